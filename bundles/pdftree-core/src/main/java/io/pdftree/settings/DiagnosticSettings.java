/*
 * Copyright (c) 2024, PdfTree Contributors
 *
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *     * Redistributions of source code must retain the above copyright
 *       notice, this list of conditions and the following disclaimer.
 *     * Redistributions in binary form must reproduce the above copyright
 *       notice, this list of conditions and the following disclaimer in the
 *       documentation and/or other materials provided with the distribution.
 *     * Neither the name of the <organization> nor the
 *       names of its contributors may be used to endorse or promote products
 *       derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
 * ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
 * WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
 * DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
 * DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
 * (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
 * LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
 * ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
 * SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.pdftree.settings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized diagnostic and debugging settings.
 * <p>
 * Diagnostic features are disabled by default and can be enabled via system properties for
 * troubleshooting a document that does not resolve the way it should.
 * <p>
 * <b>Available System Properties:</b>
 * <ul>
 *   <li>{@code pdftree.debug.tree.dump} - Dump the full tree (level order) at debug level after
 *   each analysis</li>
 * </ul>
 * <p>
 * <b>Example Usage:</b>
 * <pre>{@code
 * java -Dpdftree.debug.tree.dump=true -jar host.jar document.pdf
 * }</pre>
 */
public final class DiagnosticSettings {

  private static final Logger LOGGER = LoggerFactory.getLogger(DiagnosticSettings.class);

  /** Name of the system property enabling tree dumps. */
  public static final String TREE_DUMP_PROPERTY = "pdftree.debug.tree.dump";

  /**
   * Dump every resolved tree.
   * <p>
   * <b>Performance Impact:</b> Moderate, one log line per node.
   * <p>
   * <b>System Property:</b> {@code pdftree.debug.tree.dump}
   */
  public static final boolean TREE_DUMP = Boolean.getBoolean(TREE_DUMP_PROPERTY);

  static {
    if (TREE_DUMP) {
      LOGGER.info("PdfTree Diagnostic Settings Active:");
      LOGGER.info("  - Tree dump ENABLED ({})", TREE_DUMP_PROPERTY);
    }
  }

  /**
   * Check if tree dumps are enabled.
   *
   * @return true if every resolved tree is dumped to the log
   */
  public static boolean isTreeDumpEnabled() {
    return TREE_DUMP;
  }

  private DiagnosticSettings() {
    throw new AssertionError("Utility class - do not instantiate");
  }
}
