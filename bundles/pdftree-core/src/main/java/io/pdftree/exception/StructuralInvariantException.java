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

package io.pdftree.exception;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Thrown when the object graph cannot be turned into a consistent tree: a node is referenced again
 * although it neither has a parent nor is awaiting placement, a node would get a second parent, or
 * no placement heuristic could find a parent for an indeterminate node.
 *
 * <p>
 * No partial tree survives this exception. The message carries the diagnostic context (the node,
 * its referrers and their descendant counts) so that the analyst can see why the document could
 * not be resolved.
 * </p>
 */
public final class StructuralInvariantException extends PdfTreeException {

  private static final long serialVersionUID = 1L;

  /** Object number of the node the violation was detected on. */
  private final int nodeId;

  /** Diagnostic lines, for instance the referrers with their descendant counts. */
  private final ImmutableList<String> diagnostics;

  /**
   * Constructor.
   *
   * @param nodeId  object number of the offending node
   * @param message description of the violation
   */
  public StructuralInvariantException(final int nodeId, final String message) {
    this(nodeId, message, List.of());
  }

  /**
   * Constructor.
   *
   * @param nodeId      object number of the offending node
   * @param message     description of the violation
   * @param diagnostics additional context lines
   */
  public StructuralInvariantException(final int nodeId, final String message, final List<String> diagnostics) {
    super(buildMessage(message, diagnostics));
    this.nodeId = nodeId;
    this.diagnostics = ImmutableList.copyOf(diagnostics);
  }

  private static String buildMessage(final String message, final List<String> diagnostics) {
    if (diagnostics.isEmpty()) {
      return message;
    }
    return message + System.lineSeparator() + "  " + String.join(System.lineSeparator() + "  ", diagnostics);
  }

  /**
   * Get the object number of the offending node.
   *
   * @return the node id
   */
  public int getNodeId() {
    return nodeId;
  }

  /**
   * Get the diagnostic context lines.
   *
   * @return diagnostics, never {@code null}
   */
  public List<String> getDiagnostics() {
    return diagnostics;
  }
}
