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

package io.pdftree.report;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the findings of one analysis in the order they are raised.
 */
public final class Findings {

  private final List<Finding> findings = new ArrayList<>();

  /**
   * Record a finding. A finding equal to an already recorded one is ignored.
   *
   * @param kind    kind of the finding
   * @param nodeId  object number of the affected record
   * @param message format string, see {@link String#format(String, Object...)}
   * @param args    format arguments
   */
  public void add(final FindingKind kind, final int nodeId, final String message, final Object... args) {
    final Finding finding = new Finding(kind, nodeId, args.length == 0 ? message : String.format(message, args));
    if (!findings.contains(finding)) {
      findings.add(finding);
    }
  }

  /**
   * Get the findings recorded so far.
   *
   * @return an immutable snapshot
   */
  public List<Finding> snapshot() {
    return ImmutableList.copyOf(findings);
  }

  /**
   * Get the findings of one kind.
   *
   * @param kind the kind
   * @return an immutable snapshot
   */
  public List<Finding> ofKind(final FindingKind kind) {
    return findings.stream().filter(finding -> finding.getKind() == kind).collect(ImmutableList.toImmutableList());
  }
}
