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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import static java.util.Objects.requireNonNull;

/**
 * A non-fatal finding attached to a record.
 */
public final class Finding {

  private final FindingKind kind;

  private final int nodeId;

  private final String message;

  /**
   * Constructor.
   *
   * @param kind    kind of the finding
   * @param nodeId  object number of the affected record
   * @param message human readable description
   */
  public Finding(final FindingKind kind, final int nodeId, final String message) {
    this.kind = requireNonNull(kind);
    this.nodeId = nodeId;
    this.message = requireNonNull(message);
  }

  public FindingKind getKind() {
    return kind;
  }

  public int getNodeId() {
    return nodeId;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public boolean equals(final Object obj) {
    if (!(obj instanceof Finding)) {
      return false;
    }
    final Finding other = (Finding) obj;
    return kind == other.kind && nodeId == other.nodeId && message.equals(other.message);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(kind, nodeId, message);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("kind", kind).add("nodeId", nodeId).add("message", message).toString();
  }
}
