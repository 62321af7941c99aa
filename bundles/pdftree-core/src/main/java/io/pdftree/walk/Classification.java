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

package io.pdftree.walk;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import io.pdftree.node.RelationshipEdge;

import static java.util.Objects.requireNonNull;

/**
 * Result of classifying one reference: the edge to apply, whether the target awaits placement, and
 * whether the target should be walked.
 */
public final class Classification {

  private final RelationshipEdge edge;

  private final boolean markPending;

  private final boolean enqueue;

  private final String reason;

  Classification(final RelationshipEdge edge, final boolean markPending, final boolean enqueue,
      final String reason) {
    this.edge = requireNonNull(edge);
    this.markPending = markPending;
    this.enqueue = enqueue;
    this.reason = requireNonNull(reason);
  }

  public RelationshipEdge getEdge() {
    return edge;
  }

  /**
   * Determines if the target must be placed by the resolver after the walk.
   *
   * @return {@code true} if the target joins the pending set
   */
  public boolean isMarkPending() {
    return markPending;
  }

  public boolean isEnqueue() {
    return enqueue;
  }

  /**
   * Get a short description of the rule that decided this classification.
   *
   * @return the reason, for logs
   */
  public String getReason() {
    return reason;
  }

  @Override
  public boolean equals(final Object obj) {
    if (!(obj instanceof Classification)) {
      return false;
    }
    final Classification other = (Classification) obj;
    return edge == other.edge && markPending == other.markPending && enqueue == other.enqueue
        && reason.equals(other.reason);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(edge, markPending, enqueue, reason);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("edge", edge)
                      .add("markPending", markPending)
                      .add("enqueue", enqueue)
                      .add("reason", reason)
                      .toString();
  }
}
