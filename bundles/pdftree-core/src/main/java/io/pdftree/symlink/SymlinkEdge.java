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

package io.pdftree.symlink;

import com.google.common.base.Objects;

import static java.util.Objects.requireNonNull;

/**
 * A visible, non-owning edge from a referring node to a node that lives elsewhere in the tree.
 */
public final class SymlinkEdge {

  private final int fromId;

  private final int toId;

  private final String label;

  private final String referenceKey;

  /**
   * Constructor.
   *
   * @param fromId       object number of the referring node
   * @param toId         object number of the referenced node
   * @param label        the address of the reference in the referring record
   * @param referenceKey the top level key of the reference
   */
  public SymlinkEdge(final int fromId, final int toId, final String label, final String referenceKey) {
    this.fromId = fromId;
    this.toId = toId;
    this.label = requireNonNull(label);
    this.referenceKey = requireNonNull(referenceKey);
  }

  public int getFromId() {
    return fromId;
  }

  public int getToId() {
    return toId;
  }

  public String getLabel() {
    return label;
  }

  public String getReferenceKey() {
    return referenceKey;
  }

  @Override
  public boolean equals(final Object obj) {
    if (!(obj instanceof SymlinkEdge)) {
      return false;
    }
    final SymlinkEdge other = (SymlinkEdge) obj;
    return fromId == other.fromId && toId == other.toId && label.equals(other.label)
        && referenceKey.equals(other.referenceKey);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(fromId, toId, label, referenceKey);
  }

  @Override
  public String toString() {
    return fromId + " --" + label + "--> " + toId;
  }
}
