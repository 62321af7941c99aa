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
import io.pdftree.node.NonTreeRelationship;
import io.pdftree.node.PdfTreeNode;
import io.pdftree.record.ObjectReference;

import static java.util.Objects.requireNonNull;

/**
 * One reference found in a node's record, with the top level key it hangs off and its full
 * address, e.g. key {@code /Resources} and address {@code /Resources[/Font][/F1]}.
 */
public final class DiscoveredReference {

  private final PdfTreeNode source;

  private final String referenceKey;

  private final String address;

  private final ObjectReference target;

  /**
   * Constructor.
   *
   * @param source       the node whose record holds the reference
   * @param referenceKey the top level key
   * @param address      the full address
   * @param target       the reference
   */
  public DiscoveredReference(final PdfTreeNode source, final String referenceKey, final String address,
      final ObjectReference target) {
    this.source = requireNonNull(source);
    this.referenceKey = requireNonNull(referenceKey);
    this.address = requireNonNull(address);
    this.target = requireNonNull(target);
  }

  public PdfTreeNode getSource() {
    return source;
  }

  public String getReferenceKey() {
    return referenceKey;
  }

  public String getAddress() {
    return address;
  }

  public ObjectReference getTarget() {
    return target;
  }

  public int getTargetId() {
    return target.getObjectNumber();
  }

  /**
   * Express this reference as a weak edge on its target.
   *
   * @return the relationship
   */
  public NonTreeRelationship toNonTreeRelationship() {
    return new NonTreeRelationship(source.getId(), referenceKey, address, getTargetId());
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("source", source)
                      .add("referenceKey", referenceKey)
                      .add("address", address)
                      .add("target", target)
                      .toString();
  }
}
