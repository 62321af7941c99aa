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

package io.pdftree.node;

import com.google.common.base.Objects;

import static java.util.Objects.requireNonNull;

/**
 * A reference from one record to another that does not confer ownership. It is stored on the
 * referenced node and carries the referring record by id only.
 */
public final class NonTreeRelationship {

  private final int sourceId;

  private final String referenceKey;

  private final String address;

  private final int targetId;

  /**
   * Constructor.
   *
   * @param sourceId     object number of the referring record
   * @param referenceKey top level key of the reference in the referring record
   * @param address      full address of the reference in the referring record
   * @param targetId     object number of the referenced record
   */
  public NonTreeRelationship(final int sourceId, final String referenceKey, final String address,
      final int targetId) {
    this.sourceId = sourceId;
    this.referenceKey = requireNonNull(referenceKey);
    this.address = requireNonNull(address);
    this.targetId = targetId;
  }

  public int getSourceId() {
    return sourceId;
  }

  public String getReferenceKey() {
    return referenceKey;
  }

  public String getAddress() {
    return address;
  }

  public int getTargetId() {
    return targetId;
  }

  @Override
  public boolean equals(final Object obj) {
    if (!(obj instanceof NonTreeRelationship)) {
      return false;
    }
    final NonTreeRelationship other = (NonTreeRelationship) obj;
    return sourceId == other.sourceId && targetId == other.targetId && referenceKey.equals(other.referenceKey)
        && address.equals(other.address);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(sourceId, referenceKey, address, targetId);
  }

  @Override
  public String toString() {
    return "Relationship of " + sourceId + " to " + targetId + " (ref_key=" + referenceKey + ", address='" + address
        + "')";
  }
}
