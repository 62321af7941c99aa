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

package io.pdftree.record;

import static java.util.Objects.requireNonNull;

/**
 * A field value that points at another record instead of embedding it.
 */
public final class ObjectReference {

  private final ObjectId target;

  /**
   * Constructor.
   *
   * @param target identifier of the referenced record
   */
  public ObjectReference(final ObjectId target) {
    this.target = requireNonNull(target);
  }

  /**
   * Convenience factory for a reference to generation 0.
   *
   * @param objectNumber the referenced object number
   * @return the reference
   */
  public static ObjectReference to(final int objectNumber) {
    return new ObjectReference(new ObjectId(objectNumber));
  }

  public ObjectId getTarget() {
    return target;
  }

  public int getObjectNumber() {
    return target.getObjectNumber();
  }

  public int getGenerationNumber() {
    return target.getGenerationNumber();
  }

  @Override
  public boolean equals(final Object obj) {
    return obj instanceof ObjectReference && target.equals(((ObjectReference) obj).target);
  }

  @Override
  public int hashCode() {
    return target.hashCode();
  }

  @Override
  public String toString() {
    return target.toString();
  }
}
