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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Identifier of an indirect record: the object number plus its generation number. The object
 * number is the node key used throughout the tree, the generation counts revisions.
 */
public final class ObjectId implements Comparable<ObjectId> {

  private final int objectNumber;

  private final int generationNumber;

  /**
   * Creates a new identifier with generation number 0.
   *
   * @param objectNumber the object number (must be non-negative)
   */
  public ObjectId(final int objectNumber) {
    this(objectNumber, 0);
  }

  /**
   * Creates a new identifier.
   *
   * @param objectNumber     the object number (must be non-negative)
   * @param generationNumber the generation number (must be non-negative)
   * @throws IllegalArgumentException if one of the numbers is negative
   */
  public ObjectId(final int objectNumber, final int generationNumber) {
    checkArgument(objectNumber >= 0, "Object number must be non-negative: %s", objectNumber);
    checkArgument(generationNumber >= 0, "Generation number must be non-negative: %s", generationNumber);
    this.objectNumber = objectNumber;
    this.generationNumber = generationNumber;
  }

  public int getObjectNumber() {
    return objectNumber;
  }

  public int getGenerationNumber() {
    return generationNumber;
  }

  @Override
  public int compareTo(final ObjectId other) {
    final int byNumber = Integer.compare(objectNumber, other.objectNumber);
    return byNumber != 0 ? byNumber : Integer.compare(generationNumber, other.generationNumber);
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj instanceof ObjectId) {
      final ObjectId other = (ObjectId) obj;
      return objectNumber == other.objectNumber && generationNumber == other.generationNumber;
    }
    return false;
  }

  @Override
  public int hashCode() {
    return 31 * objectNumber + generationNumber;
  }

  /**
   * Returns the identifier in reference syntax, {@code "n g R"}.
   */
  @Override
  public String toString() {
    return objectNumber + " " + generationNumber + " R";
  }
}
