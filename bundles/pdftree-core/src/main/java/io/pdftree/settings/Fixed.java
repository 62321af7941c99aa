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

/**
 * Fixed constants for the tree builder. These constants should never be changed.
 */
public enum Fixed {

  // --- Keys
  // -------------------------------------------------------------
  /** Null key for nodes. */
  NULL_NODE_KEY(-1),

  /** Object number given to the trailer when it does not declare a {@code /Size}. */
  TRAILER_FALLBACK_ID(10_000_000),

  // --- Streams
  // -------------------------------------------------------------
  /** Stream length recorded when a payload could not be decoded. */
  DECODE_FAILURE_LENGTH(-1);

  /**
   * Standard property.
   */
  private final int standardProperty;

  /**
   * Private constructor.
   *
   * @param property property to set
   */
  Fixed(final int property) {
    standardProperty = property;
  }

  /**
   * Getting the property.
   *
   * @return the prop
   */
  public int getStandardProperty() {
    return standardProperty;
  }
}
