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

package io.pdftree.resolve;

/**
 * Heuristics that place a node whose parent could not be decided during the walk, in the order
 * they are tried.
 */
public enum PlacementRule {
  /** A referrer is an ancestor of every other referrer. */
  COMMON_ANCESTOR,

  /** Exactly one referrer survives a structural filter. */
  SINGLE_CANDIDATE,

  /**
   * A {@code /Resources} container goes under the dominating referrer among those reaching it via
   * {@code /Resources}.
   */
  RESOURCES_CONTAINER,

  /** A record referred to only by {@code /Page} and {@code /Pages} records goes under a {@code /Pages}. */
  PAGES_ESCAPE_HATCH,

  /** Most descendants, backed by referrers that look alike or by a color space. */
  JUSTIFIED_MOST_DESCENDANTS,

  /** Most descendants without further evidence. */
  WEAK_MOST_DESCENDANTS;

  /**
   * Determines if a placement by this rule rests on weak evidence and is reported.
   *
   * @return {@code true} if the placement produces an evidence warning
   */
  public boolean isWeakEvidence() {
    return this == PAGES_ESCAPE_HATCH || this == WEAK_MOST_DESCENDANTS;
  }
}
