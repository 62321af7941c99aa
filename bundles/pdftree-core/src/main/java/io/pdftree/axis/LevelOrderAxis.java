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

package io.pdftree.axis;

import io.pdftree.api.NodeCursor;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import org.checkerframework.checker.index.qual.NonNegative;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Iterates over a subtree in level order / in a breadth first traversal. Siblings are returned in
 * insertion order.
 */
public final class LevelOrderAxis extends AbstractAxis {

  /** Keys still to return, in level order. */
  private IntArrayFIFOQueue pendingKeys;

  /** Level of each pending key, relative to the start node. */
  private IntArrayFIFOQueue pendingLevels;

  /** Determines if {@code hasNext()} is called for the first time. */
  private boolean isFirst;

  /** Filter by level. */
  private final int filterLevel;

  /** Level of the node returned last. */
  private int level;

  /**
   * Get a new builder instance.
   *
   * @param cursor the {@link NodeCursor} to iterate with
   * @return {@link Builder} instance
   */
  public static Builder newBuilder(final NodeCursor cursor) {
    return new Builder(cursor);
  }

  /** Builder. */
  public static final class Builder {

    /** Filter by level. */
    private int filterLevel = Integer.MAX_VALUE;

    /** Cursor to iterate with. */
    private final NodeCursor cursor;

    /** Determines if current start node to traversal should be included or not. */
    private IncludeSelf includeSelf = IncludeSelf.NO;

    /**
     * Constructor.
     *
     * @param cursor cursor to iterate with
     */
    public Builder(final NodeCursor cursor) {
      this.cursor = checkNotNull(cursor);
    }

    /**
     * Determines that the current node should also be considered.
     *
     * @return this builder instance
     */
    public Builder includeSelf() {
      includeSelf = IncludeSelf.YES;
      return this;
    }

    /**
     * Determines the maximum level to filter. The children of the start node are on level 1.
     *
     * @param filterLevel maximum level to filter nodes
     * @return this builder instance
     */
    public Builder filterLevel(final @NonNegative int filterLevel) {
      checkArgument(filterLevel >= 0, "filterLevel must be >= 0!");
      this.filterLevel = filterLevel;
      return this;
    }

    /**
     * Build a new instance.
     *
     * @return new instance
     */
    public LevelOrderAxis build() {
      return new LevelOrderAxis(this);
    }
  }

  private LevelOrderAxis(final Builder builder) {
    super(builder.cursor, builder.includeSelf);
    filterLevel = builder.filterLevel;
  }

  @Override
  public void reset(final int nodeKey) {
    super.reset(nodeKey);
    isFirst = true;
    level = 0;
    pendingKeys = new IntArrayFIFOQueue();
    pendingLevels = new IntArrayFIFOQueue();
  }

  @Override
  protected int nextKey() {
    final NodeCursor cursor = getCursor();

    if (isFirst) {
      isFirst = false;
      if (includeSelf() == IncludeSelf.YES) {
        pendingKeys.enqueue(cursor.getNodeKey());
        pendingLevels.enqueue(0);
      } else {
        enqueueChildren(cursor, 1);
      }
    }

    if (pendingKeys.isEmpty()) {
      return done();
    }

    final int key = pendingKeys.dequeueInt();
    level = pendingLevels.dequeueInt();

    // End traversal if level is reached.
    if (level > filterLevel) {
      return done();
    }

    cursor.moveTo(key);
    enqueueChildren(cursor, level + 1);
    return key;
  }

  private void enqueueChildren(final NodeCursor cursor, final int childLevel) {
    if (!cursor.hasFirstChild()) {
      return;
    }
    final int parentKey = cursor.getNodeKey();
    cursor.moveTo(cursor.getFirstChildKey());
    pendingKeys.enqueue(cursor.getNodeKey());
    pendingLevels.enqueue(childLevel);
    while (cursor.hasRightSibling()) {
      cursor.moveTo(cursor.getRightSiblingKey());
      pendingKeys.enqueue(cursor.getNodeKey());
      pendingLevels.enqueue(childLevel);
    }
    cursor.moveTo(parentKey);
  }

  /**
   * Get the level of the node returned last, relative to the start node.
   *
   * @return the current level
   */
  public int getCurrentLevel() {
    return level;
  }
}
