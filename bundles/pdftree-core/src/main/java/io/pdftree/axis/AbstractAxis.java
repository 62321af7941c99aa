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

import com.google.common.base.MoreObjects;
import io.pdftree.api.Axis;
import io.pdftree.api.NodeCursor;
import io.pdftree.settings.Fixed;
import it.unimi.dsi.fastutil.ints.IntIterator;
import org.checkerframework.checker.index.qual.NonNegative;

import java.util.NoSuchElementException;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * <p>
 * Base of all axes over the resolved tree. Iterates object numbers as a fastutil
 * {@link IntIterator} and keeps the cursor on the node returned last.
 * </p>
 * <p>
 * Subclasses implement {@code nextKey()} and return {@code done()} once they run out of nodes.
 * </p>
 */
public abstract class AbstractAxis implements Axis {

  /** Cursor exclusive to this axis while it iterates. */
  protected final NodeCursor nodeCursor;

  /** Key of next node. */
  private int nextNodeKey;

  /** Key of node where axis started. */
  private int startNodeKey;

  /** Include self? */
  private final IncludeSelf includeSelf;

  /** Current state. */
  private State state = State.NOT_READY;

  /** State of the iterator. */
  private enum State {
    /** The next key is computed but not yet returned. */
    READY,

    /** The next key still has to be computed. */
    NOT_READY,

    /** No keys left. */
    DONE,

    /** {@code nextKey()} threw. */
    FAILED,
  }

  /**
   * Bind axis step to a cursor.
   *
   * @param nodeCursor node cursor
   * @throws NullPointerException if {@code nodeCursor} is {@code null}
   */
  protected AbstractAxis(final NodeCursor nodeCursor) {
    this(nodeCursor, IncludeSelf.NO);
  }

  /**
   * Bind axis step to a cursor.
   *
   * @param nodeCursor  node cursor
   * @param includeSelf determines if self is included
   * @throws NullPointerException if {@code nodeCursor} or {@code includeSelf} is {@code null}
   */
  protected AbstractAxis(final NodeCursor nodeCursor, final IncludeSelf includeSelf) {
    this.nodeCursor = requireNonNull(nodeCursor);
    this.includeSelf = requireNonNull(includeSelf);
    reset(nodeCursor.getNodeKey());
  }

  @Override
  public final IntIterator iterator() {
    return this;
  }

  /**
   * Marks the end of the traversal.
   *
   * @return {@link Fixed#NULL_NODE_KEY}
   */
  protected int done() {
    return Fixed.NULL_NODE_KEY.getStandardProperty();
  }

  /**
   * {@inheritDoc}
   *
   * <p>
   * During the last call to {@code hasNext()}, that is {@code hasNext()} returns false, the cursor
   * is reset to the start key.
   * </p>
   *
   * <p>
   * <strong>Implementors must implement {@code nextKey()} instead which is a template method called
   * from this {@code hasNext()} method.</strong>
   * </p>
   */
  @Override
  public final boolean hasNext() {
    checkState(state != State.FAILED);
    switch (state) {
      case DONE:
        return false;
      case READY:
        return true;
      case FAILED:
      case NOT_READY:
      default:
    }

    resetToLastKey();

    final boolean hasNext = tryToComputeNext();
    if (hasNext) {
      return true;
    } else {
      resetToStartKey();
      return false;
    }
  }

  private boolean tryToComputeNext() {
    state = State.FAILED;
    nextNodeKey = nextKey();
    if (nextNodeKey == Fixed.NULL_NODE_KEY.getStandardProperty()) {
      state = State.DONE;
      return false;
    }
    state = State.READY;
    return true;
  }

  /**
   * Returns the next node key. <strong>Note:</strong> the implementation must either call
   * {@link #done()} when there are no elements left in the iteration or return
   * {@code Fixed.NULL_NODE_KEY.getStandardProperty()}.
   *
   * <p>
   * The cursor points to the node returned last (or the start node) when this method is invoked.
   * Implementations may move the cursor. Once the implementation signals that it is done or throws
   * an exception, {@code nextKey()} is never called again.
   * </p>
   *
   * @return the next node key
   */
  protected abstract int nextKey();

  @Override
  public final int nextInt() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    state = State.NOT_READY;

    if (!nodeCursor.moveTo(nextNodeKey)) {
      throw new IllegalStateException("Failed to move to nodeKey: " + nextNodeKey);
    }
    return nextNodeKey;
  }

  /**
   * Remove is not supported.
   */
  @Override
  public final void remove() {
    throw new UnsupportedOperationException();
  }

  @Override
  public void reset(@NonNegative final int nodeKey) {
    startNodeKey = nodeKey;
    nextNodeKey = nodeKey;
    state = State.NOT_READY;
  }

  @Override
  public NodeCursor getCursor() {
    return nodeCursor;
  }

  private void resetToStartKey() {
    nodeCursor.moveTo(startNodeKey);
  }

  /**
   * Move the cursor back onto the node computed last, callers may have moved it in between.
   *
   * @return the key computed last
   */
  protected final int resetToLastKey() {
    if (nodeCursor.getNodeKey() != nextNodeKey) {
      nodeCursor.moveTo(nextNodeKey);
    }
    return nextNodeKey;
  }

  @Override
  public final int peek() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    return nextNodeKey;
  }

  @Override
  public final int getStartKey() {
    return startNodeKey;
  }

  @Override
  public final IncludeSelf includeSelf() {
    return includeSelf;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("cursor", nodeCursor).add("startKey", startNodeKey).toString();
  }
}
