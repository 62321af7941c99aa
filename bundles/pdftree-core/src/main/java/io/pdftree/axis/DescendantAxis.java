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
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * <p>
 * Iterate over all descendants starting at a given node (in preorder). Self might or might not be
 * included.
 * </p>
 */
public final class DescendantAxis extends AbstractAxis {

  /** Stack for remembering the next node keys in preorder. */
  private IntArrayList keyStack;

  /** Determines if it's the first call to hasNext(). */
  private boolean first;

  /**
   * Constructor initializing internal state.
   *
   * @param cursor cursor to iterate with
   */
  public DescendantAxis(final NodeCursor cursor) {
    super(cursor);
  }

  /**
   * Constructor initializing internal state.
   *
   * @param cursor      cursor to iterate with
   * @param includeSelf determines if current node is included or not
   */
  public DescendantAxis(final NodeCursor cursor, final IncludeSelf includeSelf) {
    super(cursor, includeSelf);
  }

  @Override
  public void reset(final int nodeKey) {
    super.reset(nodeKey);
    first = true;
    keyStack = new IntArrayList();
  }

  @Override
  protected int nextKey() {
    final NodeCursor cursor = getCursor();

    if (first) {
      first = false;
      if (includeSelf() == IncludeSelf.YES) {
        return cursor.getNodeKey();
      }
    }

    pushChildren(cursor);

    if (keyStack.isEmpty()) {
      return done();
    }
    return keyStack.popInt();
  }

  /**
   * Push the children of the current node so that the first child is popped first.
   */
  private void pushChildren(final NodeCursor cursor) {
    if (!cursor.hasFirstChild()) {
      return;
    }
    final int parentKey = cursor.getNodeKey();
    final IntArrayList children = new IntArrayList();
    cursor.moveTo(cursor.getFirstChildKey());
    children.add(cursor.getNodeKey());
    while (cursor.hasRightSibling()) {
      cursor.moveTo(cursor.getRightSiblingKey());
      children.add(cursor.getNodeKey());
    }
    for (int i = children.size() - 1; i >= 0; i--) {
      keyStack.push(children.getInt(i));
    }
    cursor.moveTo(parentKey);
  }
}
