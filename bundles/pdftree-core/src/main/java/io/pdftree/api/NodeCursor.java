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

package io.pdftree.api;

import io.pdftree.node.PdfTreeNode;

/**
 * Cursor interface which supports moving through the resolved tree. Node keys are object
 * numbers.
 */
public interface NodeCursor {

  /**
   * Move cursor to a node by its key.
   *
   * @param key key of node to select
   * @return {@code true} if the node exists, {@code false} otherwise (the cursor stays put)
   */
  boolean moveTo(int key);

  /**
   * Move cursor to the root of the tree.
   *
   * @return {@code true} if the move succeeded
   */
  boolean moveToDocumentRoot();

  /**
   * Get the node the cursor points to.
   *
   * @return the current node
   */
  PdfTreeNode getNode();

  /**
   * Get the key of the current node.
   *
   * @return the object number of the current node
   */
  int getNodeKey();

  boolean hasParent();

  int getParentKey();

  boolean hasFirstChild();

  int getFirstChildKey();

  boolean hasRightSibling();

  int getRightSiblingKey();
}
