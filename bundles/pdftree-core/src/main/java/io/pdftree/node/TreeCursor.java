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

import com.google.common.base.MoreObjects;
import io.pdftree.api.NodeCursor;
import io.pdftree.settings.Fixed;

import static java.util.Objects.requireNonNull;

/**
 * {@link NodeCursor} over the nodes of a {@link NodeRegistry}.
 */
public final class TreeCursor implements NodeCursor {

  private final NodeRegistry registry;

  private PdfTreeNode current;

  TreeCursor(final NodeRegistry registry) {
    this.registry = requireNonNull(registry);
    current = registry.getRoot();
  }

  @Override
  public boolean moveTo(final int key) {
    final PdfTreeNode node = registry.find(key);
    if (node == null) {
      return false;
    }
    current = node;
    return true;
  }

  @Override
  public boolean moveToDocumentRoot() {
    current = registry.getRoot();
    return true;
  }

  @Override
  public PdfTreeNode getNode() {
    return current;
  }

  @Override
  public int getNodeKey() {
    return current.getId();
  }

  @Override
  public boolean hasParent() {
    return current.getParent() != null;
  }

  @Override
  public int getParentKey() {
    final PdfTreeNode parent = current.getParent();
    return parent == null ? Fixed.NULL_NODE_KEY.getStandardProperty() : parent.getId();
  }

  @Override
  public boolean hasFirstChild() {
    return !current.getChildren().isEmpty();
  }

  @Override
  public int getFirstChildKey() {
    return hasFirstChild() ? current.getChildren().get(0).getId() : Fixed.NULL_NODE_KEY.getStandardProperty();
  }

  @Override
  public boolean hasRightSibling() {
    final PdfTreeNode parent = current.getParent();
    return parent != null && current.getChildIndex() + 1 < parent.getChildren().size();
  }

  @Override
  public int getRightSiblingKey() {
    if (!hasRightSibling()) {
      return Fixed.NULL_NODE_KEY.getStandardProperty();
    }
    return current.getParent().getChildren().get(current.getChildIndex() + 1).getId();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("node", current).toString();
  }
}
