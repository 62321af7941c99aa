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

package io.pdftree.symlink;

import com.google.common.collect.ImmutableList;
import io.pdftree.axis.LevelOrderAxis;
import io.pdftree.node.NodeRegistry;
import io.pdftree.node.NonTreeRelationship;
import io.pdftree.node.PdfTreeNode;
import io.pdftree.node.TreeCursor;
import io.pdftree.utils.LogWrapper;
import org.slf4j.LoggerFactory;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Turns the non-tree relationships that survived resolution into {@link SymlinkEdge}s. A
 * relationship whose source became the node's parent or child is redundant and is dropped.
 */
public final class SymlinkMaterializer {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGGER = new LogWrapper(LoggerFactory.getLogger(SymlinkMaterializer.class));

  private final NodeRegistry registry;

  /**
   * Constructor.
   *
   * @param registry the registry holding the resolved tree
   */
  public SymlinkMaterializer(final NodeRegistry registry) {
    this.registry = requireNonNull(registry);
  }

  /**
   * Materialize the edges of all nodes in the tree.
   *
   * @return the edges, grouped by target in level order
   */
  public List<SymlinkEdge> materialize() {
    final ImmutableList.Builder<SymlinkEdge> edges = ImmutableList.builder();
    final TreeCursor cursor = registry.newCursor();
    final LevelOrderAxis axis = LevelOrderAxis.newBuilder(cursor).includeSelf().build();
    while (axis.hasNext()) {
      axis.nextInt();
      edges.addAll(materialize(cursor.getNode()));
    }
    return edges.build();
  }

  private List<SymlinkEdge> materialize(final PdfTreeNode node) {
    final List<NonTreeRelationship> relationships = node.getNonTreeRelationships();
    if (relationships.isEmpty()) {
      return List.of();
    }
    LOGGER.info("Symlinking {}'s {} other relationships...", node, relationships.size());

    final ImmutableList.Builder<SymlinkEdge> edges = ImmutableList.builder();
    for (final NonTreeRelationship relationship : relationships) {
      final PdfTreeNode source = registry.find(relationship.getSourceId());
      if (source == null || source == node.getParent() || source.getParent() == node) {
        LOGGER.warn("  {} is still 'non-tree' but is a parent or child of {}", relationship, node);
        node.discardNonTreeRelationship(relationship);
      } else {
        LOGGER.debug("   SymLinking {} to {}", relationship, node);
        edges.add(new SymlinkEdge(relationship.getSourceId(), node.getId(), relationship.getAddress(),
            relationship.getReferenceKey()));
      }
    }
    return edges.build();
  }
}
