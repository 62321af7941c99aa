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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Multimaps;
import io.pdftree.axis.LevelOrderAxis;
import io.pdftree.node.NodeRegistry;
import io.pdftree.node.PdfTreeNode;
import io.pdftree.node.TreeCursor;
import io.pdftree.report.Finding;
import io.pdftree.settings.AnalysisConfiguration;
import io.pdftree.summary.TreeSummary;
import io.pdftree.symlink.SymlinkEdge;
import io.pdftree.verify.VerificationResult;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static java.util.Objects.requireNonNull;

/**
 * The result of an analysis: a rooted tree over the document's records plus the symlinks that
 * did not fit the tree.
 */
public final class PdfTree {

  private final NodeRegistry registry;

  private final List<SymlinkEdge> symlinks;

  private final ImmutableListMultimap<Integer, SymlinkEdge> symlinksBySource;

  private final List<Finding> findings;

  private final VerificationResult verification;

  private final AnalysisConfiguration config;

  private final int maxGeneration;

  private TreeSummary summary;

  PdfTree(final NodeRegistry registry, final List<SymlinkEdge> symlinks, final List<Finding> findings,
      final VerificationResult verification, final AnalysisConfiguration config, final int maxGeneration) {
    this.registry = requireNonNull(registry);
    this.symlinks = ImmutableList.copyOf(symlinks);
    this.symlinksBySource = Multimaps.index(this.symlinks, SymlinkEdge::getFromId);
    this.findings = ImmutableList.copyOf(findings);
    this.verification = requireNonNull(verification);
    this.config = requireNonNull(config);
    this.maxGeneration = maxGeneration;
  }

  /**
   * Get the root, the node built from the trailer.
   *
   * @return the root
   */
  public PdfTreeNode getRoot() {
    return registry.getRoot();
  }

  /**
   * Find a node in the tree.
   *
   * @param id object number
   * @return the node or {@code null} if no record with this id is in the tree
   */
  public @Nullable PdfTreeNode findNode(final int id) {
    final PdfTreeNode node = registry.find(id);
    return node != null && registry.isInTree(node) ? node : null;
  }

  /**
   * Iterate over the tree in level order, starting at the root.
   *
   * @return a fresh iterable on every call
   */
  public Iterable<PdfTreeNode> levelOrder() {
    return () -> new Iterator<>() {
      private final TreeCursor cursor = registry.newCursor();

      private final LevelOrderAxis axis = LevelOrderAxis.newBuilder(cursor).includeSelf().build();

      @Override
      public boolean hasNext() {
        return axis.hasNext();
      }

      @Override
      public PdfTreeNode next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        axis.nextInt();
        return cursor.getNode();
      }
    };
  }

  /**
   * Get a cursor positioned on the root.
   *
   * @return a new cursor
   */
  public NodeCursor newCursor() {
    return registry.newCursor();
  }

  public List<SymlinkEdge> getSymlinks() {
    return symlinks;
  }

  /**
   * Get the symlinks leaving a node.
   *
   * @param node the source node
   * @return the edges, possibly empty
   */
  public List<SymlinkEdge> getSymlinksFrom(final PdfTreeNode node) {
    return symlinksBySource.get(node.getId());
  }

  public List<Finding> getFindings() {
    return findings;
  }

  public VerificationResult getVerification() {
    return verification;
  }

  /**
   * Get the frequency summary, computed on first use.
   *
   * @return the summary
   */
  public TreeSummary getSummary() {
    if (summary == null) {
      summary = TreeSummary.of(levelOrder(), symlinks);
    }
    return summary;
  }

  /**
   * Get the nodes that carry a stream.
   *
   * @return the nodes sorted by id
   */
  public List<PdfTreeNode> streamNodes() {
    final ImmutableList.Builder<PdfTreeNode> nodes = ImmutableList.builder();
    for (final PdfTreeNode node : levelOrder()) {
      if (node.containsStream()) {
        nodes.add(node);
      }
    }
    return ImmutableList.sortedCopyOf(Comparator.comparingInt(PdfTreeNode::getId), nodes.build());
  }

  /**
   * Get the highest generation number seen. Revisions are not analyzed.
   *
   * @return the generation
   */
  public int getMaxGeneration() {
    return maxGeneration;
  }

  public AnalysisConfiguration getConfiguration() {
    return config;
  }

  /**
   * Get a node's address from the root, truncated to the configured length.
   *
   * @param node a node in this tree
   * @return the address
   */
  public String getTreeAddress(final PdfTreeNode node) {
    return node.getTreeAddress(config.getMaxAddressLength());
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("root", getRoot())
                      .add("nodes", registry.size())
                      .add("symlinks", symlinks.size())
                      .add("findings", findings.size())
                      .toString();
  }
}
