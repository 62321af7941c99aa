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

package io.pdftree.walk;

import com.google.common.base.MoreObjects;
import io.pdftree.node.NodeRegistry;
import io.pdftree.node.PdfTreeNode;
import io.pdftree.record.RecordSource;
import io.pdftree.report.Findings;
import io.pdftree.settings.AnalysisConfiguration;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

import java.util.OptionalInt;

import static java.util.Objects.requireNonNull;

/**
 * Mutable state of one analysis run, shared by the walker, the resolver, the recovery pass and the
 * verifier. Never accessed concurrently.
 */
public final class WalkState {

  private final RecordSource source;

  private final AnalysisConfiguration config;

  private final Findings findings;

  private final NodeRegistry registry;

  /** Ids awaiting placement, sorted so that resolution order is deterministic. */
  private final IntSortedSet pendingIds = new IntRBTreeSet();

  private int maxGeneration;

  /**
   * Constructor.
   *
   * @param source   the record source
   * @param config   the configuration
   * @param findings the findings collector
   */
  public WalkState(final RecordSource source, final AnalysisConfiguration config, final Findings findings) {
    this.source = requireNonNull(source);
    this.config = requireNonNull(config);
    this.findings = requireNonNull(findings);
    this.registry = new NodeRegistry(source, findings);
  }

  public RecordSource getSource() {
    return source;
  }

  public AnalysisConfiguration getConfig() {
    return config;
  }

  public Findings getFindings() {
    return findings;
  }

  public NodeRegistry getRegistry() {
    return registry;
  }

  public PdfTreeNode getRoot() {
    return registry.getRoot();
  }

  /**
   * Get the declared record count.
   *
   * @return the trailer's {@code /Size}, if any
   */
  public OptionalInt getDeclaredSize() {
    return source.getDeclaredSize();
  }

  /**
   * Get the ids awaiting placement.
   *
   * @return the live, sorted set
   */
  public IntSortedSet getPendingIds() {
    return pendingIds;
  }

  public boolean isPending(final int id) {
    return pendingIds.contains(id);
  }

  /**
   * Get the highest generation of the document, either declared by the source or seen in a
   * reference during the walk.
   *
   * @return the generation, {@code 0} without revisions
   */
  public int getMaxGeneration() {
    return Math.max(maxGeneration, source.getMaxGeneration());
  }

  void updateMaxGeneration(final int generation) {
    maxGeneration = Math.max(maxGeneration, generation);
  }

  /**
   * Determines if a node is connected to the root.
   *
   * @param node the node
   * @return {@code true} if the node is reachable from the root through children
   */
  public boolean isInTree(final PdfTreeNode node) {
    return registry.isInTree(node);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("nodes", registry.size())
                      .add("pending", pendingIds.size())
                      .add("maxGeneration", getMaxGeneration())
                      .toString();
  }
}
