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

import io.pdftree.exception.PdfTreeException;
import io.pdftree.exception.RecordDecodeException;
import io.pdftree.node.NodeRegistry;
import io.pdftree.node.PdfTreeNode;
import io.pdftree.record.ObjectId;
import io.pdftree.record.PdfNames;
import io.pdftree.report.FindingKind;
import io.pdftree.settings.AnalysisConfiguration;
import io.pdftree.utils.LogWrapper;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.OptionalInt;

import static java.util.Objects.requireNonNull;

/**
 * Walks every record reachable from the trailer in FIFO order, building nodes on first discovery
 * and applying the {@link ReferenceClassifier}'s decision for every reference.
 */
public final class GraphWalker {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGGER = new LogWrapper(LoggerFactory.getLogger(GraphWalker.class));

  private final WalkState state;

  private final ReferenceClassifier classifier;

  /**
   * Constructor.
   *
   * @param state the analysis state to populate
   */
  public GraphWalker(final WalkState state) {
    this.state = requireNonNull(state);
    this.classifier = new ReferenceClassifier(state);
  }

  /**
   * Walk the document.
   *
   * @return the root node
   * @throws PdfTreeException if the walk exceeds the configured record bound, or a
   *         {@link io.pdftree.exception.StructuralInvariantException} if the graph violates the tree
   *         invariants
   */
  public PdfTreeNode walk() throws PdfTreeException {
    final AnalysisConfiguration config = state.getConfig();
    final NodeRegistry registry = state.getRegistry();

    // The trailer has no id of its own, it is given the declared size.
    final OptionalInt declaredSize = state.getDeclaredSize();
    final int rootId;
    if (declaredSize.isPresent()) {
      rootId = declaredSize.getAsInt();
      if (rootId > config.getNodeCountWarnThreshold()) {
        LOGGER.warn("This document has {} nodes; could take a while to parse...", rootId);
      }
    } else {
      LOGGER.warn("Could not determine number of nodes in this document! {} is {}", PdfNames.SIZE,
          state.getSource().getTrailer().get(PdfNames.SIZE));
      rootId = config.getTrailerFallbackId();
    }

    final PdfTreeNode root = registry.registerTrailer(trailerId(rootId));
    final Deque<PdfTreeNode> worklist = new ArrayDeque<>();
    final IntSet enqueued = new IntOpenHashSet();
    worklist.add(root);
    enqueued.add(root.getId());

    int visited = 0;
    while (!worklist.isEmpty()) {
      final PdfTreeNode node = worklist.poll();
      if (++visited > config.getMaxRecordsVisited()) {
        throw new PdfTreeException("Walk aborted after visiting %d records", config.getMaxRecordsVisited());
      }
      LOGGER.info("Walking {}", node);

      for (final DiscoveredReference reference : ReferenceCollector.collect(node)) {
        final PdfTreeNode target = walkReference(reference);
        if (target != null && enqueued.add(target.getId())) {
          worklist.add(target);
        }
      }
      node.markAllReferencesProcessed();
    }

    LOGGER.info("Walk visited {} records, {} awaiting placement", visited, state.getPendingIds().size());
    return root;
  }

  /**
   * The trailer is keyed by the declared size, which an understated {@code /Size} hands to a real
   * record. Such ids are skipped until one is found that no record decodes at.
   */
  private int trailerId(final int candidate) throws PdfTreeException {
    final int fallbackId = state.getConfig().getTrailerFallbackId();
    int id = candidate;
    while (recordExists(id)) {
      if (id == Integer.MAX_VALUE) {
        throw new PdfTreeException("No free id left for the trailer");
      }
      final int next = id < fallbackId ? fallbackId : id + 1;
      LOGGER.warn("Record {} exists although {} is {}; the trailer gets id {}", id, PdfNames.SIZE, candidate,
          next);
      id = next;
    }
    return id;
  }

  private boolean recordExists(final int id) {
    try {
      state.getSource().getRecord(new ObjectId(id));
      return true;
    } catch (final RecordDecodeException e) {
      LOGGER.debug("No record {} to collide with the trailer: {}", id, e.getMessage());
      return false;
    }
  }

  /**
   * Classify one reference and apply the result.
   *
   * @return the target if it should be walked, {@code null} otherwise
   */
  private PdfTreeNode walkReference(final DiscoveredReference reference) throws PdfTreeException {
    LOGGER.debug("Assessing relationship {}...", reference);
    final NodeRegistry registry = state.getRegistry();
    if (reference.getTargetId() == registry.getRoot().getId()) {
      // Only undecodable records can still carry the trailer's id.
      LOGGER.warn("{} points at the id the trailer was given", reference);
      state.getFindings().add(FindingKind.EVIDENCE_WARNING, reference.getTargetId(),
          "Record %d shares its id with the trailer and cannot be placed", reference.getTargetId());
      return null;
    }
    final boolean alreadyVisited = registry.contains(reference.getTargetId());
    final PdfTreeNode target = registry.buildOrFind(reference.getTarget(), reference.getAddress());
    state.updateMaxGeneration(reference.getTarget().getGenerationNumber());

    final Classification classification = classifier.classify(reference, target, alreadyVisited);
    final PdfTreeNode source = reference.getSource();
    switch (classification.getEdge()) {
      case PARENT:
        source.setParent(target);
        break;
      case CHILD:
        source.addChild(target);
        if (state.getPendingIds().remove(target.getId())) {
          LOGGER.info("  Found {} => {} was marked indeterminate but now placed", reference, target);
        }
        break;
      case NON_TREE:
      case INDETERMINATE:
        target.addNonTreeRelationship(reference.toNonTreeRelationship());
        break;
      case NONE:
      default:
        break;
    }
    if (classification.isMarkPending() && state.getPendingIds().add(target.getId())) {
      LOGGER.info("  {} awaits placement ({})", target, classification.getReason());
    }
    return classification.isEnqueue() ? target : null;
  }
}
