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

import io.pdftree.exception.PdfTreeException;
import io.pdftree.exception.RecordDecodeException;
import io.pdftree.exception.StructuralInvariantException;
import io.pdftree.node.NodeRegistry;
import io.pdftree.node.PdfTreeNode;
import io.pdftree.record.ObjectId;
import io.pdftree.record.ObjectReference;
import io.pdftree.record.PdfNames;
import io.pdftree.record.PdfRecord;
import io.pdftree.utils.LogWrapper;
import io.pdftree.walk.WalkState;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import static java.util.Objects.requireNonNull;

/**
 * Best effort placement of declared records nothing in the tree refers to, for the few kinds whose
 * home can be told from their own content.
 */
public final class LostNodeRecovery {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGGER = new LogWrapper(LoggerFactory.getLogger(LostNodeRecovery.class));

  private final WalkState state;

  /**
   * Constructor.
   *
   * @param state the analysis state
   */
  public LostNodeRecovery(final WalkState state) {
    this.state = requireNonNull(state);
  }

  /**
   * Run the recovery.
   *
   * @return the ids of the records that were placed
   * @throws PdfTreeException if recovery would load more than the configured number of records, or a
   *         {@link StructuralInvariantException} if a placement violates the tree invariants
   */
  public IntList recover() throws PdfTreeException {
    final IntList placed = new IntArrayList();
    final NodeRegistry registry = state.getRegistry();
    final OptionalInt declaredSize = state.getDeclaredSize();

    if (declaredSize.isPresent()) {
      final int size = declaredSize.getAsInt();
      final int missingCount = countMissingIds(size);
      if (missingCount > state.getConfig().getMissingNodeWarnThreshold()) {
        LOGGER.warn("Found {} missing node IDs. This could take a while to sort out...", missingCount);
      }

      final int maxLoaded = state.getConfig().getMaxRecordsVisited();
      int loaded = 0;
      for (int id = 1; id < size; id++) {
        final PdfTreeNode existing = registry.find(id);
        if (existing != null && (existing.getParent() != null || state.isInTree(existing))) {
          continue;
        }
        if (++loaded > maxLoaded) {
          throw new PdfTreeException("Recovery aborted after loading %d records", maxLoaded);
        }
        final PdfRecord record = loadRecord(id);
        if (record == null || !record.hasDictionary()) {
          continue;
        }
        if (placeLostRecord(id, record)) {
          placed.add(id);
        }
      }
    }

    // Force /Pages to be children of /Catalog.
    final PdfTreeNode catalog = findInTree(PdfNames.CATALOG);
    if (catalog != null) {
      final List<PdfTreeNode> orphans = new ArrayList<>();
      for (final PdfTreeNode node : registry.nodes()) {
        if (node.getParent() == null && node != state.getRoot() && PdfNames.PAGES.equals(node.getKind())) {
          orphans.add(node);
        }
      }
      for (final PdfTreeNode orphan : orphans) {
        LOGGER.warn("Forcing orphaned {} node {} to be child of {}", PdfNames.PAGES, orphan, catalog);
        orphan.setParent(catalog);
        placed.add(orphan.getId());
      }
    }
    return placed;
  }

  private boolean placeLostRecord(final int id, final PdfRecord record) throws StructuralInvariantException {
    if (record.get(PdfNames.TYPE) == null && record.getDictionary().containsKey(PdfNames.LINEARIZED)) {
      LOGGER.warn("Placing special {} node {} as child of root", PdfNames.LINEARIZED, id);
      state.getRoot().addChild(build(id, PdfNames.LINEARIZED));
      return true;
    }
    final PdfTreeNode pParent = referencedTreeNode(record, PdfNames.P);
    if (pParent != null) {
      LOGGER.warn("Placing lost {} with {} ref pointing to {}", id, PdfNames.P, pParent);
      pParent.addChild(build(id, "/P(arent)"));
      return true;
    }
    final PdfTreeNode colorSpace = referencedTreeNode(record, PdfNames.COLOR_SPACE);
    if (colorSpace != null) {
      LOGGER.warn("Placing lost {} with {} ref pointing to {}", id, PdfNames.COLOR_SPACE, colorSpace);
      colorSpace.addChild(build(id, "/C(olorSpace)"));
      return true;
    }
    if (PdfNames.XREF.equals(record.getName(PdfNames.TYPE))) {
      final PdfTreeNode rootNode = referencedTreeNode(record, PdfNames.ROOT);
      if (rootNode != null) {
        LOGGER.info("Placing {} {} under {} based on {} property", PdfNames.XREF, id, rootNode, PdfNames.ROOT);
        rootNode.addChild(build(id, PdfNames.XREF));
        return true;
      }
    }
    return false;
  }

  private PdfTreeNode build(final int id, final String address) {
    return state.getRegistry().buildOrFind(new ObjectReference(new ObjectId(id)), address);
  }

  private @Nullable PdfTreeNode referencedTreeNode(final PdfRecord record, final String key) {
    final Object value = record.get(key);
    if (!(value instanceof ObjectReference)) {
      return null;
    }
    final PdfTreeNode node = state.getRegistry().find(((ObjectReference) value).getObjectNumber());
    return node != null && state.isInTree(node) ? node : null;
  }

  private @Nullable PdfRecord loadRecord(final int id) {
    try {
      return state.getSource().getRecord(new ObjectId(id));
    } catch (final RecordDecodeException e) {
      LOGGER.debug("Cannot recover {}: {}", id, e.getMessage());
      return null;
    }
  }

  private @Nullable PdfTreeNode findInTree(final String kind) {
    for (final PdfTreeNode node : state.getRegistry().nodes()) {
      if (kind.equals(node.getKind()) && state.isInTree(node)) {
        return node;
      }
    }
    return null;
  }

  /**
   * Count the ids below the declared size without a node in the tree. Only the built nodes are
   * inspected, the declared size may be hostile.
   */
  private int countMissingIds(final int declaredSize) {
    int inTree = 0;
    for (final PdfTreeNode node : state.getRegistry().nodes()) {
      if (node.getId() >= 1 && node.getId() < declaredSize && state.isInTree(node)) {
        inTree++;
      }
    }
    return Math.max(0, declaredSize - 1 - inTree);
  }
}
