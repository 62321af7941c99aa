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

import io.pdftree.exception.RecordDecodeException;
import io.pdftree.record.ObjectId;
import io.pdftree.record.ObjectReference;
import io.pdftree.record.PdfNames;
import io.pdftree.record.PdfRecord;
import io.pdftree.record.RecordSource;
import io.pdftree.report.FindingKind;
import io.pdftree.report.Findings;
import io.pdftree.settings.Fixed;
import io.pdftree.utils.LogWrapper;
import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Identity map from object number to the one node built for it. Lives for one analysis.
 */
public final class NodeRegistry {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGGER = new LogWrapper(LoggerFactory.getLogger(NodeRegistry.class));

  /** Nodes in discovery order. */
  private final Int2ObjectLinkedOpenHashMap<PdfTreeNode> nodes = new Int2ObjectLinkedOpenHashMap<>();

  /** Where records come from. */
  private final RecordSource source;

  /** Where decode failures are reported. */
  private final Findings findings;

  /** The trailer node, once registered. */
  private @Nullable PdfTreeNode root;

  /**
   * Constructor.
   *
   * @param source   the record source
   * @param findings collector of decode failures
   */
  public NodeRegistry(final RecordSource source, final Findings findings) {
    this.source = requireNonNull(source);
    this.findings = requireNonNull(findings);
  }

  /**
   * Build the root node from the trailer.
   *
   * @param rootId the id given to the trailer
   * @return the root node
   * @throws IllegalStateException if a root is registered already or the id is taken
   */
  public PdfTreeNode registerTrailer(final int rootId) {
    checkState(root == null, "Trailer already registered");
    checkState(!nodes.containsKey(rootId), "Id %s already taken", rootId);
    final PdfTreeNode trailer = new PdfTreeNode(new ObjectId(rootId), source.getTrailer(), PdfNames.TRAILER, false,
        null, 0);
    nodes.put(rootId, trailer);
    root = trailer;
    return trailer;
  }

  /**
   * Return the node for a reference, building it on first discovery. A record that fails to decode
   * yields a degraded node and a {@link FindingKind#DEGRADED_RECORD} finding.
   *
   * @param reference the reference
   * @param address   the address the reference was found at, kept as discovery address
   * @return the one node for the referenced object number
   */
  public PdfTreeNode buildOrFind(final ObjectReference reference, final String address) {
    final int id = reference.getObjectNumber();
    final PdfTreeNode existing = nodes.get(id);
    if (existing != null) {
      return existing;
    }

    LOGGER.debug("Building node for {}", reference);
    PdfRecord record;
    boolean degraded = false;
    try {
      record = source.getRecord(reference.getTarget());
    } catch (final RecordDecodeException e) {
      LOGGER.warn("Failed to build node {} properly ({}). Tree integrity not guaranteed.", reference, e.getMessage());
      findings.add(FindingKind.DEGRADED_RECORD, id, "Record %s could not be decoded: %s", reference, e.getMessage());
      record = PdfRecord.unresolved(reference);
      degraded = true;
    }

    byte[] streamData = null;
    int streamLength = 0;
    if (record.getPayload() != null) {
      try {
        streamData = record.getPayload().getBytes();
        streamLength = streamData.length;
      } catch (final RecordDecodeException e) {
        LOGGER.warn("Failed to decode stream of {}: {}. Trees will be unaffected but the payload is unavailable.",
            reference, e.getMessage());
        findings.add(FindingKind.DEGRADED_RECORD, id, "Stream of %s could not be decoded: %s", reference,
            e.getMessage());
        streamLength = Fixed.DECODE_FAILURE_LENGTH.getStandardProperty();
      }
    }

    final PdfTreeNode node = new PdfTreeNode(reference.getTarget(), record, address, degraded, streamData,
        streamLength);
    nodes.put(id, node);
    return node;
  }

  public boolean contains(final int id) {
    return nodes.containsKey(id);
  }

  /**
   * Find the node of an object number.
   *
   * @param id the object number
   * @return the node or {@code null} if it was never discovered
   */
  public @Nullable PdfTreeNode find(final int id) {
    return nodes.get(id);
  }

  /**
   * Get the root node.
   *
   * @return the trailer node
   * @throws IllegalStateException if no trailer is registered yet
   */
  public PdfTreeNode getRoot() {
    checkState(root != null, "No trailer registered");
    return root;
  }

  public int size() {
    return nodes.size();
  }

  /**
   * Get all ids in discovery order.
   *
   * @return a copy of the ids
   */
  public IntList ids() {
    return new IntArrayList(nodes.keySet());
  }

  /**
   * Get all nodes in discovery order.
   *
   * @return an unmodifiable view
   */
  public Collection<PdfTreeNode> nodes() {
    return Collections.unmodifiableCollection(nodes.values());
  }

  /**
   * Determines if a node is connected to the root through parent links.
   *
   * @param node the node
   * @return {@code true} if the node is the root or one of its descendants
   */
  public boolean isInTree(final PdfTreeNode node) {
    final PdfTreeNode treeRoot = getRoot();
    return node == treeRoot || treeRoot.isAncestorOf(node);
  }

  /**
   * Get a new cursor over the nodes of this registry, placed on the root.
   *
   * @return the cursor
   */
  public TreeCursor newCursor() {
    return new TreeCursor(this);
  }
}
