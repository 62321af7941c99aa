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

import com.google.common.collect.ImmutableList;
import io.pdftree.exception.StructuralInvariantException;
import io.pdftree.record.ObjectId;
import io.pdftree.record.PdfNames;
import io.pdftree.record.PdfRecord;
import io.pdftree.record.RecordShape;
import io.pdftree.settings.Fixed;
import io.pdftree.utils.AddressStrings;
import io.pdftree.utils.LogWrapper;
import io.pdftree.walk.DiscoveredReference;
import io.pdftree.walk.ReferenceCollector;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Wraps one record and carries its position in the tree.
 *
 * <p>
 * The parent link and the parent's child list are always changed together through
 * {@link #setParent(PdfTreeNode)} and {@link #addChild(PdfTreeNode)}. A node never changes its
 * parent once it has one and is never removed, so its index among its siblings is stable.
 * </p>
 *
 * <p>
 * Non-tree relationships are inbound: each one records a referring node by id.
 * </p>
 */
public final class PdfTreeNode {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGGER = new LogWrapper(LoggerFactory.getLogger(PdfTreeNode.class));

  /** Object number, the node key. */
  private final int id;

  /** Generation of the record this node was built from. */
  private final int generation;

  /** The wrapped record. */
  private final PdfRecord record;

  /** Derived from {@code /Type} or the discovery address. */
  private final String kind;

  /** {@code /Subtype} or {@code /S}. */
  private final @Nullable String subKind;

  /** Display name, never empty. */
  private final String label;

  /** Address of the reference this node was discovered through. */
  private final String firstAddress;

  /** Determines if the record could not be decoded and was replaced by a placeholder. */
  private final boolean degraded;

  /** Decoded stream bytes, {@code null} for non-streams and failed decodes. */
  private final byte @Nullable [] streamData;

  /** Stream length, {@code 0} for non-streams, {@link Fixed#DECODE_FAILURE_LENGTH} for failures. */
  private final int streamLength;

  /** The parent, {@code null} for the root and for unplaced nodes. */
  private @Nullable PdfTreeNode parent;

  /** Index among the parent's children. */
  private int childIndex = -1;

  /** Children in insertion order. */
  private final List<PdfTreeNode> children = new ArrayList<>();

  /** Inbound relationships that do not confer ownership. */
  private final List<NonTreeRelationship> nonTreeRelationships = new ArrayList<>();

  /** Determines if all references of the record have been classified. */
  private boolean allReferencesProcessed;

  /**
   * Constructor.
   *
   * @param id           the object number
   * @param record       the record
   * @param address      the address the node is discovered through
   * @param degraded     determines if the record is a placeholder for an undecodable record
   * @param streamData   decoded stream bytes or {@code null}
   * @param streamLength length of the stream bytes
   */
  PdfTreeNode(final ObjectId id, final PdfRecord record, final String address, final boolean degraded,
      final byte @Nullable [] streamData, final int streamLength) {
    this.id = id.getObjectNumber();
    this.generation = id.getGenerationNumber();
    this.record = requireNonNull(record);
    this.firstAddress = requireNonNull(address);
    this.degraded = degraded;
    this.streamData = streamData;
    this.streamLength = streamLength;

    String derivedKind;
    String derivedLabel;
    if (record.hasDictionary()) {
      final String type = record.getName(PdfNames.TYPE);
      derivedKind = type == null ? address : type;
      subKind = firstNonNull(record.getName(PdfNames.SUBTYPE), record.getName(PdfNames.S));
      if (type != null && subKind != null) {
        derivedLabel = derivedKind + ":" + (subKind.startsWith("/") ? subKind.substring(1) : subKind);
      } else {
        derivedLabel = derivedKind;
      }
      derivedKind = AddressStrings.rootAddress(derivedKind);
      derivedLabel = AddressStrings.rootAddress(derivedLabel);
    } else {
      subKind = null;
      derivedLabel = address;
      derivedKind = AddressStrings.rootAddress(address);
    }

    // Nodes only known through an array index, e.g. "[3]".
    if (derivedKind.isEmpty()) {
      derivedKind = PdfNames.UNLABELED;
    }
    if (derivedLabel.isEmpty()) {
      derivedLabel = PdfNames.UNLABELED + address;
    }
    kind = derivedKind;
    label = derivedLabel;

    LOGGER.debug("Node ID: {}, kind: {}, subkind: {}, label: {}, first address: {}", this.id, kind, subKind, label,
        firstAddress);
  }

  private static @Nullable String firstNonNull(final @Nullable String first, final @Nullable String second) {
    return first != null ? first : second;
  }

  /**
   * Set the parent of this node, which also appends this node to the parent's children. Non-tree
   * relationships from the new parent are dropped. Setting the current parent again does nothing.
   *
   * @param parent the new parent
   * @throws StructuralInvariantException if this node already has a different parent, or if the
   *         parent is this node or one of its descendants
   */
  public void setParent(final PdfTreeNode parent) throws StructuralInvariantException {
    requireNonNull(parent);
    if (this.parent == parent) {
      return;
    }
    if (this.parent != null) {
      throw new StructuralInvariantException(id,
          String.format("Cannot set %s as parent of %s, parent is already %s", parent, this, this.parent));
    }
    if (parent == this || isAncestorOf(parent)) {
      throw new StructuralInvariantException(id,
          String.format("Cannot set %s as parent of %s, it would create a cycle", parent, this));
    }

    this.parent = parent;
    childIndex = parent.children.size();
    parent.children.add(this);
    removeNonTreeRelationshipsFrom(parent);
    LOGGER.info("  Added {} as parent of {}", parent, this);
  }

  /**
   * Add a child to this node. Adding an existing child does nothing.
   *
   * @param child the child
   * @throws StructuralInvariantException if the child already has a different parent or is an
   *         ancestor of this node
   */
  public void addChild(final PdfTreeNode child) throws StructuralInvariantException {
    if (child.parent == this) {
      LOGGER.debug("{} is already child of {}", child, this);
      return;
    }
    child.setParent(this);
  }

  /**
   * Add an inbound relationship that does not confer ownership. Duplicates are ignored.
   *
   * @param relationship the relationship, its target must be this node
   */
  public void addNonTreeRelationship(final NonTreeRelationship relationship) {
    checkArgument(relationship.getTargetId() == id, "%s does not point at %s", relationship, this);
    if (nonTreeRelationships.contains(relationship)) {
      return;
    }
    nonTreeRelationships.add(relationship);
    LOGGER.info("Added other relationship: {} {}", relationship, this);
  }

  /**
   * Drop a relationship that turned out to be expressed by the tree.
   *
   * @param relationship the relationship
   * @return {@code true} if it was present
   */
  public boolean discardNonTreeRelationship(final NonTreeRelationship relationship) {
    return nonTreeRelationships.remove(relationship);
  }

  private void removeNonTreeRelationshipsFrom(final PdfTreeNode from) {
    final List<NonTreeRelationship> toRemove = new ArrayList<>();
    for (final NonTreeRelationship relationship : nonTreeRelationships) {
      if (relationship.getSourceId() == from.id) {
        toRemove.add(relationship);
      }
    }
    if (toRemove.isEmpty()) {
      return;
    }
    if (toRemove.size() > 1 && !toRemove.stream().allMatch(r -> PdfNames.FIRST.equals(r.getReferenceKey())
        || PdfNames.LAST.equals(r.getReferenceKey()))) {
      LOGGER.warn("> 1 relationships to remove from {} to {}: {}", from, this, toRemove);
    }
    for (final NonTreeRelationship relationship : toRemove) {
      LOGGER.debug("Removing relationship {} from {}", relationship, this);
      nonTreeRelationships.remove(relationship);
    }
  }

  /**
   * Determines if this node is a (transitive) parent of another node.
   *
   * @param other the other node
   * @return {@code true} if this node is on the other node's ancestor chain
   */
  public boolean isAncestorOf(final PdfTreeNode other) {
    for (PdfTreeNode current = other.parent; current != null; current = current.parent) {
      if (current == this) {
        return true;
      }
    }
    return false;
  }

  /**
   * Get the ancestors, nearest first.
   *
   * @return the ancestor chain up to the top most node
   */
  public List<PdfTreeNode> ancestors() {
    final List<PdfTreeNode> ancestors = new ArrayList<>();
    for (PdfTreeNode current = parent; current != null; current = current.parent) {
      ancestors.add(current);
    }
    return ancestors;
  }

  /**
   * Count children, grandchildren and so on.
   *
   * @return the number of descendants
   */
  public int descendantCount() {
    int count = 0;
    final Deque<PdfTreeNode> stack = new ArrayDeque<>(children);
    while (!stack.isEmpty()) {
      final PdfTreeNode node = stack.pop();
      count++;
      node.children.forEach(stack::push);
    }
    return count;
  }

  /**
   * Get the address under which the current parent refers to this node: the first reference of the
   * parent's record that points here, or the discovery address if the parent holds no reference.
   *
   * @return the address
   */
  public String getAddress() {
    if (parent == null) {
      return firstAddress;
    }
    for (final DiscoveredReference reference : ReferenceCollector.collect(parent)) {
      if (reference.getTargetId() == id) {
        return reference.getAddress();
      }
    }
    LOGGER.debug("Could not find expected reference from {} to {}", parent, this);
    return firstAddress;
  }

  /**
   * Create a string like {@code /Root/Pages/Kids[0]/Resources[/Font]} from the root down to this
   * node, truncated to the given length with a leading {@code ...}.
   *
   * @param maxLength maximum length of the result, at least 4
   * @return the tree address, {@code /} for the root
   * @throws IllegalStateException if this node is not connected to the root
   */
  public String getTreeAddress(final @NonNegative int maxLength) {
    checkArgument(maxLength > 3, "maxLength must be > 3");
    if (isTrailer()) {
      return "/";
    }
    final Deque<String> parts = new ArrayDeque<>();
    PdfTreeNode current = this;
    while (!current.isTrailer()) {
      if (current.parent == null) {
        throw new IllegalStateException(this + " does not have a path to the root; cannot get accurate node address.");
      }
      parts.push(current.getAddress());
      current = current.parent;
    }
    final String address = String.join("", parts);
    if (address.length() <= maxLength) {
      return address;
    }
    return "..." + address.substring(address.length() - maxLength + 3);
  }

  private boolean isTrailer() {
    return PdfNames.TRAILER.equals(label);
  }

  public int getId() {
    return id;
  }

  public int getGeneration() {
    return generation;
  }

  public PdfRecord getRecord() {
    return record;
  }

  public String getKind() {
    return kind;
  }

  public @Nullable String getSubKind() {
    return subKind;
  }

  public String getLabel() {
    return label;
  }

  public String getFirstAddress() {
    return firstAddress;
  }

  public boolean isDegraded() {
    return degraded;
  }

  public @Nullable PdfTreeNode getParent() {
    return parent;
  }

  /**
   * Get the children in insertion order.
   *
   * @return an unmodifiable view
   */
  public List<PdfTreeNode> getChildren() {
    return Collections.unmodifiableList(children);
  }

  int getChildIndex() {
    return childIndex;
  }

  /**
   * Get the inbound non-tree relationships in discovery order.
   *
   * @return an immutable snapshot
   */
  public List<NonTreeRelationship> getNonTreeRelationships() {
    return ImmutableList.copyOf(nonTreeRelationships);
  }

  /**
   * Determines if the record is a stream.
   *
   * @return {@code true} for stream records
   */
  public boolean containsStream() {
    return record.getShape() == RecordShape.STREAM;
  }

  /**
   * Get a copy of the decoded stream bytes.
   *
   * @return the bytes, or {@code null} if this is no stream or decoding failed
   */
  public byte @Nullable [] getStreamPayload() {
    return streamData == null ? null : streamData.clone();
  }

  /**
   * Get the length of the decoded stream.
   *
   * @return the length, {@code 0} for non-streams, {@code -1} if decoding failed
   */
  public int getStreamLength() {
    return streamLength;
  }

  public boolean isAllReferencesProcessed() {
    return allReferencesProcessed;
  }

  /** Mark that every reference of this node's record has been classified. */
  public void markAllReferencesProcessed() {
    allReferencesProcessed = true;
  }

  @Override
  public String toString() {
    return "<" + id + ":" + label + (containsStream() ? "(Stream)" : "") + ">";
  }
}
