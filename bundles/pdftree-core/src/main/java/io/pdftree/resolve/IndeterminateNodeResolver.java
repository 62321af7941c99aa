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

import com.google.common.collect.ImmutableSet;
import io.pdftree.exception.StructuralInvariantException;
import io.pdftree.node.NonTreeRelationship;
import io.pdftree.node.PdfTreeNode;
import io.pdftree.node.TreeDump;
import io.pdftree.record.PdfNames;
import io.pdftree.report.FindingKind;
import io.pdftree.utils.AddressStrings;
import io.pdftree.utils.LogWrapper;
import io.pdftree.walk.ReferenceKeyCategory;
import io.pdftree.walk.WalkState;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Places the nodes the walk could not place, once the whole graph is known. Pending nodes are
 * processed in id order; the first {@link PlacementRule} that yields a parent wins.
 */
public final class IndeterminateNodeResolver {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGGER = new LogWrapper(LoggerFactory.getLogger(IndeterminateNodeResolver.class));

  private static final ImmutableSet<String> PAGE_AND_PAGES = ImmutableSet.of(PdfNames.PAGE, PdfNames.PAGES);

  private static final ImmutableSet<String> CHILD_KEYS = ImmutableSet.of(PdfNames.K, PdfNames.KIDS);

  private final WalkState state;

  /** How often each rule placed a node. */
  private final Map<PlacementRule, Integer> ruleCounts = new EnumMap<>(PlacementRule.class);

  /**
   * Constructor.
   *
   * @param state the state holding the pending ids
   */
  public IndeterminateNodeResolver(final WalkState state) {
    this.state = requireNonNull(state);
  }

  /**
   * Place every pending node. Nodes that gained a parent in the meantime are skipped.
   *
   * @throws StructuralInvariantException if a pending node has no usable referrer
   */
  public void resolveAll() throws StructuralInvariantException {
    final IntArrayList pendingIds = new IntArrayList(state.getPendingIds());
    LOGGER.info("Resolving {} indeterminate nodes: {}", pendingIds.size(), pendingIds);

    for (final int id : pendingIds) {
      final PdfTreeNode node = requireNonNull(state.getRegistry().find(id));
      if (node.getParent() != null) {
        LOGGER.info("{} marked indeterminate but has parent: {}", node, node.getParent());
      } else {
        final PlacementRule rule = place(node);
        ruleCounts.merge(rule, 1, Integer::sum);
      }
      state.getPendingIds().remove(id);
    }
  }

  /**
   * Place one node.
   *
   * @param node the node, without parent
   * @return the rule that placed it
   * @throws StructuralInvariantException if the node has no usable referrer
   */
  public PlacementRule place(final PdfTreeNode node) throws StructuralInvariantException {
    LOGGER.debug("Attempting to resolve indeterminate node: {}", node);

    final List<NonTreeRelationship> relationships = usableRelationships(node);
    final List<PdfTreeNode> referrers = distinctSources(relationships);
    if (referrers.isEmpty()) {
      throw failure(node, "No placement found for %s: it has no referrers that can be its parent");
    }

    final PdfTreeNode commonAncestor = findCommonAncestor(referrers);
    if (commonAncestor != null) {
      LOGGER.info("  Found common ancestor: {}", commonAncestor);
      return adopt(node, commonAncestor, PlacementRule.COMMON_ANCESTOR);
    }

    final PdfTreeNode single = findSingleCandidate(node, relationships);
    if (single != null) {
      return adopt(node, single, PlacementRule.SINGLE_CANDIDATE);
    }

    if (PdfNames.RESOURCES.equals(node.getLabel())) {
      final List<PdfTreeNode> resourceReferrers = distinctSources(relationships.stream()
          .filter(r -> PdfNames.RESOURCES.equals(r.getReferenceKey()))
          .collect(Collectors.toList()));
      final PdfTreeNode container = findCommonAncestor(resourceReferrers);
      if (container != null) {
        LOGGER.info("  Found common ancestor among {} referrers: {}", PdfNames.RESOURCES, container);
        return adopt(node, container, PlacementRule.RESOURCES_CONTAINER);
      }
    }

    // A {/Page, /Pages} label set always passes the fuzzy label match below.
    final Set<String> referrerLabels = referrers.stream().map(PdfTreeNode::getLabel).collect(Collectors.toSet());
    if (referrerLabels.equals(PAGE_AND_PAGES)) {
      final PdfTreeNode pages = findNodeWithMostDescendants(referrers.stream()
          .filter(r -> PdfNames.PAGES.equals(r.getLabel()))
          .collect(Collectors.toList()));
      LOGGER.warn("  {} seems to be a loose {}. Linking to {}", node, PdfNames.PAGE, pages);
      state.getFindings().add(FindingKind.EVIDENCE_WARNING, node.getId(),
          "%s is referred to only by %s and %s records; placed under %s against the containment convention", node,
          PdfNames.PAGE, PdfNames.PAGES, pages);
      return adopt(node, pages, PlacementRule.PAGES_ESCAPE_HATCH);
    }

    final PdfTreeNode mostDescendants = findNodeWithMostDescendants(referrers);
    if (hasOnlySimilarRelationships(relationships, referrers)) {
      LOGGER.info("  Fuzzy match addresses or labels; placing under node w/most descendants: {}", mostDescendants);
      return adopt(node, mostDescendants, PlacementRule.JUSTIFIED_MOST_DESCENDANTS);
    }
    if (PdfNames.COLOR_SPACE.equals(node.getKind())) {
      LOGGER.info("  Color space node found; placing under node w/most descendants: {}", mostDescendants);
      return adopt(node, mostDescendants, PlacementRule.JUSTIFIED_MOST_DESCENDANTS);
    }

    LOGGER.warn("  {} parent {} chosen based on descendant count only", node, mostDescendants);
    final List<String> candidates = describeCandidates(node, relationships);
    candidates.forEach(line -> LOGGER.warn("  {}", line));
    state.getFindings().add(FindingKind.EVIDENCE_WARNING, node.getId(),
        "%s placed under %s based on descendant count only; candidates: %s", node, mostDescendants, candidates);
    return adopt(node, mostDescendants, PlacementRule.WEAK_MOST_DESCENDANTS);
  }

  /**
   * Get how often each rule placed a node so far.
   *
   * @return a copy of the counts
   */
  public Map<PlacementRule, Integer> getRuleCounts() {
    return new EnumMap<>(ruleCounts);
  }

  private PlacementRule adopt(final PdfTreeNode node, final PdfTreeNode parent, final PlacementRule rule)
      throws StructuralInvariantException {
    node.setParent(parent);
    return rule;
  }

  /**
   * Relationships whose source may become the parent: neither the node itself nor one of its
   * descendants.
   */
  private List<NonTreeRelationship> usableRelationships(final PdfTreeNode node) {
    final List<NonTreeRelationship> usable = new ArrayList<>();
    for (final NonTreeRelationship relationship : node.getNonTreeRelationships()) {
      final PdfTreeNode source = state.getRegistry().find(relationship.getSourceId());
      if (source != null && source != node && !node.isAncestorOf(source)) {
        usable.add(relationship);
      }
    }
    return usable;
  }

  private List<PdfTreeNode> distinctSources(final List<NonTreeRelationship> relationships) {
    final Set<PdfTreeNode> sources = new LinkedHashSet<>();
    for (final NonTreeRelationship relationship : relationships) {
      sources.add(requireNonNull(state.getRegistry().find(relationship.getSourceId())));
    }
    return new ArrayList<>(sources);
  }

  /**
   * If any of the nodes is an ancestor of the rest of the nodes, return it.
   */
  private static @Nullable PdfTreeNode findCommonAncestor(final List<PdfTreeNode> nodes) {
    for (final PdfTreeNode possibleAncestor : nodes) {
      LOGGER.debug("  Checking possible common ancestor: {}", possibleAncestor);
      final boolean dominatesAll = nodes.stream()
                                        .filter(other -> other != possibleAncestor)
                                        .allMatch(possibleAncestor::isAncestorOf);
      if (dominatesAll) {
        return possibleAncestor;
      }
    }
    return null;
  }

  private @Nullable PdfTreeNode findSingleCandidate(final PdfTreeNode node,
      final List<NonTreeRelationship> relationships) {
    final List<Predicate<NonTreeRelationship>> filters = List.of(
        r -> CHILD_KEYS.contains(r.getReferenceKey()),
        r -> !ReferenceKeyCategory.LINK_KEYS.contains(source(r).getKind()),
        r -> PAGE_AND_PAGES.contains(source(r).getKind()) && !source(r).getKind().equals(node.getKind()));
    for (final Predicate<NonTreeRelationship> filter : filters) {
      final List<NonTreeRelationship> remaining = relationships.stream().filter(filter).collect(Collectors.toList());
      if (remaining.size() == 1) {
        LOGGER.info("  Single remaining relationship {}; making it the parent", remaining.get(0));
        return source(remaining.get(0));
      }
    }
    return null;
  }

  private PdfTreeNode source(final NonTreeRelationship relationship) {
    return requireNonNull(state.getRegistry().find(relationship.getSourceId()));
  }

  /**
   * Find the node with the most descendants, ties broken by the lowest id.
   */
  static PdfTreeNode findNodeWithMostDescendants(final List<PdfTreeNode> nodes) {
    return nodes.stream()
                .max(Comparator.comparingInt(PdfTreeNode::descendantCount)
                               .thenComparing(PdfTreeNode::getId, Comparator.reverseOrder()))
                .orElseThrow();
  }

  /**
   * Determines if all addresses pointing here, or all labels of the referring nodes, are alike.
   */
  private static boolean hasOnlySimilarRelationships(final List<NonTreeRelationship> relationships,
      final List<PdfTreeNode> referrers) {
    final Set<String> addresses = relationships.stream()
                                               .map(NonTreeRelationship::getAddress)
                                               .collect(Collectors.toCollection(LinkedHashSet::new));
    final Set<String> labels = referrers.stream()
                                        .map(PdfTreeNode::getLabel)
                                        .collect(Collectors.toCollection(LinkedHashSet::new));
    return AddressStrings.allSameIgnoringNumbers(addresses) || AddressStrings.haveCommonSubstring(addresses)
        || AddressStrings.allSameIgnoringNumbers(labels) || AddressStrings.haveCommonSubstring(labels);
  }

  private List<String> describeCandidates(final PdfTreeNode node, final List<NonTreeRelationship> relationships) {
    final List<String> lines = new ArrayList<>();
    lines.add(node + " parent from candidates:");
    for (int i = 0; i < relationships.size(); i++) {
      final NonTreeRelationship relationship = relationships.get(i);
      lines.add((i + 1) + ". " + relationship + ", Descendant Count: " + source(relationship).descendantCount());
    }
    return lines;
  }

  private StructuralInvariantException failure(final PdfTreeNode node, final String message) {
    final List<String> diagnostics = new ArrayList<>();
    for (final NonTreeRelationship relationship : node.getNonTreeRelationships()) {
      final PdfTreeNode source = state.getRegistry().find(relationship.getSourceId());
      diagnostics.add(relationship + ", Descendant Count: " + (source == null ? 0 : source.descendantCount()));
    }
    LOGGER.error("Partial tree before failing to place {}:", node);
    TreeDump.lines(state.getRegistry(), state.getConfig().getMaxAddressLength()).forEach(LOGGER::error);
    return new StructuralInvariantException(node.getId(), String.format(message, node), diagnostics);
  }
}
