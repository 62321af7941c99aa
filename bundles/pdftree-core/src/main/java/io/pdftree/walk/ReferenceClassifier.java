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

import io.pdftree.exception.StructuralInvariantException;
import io.pdftree.node.PdfTreeNode;
import io.pdftree.node.RelationshipEdge;
import io.pdftree.utils.LogWrapper;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Decides what one discovered reference means for the tree. Classification only reads the tree;
 * the {@link GraphWalker} applies the result.
 *
 * <p>
 * Rules, first match wins:
 * </p>
 * <ol>
 * <li>the target already is the source's parent or child: nothing to do</li>
 * <li>explicit parent pointers and child lists are authoritative, unless they would create a cycle
 * or give the target a second parent, in which case the reference is kept as a non-tree edge</li>
 * <li>links never confer ownership; a link to a record that is not in the tree yet defers its
 * placement</li>
 * <li>shared resources defer placement until the whole graph is known</li>
 * <li>a record seen before must already have a parent or await placement</li>
 * <li>otherwise the first reference to a record owns it</li>
 * </ol>
 */
public final class ReferenceClassifier {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGGER = new LogWrapper(LoggerFactory.getLogger(ReferenceClassifier.class));

  private final WalkState state;

  /**
   * Constructor.
   *
   * @param state the state to read
   */
  public ReferenceClassifier(final WalkState state) {
    this.state = requireNonNull(state);
  }

  /**
   * Classify a reference.
   *
   * @param reference      the reference
   * @param target         the node of the referenced record
   * @param alreadyVisited determines if the target had been discovered before this reference
   * @return the classification
   * @throws StructuralInvariantException if the target was seen before but neither has a parent nor
   *         awaits placement
   */
  public Classification classify(final DiscoveredReference reference, final PdfTreeNode target,
      final boolean alreadyVisited) throws StructuralInvariantException {
    final PdfTreeNode source = reference.getSource();

    if (target == source.getParent() || target.getParent() == source) {
      LOGGER.debug("  {} and {} are already parent/child", source, target);
      return new Classification(RelationshipEdge.NONE, false, false, "already related");
    }

    final ReferenceKeyCategory category = ReferenceKeyCategory.of(reference.getReferenceKey(), source);
    switch (category) {
      case PARENT_POINTER:
        if (target == source || source.isAncestorOf(target)) {
          LOGGER.info("{} would create a cycle; keeping it as non-tree relationship", reference);
          return new Classification(RelationshipEdge.NON_TREE, false, !alreadyVisited, "parent pointer cycle");
        }
        LOGGER.debug("  Explicit parent link: {}", reference);
        return new Classification(RelationshipEdge.PARENT, false, !alreadyVisited, "explicit parent pointer");
      case CHILD_LIST:
        if (target == source || target.isAncestorOf(source)) {
          LOGGER.info("{} would create a cycle; keeping it as non-tree relationship", reference);
          return new Classification(RelationshipEdge.NON_TREE, false, !alreadyVisited, "child list cycle");
        }
        if (target.getParent() != null) {
          LOGGER.info("{} fail: {} parent is already {}", reference, target, target.getParent());
          return new Classification(RelationshipEdge.NON_TREE, false, !alreadyVisited, "child has other parent");
        }
        LOGGER.debug("  Explicit child link: {}", reference);
        return new Classification(RelationshipEdge.CHILD, false, !alreadyVisited, "explicit child list");
      case LINK:
        final boolean outsideTree = !state.isInTree(target);
        LOGGER.debug("  Link ref {}", reference);
        return new Classification(RelationshipEdge.NON_TREE, outsideTree && target.getParent() == null, outsideTree,
            "link");
      case INDETERMINATE:
        LOGGER.info("  Indeterminate ref {}", reference);
        return new Classification(RelationshipEdge.INDETERMINATE, target.getParent() == null, true,
            "shared resource");
      case ORDINARY:
        if (alreadyVisited) {
          if (target.getParent() == null && !state.isPending(target.getId())) {
            throw new StructuralInvariantException(target.getId(),
                String.format("%s - reference to a node with no parent and no pending resolution", reference));
          }
          LOGGER.debug("  Already saw {}; not scanning next", reference);
          return new Classification(RelationshipEdge.NON_TREE, false, false, "seen before");
        }
        return new Classification(RelationshipEdge.CHILD, false, true, "first reference");
      default:
        throw new AssertionError("Unknown reference key category: " + category);
    }
  }
}
