package io.pdftree.summary;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;
import io.pdftree.node.PdfTreeNode;
import io.pdftree.symlink.SymlinkEdge;
import io.pdftree.walk.DiscoveredReference;
import io.pdftree.walk.ReferenceCollector;

import java.util.List;

/**
 * Frequency counts over a finished tree.
 */
public final class TreeSummary {

  private final ImmutableMultiset<String> kinds;

  private final ImmutableMultiset<String> labels;

  private final ImmutableMultiset<String> referenceKeys;

  private final int nodeCount;

  private final int symlinkCount;

  private final int streamCount;

  private TreeSummary(final ImmutableMultiset<String> kinds, final ImmutableMultiset<String> labels,
      final ImmutableMultiset<String> referenceKeys, final int nodeCount, final int symlinkCount,
      final int streamCount) {
    this.kinds = kinds;
    this.labels = labels;
    this.referenceKeys = referenceKeys;
    this.nodeCount = nodeCount;
    this.symlinkCount = symlinkCount;
    this.streamCount = streamCount;
  }

  /**
   * Count the given nodes.
   *
   * @param nodes    the nodes in the tree
   * @param symlinks the symlinks between them
   * @return the summary
   */
  public static TreeSummary of(final Iterable<PdfTreeNode> nodes, final List<SymlinkEdge> symlinks) {
    final ImmutableMultiset.Builder<String> kinds = ImmutableMultiset.builder();
    final ImmutableMultiset.Builder<String> labels = ImmutableMultiset.builder();
    final ImmutableMultiset.Builder<String> referenceKeys = ImmutableMultiset.builder();
    int nodeCount = 0;
    int streamCount = 0;
    for (final PdfTreeNode node : nodes) {
      nodeCount++;
      kinds.add(node.getKind());
      labels.add(node.getLabel());
      if (node.containsStream()) {
        streamCount++;
      }
      for (final DiscoveredReference reference : ReferenceCollector.collect(node)) {
        referenceKeys.add(reference.getReferenceKey());
      }
    }
    return new TreeSummary(kinds.build(), labels.build(), referenceKeys.build(), nodeCount, symlinks.size(),
        streamCount);
  }

  public Multiset<String> getKinds() {
    return kinds;
  }

  public Multiset<String> getLabels() {
    return labels;
  }

  /**
   * Get how often each key was used to reference another record, over all nodes in the tree.
   *
   * @return the key counts
   */
  public Multiset<String> getReferenceKeys() {
    return referenceKeys;
  }

  public int getNodeCount() {
    return nodeCount;
  }

  public int getSymlinkCount() {
    return symlinkCount;
  }

  public int getStreamCount() {
    return streamCount;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("nodes", nodeCount)
                      .add("symlinks", symlinkCount)
                      .add("streams", streamCount)
                      .add("kinds", kinds)
                      .toString();
  }
}
