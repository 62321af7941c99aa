package io.pdftree.summary;

import com.google.gson.stream.JsonWriter;
import io.pdftree.api.PdfTree;
import io.pdftree.exception.PdfTreeException;
import io.pdftree.node.PdfTreeNode;
import io.pdftree.symlink.SymlinkEdge;
import io.pdftree.utils.LogWrapper;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;

import static java.util.Objects.requireNonNull;

/**
 * Writes a {@link PdfTree} as JSON: one object per node in level order, with its parent, its
 * children and its outgoing symlinks.
 */
public final class TreeJsonSerializer {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGGER = new LogWrapper(LoggerFactory.getLogger(TreeJsonSerializer.class));

  private final boolean indent;

  /**
   * Constructor.
   *
   * @param indent {@code true} to pretty print
   */
  public TreeJsonSerializer(final boolean indent) {
    this.indent = indent;
  }

  /**
   * Serialize the tree.
   *
   * @param tree   the tree
   * @param writer where to write, not closed
   * @throws PdfTreeException if writing fails
   */
  public void serialize(final PdfTree tree, final Writer writer) throws PdfTreeException {
    requireNonNull(tree);
    requireNonNull(writer);
    try {
      final JsonWriter json = new JsonWriter(writer);
      if (indent) {
        json.setIndent("  ");
      }
      json.beginObject();
      json.name("rootId").value(tree.getRoot().getId());
      json.name("maxGeneration").value(tree.getMaxGeneration());
      json.name("nodes");
      json.beginArray();
      int count = 0;
      for (final PdfTreeNode node : tree.levelOrder()) {
        writeNode(json, tree, node);
        count++;
      }
      json.endArray();
      json.endObject();
      json.flush();
      LOGGER.debug("Serialized {} nodes", count);
    } catch (final IOException e) {
      throw new PdfTreeException("Failed to serialize tree", e);
    }
  }

  private static void writeNode(final JsonWriter json, final PdfTree tree, final PdfTreeNode node)
      throws IOException {
    json.beginObject();
    json.name("id").value(node.getId());
    json.name("label").value(node.getLabel());
    json.name("kind").value(node.getKind());
    json.name("address").value(tree.getTreeAddress(node));
    final PdfTreeNode parent = node.getParent();
    json.name("parent");
    if (parent == null) {
      json.nullValue();
    } else {
      json.value(parent.getId());
    }
    json.name("children");
    json.beginArray();
    for (final PdfTreeNode child : node.getChildren()) {
      json.value(child.getId());
    }
    json.endArray();
    json.name("symlinks");
    json.beginArray();
    for (final SymlinkEdge symlink : tree.getSymlinksFrom(node)) {
      json.beginObject();
      json.name("to").value(symlink.getToId());
      json.name("label").value(symlink.getLabel());
      json.name("key").value(symlink.getReferenceKey());
      json.endObject();
    }
    json.endArray();
    if (node.isDegraded()) {
      json.name("degraded").value(true);
    }
    json.endObject();
  }
}
