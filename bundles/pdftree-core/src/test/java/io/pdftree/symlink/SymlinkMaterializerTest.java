package io.pdftree.symlink;

import io.pdftree.DocumentFixtures;
import io.pdftree.exception.PdfTreeException;
import io.pdftree.exception.StructuralInvariantException;
import io.pdftree.node.NodeRegistry;
import io.pdftree.node.NonTreeRelationship;
import io.pdftree.node.PdfTreeNode;
import io.pdftree.record.InMemoryRecordSource;
import io.pdftree.record.PdfNames;
import io.pdftree.report.Findings;
import io.pdftree.settings.AnalysisConfiguration;
import io.pdftree.walk.GraphWalker;
import io.pdftree.walk.WalkState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.pdftree.DocumentFixtures.dict;
import static io.pdftree.DocumentFixtures.ref;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class SymlinkMaterializerTest {

  @Test
  public void testNextPointer() throws PdfTreeException {
    final WalkState state =
        new WalkState(DocumentFixtures.nextPointerDocument(), AnalysisConfiguration.DEFAULT, new Findings());
    new GraphWalker(state).walk();

    final List<SymlinkEdge> edges = new SymlinkMaterializer(state.getRegistry()).materialize();

    assertEquals(List.of(new SymlinkEdge(3, 2, PdfNames.NEXT, PdfNames.NEXT)), edges);
    assertEquals("3 --/Next--> 2", edges.get(0).toString());
  }

  @Test
  public void testRelationshipExpressedByTreeIsDiscarded() throws StructuralInvariantException {
    final InMemoryRecordSource source = InMemoryRecordSource.newBuilder()
                                                            .record(1, dict(PdfNames.TYPE, "/Outlines"))
                                                            .record(2, dict(PdfNames.TYPE, "/Item"))
                                                            .record(3, dict(PdfNames.TYPE, "/Item"))
                                                            .build();
    final NodeRegistry registry = new NodeRegistry(source, new Findings());
    final PdfTreeNode root = registry.registerTrailer(10);
    final PdfTreeNode outlines = registry.buildOrFind(ref(1), "/Outlines");
    final PdfTreeNode first = registry.buildOrFind(ref(2), PdfNames.FIRST);
    final PdfTreeNode second = registry.buildOrFind(ref(3), PdfNames.NEXT);
    root.addChild(outlines);
    outlines.addChild(first);
    first.addChild(second);
    final NonTreeRelationship fromChild = new NonTreeRelationship(3, PdfNames.PREV, PdfNames.PREV, 2);
    final NonTreeRelationship fromSibling = new NonTreeRelationship(1, PdfNames.LAST, PdfNames.LAST, 3);
    first.addNonTreeRelationship(fromChild);
    second.addNonTreeRelationship(fromSibling);

    final List<SymlinkEdge> edges = new SymlinkMaterializer(registry).materialize();

    assertEquals(List.of(new SymlinkEdge(1, 3, PdfNames.LAST, PdfNames.LAST)), edges);
    assertTrue(first.getNonTreeRelationships().isEmpty());
  }
}
