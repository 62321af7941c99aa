package io.pdftree.walk;

import io.pdftree.DocumentFixtures;
import io.pdftree.exception.PdfTreeException;
import io.pdftree.node.NonTreeRelationship;
import io.pdftree.node.PdfTreeNode;
import io.pdftree.record.InMemoryRecordSource;
import io.pdftree.record.ObjectId;
import io.pdftree.record.ObjectReference;
import io.pdftree.record.PdfNames;
import io.pdftree.record.RecordSource;
import io.pdftree.report.Finding;
import io.pdftree.report.FindingKind;
import io.pdftree.report.Findings;
import io.pdftree.settings.AnalysisConfiguration;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static io.pdftree.DocumentFixtures.dict;
import static io.pdftree.DocumentFixtures.ref;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class GraphWalkerTest {

  private static WalkState walk(final RecordSource source, final AnalysisConfiguration config)
      throws PdfTreeException {
    final WalkState state = new WalkState(source, config, new Findings());
    new GraphWalker(state).walk();
    return state;
  }

  @Test
  public void testNextPointerIsNoOwnership() throws PdfTreeException {
    final WalkState state = walk(DocumentFixtures.nextPointerDocument(), AnalysisConfiguration.DEFAULT);

    final PdfTreeNode root = state.getRoot();
    assertEquals(4, root.getId());
    final PdfTreeNode alpha = state.getRegistry().find(2);
    assertSame(state.getRegistry().find(1), alpha.getParent());
    assertEquals(List.of(new NonTreeRelationship(3, PdfNames.NEXT, PdfNames.NEXT, 2)), alpha.getNonTreeRelationships());
    assertTrue(state.getPendingIds().isEmpty());
    for (final PdfTreeNode node : state.getRegistry().nodes()) {
      assertTrue(node.isAllReferencesProcessed());
    }
  }

  @Test
  public void testSharedResourceAwaitsPlacement() throws PdfTreeException {
    final WalkState state = walk(DocumentFixtures.commonAncestorDocument(), AnalysisConfiguration.DEFAULT);

    final PdfTreeNode font = state.getRegistry().find(4);
    assertNull(font.getParent());
    assertEquals(new IntRBTreeSet(new int[] {4}), state.getPendingIds());
    assertEquals(List.of(2, 3), font.getNonTreeRelationships().stream().map(NonTreeRelationship::getSourceId)
        .collect(Collectors.toList()));
  }

  @Test
  public void testParentPointerPlacesLinkedPage() throws PdfTreeException {
    final RecordSource source = InMemoryRecordSource.newBuilder()
                                                    .trailerEntry(PdfNames.SIZE, 5)
                                                    .trailerEntry(PdfNames.ROOT, ref(1))
                                                    .record(1, dict(PdfNames.TYPE, PdfNames.CATALOG, PdfNames.PAGES,
                                                        ref(2), PdfNames.OPEN_ACTION, ref(4)))
                                                    .record(2, dict(PdfNames.TYPE, PdfNames.PAGES, PdfNames.KIDS,
                                                        List.of(ref(3))))
                                                    .record(3, dict(PdfNames.TYPE, PdfNames.PAGE, PdfNames.PARENT,
                                                        ref(2)))
                                                    .record(4, dict(PdfNames.TYPE, PdfNames.PAGE, PdfNames.PARENT,
                                                        ref(2)))
                                                    .build();
    final WalkState state = walk(source, AnalysisConfiguration.DEFAULT);

    final PdfTreeNode pages = state.getRegistry().find(2);
    assertEquals(List.of(state.getRegistry().find(3), state.getRegistry().find(4)), pages.getChildren());
    assertTrue(state.isInTree(state.getRegistry().find(4)));
  }

  @Test
  public void testFallbackRootId() throws PdfTreeException {
    final RecordSource source = InMemoryRecordSource.newBuilder()
                                                    .trailerEntry(PdfNames.ROOT, ref(1))
                                                    .record(1, dict(PdfNames.TYPE, PdfNames.CATALOG))
                                                    .build();
    final WalkState state = walk(source, AnalysisConfiguration.newBuilder().trailerFallbackId(99).build());

    assertEquals(99, state.getRoot().getId());
    assertEquals(2, state.getRegistry().size());
  }

  @Test
  public void testMaxGeneration() throws PdfTreeException {
    final RecordSource source = InMemoryRecordSource.newBuilder()
                                                    .trailerEntry(PdfNames.SIZE, 2)
                                                    .trailerEntry(PdfNames.ROOT, new ObjectReference(
                                                        new ObjectId(1, 2)))
                                                    .record(new ObjectId(1, 2), dict(PdfNames.TYPE, PdfNames.CATALOG))
                                                    .build();

    assertEquals(2, walk(source, AnalysisConfiguration.DEFAULT).getMaxGeneration());
  }

  @Test
  public void testDeclaredMaxGeneration() throws PdfTreeException {
    final RecordSource source = InMemoryRecordSource.newBuilder()
                                                    .trailerEntry(PdfNames.SIZE, 3)
                                                    .trailerEntry(PdfNames.ROOT, ref(1))
                                                    .record(1, dict(PdfNames.TYPE, PdfNames.CATALOG))
                                                    .record(new ObjectId(2, 3), dict(PdfNames.TYPE, "/Annot"))
                                                    .build();

    // Only the unreferenced record carries a revision.
    assertEquals(3, walk(source, AnalysisConfiguration.DEFAULT).getMaxGeneration());
  }

  @Test
  public void testTrailerIdAvoidsUnderstatedSize() throws PdfTreeException {
    final RecordSource source = InMemoryRecordSource.newBuilder()
                                                    .trailerEntry(PdfNames.SIZE, 3)
                                                    .trailerEntry(PdfNames.ROOT, ref(1))
                                                    .record(1, dict(PdfNames.TYPE, PdfNames.CATALOG, "/Extra", ref(3)))
                                                    .record(3, dict(PdfNames.TYPE, "/Annot"))
                                                    .record(50, dict(PdfNames.TYPE, "/Annot"))
                                                    .build();
    final WalkState state = walk(source, AnalysisConfiguration.newBuilder().trailerFallbackId(50).build());

    assertEquals(51, state.getRoot().getId());
    final PdfTreeNode annotation = state.getRegistry().find(3);
    assertEquals("/Annot", annotation.getKind());
    assertSame(state.getRegistry().find(1), annotation.getParent());
  }

  @Test
  public void testReferenceToTrailerIdIsReported() throws PdfTreeException {
    final RecordSource source = InMemoryRecordSource.newBuilder()
                                                    .trailerEntry(PdfNames.SIZE, 3)
                                                    .trailerEntry(PdfNames.ROOT, ref(1))
                                                    .record(1, dict(PdfNames.TYPE, PdfNames.CATALOG, "/Extra", ref(3)))
                                                    .undecodable(3, "bad filter")
                                                    .build();
    final WalkState state = walk(source, AnalysisConfiguration.DEFAULT);

    assertEquals(3, state.getRoot().getId());
    assertTrue(state.getRoot().getChildren().stream().noneMatch(child -> child.getId() == 3));
    assertTrue(state.getFindings().snapshot().contains(new Finding(FindingKind.EVIDENCE_WARNING, 3,
        "Record 3 shares its id with the trailer and cannot be placed")));
  }

  @Test
  public void testWalkIsBounded() {
    final AnalysisConfiguration config = AnalysisConfiguration.newBuilder().maxRecordsVisited(2).build();

    final PdfTreeException e =
        assertThrows(PdfTreeException.class, () -> walk(DocumentFixtures.nextPointerDocument(), config));
    assertEquals("Walk aborted after visiting 2 records", e.getMessage());
  }
}
