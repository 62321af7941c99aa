package io.pdftree.api;

import io.pdftree.DocumentFixtures;
import io.pdftree.exception.PdfTreeException;
import io.pdftree.exception.RecordDecodeException;
import io.pdftree.exception.StructuralInvariantException;
import io.pdftree.node.PdfTreeNode;
import io.pdftree.record.InMemoryRecordSource;
import io.pdftree.record.ObjectId;
import io.pdftree.record.PdfNames;
import io.pdftree.record.PdfRecord;
import io.pdftree.record.RecordSource;
import io.pdftree.report.Finding;
import io.pdftree.report.FindingKind;
import io.pdftree.settings.AnalysisConfiguration;
import io.pdftree.summary.TreeJsonSerializer;
import io.pdftree.symlink.SymlinkEdge;
import io.pdftree.verify.UnplacedReason;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.stream.Collectors;

import static io.pdftree.DocumentFixtures.dict;
import static io.pdftree.DocumentFixtures.entries;
import static io.pdftree.DocumentFixtures.ref;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public final class PdfAnalyzerTest {

  private final PdfAnalyzer analyzer = new PdfAnalyzer();

  /**
   * Every node appears once, every node reaches the root through its parents and every id the
   * analysis built is part of the tree.
   */
  private static void assertWellFormed(final PdfTree tree) {
    final IntSet seen = new IntOpenHashSet();
    for (final PdfTreeNode node : tree.levelOrder()) {
      assertTrue(seen.add(node.getId()), "node " + node + " visited twice");
      final List<PdfTreeNode> ancestors = node.ancestors();
      if (node != tree.getRoot()) {
        assertSame(tree.getRoot(), ancestors.get(ancestors.size() - 1));
      }
      assertSame(node, tree.findNode(node.getId()));
    }
    assertEquals(tree.getSummary().getNodeCount(), seen.size());
  }

  @Test
  public void testNextPointerBecomesSymlink() throws PdfTreeException {
    final PdfTree tree = analyzer.analyze(DocumentFixtures.nextPointerDocument());
    assertWellFormed(tree);

    final PdfTreeNode alpha = tree.findNode(2);
    final PdfTreeNode beta = tree.findNode(3);
    assertSame(tree.findNode(1), alpha.getParent());
    assertSame(tree.findNode(1), beta.getParent());
    assertEquals(List.of(new SymlinkEdge(3, 2, PdfNames.NEXT, PdfNames.NEXT)), tree.getSymlinks());
    assertEquals(tree.getSymlinks(), tree.getSymlinksFrom(beta));
    assertTrue(tree.getSymlinksFrom(alpha).isEmpty());
    assertTrue(tree.getFindings().isEmpty());
    assertTrue(tree.getVerification().wasSuccessful());
  }

  @Test
  public void testCommonAncestorOwnsSharedFont() throws PdfTreeException {
    final PdfTree tree = analyzer.analyze(DocumentFixtures.commonAncestorDocument());
    assertWellFormed(tree);

    final PdfTreeNode font = tree.findNode(4);
    assertSame(tree.findNode(2), font.getParent());
    assertEquals("/Font:Type1", font.getLabel());
    assertEquals("/Root/Pages/Font", tree.getTreeAddress(font));
    assertEquals(List.of(new SymlinkEdge(3, 4, PdfNames.FONT, PdfNames.FONT)), tree.getSymlinks());
    assertTrue(tree.getFindings().isEmpty());
  }

  @Test
  public void testFiveSiblingsFallBackToMostDescendants() throws PdfTreeException {
    final PdfTree tree = analyzer.analyze(DocumentFixtures.fiveSiblingsDocument(true));
    assertWellFormed(tree);

    assertSame(tree.findNode(5), tree.findNode(8).getParent());
    final List<Finding> warnings = tree.getFindings()
                                       .stream()
                                       .filter(f -> f.getKind() == FindingKind.EVIDENCE_WARNING)
                                       .collect(Collectors.toList());
    assertEquals(1, warnings.size());
    assertEquals(8, warnings.get(0).getNodeId());
    assertEquals(List.of(3, 4, 6, 7),
        tree.getSymlinks().stream().map(SymlinkEdge::getFromId).collect(Collectors.toList()));
  }

  @Test
  public void testFiveSiblingsTieGoesToLowestId() throws PdfTreeException {
    final PdfTree tree = analyzer.analyze(DocumentFixtures.fiveSiblingsDocument(false));

    assertSame(tree.findNode(3), tree.findNode(8).getParent());
  }

  @Test
  public void testUnreferencedRecords() throws PdfTreeException {
    final PdfTree tree = analyzer.analyze(DocumentFixtures.unreferencedRecordsDocument());
    assertWellFormed(tree);

    assertEquals(UnplacedReason.OBJECT_STREAM, tree.getVerification().getReason(3));
    assertEquals(UnplacedReason.UNEXPLAINED, tree.getVerification().getReason(5));
    assertNull(tree.findNode(5));
    assertFalse(tree.getVerification().wasSuccessful());
    assertTrue(tree.getFindings().contains(new Finding(FindingKind.EVIDENCE_WARNING, 5,
        "Record 5 is not in the tree and nothing explains why")));
    assertTrue(tree.getFindings().contains(new Finding(FindingKind.DEGRADED_RECORD, 6,
        "Record 6 is not in the tree and could not be decoded: unexpected end of stream")));
  }

  @Test
  public void testUnderstatedSizeKeepsRecordVisible() throws PdfTreeException {
    final RecordSource source = InMemoryRecordSource.newBuilder()
                                                    .trailerEntry(PdfNames.SIZE, 3)
                                                    .trailerEntry(PdfNames.ROOT, ref(1))
                                                    .record(1, dict(PdfNames.TYPE, PdfNames.CATALOG, "/Extra", ref(3)))
                                                    .record(3, dict(PdfNames.TYPE, "/Annot"))
                                                    .build();
    final PdfTree tree = analyzer.analyze(source);
    assertWellFormed(tree);

    assertEquals(AnalysisConfiguration.DEFAULT.getTrailerFallbackId(), tree.getRoot().getId());
    final PdfTreeNode annotation = tree.findNode(3);
    assertEquals("/Annot", annotation.getKind());
    assertSame(tree.findNode(1), annotation.getParent());
    assertEquals(List.of(3), new ArrayList<>(tree.getVerification().getOutOfRangeIds()));
    assertTrue(tree.getFindings().contains(new Finding(FindingKind.EVIDENCE_WARNING, 3,
        "Record 3 lies beyond the declared size 3")));
  }

  @Test
  public void testHostileSizeIsBounded() {
    final RecordSource source = InMemoryRecordSource.newBuilder()
                                                    .trailerEntry(PdfNames.SIZE, 2_000_000)
                                                    .trailerEntry(PdfNames.ROOT, ref(1))
                                                    .record(1, dict(PdfNames.TYPE, PdfNames.CATALOG))
                                                    .build();
    final PdfAnalyzer bounded = new PdfAnalyzer(AnalysisConfiguration.newBuilder().maxRecordsVisited(10).build());

    final PdfTreeException e = assertThrows(PdfTreeException.class, () -> bounded.analyze(source));
    assertEquals("Recovery aborted after loading 10 records", e.getMessage());
  }

  @Test
  public void testLostNodesAreRecovered() throws PdfTreeException {
    final RecordSource source = InMemoryRecordSource.newBuilder()
                                                    .trailerEntry(PdfNames.SIZE, 4)
                                                    .trailerEntry(PdfNames.ROOT, ref(1))
                                                    .record(1, dict(PdfNames.TYPE, PdfNames.CATALOG))
                                                    .record(2, dict(PdfNames.LINEARIZED, 1))
                                                    .record(3, dict(PdfNames.TYPE, "/Annot", PdfNames.P, ref(1)))
                                                    .build();

    final PdfTree recovered = analyzer.analyze(source);
    assertWellFormed(recovered);
    assertSame(recovered.getRoot(), recovered.findNode(2).getParent());
    assertSame(recovered.findNode(1), recovered.findNode(3).getParent());
    assertTrue(recovered.getVerification().getMissingIds().isEmpty());

    final PdfTree unrecovered =
        new PdfAnalyzer(AnalysisConfiguration.newBuilder().recoverLostNodes(false).build()).analyze(source);
    assertNull(unrecovered.findNode(2));
    assertEquals(2, unrecovered.getVerification().getNotableIds().size());
  }

  @Test
  public void testDecodeFailuresDegradeGracefully() throws PdfTreeException {
    final RecordSource source = mock(RecordSource.class);
    when(source.getTrailer()).thenReturn(dict(PdfNames.SIZE, 4, PdfNames.ROOT, ref(1)));
    when(source.getDeclaredSize()).thenReturn(OptionalInt.of(4));
    doThrow(new RecordDecodeException("no such object")).when(source).getRecord(any(ObjectId.class));
    doReturn(dict(PdfNames.TYPE, PdfNames.CATALOG, "/Info", ref(2), "/Thumb", ref(3))).when(source)
                                                                                       .getRecord(new ObjectId(1));
    doReturn(PdfRecord.stream(entries(PdfNames.TYPE, "/XObject"), () -> {
      throw new RecordDecodeException("unsupported filter");
    })).when(source).getRecord(new ObjectId(3));

    final PdfTree tree = analyzer.analyze(source);
    assertWellFormed(tree);

    final PdfTreeNode info = tree.findNode(2);
    assertTrue(info.isDegraded());
    assertEquals("/Info", info.getLabel());
    assertEquals(-1, tree.findNode(3).getStreamLength());
    assertEquals(List.of(2, 3), tree.getFindings()
                                    .stream()
                                    .filter(f -> f.getKind() == FindingKind.DEGRADED_RECORD)
                                    .map(Finding::getNodeId)
                                    .collect(Collectors.toList()));
    assertEquals(List.of(tree.findNode(3)), tree.streamNodes());
  }

  @Test
  public void testSecondParentAbortsAnalysis() {
    final RecordSource source = InMemoryRecordSource.newBuilder()
                                                    .trailerEntry(PdfNames.SIZE, 5)
                                                    .trailerEntry(PdfNames.ROOT, ref(1))
                                                    .record(1, dict(PdfNames.TYPE, PdfNames.CATALOG, PdfNames.PAGES,
                                                        ref(2), "/Other", ref(4)))
                                                    .record(2, dict(PdfNames.TYPE, PdfNames.PAGES, PdfNames.KIDS,
                                                        List.of(ref(3))))
                                                    .record(3, dict(PdfNames.TYPE, PdfNames.PAGE, PdfNames.PARENT,
                                                        ref(4)))
                                                    .record(4, dict(PdfNames.TYPE, PdfNames.PAGES))
                                                    .build();

    final StructuralInvariantException e =
        assertThrows(StructuralInvariantException.class, () -> analyzer.analyze(source));
    assertEquals(3, e.getNodeId());
  }

  @Test
  public void testAnalysisIsDeterministic() throws PdfTreeException {
    final TreeJsonSerializer serializer = new TreeJsonSerializer(false);
    final StringWriter first = new StringWriter();
    final StringWriter second = new StringWriter();
    serializer.serialize(analyzer.analyze(DocumentFixtures.fiveSiblingsDocument(true)), first);
    serializer.serialize(analyzer.analyze(DocumentFixtures.fiveSiblingsDocument(true)), second);

    assertEquals(first.toString(), second.toString());
  }

  @Test
  public void testTreeApi() throws PdfTreeException {
    final PdfTree tree = analyzer.analyze(DocumentFixtures.commonAncestorDocument());

    assertEquals(List.of(5, 1, 2, 3, 4), levelOrderIds(tree));
    assertTrue(tree.streamNodes().isEmpty());
    assertNotNull(tree.newCursor());
    assertEquals(5, tree.newCursor().getNodeKey());
    assertNull(tree.findNode(42));
    assertEquals(0, tree.getMaxGeneration());
    assertSame(AnalysisConfiguration.DEFAULT, tree.getConfiguration());
  }

  private static List<Integer> levelOrderIds(final PdfTree tree) {
    final List<Integer> ids = new ArrayList<>();
    tree.levelOrder().forEach(node -> ids.add(node.getId()));
    return ids;
  }
}
