package io.pdftree.resolve;

import io.pdftree.exception.PdfTreeException;
import io.pdftree.exception.StructuralInvariantException;
import io.pdftree.node.NodeRegistry;
import io.pdftree.node.PdfTreeNode;
import io.pdftree.record.InMemoryRecordSource;
import io.pdftree.record.ObjectId;
import io.pdftree.record.PdfNames;
import io.pdftree.record.PdfRecord;
import io.pdftree.record.RecordSource;
import io.pdftree.report.Findings;
import io.pdftree.settings.AnalysisConfiguration;
import io.pdftree.walk.WalkState;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.pdftree.DocumentFixtures.dict;
import static io.pdftree.DocumentFixtures.entries;
import static io.pdftree.DocumentFixtures.ref;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Tree before recovery: trailer 12, catalog 1, pages 2, page 3 and color space 4 below the page.
 * Records 5 to 11 are lost.
 */
public final class LostNodeRecoveryTest {

  private WalkState state;

  private NodeRegistry registry;

  private PdfTreeNode root;

  private PdfTreeNode catalog;

  private PdfTreeNode page;

  private PdfTreeNode colorSpace;

  @BeforeEach
  public void setUp() throws StructuralInvariantException {
    final InMemoryRecordSource source =
        InMemoryRecordSource.newBuilder()
                            .trailerEntry(PdfNames.SIZE, 12)
                            .trailerEntry(PdfNames.ROOT, ref(1))
                            .record(1, dict(PdfNames.TYPE, PdfNames.CATALOG, PdfNames.PAGES, ref(2)))
                            .record(2, dict(PdfNames.TYPE, PdfNames.PAGES, PdfNames.KIDS, List.of(ref(3))))
                            .record(3, dict(PdfNames.TYPE, PdfNames.PAGE, PdfNames.COLOR_SPACE, ref(4)))
                            .record(4, dict(PdfNames.TYPE, PdfNames.COLOR_SPACE))
                            .record(5, dict(PdfNames.LINEARIZED, 1, "/L", 48_213))
                            .record(6, dict(PdfNames.TYPE, "/Annot", PdfNames.P, ref(3)))
                            .record(7, dict(PdfNames.TYPE, "/Pattern", PdfNames.COLOR_SPACE, ref(4)))
                            .record(8, PdfRecord.stream(entries(PdfNames.TYPE, PdfNames.XREF, PdfNames.ROOT, ref(1)),
                                () -> new byte[0]))
                            .record(9, dict(PdfNames.TYPE, "/Annot", PdfNames.P, ref(11)))
                            .record(10, PdfRecord.scalar(612))
                            .record(11, dict(PdfNames.TYPE, PdfNames.PAGES, PdfNames.KIDS, List.of()))
                            .build();
    state = new WalkState(source, AnalysisConfiguration.DEFAULT, new Findings());
    registry = state.getRegistry();
    root = registry.registerTrailer(12);
    catalog = registry.buildOrFind(ref(1), PdfNames.ROOT);
    final PdfTreeNode pages = registry.buildOrFind(ref(2), PdfNames.PAGES);
    page = registry.buildOrFind(ref(3), "/Kids[0]");
    colorSpace = registry.buildOrFind(ref(4), PdfNames.COLOR_SPACE);
    root.addChild(catalog);
    catalog.addChild(pages);
    pages.addChild(page);
    page.addChild(colorSpace);
  }

  @Test
  public void testRecover() throws PdfTreeException {
    final IntList placed = new LostNodeRecovery(state).recover();

    assertEquals(IntArrayList.wrap(new int[] {5, 6, 7, 8}), placed);

    final PdfTreeNode linearized = registry.find(5);
    assertSame(root, linearized.getParent());
    assertEquals(PdfNames.LINEARIZED, linearized.getLabel());
    assertSame(page, registry.find(6).getParent());
    assertEquals("/P(arent)", registry.find(6).getFirstAddress());
    assertSame(colorSpace, registry.find(7).getParent());
    assertSame(catalog, registry.find(8).getParent());
    assertNull(registry.find(9));
    assertNull(registry.find(10));
    assertNull(registry.find(11));
  }

  @Test
  public void testOrphanPagesGoUnderCatalog() throws PdfTreeException {
    final PdfTreeNode orphan = registry.buildOrFind(ref(11), PdfNames.PAGES);

    final IntList placed = new LostNodeRecovery(state).recover();

    assertSame(catalog, orphan.getParent());
    assertEquals(11, placed.getInt(placed.size() - 1));
  }

  @Test
  public void testRecoveryIsBounded() throws PdfTreeException {
    final RecordSource source = spy(InMemoryRecordSource.newBuilder()
                                                        .trailerEntry(PdfNames.SIZE, 2_000_000)
                                                        .trailerEntry(PdfNames.ROOT, ref(1))
                                                        .record(1, dict(PdfNames.TYPE, PdfNames.CATALOG))
                                                        .build());
    final WalkState bounded =
        new WalkState(source, AnalysisConfiguration.newBuilder().maxRecordsVisited(10).build(), new Findings());
    final PdfTreeNode trailer = bounded.getRegistry().registerTrailer(2_000_000);
    trailer.addChild(bounded.getRegistry().buildOrFind(ref(1), PdfNames.ROOT));

    final PdfTreeException e = assertThrows(PdfTreeException.class, () -> new LostNodeRecovery(bounded).recover());
    assertEquals("Recovery aborted after loading 10 records", e.getMessage());
    // The catalog plus ten lost records.
    verify(source, times(11)).getRecord(any(ObjectId.class));
  }
}
