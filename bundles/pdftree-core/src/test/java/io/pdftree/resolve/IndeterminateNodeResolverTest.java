package io.pdftree.resolve;

import io.pdftree.DocumentFixtures;
import io.pdftree.exception.PdfTreeException;
import io.pdftree.exception.StructuralInvariantException;
import io.pdftree.node.NodeRegistry;
import io.pdftree.node.NonTreeRelationship;
import io.pdftree.node.PdfTreeNode;
import io.pdftree.record.InMemoryRecordSource;
import io.pdftree.record.PdfNames;
import io.pdftree.record.RecordSource;
import io.pdftree.report.Finding;
import io.pdftree.report.FindingKind;
import io.pdftree.report.Findings;
import io.pdftree.settings.AnalysisConfiguration;
import io.pdftree.walk.GraphWalker;
import io.pdftree.walk.WalkState;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.pdftree.DocumentFixtures.dict;
import static io.pdftree.DocumentFixtures.ref;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class IndeterminateNodeResolverTest {

  private WalkState state;

  private NodeRegistry registry;

  private PdfTreeNode root;

  /**
   * Set up a state holding the given records, with the trailer registered as node 20.
   */
  private void setUp(final InMemoryRecordSource.Builder records) {
    state = new WalkState(records.trailerEntry(PdfNames.SIZE, 20).build(), AnalysisConfiguration.DEFAULT,
        new Findings());
    registry = state.getRegistry();
    root = registry.registerTrailer(20);
  }

  private PdfTreeNode node(final int id, final String address) {
    return registry.buildOrFind(ref(id), address);
  }

  private static void refer(final PdfTreeNode source, final String key, final String address,
      final PdfTreeNode target) {
    target.addNonTreeRelationship(new NonTreeRelationship(source.getId(), key, address, target.getId()));
  }

  private IndeterminateNodeResolver walkAndResolve(final RecordSource source) throws PdfTreeException {
    state = new WalkState(source, AnalysisConfiguration.DEFAULT, new Findings());
    new GraphWalker(state).walk();
    final IndeterminateNodeResolver resolver = new IndeterminateNodeResolver(state);
    resolver.resolveAll();
    return resolver;
  }

  @Test
  public void testCommonAncestor() throws PdfTreeException {
    final IndeterminateNodeResolver resolver = walkAndResolve(DocumentFixtures.commonAncestorDocument());

    assertSame(state.getRegistry().find(2), state.getRegistry().find(4).getParent());
    assertTrue(state.getPendingIds().isEmpty());
    assertEquals(Map.of(PlacementRule.COMMON_ANCESTOR, 1), resolver.getRuleCounts());
    assertTrue(state.getFindings().snapshot().isEmpty());
  }

  @Test
  public void testWeakFallbackPrefersMostDescendants() throws PdfTreeException {
    final IndeterminateNodeResolver resolver = walkAndResolve(DocumentFixtures.fiveSiblingsDocument(true));

    assertSame(state.getRegistry().find(5), state.getRegistry().find(8).getParent());
    assertEquals(Map.of(PlacementRule.WEAK_MOST_DESCENDANTS, 1), resolver.getRuleCounts());
    final List<Finding> warnings = state.getFindings().ofKind(FindingKind.EVIDENCE_WARNING);
    assertEquals(1, warnings.size());
    assertEquals(8, warnings.get(0).getNodeId());
  }

  @Test
  public void testWeakFallbackTieGoesToLowestId() throws PdfTreeException {
    walkAndResolve(DocumentFixtures.fiveSiblingsDocument(false));

    assertSame(state.getRegistry().find(3), state.getRegistry().find(8).getParent());
  }

  @Test
  public void testNodeWithParentIsSkipped() throws PdfTreeException {
    final RecordSource source = InMemoryRecordSource.newBuilder()
                                                    .trailerEntry(PdfNames.SIZE, 4)
                                                    .trailerEntry(PdfNames.ROOT, ref(1))
                                                    .record(1, dict(PdfNames.TYPE, PdfNames.CATALOG, PdfNames.PAGES,
                                                        ref(2), PdfNames.OPEN_ACTION, ref(3)))
                                                    .record(2, dict(PdfNames.TYPE, PdfNames.PAGES))
                                                    .record(3, dict(PdfNames.TYPE, PdfNames.PAGE, PdfNames.PARENT,
                                                        ref(2)))
                                                    .build();
    final IndeterminateNodeResolver resolver = walkAndResolve(source);

    assertTrue(resolver.getRuleCounts().isEmpty());
    assertTrue(state.getPendingIds().isEmpty());
    assertSame(state.getRegistry().find(2), state.getRegistry().find(3).getParent());
  }

  @Test
  public void testSingleCandidate() throws StructuralInvariantException {
    setUp(InMemoryRecordSource.newBuilder()
                              .record(1, dict(PdfNames.TYPE, PdfNames.CATALOG))
                              .record(2, dict("/Title", "Intro"))
                              .record(3, dict(PdfNames.TYPE, PdfNames.PAGE))
                              .record(4, dict(PdfNames.TYPE, PdfNames.XOBJECT)));
    final PdfTreeNode catalog = node(1, PdfNames.ROOT);
    final PdfTreeNode outlineItem = node(2, PdfNames.FIRST);
    final PdfTreeNode page = node(3, "/Page");
    final PdfTreeNode image = node(4, "/Im0");
    root.addChild(catalog);
    catalog.addChild(outlineItem);
    catalog.addChild(page);
    refer(outlineItem, "/Foo", "/Foo", image);
    refer(page, PdfNames.XOBJECT, "/XObject[/Im0]", image);

    assertEquals(PlacementRule.SINGLE_CANDIDATE, new IndeterminateNodeResolver(state).place(image));
    assertSame(page, image.getParent());
  }

  @Test
  public void testResourcesContainer() throws StructuralInvariantException {
    setUp(InMemoryRecordSource.newBuilder()
                              .record(1, dict(PdfNames.TYPE, PdfNames.CATALOG))
                              .record(2, dict(PdfNames.TYPE, PdfNames.PAGES))
                              .record(3, dict(PdfNames.TYPE, PdfNames.PAGE))
                              .record(5, dict(PdfNames.FONT, ref(9)))
                              .record(6, dict(PdfNames.TYPE, "/Annot")));
    final PdfTreeNode catalog = node(1, PdfNames.ROOT);
    final PdfTreeNode pages = node(2, PdfNames.PAGES);
    final PdfTreeNode page = node(3, "/Kids[0]");
    final PdfTreeNode annotation = node(6, "/Annot");
    final PdfTreeNode resources = node(5, PdfNames.RESOURCES);
    root.addChild(catalog);
    catalog.addChild(pages);
    pages.addChild(page);
    catalog.addChild(annotation);
    refer(pages, PdfNames.RESOURCES, PdfNames.RESOURCES, resources);
    refer(page, PdfNames.RESOURCES, PdfNames.RESOURCES, resources);
    refer(annotation, "/AP", "/AP[/N]", resources);

    assertEquals(PlacementRule.RESOURCES_CONTAINER, new IndeterminateNodeResolver(state).place(resources));
    assertSame(pages, resources.getParent());
  }

  @Test
  public void testPagesEscapeHatch() throws StructuralInvariantException {
    setUp(InMemoryRecordSource.newBuilder()
                              .record(1, dict(PdfNames.TYPE, PdfNames.CATALOG))
                              .record(2, dict(PdfNames.TYPE, PdfNames.PAGES))
                              .record(3, dict(PdfNames.TYPE, PdfNames.PAGES))
                              .record(4, dict(PdfNames.TYPE, PdfNames.PAGE))
                              .record(9, dict(PdfNames.TYPE, PdfNames.PAGE)));
    final PdfTreeNode catalog = node(1, PdfNames.ROOT);
    final PdfTreeNode firstPages = node(2, PdfNames.PAGES);
    final PdfTreeNode secondPages = node(3, "/Pages2");
    final PdfTreeNode page = node(4, "/Kids[0]");
    final PdfTreeNode loose = node(9, "/Ab");
    root.addChild(catalog);
    catalog.addChild(firstPages);
    catalog.addChild(secondPages);
    secondPages.addChild(page);
    refer(firstPages, "/Ab", "/Ab", loose);
    refer(secondPages, "/Cde", "/Cde", loose);
    refer(page, "/Fghi", "/Fghi", loose);

    assertEquals(PlacementRule.PAGES_ESCAPE_HATCH, new IndeterminateNodeResolver(state).place(loose));
    assertSame(secondPages, loose.getParent());
    assertEquals(9, state.getFindings().ofKind(FindingKind.EVIDENCE_WARNING).get(0).getNodeId());
  }

  @Test
  public void testSimilarAddressesJustifyMostDescendants() throws StructuralInvariantException {
    setUp(InMemoryRecordSource.newBuilder()
                              .record(1, dict(PdfNames.TYPE, PdfNames.CATALOG))
                              .record(2, dict(PdfNames.TYPE, "/Red"))
                              .record(3, dict(PdfNames.TYPE, "/Green"))
                              .record(4, dict(PdfNames.TYPE, "/Leaf"))
                              .record(5, dict(PdfNames.TYPE, PdfNames.XOBJECT)));
    final PdfTreeNode catalog = node(1, PdfNames.ROOT);
    final PdfTreeNode red = node(2, "/Red");
    final PdfTreeNode green = node(3, "/Green");
    final PdfTreeNode image = node(5, "/XObject[/Im1]");
    root.addChild(catalog);
    catalog.addChild(red);
    catalog.addChild(green);
    green.addChild(node(4, "/Leaf"));
    refer(red, PdfNames.XOBJECT, "/XObject[/Im1]", image);
    refer(green, PdfNames.XOBJECT, "/XObject[/Im2]", image);

    assertEquals(PlacementRule.JUSTIFIED_MOST_DESCENDANTS, new IndeterminateNodeResolver(state).place(image));
    assertSame(green, image.getParent());
    assertTrue(state.getFindings().snapshot().isEmpty());
  }

  @Test
  public void testColorSpaceJustifiesMostDescendants() throws StructuralInvariantException {
    setUp(InMemoryRecordSource.newBuilder()
                              .record(1, dict(PdfNames.TYPE, PdfNames.CATALOG))
                              .record(2, dict(PdfNames.TYPE, "/Red"))
                              .record(3, dict(PdfNames.TYPE, "/Green"))
                              .record(5, dict(PdfNames.TYPE, PdfNames.COLOR_SPACE)));
    final PdfTreeNode catalog = node(1, PdfNames.ROOT);
    final PdfTreeNode red = node(2, "/Red");
    final PdfTreeNode green = node(3, "/Green");
    final PdfTreeNode colorSpace = node(5, "/Ab");
    root.addChild(catalog);
    catalog.addChild(red);
    catalog.addChild(green);
    refer(green, "/Ab", "/Ab", colorSpace);
    refer(red, "/Cde", "/Cde", colorSpace);

    assertEquals(PlacementRule.JUSTIFIED_MOST_DESCENDANTS, new IndeterminateNodeResolver(state).place(colorSpace));
    assertSame(red, colorSpace.getParent());
  }

  @Test
  public void testNoReferrers() throws StructuralInvariantException {
    setUp(InMemoryRecordSource.newBuilder()
                              .record(7, dict(PdfNames.TYPE, PdfNames.FONT))
                              .record(8, dict(PdfNames.TYPE, "/FontDescriptor")));
    final PdfTreeNode font = node(7, PdfNames.FONT);
    final PdfTreeNode descriptor = node(8, "/FontDescriptor");
    font.addChild(descriptor);
    refer(descriptor, PdfNames.FONT, PdfNames.FONT, font);

    final StructuralInvariantException e = assertThrows(StructuralInvariantException.class,
        () -> new IndeterminateNodeResolver(state).place(font));
    assertEquals(7, e.getNodeId());
    assertEquals(1, e.getDiagnostics().size());
  }

  @Test
  public void testFindNodeWithMostDescendants() throws StructuralInvariantException {
    setUp(InMemoryRecordSource.newBuilder()
                              .record(3, dict())
                              .record(4, dict())
                              .record(5, dict())
                              .record(6, dict()));
    final PdfTreeNode three = node(3, "/A");
    final PdfTreeNode four = node(4, "/B");
    final PdfTreeNode five = node(5, "/C");

    assertSame(three, IndeterminateNodeResolver.findNodeWithMostDescendants(List.of(five, three, four)));

    five.addChild(node(6, "/D"));
    assertSame(five, IndeterminateNodeResolver.findNodeWithMostDescendants(List.of(three, four, five)));
  }
}
