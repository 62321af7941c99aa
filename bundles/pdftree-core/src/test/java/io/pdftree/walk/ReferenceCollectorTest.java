package io.pdftree.walk;

import io.pdftree.node.NodeRegistry;
import io.pdftree.node.PdfTreeNode;
import io.pdftree.record.InMemoryRecordSource;
import io.pdftree.record.PdfNames;
import io.pdftree.record.PdfRecord;
import io.pdftree.report.Findings;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static io.pdftree.DocumentFixtures.dict;
import static io.pdftree.DocumentFixtures.entries;
import static io.pdftree.DocumentFixtures.ref;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class ReferenceCollectorTest {

  private static PdfTreeNode node(final PdfRecord record) {
    final NodeRegistry registry =
        new NodeRegistry(InMemoryRecordSource.newBuilder().record(1, record).build(), new Findings());
    return registry.buildOrFind(ref(1), "/Test");
  }

  private static List<String> describe(final List<DiscoveredReference> references) {
    return references.stream()
                     .map(r -> r.getReferenceKey() + " " + r.getAddress() + " -> " + r.getTargetId())
                     .collect(Collectors.toList());
  }

  @Test
  public void testDictionary() {
    final PdfTreeNode page = node(dict(PdfNames.TYPE, PdfNames.PAGE,
        PdfNames.PARENT, ref(2),
        PdfNames.RESOURCES, entries(PdfNames.FONT, entries("/F1", ref(5), "/F2", ref(6))),
        PdfNames.ANNOTS, Arrays.asList(ref(7), 8, null, ref(9))));

    assertEquals(List.of("/Parent /Parent -> 2",
        "/Resources /Resources[/Font][/F1] -> 5",
        "/Resources /Resources[/Font][/F2] -> 6",
        "/Annots /Annots[0] -> 7",
        "/Annots /Annots[3] -> 9"), describe(ReferenceCollector.collect(page)));
  }

  @Test
  public void testTopLevelArray() {
    final PdfTreeNode array = node(PdfRecord.array(List.of(ref(3), 5, List.of(ref(4)))));

    assertEquals(List.of("/ArrayElement [0] -> 3", "/ArrayElement [2][0] -> 4"),
        describe(ReferenceCollector.collect(array)));
  }

  @Test
  public void testScalarHasNoReferences() {
    assertTrue(ReferenceCollector.collect(node(PdfRecord.scalar(ref(3)))).isEmpty());
  }

  @Test
  public void testNumberTreeIsReadAsDictionary() {
    final PdfTreeNode numberTree = node(dict(PdfNames.NUMS, List.of(0, ref(10), 4, ref(11))));

    assertEquals(List.of("/Nums /Nums[0] -> 10", "/Nums /Nums[4] -> 11"),
        describe(ReferenceCollector.collect(numberTree)));
  }

  @Test
  public void testMalformedNumberTreeIsReadAsArray() {
    final PdfTreeNode odd = node(dict(PdfNames.NUMS, List.of(0, ref(10), 4)));
    final PdfTreeNode named = node(dict(PdfNames.NUMS, List.of("/A", ref(10))));

    assertEquals(List.of("/Nums /Nums[1] -> 10"), describe(ReferenceCollector.collect(odd)));
    assertEquals(List.of("/Nums /Nums[1] -> 10"), describe(ReferenceCollector.collect(named)));
  }

  @Test
  public void testToNonTreeRelationship() {
    final PdfTreeNode source = node(dict(PdfNames.FONT, ref(4)));
    final DiscoveredReference reference = ReferenceCollector.collect(source).get(0);

    assertEquals("/Font", reference.toNonTreeRelationship().getAddress());
    assertEquals(1, reference.toNonTreeRelationship().getSourceId());
    assertEquals(4, reference.toNonTreeRelationship().getTargetId());
  }
}
