package io.pdftree;

import io.pdftree.record.InMemoryRecordSource;
import io.pdftree.record.ObjectReference;
import io.pdftree.record.PdfNames;
import io.pdftree.record.PdfRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Small in-memory documents shared by the tests.
 */
public final class DocumentFixtures {

  private DocumentFixtures() {
    throw new AssertionError("May never be instantiated!");
  }

  public static ObjectReference ref(final int objectNumber) {
    return ObjectReference.to(objectNumber);
  }

  /**
   * Build a dictionary record from alternating keys and values, keeping their order.
   *
   * @param keysAndValues {@code /Key, value, /Key, value, ...}
   * @return the record
   */
  public static PdfRecord dict(final Object... keysAndValues) {
    return PdfRecord.dictionary(entries(keysAndValues));
  }

  /**
   * Build an ordered map from alternating keys and values.
   *
   * @param keysAndValues {@code /Key, value, /Key, value, ...}
   * @return the map
   */
  public static Map<String, Object> entries(final Object... keysAndValues) {
    checkArgument(keysAndValues.length % 2 == 0, "Odd number of arguments");
    final Map<String, Object> entries = new LinkedHashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      entries.put((String) keysAndValues[i], keysAndValues[i + 1]);
    }
    return entries;
  }

  /**
   * Catalog 1 owns A (2) and B (3); B also points back at A with {@code /Next}.
   *
   * <pre>
   * trailer(4) -- /Root --> 1 -- /Alpha --> 2
   *                           -- /Beta  --> 3 -- /Next --> 2
   * </pre>
   *
   * @return the source
   */
  public static InMemoryRecordSource nextPointerDocument() {
    return InMemoryRecordSource.newBuilder()
                               .trailerEntry(PdfNames.SIZE, 4)
                               .trailerEntry(PdfNames.ROOT, ref(1))
                               .record(1, dict(PdfNames.TYPE, PdfNames.CATALOG, "/Alpha", ref(2), "/Beta", ref(3)))
                               .record(2, dict(PdfNames.TYPE, "/Alpha"))
                               .record(3, dict(PdfNames.TYPE, "/Beta", PdfNames.NEXT, ref(2)))
                               .build();
  }

  /**
   * Font 4 is shared by the page tree 2 and its page 3.
   *
   * @return the source
   */
  public static InMemoryRecordSource commonAncestorDocument() {
    return InMemoryRecordSource.newBuilder()
                               .trailerEntry(PdfNames.SIZE, 5)
                               .trailerEntry(PdfNames.ROOT, ref(1))
                               .record(1, dict(PdfNames.TYPE, PdfNames.CATALOG, PdfNames.PAGES, ref(2)))
                               .record(2, dict(PdfNames.TYPE, PdfNames.PAGES, PdfNames.KIDS, List.of(ref(3)),
                                   PdfNames.FONT, ref(4)))
                               .record(3, dict(PdfNames.TYPE, PdfNames.PAGE, PdfNames.PARENT, ref(2), PdfNames.FONT,
                                   ref(4)))
                               .record(4, dict(PdfNames.TYPE, PdfNames.FONT, PdfNames.SUBTYPE, "/Type1"))
                               .build();
  }

  /**
   * Record 8 is referenced through a different shared resource key by each of the five unrelated
   * siblings 3 to 7 below group 2. With {@code withLeaf} sibling 5 owns leaf 9.
   *
   * @param withLeaf determines if sibling 5 gets a child
   * @return the source
   */
  public static InMemoryRecordSource fiveSiblingsDocument(final boolean withLeaf) {
    final InMemoryRecordSource.Builder builder = InMemoryRecordSource.newBuilder();
    builder.trailerEntry(PdfNames.SIZE, withLeaf ? 10 : 9)
           .trailerEntry(PdfNames.ROOT, ref(1))
           .record(1, dict(PdfNames.TYPE, PdfNames.CATALOG, "/Group", ref(2)))
           .record(2, dict(PdfNames.TYPE, "/Group", "/Members", List.of(ref(3), ref(4), ref(5), ref(6),
               ref(7))))
           .record(3, dict(PdfNames.TYPE, "/Red", PdfNames.COLOR_SPACE, ref(8)))
           .record(4, dict(PdfNames.TYPE, "/Green", PdfNames.EXT_G_STATE, ref(8)))
           .record(6, dict(PdfNames.TYPE, "/Yellow", PdfNames.RESOURCES, ref(8)))
           .record(7, dict(PdfNames.TYPE, "/Purple", PdfNames.XOBJECT, ref(8)))
           .record(8, dict(PdfNames.TYPE, PdfNames.EXT_G_STATE));
    if (withLeaf) {
      builder.record(5, dict(PdfNames.TYPE, "/Blue", PdfNames.FONT, ref(8), "/Leaf", ref(9)))
             .record(9, dict(PdfNames.TYPE, "/Leaf"));
    } else {
      builder.record(5, dict(PdfNames.TYPE, "/Blue", PdfNames.FONT, ref(8)));
    }
    return builder.build();
  }

  /**
   * A small document whose declared size covers records nothing references: an object stream (3),
   * a length scalar (4), an annotation (5) and an undecodable record (6).
   *
   * @return the source
   */
  public static InMemoryRecordSource unreferencedRecordsDocument() {
    return InMemoryRecordSource.newBuilder()
                               .trailerEntry(PdfNames.SIZE, 7)
                               .trailerEntry(PdfNames.ROOT, ref(1))
                               .record(1, dict(PdfNames.TYPE, PdfNames.CATALOG, PdfNames.PAGES, ref(2)))
                               .record(2, dict(PdfNames.TYPE, PdfNames.PAGES, PdfNames.KIDS, List.of()))
                               .record(3, PdfRecord.stream(entries(PdfNames.TYPE, PdfNames.OBJECT_STREAM, "/N", 2),
                                   () -> new byte[] {1, 2, 3}))
                               .record(4, PdfRecord.scalar(812))
                               .record(5, dict(PdfNames.TYPE, "/Annot", PdfNames.SUBTYPE, "/Link"))
                               .undecodable(6, "unexpected end of stream")
                               .build();
  }
}
