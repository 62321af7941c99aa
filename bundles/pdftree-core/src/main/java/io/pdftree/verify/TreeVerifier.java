package io.pdftree.verify;

import io.pdftree.axis.DescendantAxis;
import io.pdftree.axis.IncludeSelf;
import io.pdftree.exception.PdfTreeException;
import io.pdftree.exception.RecordDecodeException;
import io.pdftree.exception.StructuralInvariantException;
import io.pdftree.node.NodeRegistry;
import io.pdftree.node.PdfTreeNode;
import io.pdftree.record.ObjectId;
import io.pdftree.record.PdfNames;
import io.pdftree.record.PdfRecord;
import io.pdftree.record.RecordShape;
import io.pdftree.report.FindingKind;
import io.pdftree.utils.LogWrapper;
import io.pdftree.walk.WalkState;
import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Confirms that the tree accounts for every record: every built node is reachable from the root
 * exactly once, and every declared record that is not in the tree has a known reason.
 */
public final class TreeVerifier {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGGER = new LogWrapper(LoggerFactory.getLogger(TreeVerifier.class));

  /** Trailer keys a cross-reference stream does not repeat. */
  private static final Set<String> XREF_IGNORED_KEYS = Set.of(PdfNames.SIZE, PdfNames.PREV, PdfNames.XREF_STREAM);

  private final WalkState state;

  /**
   * Constructor.
   *
   * @param state the analysis state
   */
  public TreeVerifier(final WalkState state) {
    this.state = requireNonNull(state);
  }

  /**
   * Run both checks.
   *
   * @return the backward check's result
   * @throws PdfTreeException if the backward check would load more than the configured number of
   *         records, or a {@link StructuralInvariantException} if a built node is not reachable from
   *         the root
   */
  public VerificationResult verify() throws PdfTreeException {
    final IntSet reachable = verifyForwardCompleteness();
    return verifyBackwardExplainability(reachable);
  }

  private IntSet verifyForwardCompleteness() throws StructuralInvariantException {
    final NodeRegistry registry = state.getRegistry();
    final IntSet reachable = new IntOpenHashSet();
    final DescendantAxis axis = new DescendantAxis(registry.newCursor(), IncludeSelf.YES);
    while (axis.hasNext()) {
      final int key = axis.nextInt();
      if (!reachable.add(key)) {
        throw new StructuralInvariantException(key, String.format("Node %d is reachable more than once", key));
      }
    }

    final IntList unplaced = new IntArrayList();
    for (final PdfTreeNode node : registry.nodes()) {
      if (!reachable.contains(node.getId())) {
        unplaced.add(node.getId());
      }
    }
    if (!unplaced.isEmpty()) {
      final PdfTreeNode first = requireNonNull(registry.find(unplaced.getInt(0)));
      throw new StructuralInvariantException(first.getId(),
          String.format("Nodes were traversed but never placed: %s", unplaced),
          unplaced.intStream().mapToObj(id -> String.valueOf(registry.find(id))).collect(Collectors.toList()));
    }
    return reachable;
  }

  private VerificationResult verifyBackwardExplainability(final IntSet reachable) throws PdfTreeException {
    final Int2ObjectLinkedOpenHashMap<UnplacedReason> reasons = new Int2ObjectLinkedOpenHashMap<>();
    final OptionalInt declaredSize = state.getDeclaredSize();
    if (declaredSize.isEmpty()) {
      LOGGER.error("{} not found in trailer; cannot verify all nodes are in tree", PdfNames.SIZE);
      return new VerificationResult(false, reasons, new IntArrayList());
    }

    if (state.getMaxGeneration() > 0) {
      LOGGER.warn("Verification doesn't check revisions but this document's generation is {}",
          state.getMaxGeneration());
    }

    final int maxLoaded = state.getConfig().getMaxRecordsVisited();
    int loaded = 0;
    for (int id = 1; id < declaredSize.getAsInt(); id++) {
      if (reachable.contains(id)) {
        continue;
      }
      if (++loaded > maxLoaded) {
        throw new PdfTreeException("Verification aborted after loading %d records", maxLoaded);
      }
      final UnplacedReason reason = classify(id);
      reasons.put(id, reason);
      if (reason == UnplacedReason.UNEXPLAINED) {
        state.getFindings().add(FindingKind.EVIDENCE_WARNING, id, "Record %d is not in the tree and nothing explains why",
            id);
      }
    }

    final IntSortedSet outOfRange = new IntRBTreeSet();
    for (final PdfTreeNode node : state.getRegistry().nodes()) {
      if (node != state.getRoot() && node.getId() >= declaredSize.getAsInt()) {
        outOfRange.add(node.getId());
        LOGGER.warn("{} lies beyond the declared {} {}", node, PdfNames.SIZE, declaredSize.getAsInt());
        state.getFindings().add(FindingKind.EVIDENCE_WARNING, node.getId(),
            "Record %d lies beyond the declared size %d", node.getId(), declaredSize.getAsInt());
      }
    }

    final VerificationResult result = new VerificationResult(true, reasons, new IntArrayList(outOfRange));
    if (!result.wasSuccessful()) {
      LOGGER.warn("All missing node ids: {}", result.getMissingIds());
      LOGGER.warn("Important missing node IDs: {}", result.getNotableIds());
    }
    return result;
  }

  private UnplacedReason classify(final int id) {
    final PdfRecord record;
    try {
      record = state.getSource().getRecord(new ObjectId(id));
    } catch (final RecordDecodeException e) {
      LOGGER.error("Couldn't verify elementary obj with id {} is properly in tree: {}", id, e.getMessage());
      state.getFindings().add(FindingKind.DEGRADED_RECORD, id,
          "Record %d is not in the tree and could not be decoded: %s", id, e.getMessage());
      return UnplacedReason.UNDECODABLE;
    }

    if (record.getShape() == RecordShape.SCALAR) {
      LOGGER.info("Obj {} is a scalar w/value {}; if referenced by /Length etc. this is a nonissue", id,
          record.getScalar());
      return UnplacedReason.SCALAR;
    }
    if (!record.hasDictionary()) {
      LOGGER.warn("Obj {} ({}) isn't a dictionary, cannot determine if it should be in tree", id, record);
      return UnplacedReason.UNEXPLAINED;
    }

    final String type = record.getName(PdfNames.TYPE);
    if (type == null) {
      LOGGER.warn("Obj {} has no {} and is not in tree. Either a loose node w/no data or an error: {}", id,
          PdfNames.TYPE, record);
      return UnplacedReason.UNEXPLAINED;
    }
    if (PdfNames.OBJECT_STREAM.equals(type)) {
      LOGGER.debug("Object with id {} not found in tree because it's an {}", id, PdfNames.OBJECT_STREAM);
      return UnplacedReason.OBJECT_STREAM;
    }
    if (PdfNames.XREF.equals(type) && duplicatesTrailer(record)) {
      LOGGER.info("{} obj {} duplicates the trailer", PdfNames.XREF, id);
      return UnplacedReason.XREF_STREAM;
    }
    LOGGER.warn("{} obj {} not found in tree!", type, id);
    return UnplacedReason.UNEXPLAINED;
  }

  private boolean duplicatesTrailer(final PdfRecord xref) {
    if (!(xref.get(PdfNames.SIZE) instanceof Number)) {
      LOGGER.info("{} has no {}", PdfNames.XREF, PdfNames.SIZE);
      return false;
    }
    for (final Map.Entry<String, Object> entry : state.getSource().getTrailer().getDictionary().entrySet()) {
      if (XREF_IGNORED_KEYS.contains(entry.getKey())) {
        continue;
      }
      final Object xrefValue = xref.get(entry.getKey());
      if (!Objects.equals(entry.getValue(), xrefValue)) {
        LOGGER.info("Trailer has {} -> {} but {} obj has {} at that key", entry.getKey(), entry.getValue(),
            PdfNames.XREF, xrefValue);
        return false;
      }
    }
    return true;
  }
}
