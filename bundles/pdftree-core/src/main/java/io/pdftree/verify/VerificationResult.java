package io.pdftree.verify;

import com.google.common.base.MoreObjects;
import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMaps;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Outcome of the backward explainability check.
 */
public final class VerificationResult {

  private final boolean declaredSizeKnown;

  private final Int2ObjectMap<UnplacedReason> reasons;

  /** Records in the tree whose id is not below the declared size. */
  private final IntList outOfRangeIds;

  VerificationResult(final boolean declaredSizeKnown, final Int2ObjectLinkedOpenHashMap<UnplacedReason> reasons,
      final IntList outOfRangeIds) {
    this.declaredSizeKnown = declaredSizeKnown;
    this.reasons = Int2ObjectMaps.unmodifiable(reasons);
    this.outOfRangeIds = IntLists.unmodifiable(outOfRangeIds);
  }

  /**
   * Determines if the document declares its record count. Without it the backward check is skipped.
   *
   * @return {@code true} if the backward check ran
   */
  public boolean isDeclaredSizeKnown() {
    return declaredSizeKnown;
  }

  /**
   * Get the declared ids that are not in the tree, ascending.
   *
   * @return the ids
   */
  public IntList getMissingIds() {
    return IntLists.unmodifiable(new IntArrayList(reasons.keySet()));
  }

  /**
   * Get the reason an id is missing.
   *
   * @param id the object number
   * @return the reason or {@code null} if the id is not missing
   */
  public @Nullable UnplacedReason getReason(final int id) {
    return reasons.get(id);
  }

  /**
   * Get the reasons by id.
   *
   * @return an unmodifiable view
   */
  public Int2ObjectMap<UnplacedReason> getReasons() {
    return reasons;
  }

  /**
   * Get the ids of records that are in the tree although the declared size does not cover them.
   *
   * @return the ids, ascending
   */
  public IntList getOutOfRangeIds() {
    return outOfRangeIds;
  }

  /**
   * Get the missing ids nothing explains.
   *
   * @return the ids, ascending
   */
  public IntList getNotableIds() {
    final IntList notable = new IntArrayList();
    for (final Int2ObjectMap.Entry<UnplacedReason> entry : reasons.int2ObjectEntrySet()) {
      if (!entry.getValue().isExplained()) {
        notable.add(entry.getIntKey());
      }
    }
    return IntLists.unmodifiable(notable);
  }

  /**
   * Determines if every missing id is explained.
   *
   * @return {@code true} if there are no notable ids
   */
  public boolean wasSuccessful() {
    return getNotableIds().isEmpty();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("declaredSizeKnown", declaredSizeKnown)
                      .add("missing", getMissingIds())
                      .add("notable", getNotableIds())
                      .add("outOfRange", outOfRangeIds)
                      .toString();
  }
}
