package io.pdftree.verify;

/**
 * Why a declared record is not part of the tree.
 */
public enum UnplacedReason {
  /** An object stream; its members are inlined elsewhere. */
  OBJECT_STREAM(true),

  /** A cross-reference stream duplicating the trailer. */
  XREF_STREAM(true),

  /** A number, name, boolean or null, typically referenced by {@code /Length} and friends. */
  SCALAR(true),

  /** The record could not be decoded. */
  UNDECODABLE(false),

  /** Nothing explains the absence; worth an analyst's attention. */
  UNEXPLAINED(false);

  private final boolean explained;

  UnplacedReason(final boolean explained) {
    this.explained = explained;
  }

  public boolean isExplained() {
    return explained;
  }
}
