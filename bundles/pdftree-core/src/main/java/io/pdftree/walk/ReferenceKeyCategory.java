/*
 * Copyright (c) 2024, PdfTree Contributors
 *
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *     * Redistributions of source code must retain the above copyright
 *       notice, this list of conditions and the following disclaimer.
 *     * Redistributions in binary form must reproduce the above copyright
 *       notice, this list of conditions and the following disclaimer in the
 *       documentation and/or other materials provided with the distribution.
 *     * Neither the name of the <organization> nor the
 *       names of its contributors may be used to endorse or promote products
 *       derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
 * ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
 * WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
 * DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
 * DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
 * (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
 * LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
 * ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
 * SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.pdftree.walk;

import com.google.common.collect.ImmutableSet;
import io.pdftree.node.PdfTreeNode;
import io.pdftree.record.PdfNames;
import io.pdftree.utils.AddressStrings;

/**
 * What a reference key says about ownership of the referenced record.
 */
public enum ReferenceKeyCategory {
  /** The referenced record is the parent of the referring one. */
  PARENT_POINTER,

  /** The referenced record is a child of the referring one. */
  CHILD_LIST,

  /** Navigation or administrative link that never confers ownership. */
  LINK,

  /** Shared resources whose owner can only be decided once the whole graph is known. */
  INDETERMINATE,

  /** Everything else. */
  ORDINARY;

  /** Keys that never confer ownership. */
  public static final ImmutableSet<String> LINK_KEYS = ImmutableSet.of(PdfNames.NEXT, PdfNames.PREV, PdfNames.LAST,
      PdfNames.FIRST, PdfNames.D, PdfNames.DEST, PdfNames.OPEN_ACTION);

  /** Labels of records whose references are all links. */
  public static final ImmutableSet<String> LINK_NODE_LABELS = ImmutableSet.of(PdfNames.OUTLINES, PdfNames.ANNOTS,
      PdfNames.NUMS, PdfNames.NAMES, PdfNames.DESTS);

  /** Keys of shared resources. */
  public static final ImmutableSet<String> INDETERMINATE_KEYS = ImmutableSet.of(PdfNames.COLOR_SPACE, PdfNames.DEST,
      PdfNames.EXT_G_STATE, PdfNames.FONT, PdfNames.OPEN_ACTION, PdfNames.RESOURCES, PdfNames.XOBJECT,
      PdfNames.ARRAY_ELEMENT, PdfNames.UNLABELED);

  /**
   * Categorize the key of a reference. The source node's kind matters for structure element and
   * object reference aliases, its label for link containers.
   *
   * @param referenceKey the top level key
   * @param source       the referring node
   * @return the category
   */
  public static ReferenceKeyCategory of(final String referenceKey, final PdfTreeNode source) {
    final String sourceKind = source.getKind();
    if (PdfNames.PARENT.equals(referenceKey)
        || (PdfNames.STRUCT_ELEM.equals(sourceKind) && PdfNames.P.equals(referenceKey))) {
      return PARENT_POINTER;
    }
    if (PdfNames.KIDS.equals(referenceKey) || (PdfNames.STRUCT_ELEM.equals(sourceKind)
        && PdfNames.K.equals(referenceKey)) || (PdfNames.OBJR.equals(sourceKind) && PdfNames.OBJ.equals(referenceKey))) {
      return CHILD_LIST;
    }
    if (LINK_KEYS.contains(referenceKey) || AddressStrings.isPrefixedByAny(source.getLabel(), LINK_NODE_LABELS)) {
      return LINK;
    }
    if (INDETERMINATE_KEYS.contains(referenceKey)) {
      return INDETERMINATE;
    }
    return ORDINARY;
  }
}
