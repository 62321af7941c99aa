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

package io.pdftree.record;

/**
 * Well known dictionary keys and type names.
 */
public final class PdfNames {

  public static final String TYPE = "/Type";
  public static final String SUBTYPE = "/Subtype";
  public static final String S = "/S";
  public static final String SIZE = "/Size";
  public static final String ROOT = "/Root";
  public static final String PREV = "/Prev";
  public static final String XREF_STREAM = "/XRefStm";

  public static final String PARENT = "/Parent";
  public static final String P = "/P";
  public static final String KIDS = "/Kids";
  public static final String K = "/K";
  public static final String OBJ = "/Obj";
  public static final String NUMS = "/Nums";
  public static final String FIRST = "/First";
  public static final String LAST = "/Last";
  public static final String NEXT = "/Next";
  public static final String D = "/D";
  public static final String DEST = "/Dest";
  public static final String OPEN_ACTION = "/OpenAction";
  public static final String COLOR_SPACE = "/ColorSpace";
  public static final String EXT_G_STATE = "/ExtGState";
  public static final String FONT = "/Font";
  public static final String RESOURCES = "/Resources";
  public static final String XOBJECT = "/XObject";
  public static final String LINEARIZED = "/Linearized";

  public static final String TRAILER = "/Trailer";
  public static final String CATALOG = "/Catalog";
  public static final String PAGE = "/Page";
  public static final String PAGES = "/Pages";
  public static final String STRUCT_ELEM = "/StructElem";
  public static final String OBJR = "/OBJR";
  public static final String OBJECT_STREAM = "/ObjStm";
  public static final String XREF = "/XRef";
  public static final String OUTLINES = "/Outlines";
  public static final String ANNOTS = "/Annots";
  public static final String NAMES = "/Names";
  public static final String DESTS = "/Dests";

  /** Reference key given to elements of a top level array record. */
  public static final String ARRAY_ELEMENT = "/ArrayElement";

  /** Kind of nodes only known through a bare array index. */
  public static final String UNLABELED = "/UnlabeledArrayElement";

  private PdfNames() {
    throw new AssertionError("May never be instantiated!");
  }
}
