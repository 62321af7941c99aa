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

import io.pdftree.node.PdfTreeNode;
import io.pdftree.record.ObjectReference;
import io.pdftree.record.PdfNames;
import io.pdftree.record.PdfRecord;
import io.pdftree.utils.AddressStrings;
import io.pdftree.utils.LogWrapper;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Enumerates every reference a node's record holds, directly or nested in arrays and dictionaries,
 * in record order.
 *
 * <p>
 * Dictionary references are keyed by the top level key; nested keys and indices are appended to
 * the address in brackets. References in a top level array are keyed {@code /ArrayElement} with
 * addresses like {@code [2]}. Number tree {@code /Nums} arrays of even length with integer keys are
 * read as dictionaries.
 * </p>
 */
public final class ReferenceCollector {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGGER = new LogWrapper(LoggerFactory.getLogger(ReferenceCollector.class));

  private ReferenceCollector() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Collect the references of a node's record.
   *
   * @param node the node
   * @return the references in record order
   */
  public static List<DiscoveredReference> collect(final PdfTreeNode node) {
    final List<DiscoveredReference> references = new ArrayList<>();
    final PdfRecord record = node.getRecord();
    switch (record.getShape()) {
      case DICTIONARY:
      case STREAM:
        for (final Map.Entry<String, Object> entry : record.getDictionary().entrySet()) {
          final Object value = coerceNums(entry.getKey(), entry.getValue());
          visit(node, value, entry.getKey(), entry.getKey(), references);
        }
        break;
      case ARRAY:
        final List<Object> elements = record.getArray();
        for (int i = 0; i < elements.size(); i++) {
          visit(node, elements.get(i), PdfNames.ARRAY_ELEMENT, AddressStrings.bracketed(i), references);
        }
        break;
      case SCALAR:
      default:
        // Scalars, including placeholders of undecodable records, hold no references.
    }
    return references;
  }

  private static void visit(final PdfTreeNode node, final @Nullable Object value, final String referenceKey,
      final String address, final List<DiscoveredReference> references) {
    if (value instanceof ObjectReference) {
      references.add(new DiscoveredReference(node, referenceKey, address, (ObjectReference) value));
    } else if (value instanceof List) {
      final List<?> list = (List<?>) value;
      for (int i = 0; i < list.size(); i++) {
        visit(node, list.get(i), referenceKey, address + AddressStrings.bracketed(i), references);
      }
    } else if (value instanceof Map) {
      for (final Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        final String key = String.valueOf(entry.getKey());
        visit(node, coerceNums(key, entry.getValue()), referenceKey, address + AddressStrings.bracketed(key),
            references);
      }
    }
  }

  /**
   * Number trees are dictionary-like pairs in an array, e.g. {@code [0 objA 1 objB 4 objC]}.
   */
  private static @Nullable Object coerceNums(final String key, final @Nullable Object value) {
    if (!PdfNames.NUMS.equals(key) || !(value instanceof List)) {
      return value;
    }
    final List<?> nums = (List<?>) value;
    if (nums.size() % 2 != 0) {
      LOGGER.warn("Bad number tree, odd number of elements: {}", nums);
      return value;
    }
    final Map<String, Object> numsDict = new LinkedHashMap<>();
    for (int i = 0; i < nums.size(); i += 2) {
      final Object numKey = nums.get(i);
      if (!(numKey instanceof Integer || numKey instanceof Long)) {
        LOGGER.warn("Bad number tree, key {} is no integer: {}", numKey, nums);
        return value;
      }
      numsDict.put(numKey.toString(), nums.get(i + 1));
    }
    LOGGER.debug("Coerced /Nums list to a dict with {} keys", numsDict.size());
    return numsDict;
  }
}
