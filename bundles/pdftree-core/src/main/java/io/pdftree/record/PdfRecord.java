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

import com.google.common.base.MoreObjects;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * One decoded record of a document.
 *
 * <p>
 * Dictionary values (and array elements) are {@link ObjectReference}s, nested {@link Map}s with
 * {@code /Key} strings, nested {@link List}s, {@link String}s (names start with a slash),
 * {@link Number}s, {@link Boolean}s or {@code null}. Dictionaries keep their insertion order, which
 * is the order references are discovered in.
 * </p>
 */
public final class PdfRecord {

  private final RecordShape shape;

  private final @Nullable Map<String, Object> dictionary;

  private final @Nullable List<Object> array;

  private final @Nullable Object scalar;

  private final @Nullable StreamPayload payload;

  private PdfRecord(final RecordShape shape, final @Nullable Map<String, Object> dictionary,
      final @Nullable List<Object> array, final @Nullable Object scalar, final @Nullable StreamPayload payload) {
    this.shape = shape;
    this.dictionary = dictionary;
    this.array = array;
    this.scalar = scalar;
    this.payload = payload;
  }

  /**
   * Create a dictionary record.
   *
   * @param entries the entries, iterated in insertion order
   * @return the record
   */
  public static PdfRecord dictionary(final Map<String, ?> entries) {
    return new PdfRecord(RecordShape.DICTIONARY, Collections.unmodifiableMap(new LinkedHashMap<>(entries)), null,
        null, null);
  }

  /**
   * Create an array record.
   *
   * @param elements the elements, {@code null} elements are allowed
   * @return the record
   */
  public static PdfRecord array(final List<?> elements) {
    return new PdfRecord(RecordShape.ARRAY, null, Collections.unmodifiableList(new ArrayList<>(elements)),
        null, null);
  }

  /**
   * Create a scalar record.
   *
   * @param value number, name, string, boolean or {@code null}
   * @return the record
   */
  public static PdfRecord scalar(final @Nullable Object value) {
    return new PdfRecord(RecordShape.SCALAR, null, null, value, null);
  }

  /**
   * Create a stream record.
   *
   * @param entries the stream dictionary
   * @param payload decoder of the stream bytes
   * @return the record
   */
  public static PdfRecord stream(final Map<String, ?> entries, final StreamPayload payload) {
    return new PdfRecord(RecordShape.STREAM, Collections.unmodifiableMap(new LinkedHashMap<>(entries)), null, null,
        requireNonNull(payload));
  }

  /**
   * Placeholder for a record that could not be decoded: a scalar holding the reference itself, so
   * the node is labelled by its discovery address and contributes no references.
   *
   * @param reference the reference that failed to resolve
   * @return the placeholder
   */
  public static PdfRecord unresolved(final ObjectReference reference) {
    return new PdfRecord(RecordShape.SCALAR, null, null, requireNonNull(reference), null);
  }

  public RecordShape getShape() {
    return shape;
  }

  /**
   * Determines if this record carries a dictionary, that is if it is a dictionary or a stream.
   *
   * @return {@code true} if {@link #getDictionary()} may be called
   */
  public boolean hasDictionary() {
    return dictionary != null;
  }

  /**
   * Get the dictionary of a dictionary or stream record.
   *
   * @return the unmodifiable dictionary
   * @throws IllegalStateException if the record has no dictionary
   */
  public Map<String, Object> getDictionary() {
    checkState(dictionary != null, "%s record has no dictionary", shape);
    return dictionary;
  }

  /**
   * Get a dictionary value.
   *
   * @param key the {@code /Key}
   * @return the value or {@code null} if absent or if this record has no dictionary
   */
  public @Nullable Object get(final String key) {
    return dictionary == null ? null : dictionary.get(key);
  }

  /**
   * Get a dictionary value if it is a name or string.
   *
   * @param key the {@code /Key}
   * @return the value or {@code null}
   */
  public @Nullable String getName(final String key) {
    final Object value = get(key);
    return value instanceof String ? (String) value : null;
  }

  /**
   * Get the elements of an array record.
   *
   * @return the unmodifiable elements
   * @throws IllegalStateException if the record is no array
   */
  public List<Object> getArray() {
    checkState(array != null, "%s record is no array", shape);
    return array;
  }

  public @Nullable Object getScalar() {
    return scalar;
  }

  /**
   * Get the payload of a stream record.
   *
   * @return the payload or {@code null} if the record is no stream
   */
  public @Nullable StreamPayload getPayload() {
    return payload;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .omitNullValues()
                      .add("shape", shape)
                      .add("dictionary", dictionary)
                      .add("array", array)
                      .add("scalar", scalar)
                      .toString();
  }
}
