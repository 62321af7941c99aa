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
import io.pdftree.exception.RecordDecodeException;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import org.checkerframework.checker.index.qual.NonNegative;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * {@link RecordSource} over records that are already decoded and held in memory.
 */
public final class InMemoryRecordSource implements RecordSource {

  /** Records by object number. */
  private final Int2ObjectMap<PdfRecord> records;

  /** Generation of each record. */
  private final Int2ObjectMap<ObjectId> ids;

  /** Object numbers whose decoding fails. */
  private final Int2ObjectMap<String> failures;

  /** The trailer. */
  private final PdfRecord trailer;

  /** Highest generation. */
  private final int maxGeneration;

  private InMemoryRecordSource(final Builder builder) {
    records = new Int2ObjectOpenHashMap<>(builder.records);
    ids = new Int2ObjectOpenHashMap<>(builder.ids);
    failures = new Int2ObjectOpenHashMap<>(builder.failures);
    trailer = PdfRecord.dictionary(builder.trailer);
    maxGeneration = ids.values().stream().mapToInt(ObjectId::getGenerationNumber).max().orElse(0);
  }

  /**
   * Get a new builder instance.
   *
   * @return {@link Builder} instance
   */
  public static Builder newBuilder() {
    return new Builder();
  }

  @Override
  public PdfRecord getRecord(final ObjectId id) throws RecordDecodeException {
    requireNonNull(id);
    final String failure = failures.get(id.getObjectNumber());
    if (failure != null) {
      throw new RecordDecodeException(failure);
    }
    final PdfRecord record = records.get(id.getObjectNumber());
    if (record == null) {
      throw new RecordDecodeException("No record with id " + id);
    }
    return record;
  }

  @Override
  public PdfRecord getTrailer() {
    return trailer;
  }

  @Override
  public int getMaxGeneration() {
    return maxGeneration;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("records", records.size())
                      .add("failures", failures.size())
                      .add("maxGeneration", maxGeneration)
                      .toString();
  }

  /** Builder. */
  public static final class Builder {

    private final Int2ObjectMap<PdfRecord> records = new Int2ObjectOpenHashMap<>();

    private final Int2ObjectMap<ObjectId> ids = new Int2ObjectOpenHashMap<>();

    private final Int2ObjectMap<String> failures = new Int2ObjectOpenHashMap<>();

    private final Map<String, Object> trailer = new LinkedHashMap<>();

    private Builder() {
    }

    /**
     * Add a trailer entry.
     *
     * @param key   the {@code /Key}
     * @param value the value
     * @return this builder instance
     */
    public Builder trailerEntry(final String key, final Object value) {
      checkArgument(requireNonNull(key).startsWith("/"), "keys start with a slash: %s", key);
      trailer.put(key, value);
      return this;
    }

    /**
     * Add a record of generation 0.
     *
     * @param objectNumber the object number
     * @param record       the record
     * @return this builder instance
     */
    public Builder record(final @NonNegative int objectNumber, final PdfRecord record) {
      return record(new ObjectId(objectNumber), record);
    }

    /**
     * Add a record.
     *
     * @param id     the identifier
     * @param record the record
     * @return this builder instance
     */
    public Builder record(final ObjectId id, final PdfRecord record) {
      checkState(!records.containsKey(id.getObjectNumber()) && !failures.containsKey(id.getObjectNumber()),
          "Duplicate object number %s", id.getObjectNumber());
      records.put(id.getObjectNumber(), requireNonNull(record));
      ids.put(id.getObjectNumber(), id);
      return this;
    }

    /**
     * Declare an object number whose record fails to decode.
     *
     * @param objectNumber the object number
     * @param message      decoder message
     * @return this builder instance
     */
    public Builder undecodable(final @NonNegative int objectNumber, final String message) {
      checkState(!records.containsKey(objectNumber), "Duplicate object number %s", objectNumber);
      failures.put(objectNumber, requireNonNull(message));
      return this;
    }

    /**
     * Build a new instance.
     *
     * @return new instance
     */
    public InMemoryRecordSource build() {
      return new InMemoryRecordSource(this);
    }
  }
}
