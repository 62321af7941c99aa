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

package io.pdftree.settings;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.pdftree.exception.PdfTreeException;
import org.checkerframework.checker.index.qual.NonNegative;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Settings of one analysis run. Instances are immutable, use {@link #newBuilder()}.
 */
public final class AnalysisConfiguration {

  /** Default maximum length of tree addresses. */
  public static final int DEFAULT_MAX_ADDRESS_LENGTH = 90;

  /** Default record count above which a slow walk is announced. */
  public static final int DEFAULT_NODE_COUNT_WARN_THRESHOLD = 10_000;

  /** Default missing id count above which a slow recovery is announced. */
  public static final int DEFAULT_MISSING_NODE_WARN_THRESHOLD = 200;

  /** Configuration with every default. */
  public static final AnalysisConfiguration DEFAULT = newBuilder().build();

  private final int maxAddressLength;

  private final int nodeCountWarnThreshold;

  private final int missingNodeWarnThreshold;

  private final int trailerFallbackId;

  private final int maxRecordsVisited;

  private final boolean recoverLostNodes;

  private AnalysisConfiguration(final Builder builder) {
    maxAddressLength = builder.maxAddressLength;
    nodeCountWarnThreshold = builder.nodeCountWarnThreshold;
    missingNodeWarnThreshold = builder.missingNodeWarnThreshold;
    trailerFallbackId = builder.trailerFallbackId;
    maxRecordsVisited = builder.maxRecordsVisited;
    recoverLostNodes = builder.recoverLostNodes;
  }

  /**
   * Get a new builder instance.
   *
   * @return {@link Builder} instance
   */
  public static Builder newBuilder() {
    return new Builder();
  }

  public int getMaxAddressLength() {
    return maxAddressLength;
  }

  public int getNodeCountWarnThreshold() {
    return nodeCountWarnThreshold;
  }

  public int getMissingNodeWarnThreshold() {
    return missingNodeWarnThreshold;
  }

  public int getTrailerFallbackId() {
    return trailerFallbackId;
  }

  /**
   * Get the maximum number of records the walker may visit before giving up.
   *
   * @return the bound, {@link Integer#MAX_VALUE} if unbounded
   */
  public int getMaxRecordsVisited() {
    return maxRecordsVisited;
  }

  public boolean isRecoverLostNodes() {
    return recoverLostNodes;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof AnalysisConfiguration)) {
      return false;
    }
    final AnalysisConfiguration other = (AnalysisConfiguration) obj;
    return maxAddressLength == other.maxAddressLength && nodeCountWarnThreshold == other.nodeCountWarnThreshold
        && missingNodeWarnThreshold == other.missingNodeWarnThreshold && trailerFallbackId == other.trailerFallbackId
        && maxRecordsVisited == other.maxRecordsVisited && recoverLostNodes == other.recoverLostNodes;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(maxAddressLength, nodeCountWarnThreshold, missingNodeWarnThreshold, trailerFallbackId,
        maxRecordsVisited, recoverLostNodes);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("maxAddressLength", maxAddressLength)
                      .add("nodeCountWarnThreshold", nodeCountWarnThreshold)
                      .add("missingNodeWarnThreshold", missingNodeWarnThreshold)
                      .add("trailerFallbackId", trailerFallbackId)
                      .add("maxRecordsVisited", maxRecordsVisited)
                      .add("recoverLostNodes", recoverLostNodes)
                      .toString();
  }

  /**
   * Serializing a {@link AnalysisConfiguration} as json.
   *
   * @param config to be serialized
   * @param writer where the json goes, left open
   * @throws PdfTreeException if an I/O error occurs
   */
  public static void serialize(final AnalysisConfiguration config, final Writer writer) throws PdfTreeException {
    try {
      final JsonWriter jsonWriter = new JsonWriter(writer);
      jsonWriter.beginObject();
      jsonWriter.name("maxAddressLength").value(config.maxAddressLength);
      jsonWriter.name("nodeCountWarnThreshold").value(config.nodeCountWarnThreshold);
      jsonWriter.name("missingNodeWarnThreshold").value(config.missingNodeWarnThreshold);
      jsonWriter.name("trailerFallbackId").value(config.trailerFallbackId);
      jsonWriter.name("maxRecordsVisited").value(config.maxRecordsVisited);
      jsonWriter.name("recoverLostNodes").value(config.recoverLostNodes);
      jsonWriter.endObject();
      jsonWriter.flush();
    } catch (final IOException e) {
      throw new PdfTreeException(e);
    }
  }

  /**
   * Generate a {@link AnalysisConfiguration} out of json. Absent names keep their defaults.
   *
   * @param reader where the json comes from
   * @return a new configuration
   * @throws PdfTreeException if an I/O error occurs or the json holds an unknown name
   */
  public static AnalysisConfiguration deserialize(final Reader reader) throws PdfTreeException {
    final Builder builder = newBuilder();
    try {
      final JsonReader jsonReader = new JsonReader(reader);
      jsonReader.beginObject();
      while (jsonReader.hasNext()) {
        final String name = jsonReader.nextName();
        switch (name) {
          case "maxAddressLength":
            builder.maxAddressLength(jsonReader.nextInt());
            break;
          case "nodeCountWarnThreshold":
            builder.nodeCountWarnThreshold(jsonReader.nextInt());
            break;
          case "missingNodeWarnThreshold":
            builder.missingNodeWarnThreshold(jsonReader.nextInt());
            break;
          case "trailerFallbackId":
            builder.trailerFallbackId(jsonReader.nextInt());
            break;
          case "maxRecordsVisited":
            builder.maxRecordsVisited(jsonReader.nextInt());
            break;
          case "recoverLostNodes":
            builder.recoverLostNodes(jsonReader.nextBoolean());
            break;
          default:
            throw new PdfTreeException("Unknown configuration name: %s", name);
        }
      }
      jsonReader.endObject();
    } catch (final IOException | IllegalStateException e) {
      throw new PdfTreeException(e);
    }
    return builder.build();
  }

  /** Builder. */
  public static final class Builder {

    private int maxAddressLength = DEFAULT_MAX_ADDRESS_LENGTH;

    private int nodeCountWarnThreshold = DEFAULT_NODE_COUNT_WARN_THRESHOLD;

    private int missingNodeWarnThreshold = DEFAULT_MISSING_NODE_WARN_THRESHOLD;

    private int trailerFallbackId = Fixed.TRAILER_FALLBACK_ID.getStandardProperty();

    private int maxRecordsVisited = Integer.MAX_VALUE;

    private boolean recoverLostNodes = true;

    private Builder() {
    }

    /**
     * Maximum length of the addresses returned by {@code getTreeAddress()}.
     *
     * @param maxAddressLength the maximum, at least 4
     * @return this builder instance
     */
    public Builder maxAddressLength(final @NonNegative int maxAddressLength) {
      checkArgument(maxAddressLength > 3, "maxAddressLength must be > 3!");
      this.maxAddressLength = maxAddressLength;
      return this;
    }

    public Builder nodeCountWarnThreshold(final @NonNegative int nodeCountWarnThreshold) {
      checkArgument(nodeCountWarnThreshold >= 0, "nodeCountWarnThreshold must be >= 0!");
      this.nodeCountWarnThreshold = nodeCountWarnThreshold;
      return this;
    }

    public Builder missingNodeWarnThreshold(final @NonNegative int missingNodeWarnThreshold) {
      checkArgument(missingNodeWarnThreshold >= 0, "missingNodeWarnThreshold must be >= 0!");
      this.missingNodeWarnThreshold = missingNodeWarnThreshold;
      return this;
    }

    public Builder trailerFallbackId(final @NonNegative int trailerFallbackId) {
      checkArgument(trailerFallbackId >= 0, "trailerFallbackId must be >= 0!");
      this.trailerFallbackId = trailerFallbackId;
      return this;
    }

    /**
     * Bound the walk. Exceeding the bound aborts the analysis.
     *
     * @param maxRecordsVisited maximum number of records to visit
     * @return this builder instance
     */
    public Builder maxRecordsVisited(final @NonNegative int maxRecordsVisited) {
      checkArgument(maxRecordsVisited > 0, "maxRecordsVisited must be > 0!");
      this.maxRecordsVisited = maxRecordsVisited;
      return this;
    }

    public Builder recoverLostNodes(final boolean recoverLostNodes) {
      this.recoverLostNodes = recoverLostNodes;
      return this;
    }

    /**
     * Build a new instance.
     *
     * @return new instance
     */
    public AnalysisConfiguration build() {
      return new AnalysisConfiguration(this);
    }
  }
}
