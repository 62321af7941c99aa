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

import io.pdftree.exception.RecordDecodeException;

import java.util.OptionalInt;

/**
 * Access to the records of one decoded document. Implementations are supplied by the host that
 * parsed the binary container; the analysis only reads through this interface.
 */
public interface RecordSource {

  /**
   * Resolve an identifier to its record.
   *
   * @param id identifier of the record
   * @return the record, never {@code null}
   * @throws RecordDecodeException if the record exists but cannot be decoded, or does not exist
   */
  PdfRecord getRecord(ObjectId id) throws RecordDecodeException;

  /**
   * Get the trailer, the root record of the document. It carries no identifier of its own.
   *
   * @return the trailer dictionary record
   */
  PdfRecord getTrailer();

  /**
   * Get the record count declared by the trailer's {@code /Size}.
   *
   * @return the declared size, empty if the trailer does not declare one or its value is not a
   *         whole number between {@code 0} and {@link Integer#MAX_VALUE}
   */
  default OptionalInt getDeclaredSize() {
    final Object size = getTrailer().get(PdfNames.SIZE);
    if (!(size instanceof Number)) {
      return OptionalInt.empty();
    }
    final Number number = (Number) size;
    final long value = number.longValue();
    if (value < 0 || value > Integer.MAX_VALUE || value != number.doubleValue()) {
      return OptionalInt.empty();
    }
    return OptionalInt.of((int) value);
  }

  /**
   * Get the highest generation number of any record in the document.
   *
   * @return the maximum generation, {@code 0} for documents without revisions
   */
  int getMaxGeneration();
}
