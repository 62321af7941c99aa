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

package io.pdftree.utils;

import java.util.Collection;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * String helpers for reference addresses such as {@code /Resources[/Font][/F1]}.
 */
public final class AddressStrings {

  private static final Pattern DIGITS = Pattern.compile("\\d");

  private AddressStrings() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Strip the bracketed part off an address, e.g. {@code /Root[1]} becomes {@code /Root}.
   *
   * @param address the address
   * @return the part before the first opening bracket
   */
  public static String rootAddress(final String address) {
    final int bracket = requireNonNull(address).indexOf('[');
    return bracket < 0 ? address : address.substring(0, bracket);
  }

  /**
   * Surround a key or index with brackets.
   *
   * @param keyOrIndex key or index
   * @return {@code [keyOrIndex]}
   */
  public static String bracketed(final Object keyOrIndex) {
    return "[" + keyOrIndex + "]";
  }

  /**
   * Determines if a string starts with any of the given prefixes.
   *
   * @param string   the string to check
   * @param prefixes candidate prefixes
   * @return {@code true} if one of the prefixes matches
   */
  public static boolean isPrefixedByAny(final String string, final Collection<String> prefixes) {
    for (final String prefix : prefixes) {
      if (string.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Determines if all strings are the same once every digit is replaced by {@code x}.
   *
   * @param strings the strings to compare
   * @return {@code true} if exactly one distinct pattern remains
   */
  public static boolean allSameIgnoringNumbers(final Collection<String> strings) {
    return strings.stream().map(s -> DIGITS.matcher(s).replaceAll("x")).distinct().count() == 1;
  }

  /**
   * Determines if every string is contained in all strings of the collection that are longer than
   * itself.
   *
   * @param strings the strings to compare
   * @return {@code true} if the strings share a common substring in that sense
   */
  public static boolean haveCommonSubstring(final Collection<String> strings) {
    for (final String string : strings) {
      for (final String other : strings) {
        if (other.length() > string.length() && !other.contains(string)) {
          return false;
        }
      }
    }
    return true;
  }
}
