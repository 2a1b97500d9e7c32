/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.densemap.index;

/**
 * Reads and writes fixed-width unsigned integers packed in a long array, least significant bit first. A value can span two words.
 */
final class PackedBits {
  private PackedBits() {
  }

  static int wordsFor(final long bits) {
    final long words = (bits + 63) >>> 6;
    if (words > Integer.MAX_VALUE - 8)
      throw new IllegalArgumentException("Cannot allocate a bit array of " + bits + " bits");
    return (int) words;
  }

  static void write(final long[] words, final long bitOffset, final int width, final long value) {
    if (width == 0)
      return;

    final int word = (int) (bitOffset >>> 6);
    final int shift = (int) (bitOffset & 63);
    final long masked = width == 64 ? value : value & ((1L << width) - 1);

    words[word] |= masked << shift;
    if (shift + width > 64)
      words[word + 1] |= masked >>> (64 - shift);
  }

  static long read(final long[] words, final long bitOffset, final int width) {
    if (width == 0)
      return 0;

    final int word = (int) (bitOffset >>> 6);
    final int shift = (int) (bitOffset & 63);
    long value = words[word] >>> shift;
    if (shift + width > 64)
      value |= words[word + 1] << (64 - shift);
    return width == 64 ? value : value & ((1L << width) - 1);
  }

  static void set(final long[] words, final long bit) {
    words[(int) (bit >>> 6)] |= 1L << (bit & 63);
  }

  /**
   * Position of the n-th set bit (0-based) of the word.
   */
  static int selectInWord(long word, int n) {
    while (n-- > 0)
      word &= word - 1;
    return Long.numberOfTrailingZeros(word);
  }
}
