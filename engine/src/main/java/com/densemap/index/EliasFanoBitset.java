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

import com.densemap.exception.KeyOutOfRangeException;

import java.io.DataOutput;
import java.io.IOException;
import java.util.Arrays;

/**
 * Elias-Fano encoding of the set positions of a sparse bitvector. Each position is split in `lowBits` low bits, stored packed, and a
 * high part stored in unary in the upper bitvector: the i-th position sets the bit (high + i). The whole structure takes about
 * 2 + log2(size / ones) bits per set bit.
 * <p>
 * Select support samples the upper bitvector position of one every `sampling` set bits. A query jumps to the closest sample and counts
 * the remaining set bits word by word with {@link Long#bitCount(long)}.
 */
public class EliasFanoBitset implements SuccinctBitset {
  private final long   size;
  private final long   ones;
  private final int    lowBits;
  private final long[] low;
  private final long   upperBits;
  private final long[] upper;
  private final int    sampling;
  private final long[] samples;

  EliasFanoBitset(final long size, final long ones, final int lowBits, final long[] low, final long upperBits, final long[] upper,
      final int sampling, final long[] samples) {
    this.size = size;
    this.ones = ones;
    this.lowBits = lowBits;
    this.low = low;
    this.upperBits = upperBits;
    this.upper = upper;
    this.sampling = sampling;
    this.samples = samples;
  }

  static int computeLowBits(final long size, final long ones) {
    if (ones == 0 || size <= ones)
      return 0;
    return 63 - Long.numberOfLeadingZeros(size / ones);
  }

  static long computeUpperBits(final long size, final long ones, final int lowBits) {
    if (size == 0)
      return 1;
    return ones + ((size - 1) >>> lowBits) + 1;
  }

  static int computeSamples(final long ones, final int sampling) {
    return (int) ((ones + sampling - 1) / sampling);
  }

  /**
   * Builds the select samples scanning the upper bitvector once.
   */
  static long[] buildSamples(final long[] upper, final long ones, final int sampling) {
    final long[] samples = new long[computeSamples(ones, sampling)];
    long i = 0;
    for (int w = 0; w < upper.length && i < ones; w++) {
      long word = upper[w];
      while (word != 0) {
        if (i % sampling == 0)
          samples[(int) (i / sampling)] = ((long) w << 6) + Long.numberOfTrailingZeros(word);
        ++i;
        word &= word - 1;
      }
    }
    return samples;
  }

  @Override
  public long size() {
    return size;
  }

  @Override
  public long cardinality() {
    return ones;
  }

  @Override
  public long select(final long rank) {
    if (rank < 0 || rank >= ones)
      throw new KeyOutOfRangeException("Rank " + rank + " is outside the range [0, " + ones + ")");

    final long high = selectUpper(rank) - rank;
    return (high << lowBits) | PackedBits.read(low, rank * lowBits, lowBits);
  }

  private long selectUpper(final long rank) {
    final long sample = samples[(int) (rank / sampling)];
    int target = (int) (rank % sampling);
    if (target == 0)
      return sample;

    // LOOK FOR THE (target - 1)-TH SET BIT AFTER THE SAMPLE
    --target;
    final long from = sample + 1;
    int w = (int) (from >>> 6);
    long word = upper[w] & (-1L << (from & 63));
    while (true) {
      final int count = Long.bitCount(word);
      if (target < count)
        return ((long) w << 6) + PackedBits.selectInWord(word, target);
      target -= count;
      word = upper[++w];
    }
  }

  @Override
  public BitsetEncoding getEncoding() {
    return BitsetEncoding.ELIAS_FANO;
  }

  @Override
  public void serialize(final DataOutput bitsetOut, final DataOutput selectOut) throws IOException {
    bitsetOut.writeLong(size);
    bitsetOut.writeLong(ones);
    bitsetOut.writeInt(lowBits);
    writeWords(bitsetOut, low);
    bitsetOut.writeLong(upperBits);
    writeWords(bitsetOut, upper);

    selectOut.writeInt(sampling);
    writeWords(selectOut, samples);
  }

  public int getLowBits() {
    return lowBits;
  }

  public int getSampling() {
    return sampling;
  }

  private static void writeWords(final DataOutput out, final long[] words) throws IOException {
    out.writeInt(words.length);
    for (final long w : words)
      out.writeLong(w);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof EliasFanoBitset))
      return false;
    final EliasFanoBitset that = (EliasFanoBitset) o;
    return size == that.size && ones == that.ones && lowBits == that.lowBits && Arrays.equals(low, that.low) && Arrays.equals(upper,
        that.upper);
  }

  @Override
  public int hashCode() {
    int result = Long.hashCode(size);
    result = 31 * result + Long.hashCode(ones);
    result = 31 * result + Arrays.hashCode(low);
    result = 31 * result + Arrays.hashCode(upper);
    return result;
  }

  @Override
  public String toString() {
    return "EliasFanoBitset{size=" + size + ", ones=" + ones + ", lowBits=" + lowBits + ", sampling=" + sampling + "}";
  }
}
