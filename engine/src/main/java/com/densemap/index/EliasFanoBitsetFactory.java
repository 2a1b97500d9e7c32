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

import com.densemap.exception.FormatMismatchException;

import java.io.DataInput;
import java.io.IOException;

public class EliasFanoBitsetFactory implements SuccinctBitsetFactory {
  private final int sampling;

  public EliasFanoBitsetFactory(final int sampling) {
    if (sampling < 1)
      throw new IllegalArgumentException("Invalid select sampling " + sampling);
    this.sampling = sampling;
  }

  @Override
  public BitsetEncoding getEncoding() {
    return BitsetEncoding.ELIAS_FANO;
  }

  @Override
  public SuccinctBitset.Builder newBuilder(final long size, final long ones) {
    return new Builder(size, ones, sampling);
  }

  @Override
  public SuccinctBitset deserialize(final DataInput bitsetIn, final DataInput selectIn) throws IOException {
    final long size = bitsetIn.readLong();
    final long ones = bitsetIn.readLong();
    if (size < 0 || ones < 0 || ones > size)
      throw new FormatMismatchException("Invalid Elias-Fano bitset with " + ones + " set bits over " + size + " bits");

    final int lowBits = bitsetIn.readInt();
    if (lowBits != EliasFanoBitset.computeLowBits(size, ones))
      throw new FormatMismatchException("Invalid Elias-Fano low bits " + lowBits);

    final long[] low = readWords(bitsetIn, PackedBits.wordsFor(ones * lowBits), "low bits");

    final long upperBits = bitsetIn.readLong();
    if (upperBits != EliasFanoBitset.computeUpperBits(size, ones, lowBits))
      throw new FormatMismatchException("Invalid Elias-Fano upper bitvector length " + upperBits);
    final long[] upper = readWords(bitsetIn, PackedBits.wordsFor(upperBits), "upper bits");

    final int selectSampling = selectIn.readInt();
    if (selectSampling < 1)
      throw new FormatMismatchException("Invalid Elias-Fano select sampling " + selectSampling);
    final long[] samples = readWords(selectIn, EliasFanoBitset.computeSamples(ones, selectSampling), "select samples");

    return new EliasFanoBitset(size, ones, lowBits, low, upperBits, upper, selectSampling, samples);
  }

  private static long[] readWords(final DataInput in, final int expected, final String section) throws IOException {
    final int length = in.readInt();
    if (length != expected)
      throw new FormatMismatchException("Invalid Elias-Fano " + section + " length " + length + " (expected " + expected + ")");

    final long[] words = new long[length];
    for (int i = 0; i < length; i++)
      words[i] = in.readLong();
    return words;
  }

  static class Builder implements SuccinctBitset.Builder {
    private final long   size;
    private final long   ones;
    private final int    sampling;
    private final int    lowBits;
    private final long   upperBits;
    private final long[] low;
    private final long[] upper;
    private       long   added = 0;
    private       long   last  = -1;

    Builder(final long size, final long ones, final int sampling) {
      if (size < 0 || ones < 0 || ones > size)
        throw new IllegalArgumentException("Cannot build a bitset with " + ones + " set bits over " + size + " bits");

      this.size = size;
      this.ones = ones;
      this.sampling = sampling;
      this.lowBits = EliasFanoBitset.computeLowBits(size, ones);
      this.upperBits = EliasFanoBitset.computeUpperBits(size, ones, lowBits);
      this.low = new long[PackedBits.wordsFor(ones * lowBits)];
      this.upper = new long[PackedBits.wordsFor(upperBits)];
    }

    @Override
    public Builder add(final long position) {
      if (position <= last || position >= size)
        throw new IllegalArgumentException("Position " + position + " is not ascending or is outside [0, " + size + ")");
      if (added >= ones)
        throw new IllegalStateException("Bitset already contains the declared " + ones + " set bits");

      PackedBits.write(low, added * lowBits, lowBits, position);
      PackedBits.set(upper, (position >>> lowBits) + added);
      last = position;
      ++added;
      return this;
    }

    @Override
    public EliasFanoBitset build() {
      if (added != ones)
        throw new IllegalStateException("Bitset declared " + ones + " set bits but " + added + " were added");

      return new EliasFanoBitset(size, ones, lowBits, low, upperBits, upper, sampling,
          EliasFanoBitset.buildSamples(upper, ones, sampling));
    }
  }
}
