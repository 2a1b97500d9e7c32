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
import org.roaringbitmap.longlong.Roaring64NavigableMap;

import java.io.DataInput;
import java.io.IOException;

public class RoaringBitsetFactory implements SuccinctBitsetFactory {
  @Override
  public BitsetEncoding getEncoding() {
    return BitsetEncoding.ROARING;
  }

  @Override
  public SuccinctBitset.Builder newBuilder(final long size, final long ones) {
    if (size < 0 || ones < 0 || ones > size)
      throw new IllegalArgumentException("Cannot build a bitset with " + ones + " set bits over " + size + " bits");

    return new SuccinctBitset.Builder() {
      private final Roaring64NavigableMap bitmap = new Roaring64NavigableMap();
      private       long                  last   = -1;

      @Override
      public SuccinctBitset.Builder add(final long position) {
        if (position <= last || position >= size)
          throw new IllegalArgumentException("Position " + position + " is not ascending or is outside [0, " + size + ")");
        bitmap.addLong(position);
        last = position;
        return this;
      }

      @Override
      public SuccinctBitset build() {
        if (bitmap.getLongCardinality() != ones)
          throw new IllegalStateException("Bitset declared " + ones + " set bits but " + bitmap.getLongCardinality() + " were added");
        bitmap.runOptimize();
        return new RoaringBitset(size, bitmap);
      }
    };
  }

  @Override
  public SuccinctBitset deserialize(final DataInput bitsetIn, final DataInput selectIn) throws IOException {
    final long size = bitsetIn.readLong();
    final Roaring64NavigableMap bitmap = new Roaring64NavigableMap();
    try {
      bitmap.deserialize(bitsetIn);
    } catch (final IOException | RuntimeException e) {
      throw new FormatMismatchException("Corrupt roaring bitset of " + size + " bits", e);
    }

    if (size < 0 || bitmap.getLongCardinality() > size || (!bitmap.isEmpty() && bitmap.getReverseLongIterator().next() >= size))
      throw new FormatMismatchException("Invalid roaring bitset with " + bitmap.getLongCardinality() + " set bits over " + size + " bits");

    return new RoaringBitset(size, bitmap);
  }
}
