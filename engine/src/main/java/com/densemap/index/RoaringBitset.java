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
import org.roaringbitmap.longlong.Roaring64NavigableMap;

import java.io.DataOutput;
import java.io.IOException;

/**
 * Bitset backed by a {@link Roaring64NavigableMap}, that answers select queries natively. Denser than Elias-Fano on long runs of set
 * bits, slower on select. The select output is left empty.
 */
public class RoaringBitset implements SuccinctBitset {
  private final long                  size;
  private final Roaring64NavigableMap bitmap;

  RoaringBitset(final long size, final Roaring64NavigableMap bitmap) {
    this.size = size;
    this.bitmap = bitmap;
  }

  @Override
  public long size() {
    return size;
  }

  @Override
  public long cardinality() {
    return bitmap.getLongCardinality();
  }

  @Override
  public long select(final long rank) {
    if (rank < 0 || rank >= bitmap.getLongCardinality())
      throw new KeyOutOfRangeException("Rank " + rank + " is outside the range [0, " + bitmap.getLongCardinality() + ")");
    return bitmap.select(rank);
  }

  @Override
  public BitsetEncoding getEncoding() {
    return BitsetEncoding.ROARING;
  }

  @Override
  public void serialize(final DataOutput bitsetOut, final DataOutput selectOut) throws IOException {
    bitsetOut.writeLong(size);
    bitmap.serialize(bitsetOut);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof RoaringBitset))
      return false;
    final RoaringBitset that = (RoaringBitset) o;
    return size == that.size && bitmap.equals(that.bitmap);
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(size) + bitmap.hashCode();
  }

  @Override
  public String toString() {
    return "RoaringBitset{size=" + size + ", ones=" + bitmap.getLongCardinality() + "}";
  }
}
