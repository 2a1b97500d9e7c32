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
package com.densemap.engine.sort;

import com.densemap.log.LogManager;
import com.densemap.utility.FileUtils;

import java.nio.file.Path;
import java.util.logging.Level;

/**
 * In-place most-significant-digit radix sort (American flag sort) over a memory mapped record file. Each level distributes the records
 * of a partition in buckets by one byte of the key prefix, then recurses on the next byte.
 * <p>
 * Partitions with less than `cutOff` records are finished with insertion sort. Bytes outside [charStart, charStop] fall in the first or
 * last bucket; such buckets, and partitions reached after `stackSize` levels, are finished with heap sort from the current byte, so the
 * result is always fully ordered whatever the tuning.
 */
public class RadixRecordSorter implements RecordSorter {
  public static final String NAME = "radix";

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public void sortByKeyPrefix(final Path file, final int recordWidth, final int keyWidth, final SortOptions options) {
    if (keyWidth < 1 || keyWidth > recordWidth)
      throw new IllegalArgumentException("Invalid key width " + keyWidth + " for records of " + recordWidth + " bytes");

    final long begin = System.nanoTime();
    try (final MappedRecordBuffer buffer = new MappedRecordBuffer(file, recordWidth, options.getMappingChunkSize())) {
      final SortRun run = new SortRun(buffer, keyWidth, options);
      run.sort(0, buffer.getRecordCount(), 0);

      LogManager.instance()
          .log(this, Level.FINE, "Radix sorted %d records of file %s in %s", buffer.getRecordCount(), file.getFileName(),
              FileUtils.elapsedMillis(begin));
    }
  }

  private static class SortRun {
    private final MappedRecordBuffer buffer;
    private final int                keyWidth;
    private final int                charStart;
    private final int                charStop;
    private final int                buckets;
    private final int                stackSize;
    private final int                cutOff;
    private final byte[]             scratchA;
    private final byte[]             scratchB;

    SortRun(final MappedRecordBuffer buffer, final int keyWidth, final SortOptions options) {
      this.buffer = buffer;
      this.keyWidth = keyWidth;
      this.charStart = options.getCharStart();
      this.charStop = options.getCharStop();
      this.buckets = charStop - charStart + 1;
      this.stackSize = options.getStackSize();
      this.cutOff = options.getCutOff();
      this.scratchA = new byte[buffer.getRecordWidth()];
      this.scratchB = new byte[buffer.getRecordWidth()];
    }

    void sort(final long from, final long to, final int digit) {
      final long count = to - from;
      if (count < 2 || digit >= keyWidth)
        return;

      if (count < cutOff) {
        insertionSort(from, to, digit);
        return;
      }

      if (digit >= stackSize) {
        heapSort(from, to, digit);
        return;
      }

      final long[] counts = new long[buckets];
      boolean lowClamped = false;
      boolean highClamped = false;
      for (long r = from; r < to; ++r) {
        final int b = buffer.getByte(r, digit) & 0xFF;
        if (b < charStart)
          lowClamped = true;
        else if (b > charStop)
          highClamped = true;
        ++counts[bucketOf(b)];
      }

      final long[] heads = new long[buckets];
      final long[] tails = new long[buckets];
      long next = from;
      for (int i = 0; i < buckets; i++) {
        heads[i] = next;
        next += counts[i];
        tails[i] = next;
      }

      // PERMUTE IN PLACE: EVERY SWAP MOVES ONE RECORD INTO ITS FINAL BUCKET
      for (int i = 0; i < buckets; i++) {
        while (heads[i] < tails[i]) {
          final int b = bucketOf(buffer.getByte(heads[i], digit) & 0xFF);
          if (b == i)
            ++heads[i];
          else {
            buffer.swap(heads[i], heads[b], scratchA, scratchB);
            ++heads[b];
          }
        }
      }

      long start = from;
      for (int i = 0; i < buckets; i++) {
        final long end = start + counts[i];
        if (counts[i] > 1) {
          if ((i == 0 && lowClamped) || (i == buckets - 1 && highClamped))
            // THE BUCKET MIXES DIFFERENT BYTES AT THIS DIGIT
            heapSort(start, end, digit);
          else
            sort(start, end, digit + 1);
        }
        start = end;
      }
    }

    private int bucketOf(final int b) {
      if (b <= charStart)
        return 0;
      if (b >= charStop)
        return buckets - 1;
      return b - charStart;
    }

    private void insertionSort(final long from, final long to, final int digit) {
      for (long i = from + 1; i < to; ++i)
        for (long j = i; j > from && buffer.compareKeys(j - 1, j, digit, keyWidth) > 0; --j)
          buffer.swap(j - 1, j, scratchA, scratchB);
    }

    private void heapSort(final long from, final long to, final int digit) {
      final long n = to - from;
      for (long i = n / 2 - 1; i >= 0; --i)
        siftDown(from, i, n, digit);

      for (long end = n - 1; end > 0; --end) {
        buffer.swap(from, from + end, scratchA, scratchB);
        siftDown(from, 0, end, digit);
      }
    }

    private void siftDown(final long base, long root, final long size, final int digit) {
      while (true) {
        long child = 2 * root + 1;
        if (child >= size)
          return;
        if (child + 1 < size && buffer.compareKeys(base + child, base + child + 1, digit, keyWidth) < 0)
          ++child;
        if (buffer.compareKeys(base + root, base + child, digit, keyWidth) >= 0)
          return;
        buffer.swap(base + root, base + child, scratchA, scratchB);
        root = child;
      }
    }
  }
}
