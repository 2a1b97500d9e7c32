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

import com.densemap.exception.InvariantViolationException;
import com.densemap.exception.StorageException;

import java.io.IOException;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Read-write memory mapping of a record file, split in regions holding a whole number of records so that no record straddles two
 * mappings. Files larger than 2GB are mapped with multiple regions.
 */
public class MappedRecordBuffer implements AutoCloseable {
  private final Path               path;
  private final int                recordWidth;
  private final long               recordCount;
  private final long               recordsPerRegion;
  private final MappedByteBuffer[] regions;
  private       FileChannel        channel;

  public MappedRecordBuffer(final Path path, final int recordWidth, final long maxRegionSize) {
    this.path = path;
    this.recordWidth = recordWidth;
    this.recordsPerRegion = Math.max(1, Math.min(maxRegionSize, Integer.MAX_VALUE) / recordWidth);

    try {
      this.channel = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE);
      final long size = channel.size();
      if (size % recordWidth != 0)
        throw new InvariantViolationException(
            "File '" + path + "' has size " + size + " that is not a multiple of the record width " + recordWidth);

      this.recordCount = size / recordWidth;
      final int totalRegions = (int) ((recordCount + recordsPerRegion - 1) / recordsPerRegion);
      this.regions = new MappedByteBuffer[totalRegions];
      for (int i = 0; i < totalRegions; i++) {
        final long firstRecord = i * recordsPerRegion;
        final long records = Math.min(recordsPerRegion, recordCount - firstRecord);
        regions[i] = channel.map(FileChannel.MapMode.READ_WRITE, firstRecord * recordWidth, records * recordWidth);
      }
    } catch (final IOException e) {
      closeChannel();
      throw new StorageException("Error on mapping file '" + path + "' in memory", e);
    } catch (final RuntimeException e) {
      closeChannel();
      throw e;
    }
  }

  public long getRecordCount() {
    return recordCount;
  }

  public int getRecordWidth() {
    return recordWidth;
  }

  public byte getByte(final long record, final int byteIndex) {
    return regions[(int) (record / recordsPerRegion)].get(offsetOf(record) + byteIndex);
  }

  public void get(final long record, final byte[] target) {
    regions[(int) (record / recordsPerRegion)].get(offsetOf(record), target, 0, recordWidth);
  }

  public void put(final long record, final byte[] source) {
    regions[(int) (record / recordsPerRegion)].put(offsetOf(record), source, 0, recordWidth);
  }

  /**
   * Compares the key bytes in the range [fromByte, keyWidth) of two records as unsigned values.
   */
  public int compareKeys(final long a, final long b, final int fromByte, final int keyWidth) {
    final MappedByteBuffer regionA = regions[(int) (a / recordsPerRegion)];
    final MappedByteBuffer regionB = regions[(int) (b / recordsPerRegion)];
    final int offsetA = offsetOf(a);
    final int offsetB = offsetOf(b);
    for (int i = fromByte; i < keyWidth; i++) {
      final int cmp = (regionA.get(offsetA + i) & 0xFF) - (regionB.get(offsetB + i) & 0xFF);
      if (cmp != 0)
        return cmp;
    }
    return 0;
  }

  /**
   * Swaps the content of two records using the two scratch arrays, each at least one record wide.
   */
  public void swap(final long a, final long b, final byte[] scratchA, final byte[] scratchB) {
    if (a == b)
      return;
    get(a, scratchA);
    get(b, scratchB);
    put(a, scratchB);
    put(b, scratchA);
  }

  public void force() {
    for (final MappedByteBuffer region : regions)
      region.force();
  }

  @Override
  public void close() {
    try {
      force();
    } finally {
      closeChannel();
    }
  }

  private int offsetOf(final long record) {
    return (int) (record % recordsPerRegion) * recordWidth;
  }

  private void closeChannel() {
    if (channel == null)
      return;
    try {
      channel.close();
    } catch (final IOException e) {
      throw new StorageException("Error on closing file '" + path + "'", e);
    } finally {
      channel = null;
    }
  }
}
