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

import com.densemap.exception.ConfigurationException;
import com.densemap.exception.InvariantViolationException;
import com.densemap.exception.StorageException;
import com.densemap.log.LogManager;
import com.densemap.utility.FileUtils;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.logging.Level;

/**
 * Loads all the records in RAM, sorts them with {@link Arrays#sort(Object[], java.util.Comparator)} by unsigned key prefix and writes
 * them back. Useful as a reference and for small files only: the whole file must fit in the heap. Ignores the tuning options.
 */
public class ComparisonRecordSorter implements RecordSorter {
  public static final String NAME = "comparison";

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public void sortByKeyPrefix(final Path file, final int recordWidth, final int keyWidth, final SortOptions options) {
    if (keyWidth < 1 || keyWidth > recordWidth)
      throw new IllegalArgumentException("Invalid key width " + keyWidth + " for records of " + recordWidth + " bytes");

    final long begin = System.nanoTime();
    try (final FileChannel channel = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
      final long size = channel.size();
      if (size % recordWidth != 0)
        throw new InvariantViolationException(
            "File '" + file + "' has size " + size + " that is not a multiple of the record width " + recordWidth);

      final long count = size / recordWidth;
      if (count > Integer.MAX_VALUE)
        throw new ConfigurationException(
            "File '" + file + "' has " + count + " records, too many for the '" + NAME + "' sort algorithm. Use '" + RadixRecordSorter.NAME
                + "'");

      final byte[][] records = new byte[(int) count][];
      final ByteBuffer buffer = ByteBuffer.allocate(recordWidth);
      for (int i = 0; i < records.length; i++) {
        buffer.clear();
        readFully(channel, buffer, (long) i * recordWidth, file);
        records[i] = buffer.array().clone();
      }

      Arrays.sort(records, (a, b) -> Arrays.compareUnsigned(a, 0, keyWidth, b, 0, keyWidth));

      for (int i = 0; i < records.length; i++) {
        final ByteBuffer out = ByteBuffer.wrap(records[i]);
        long position = (long) i * recordWidth;
        while (out.hasRemaining())
          position += channel.write(out, position);
      }
      channel.force(false);

      LogManager.instance()
          .log(this, Level.FINE, "Sorted %d records of file %s in memory in %s", count, file.getFileName(), FileUtils.elapsedMillis(begin));

    } catch (final IOException e) {
      throw new StorageException("Error on sorting file '" + file + "'", e);
    }
  }

  private static void readFully(final FileChannel channel, final ByteBuffer buffer, final long offset, final Path file) throws IOException {
    while (buffer.hasRemaining()) {
      if (channel.read(buffer, offset + buffer.position()) < 0)
        throw new StorageException("Unexpected end of file '" + file + "' at offset " + (offset + buffer.position()));
    }
  }
}
