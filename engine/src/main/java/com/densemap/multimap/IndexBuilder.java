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
package com.densemap.multimap;

import com.densemap.engine.RecordCursor;
import com.densemap.engine.RecordReader;
import com.densemap.exception.InvariantViolationException;
import com.densemap.index.SuccinctBitset;
import com.densemap.index.SuccinctBitsetFactory;
import com.densemap.log.LogManager;
import com.densemap.utility.FileUtils;

import java.util.logging.Level;

/**
 * Scans a sorted and dense record file once and builds the {@link KeyIndex}: a set bit at position 0 and at every position whose key
 * differs from the previous one.
 */
public class IndexBuilder {
  private final SuccinctBitsetFactory bitsetFactory;

  public IndexBuilder(final SuccinctBitsetFactory bitsetFactory) {
    this.bitsetFactory = bitsetFactory;
  }

  /**
   * @throws InvariantViolationException if the file is empty, not sorted or not dense
   */
  public KeyIndex build(final RecordReader<?> reader) {
    final long begin = System.nanoTime();

    final long count = reader.getRecordCount();
    if (count == 0)
      throw new InvariantViolationException("Cannot index an empty multimap");

    final long maxKey = reader.readKey(count - 1);
    if (maxKey >= count)
      throw new InvariantViolationException("Cannot index " + count + " records with max key " + maxKey + ": the key domain is not dense");

    final SuccinctBitset.Builder builder = bitsetFactory.newBuilder(count, maxKey + 1);

    long runs = 0;
    long prev = -1;
    final RecordCursor<?> cursor = reader.cursor(0, count);
    while (cursor.next()) {
      final long key = cursor.getKey();
      if (key == prev)
        continue;

      if (key != prev + 1)
        throw new InvariantViolationException(
            "Key " + key + " at position " + cursor.getPosition() + " follows key " + prev + ": the multimap is not sorted and dense");

      builder.add(cursor.getPosition());
      ++runs;
      prev = key;
    }

    if (runs != maxKey + 1)
      throw new InvariantViolationException("Found " + runs + " distinct keys, expected " + (maxKey + 1));

    final SuccinctBitset bitset = builder.build();

    LogManager.instance()
        .log(this, Level.FINE, "Indexed %d records with %d distinct keys using %s in %s", count, runs, bitset.getEncoding().getName(),
            FileUtils.elapsedMillis(begin));

    return new KeyIndex(bitset, maxKey, count);
  }
}
