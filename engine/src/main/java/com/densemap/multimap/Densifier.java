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
import com.densemap.engine.RecordWriter;
import com.densemap.exception.InvariantViolationException;
import com.densemap.log.LogManager;

import java.util.logging.Level;

/**
 * Fills the gaps of the key domain of a sorted record file. For every missing key in [0, last key] one record with the null value is
 * appended at the end of the file, so the file is no longer sorted when at least one record was appended.
 * <p>
 * The cost depends on the number of missing keys, not on the number of records: a few keys spread over a huge range produce a huge file.
 */
public class Densifier<V> {
  private final RecordReader<V> reader;
  private final RecordWriter<V> writer;

  public Densifier(final RecordReader<V> reader, final RecordWriter<V> writer) {
    this.reader = reader;
    this.writer = writer;
  }

  /**
   * @return the number of records appended
   *
   * @throws InvariantViolationException if the file is empty or not sorted
   */
  public long densify() {
    final long count = reader.getRecordCount();
    if (count == 0)
      throw new InvariantViolationException("Cannot densify an empty multimap");

    long appended = 0;
    long prev = -1;

    final RecordCursor<V> cursor = reader.cursor(0, count);
    while (cursor.next()) {
      final long curr = cursor.getKey();
      if (curr < prev)
        throw new InvariantViolationException(
            "Records are not sorted: key " + curr + " at position " + cursor.getPosition() + " follows key " + prev);

      for (long missing = prev + 1; missing < curr; ++missing) {
        writer.appendNull(missing);
        ++appended;
      }
      prev = curr;
    }

    writer.flush();

    LogManager.instance().log(this, Level.FINE, "Densified %d records up to key %d: appended %d null records", count, prev, appended);
    return appended;
  }
}
