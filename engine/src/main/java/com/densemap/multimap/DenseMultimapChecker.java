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
import com.densemap.exception.DenseMapException;
import com.densemap.log.LogManager;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;

/**
 * Verifies an indexed multimap against its backing file: alignment, ascending order, density of the keys and agreement of the index with
 * the position of the first record of every key. The backing file is never modified.
 */
public class DenseMultimapChecker {
  private static final int MAX_ERRORS = 100;

  private final DenseMultimap<?>    multimap;
  private final Map<String, Object> result = new LinkedHashMap<>();
  private final List<String>        errors = new ArrayList<>();
  private       long                totalErrors;

  public DenseMultimapChecker(final DenseMultimap<?> multimap) {
    this.multimap = multimap;
  }

  /**
   * Runs the check.
   *
   * @return a map with `recordCount`, `maxKey`, `errors` (at most 100 descriptions), `totalErrors` and `ok`
   */
  public Map<String, Object> check() {
    result.clear();
    errors.clear();
    totalErrors = 0;

    LogManager.instance().log(this, Level.INFO, "Integrity check of multimap '%s' started", multimap.getBaseFilePath());

    final KeyIndex index = multimap.isIndexed() ? multimap.getKeyIndex() : null;
    if (index == null)
      addError("Multimap is not indexed (state=" + multimap.getState() + ")");
    else {
      try {
        checkRecords(multimap.getReader(), index);
      } catch (final DenseMapException e) {
        addError("Error on reading the multimap: " + e.getMessage());
      }
    }

    result.put("errors", new ArrayList<>(errors));
    result.put("totalErrors", totalErrors);
    result.put("ok", totalErrors == 0);

    LogManager.instance().log(this, Level.INFO, "Integrity check of multimap '%s' completed: %s", multimap.getBaseFilePath(),
        new JSONObject(result).toString());

    return result;
  }

  private void checkRecords(final RecordReader<?> reader, final KeyIndex index) {
    final long recordCount = reader.getRecordCount();
    result.put("recordCount", recordCount);
    result.put("maxKey", index.getMaxKey());

    if (recordCount != index.getRecordCount())
      addError("Index covers " + index.getRecordCount() + " records but the file has " + recordCount);

    long prev = -1;
    final RecordCursor<?> cursor = reader.cursor(0, Math.min(recordCount, index.getRecordCount()));
    while (cursor.next()) {
      final long key = cursor.getKey();
      final long position = cursor.getPosition();

      if (key < prev)
        addError("Key " + key + " at position " + position + " is lower than the previous key " + prev);
      else if (key > prev) {
        if (key != prev + 1)
          addError("Keys from " + (prev + 1) + " to " + (key - 1) + " are missing");

        if (key > index.getMaxKey())
          addError("Key " + key + " at position " + position + " is beyond the indexed max key " + index.getMaxKey());
        else {
          final long indexed = index.firstRecord(key);
          if (indexed != position)
            addError("Index points key " + key + " to position " + indexed + " but its first record is at position " + position);
        }
        prev = key;
      }
    }

    if (prev != index.getMaxKey())
      addError("Last key is " + prev + " but the indexed max key is " + index.getMaxKey());
  }

  private void addError(final String error) {
    ++totalErrors;
    if (errors.size() < MAX_ERRORS)
      errors.add(error);
  }
}
