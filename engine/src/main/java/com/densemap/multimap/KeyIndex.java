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

import com.densemap.exception.KeyOutOfRangeException;
import com.densemap.index.SuccinctBitset;

/**
 * Maps every key of a dense sorted record file to the range of its records. The bitset has one set bit for the first record of each
 * key, so the records of key k are in [select(k), select(k + 1)), the last key ending at the record count.
 */
public class KeyIndex {
  private final SuccinctBitset keyStarts;
  private final long           maxKey;
  private final long           recordCount;

  public KeyIndex(final SuccinctBitset keyStarts, final long maxKey, final long recordCount) {
    this.keyStarts = keyStarts;
    this.maxKey = maxKey;
    this.recordCount = recordCount;
  }

  public void checkKey(final long key) {
    if (key < 0 || key > maxKey) {
      final KeyOutOfRangeException e = new KeyOutOfRangeException("Key " + key + " is outside the indexed range [0, " + maxKey + "]");
      e.addContext("key", key);
      e.addContext("maxKey", maxKey);
      throw e;
    }
  }

  /**
   * Position of the first record of the key.
   */
  public long firstRecord(final long key) {
    checkKey(key);
    return keyStarts.select(key);
  }

  /**
   * Position after the last record of the key.
   */
  public long endRecord(final long key) {
    checkKey(key);
    return key < maxKey ? keyStarts.select(key + 1) : recordCount;
  }

  public long getMaxKey() {
    return maxKey;
  }

  public long getRecordCount() {
    return recordCount;
  }

  public SuccinctBitset getKeyStarts() {
    return keyStarts;
  }

  @Override
  public String toString() {
    return "KeyIndex{maxKey=" + maxKey + ", recordCount=" + recordCount + ", keyStarts=" + keyStarts + "}";
  }
}
