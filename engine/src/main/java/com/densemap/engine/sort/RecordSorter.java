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

import java.nio.file.Path;

/**
 * Reorders a file of fixed-width records in place, ascending by the unsigned byte-wise value of the leading key prefix of each record.
 * The order of records sharing the same key is implementation defined.
 */
public interface RecordSorter {
  String getName();

  /**
   * Sorts the file in place.
   *
   * @param file        file to sort, its length must be a multiple of the record width
   * @param recordWidth width of one record in bytes
   * @param keyWidth    number of leading bytes of each record that are compared
   * @param options     tuning options; implementations ignore the ones they do not use
   *
   * @throws com.densemap.exception.StorageException on I/O errors
   */
  void sortByKeyPrefix(Path file, int recordWidth, int keyWidth, SortOptions options);
}
