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

import java.util.Locale;

/**
 * Resolves the sorter configured with `densemap.sort.algorithm`.
 */
public final class RecordSorters {
  private RecordSorters() {
  }

  public static RecordSorter forName(final String name) {
    if (name == null)
      throw new ConfigurationException("Sort algorithm not specified");

    switch (name.toLowerCase(Locale.ENGLISH)) {
    case RadixRecordSorter.NAME:
      return new RadixRecordSorter();
    case ComparisonRecordSorter.NAME:
      return new ComparisonRecordSorter();
    default:
      throw new ConfigurationException("Unsupported sort algorithm '" + name + "'");
    }
  }
}
