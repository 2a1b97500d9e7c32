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

import com.densemap.ContextConfiguration;
import com.densemap.GlobalConfiguration;
import com.densemap.exception.ConfigurationException;

/**
 * Tuning options of the in-place sorters.
 */
public class SortOptions {
  private final int  charStart;
  private final int  charStop;
  private final int  stackSize;
  private final int  cutOff;
  private final long mappingChunkSize;

  public SortOptions(final int charStart, final int charStop, final int stackSize, final int cutOff, final long mappingChunkSize) {
    if (charStart < 0 || charStop > 255 || charStart > charStop)
      throw new ConfigurationException("Invalid byte range [" + charStart + ", " + charStop + "] for sorting, expected 0 <= start <= stop <= 255");
    if (stackSize < 1)
      throw new ConfigurationException("Invalid sort stack size " + stackSize);
    if (cutOff < 1)
      throw new ConfigurationException("Invalid sort cut off " + cutOff);
    if (mappingChunkSize < 1)
      throw new ConfigurationException("Invalid mapping chunk size " + mappingChunkSize);

    this.charStart = charStart;
    this.charStop = charStop;
    this.stackSize = stackSize;
    this.cutOff = cutOff;
    this.mappingChunkSize = mappingChunkSize;
  }

  public static SortOptions fromConfiguration(final ContextConfiguration configuration) {
    return new SortOptions(//
        configuration.getValueAsInteger(GlobalConfiguration.SORT_CHAR_START),//
        configuration.getValueAsInteger(GlobalConfiguration.SORT_CHAR_STOP),//
        configuration.getValueAsInteger(GlobalConfiguration.SORT_STACK_SIZE),//
        configuration.getValueAsInteger(GlobalConfiguration.SORT_CUT_OFF),//
        configuration.getValueAsLong(GlobalConfiguration.SORT_MAPPING_CHUNK_SIZE));
  }

  public static SortOptions defaults() {
    return fromConfiguration(new ContextConfiguration());
  }

  public int getCharStart() {
    return charStart;
  }

  public int getCharStop() {
    return charStop;
  }

  public int getStackSize() {
    return stackSize;
  }

  public int getCutOff() {
    return cutOff;
  }

  public long getMappingChunkSize() {
    return mappingChunkSize;
  }

  @Override
  public String toString() {
    return "SortOptions{charStart=" + charStart + ", charStop=" + charStop + ", stackSize=" + stackSize + ", cutOff=" + cutOff
        + ", mappingChunkSize=" + mappingChunkSize + "}";
  }
}
