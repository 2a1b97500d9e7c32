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
package com.densemap.index;

import java.io.DataOutput;
import java.io.IOException;

/**
 * Immutable compressed bitvector answering select queries. Instances are created through a {@link Builder} obtained from a
 * {@link SuccinctBitsetFactory}, by adding the positions of the set bits in ascending order.
 */
public interface SuccinctBitset {
  /**
   * Number of bits of the vector, set or not.
   */
  long size();

  /**
   * Number of set bits.
   */
  long cardinality();

  /**
   * Returns the position of the set bit preceded by exactly `rank` set bits. Ranks are 0-based.
   *
   * @throws com.densemap.exception.KeyOutOfRangeException if rank is outside [0, cardinality)
   */
  long select(long rank);

  BitsetEncoding getEncoding();

  /**
   * Writes the bitvector and its select support to two separate outputs. Encodings without an explicit select support leave the second
   * output empty.
   */
  void serialize(DataOutput bitsetOut, DataOutput selectOut) throws IOException;

  interface Builder {
    /**
     * Sets the bit at `position`. Positions must be added in strictly ascending order.
     */
    Builder add(long position);

    SuccinctBitset build();
  }
}
