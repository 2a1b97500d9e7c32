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

import java.io.DataInput;
import java.io.IOException;

/**
 * Creates bitsets of one {@link BitsetEncoding}, either by building them or by reading what {@link SuccinctBitset#serialize} wrote.
 */
public interface SuccinctBitsetFactory {
  BitsetEncoding getEncoding();

  /**
   * @param size number of bits of the vector
   * @param ones exact number of bits that will be set
   */
  SuccinctBitset.Builder newBuilder(long size, long ones);

  /**
   * @throws com.densemap.exception.FormatMismatchException if the content is not consistent
   * @throws IOException                                    on read errors, including truncated content
   */
  SuccinctBitset deserialize(DataInput bitsetIn, DataInput selectIn) throws IOException;
}
