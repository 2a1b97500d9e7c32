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
package com.densemap.serializer;

import java.nio.ByteBuffer;

/**
 * Fixed-width binary representation of the values stored in a multimap. Every value takes exactly {@link #getWidth()} bytes on disk,
 * the all-zero byte sequence decodes to the null value used for the synthetic records that fill the gaps of the key domain.
 *
 * @param <V> type of the values
 */
public interface ValueSerializer<V> {
  /**
   * Width in bytes of one serialized value. Must be constant for the lifetime of a multimap.
   */
  int getWidth();

  /**
   * Writes the value at the current position of the buffer, advancing it by exactly {@link #getWidth()} bytes.
   */
  void write(V value, ByteBuffer buffer);

  /**
   * Reads a value from the current position of the buffer, advancing it by exactly {@link #getWidth()} bytes.
   */
  V read(ByteBuffer buffer);
}
