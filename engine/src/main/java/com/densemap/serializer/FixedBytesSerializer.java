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
 * Opaque fixed-size blobs. Shorter arrays are rejected rather than padded, so that a value read back is always the value written.
 */
public class FixedBytesSerializer implements ValueSerializer<byte[]> {
  private final int width;

  public FixedBytesSerializer(final int width) {
    if (width < 1)
      throw new IllegalArgumentException("Invalid value width " + width);
    this.width = width;
  }

  @Override
  public int getWidth() {
    return width;
  }

  @Override
  public void write(final byte[] value, final ByteBuffer buffer) {
    if (value.length != width)
      throw new IllegalArgumentException("Value of " + value.length + " bytes does not match the configured width " + width);
    buffer.put(value);
  }

  @Override
  public byte[] read(final ByteBuffer buffer) {
    final byte[] value = new byte[width];
    buffer.get(value);
    return value;
  }
}
