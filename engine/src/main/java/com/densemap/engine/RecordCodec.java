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
package com.densemap.engine;

import com.densemap.exception.DenseMapException;
import com.densemap.exception.ErrorCode;
import com.densemap.exception.KeyOutOfRangeException;
import com.densemap.serializer.ValueSerializer;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Fixed-width encoding of one (key, value) record: the key as an unsigned big-endian integer of {@link #getKeyWidth()} bytes followed
 * by the value bytes produced by the value serializer. Big-endian keys make the byte-wise order of the key prefix match the numeric
 * order, which is what the in-place sorters rely on. The codec has no state besides the layout.
 *
 * @param <V> type of the values
 */
public class RecordCodec<V> {
  private final int                keyWidth;
  private final ValueSerializer<V> valueSerializer;
  private final int                recordWidth;
  private final long               maxKey;
  private final byte[]             nullValueBytes;

  public RecordCodec(final int keyWidth, final ValueSerializer<V> valueSerializer) {
    if (keyWidth < 1 || keyWidth > Long.BYTES)
      throw new IllegalArgumentException("Invalid key width " + keyWidth + ", allowed values are 1..8");
    if (valueSerializer.getWidth() < 1)
      throw new IllegalArgumentException("Invalid value width " + valueSerializer.getWidth());

    this.keyWidth = keyWidth;
    this.valueSerializer = valueSerializer;
    this.recordWidth = keyWidth + valueSerializer.getWidth();
    this.maxKey = keyWidth == Long.BYTES ? Long.MAX_VALUE : (1L << (keyWidth * 8)) - 1;
    this.nullValueBytes = new byte[valueSerializer.getWidth()];
  }

  /**
   * Allocates a buffer for `records` records with the byte order the values are encoded with.
   */
  public ByteBuffer allocate(final int records) {
    return ByteBuffer.allocate(records * recordWidth).order(ByteOrder.nativeOrder());
  }

  public void checkKey(final long key) {
    if (key < 0 || key > maxKey) {
      final KeyOutOfRangeException e = new KeyOutOfRangeException(
          "Key " + key + " is outside the range [0, " + maxKey + "] allowed by " + keyWidth + "-byte keys");
      e.addContext("key", key);
      throw e;
    }
  }

  /**
   * Writes one record at the current position of the buffer.
   */
  public void write(final long key, final V value, final ByteBuffer buffer) {
    checkKey(key);
    writeKey(key, buffer);
    writeValue(value, buffer);
  }

  public void writeKey(final long key, final ByteBuffer buffer) {
    for (int shift = (keyWidth - 1) * 8; shift >= 0; shift -= 8)
      buffer.put((byte) (key >>> shift));
  }

  public void writeValue(final V value, final ByteBuffer buffer) {
    final int begin = buffer.position();
    valueSerializer.write(value, buffer);
    if (buffer.position() - begin != valueSerializer.getWidth())
      throw new DenseMapException(ErrorCode.INTERNAL_ERROR,
          "Value serializer " + valueSerializer.getClass().getSimpleName() + " wrote " + (buffer.position() - begin) + " bytes instead of "
              + valueSerializer.getWidth());
  }

  /**
   * Writes the all-zero null value at the current position of the buffer.
   */
  public void writeNullValue(final ByteBuffer buffer) {
    buffer.put(nullValueBytes);
  }

  /**
   * Reads the key of the record starting at the absolute offset of the buffer.
   */
  public long readKey(final ByteBuffer buffer, final int offset) {
    long key = 0;
    for (int i = 0; i < keyWidth; i++)
      key = (key << 8) | (buffer.get(offset + i) & 0xFF);
    return key;
  }

  /**
   * Reads the value of the record starting at the absolute offset of the buffer. The buffer position is not changed.
   */
  public V readValue(final ByteBuffer buffer, final int offset) {
    final ByteBuffer view = buffer.duplicate().order(buffer.order());
    view.position(offset + keyWidth);
    return valueSerializer.read(view);
  }

  public V getNullValue() {
    return valueSerializer.read(ByteBuffer.wrap(nullValueBytes).order(ByteOrder.nativeOrder()));
  }

  public int getKeyWidth() {
    return keyWidth;
  }

  public int getValueWidth() {
    return valueSerializer.getWidth();
  }

  public int getRecordWidth() {
    return recordWidth;
  }

  /**
   * Largest key representable with the configured key width.
   */
  public long getMaxKey() {
    return maxKey;
  }

  public ValueSerializer<V> getValueSerializer() {
    return valueSerializer;
  }
}
