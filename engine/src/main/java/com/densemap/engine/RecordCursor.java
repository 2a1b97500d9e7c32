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

import java.nio.ByteBuffer;

/**
 * Forward-only buffered scan over a range of records. Call {@link #next()} before reading the current record.
 */
public class RecordCursor<V> {
  private final RecordReader<V> reader;
  private final RecordCodec<V>  codec;
  private final ByteBuffer      buffer;
  private final long            to;
  private       long            nextToLoad;
  private       long            position;
  private       int             offset;

  RecordCursor(final RecordReader<V> reader, final RecordCodec<V> codec, final long from, final long to, final int bufferRecords) {
    this.reader = reader;
    this.codec = codec;
    this.to = to;
    this.nextToLoad = from;
    this.position = from - 1;
    this.buffer = codec.allocate(bufferRecords);
    this.buffer.limit(0);
    this.offset = -codec.getRecordWidth();
  }

  /**
   * Moves to the next record.
   *
   * @return false when the range is exhausted
   */
  public boolean next() {
    if (position + 1 >= to)
      return false;

    offset += codec.getRecordWidth();
    if (offset >= buffer.limit()) {
      final long toLoad = Math.min((long) buffer.capacity() / codec.getRecordWidth(), to - nextToLoad);
      buffer.clear();
      buffer.limit((int) toLoad * codec.getRecordWidth());
      reader.read(buffer, nextToLoad * codec.getRecordWidth());
      buffer.flip();
      nextToLoad += toLoad;
      offset = 0;
    }

    ++position;
    return true;
  }

  /**
   * Index of the current record in the file.
   */
  public long getPosition() {
    return position;
  }

  public long getKey() {
    return codec.readKey(buffer, offset);
  }

  public V getValue() {
    return codec.readValue(buffer, offset);
  }
}
