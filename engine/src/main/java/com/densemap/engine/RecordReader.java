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

import com.densemap.exception.KeyOutOfRangeException;
import com.densemap.exception.StorageException;
import com.densemap.log.LogManager;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.StandardOpenOption;
import java.util.logging.Level;

/**
 * Read handle on a {@link RecordFile}: random positioned reads of single records and buffered sequential scans through
 * {@link RecordCursor}.
 */
public class RecordReader<V> implements AutoCloseable {
  private final RecordFile<V>  file;
  private final RecordCodec<V> codec;
  private final ByteBuffer     record;
  private final int            scanBufferSize;
  private       FileChannel    channel;

  RecordReader(final RecordFile<V> file, final int scanBufferSize) throws IOException {
    this.file = file;
    this.codec = file.getCodec();
    this.record = codec.allocate(1);
    this.scanBufferSize = scanBufferSize;
    this.channel = FileChannel.open(file.getOSFile().toPath(), StandardOpenOption.READ);
  }

  public long getRecordCount() {
    try {
      return file.toRecordCount(getChannel().size());
    } catch (final IOException e) {
      throw new StorageException("Error on reading the size of file '" + file.getFilePath() + "'", e);
    }
  }

  public long readKey(final long index) {
    readRecord(index);
    return codec.readKey(record, 0);
  }

  public V readValue(final long index) {
    readRecord(index);
    return codec.readValue(record, 0);
  }

  /**
   * Returns a cursor over all the records.
   */
  public RecordCursor<V> cursor() {
    return cursor(0, getRecordCount());
  }

  /**
   * Returns a cursor over the records in the half-open range [from, to).
   */
  public RecordCursor<V> cursor(final long from, final long to) {
    return new RecordCursor<>(this, codec, from, to, Math.max(1, scanBufferSize / codec.getRecordWidth()));
  }

  void read(final ByteBuffer buffer, final long offset) {
    try {
      while (buffer.hasRemaining()) {
        final int read = getChannel().read(buffer, offset + buffer.position());
        if (read < 0)
          throw new StorageException("Unexpected end of file '" + file.getFilePath() + "' at offset " + (offset + buffer.position()));
      }
    } catch (final IOException e) {
      throw new StorageException("Error on reading file '" + file.getFilePath() + "' at offset " + offset, e);
    }
  }

  public boolean isOpen() {
    return channel != null;
  }

  @Override
  public void close() {
    if (channel == null)
      return;

    try {
      LogManager.instance().log(this, Level.FINE, "Closing file %s...", file.getFileName());
      channel.close();
    } catch (final IOException e) {
      LogManager.instance().log(this, Level.SEVERE, "Error on closing file %s", e, file.getFileName());
      throw new StorageException("Error on closing file '" + file.getFilePath() + "'", e);
    } finally {
      channel = null;
    }
  }

  RecordFile<V> getFile() {
    return file;
  }

  private void readRecord(final long index) {
    final long count = getRecordCount();
    if (index < 0 || index >= count)
      throw new KeyOutOfRangeException("Record " + index + " is outside the range [0, " + count + ")");

    record.clear();
    read(record, index * codec.getRecordWidth());
  }

  private FileChannel getChannel() {
    if (channel == null)
      throw new StorageException("Reader on file '" + file.getFilePath() + "' is closed");
    return channel;
  }
}
