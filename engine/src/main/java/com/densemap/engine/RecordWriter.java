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

import com.densemap.exception.StorageException;
import com.densemap.log.LogManager;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.StandardOpenOption;
import java.util.logging.Level;

/**
 * Buffered append handle on a {@link RecordFile}. Records are written at the end of the file, the buffer is flushed when full, on
 * {@link #flush()} and on {@link #close()}.
 */
public class RecordWriter<V> implements AutoCloseable {
  private final RecordFile<V>  file;
  private final RecordCodec<V> codec;
  private final ByteBuffer     buffer;
  private       FileChannel    channel;
  private       long           appended = 0;

  RecordWriter(final RecordFile<V> file, final int bufferSize) throws IOException {
    this.file = file;
    this.codec = file.getCodec();
    this.buffer = codec.allocate(Math.max(1, bufferSize / codec.getRecordWidth()));
    this.channel = FileChannel.open(file.getOSFile().toPath(), StandardOpenOption.CREATE, StandardOpenOption.WRITE,
        StandardOpenOption.APPEND);
  }

  public void append(final long key, final V value) {
    checkOpen();
    codec.checkKey(key);
    if (buffer.remaining() < codec.getRecordWidth())
      flush();
    final int begin = buffer.position();
    try {
      codec.write(key, value, buffer);
    } catch (final RuntimeException e) {
      // DISCARD THE PARTIAL RECORD
      buffer.position(begin);
      throw e;
    }
    ++appended;
  }

  /**
   * Appends a record with the all-zero null value.
   */
  public void appendNull(final long key) {
    checkOpen();
    codec.checkKey(key);
    if (buffer.remaining() < codec.getRecordWidth())
      flush();
    codec.writeKey(key, buffer);
    codec.writeNullValue(buffer);
    ++appended;
  }

  public void flush() {
    checkOpen();
    buffer.flip();
    try {
      while (buffer.hasRemaining())
        channel.write(buffer);
    } catch (final IOException e) {
      throw new StorageException("Error on appending to file '" + file.getFilePath() + "'", e);
    } finally {
      buffer.clear();
    }
  }

  /**
   * Number of records appended through this handle.
   */
  public long getAppended() {
    return appended;
  }

  public boolean isOpen() {
    return channel != null;
  }

  @Override
  public void close() {
    if (channel == null)
      return;

    try {
      flush();
    } finally {
      try {
        LogManager.instance().log(this, Level.FINE, "Closing file %s after appending %d records...", file.getFileName(), appended);
        channel.close();
      } catch (final IOException e) {
        LogManager.instance().log(this, Level.SEVERE, "Error on closing file %s", e, file.getFileName());
        throw new StorageException("Error on closing file '" + file.getFilePath() + "'", e);
      } finally {
        channel = null;
      }
    }
  }

  private void checkOpen() {
    if (channel == null)
      throw new StorageException("Writer on file '" + file.getFilePath() + "' is closed");
  }
}
