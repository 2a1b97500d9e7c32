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

import com.densemap.exception.InvariantViolationException;
import com.densemap.exception.StorageException;
import com.densemap.log.LogManager;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.logging.Level;

/**
 * Append-only binary file of fixed-width records backing a multimap. Reading and writing go through independent handles, opened and
 * closed explicitly around each phase: {@link #openWriter()} and {@link #openReader()}. Neither handle is thread safe.
 *
 * @param <V> type of the values
 */
public class RecordFile<V> {
  private final String         filePath;
  private final String         fileName;
  private final File           osFile;
  private final RecordCodec<V> codec;
  private final int            readBufferSize;
  private final int            writeBufferSize;

  public RecordFile(final String filePath, final RecordCodec<V> codec, final int readBufferSize, final int writeBufferSize) {
    this.filePath = filePath;
    this.codec = codec;
    this.readBufferSize = readBufferSize;
    this.writeBufferSize = writeBufferSize;
    this.osFile = new File(filePath);
    this.fileName = osFile.getName();
  }

  public boolean exists() {
    return osFile.exists();
  }

  public long getSize() {
    return osFile.length();
  }

  /**
   * Returns the number of records from the file length. Pending buffered appends are not counted: flush the writer first.
   *
   * @throws InvariantViolationException if the file length is not a multiple of the record width
   */
  public long getRecordCount() {
    return toRecordCount(getSize());
  }

  long toRecordCount(final long size) {
    if (size % codec.getRecordWidth() != 0)
      throw new InvariantViolationException(
          "File '" + filePath + "' has size " + size + " that is not a multiple of the record width " + codec.getRecordWidth());
    return size / codec.getRecordWidth();
  }

  /**
   * Opens a handle appending at the end of the file, creating it if missing.
   */
  public RecordWriter<V> openWriter() {
    try {
      LogManager.instance().log(this, Level.FINE, "Opening file %s for append...", fileName);
      return new RecordWriter<>(this, writeBufferSize);
    } catch (final IOException e) {
      throw new StorageException("Error on opening file '" + filePath + "' for writing", e);
    }
  }

  public RecordReader<V> openReader() {
    try {
      LogManager.instance().log(this, Level.FINE, "Opening file %s for reading...", fileName);
      return new RecordReader<>(this, readBufferSize);
    } catch (final IOException e) {
      throw new StorageException("Error on opening file '" + filePath + "' for reading", e);
    }
  }

  public void drop() {
    try {
      LogManager.instance().log(this, Level.FINE, "Deleting file %s...", fileName);
      Files.deleteIfExists(osFile.toPath());
    } catch (final IOException e) {
      throw new StorageException("Error on deleting file '" + filePath + "'", e);
    }
  }

  public RecordCodec<V> getCodec() {
    return codec;
  }

  public String getFilePath() {
    return filePath;
  }

  public String getFileName() {
    return fileName;
  }

  public File getOSFile() {
    return osFile;
  }

  @Override
  public String toString() {
    return filePath;
  }
}
