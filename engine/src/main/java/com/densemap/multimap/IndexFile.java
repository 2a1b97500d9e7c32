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
package com.densemap.multimap;

import com.densemap.engine.RecordReader;
import com.densemap.exception.FormatMismatchException;
import com.densemap.exception.SchemaMismatchException;
import com.densemap.exception.StaleIndexException;
import com.densemap.exception.StorageException;
import com.densemap.index.BitsetEncoding;
import com.densemap.index.SuccinctBitset;
import com.densemap.index.SuccinctBitsetFactory;
import com.densemap.log.LogManager;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.function.Function;
import java.util.logging.Level;

/**
 * Sidecar file persisting a {@link KeyIndex} next to its record file. All numbers are big-endian.
 * <p>
 * Layout:
 * - [9]  magic "dmultimap"
 * - [4]  format version (always {@value #CURRENT_VERSION})
 * - [4]  record width
 * - [8]  record count
 * - [8]  max key
 * - [1]  bitset encoding code, see {@link BitsetEncoding}
 * - [4]  bitset length + bitset bytes
 * - [4]  select support length + select support bytes
 */
public class IndexFile {
  public static final  int    CURRENT_VERSION = 1;
  private static final byte[] MAGIC_VALUE     = "dmultimap".getBytes(StandardCharsets.US_ASCII);

  private final File file;

  public IndexFile(final String filePath) {
    this.file = new File(filePath);
  }

  /**
   * Writes the index replacing any existing file.
   *
   * @return the number of bytes written
   */
  public long write(final int recordWidth, final KeyIndex index) {
    final SuccinctBitset bitset = index.getKeyStarts();
    try {
      final ByteArrayOutputStream bitsetBytes = new ByteArrayOutputStream();
      final ByteArrayOutputStream selectBytes = new ByteArrayOutputStream();
      try (final DataOutputStream bitsetOut = new DataOutputStream(bitsetBytes);
          final DataOutputStream selectOut = new DataOutputStream(selectBytes)) {
        bitset.serialize(bitsetOut, selectOut);
      }

      try (final DataOutputStream out = new DataOutputStream(new BufferedOutputStream(new FileOutputStream(file)))) {
        out.write(MAGIC_VALUE);
        out.writeInt(CURRENT_VERSION);
        out.writeInt(recordWidth);
        out.writeLong(index.getRecordCount());
        out.writeLong(index.getMaxKey());
        out.writeByte(bitset.getEncoding().getCode());
        out.writeInt(bitsetBytes.size());
        bitsetBytes.writeTo(out);
        out.writeInt(selectBytes.size());
        selectBytes.writeTo(out);
      }
    } catch (final IOException e) {
      throw new StorageException("Error on writing index file '" + file + "'", e);
    }

    LogManager.instance()
        .log(this, Level.INFO, "Saved index of %d records and %d keys to file %s (%d bytes)", index.getRecordCount(),
            index.getMaxKey() + 1, file.getName(), file.length());
    return file.length();
  }

  /**
   * Reads the index and validates it against the live record file.
   *
   * @param recordWidth     record width of the multimap loading the index
   * @param reader          open reader on the live record file
   * @param factoryResolver returns the factory able to deserialize the persisted encoding
   *
   * @throws FormatMismatchException on a wrong magic, an unsupported version, an unknown encoding or truncated content
   * @throws SchemaMismatchException if the record width differs
   * @throws StaleIndexException     if the record file changed after the index was saved
   * @throws StorageException        if the file cannot be read
   */
  public KeyIndex read(final int recordWidth, final RecordReader<?> reader,
      final Function<BitsetEncoding, SuccinctBitsetFactory> factoryResolver) {
    if (!file.exists())
      throw new StorageException("Index file '" + file + "' not found");

    try (final DataInputStream in = new DataInputStream(new BufferedInputStream(new FileInputStream(file)))) {
      final byte[] magic = new byte[MAGIC_VALUE.length];
      in.readFully(magic);
      if (!Arrays.equals(magic, MAGIC_VALUE))
        throw new FormatMismatchException("File '" + file + "' is not a multimap index file");

      final int version = in.readInt();
      if (version != CURRENT_VERSION)
        throw new FormatMismatchException("Unsupported index format version " + version + " (expected: " + CURRENT_VERSION + ")");

      final int savedRecordWidth = in.readInt();
      if (savedRecordWidth != recordWidth)
        throw new SchemaMismatchException(
            "Index file '" + file + "' was saved with record width " + savedRecordWidth + " but the multimap has record width " + recordWidth);

      final long savedRecordCount = in.readLong();
      final long liveRecordCount = reader.getRecordCount();
      if (savedRecordCount != liveRecordCount)
        throw stale("record count", savedRecordCount, liveRecordCount);

      final long savedMaxKey = in.readLong();
      final long liveMaxKey = liveRecordCount > 0 ? reader.readKey(liveRecordCount - 1) : -1;
      if (savedMaxKey != liveMaxKey)
        throw stale("max key", savedMaxKey, liveMaxKey);

      final byte code = in.readByte();
      final BitsetEncoding encoding = BitsetEncoding.fromCode(code);
      if (encoding == null)
        throw new FormatMismatchException("Unknown bitset encoding " + code + " in index file '" + file + "'");

      final byte[] bitsetBytes = readBlob(in);
      final byte[] selectBytes = readBlob(in);

      final SuccinctBitset bitset = factoryResolver.apply(encoding)
          .deserialize(new DataInputStream(new ByteArrayInputStream(bitsetBytes)), new DataInputStream(new ByteArrayInputStream(selectBytes)));

      if (bitset.size() != savedRecordCount || bitset.cardinality() != savedMaxKey + 1)
        throw new FormatMismatchException(
            "Bitset in index file '" + file + "' has " + bitset.cardinality() + " set bits over " + bitset.size() + " bits, expected "
                + (savedMaxKey + 1) + " over " + savedRecordCount);

      LogManager.instance()
          .log(this, Level.INFO, "Loaded index of %d records and %d keys from file %s", savedRecordCount, savedMaxKey + 1, file.getName());

      return new KeyIndex(bitset, savedMaxKey, savedRecordCount);

    } catch (final EOFException e) {
      throw new FormatMismatchException("Index file '" + file + "' is truncated", e);
    } catch (final IOException e) {
      throw new StorageException("Error on reading index file '" + file + "'", e);
    }
  }

  public boolean exists() {
    return file.exists();
  }

  public File getOSFile() {
    return file;
  }

  private byte[] readBlob(final DataInputStream in) throws IOException {
    final int length = in.readInt();
    if (length < 0 || length > file.length())
      throw new FormatMismatchException("Invalid blob length " + length + " in index file '" + file + "'");
    final byte[] blob = new byte[length];
    in.readFully(blob);
    return blob;
  }

  private StaleIndexException stale(final String what, final long saved, final long live) {
    final StaleIndexException e = new StaleIndexException(
        "Index file '" + file + "' is stale: saved " + what + " " + saved + " differs from the current " + live);
    e.addContext("saved", saved);
    e.addContext("live", live);
    return e;
  }
}
