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
import com.densemap.exception.KeyOutOfRangeException;
import com.densemap.exception.StorageException;
import com.densemap.serializer.LongSerializer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordFileTest {
  @TempDir
  Path tempDir;

  private RecordFile<Long> newFile(final int bufferSize) {
    return new RecordFile<>(tempDir.resolve("records.bin").toString(), new RecordCodec<>(4, LongSerializer.INSTANCE), bufferSize,
        bufferSize);
  }

  @Test
  void appendAndRead() {
    final RecordFile<Long> file = newFile(64 * 1024);
    assertThat(file.exists()).isFalse();

    try (final RecordWriter<Long> writer = file.openWriter()) {
      for (int i = 0; i < 1000; i++)
        writer.append(i * 3L, (long) i);
      assertThat(writer.getAppended()).isEqualTo(1000);
    }

    assertThat(file.getSize()).isEqualTo(1000L * 12);
    assertThat(file.getRecordCount()).isEqualTo(1000);

    try (final RecordReader<Long> reader = file.openReader()) {
      assertThat(reader.getRecordCount()).isEqualTo(1000);
      assertThat(reader.readKey(0)).isZero();
      assertThat(reader.readKey(999)).isEqualTo(2997);
      assertThat(reader.readValue(500)).isEqualTo(500L);
    }
  }

  @Test
  void writerFlushesWhenTheBufferIsFull() {
    // BUFFER OF 2 RECORDS ONLY
    final RecordFile<Long> file = newFile(24);
    try (final RecordWriter<Long> writer = file.openWriter()) {
      writer.append(1, 10L);
      writer.append(2, 20L);
      assertThat(file.getRecordCount()).isZero();
      writer.append(3, 30L);
      assertThat(file.getRecordCount()).isEqualTo(2);
      writer.flush();
      assertThat(file.getRecordCount()).isEqualTo(3);
    }
  }

  @Test
  void reopenAppendsAtTheEnd() {
    final RecordFile<Long> file = newFile(1024);
    try (final RecordWriter<Long> writer = file.openWriter()) {
      writer.append(1, 10L);
    }
    try (final RecordWriter<Long> writer = file.openWriter()) {
      writer.appendNull(0);
    }

    try (final RecordReader<Long> reader = file.openReader()) {
      assertThat(reader.readKey(1)).isZero();
      assertThat(reader.readValue(1)).isZero();
      assertThat(reader.readValue(0)).isEqualTo(10L);
    }
  }

  @Test
  void cursorScansRanges() {
    // SMALL SCAN BUFFER TO CROSS SEVERAL REFILLS
    final RecordFile<Long> file = newFile(36);
    try (final RecordWriter<Long> writer = file.openWriter()) {
      for (int i = 0; i < 20; i++)
        writer.append(i, i * 10L);
    }

    try (final RecordReader<Long> reader = file.openReader()) {
      final List<Long> values = new ArrayList<>();
      final RecordCursor<Long> cursor = reader.cursor(5, 12);
      while (cursor.next()) {
        assertThat(cursor.getKey()).isEqualTo(cursor.getPosition());
        values.add(cursor.getValue());
      }
      assertThat(values).containsExactly(50L, 60L, 70L, 80L, 90L, 100L, 110L);

      final RecordCursor<Long> all = reader.cursor();
      long count = 0;
      while (all.next())
        ++count;
      assertThat(count).isEqualTo(20);

      assertThat(reader.cursor(3, 3).next()).isFalse();
    }
  }

  @Test
  void readOutsideTheFile() {
    final RecordFile<Long> file = newFile(1024);
    try (final RecordWriter<Long> writer = file.openWriter()) {
      writer.append(1, 10L);
    }
    try (final RecordReader<Long> reader = file.openReader()) {
      assertThatThrownBy(() -> reader.readKey(1)).isInstanceOf(KeyOutOfRangeException.class);
      assertThatThrownBy(() -> reader.readValue(-1)).isInstanceOf(KeyOutOfRangeException.class);
    }
  }

  @Test
  void unalignedFileIsAnInvariantViolation() throws IOException {
    final RecordFile<Long> file = newFile(1024);
    try (final RecordWriter<Long> writer = file.openWriter()) {
      writer.append(1, 10L);
    }
    Files.write(file.getOSFile().toPath(), new byte[] { 1, 2, 3 }, StandardOpenOption.APPEND);

    assertThatThrownBy(file::getRecordCount).isInstanceOf(InvariantViolationException.class);
  }

  @Test
  void closedHandlesAndMissingFiles() {
    final RecordFile<Long> file = newFile(1024);
    assertThatThrownBy(file::openReader).isInstanceOf(StorageException.class);

    final RecordWriter<Long> writer = file.openWriter();
    writer.close();
    assertThat(writer.isOpen()).isFalse();
    assertThatThrownBy(() -> writer.append(1, 1L)).isInstanceOf(StorageException.class);
    writer.close();

    file.drop();
    assertThat(file.exists()).isFalse();
  }
}
