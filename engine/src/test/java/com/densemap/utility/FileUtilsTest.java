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
package com.densemap.utility;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileUtilsTest {

  @TempDir
  Path tempDir;

  @Test
  void sizeConstants() {
    assertThat(FileUtils.KILOBYTE).isEqualTo(1024);
    assertThat(FileUtils.MEGABYTE).isEqualTo(1024 * 1024);
    assertThat(FileUtils.GIGABYTE).isEqualTo(1024 * 1024 * 1024);
    assertThat(FileUtils.TERABYTE).isEqualTo(1024L * 1024L * 1024L * 1024L);
  }

  @Test
  void getSizeAsNumber() {
    assertThat(FileUtils.getSizeAsNumber("1024")).isEqualTo(1024L);
    assertThat(FileUtils.getSizeAsNumber("64KB")).isEqualTo(64L * FileUtils.KILOBYTE);
    assertThat(FileUtils.getSizeAsNumber("1kb")).isEqualTo(FileUtils.KILOBYTE);
    assertThat(FileUtils.getSizeAsNumber("5MB")).isEqualTo(5L * FileUtils.MEGABYTE);
    assertThat(FileUtils.getSizeAsNumber("1GB")).isEqualTo(FileUtils.GIGABYTE);
    assertThat(FileUtils.getSizeAsNumber("2TB")).isEqualTo(2 * FileUtils.TERABYTE);
    assertThat(FileUtils.getSizeAsNumber("100B")).isEqualTo(100L);
    assertThat(FileUtils.getSizeAsNumber("1.5KB")).isEqualTo(1536L);
    assertThat(FileUtils.getSizeAsNumber(42)).isEqualTo(42L);
  }

  @Test
  void getSizeAsNumberRejectsGarbage() {
    assertThatThrownBy(() -> FileUtils.getSizeAsNumber("lots")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> FileUtils.getSizeAsNumber(null)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void getSizeAsString() {
    assertThat(FileUtils.getSizeAsString(100)).isEqualTo("100b");
    assertThat(FileUtils.getSizeAsString(2048)).isEqualTo("2.00KB");
    assertThat(FileUtils.getSizeAsString(3L * FileUtils.MEGABYTE)).isEqualTo("3.00MB");
  }

  @Test
  void deleteRecursively() throws IOException {
    final Path root = tempDir.resolve("root");
    Files.createDirectories(root.resolve("a/b"));
    Files.writeString(root.resolve("a/b/file.bin"), "data");
    Files.writeString(root.resolve("top.idx"), "data");

    FileUtils.deleteRecursively(root.toFile());

    assertThat(root).doesNotExist();
  }

  @Test
  void deleteFile() throws IOException {
    final File file = Files.writeString(tempDir.resolve("x.bin"), "data").toFile();
    assertThat(FileUtils.deleteFile(file)).isTrue();
    assertThat(file).doesNotExist();
    assertThat(FileUtils.deleteFile(file)).isTrue();
  }

  @Test
  void elapsedMillis() {
    assertThat(FileUtils.elapsedMillis(System.nanoTime())).endsWith("ms");
  }
}
