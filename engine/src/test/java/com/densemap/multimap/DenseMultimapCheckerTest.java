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

import com.densemap.TestHelper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class DenseMultimapCheckerTest extends TestHelper {

  @Test
  public void healthyMultimap() {
    final DenseMultimap<Long> map = newMultimap();
    for (int i = 0; i < 500; i++)
      map.append((i * 7) % 300, (long) i);
    map.index();

    final Map<String, Object> result = new DenseMultimapChecker(map).check();

    assertThat(result.get("ok")).isEqualTo(true);
    assertThat(result.get("totalErrors")).isEqualTo(0L);
    assertThat(result.get("recordCount")).isEqualTo(map.recordCount());
    assertThat(result.get("maxKey")).isEqualTo(map.getMaxKey());
    assertThat((List<?>) result.get("errors")).isEmpty();
  }

  @Test
  public void notIndexed() {
    final DenseMultimap<Long> map = newMultimap();
    map.append(1, 1L);

    final Map<String, Object> result = new DenseMultimapChecker(map).check();
    assertThat(result.get("ok")).isEqualTo(false);
    assertThat((List<?>) result.get("errors")).hasSize(1);
  }

  @Test
  public void corruptedOrder() throws IOException {
    final DenseMultimap<Long> map = newMultimap();
    for (int i = 0; i < 10; i++)
      map.append(i, (long) i);
    map.index();
    map.closeReader();

    // SWAP THE KEY OF THE FIRST TWO RECORDS: 1, 0, 2, ...
    try (final RandomAccessFile raf = new RandomAccessFile(basePath, "rw")) {
      raf.seek(3);
      raf.write(1);
      raf.seek(12 + 3);
      raf.write(0);
    }

    final Map<String, Object> result = new DenseMultimapChecker(map).check();
    assertThat(result.get("ok")).isEqualTo(false);
    assertThat((Long) result.get("totalErrors")).isPositive();
  }
}
