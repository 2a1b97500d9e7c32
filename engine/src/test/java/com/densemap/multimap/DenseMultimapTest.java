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

import com.densemap.ContextConfiguration;
import com.densemap.GlobalConfiguration;
import com.densemap.TestHelper;
import com.densemap.exception.ConfigurationException;
import com.densemap.exception.InvariantViolationException;
import com.densemap.exception.KeyOutOfRangeException;
import com.densemap.serializer.FixedBytesSerializer;
import com.densemap.serializer.IntegerSerializer;
import com.densemap.serializer.LongSerializer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DenseMultimapTest extends TestHelper {
  private static final long VA = 100L;
  private static final long VB = 200L;
  private static final long V5 = 500L;

  static Stream<ContextConfiguration> configurations() {
    return Stream.of(//
        new ContextConfiguration(),//
        new ContextConfiguration().setValue(GlobalConfiguration.BITSET_ENCODING, "roaring"),//
        new ContextConfiguration().setValue(GlobalConfiguration.SORT_ALGORITHM, "comparison")
            .setValue(GlobalConfiguration.BITSET_SELECT_SAMPLING, 2),//
        new ContextConfiguration().setValue(GlobalConfiguration.READ_BUFFER_SIZE, 16).setValue(GlobalConfiguration.WRITE_BUFFER_SIZE, 16)
            .setValue(GlobalConfiguration.SORT_MAPPING_CHUNK_SIZE, 64));
  }

  @ParameterizedTest
  @MethodSource("configurations")
  public void gapsResolveToTheNullValue(final ContextConfiguration configuration) {
    final DenseMultimap<Long> map = newMultimap(configuration);
    map.append(5, V5);
    map.append(2, VA);
    map.append(2, VB);

    map.index();

    assertThat(map.getMaxKey()).isEqualTo(5);
    assertThat(map.values(2)).containsExactlyInAnyOrder(VA, VB);
    assertThat(map.values(5)).containsExactly(V5);
    for (final long k : new long[] { 0, 1, 3, 4 })
      assertThat(map.values(k)).as("key %d", k).containsExactly(0L);
  }

  @ParameterizedTest
  @MethodSource("configurations")
  public void randomContentMatchesAnInMemoryMultimap(final ContextConfiguration configuration) {
    final DenseMultimap<Long> map = newMultimap(configuration);
    final Map<Long, List<Long>> expected = new HashMap<>();

    final Random random = new Random(12345);
    long maxKey = 0;
    for (int i = 0; i < 5_000; i++) {
      final long key = random.nextInt(2_000);
      final long value = i + 1;
      map.append(key, value);
      expected.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
      maxKey = Math.max(maxKey, key);
    }

    map.index();

    assertThat(map.getMaxKey()).isEqualTo(maxKey);
    for (long k = 0; k <= maxKey; k++) {
      final List<Long> values = map.values(k);
      assertThat(values).as("key %d", k).isNotEmpty();
      if (expected.containsKey(k))
        assertThat(values).as("key %d", k).containsExactlyInAnyOrderElementsOf(expected.get(k));
      else
        assertThat(values).as("key %d", k).containsExactly(0L);
      assertThat(map.valueCount(k)).isEqualTo(values.size());
    }
  }

  @Test
  public void recordCountAfterAppends() {
    final DenseMultimap<Long> map = newMultimap();
    assertThat(map.recordCount()).isZero();

    for (int i = 0; i < 1_234; i++)
      map.append(i % 10, (long) i);

    assertThat(map.recordCount()).isEqualTo(1_234);
    assertThat(map.getState()).isEqualTo(MultimapState.WRITING);
  }

  @Test
  public void sortTwiceIsByteIdentical() throws IOException {
    final DenseMultimap<Long> map = newMultimap();
    final Random random = new Random(3);
    for (int i = 0; i < 2_000; i++)
      map.append(random.nextInt(100), (long) i);

    map.sort();
    assertThat(map.isSorted()).isTrue();
    assertThat(map.getState()).isEqualTo(MultimapState.SORTED);
    final byte[] first = Files.readAllBytes(new File(basePath).toPath());

    map.sort();
    assertThat(Files.readAllBytes(new File(basePath).toPath())).isEqualTo(first);

    for (int i = 1; i < map.recordCount(); i++)
      assertThat(map.nthKey(i)).isGreaterThanOrEqualTo(map.nthKey(i - 1));
  }

  @Test
  public void indexTwiceIsEquivalent() {
    final DenseMultimap<Long> map = newMultimap();
    map.append(7, 1L);
    map.append(3, 2L);
    map.append(7, 3L);

    map.index();
    final KeyIndex first = map.getKeyIndex();
    final List<List<Long>> before = allValues(map);

    map.index();
    final KeyIndex second = map.getKeyIndex();

    assertThat(second.getMaxKey()).isEqualTo(first.getMaxKey());
    assertThat(second.getRecordCount()).isEqualTo(first.getRecordCount());
    assertThat(second.getKeyStarts()).isEqualTo(first.getKeyStarts());
    assertThat(allValues(map)).isEqualTo(before);
  }

  @Test
  public void boundaryKeys() {
    final DenseMultimap<Long> map = newMultimap();
    map.append(0, 10L);
    map.append(0, 11L);
    map.append(4, 40L);
    map.append(4, 41L);
    map.append(4, 42L);

    map.index();

    assertThat(map.values(0)).containsExactlyInAnyOrder(10L, 11L);
    assertThat(map.values(4)).containsExactlyInAnyOrder(40L, 41L, 42L);
    assertThat(map.valueCount(4)).isEqualTo(3);
    assertThatThrownBy(() -> map.values(5)).isInstanceOf(KeyOutOfRangeException.class);
    assertThatThrownBy(() -> map.values(-1)).isInstanceOf(KeyOutOfRangeException.class);
  }

  @Test
  public void singleKeyDomain() {
    final DenseMultimap<Long> map = newMultimap();
    map.append(0, 1L);
    map.append(0, 2L);
    map.index();

    assertThat(map.getMaxKey()).isZero();
    assertThat(map.values(0)).containsExactlyInAnyOrder(1L, 2L);
    assertThat(map.save()).isPositive();
  }

  @Test
  public void emptyBuildFails() {
    final DenseMultimap<Long> map = newMultimap();
    assertThatThrownBy(map::index).isInstanceOf(InvariantViolationException.class);

    map.openWriter();
    map.closeWriter();
    assertThatThrownBy(map::index).isInstanceOf(InvariantViolationException.class);
    assertThat(map.isIndexed()).isFalse();
  }

  @Test
  public void queriesRequireTheIndex() {
    final DenseMultimap<Long> map = newMultimap();
    map.append(1, 1L);

    assertThatThrownBy(() -> map.values(1)).isInstanceOf(InvariantViolationException.class);
    assertThatThrownBy(() -> map.valueCount(1)).isInstanceOf(InvariantViolationException.class);
    assertThatThrownBy(map::save).isInstanceOf(InvariantViolationException.class);
    assertThatThrownBy(map::getMaxKey).isInstanceOf(InvariantViolationException.class);

    map.sort();
    assertThatThrownBy(() -> map.values(1)).isInstanceOf(InvariantViolationException.class);
    map.densify();
    assertThat(map.getState()).isEqualTo(MultimapState.DENSIFIED);
    assertThatThrownBy(() -> map.values(1)).isInstanceOf(InvariantViolationException.class);
  }

  @Test
  public void appendAfterIndexInvalidatesIt() {
    final DenseMultimap<Long> map = newMultimap();
    map.append(1, 1L);
    map.index();
    assertThat(map.isIndexed()).isTrue();

    map.append(3, 3L);
    assertThat(map.isIndexed()).isFalse();
    assertThat(map.isSorted()).isFalse();
    assertThat(map.getState()).isEqualTo(MultimapState.WRITING);
    assertThatThrownBy(() -> map.values(1)).isInstanceOf(InvariantViolationException.class);

    map.index();
    assertThat(map.getMaxKey()).isEqualTo(3);
    assertThat(map.values(1)).containsExactly(1L);
    assertThat(map.values(2)).containsExactly(0L);
    assertThat(map.values(3)).containsExactly(3L);
  }

  @Test
  public void openingTheWriterWithoutAppendingKeepsTheIndex() {
    final DenseMultimap<Long> map = newMultimap();
    map.append(2, 2L);
    map.index();

    map.openWriter();
    assertThat(map.getState()).isEqualTo(MultimapState.WRITING);
    map.closeWriter();
    assertThat(map.getState()).isEqualTo(MultimapState.INDEXED);
    assertThat(map.values(2)).containsExactly(2L);
  }

  @Test
  public void densifyReturnsTheSyntheticRecords() {
    final DenseMultimap<Long> map = newMultimap();
    map.append(4, 4L);
    map.append(1, 1L);

    assertThat(map.pad()).isEqualTo(3);
    assertThat(map.recordCount()).isEqualTo(5);
    assertThat(map.isSorted()).isTrue();
    for (int i = 0; i < 5; i++)
      assertThat(map.nthKey(i)).isEqualTo(i);
    assertThat(map.nthValue(1)).isEqualTo(1L);
    assertThat(map.nthValue(2)).isZero();

    assertThat(map.densify()).isZero();
  }

  @Test
  public void positionalReads() {
    final DenseMultimap<Long> map = newMultimap();
    map.append(9, 90L);
    map.append(8, 80L);

    // PENDING APPENDS ARE VISIBLE
    assertThat(map.nthKey(1)).isEqualTo(8);
    assertThat(map.nthValue(0)).isEqualTo(90L);
    assertThatThrownBy(() -> map.nthKey(2)).isInstanceOf(KeyOutOfRangeException.class);
  }

  @Test
  public void forEachValueStreamsTheValues() {
    final DenseMultimap<Long> map = newMultimap();
    map.append(1, 5L);
    map.append(1, 6L);
    map.index();

    final List<Long> collected = new ArrayList<>();
    map.forEachValue(1, collected::add);
    assertThat(collected).containsExactlyInAnyOrder(5L, 6L);
  }

  @Test
  public void stateTransitions() {
    final DenseMultimap<Long> map = register(new DenseMultimap<>(4, LongSerializer.INSTANCE));
    assertThat(map.getState()).isEqualTo(MultimapState.UNOPENED);
    assertThatThrownBy(() -> map.append(1, 1L)).isInstanceOf(InvariantViolationException.class);
    assertThatThrownBy(map::openReader).isInstanceOf(InvariantViolationException.class);
    assertThatThrownBy(map::getIndexFilePath).isInstanceOf(InvariantViolationException.class);

    map.openWriter(basePath);
    assertThat(map.getState()).isEqualTo(MultimapState.WRITING);
    map.append(1, 1L);
    map.closeWriter();
    assertThat(map.getState()).isEqualTo(MultimapState.READING);

    map.openReader();
    map.closeReader();
    map.index();
    assertThat(map.getState()).isEqualTo(MultimapState.INDEXED);
    assertThat(map.getIndexFilePath()).isEqualTo(basePath + ".idx");

    map.setBaseFile(basePath);
    assertThat(map.getState()).isEqualTo(MultimapState.UNOPENED);
    assertThat(map.isIndexed()).isFalse();
    assertThat(map.recordCount()).isEqualTo(2);
  }

  @Test
  public void keysOutsideTheWidth() {
    final DenseMultimap<Integer> map = register(new DenseMultimap<>(1, IntegerSerializer.INSTANCE));
    map.setBaseFile(basePath);

    map.append(255, 1);
    assertThatThrownBy(() -> map.append(256, 1)).isInstanceOf(KeyOutOfRangeException.class);
    assertThatThrownBy(() -> map.append(-3, 1)).isInstanceOf(KeyOutOfRangeException.class);

    map.index();
    assertThat(map.getMaxKey()).isEqualTo(255);
    assertThat(map.values(255)).containsExactly(1);
    assertThat(map.values(17)).containsExactly(0);
  }

  @Test
  public void opaqueValues() {
    final DenseMultimap<byte[]> map = register(new DenseMultimap<>(2, new FixedBytesSerializer(3)));
    map.setBaseFile(basePath);
    map.append(1, new byte[] { 1, 2, 3 });
    map.index();

    assertThat(map.values(1).get(0)).containsExactly(1, 2, 3);
    assertThat(map.values(0).get(0)).containsExactly(0, 0, 0);
  }

  @Test
  public void rejectedAppendLeavesNoPartialRecord() {
    final DenseMultimap<byte[]> opaque = register(new DenseMultimap<>(4, new FixedBytesSerializer(4)));
    opaque.setBaseFile(basePath + "-opaque");
    opaque.append(0, new byte[] { 1, 2, 3, 4 });
    assertThatThrownBy(() -> opaque.append(1, new byte[] { 1, 2, 3 })).isInstanceOf(IllegalArgumentException.class);
    opaque.append(2, new byte[] { 5, 6, 7, 8 });

    assertThat(opaque.recordCount()).isEqualTo(2);
    opaque.index();
    assertThat(opaque.values(1).get(0)).containsExactly(0, 0, 0, 0);
    assertThat(opaque.values(2).get(0)).containsExactly(5, 6, 7, 8);

    final DenseMultimap<Long> map = newMultimap();
    map.append(0, VA);
    assertThatThrownBy(() -> map.append(1, null)).isInstanceOf(NullPointerException.class);
    map.append(2, VB);

    map.index();
    assertThat(map.recordCount()).isEqualTo(3);
    assertThat(map.values(0)).containsExactly(VA);
    assertThat(map.values(1)).containsExactly(0L);
    assertThat(map.values(2)).containsExactly(VB);
  }

  @Test
  public void keyWidthFromConfiguration() {
    final ContextConfiguration cfg = new ContextConfiguration().setValue(GlobalConfiguration.KEY_WIDTH, 2);
    final DenseMultimap<Long> map = register(new DenseMultimap<>(LongSerializer.INSTANCE, cfg));
    assertThat(map.getCodec().getKeyWidth()).isEqualTo(2);
    assertThat(map.getCodec().getRecordWidth()).isEqualTo(10);
  }

  @Test
  public void invalidConfiguration() {
    assertThatThrownBy(() -> new DenseMultimap<>(4, LongSerializer.INSTANCE,
        new ContextConfiguration().setValue(GlobalConfiguration.SORT_ALGORITHM, "bogo"))).isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(() -> new DenseMultimap<>(4, LongSerializer.INSTANCE,
        new ContextConfiguration().setValue(GlobalConfiguration.SORT_CHAR_START, 300))).isInstanceOf(ConfigurationException.class);
  }

  private static List<List<Long>> allValues(final DenseMultimap<Long> map) {
    final List<List<Long>> result = new ArrayList<>();
    for (long k = 0; k <= map.getMaxKey(); k++) {
      final List<Long> values = map.values(k);
      values.sort(Long::compare);
      result.add(values);
    }
    return result;
  }
}
