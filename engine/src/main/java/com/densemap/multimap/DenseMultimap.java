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
import com.densemap.engine.RecordCodec;
import com.densemap.engine.RecordCursor;
import com.densemap.engine.RecordFile;
import com.densemap.engine.RecordReader;
import com.densemap.engine.RecordWriter;
import com.densemap.engine.sort.RecordSorter;
import com.densemap.engine.sort.RecordSorters;
import com.densemap.engine.sort.SortOptions;
import com.densemap.exception.InvariantViolationException;
import com.densemap.exception.StorageException;
import com.densemap.index.BitsetEncoding;
import com.densemap.index.SuccinctBitsetFactory;
import com.densemap.log.LogManager;
import com.densemap.serializer.ValueSerializer;
import com.densemap.utility.FileUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Level;

/**
 * Disk-resident multimap from a dense range of integer keys [0, max key] to fixed-width values. It is built once by appending records
 * in any order, then {@link #index()} sorts the backing file, fills the missing keys with null values and builds a succinct index of
 * the first record of each key. After that {@link #values(long)} resolves any key with two select queries and one sequential read.
 * <p>
 * Typical usage:
 * <pre>
 * try (DenseMultimap&lt;Long&gt; map = new DenseMultimap&lt;&gt;(4, LongSerializer.INSTANCE)) {
 *   map.setBaseFile("/data/edges.bin");
 *   map.append(5, 50L);
 *   map.append(2, 20L);
 *   map.index();
 *   map.save();
 *   List&lt;Long&gt; values = map.values(2);
 * }
 * </pre>
 * Appending after the index was built is allowed but discards the index: the whole build must be repeated before querying again. The
 * instance is not thread safe.
 *
 * @param <V> type of the values
 */
public class DenseMultimap<V> implements AutoCloseable {
  private final ContextConfiguration  configuration;
  private final RecordCodec<V>        codec;
  private final RecordSorter          sorter;
  private final SortOptions           sortOptions;
  private final SuccinctBitsetFactory bitsetFactory;
  private       RecordFile<V>         file;
  private       RecordWriter<V>       writer;
  private       RecordReader<V>       reader;
  private       MultimapState         state     = MultimapState.UNOPENED;
  private       boolean               sorted    = false;
  private       boolean               densified = false;
  private       KeyIndex              index;

  public DenseMultimap(final int keyWidth, final ValueSerializer<V> valueSerializer) {
    this(keyWidth, valueSerializer, new ContextConfiguration());
  }

  /**
   * Creates a multimap with the key width configured with `densemap.keyWidth`.
   */
  public DenseMultimap(final ValueSerializer<V> valueSerializer, final ContextConfiguration configuration) {
    this(configuration.getValueAsInteger(GlobalConfiguration.KEY_WIDTH), valueSerializer, configuration);
  }

  public DenseMultimap(final int keyWidth, final ValueSerializer<V> valueSerializer, final ContextConfiguration configuration) {
    this(keyWidth, valueSerializer, configuration, RecordSorters.forName(configuration.getValueAsString(GlobalConfiguration.SORT_ALGORITHM)),
        BitsetEncoding.forName(configuration.getValueAsString(GlobalConfiguration.BITSET_ENCODING)).newFactory(configuration));
  }

  public DenseMultimap(final int keyWidth, final ValueSerializer<V> valueSerializer, final ContextConfiguration configuration,
      final RecordSorter sorter, final SuccinctBitsetFactory bitsetFactory) {
    this.configuration = configuration;
    this.codec = new RecordCodec<>(keyWidth, valueSerializer);
    this.sorter = sorter;
    this.sortOptions = SortOptions.fromConfiguration(configuration);
    this.bitsetFactory = bitsetFactory;
  }

  /**
   * Binds the multimap to a backing file. Any open handle is closed and the current index is discarded. The file is not created nor
   * truncated: appending to an existing file adds records to it.
   */
  public void setBaseFile(final String path) {
    closeHandles();
    this.file = new RecordFile<>(path, codec, configuration.getValueAsInteger(GlobalConfiguration.READ_BUFFER_SIZE),
        configuration.getValueAsInteger(GlobalConfiguration.WRITE_BUFFER_SIZE));
    this.state = MultimapState.UNOPENED;
    this.sorted = false;
    this.densified = false;
    this.index = null;
  }

  public void openWriter(final String path) {
    setBaseFile(path);
    openWriter();
  }

  /**
   * Opens the append handle, creating the backing file if missing.
   */
  public void openWriter() {
    checkBaseFile();
    if (writer == null)
      writer = file.openWriter();
    state = MultimapState.WRITING;
  }

  /**
   * Flushes and closes the append handle.
   */
  public void closeWriter() {
    if (writer == null)
      return;

    try {
      writer.close();
    } finally {
      writer = null;
      state = restingState();
    }
  }

  public void openReader() {
    checkBaseFile();
    getReader();
    if (state == MultimapState.UNOPENED || state == MultimapState.WRITING)
      state = MultimapState.READING;
  }

  public void closeReader() {
    if (reader == null)
      return;

    try {
      reader.close();
    } finally {
      reader = null;
    }
  }

  /**
   * Appends one record at the end of the backing file, opening the append handle if needed. Any previous sort or index is invalidated.
   *
   * @throws com.densemap.exception.KeyOutOfRangeException if the key is negative or does not fit the key width
   */
  public void append(final long key, final V value) {
    openWriter();
    writer.append(key, value);
    sorted = false;
    densified = false;
    index = null;
  }

  /**
   * Sorts the backing file in place by key. Does nothing if the file is already sorted.
   */
  public void sort() {
    checkBaseFile();
    closeWriter();
    if (sorted)
      return;

    closeReader();
    if (file.exists()) {
      LogManager.instance().log(this, Level.FINE, "Sorting %d records of file %s with %s...", file.getRecordCount(), file.getFileName(),
          sorter.getName());
      sorter.sortByKeyPrefix(file.getOSFile().toPath(), codec.getRecordWidth(), codec.getKeyWidth(), sortOptions);
    }

    sorted = true;
    state = MultimapState.SORTED;
  }

  /**
   * Sorts the backing file, then appends one null record for every missing key in [0, max key] and sorts again if needed.
   *
   * @return the number of null records appended
   *
   * @throws InvariantViolationException if the multimap has no records
   */
  public long densify() {
    sort();
    if (!file.exists() || file.getRecordCount() == 0)
      throw new InvariantViolationException("Cannot densify the empty multimap '" + file.getFilePath() + "'");

    final long appended;
    try (final RecordWriter<V> padWriter = file.openWriter()) {
      appended = new Densifier<>(getReader(), padWriter).densify();
    }

    if (appended > 0) {
      sorted = false;
      sort();
    }

    densified = true;
    state = MultimapState.DENSIFIED;
    return appended;
  }

  /**
   * Same as {@link #densify()}.
   */
  public long pad() {
    return densify();
  }

  /**
   * Runs the whole build: sort, densify and the index of the first record of every key. Running it again on an unchanged multimap
   * produces an equivalent index.
   *
   * @throws InvariantViolationException if the multimap has no records
   */
  public void index() {
    final long begin = System.nanoTime();

    densify();
    index = new IndexBuilder(bitsetFactory).build(getReader());
    state = MultimapState.INDEXED;

    LogManager.instance()
        .log(this, Level.FINE, "Multimap %s indexed: %d records, max key %d (%s)", file.getFileName(), index.getRecordCount(),
            index.getMaxKey(), FileUtils.elapsedMillis(begin));
  }

  /**
   * Persists the index to {@link #getIndexFilePath()}.
   *
   * @return the number of bytes written
   */
  public long save() {
    checkIndexed();
    return new IndexFile(getIndexFilePath()).write(codec.getRecordWidth(), index);
  }

  /**
   * Binds the multimap to an existing backing file and loads the index saved next to it.
   *
   * @throws com.densemap.exception.FormatMismatchException if the index file is not valid or has an unsupported version
   * @throws com.densemap.exception.SchemaMismatchException if the index was saved with a different record width
   * @throws com.densemap.exception.StaleIndexException    if the backing file changed after the index was saved
   * @throws StorageException                              if the backing file or the index file are missing
   */
  public void load(final String path) {
    setBaseFile(path);
    if (!file.exists())
      throw new StorageException("File '" + path + "' not found");

    openReader();
    index = new IndexFile(getIndexFilePath()).read(codec.getRecordWidth(), reader,
        encoding -> encoding == bitsetFactory.getEncoding() ? bitsetFactory : encoding.newFactory(configuration));
    sorted = true;
    densified = true;
    state = MultimapState.INDEXED;
  }

  /**
   * Returns the values of the key in file order. The list is never empty: keys never appended have one null value.
   *
   * @throws InvariantViolationException                   if the multimap is not indexed
   * @throws com.densemap.exception.KeyOutOfRangeException if the key is outside [0, max key]
   */
  public List<V> values(final long key) {
    final List<V> result = new ArrayList<>();
    forEachValue(key, result::add);
    return result;
  }

  public void forEachValue(final long key, final Consumer<V> consumer) {
    checkIndexed();
    final RecordCursor<V> cursor = getReader().cursor(index.firstRecord(key), index.endRecord(key));
    while (cursor.next())
      consumer.accept(cursor.getValue());
  }

  /**
   * Returns the number of values of the key without reading them.
   */
  public long valueCount(final long key) {
    checkIndexed();
    return index.endRecord(key) - index.firstRecord(key);
  }

  /**
   * Number of records of the backing file, including the ones still buffered by the append handle.
   */
  public long recordCount() {
    checkBaseFile();
    if (writer != null)
      writer.flush();
    return file.exists() ? file.getRecordCount() : 0;
  }

  /**
   * Key of the record at the position in file order.
   */
  public long nthKey(final long position) {
    checkBaseFile();
    if (writer != null)
      writer.flush();
    return getReader().readKey(position);
  }

  public V nthValue(final long position) {
    checkBaseFile();
    if (writer != null)
      writer.flush();
    return getReader().readValue(position);
  }

  public long getMaxKey() {
    checkIndexed();
    return index.getMaxKey();
  }

  public MultimapState getState() {
    return state;
  }

  public boolean isSorted() {
    return sorted;
  }

  public boolean isIndexed() {
    return state == MultimapState.INDEXED;
  }

  public String getIndexFilePath() {
    checkBaseFile();
    return file.getFilePath() + configuration.getValueAsString(GlobalConfiguration.INDEX_FILE_EXTENSION);
  }

  public String getBaseFilePath() {
    return file != null ? file.getFilePath() : null;
  }

  public RecordCodec<V> getCodec() {
    return codec;
  }

  KeyIndex getKeyIndex() {
    return index;
  }

  RecordReader<V> getReader() {
    if (reader == null)
      reader = file.openReader();
    return reader;
  }

  /**
   * Closes the open handles. Files are kept.
   */
  @Override
  public void close() {
    closeHandles();
  }

  private void closeHandles() {
    try {
      closeWriter();
    } finally {
      closeReader();
    }
  }

  private MultimapState restingState() {
    if (index != null)
      return MultimapState.INDEXED;
    if (densified)
      return MultimapState.DENSIFIED;
    if (sorted)
      return MultimapState.SORTED;
    return file != null && file.exists() ? MultimapState.READING : MultimapState.UNOPENED;
  }

  private void checkBaseFile() {
    if (file == null)
      throw new InvariantViolationException("Base file not set");
  }

  private void checkIndexed() {
    if (state != MultimapState.INDEXED || index == null)
      throw new InvariantViolationException("Multimap is not indexed (state=" + state + ")");
  }

  @Override
  public String toString() {
    return "DenseMultimap{file=" + file + ", state=" + state + "}";
  }
}
