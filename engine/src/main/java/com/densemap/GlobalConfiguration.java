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
package com.densemap;

import com.densemap.log.LogManager;
import com.densemap.utility.Callable;
import com.densemap.utility.FileUtils;
import org.json.JSONObject;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;

/**
 * Keeps all configuration settings. At startup assigns the configuration values by reading system properties and, as a fallback,
 * environment variables with the same name.
 */
public enum GlobalConfiguration {
  // ENVIRONMENT
  DUMP_CONFIG_AT_STARTUP("densemap.dumpConfigAtStartup", "Dumps the configuration at startup", Boolean.class, false, new Callable<Object, Object>() {
    @Override
    public Object call(final Object value) {
      if (Boolean.parseBoolean(value.toString()))
        dumpConfiguration(System.out);
      return value;
    }
  }),

  TEST("densemap.test", "Tells if it is running in test mode", Boolean.class, false),

  // RECORDS
  KEY_WIDTH("densemap.keyWidth", "Width in bytes of the keys stored in the backing file. Allowed values are 1..8", Integer.class, 8,
      new Callable<Object, Object>() {
        @Override
        public Object call(final Object value) {
          final int width = Integer.parseInt(value.toString());
          if (width < 1 || width > 8)
            throw new IllegalArgumentException("Invalid key width " + width + ", allowed values are 1..8");
          return value;
        }
      }),

  INDEX_FILE_EXTENSION("densemap.indexFileExtension", "Extension appended to the base file name to obtain the index file name", String.class, ".idx"),

  READ_BUFFER_SIZE("densemap.readBufferSize", "Size of the buffer used to scan the backing file sequentially", Integer.class, 64 * 1024),

  WRITE_BUFFER_SIZE("densemap.writeBufferSize", "Size of the buffer used to append records to the backing file", Integer.class, 64 * 1024),

  // SORT
  SORT_ALGORITHM("densemap.sort.algorithm", "Algorithm used to sort the backing file in place by key: 'radix' or 'comparison'", String.class, "radix",
      new String[] { "radix", "comparison" }),

  SORT_CHAR_START("densemap.sort.charStart", "Lowest byte value the radix sort distinguishes. Lower bytes fall in the first bucket", Integer.class, 0),

  SORT_CHAR_STOP("densemap.sort.charStop", "Highest byte value the radix sort distinguishes. Higher bytes fall in the last bucket", Integer.class, 255),

  SORT_STACK_SIZE("densemap.sort.stackSize",
      "Maximum number of key bytes the radix sort recurses on. Partitions still unsorted past this depth are sorted by comparison", Integer.class,
      12),

  SORT_CUT_OFF("densemap.sort.cutOff", "Partitions with less records than this are sorted with insertion sort", Integer.class, 4),

  SORT_MAPPING_CHUNK_SIZE("densemap.sort.mappingChunkSize", "Maximum size of each memory mapped region used by the radix sort", Long.class,
      FileUtils.GIGABYTE),

  // BITSET
  BITSET_ENCODING("densemap.bitset.encoding", "Succinct encoding of the key start bitvector: 'elias-fano' or 'roaring'", String.class,
      "elias-fano", new String[] { "elias-fano", "roaring" }),

  BITSET_SELECT_SAMPLING("densemap.bitset.selectSampling",
      "Elias-Fano select support samples the position of one every N set bits. Lower values use more memory and answer faster", Integer.class,
      64),
  ;

  /**
   * Place holder for the "undefined" value of setting.
   */
  private final Object nullValue = new Object();

  private final       String                   key;
  private final       Object                   defValue;
  private final       Class<?>                 type;
  private final       Callable<Object, Object> callback;
  private final       String[]                 allowedValues;
  private volatile    Object                   value  = nullValue;
  private final       String                   description;
  public final static String                   PREFIX = "densemap.";

  static {
    readConfiguration();
  }

  GlobalConfiguration(final String key, final String description, final Class<?> type, final Object defValue) {
    this(key, description, type, defValue, (Callable<Object, Object>) null);
  }

  GlobalConfiguration(final String key, final String description, final Class<?> type, final Object defValue,
      final Callable<Object, Object> callback) {
    this.key = key;
    this.description = description;
    this.defValue = defValue;
    this.type = type;
    this.callback = callback;
    this.allowedValues = null;
  }

  GlobalConfiguration(final String key, final String description, final Class<?> type, final Object defValue,
      final String[] allowedValues) {
    this.key = key;
    this.description = description;
    this.defValue = defValue;
    this.type = type;
    this.callback = null;
    this.allowedValues = allowedValues;
  }

  /**
   * Reset all the configurations to the default values.
   */
  public static void resetAll() {
    for (final GlobalConfiguration v : values())
      v.reset();
  }

  /**
   * Reset the configuration to the default value.
   */
  public void reset() {
    value = nullValue;
  }

  public static void dumpConfiguration(final PrintStream out) {
    out.print(Constants.PRODUCT.toUpperCase(Locale.ENGLISH));
    out.print(" ");
    out.print(Constants.getRawVersion());
    out.println(" configuration:");

    String lastSection = "";
    for (final GlobalConfiguration v : values()) {
      final String subKey = v.key.substring(PREFIX.length());
      final int dot = subKey.indexOf('.');
      final String section = dot > -1 ? subKey.substring(0, dot) : "general";

      if (!lastSection.equals(section)) {
        out.print("- ");
        out.println(section.toUpperCase(Locale.ENGLISH));
        lastSection = section;
      }
      out.print("  + ");
      out.print(v.key);
      out.print(" = ");
      out.println(String.valueOf((Object) v.getValue()));
    }
  }

  public static void fromJSON(final String input) {
    if (input == null)
      return;

    final JSONObject json = new JSONObject(input);
    final JSONObject cfg = json.getJSONObject("configuration");
    for (final String k : cfg.keySet()) {
      final GlobalConfiguration cfgEntry = findByKey(PREFIX + k);
      if (cfgEntry != null)
        cfgEntry.setValue(cfg.get(k));
    }
  }

  public static String toJSON() {
    final JSONObject json = new JSONObject();

    final JSONObject cfg = new JSONObject();
    json.put("configuration", cfg);

    for (final GlobalConfiguration k : values())
      cfg.put(k.key.substring(PREFIX.length()), (Object) k.getValue());

    return json.toString();
  }

  /**
   * Find the GlobalConfiguration instance by the key. Key is case insensitive.
   *
   * @return GlobalConfiguration instance if found, otherwise null
   */
  public static GlobalConfiguration findByKey(final String key) {
    for (final GlobalConfiguration v : values()) {
      if (v.getKey().equalsIgnoreCase(key))
        return v;
    }
    return null;
  }

  /**
   * Changes the configuration values in one shot by passing a Map of values. Keys can be the Java ENUM names or the string
   * representation of configuration values
   */
  public static void setConfiguration(final Map<String, Object> config) {
    for (final Map.Entry<String, Object> entry : config.entrySet()) {
      for (final GlobalConfiguration v : values()) {
        if (v.getKey().equals(entry.getKey()) || v.name().equals(entry.getKey())) {
          v.setValue(entry.getValue());
          break;
        }
      }
    }
  }

  /**
   * Assign configuration values by reading system properties.
   */
  private static void readConfiguration() {
    for (final GlobalConfiguration config : values()) {
      String prop = System.getProperty(config.key);
      if (prop == null)
        prop = System.getenv(config.key);

      if (prop != null) {
        try {
          config.setValue(prop);
        } catch (final IllegalArgumentException e) {
          LogManager.instance().log(GlobalConfiguration.class, Level.SEVERE, "Invalid setting %s=%s, using the default value", e, config.key, prop);
        }
      }
    }
  }

  public <T> T getValue() {
    //noinspection unchecked
    return (T) (value != nullValue && value != null ? value : defValue);
  }

  /**
   * @return {@literal true} if configuration was changed from default value and {@literal false} otherwise.
   */
  public boolean isChanged() {
    return value != nullValue;
  }

  /**
   * Converts and assigns the value. Numeric settings accept size strings like '64KB' or '1GB'.
   *
   * @throws IllegalArgumentException if the value cannot be converted or is not among the allowed values
   */
  public void setValue(final Object newValue) {
    Object converted = newValue;
    if (newValue != null) {
      if (type == Boolean.class)
        converted = Boolean.parseBoolean(newValue.toString());
      else if (type == Integer.class)
        converted = newValue instanceof Number ? ((Number) newValue).intValue() : (int) FileUtils.getSizeAsNumber(newValue.toString());
      else if (type == Long.class)
        converted = newValue instanceof Number ? ((Number) newValue).longValue() : FileUtils.getSizeAsNumber(newValue.toString());
      else if (type == String.class)
        converted = newValue.toString();
    }

    if (allowedValues != null && converted != null) {
      boolean accepted = false;
      for (final String allowed : allowedValues)
        if (allowed.equalsIgnoreCase(converted.toString())) {
          converted = allowed;
          accepted = true;
          break;
        }

      if (!accepted)
        throw new IllegalArgumentException(
            "Invalid value '" + converted + "' of `" + key + "` option. Allowed values are " + Arrays.toString(allowedValues));
    }

    if (callback != null && converted != null)
      converted = callback.call(converted);

    value = converted;
  }

  public boolean getValueAsBoolean() {
    final Object v = getValue();
    return v instanceof Boolean ? (Boolean) v : Boolean.parseBoolean(v.toString());
  }

  public String getValueAsString() {
    final Object v = getValue();
    return v != null ? v.toString() : null;
  }

  public int getValueAsInteger() {
    final Object v = getValue();
    return (int) (v instanceof Number ? ((Number) v).intValue() : FileUtils.getSizeAsNumber(v.toString()));
  }

  public long getValueAsLong() {
    final Object v = getValue();
    return v instanceof Number ? ((Number) v).longValue() : FileUtils.getSizeAsNumber(v.toString());
  }

  public String getKey() {
    return key;
  }

  public Object getDefValue() {
    return defValue;
  }

  public Class<?> getType() {
    return type;
  }

  public String getDescription() {
    return description;
  }
}
