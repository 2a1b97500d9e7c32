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

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.Level;

public class Constants {
  public static final String PRODUCT = "DenseMap";

  private static final Properties properties = new Properties();

  static {
    try (final InputStream inputStream = Constants.class.getResourceAsStream("/com/densemap/densemap.properties")) {
      if (inputStream != null)
        properties.load(inputStream);
      else
        LogManager.instance().log(Constants.class, Level.WARNING, "DenseMap properties not found in classpath");
    } catch (final IOException e) {
      LogManager.instance().log(Constants.class, Level.SEVERE, "Failed to load DenseMap properties", e);
    }
  }

  /**
   * @return Returns only current version without build number and etc.
   */
  public static String getRawVersion() {
    return properties.getProperty("version", "unknown");
  }

  /**
   * @return the build timestamp if any.
   */
  public static String getTimestamp() {
    final String t = properties.getProperty("timestamp");
    return t == null || "${timestamp}".equals(t) ? null : t;
  }

  public static String getVersion() {
    final String timestamp = getTimestamp();
    return timestamp != null ? getRawVersion() + " (build " + timestamp + ")" : getRawVersion();
  }

  /**
   * @return true if current DenseMap version is a snapshot.
   */
  public static boolean isSnapshot() {
    return getRawVersion().endsWith("SNAPSHOT");
  }
}
