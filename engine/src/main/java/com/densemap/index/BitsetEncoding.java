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
package com.densemap.index;

import com.densemap.ContextConfiguration;
import com.densemap.GlobalConfiguration;
import com.densemap.exception.ConfigurationException;

/**
 * Available bitset encodings. The code is the byte persisted in the index file, so never change the codes of existing entries.
 */
public enum BitsetEncoding {
  ELIAS_FANO((byte) 1, "elias-fano"), ROARING((byte) 2, "roaring");

  private final byte   code;
  private final String name;

  BitsetEncoding(final byte code, final String name) {
    this.code = code;
    this.name = name;
  }

  public byte getCode() {
    return code;
  }

  public String getName() {
    return name;
  }

  /**
   * Creates the factory for this encoding, tuned by the configuration.
   */
  public SuccinctBitsetFactory newFactory(final ContextConfiguration configuration) {
    switch (this) {
    case ELIAS_FANO:
      return new EliasFanoBitsetFactory(configuration.getValueAsInteger(GlobalConfiguration.BITSET_SELECT_SAMPLING));
    case ROARING:
      return new RoaringBitsetFactory();
    default:
      throw new ConfigurationException("Unsupported bitset encoding " + this);
    }
  }

  /**
   * @return the encoding with the code or null if not found
   */
  public static BitsetEncoding fromCode(final byte code) {
    for (final BitsetEncoding e : values())
      if (e.code == code)
        return e;
    return null;
  }

  public static BitsetEncoding forName(final String name) {
    for (final BitsetEncoding e : values())
      if (e.name.equalsIgnoreCase(name))
        return e;
    throw new ConfigurationException("Unsupported bitset encoding '" + name + "'");
  }
}
