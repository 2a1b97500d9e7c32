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

import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.fail;

public class GlobalConfigurationTest {
  @AfterEach
  public void resetConfiguration() {
    GlobalConfiguration.resetAll();
  }

  @Test
  public void testSortAlgorithm() {
    GlobalConfiguration.SORT_ALGORITHM.setValue("comparison");
    assertThat(GlobalConfiguration.SORT_ALGORITHM.getValueAsString()).isEqualTo("comparison");

    GlobalConfiguration.SORT_ALGORITHM.setValue("RADIX");
    assertThat(GlobalConfiguration.SORT_ALGORITHM.getValueAsString()).isEqualTo("radix");

    try {
      GlobalConfiguration.SORT_ALGORITHM.setValue("bubble");
      fail("");
    } catch (final IllegalArgumentException e) {
      // EXPECTED
    }

    assertThat(GlobalConfiguration.SORT_ALGORITHM.getValueAsString()).isEqualTo("radix");
  }

  @Test
  public void testTypeConversion() {
    try {
      GlobalConfiguration.SORT_CUT_OFF.setValue("notvalid");
      fail("");
    } catch (final IllegalArgumentException e) {
      // EXPECTED
    }

    GlobalConfiguration.READ_BUFFER_SIZE.setValue("128KB");
    assertThat(GlobalConfiguration.READ_BUFFER_SIZE.getValueAsInteger()).isEqualTo(128 * 1024);

    GlobalConfiguration.SORT_MAPPING_CHUNK_SIZE.setValue("2GB");
    assertThat(GlobalConfiguration.SORT_MAPPING_CHUNK_SIZE.getValueAsLong()).isEqualTo(2L * 1024 * 1024 * 1024);

    GlobalConfiguration.TEST.setValue("true");
    assertThat(GlobalConfiguration.TEST.getValueAsBoolean()).isTrue();
  }

  @Test
  public void testKeyWidthIsValidated() {
    GlobalConfiguration.KEY_WIDTH.setValue(3);
    assertThat(GlobalConfiguration.KEY_WIDTH.getValueAsInteger()).isEqualTo(3);

    assertThatThrownBy(() -> GlobalConfiguration.KEY_WIDTH.setValue(9)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> GlobalConfiguration.KEY_WIDTH.setValue(0)).isInstanceOf(IllegalArgumentException.class);
    assertThat(GlobalConfiguration.KEY_WIDTH.getValueAsInteger()).isEqualTo(3);
  }

  @Test
  public void testDefaultValue() {
    GlobalConfiguration.SORT_STACK_SIZE.reset();
    final int original = GlobalConfiguration.SORT_STACK_SIZE.getValueAsInteger();

    assertThat(GlobalConfiguration.SORT_STACK_SIZE.getDefValue()).isEqualTo(original);
    assertThat(GlobalConfiguration.SORT_STACK_SIZE.isChanged()).isFalse();
    GlobalConfiguration.SORT_STACK_SIZE.setValue(4);
    assertThat(GlobalConfiguration.SORT_STACK_SIZE.isChanged()).isTrue();

    GlobalConfiguration.SORT_STACK_SIZE.reset();
    assertThat(GlobalConfiguration.SORT_STACK_SIZE.getValueAsInteger()).isEqualTo(12);
  }

  @Test
  public void testJSON() {
    GlobalConfiguration.BITSET_ENCODING.setValue("roaring");
    final String json = GlobalConfiguration.toJSON();
    assertThat(new JSONObject(json).getJSONObject("configuration").getString("bitset.encoding")).isEqualTo("roaring");

    GlobalConfiguration.resetAll();
    assertThat(GlobalConfiguration.BITSET_ENCODING.getValueAsString()).isEqualTo("elias-fano");

    GlobalConfiguration.fromJSON(json);
    assertThat(GlobalConfiguration.BITSET_ENCODING.getValueAsString()).isEqualTo("roaring");
  }

  @Test
  public void testSetConfigurationByKeyOrName() {
    GlobalConfiguration.setConfiguration(Map.of("densemap.sort.cutOff", 16, "BITSET_SELECT_SAMPLING", 32));
    assertThat(GlobalConfiguration.SORT_CUT_OFF.getValueAsInteger()).isEqualTo(16);
    assertThat(GlobalConfiguration.BITSET_SELECT_SAMPLING.getValueAsInteger()).isEqualTo(32);
    assertThat(GlobalConfiguration.findByKey("DENSEMAP.SORT.CUTOFF")).isEqualTo(GlobalConfiguration.SORT_CUT_OFF);
    assertThat(GlobalConfiguration.findByKey("densemap.unknown")).isNull();
  }
}
