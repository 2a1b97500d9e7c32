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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ContextConfigurationTest {
  @AfterEach
  void resetConfiguration() {
    GlobalConfiguration.resetAll();
  }

  @Test
  void fallsBackToGlobalValues() {
    final ContextConfiguration cfg = new ContextConfiguration();
    assertThat(cfg.getValueAsInteger(GlobalConfiguration.KEY_WIDTH)).isEqualTo(8);

    GlobalConfiguration.KEY_WIDTH.setValue(2);
    assertThat(cfg.getValueAsInteger(GlobalConfiguration.KEY_WIDTH)).isEqualTo(2);
    assertThat(cfg.hasValue(GlobalConfiguration.KEY_WIDTH)).isFalse();
  }

  @Test
  void overridesGlobalValues() {
    final ContextConfiguration cfg = new ContextConfiguration()//
        .setValue(GlobalConfiguration.SORT_ALGORITHM, "comparison")//
        .setValue(GlobalConfiguration.READ_BUFFER_SIZE, "4KB");

    assertThat(cfg.getValueAsString(GlobalConfiguration.SORT_ALGORITHM)).isEqualTo("comparison");
    assertThat(cfg.getValueAsInteger(GlobalConfiguration.READ_BUFFER_SIZE)).isEqualTo(4096);
    assertThat(GlobalConfiguration.SORT_ALGORITHM.getValueAsString()).isEqualTo("radix");
    assertThat(cfg.getContextSize()).isEqualTo(2);

    cfg.setValue(GlobalConfiguration.SORT_ALGORITHM, null);
    assertThat(cfg.getValueAsString(GlobalConfiguration.SORT_ALGORITHM)).isEqualTo("radix");
  }

  @Test
  void copyAndMerge() {
    final ContextConfiguration parent = new ContextConfiguration(Map.<String, Object>of(GlobalConfiguration.SORT_CUT_OFF.getKey(), 8));
    final ContextConfiguration child = new ContextConfiguration(parent);
    assertThat(child.getValueAsInteger(GlobalConfiguration.SORT_CUT_OFF)).isEqualTo(8);

    child.merge(new ContextConfiguration().setValue(GlobalConfiguration.TEST, true));
    assertThat(child.getValueAsBoolean(GlobalConfiguration.TEST)).isTrue();
    assertThat(child.getContextKeys()).containsExactlyInAnyOrder("densemap.sort.cutOff", "densemap.test");

    child.reset();
    assertThat(child.getContextSize()).isZero();
  }

  @Test
  void jsonRoundTrip() {
    final ContextConfiguration cfg = new ContextConfiguration().setValue(GlobalConfiguration.BITSET_ENCODING, "roaring");

    final ContextConfiguration copy = new ContextConfiguration();
    copy.fromJSON(cfg.toJSON());
    assertThat(copy.getValueAsString(GlobalConfiguration.BITSET_ENCODING)).isEqualTo("roaring");
  }
}
