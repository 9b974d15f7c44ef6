/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.api.tag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

class TagKeyTest {

  @Test
  void create() {
    TagKey key = TagKey.create("method");
    assertThat(key.getName()).isEqualTo("method");
    assertThat(key).isEqualTo(TagKey.create("method"));
  }

  @Test
  void create_rejectsInvalidNames() {
    assertThatThrownBy(() -> TagKey.create(""))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Invalid tag key name");
    assertThatThrownBy(() -> TagKey.create("café"))
        .isInstanceOf(IllegalArgumentException.class);
    char[] tooLong = new char[256];
    Arrays.fill(tooLong, 'k');
    assertThatThrownBy(() -> TagKey.create(new String(tooLong)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void compareTo_ordersByName() {
    assertThat(TagKey.create("a")).isLessThan(TagKey.create("b"));
    assertThat(TagKey.create("b").compareTo(TagKey.create("b"))).isZero();
  }
}
