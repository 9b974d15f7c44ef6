/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.exporter.prometheus;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

class NameSanitizerTest {

  @Test
  void replacesNonAlphanumerics() {
    assertThat(NameSanitizer.sanitize("tests/foo")).isEqualTo("tests_foo");
    assertThat(NameSanitizer.sanitize("key/1")).isEqualTo("key_1");
    assertThat(NameSanitizer.sanitize("a.b-c d")).isEqualTo("a_b_c_d");
    assertThat(NameSanitizer.sanitize("hé")).isEqualTo("h_");
  }

  @Test
  void prefixesLeadingDigitAndUnderscore() {
    assertThat(NameSanitizer.sanitize("0abc")).isEqualTo("key_0abc");
    assertThat(NameSanitizer.sanitize("_abc")).isEqualTo("key_abc");
    assertThat(NameSanitizer.sanitize("/abc")).isEqualTo("key_abc");
  }

  @Test
  void truncates() {
    char[] chars = new char[150];
    Arrays.fill(chars, 'a');

    assertThat(NameSanitizer.sanitize(new String(chars))).hasSize(NameSanitizer.MAX_LENGTH);
  }

  @Test
  void empty() {
    assertThat(NameSanitizer.sanitize("")).isEmpty();
  }
}
