/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.exporter.prometheus;

/** Turns view names and tag keys into valid Prometheus metric and label names. */
final class NameSanitizer {

  static final int MAX_LENGTH = 100;

  /**
   * Replaces every character that is not an ASCII letter or digit with {@code _}, truncates to
   * {@value #MAX_LENGTH} characters, prefixes {@code key_} when the result starts with a digit and
   * {@code key} when it starts with an underscore.
   */
  static String sanitize(String name) {
    if (name.isEmpty()) {
      return name;
    }
    if (name.length() > MAX_LENGTH) {
      name = name.substring(0, MAX_LENGTH);
    }
    StringBuilder sb = new StringBuilder(name.length() + 4);
    for (int i = 0; i < name.length(); i++) {
      char ch = name.charAt(i);
      sb.append(isAsciiLetterOrDigit(ch) ? ch : '_');
    }
    char first = sb.charAt(0);
    if (first >= '0' && first <= '9') {
      sb.insert(0, "key_");
    } else if (first == '_') {
      sb.insert(0, "key");
    }
    return sb.toString();
  }

  private static boolean isAsciiLetterOrDigit(char ch) {
    return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || (ch >= '0' && ch <= '9');
  }

  private NameSanitizer() {}
}
