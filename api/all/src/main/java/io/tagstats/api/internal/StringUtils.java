/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.api.internal;

import javax.annotation.Nullable;

/**
 * Utilities for validating names.
 *
 * <p>This class is internal and is hence not for public use. Its APIs are unstable and can change
 * at any time.
 */
public final class StringUtils {

  /** Maximum length of tag keys and view names. */
  public static final int NAME_MAX_LENGTH = 255;

  /**
   * Returns {@code true} if every character of {@code str} is printable ASCII.
   *
   * @param str the string to check.
   */
  public static boolean isPrintableString(String str) {
    for (int i = 0; i < str.length(); i++) {
      if (!isPrintableChar(str.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  /** Returns {@code true} if {@code name} is non-empty, printable and not longer than 255. */
  public static boolean isValidName(@Nullable String name) {
    return name != null
        && !name.isEmpty()
        && name.length() <= NAME_MAX_LENGTH
        && isPrintableString(name);
  }

  private static boolean isPrintableChar(char ch) {
    return ch >= ' ' && ch <= '~';
  }

  private StringUtils() {}
}
