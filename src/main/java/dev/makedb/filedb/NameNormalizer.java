// Copyright 2024 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package dev.makedb.filedb;

import com.google.common.base.Ascii;

/** Canonical spelling of file names. */
public final class NameNormalizer {
  private static final String DOT_SLASH = "./";

  private NameNormalizer() {}

  /**
   * Removes redundant {@code ./} components: every leading {@code ./} with the slashes that follow
   * it, and every {@code /./} with its trailing slashes anywhere else. A name made only of such
   * components becomes {@code ./}. The result is a fixed point.
   */
  public static String normalize(String name) {
    String s = stripLeadingDotSlash(name);
    int u;
    while ((u = s.indexOf("/./")) >= 0) {
      int end = u + 3;
      while (end < s.length() && s.charAt(end) == '/') {
        end++;
      }
      s = s.substring(0, u + 1) + s.substring(end);
    }
    return s;
  }

  /**
   * Removes leading {@code ./} components and the slashes after them, as long as something would
   * be left; {@code .//} is {@code ./}, not {@code /}.
   */
  public static String stripLeadingDotSlash(String name) {
    int i = 0;
    while (name.length() - i > 2 && name.charAt(i) == '.' && name.charAt(i + 1) == '/') {
      i += 2;
      while (i < name.length() && name.charAt(i) == '/') {
        i++;
      }
    }
    if (i == 0) {
      return name;
    }
    return i == name.length() ? DOT_SLASH : name.substring(i);
  }

  /** Lower-cases a name for case-insensitive file systems. Special targets keep their case. */
  public static String foldCase(String name) {
    return name.startsWith(".") ? name : Ascii.toLowerCase(name);
  }
}
