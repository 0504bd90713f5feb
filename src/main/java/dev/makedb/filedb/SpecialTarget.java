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

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.function.Function;
import javax.annotation.Nullable;

/** The reserved target names whose prerequisites set build-wide semantics. */
public enum SpecialTarget {
  PRECIOUS(".PRECIOUS"),
  LOW_RESOLUTION_TIME(".LOW_RESOLUTION_TIME"),
  PHONY(".PHONY"),
  NOTINTERMEDIATE(".NOTINTERMEDIATE"),
  INTERMEDIATE(".INTERMEDIATE"),
  SECONDARY(".SECONDARY"),
  EXPORT_ALL_VARIABLES(".EXPORT_ALL_VARIABLES"),
  IGNORE(".IGNORE"),
  SILENT(".SILENT"),
  NOTPARALLEL(".NOTPARALLEL");

  /** The variable naming prerequisites added to every target, or to one target. */
  public static final String EXTRA_PREREQS = ".EXTRA_PREREQS";

  private static final ImmutableMap<String, SpecialTarget> BY_NAME =
      Arrays.stream(values())
          .collect(ImmutableMap.toImmutableMap(SpecialTarget::targetName, Function.identity()));

  private final String targetName;

  SpecialTarget(String targetName) {
    this.targetName = targetName;
  }

  public String targetName() {
    return targetName;
  }

  @Nullable
  public static SpecialTarget forName(String name) {
    return BY_NAME.get(name);
  }

  public static boolean isSpecial(String name) {
    return BY_NAME.containsKey(name);
  }

  /**
   * Whether {@code name} looks like a POSIX special target: a dot followed only by capital
   * letters.
   */
  public static boolean looksSpecial(String name) {
    if (name.length() < 2 || name.charAt(0) != '.') {
      return false;
    }
    for (int i = 1; i < name.length(); i++) {
      char c = name.charAt(i);
      if (c < 'A' || c > 'Z') {
        return false;
      }
    }
    return true;
  }
}
