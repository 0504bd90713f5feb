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
package dev.makedb.expand;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * A set of make variables: the global set, or the target-specific variables of one file. Values
 * are stored unexpanded and expanded on every reference.
 */
public final class VariableSet {
  private final Map<String, String> values = new LinkedHashMap<>();

  @CanIgnoreReturnValue
  public VariableSet define(String name, String value) {
    values.put(name, value);
    return this;
  }

  @Nullable
  public String get(String name) {
    return values.get(name);
  }

  public boolean isDefined(String name) {
    return values.containsKey(name);
  }

  /** Adds every variable of {@code other} that this set does not define itself. */
  public void mergeFrom(VariableSet other) {
    if (other == this) {
      return;
    }
    other.values.forEach(values::putIfAbsent);
  }

  public ImmutableMap<String, String> asMap() {
    return ImmutableMap.copyOf(values);
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
