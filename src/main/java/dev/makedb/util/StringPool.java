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
package dev.makedb.util;

import com.google.common.collect.Interner;
import com.google.common.collect.Interners;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * The canonical string cache of a run. Every name the file database stores is interned here, so
 * that equal names are shared and so that {@link #isCanonical} can tell a stored string from a
 * stray copy.
 */
public final class StringPool {
  private final Interner<String> interner = Interners.newStrongInterner();
  private final Set<String> canonical = Sets.newIdentityHashSet();

  @CanIgnoreReturnValue
  public synchronized String intern(String s) {
    String result = interner.intern(s);
    canonical.add(result);
    return result;
  }

  @Nullable
  public String internNullable(@Nullable String s) {
    return s == null ? null : intern(s);
  }

  /** Returns whether {@code s} is the very instance this pool hands out for its contents. */
  public synchronized boolean isCanonical(String s) {
    return canonical.contains(s);
  }

  public synchronized int size() {
    return canonical.size();
  }
}
