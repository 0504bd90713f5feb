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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link StringPool}. */
@RunWith(JUnit4.class)
public final class StringPoolTest {
  private final StringPool pool = new StringPool();

  @Test
  public void equalStringsShareOneInstance() {
    String first = pool.intern(new String("main.o"));
    String second = pool.intern(new String("main.o"));

    assertThat(second).isSameInstanceAs(first);
    assertThat(pool.size()).isEqualTo(1);
  }

  @Test
  public void isCanonical_identityNotEquality() {
    String stored = pool.intern(new String("main.o"));

    assertThat(pool.isCanonical(stored)).isTrue();
    assertThat(pool.isCanonical(new String("main.o"))).isFalse();
    assertThat(pool.isCanonical("never.o")).isFalse();
  }

  @Test
  public void internNullable() {
    assertThat(pool.internNullable(null)).isNull();
    assertThat(pool.isCanonical(pool.internNullable("x"))).isTrue();
  }
}
