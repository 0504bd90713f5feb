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

import static com.google.common.truth.Truth.assertThat;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;

/** Tests for {@link NameNormalizer}. */
@RunWith(TestParameterInjector.class)
public final class NameNormalizerTest {

  enum NormalizeCase {
    PLAIN("foo.c", "foo.c"),
    LEADING_DOT_SLASH("./foo.c", "foo.c"),
    REPEATED_LEADING("././/foo.c", "foo.c"),
    INNER_DOT("a/./b", "a/b"),
    INNER_DOT_EXTRA_SLASHES("a/.//b", "a/b"),
    CONSECUTIVE_INNER_DOTS("a/././b", "a/b"),
    DOTS_AND_SLASH_RUNS("foo/.///.///bar/", "foo/bar/"),
    LEADING_AND_INNER("./a/./b/c", "a/b/c"),
    DOT_SLASH_ALONE("./", "./"),
    DOT_SLASH_SLASH(".//", "./"),
    PARENT_KEPT("../a", "../a"),
    ABSOLUTE("/usr/./lib", "/usr/lib");

    final String input;
    final String expected;

    NormalizeCase(String input, String expected) {
      this.input = input;
      this.expected = expected;
    }
  }

  @Test
  public void normalize(@TestParameter NormalizeCase testCase) {
    assertThat(NameNormalizer.normalize(testCase.input)).isEqualTo(testCase.expected);
  }

  @Test
  public void normalize_isFixedPoint(@TestParameter NormalizeCase testCase) {
    String once = NameNormalizer.normalize(testCase.input);
    assertThat(NameNormalizer.normalize(once)).isEqualTo(once);
  }

  @Test
  public void stripLeadingDotSlash_leavesInnerComponents() {
    assertThat(NameNormalizer.stripLeadingDotSlash("./a/./b")).isEqualTo("a/./b");
    assertThat(NameNormalizer.stripLeadingDotSlash("a")).isEqualTo("a");
  }

  @Test
  public void foldCase_lowersOrdinaryNames() {
    assertThat(NameNormalizer.foldCase("Src/Main.C")).isEqualTo("src/main.c");
  }

  @Test
  public void foldCase_keepsDotNames() {
    assertThat(NameNormalizer.foldCase(".PHONY")).isEqualTo(".PHONY");
  }
}
