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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import dev.makedb.util.StringPool;

/**
 * The text a pattern's {@code %} matched, as captured by one prerequisite. A stem that carries a
 * directory is split at the last slash: {@link #dirname} keeps the directory part, slash
 * included, and {@link #basename} the rest.
 */
@AutoValue
public abstract class Stem {

  /** Creates a stem split after its last slash. */
  public static Stem of(String text) {
    return of(text, text.lastIndexOf('/') + 1);
  }

  public static Stem of(String text, int basenameOffset) {
    checkArgument(
        basenameOffset >= 0 && basenameOffset <= text.length(),
        "basename offset %s out of bounds for stem '%s'",
        basenameOffset,
        text);
    return new AutoValue_Stem(text, text.substring(0, basenameOffset));
  }

  /** Creates a stem with no directory part, even if it contains slashes. */
  public static Stem unsplit(String text) {
    return of(text, 0);
  }

  public abstract String text();

  public abstract String dirname();

  public final int basenameOffset() {
    return dirname().length();
  }

  public final String basename() {
    return text().substring(basenameOffset());
  }

  public final boolean hasDirname() {
    return !dirname().isEmpty();
  }

  /** Returns an equal stem whose strings come from {@code pool}. */
  final Stem intern(StringPool pool) {
    return new AutoValue_Stem(pool.intern(text()), pool.intern(dirname()));
  }
}
