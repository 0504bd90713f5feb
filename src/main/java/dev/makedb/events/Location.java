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
package dev.makedb.events;

import com.google.auto.value.AutoValue;

/** A position in a makefile: the file name and a 1-based line number. */
@AutoValue
public abstract class Location {

  public static Location fromFileLine(String file, long line) {
    return new AutoValue_Location(file, line);
  }

  public abstract String file();

  public abstract long line();

  @Override
  public final String toString() {
    return file() + ":" + line();
  }
}
