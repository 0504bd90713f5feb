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

import com.google.common.collect.ImmutableList;
import dev.makedb.events.Location;
import javax.annotation.Nullable;

/**
 * The recipe of a rule. A recipe is shared, not copied, when two nodes merge, so recipes are
 * compared by identity.
 */
public final class Recipe {
  @Nullable private final Location location;
  private final ImmutableList<String> lines;

  public Recipe(@Nullable Location location, ImmutableList<String> lines) {
    this.location = location;
    this.lines = lines;
  }

  /** Where the recipe was written, or null for a built-in recipe. */
  @Nullable
  public Location getLocation() {
    return location;
  }

  public ImmutableList<String> getLines() {
    return lines;
  }

  @Override
  public String toString() {
    return "Recipe{" + (location == null ? "built-in" : location) + ", " + lines + "}";
  }
}
