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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import javax.annotation.Nullable;

/**
 * Computes an alternate order in which a file's prerequisites are visited, for {@code --shuffle}.
 * The alternate order is derived from the declared list and must be recomputed whenever that
 * list changes.
 */
public abstract class DependencyShuffler {

  /** Returns the alternate order, or null to use the declared order. */
  @Nullable
  abstract ImmutableList<Dependency> shuffle(List<Dependency> deps);

  /** Recomputes the alternate order of {@code file}. */
  public final void regenerate(FileNode file) {
    file.setShuffledDependencies(shuffle(file.getDependencies()));
  }

  public static DependencyShuffler none() {
    return NONE;
  }

  public static DependencyShuffler reverse() {
    return REVERSE;
  }

  public static DependencyShuffler random(long seed) {
    return new RandomShuffler(seed);
  }

  /**
   * Parses a {@code --shuffle} argument: {@code none}, {@code identity}, {@code reverse},
   * {@code random}, or a numeric seed.
   */
  public static DependencyShuffler forMode(String mode) {
    switch (mode) {
      case "none":
      case "identity":
        return NONE;
      case "reverse":
        return REVERSE;
      case "random":
        return random(System.nanoTime());
      default:
        try {
          return random(Long.parseLong(mode));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("invalid shuffle mode: '" + mode + "'", e);
        }
    }
  }

  private static final DependencyShuffler NONE =
      new DependencyShuffler() {
        @Override
        ImmutableList<Dependency> shuffle(List<Dependency> deps) {
          return null;
        }
      };

  private static final DependencyShuffler REVERSE =
      new DependencyShuffler() {
        @Override
        ImmutableList<Dependency> shuffle(List<Dependency> deps) {
          return ImmutableList.copyOf(deps).reverse();
        }
      };

  private static final class RandomShuffler extends DependencyShuffler {
    private final Random random;

    RandomShuffler(long seed) {
      this.random = new Random(seed);
    }

    @Override
    ImmutableList<Dependency> shuffle(List<Dependency> deps) {
      List<Dependency> copy = new ArrayList<>(deps);
      Collections.shuffle(copy, random);
      return ImmutableList.copyOf(copy);
    }
  }
}
