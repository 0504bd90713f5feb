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

import static com.google.common.base.Preconditions.checkNotNull;

import dev.makedb.events.Event;
import dev.makedb.events.EventHandler;
import dev.makedb.util.StringPool;
import javax.annotation.Nullable;

/**
 * Checks that every name stored in the file database is the instance held by the
 * {@link StringPool}, and reports every one that is not.
 */
public final class DatabaseVerifier {
  private final FileRegistry registry;
  private final StringPool strings;
  private final EventHandler eventHandler;

  public DatabaseVerifier(FileRegistry registry) {
    this.registry = checkNotNull(registry);
    this.strings = registry.getState().getStrings();
    this.eventHandler = registry.getState().getEventHandler();
  }

  /** Returns the number of problems found. */
  public int verify() {
    int problems = 0;
    for (FileNode f : registry.getFiles()) {
      problems += verifyFile(f);
    }
    return problems;
  }

  private int verifyFile(FileNode f) {
    int problems = 0;
    problems += check(f, "name", f.getName());
    problems += check(f, "hname", f.getHname());
    problems += check(f, "vpath", f.getVpath());
    problems += check(f, "stem", f.getStem());
    for (Dependency d : f.getDependencies()) {
      if (!d.needsSecondExpansion()) {
        problems += check(f, "name", d.getName());
      }
      if (d.getStem() != null) {
        problems += check(f, "stem", d.getStem().text());
        problems += check(f, "stem_dirname", d.getStem().dirname());
      }
    }
    return problems;
  }

  private int check(FileNode f, String field, @Nullable String value) {
    if (value == null || value.isEmpty() || strings.isCanonical(value)) {
      return 0;
    }
    eventHandler.handle(
        Event.errorf(null, "%s: field '%s' not cached: %s", f.getName(), field, value));
    return 1;
  }
}
