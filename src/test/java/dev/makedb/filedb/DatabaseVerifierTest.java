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

import com.google.common.collect.ImmutableList;
import dev.makedb.events.Event;
import dev.makedb.events.StoredEventHandler;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link DatabaseVerifier}. */
@RunWith(JUnit4.class)
public final class DatabaseVerifierTest {
  private final StoredEventHandler events = new StoredEventHandler();
  private FileRegistry registry;
  private Prerequisites prerequisites;

  @Before
  public void setUp() {
    registry = new FileRegistry(new BuildState(MakeOptions.defaults(), events));
    prerequisites = new Prerequisites(registry, SearchPath.NONE);
  }

  @Test
  public void databaseBuiltThroughRegistryIsClean() throws Exception {
    FileNode all = registry.getOrCreate("all");
    all.addDependencies(
        prerequisites.enterPrereqs(prerequisites.splitPrereqs("a.o b.o", null), null));
    FileNode obj = registry.getOrCreate("dir/x.o");
    obj.setStem(registry.getState().getStrings().intern("dir/x"));
    obj.addDependencies(
        prerequisites.enterPrereqs(
            ImmutableList.of(Dependency.named("%.c"), Dependency.template("$(%_EXTRA)")), obj));
    registry.rename(registry.getOrCreate("old"), "new");

    assertThat(new DatabaseVerifier(registry).verify()).isEqualTo(0);
    assertThat(events.isEmpty()).isTrue();
  }

  @Test
  public void reportsStrayStrings() {
    FileNode f = registry.getOrCreate("all");
    f.setStem(new String("stray-stem"));
    f.setVpath(new String("src/all"));

    assertThat(new DatabaseVerifier(registry).verify()).isEqualTo(2);
    assertThat(events.getEvents())
        .containsExactly(
            Event.error("all: field 'vpath' not cached: src/all"),
            Event.error("all: field 'stem' not cached: stray-stem"))
        .inOrder();
  }

  @Test
  public void reportsStrayPrerequisiteName() {
    FileNode f = registry.getOrCreate("all");
    f.addDependency(Dependency.named(new String("unentered.o")));

    assertThat(new DatabaseVerifier(registry).verify()).isEqualTo(1);
    assertThat(events.getEvents())
        .containsExactly(Event.error("all: field 'name' not cached: unentered.o"));
  }

  @Test
  public void templatesAreNotChecked() {
    FileNode f = registry.getOrCreate("all");
    f.addDependency(Dependency.template(new String("$(OBJS)")));

    assertThat(new DatabaseVerifier(registry).verify()).isEqualTo(0);
  }
}
