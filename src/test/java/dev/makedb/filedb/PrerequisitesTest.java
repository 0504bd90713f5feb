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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import dev.makedb.events.EventHandler;
import dev.makedb.expand.SimpleMacroExpander;
import dev.makedb.expand.VariableSet;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Prerequisites}. */
@RunWith(JUnit4.class)
public final class PrerequisitesTest {
  private BuildState state;
  private FileRegistry registry;
  private Prerequisites prerequisites;

  @Before
  public void setUp() {
    state = new BuildState(MakeOptions.defaults(), EventHandler.NOOP);
    registry = new FileRegistry(state);
    prerequisites = new Prerequisites(registry, SearchPath.NONE);
  }

  private static List<String> names(List<Dependency> deps) {
    return deps.stream().map(Dependency::displayName).collect(Collectors.toList());
  }

  @Test
  public void splitPrereqs_wordsInOrder() {
    List<Dependency> deps = prerequisites.splitPrereqs("  a.o\tb.o \n c.o ", null);

    assertThat(names(deps)).containsExactly("a.o", "b.o", "c.o").inOrder();
    for (Dependency d : deps) {
      assertThat(d.getFile()).isNull();
      assertThat(d.isOrderOnly()).isFalse();
      assertThat(d.isWaitHere()).isFalse();
    }
  }

  @Test
  public void splitPrereqs_empty() {
    assertThat(prerequisites.splitPrereqs(" \t ", null)).isEmpty();
  }

  @Test
  public void splitPrereqs_orderOnlyAfterBar() {
    List<Dependency> deps = prerequisites.splitPrereqs("a b | c d", null);

    assertThat(names(deps)).containsExactly("a", "b", "c", "d").inOrder();
    assertThat(deps.stream().map(Dependency::isOrderOnly).collect(Collectors.toList()))
        .containsExactly(false, false, true, true)
        .inOrder();
  }

  @Test
  public void splitPrereqs_onlyFirstBarSeparates() {
    List<Dependency> deps = prerequisites.splitPrereqs("a | b | c", null);

    assertThat(names(deps)).containsExactly("a", "b", "|", "c").inOrder();
    assertThat(deps.get(0).isOrderOnly()).isFalse();
    assertThat(deps.get(2).isOrderOnly()).isTrue();
  }

  @Test
  public void splitPrereqs_waitMarksNextPrerequisite() {
    List<Dependency> deps = prerequisites.splitPrereqs("a .WAIT b c", null);

    assertThat(names(deps)).containsExactly("a", "b", "c").inOrder();
    assertThat(deps.stream().map(Dependency::isWaitHere).collect(Collectors.toList()))
        .containsExactly(false, true, false)
        .inOrder();
  }

  @Test
  public void splitPrereqs_prefixAfterStrippingDotSlash() {
    List<Dependency> deps = prerequisites.splitPrereqs("./x.c y.c", "sub/");

    assertThat(names(deps)).containsExactly("sub/x.c", "sub/y.c").inOrder();
  }

  @Test
  public void splitPrereqs_searchPathRewritesNames() {
    prerequisites =
        new Prerequisites(registry, name -> name.endsWith(".c") ? "src/" + name : name);

    assertThat(names(prerequisites.splitPrereqs("main.c main.h", null)))
        .containsExactly("src/main.c", "main.h")
        .inOrder();
  }

  @Test
  public void splitPrereqs_namesAreInterned() {
    for (Dependency d : prerequisites.splitPrereqs(new String("a b"), null)) {
      assertThat(state.getStrings().isCanonical(d.getName())).isTrue();
    }
  }

  @Test
  public void enterPrereqs_resolvesAndMarksExplicit() {
    List<Dependency> deps =
        prerequisites.enterPrereqs(prerequisites.splitPrereqs("a.o b.o", null), null);

    assertThat(deps).hasSize(2);
    for (Dependency d : deps) {
      assertThat(d.getName()).isNull();
      assertThat(d.getFile()).isNotNull();
      assertThat(d.getFile().is(FileFlag.EXPLICIT)).isTrue();
    }
    assertThat(deps.get(0).getFile()).isSameInstanceAs(registry.lookup("a.o"));
  }

  @Test
  public void enterPrereqs_reusesExistingFiles() {
    FileNode existing = registry.getOrCreate("a.o");

    List<Dependency> deps =
        prerequisites.enterPrereqs(prerequisites.splitPrereqs("a.o", null), null);

    assertThat(deps.get(0).getFile()).isSameInstanceAs(existing);
  }

  @Test
  public void enterPrereqs_substitutesOwnerStem() {
    FileNode owner = registry.getOrCreate("foo.o");
    owner.setStem("foo");

    List<Dependency> deps =
        prerequisites.enterPrereqs(prerequisites.splitPrereqs("%.c %.h config.h", null), owner);

    assertThat(names(deps)).containsExactly("foo.c", "foo.h", "config.h").inOrder();
    assertThat(deps.get(0).getStem()).isEqualTo(Stem.of("foo"));
    assertThat(deps.get(2).getStem()).isNull();
    assertThat(registry.lookup("foo.c").is(FileFlag.EXPLICIT)).isFalse();
  }

  @Test
  public void enterPrereqs_stemDirectoryGoesInFront() {
    FileNode owner = registry.getOrCreate("dir/foo.o");
    owner.setStem("dir/foo");

    List<Dependency> deps =
        prerequisites.enterPrereqs(prerequisites.splitPrereqs("%.c gen/%.h", null), owner);

    assertThat(names(deps)).containsExactly("dir/foo.c", "dir/gen/foo.h").inOrder();
  }

  @Test
  public void enterPrereqs_onlyFirstPercentIsReplaced() {
    List<Dependency> deps =
        prerequisites.enterPrereqs(
            ImmutableList.of(Dependency.named("%_%.c").setStem(Stem.of("x"))), null);

    assertThat(names(deps)).containsExactly("x_%.c");
  }

  @Test
  public void enterPrereqs_dropsNameEmptiedByStem() {
    List<Dependency> deps =
        prerequisites.enterPrereqs(
            ImmutableList.of(
                Dependency.named("%").setStem(Stem.of("")),
                Dependency.named("kept").setStem(Stem.of(""))),
            null);

    assertThat(names(deps)).containsExactly("kept");
  }

  @Test
  public void enterPrereqs_templatesKeepMarkersForSecondExpansion() {
    FileNode owner = registry.getOrCreate("foo.o");
    owner.setStem("foo");
    Dependency template = Dependency.template("$(%_SRCS)");

    List<Dependency> deps = prerequisites.enterPrereqs(ImmutableList.of(template), owner);

    assertThat(deps).containsExactly(template);
    assertThat(template.getName()).isEqualTo("$(%_SRCS)");
    assertThat(template.getFile()).isNull();
    assertThat(template.isStaticPattern()).isTrue();
    assertThat(template.getStem()).isEqualTo(Stem.of("foo"));
  }

  @Test
  public void enterPrereqs_specialOwnerFrozenAfterSnap() {
    FileNode phony = registry.getOrCreate(".PHONY");
    state.markSnapped();

    assertThrows(
        IllegalStateException.class,
        () -> prerequisites.enterPrereqs(prerequisites.splitPrereqs("clean", null), phony));
  }

  @Test
  public void substituteStem_withoutMarker() {
    assertThat(Prerequisites.substituteStem("plain.c", Stem.of("foo"))).isNull();
  }

  @Test
  public void substituteStem_quotedMarkerIsLiteral() {
    assertThat(Prerequisites.substituteStem("100\\%.txt", Stem.of("foo"))).isNull();
    assertThat(Prerequisites.substituteStem("a\\\\%.c", Stem.of("foo"))).isEqualTo("a\\foo.c");
  }

  @Test
  public void expandExtraPrereqs_expandsAndSkipsAutomaticVariables() {
    SimpleMacroExpander expander =
        new SimpleMacroExpander(new VariableSet().define("TOOLS", "gen.sh lint.sh"));

    List<Dependency> deps = prerequisites.expandExtraPrereqs("$(TOOLS)", expander);

    assertThat(names(deps)).containsExactly("gen.sh", "lint.sh").inOrder();
    for (Dependency d : deps) {
      assertThat(d.getFile()).isNotNull();
      assertThat(d.ignoresAutomaticVars()).isTrue();
    }
  }

  @Test
  public void expandExtraPrereqs_unset() {
    assertThat(prerequisites.expandExtraPrereqs(null, new SimpleMacroExpander())).isEmpty();
  }
}
