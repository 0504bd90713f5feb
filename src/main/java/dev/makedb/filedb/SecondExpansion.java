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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.flogger.GoogleLogger;
import dev.makedb.expand.MacroExpander;
import dev.makedb.expand.PatternSubstitution;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Second expansion of prerequisite lists: prerequisites written with {@code $$} in a makefile
 * that uses {@code .SECONDEXPANSION} are expanded again once the automatic variables of their
 * target are known.
 *
 * <p>Each file is expanded at most once, on demand; {@link FileFlag#SNAPPED} records that it has
 * been. Expanding one file's prerequisites may enter, and so create, other files, but never adds
 * prerequisites to the file being expanded except at the end of its list.
 */
public final class SecondExpansion {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final FileRegistry registry;
  private final Prerequisites prerequisites;
  private final MacroExpander expander;

  public SecondExpansion(
      FileRegistry registry, Prerequisites prerequisites, MacroExpander expander) {
    this.registry = checkNotNull(registry);
    this.prerequisites = checkNotNull(prerequisites);
    this.expander = checkNotNull(expander);
  }

  /**
   * Expands every prerequisite of {@code file} that needs it and splices the results into the
   * prerequisite list in place of the template. Does nothing on the second call.
   *
   * <p>The walk keeps its position as an index into the live list. The template at that index
   * is expanded first, which can recurse into the registry; only then is it replaced by its
   * zero or more expansions, and the walk continues with the element that followed the template
   * before the expansion started.
   */
  public void expandDeps(FileNode file) {
    if (file.is(FileFlag.SNAPPED)) {
      return;
    }
    file.set(FileFlag.SNAPPED);

    List<Dependency> deps = file.mutableDependencies();
    boolean initialized = false;
    boolean changed = false;
    int i = 0;
    while (i < deps.size()) {
      Dependency d = deps.get(i);
      if (d.getName() == null || !d.needsSecondExpansion()) {
        i++;
        continue;
      }
      changed = true;
      if (!initialized) {
        expander.initializeFileVariables(file);
        initialized = true;
      }

      List<Dependency> expanded = new ArrayList<>();
      if (d.isStaticPattern()) {
        expandPatternDep(file, d, expanded);
      } else {
        expandDep(file, d, d.getName(), false, null, expanded);
      }

      checkState(
          deps.get(i) == d,
          "prerequisites of %s changed in front of %s during second expansion",
          file.getName(),
          d.getName());
      deps.remove(i);
      deps.addAll(i, expanded);
      i += expanded.size();
    }

    if (changed) {
      // The alternate order still holds the templates.
      registry.getShuffler().regenerate(file);
    }
  }

  /**
   * Expands a static pattern template word by word. Only words that carry a {@code %} get the
   * directory of the stem in front of their expansion.
   */
  private void expandPatternDep(FileNode file, Dependency d, List<Dependency> out) {
    String name = d.getName();
    if (name.indexOf(PatternSubstitution.PERCENT) < 0) {
      expandDep(file, d, name, false, null, out);
      return;
    }
    String stemDirname = d.getStem() != null ? d.getStem().dirname() : "";
    boolean orderOnly = false;
    for (String word : PatternSubstitution.unexpandedWords(name)) {
      if (!orderOnly && word.equals("|")) {
        orderOnly = true;
        continue;
      }
      StemReference sub = substituteStem(word, stemDirname);
      expandDep(file, d, sub.text, orderOnly, sub.dirname, out);
    }
  }

  /**
   * Expands one template, splits the result and enters every prerequisite it names. A template
   * that expands to nothing produces nothing.
   */
  private void expandDep(
      FileNode file,
      Dependency d,
      String template,
      boolean orderOnly,
      @Nullable String dirname,
      List<Dependency> out) {
    Stem depStem = d.getStem();
    String stem = depStem != null ? depStem.text() : file.getStem();
    expander.setFileVariables(file, stem);

    String text = expander.expandForFile(template, file);
    logger.atFine().log("second expansion of %s: '%s' -> '%s'", file.getName(), template, text);

    List<Dependency> parsed = prerequisites.splitPrereqs(text, dirname);
    for (Dependency nd : parsed) {
      FileNode prereq = registry.lookupOrEnter(nd.getName());
      nd.resolve(prereq);
      nd.setStem(depStem);
      if (depStem == null) {
        prereq.set(FileFlag.EXPLICIT);
      }
      if (orderOnly) {
        nd.setOrderOnly(true);
      }
    }
    out.addAll(parsed);
  }

  /** A word with its {@code %} turned into a reference to the stem. */
  static final class StemReference {
    final String text;
    /** The directory to put in front of each expanded name, or null. */
    @Nullable final String dirname;

    StemReference(String text, @Nullable String dirname) {
      this.text = text;
      this.dirname = dirname;
    }
  }

  /**
   * Replaces the first unquoted {@code %} of {@code word} with {@code $*}, or with
   * {@code $(*F)} when the stem has a directory part, which then goes in front of the expansion
   * instead. A {@code %} right after a {@code $} becomes {@code ($*)} or {@code ($(*F))}, so that
   * the result still reads as a single variable reference.
   */
  static StemReference substituteStem(String word, String stemDirname) {
    StringBuilder s = new StringBuilder(word.length() + 7);
    s.append(word);
    int percent = PatternSubstitution.findPercent(s);
    if (percent < 0) {
      return new StemReference(s.toString(), null);
    }
    String reference = stemDirname.isEmpty() ? "$*" : "$(*F)";
    if (percent > 0 && s.charAt(percent - 1) == '$') {
      reference = "(" + reference + ")";
    }
    s.replace(percent, percent + 1, reference);
    return new StemReference(s.toString(), stemDirname);
  }
}
