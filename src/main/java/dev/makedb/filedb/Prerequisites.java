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

import com.google.common.flogger.GoogleLogger;
import dev.makedb.expand.MacroExpander;
import dev.makedb.expand.PatternSubstitution;
import dev.makedb.util.StringPool;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import javax.annotation.Nullable;

/** Turns prerequisite text into edges and enters their names into the {@link FileRegistry}. */
public final class Prerequisites {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final String ORDER_ONLY_SEPARATOR = "|";
  private static final String WAIT = ".WAIT";

  private final FileRegistry registry;
  private final SearchPath searchPath;
  private final StringPool strings;

  public Prerequisites(FileRegistry registry, SearchPath searchPath) {
    this.registry = checkNotNull(registry);
    this.searchPath = checkNotNull(searchPath);
    this.strings = registry.getState().getStrings();
  }

  /**
   * Splits fully expanded prerequisite text into unresolved edges, in order.
   *
   * <p>Words after the first {@code |} are order-only. Only that first {@code |} separates: any
   * later {@code |} is an ordinary name. The word {@code .WAIT} names nothing; it makes the next
   * prerequisite a wait barrier. Each name is prefixed with {@code dirPrefix}, if given, and then
   * passed through the search path.
   */
  public List<Dependency> splitPrereqs(String text, @Nullable String dirPrefix) {
    List<Dependency> deps = new ArrayList<>();
    boolean orderOnly = false;
    boolean waitNext = false;
    for (String word : PatternSubstitution.words(text)) {
      if (!orderOnly && word.equals(ORDER_ONLY_SEPARATOR)) {
        orderOnly = true;
        continue;
      }
      if (word.equals(WAIT)) {
        waitNext = true;
        continue;
      }
      String name = NameNormalizer.stripLeadingDotSlash(word);
      if (dirPrefix != null) {
        name = dirPrefix + name;
      }
      name = strings.intern(searchPath.rewrite(name));
      deps.add(Dependency.named(name).setOrderOnly(orderOnly).setWaitHere(waitNext));
      waitNext = false;
    }
    return deps;
  }

  /**
   * Enters the names of {@code deps} into the registry and points each edge at its file.
   *
   * <p>Edges that carry a stem, their own or the owner's, have the first unquoted {@code %} of
   * their name replaced by the stem first; an edge whose name becomes empty is dropped. Edges
   * that need second expansion are left unresolved. A prerequisite that is not introduced through
   * a pattern is marked {@link FileFlag#EXPLICIT}.
   *
   * @return the surviving edges, in order
   */
  public List<Dependency> enterPrereqs(List<Dependency> deps, @Nullable FileNode owner) {
    if (owner != null) {
      BuildState state = registry.getState();
      if (state.isSnapped() && SpecialTarget.isSpecial(owner.getHname())) {
        throw new IllegalStateException(
            "cannot add prerequisites to "
                + owner.getHname()
                + " after the special targets have been finalized");
      }
    }
    String ownerStem = owner != null ? owner.getStem() : null;
    List<Dependency> result = new ArrayList<>(deps);
    for (Iterator<Dependency> it = result.iterator(); it.hasNext(); ) {
      Dependency d = it.next();
      Stem stem = d.getStem() != null ? d.getStem() : ownerStem != null ? Stem.of(ownerStem) : null;
      if (stem == null || d.getName() == null) {
        continue;
      }
      if (d.needsSecondExpansion()) {
        d.setStem(stem.intern(strings));
        d.setStaticPattern(true);
        continue;
      }
      String substituted = substituteStem(d.getName(), stem);
      if (substituted == null) {
        continue;
      }
      if (substituted.isEmpty()) {
        logger.atFine().log(
            "dropping prerequisite '%s': empty after stem substitution", d.getName());
        it.remove();
        continue;
      }
      d.setName(strings.intern(substituted));
      d.setStem(stem.intern(strings));
    }

    boolean explicit = owner == null || owner.getStem() == null;
    for (Dependency d : result) {
      if (d.needsSecondExpansion() || d.getName() == null) {
        continue;
      }
      FileNode file = registry.lookupOrEnter(d.getName());
      d.resolve(file);
      if (explicit) {
        file.set(FileFlag.EXPLICIT);
      }
    }
    return result;
  }

  /**
   * Fills the first unquoted {@code %} of {@code name} with {@code stem}, keeping the directory
   * part of the stem in front of the whole name. Returns null if {@code name} has no marker.
   */
  @Nullable
  static String substituteStem(String name, Stem stem) {
    StringBuilder nm = new StringBuilder(stem.dirname().length() + name.length());
    nm.append(stem.dirname()).append(name);
    int percent = PatternSubstitution.findPercent(nm);
    if (percent < 0) {
      return null;
    }
    if (stem.basename().isEmpty()) {
      return nm.deleteCharAt(percent).toString();
    }
    return PatternSubstitution.substitute(nm, percent, stem.basename());
  }

  /**
   * Expands the value of {@code .EXTRA_PREREQS} in the global scope and enters the result. The
   * returned edges are left out of automatic variables.
   */
  public List<Dependency> expandExtraPrereqs(@Nullable String value, MacroExpander expander) {
    if (value == null) {
      return new ArrayList<>();
    }
    List<Dependency> prereqs = splitPrereqs(expander.expand(value), null);
    for (Dependency d : prereqs) {
      d.resolve(registry.lookupOrEnter(d.getName()));
      d.setIgnoreAutomaticVars(true);
    }
    return prereqs;
  }
}
