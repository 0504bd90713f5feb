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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import dev.makedb.expand.MacroExpander;
import dev.makedb.expand.VariableSet;
import java.util.List;

/**
 * Interprets the special targets ({@code .PHONY}, {@code .PRECIOUS}, {@code .INTERMEDIATE}, ...)
 * once all makefiles have been read, turning their prerequisite lists into flags on the files they
 * name and into build-wide policies on the {@link BuildState}.
 *
 * <p>The steps run in a fixed order because later ones read flags set by earlier ones.
 */
public final class SpecialTargets {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final FileRegistry registry;
  private final Prerequisites prerequisites;
  private final MacroExpander expander;
  private final BuildState state;

  public SpecialTargets(
      FileRegistry registry, Prerequisites prerequisites, MacroExpander expander) {
    this.registry = checkNotNull(registry);
    this.prerequisites = checkNotNull(prerequisites);
    this.expander = checkNotNull(expander);
    this.state = registry.getState();
  }

  /**
   * Runs the special-target pass. It may run only once per build, and no special target may
   * gain prerequisites afterwards.
   *
   * @throws MakeFatalException if a file is both not-intermediate and intermediate or secondary,
   *     or if {@code .NOTINTERMEDIATE} and {@code .SECONDARY} both apply to every file
   */
  public void snapDeps() throws MakeFatalException {
    state.markSnapped();

    for (FileNode f : filesNamedBy(SpecialTarget.PRECIOUS)) {
      f.set(FileFlag.PRECIOUS);
    }

    for (FileNode f : filesNamedBy(SpecialTarget.LOW_RESOLUTION_TIME)) {
      f.set(FileFlag.LOW_RESOLUTION_TIME);
    }

    for (FileNode f : filesNamedBy(SpecialTarget.PHONY)) {
      f.set(FileFlag.PHONY);
      f.set(FileFlag.IS_TARGET);
      f.setLastMtime(FileTimestamp.NONEXISTENT);
      f.setMtimeBeforeUpdate(FileTimestamp.NONEXISTENT);
    }

    FileNode notIntermediate = registry.lookup(SpecialTarget.NOTINTERMEDIATE.targetName());
    for (FileNode f = notIntermediate; f != null; f = f.getPrev()) {
      if (f.getDependencies().isEmpty()) {
        state.setNoIntermediates();
      } else {
        for (FileNode named : namedBy(f)) {
          named.set(FileFlag.NOT_INTERMEDIATE);
        }
      }
    }

    // A file may be .INTERMEDIATE and still match a .NOTINTERMEDIATE pattern; implicit rule
    // search gives the former priority. Only the explicit combination is an error.
    for (FileNode f : filesNamedBy(SpecialTarget.INTERMEDIATE)) {
      if (f.is(FileFlag.NOT_INTERMEDIATE)) {
        throw new MakeFatalException(
            String.format("%s cannot be both .NOTINTERMEDIATE and .INTERMEDIATE", f.getName()));
      }
      f.set(FileFlag.INTERMEDIATE);
    }

    FileNode secondary = registry.lookup(SpecialTarget.SECONDARY.targetName());
    for (FileNode f = secondary; f != null; f = f.getPrev()) {
      if (f.getDependencies().isEmpty()) {
        state.setAllSecondary();
        continue;
      }
      for (FileNode named : namedBy(f)) {
        if (named.is(FileFlag.NOT_INTERMEDIATE)) {
          throw new MakeFatalException(
              String.format(
                  "%s cannot be both .NOTINTERMEDIATE and .SECONDARY", named.getName()));
        }
        named.set(FileFlag.INTERMEDIATE);
        named.set(FileFlag.SECONDARY);
      }
    }

    if (state.isNoIntermediates() && state.isAllSecondary()) {
      throw new MakeFatalException(".NOTINTERMEDIATE and .SECONDARY are mutually exclusive");
    }

    FileNode f = registry.lookup(SpecialTarget.EXPORT_ALL_VARIABLES.targetName());
    if (f != null && f.isTarget()) {
      state.setExportAllVariables();
    }

    f = registry.lookup(SpecialTarget.IGNORE.targetName());
    if (f != null && f.isTarget()) {
      if (f.getDependencies().isEmpty()) {
        state.setIgnoreErrors();
      } else {
        for (FileNode named : namedBy(f)) {
          named.addCommandFlag(CommandFlag.NO_ERROR);
        }
      }
    }

    f = registry.lookup(SpecialTarget.SILENT.targetName());
    if (f != null && f.isTarget()) {
      if (f.getDependencies().isEmpty()) {
        state.setRunSilent();
      } else {
        for (FileNode named : namedBy(f)) {
          named.addCommandFlag(CommandFlag.SILENT);
        }
      }
    }

    f = registry.lookup(SpecialTarget.NOTPARALLEL.targetName());
    if (f != null && f.isTarget()) {
      if (f.getDependencies().isEmpty()) {
        state.setNotParallel();
      } else {
        // Serialize the prerequisites of each named target among themselves.
        for (FileNode named : namedBy(f)) {
          List<Dependency> deps = named.getDependencies();
          for (int i = 1; i < deps.size(); i++) {
            deps.get(i).setWaitHere(true);
          }
        }
      }
    }

    List<Dependency> globalExtra =
        prerequisites.expandExtraPrereqs(
            expander.lookupVariable(SpecialTarget.EXTRA_PREREQS), expander);
    for (FileNode file : ImmutableList.copyOf(registry.getFiles())) {
      snapFile(file, globalExtra);
    }
    logger.atFine().log(
        "special targets finalized for %d files (all secondary: %s, no intermediates: %s)",
        registry.size(), state.isAllSecondary(), state.isNoIntermediates());
  }

  /** Applies the build-wide defaults and the extra prerequisites to one file. */
  private void snapFile(FileNode f, List<Dependency> globalExtra) {
    // The more specific setting wins over the build-wide one.
    if (state.isAllSecondary() && !f.is(FileFlag.NOT_INTERMEDIATE)) {
      f.set(FileFlag.INTERMEDIATE);
    }
    if (state.isNoIntermediates()
        && !f.is(FileFlag.INTERMEDIATE)
        && !f.is(FileFlag.SECONDARY)) {
      f.set(FileFlag.NOT_INTERMEDIATE);
    }

    List<Dependency> extra;
    VariableSet variables = f.getVariables();
    if (variables != null) {
      extra =
          prerequisites.expandExtraPrereqs(variables.get(SpecialTarget.EXTRA_PREREQS), expander);
      if (state.getOptions().secondExpansion()) {
        for (Dependency d : extra) {
          if (d.getName() == null) {
            d.setName(d.getFile().getName());
          }
          d.setNeedsSecondExpansion(true);
        }
      }
    } else if (f.isTarget()) {
      extra = Dependency.copyAll(globalExtra);
    } else {
      return;
    }
    if (extra.isEmpty()) {
      return;
    }

    for (Dependency d : extra) {
      if (d.displayName().equals(f.getName())) {
        logger.atFine().log("dropping extra prerequisites of %s: it would depend on itself", f);
        return;
      }
    }
    registry.appendDependencies(f, extra);
  }

  /** Every file named by any member of the double-colon chain of {@code special}. */
  private ImmutableList<FileNode> filesNamedBy(SpecialTarget special) {
    ImmutableList.Builder<FileNode> files = ImmutableList.builder();
    for (FileNode f = registry.lookup(special.targetName()); f != null; f = f.getPrev()) {
      files.addAll(namedBy(f));
    }
    return files.build();
  }

  /** Every file named by a prerequisite of {@code f}, with the rest of its double-colon chain. */
  private static ImmutableList<FileNode> namedBy(FileNode f) {
    ImmutableList.Builder<FileNode> files = ImmutableList.builder();
    for (Dependency d : f.getDependencies()) {
      if (d.getFile() != null) {
        files.addAll(d.getFile().resolveRenamed().chain());
      }
    }
    return files.build();
  }
}
