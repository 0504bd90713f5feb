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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import dev.makedb.events.EventHandler;
import dev.makedb.events.PrintingEventHandler;
import dev.makedb.expand.MacroExpander;
import dev.makedb.expand.SimpleMacroExpander;
import dev.makedb.util.StringPool;
import java.io.PrintStream;
import java.time.ZoneId;
import java.util.List;
import javax.annotation.Nullable;

/**
 * The target and prerequisite database of one build, and the entry point for the makefile reader
 * and the update engine.
 *
 * <p>A database goes through three phases. While makefiles are read, files and prerequisite
 * lists are entered. {@link #snapDeps} then interprets the special targets, once. During the
 * update, prerequisite lists are second-expanded on demand and, at the end,
 * {@link #removeIntermediates} deletes what the build made along the way.
 */
public final class FileDatabase {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final String PROGRAM_NAME = "make";

  private final BuildState state;
  private final FileRegistry registry;
  private final Prerequisites prerequisites;
  private final SecondExpansion secondExpansion;
  private final SpecialTargets specialTargets;
  private final IntermediateFileReaper reaper;
  private final DatabasePrinter printer;
  private final PrintStream out;

  private FileDatabase(Builder builder) {
    this.state = new BuildState(builder.options, builder.eventHandler, builder.strings);
    DependencyShuffler shuffler =
        builder.shuffler != null
            ? builder.shuffler
            : DependencyShuffler.forMode(builder.options.shuffle());
    this.registry = new FileRegistry(state, shuffler);
    this.prerequisites = new Prerequisites(registry, builder.searchPath);
    this.secondExpansion = new SecondExpansion(registry, prerequisites, builder.expander);
    this.specialTargets = new SpecialTargets(registry, prerequisites, builder.expander);
    this.reaper = new IntermediateFileReaper(registry, builder.deleter, builder.out);
    this.printer = new DatabasePrinter(registry, builder.zone);
    this.out = builder.out;

    for (String goal : builder.options.goals()) {
      FileNode f = registry.getOrCreate(goal);
      f.set(FileFlag.CMD_TARGET);
    }
  }

  public BuildState getState() {
    return state;
  }

  public FileRegistry getRegistry() {
    return registry;
  }

  @Nullable
  public FileNode lookup(String name) {
    return registry.lookup(name);
  }

  public FileNode getOrCreate(String name) {
    return registry.getOrCreate(name);
  }

  public FileNode lookupOrEnter(String name) {
    return registry.lookupOrEnter(name);
  }

  public FileNode enterDoubleColon(String name) throws MakeFatalException {
    return registry.enterDoubleColon(name);
  }

  public void rename(FileNode from, String toName) throws MakeFatalException {
    registry.rename(from, toName);
  }

  public void rehash(FileNode from, String toName) throws MakeFatalException {
    registry.rehash(from, toName);
  }

  public List<Dependency> splitPrereqs(String text, @Nullable String dirPrefix) {
    return prerequisites.splitPrereqs(text, dirPrefix);
  }

  public List<Dependency> enterPrereqs(List<Dependency> deps, @Nullable FileNode owner) {
    return prerequisites.enterPrereqs(deps, owner);
  }

  /** Parses {@code text} and appends the resulting prerequisites to {@code target}. */
  @CanIgnoreReturnValue
  public List<Dependency> addPrerequisites(FileNode target, String text) {
    List<Dependency> deps =
        prerequisites.enterPrereqs(prerequisites.splitPrereqs(text, null), null);
    registry.addPrerequisites(target, deps);
    return deps;
  }

  public void expandDeps(FileNode file) {
    secondExpansion.expandDeps(file);
  }

  public void snapDeps() throws MakeFatalException {
    specialTargets.snapDeps();
  }

  public void removeIntermediates(boolean signal) {
    reaper.removeIntermediates(signal);
  }

  public void printDatabase() {
    printer.printDatabase(out);
  }

  public String formatDatabase() {
    return printer.formatDatabase();
  }

  public void printTargets() {
    printer.printTargets(out);
  }

  /** Runs the consistency check if {@code --verify-database} was given. */
  public int verify() {
    if (!state.getOptions().verifyDatabase()) {
      return 0;
    }
    int problems = new DatabaseVerifier(registry).verify();
    logger.atFine().log("database verification found %d problems", problems);
    return problems;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link FileDatabase}. */
  public static final class Builder {
    private MakeOptions options = MakeOptions.defaults();
    @Nullable private EventHandler eventHandler;
    private StringPool strings = new StringPool();
    @Nullable private MacroExpander expander;
    private SearchPath searchPath = SearchPath.NONE;
    private FileDeleter deleter = FileDeleter.FILESYSTEM;
    private PrintStream out = System.out;
    private ZoneId zone = ZoneId.systemDefault();
    @Nullable private DependencyShuffler shuffler;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setOptions(MakeOptions options) {
      this.options = checkNotNull(options);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setEventHandler(EventHandler eventHandler) {
      this.eventHandler = checkNotNull(eventHandler);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setStringPool(StringPool strings) {
      this.strings = checkNotNull(strings);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setExpander(MacroExpander expander) {
      this.expander = checkNotNull(expander);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setSearchPath(SearchPath searchPath) {
      this.searchPath = checkNotNull(searchPath);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setDeleter(FileDeleter deleter) {
      this.deleter = checkNotNull(deleter);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setOut(PrintStream out) {
      this.out = checkNotNull(out);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setZone(ZoneId zone) {
      this.zone = checkNotNull(zone);
      return this;
    }

    /** Overrides the shuffler derived from {@link MakeOptions#shuffle}. */
    @CanIgnoreReturnValue
    public Builder setShuffler(DependencyShuffler shuffler) {
      this.shuffler = checkNotNull(shuffler);
      return this;
    }

    public FileDatabase build() {
      if (expander == null) {
        expander = new SimpleMacroExpander();
      }
      if (eventHandler == null) {
        eventHandler = new PrintingEventHandler(PROGRAM_NAME, out, System.err);
      }
      return new FileDatabase(this);
    }
  }
}
