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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import dev.makedb.events.Event;
import dev.makedb.events.EventHandler;
import dev.makedb.events.Location;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * The table of every file the makefile knows about, keyed by canonical name.
 *
 * <p>The table holds one node per name: either a single-colon node, or the head of a
 * double-colon chain. Nodes are never removed; a node merged into another by {@link #rename}
 * becomes a forwarding stub and is kept in {@link #getForwardingStubs}. Iteration follows the
 * order in which names were first registered.
 */
public final class FileRegistry {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final int INITIAL_CAPACITY = 1000;

  private final BuildState state;
  private final DependencyShuffler shuffler;
  private final Map<String, FileNode> files = new LinkedHashMap<>(INITIAL_CAPACITY);
  private final List<FileNode> forwardingStubs = new ArrayList<>();

  private int lastTargetListSize = -1;
  private String targetList = "";

  public FileRegistry(BuildState state) {
    this(state, DependencyShuffler.none());
  }

  /** Creates a registry that keeps the alternate prerequisite order chosen by {@code shuffler}. */
  public FileRegistry(BuildState state, DependencyShuffler shuffler) {
    this.state = checkNotNull(state);
    this.shuffler = checkNotNull(shuffler);
  }

  BuildState getState() {
    return state;
  }

  DependencyShuffler getShuffler() {
    return shuffler;
  }

  /** Returns the node registered under {@code name}, or null. */
  @Nullable
  public FileNode lookup(String name) {
    checkArgument(!name.isEmpty(), "looking up an empty file name");
    return files.get(state.canonicalName(name));
  }

  /**
   * Returns the node for {@code name}, creating it if needed.
   *
   * <p>An existing single-colon node is returned as is, except that it is no longer considered
   * built-in. If {@code name} has double-colon rules, a new member is appended to its chain. Use
   * {@link #lookupOrEnter} to find a double-colon file without growing its chain.
   */
  public FileNode getOrCreate(String name) {
    checkArgument(!name.isEmpty(), "entering an empty file name");
    String hname = state.getStrings().intern(state.canonicalName(name));
    FileNode f = files.get(hname);
    if (f != null && !f.isDoubleColon()) {
      f.clear(FileFlag.BUILTIN);
      return f;
    }
    checkState(
        !state.isSnapped() || !SpecialTarget.isSpecial(hname),
        "cannot define %s after the special targets have been finalized",
        hname);

    FileNode created = new FileNode(hname);
    if (f == null) {
      created.setLast(created);
      files.put(hname, created);
    } else {
      created.setDoubleColon(f);
      f.getLast().setPrev(created);
      f.setLast(created);
    }
    return created;
  }

  /** Returns the node registered under {@code name}, or a new single-colon node. */
  public FileNode lookupOrEnter(String name) {
    FileNode f = lookup(name);
    return f != null ? f : getOrCreate(name);
  }

  /**
   * Returns a node for a new double-colon rule for {@code name}: the head of a new chain, or a
   * new member of the existing one.
   *
   * @throws MakeFatalException if {@code name} already has a single-colon rule with a recipe
   */
  public FileNode enterDoubleColon(String name) throws MakeFatalException {
    FileNode f = getOrCreate(name);
    if (f.isDoubleColon()) {
      return f;
    }
    if (f.isTarget() && f.getRecipe() != null) {
      throw new MakeFatalException(
          f.getRecipe().getLocation(),
          String.format("target file '%s' has both : and :: entries", f.getName()));
    }
    f.setDoubleColon(f);
    return f;
  }

  /**
   * Appends prerequisites to {@code target}. Special targets cannot gain prerequisites once they
   * have been finalized.
   */
  public void addPrerequisites(FileNode target, List<Dependency> deps) {
    checkState(
        !state.isSnapped() || !SpecialTarget.isSpecial(target.getHname()),
        "cannot add prerequisites to %s after the special targets have been finalized",
        target.getHname());
    appendDependencies(target, deps);
  }

  /** Appends to the prerequisite list of {@code file} and recomputes its alternate order. */
  void appendDependencies(FileNode file, List<Dependency> deps) {
    file.addDependencies(deps);
    shuffler.regenerate(file);
  }

  /**
   * Renames {@code from} and its double-colon chain to {@code toName}, merging it into the file
   * already called {@code toName} if there is one, and updates the display names of the chain.
   */
  public void rename(FileNode from, String toName) throws MakeFatalException {
    from = from.resolveRenamed();
    rehash(from, toName);
    for (FileNode f = from; f != null; f = f.getPrev()) {
      f.setName(f.getHname());
    }
  }

  /**
   * Re-keys {@code from} and its double-colon chain under {@code toName}. If {@code toName} is
   * unused this only changes the key. Otherwise {@code from} is merged into the existing node:
   *
   * <ul>
   *   <li>the existing recipe wins; a conflicting recipe of {@code from} is reported and ignored,
   *   <li>prerequisites are concatenated, those of the existing node first,
   *   <li>target-specific variables are merged,
   *   <li>flags are ORed, except {@link FileFlag#INTERMEDIATE} and {@link FileFlag#BUILTIN},
   *   <li>the later modification time wins.
   * </ul>
   *
   * <p>{@code from} then forwards to the node it was merged into. Display names are left alone.
   *
   * @throws MakeFatalException if the merge would mix single-colon and double-colon rules
   */
  public void rehash(FileNode from, String toName) throws MakeFatalException {
    checkArgument(!toName.isEmpty(), "renaming to an empty file name");
    from = from.resolveRenamed();
    from.clear(FileFlag.BUILTIN);
    String toHname = state.getStrings().intern(state.canonicalName(toName));
    if (from.getHname().equals(toHname)) {
      return;
    }

    FileNode deleted = files.remove(from.getHname());
    checkState(
        deleted == from,
        "file %s is not the one registered under %s (found %s)",
        from,
        from.getHname(),
        deleted);

    FileNode to = files.get(toHname);

    from.setHname(toHname);
    for (FileNode f = from.getDoubleColon(); f != null; f = f.getPrev()) {
      f.setHname(toHname);
    }

    if (to == null) {
      files.put(toHname, from);
      return;
    }

    logger.atFine().log("merging %s into %s", from.getName(), to.getName());
    mergeRecipe(from, to, toHname);
    appendDependencies(to, from.getDependencies());

    if (from.getVariables() != null) {
      if (to.getVariables() == null) {
        to.setVariables(from.getVariables());
      } else {
        to.getVariables().mergeFrom(from.getVariables());
      }
    }

    if (to.isDoubleColon() && from.isTarget() && !from.isDoubleColon()) {
      throw new MakeFatalException(
          String.format(
              "can't rename single-colon '%s' to double-colon '%s'", from.getName(), toHname));
    }
    if (!to.isDoubleColon() && from.isDoubleColon()) {
      if (to.isTarget()) {
        throw new MakeFatalException(
            String.format(
                "can't rename double-colon '%s' to single-colon '%s'", from.getName(), toHname));
      }
      to.setDoubleColon(from.getDoubleColon());
    }

    if (from.getLastMtime() > to.getLastMtime()) {
      // A time forced with -W beats the one found through directory search.
      to.setLastMtime(from.getLastMtime());
    }
    to.setMtimeBeforeUpdate(from.getMtimeBeforeUpdate());

    to.mergeFlagsFrom(from);
    to.clear(FileFlag.BUILTIN);
    from.setRenamed(to);
    forwardingStubs.add(from);
  }

  private void mergeRecipe(FileNode from, FileNode to, String toHname) {
    Recipe fromRecipe = from.getRecipe();
    if (fromRecipe == null) {
      return;
    }
    if (to.getRecipe() == null) {
      to.setRecipe(fromRecipe);
      return;
    }
    if (fromRecipe == to.getRecipe()) {
      return;
    }
    // Both files have recipes: keep the one of the file that survives.
    EventHandler handler = state.getEventHandler();
    Location location = fromRecipe.getLocation();
    if (location != null) {
      handler.handle(
          Event.warn(
              location,
              String.format(
                  "recipe was specified for file '%s' at %s:%d,",
                  from.getName(), location.file(), location.line())));
    } else {
      handler.handle(
          Event.warn(
              null,
              String.format(
                  "recipe for file '%s' was found by implicit rule search,", from.getName())));
    }
    handler.handle(
        Event.warn(
            location,
            String.format(
                "but '%s' is now considered the same file as '%s'", from.getName(), toHname)));
    handler.handle(
        Event.warn(
            location,
            String.format(
                "recipe for '%s' will be ignored in favor of the one for '%s'",
                from.getName(), toHname)));
  }

  /** The registered nodes: single-colon nodes and double-colon chain heads. */
  public Collection<FileNode> getFiles() {
    return Collections.unmodifiableCollection(files.values());
  }

  /** Every registered node and every member of every double-colon chain. */
  public ImmutableList<FileNode> getAllFiles() {
    ImmutableList.Builder<FileNode> all = ImmutableList.builder();
    for (FileNode f : files.values()) {
      all.addAll(f.chain());
    }
    return all.build();
  }

  /** Nodes that were merged into another node. They are kept forever so stale references work. */
  public ImmutableList<FileNode> getForwardingStubs() {
    return ImmutableList.copyOf(forwardingStubs);
  }

  public int size() {
    return files.size();
  }

  /**
   * Space-separated names of every target. The list is recomputed only when the number of
   * registered files has changed since the previous call.
   */
  @CanIgnoreReturnValue
  public String targetNameList() {
    if (files.size() != lastTargetListSize) {
      List<String> names = new ArrayList<>();
      for (FileNode f : files.values()) {
        if (f.isTarget()) {
          names.add(f.getName());
        }
      }
      targetList = Joiner.on(' ').join(names);
      lastTargetListSize = files.size();
    }
    return targetList;
  }
}
