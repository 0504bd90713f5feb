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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import dev.makedb.expand.VariableSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * A file the makefile knows about: a target, a prerequisite, or both.
 *
 * <p>Nodes are created and owned by the {@link FileRegistry} and are never destroyed. A node that
 * is merged into another by {@link FileRegistry#rename} stays around as a forwarding stub; use
 * {@link #resolveRenamed} on any reference that may be stale.
 *
 * <p>Independent rules for a double-colon target each get their own node. The node registered
 * under the name is the head of the chain; {@link #getPrev} walks from the head towards the most
 * recently added member, which the head records as {@link #getLast}.
 */
public final class FileNode {
  private String name;
  private String hname;
  @Nullable private String vpath;

  private final List<Dependency> deps = new ArrayList<>();
  @Nullable private ImmutableList<Dependency> shuffledDeps;
  private final List<Dependency> alsoMake = new ArrayList<>();
  @Nullable private Recipe recipe;
  @Nullable private String stem;
  @Nullable private VariableSet variables;

  private long lastMtime = FileTimestamp.UNKNOWN;
  private long mtimeBeforeUpdate = FileTimestamp.UNKNOWN;
  private CommandState commandState = CommandState.NOT_STARTED;
  private UpdateStatus updateStatus = UpdateStatus.NONE;
  private final EnumSet<FileFlag> flags = EnumSet.noneOf(FileFlag.class);
  private final EnumSet<CommandFlag> commandFlags = EnumSet.noneOf(CommandFlag.class);

  @Nullable private FileNode doubleColon;
  @Nullable private FileNode prev;
  @Nullable private FileNode last;
  @Nullable private FileNode renamed;

  FileNode(String name) {
    checkArgument(!name.isEmpty(), "file name must not be empty");
    this.name = name;
    this.hname = name;
  }

  /** The name the file is known by. */
  public String getName() {
    return name;
  }

  void setName(String name) {
    this.name = name;
  }

  /**
   * The registry key. It differs from {@link #getName} between a rename and the update of the
   * display names, and when names are case-folded.
   */
  public String getHname() {
    return hname;
  }

  void setHname(String hname) {
    this.hname = hname;
  }

  /** The name found through directory search, if any. */
  @Nullable
  public String getVpath() {
    return vpath;
  }

  public void setVpath(@Nullable String vpath) {
    this.vpath = vpath;
  }

  /** The prerequisites, in the order they were declared. */
  public List<Dependency> getDependencies() {
    return Collections.unmodifiableList(deps);
  }

  /** The live, mutable prerequisite list, for the database's own list surgery. */
  List<Dependency> mutableDependencies() {
    return deps;
  }

  void addDependency(Dependency dependency) {
    deps.add(checkNotNull(dependency));
  }

  void addDependencies(List<Dependency> dependencies) {
    deps.addAll(dependencies);
  }

  /**
   * The prerequisites in the alternate order chosen by a {@link DependencyShuffler}, or the
   * declared order if none has been computed.
   */
  public List<Dependency> getShuffledDependencies() {
    return shuffledDeps != null ? shuffledDeps : getDependencies();
  }

  void setShuffledDependencies(@Nullable ImmutableList<Dependency> shuffledDeps) {
    this.shuffledDeps = shuffledDeps;
  }

  /** Other files that the recipe of this file also updates. */
  public List<Dependency> getAlsoMake() {
    return Collections.unmodifiableList(alsoMake);
  }

  public void addAlsoMake(FileNode other) {
    alsoMake.add(Dependency.on(other));
  }

  @Nullable
  public Recipe getRecipe() {
    return recipe;
  }

  public void setRecipe(@Nullable Recipe recipe) {
    this.recipe = recipe;
  }

  /** The text matched by the pattern of the rule that supplied the recipe, if any. */
  @Nullable
  public String getStem() {
    return stem;
  }

  public void setStem(@Nullable String stem) {
    this.stem = stem;
  }

  /** Target-specific variables, or null if the file has none. */
  @Nullable
  public VariableSet getVariables() {
    return variables;
  }

  public void setVariables(@Nullable VariableSet variables) {
    this.variables = variables;
  }

  public long getLastMtime() {
    return lastMtime;
  }

  public void setLastMtime(long lastMtime) {
    this.lastMtime = lastMtime;
  }

  public long getMtimeBeforeUpdate() {
    return mtimeBeforeUpdate;
  }

  public void setMtimeBeforeUpdate(long mtimeBeforeUpdate) {
    this.mtimeBeforeUpdate = mtimeBeforeUpdate;
  }

  public CommandState getCommandState() {
    return commandState;
  }

  /**
   * Sets the command state of this file, and of every file it also makes whose state is behind.
   * The state of an also-made file is never lowered.
   */
  public void setCommandState(CommandState state) {
    this.commandState = checkNotNull(state);
    for (Dependency d : alsoMake) {
      FileNode other = d.getFile();
      if (state.compareTo(other.commandState) > 0) {
        other.commandState = state;
      }
    }
  }

  public UpdateStatus getUpdateStatus() {
    return updateStatus;
  }

  public void setUpdateStatus(UpdateStatus updateStatus) {
    this.updateStatus = checkNotNull(updateStatus);
  }

  public boolean is(FileFlag flag) {
    return flags.contains(flag);
  }

  @CanIgnoreReturnValue
  public FileNode set(FileFlag flag) {
    flags.add(flag);
    return this;
  }

  @CanIgnoreReturnValue
  public FileNode set(FileFlag flag, boolean value) {
    if (value) {
      flags.add(flag);
    } else {
      flags.remove(flag);
    }
    return this;
  }

  @CanIgnoreReturnValue
  public FileNode clear(FileFlag flag) {
    flags.remove(flag);
    return this;
  }

  public Set<FileFlag> getFlags() {
    return Sets.immutableEnumSet(flags);
  }

  /** ORs every flag of {@code from} that survives a merge into this node. */
  void mergeFlagsFrom(FileNode from) {
    for (FileFlag flag : from.flags) {
      if (flag.isMergedOnRename()) {
        flags.add(flag);
      }
    }
  }

  public boolean isTarget() {
    return is(FileFlag.IS_TARGET);
  }

  public boolean hasCommandFlag(CommandFlag flag) {
    return commandFlags.contains(flag);
  }

  public void addCommandFlag(CommandFlag flag) {
    commandFlags.add(flag);
  }

  public Set<CommandFlag> getCommandFlags() {
    return Sets.immutableEnumSet(commandFlags);
  }

  public boolean isDoubleColon() {
    return doubleColon != null;
  }

  /** The head of this file's double-colon chain, or null if it has single-colon rules. */
  @Nullable
  public FileNode getDoubleColon() {
    return doubleColon;
  }

  void setDoubleColon(@Nullable FileNode head) {
    this.doubleColon = head;
  }

  /** The next member of the double-colon chain, walking away from the head. */
  @Nullable
  public FileNode getPrev() {
    return prev;
  }

  void setPrev(@Nullable FileNode prev) {
    this.prev = prev;
  }

  /** On a chain head: the most recently added member, or the head itself. */
  @Nullable
  public FileNode getLast() {
    return last;
  }

  void setLast(@Nullable FileNode last) {
    this.last = last;
  }

  /** This node and every node after it on its double-colon chain. */
  public ImmutableList<FileNode> chain() {
    ImmutableList.Builder<FileNode> chain = ImmutableList.builder();
    for (FileNode f = this; f != null; f = f.prev) {
      chain.add(f);
    }
    return chain.build();
  }

  /** The node this one was merged into, if it is a forwarding stub. */
  @Nullable
  public FileNode getRenamed() {
    return renamed;
  }

  void setRenamed(FileNode renamed) {
    this.renamed = renamed;
  }

  /** Follows forwarding stubs to the node that is registered today. */
  public FileNode resolveRenamed() {
    FileNode f = this;
    while (f.renamed != null) {
      f = f.renamed;
    }
    return f;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("name", name)
        .add("hname", hname.equals(name) ? null : hname)
        .add("flags", flags)
        .add("deps", deps.size())
        .add("doubleColon", doubleColon != null ? true : null)
        .add("renamed", renamed != null ? renamed.getName() : null)
        .toString();
  }
}
