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

import com.google.common.base.MoreObjects;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * An edge from a target to one of its prerequisites.
 *
 * <p>Until it is resolved an edge only has a {@linkplain #getName name}, which for edges that
 * need second expansion is the unexpanded template. Resolution points the edge at the
 * {@link FileNode} owned by the {@link FileRegistry} and drops the name.
 */
public final class Dependency {
  @Nullable private FileNode file;
  @Nullable private String name;
  @Nullable private Stem stem;
  private boolean orderOnly;
  private boolean waitHere;
  private boolean needsSecondExpansion;
  private boolean staticPattern;
  private boolean ignoreAutomaticVars;

  private Dependency(@Nullable String name, @Nullable FileNode file) {
    this.name = name;
    this.file = file;
  }

  /** An unresolved edge. */
  public static Dependency named(String name) {
    return new Dependency(checkNotNull(name), null);
  }

  /** An unresolved edge whose name is a template for second expansion. */
  public static Dependency template(String template) {
    Dependency d = named(template);
    d.needsSecondExpansion = true;
    return d;
  }

  /** A resolved edge. */
  public static Dependency on(FileNode file) {
    return new Dependency(null, checkNotNull(file));
  }

  @Nullable
  public FileNode getFile() {
    return file;
  }

  /** The unresolved name or template; null once the edge is resolved. */
  @Nullable
  public String getName() {
    return name;
  }

  void setName(@Nullable String name) {
    this.name = name;
  }

  /** Points this edge at {@code file} and forgets its name. */
  void resolve(FileNode file) {
    this.file = checkNotNull(file);
    this.name = null;
    this.staticPattern = false;
  }

  /** The unresolved name if there is one, otherwise the name of the prerequisite. */
  public String displayName() {
    if (name != null) {
      return name;
    }
    checkState(file != null, "dependency has neither a name nor a file");
    return file.getName();
  }

  @Nullable
  public Stem getStem() {
    return stem;
  }

  public Dependency setStem(@Nullable Stem stem) {
    this.stem = stem;
    return this;
  }

  /** Order-only: the prerequisite has to exist but its timestamp is ignored. */
  public boolean isOrderOnly() {
    return orderOnly;
  }

  public Dependency setOrderOnly(boolean orderOnly) {
    this.orderOnly = orderOnly;
    return this;
  }

  /** Whether the prerequisites before this one must finish before this one starts. */
  public boolean isWaitHere() {
    return waitHere;
  }

  public Dependency setWaitHere(boolean waitHere) {
    this.waitHere = waitHere;
    return this;
  }

  public boolean needsSecondExpansion() {
    return needsSecondExpansion;
  }

  public Dependency setNeedsSecondExpansion(boolean needsSecondExpansion) {
    this.needsSecondExpansion = needsSecondExpansion;
    return this;
  }

  /** Whether the name is a static pattern template whose {@code %} is filled from the stem. */
  public boolean isStaticPattern() {
    return staticPattern;
  }

  public Dependency setStaticPattern(boolean staticPattern) {
    this.staticPattern = staticPattern;
    return this;
  }

  /** Whether the prerequisite is left out of {@code $^}, {@code $<} and friends. */
  public boolean ignoresAutomaticVars() {
    return ignoreAutomaticVars;
  }

  public Dependency setIgnoreAutomaticVars(boolean ignoreAutomaticVars) {
    this.ignoreAutomaticVars = ignoreAutomaticVars;
    return this;
  }

  /** Returns an independent copy of this edge, pointing at the same file. */
  public Dependency copy() {
    Dependency c = new Dependency(name, file);
    c.stem = stem;
    c.orderOnly = orderOnly;
    c.waitHere = waitHere;
    c.needsSecondExpansion = needsSecondExpansion;
    c.staticPattern = staticPattern;
    c.ignoreAutomaticVars = ignoreAutomaticVars;
    return c;
  }

  public static List<Dependency> copyAll(List<Dependency> deps) {
    List<Dependency> copies = new ArrayList<>(deps.size());
    for (Dependency d : deps) {
      copies.add(d.copy());
    }
    return copies;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("name", name)
        .add("file", file == null ? null : file.getName())
        .add("stem", stem == null ? null : stem.text())
        .add("orderOnly", orderOnly ? true : null)
        .add("waitHere", waitHere ? true : null)
        .add("secondExpansion", needsSecondExpansion ? true : null)
        .add("staticPattern", staticPattern ? true : null)
        .toString();
  }
}
