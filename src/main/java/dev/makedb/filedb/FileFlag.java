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

/** Boolean properties of a {@link FileNode}. */
public enum FileFlag {
  /** Mentioned as a target of some rule. */
  IS_TARGET,
  /** Prerequisite of {@code .PHONY}. */
  PHONY,
  /** Prerequisite of {@code .PRECIOUS}. */
  PRECIOUS,
  /**
   * Generated file that is deleted once the run no longer needs it. Never carried over by a
   * rename: a file that already exists must not become intermediate because a duplicate found
   * through directory search was merged into it.
   */
  INTERMEDIATE(/* mergedOnRename= */ false),
  /** Intermediate but never deleted. */
  SECONDARY,
  /** Prerequisite of {@code .NOTINTERMEDIATE}. */
  NOT_INTERMEDIATE,
  /** A missing file is not an error: a default, MAKEFILES or {@code -include} makefile. */
  DONT_CARE,
  /** Named as a goal on the command line. */
  CMD_TARGET,
  /** Mentioned literally as a prerequisite, not introduced by a pattern. */
  EXPLICIT,
  /** Comes from a built-in rule. */
  BUILTIN(/* mergedOnRename= */ false),
  /** Implicit rule search has been done. */
  TRIED_IMPLICIT,
  /** Second expansion of the prerequisites has been done. */
  SNAPPED,
  /** Prerequisite of {@code .LOW_RESOLUTION_TIME}. */
  LOW_RESOLUTION_TIME,
  /** Directory search is not used for this file. */
  IGNORE_VPATH,
  /** A makefile that has been read. */
  LOADED,
  UPDATING,
  UPDATED,
  /** A suffix rule target such as {@code .c.o}. */
  SUFFIX;

  private final boolean mergedOnRename;

  FileFlag() {
    this(true);
  }

  FileFlag(boolean mergedOnRename) {
    this.mergedOnRename = mergedOnRename;
  }

  /** Whether a node merged away by a rename passes this flag on to the node it merges into. */
  public boolean isMergedOnRename() {
    return mergedOnRename;
  }
}
