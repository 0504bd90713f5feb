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
package dev.makedb.expand;

import dev.makedb.filedb.FileNode;
import javax.annotation.Nullable;

/**
 * The macro expansion engine the file database calls into. The database never interprets
 * variable references itself; it asks the expander to expand text either in the global scope or
 * in the scope of one file with that file's automatic variables bound.
 */
public interface MacroExpander {

  /** Expands {@code text} in the global scope. */
  String expand(String text);

  /** Prepares the target-specific variable scope of {@code file}, once per second expansion. */
  void initializeFileVariables(FileNode file);

  /**
   * Binds the automatic variables of {@code file} ({@code $@}, {@code $*}, {@code $<}, ...)
   * using {@code stem} as the value of {@code $*}.
   */
  void setFileVariables(FileNode file, @Nullable String stem);

  /** Expands {@code text} in the scope of {@code file}. */
  String expandForFile(String text, FileNode file);

  /** Returns the unexpanded value of the global variable {@code name}, or null. */
  @Nullable
  String lookupVariable(String name);
}
