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

import dev.makedb.events.EventHandler;
import dev.makedb.util.StringPool;

/**
 * The mutable state of one run that is shared by every part of the file database: the options,
 * the diagnostics channel, the string pool, and the build-wide policies that
 * {@link SpecialTargets} derives from the special targets.
 *
 * <p>The special-target pass is one-shot: {@link #markSnapped} fails if it is called twice, and
 * once it has run no special target may gain prerequisites.
 */
public final class BuildState {
  private final MakeOptions options;
  private final EventHandler eventHandler;
  private final StringPool strings;

  private boolean snapped;
  private boolean allSecondary;
  private boolean noIntermediates;
  private boolean exportAllVariables;
  private boolean ignoreErrors;
  private boolean runSilent;
  private boolean notParallel;

  public BuildState(MakeOptions options, EventHandler eventHandler, StringPool strings) {
    this.options = checkNotNull(options);
    this.eventHandler = checkNotNull(eventHandler);
    this.strings = checkNotNull(strings);
    this.runSilent = options.silent();
  }

  public BuildState(MakeOptions options, EventHandler eventHandler) {
    this(options, eventHandler, new StringPool());
  }

  public MakeOptions getOptions() {
    return options;
  }

  public EventHandler getEventHandler() {
    return eventHandler;
  }

  public StringPool getStrings() {
    return strings;
  }

  /** Canonicalizes a name at a registry entry point: case folding, then normalization. */
  String canonicalName(String name) {
    String folded = options.caseInsensitiveTargets() ? NameNormalizer.foldCase(name) : name;
    return NameNormalizer.normalize(folded);
  }

  /** Whether the special targets have been interpreted. */
  public boolean isSnapped() {
    return snapped;
  }

  void markSnapped() {
    checkState(!snapped, "special targets have already been finalized");
    snapped = true;
  }

  /** {@code .SECONDARY} without prerequisites: every file is secondary. */
  public boolean isAllSecondary() {
    return allSecondary;
  }

  void setAllSecondary() {
    allSecondary = true;
  }

  /** {@code .NOTINTERMEDIATE} without prerequisites: no file is intermediate. */
  public boolean isNoIntermediates() {
    return noIntermediates;
  }

  void setNoIntermediates() {
    noIntermediates = true;
  }

  /** {@code .EXPORT_ALL_VARIABLES} is a target. */
  public boolean isExportAllVariables() {
    return exportAllVariables;
  }

  void setExportAllVariables() {
    exportAllVariables = true;
  }

  /** {@code .IGNORE} without prerequisites: errors in every recipe are ignored. */
  public boolean isIgnoreErrors() {
    return ignoreErrors;
  }

  void setIgnoreErrors() {
    ignoreErrors = true;
  }

  /** {@code -s}, or {@code .SILENT} without prerequisites. */
  public boolean isRunSilent() {
    return runSilent;
  }

  void setRunSilent() {
    runSilent = true;
  }

  /** {@code .NOTPARALLEL} without prerequisites: nothing runs in parallel. */
  public boolean isNotParallel() {
    return notParallel;
  }

  void setNotParallel() {
    notParallel = true;
  }
}
