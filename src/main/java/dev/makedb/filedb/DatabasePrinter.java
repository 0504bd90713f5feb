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

import dev.makedb.events.Location;
import java.io.PrintStream;
import java.time.ZoneId;
import java.util.List;

/**
 * Renders the file database as text, one stanza per file, for {@code -p}. The output is stable:
 * files appear in registration order, each double-colon chain member right after its predecessor.
 */
public final class DatabasePrinter {
  private final FileRegistry registry;
  private final BuildState state;
  private final ZoneId zone;

  public DatabasePrinter(FileRegistry registry) {
    this(registry, ZoneId.systemDefault());
  }

  public DatabasePrinter(FileRegistry registry, ZoneId zone) {
    this.registry = checkNotNull(registry);
    this.state = registry.getState();
    this.zone = checkNotNull(zone);
  }

  public void printDatabase(PrintStream out) {
    out.print(formatDatabase());
    out.flush();
  }

  public String formatDatabase() {
    StringBuilder out = new StringBuilder();
    out.append("\n# Files\n");
    for (FileNode f : registry.getFiles()) {
      appendFile(out, f);
    }
    out.append("\n# files hash-table stats:\n# ");
    out.append(String.format("Load=%d entries, %d forwarded", registry.size(),
        registry.getForwardingStubs().size()));
    out.append('\n');
    return out.toString();
  }

  /** Formats the stanza of {@code f} alone, without the rest of its double-colon chain. */
  public String formatFile(FileNode f) {
    StringBuilder out = new StringBuilder();
    if (!isHidden(f)) {
      appendStanza(out, f);
    }
    return out.toString();
  }

  /** A hidden member hides the members after it in its double-colon chain too. */
  private void appendFile(StringBuilder out, FileNode f) {
    for (FileNode member = f; member != null && !isHidden(member); member = member.getPrev()) {
      appendStanza(out, member);
    }
  }

  /** Built-in targets cannot be removed under {@code -r}, only hidden. */
  private boolean isHidden(FileNode f) {
    return state.getOptions().noBuiltinRules() && f.is(FileFlag.BUILTIN);
  }

  private void appendStanza(StringBuilder out, FileNode f) {
    out.append('\n');
    if (!f.isTarget()) {
      out.append("# Not a target:\n");
    }
    out.append(f.getName()).append(':');
    if (f.isDoubleColon()) {
      out.append(':');
    }
    appendPrereqs(out, f.getDependencies());

    if (f.is(FileFlag.PRECIOUS)) {
      out.append("#  Precious file (prerequisite of .PRECIOUS).\n");
    }
    if (f.is(FileFlag.PHONY)) {
      out.append("#  Phony target (prerequisite of .PHONY).\n");
    }
    if (f.is(FileFlag.CMD_TARGET)) {
      out.append("#  Command line target.\n");
    }
    if (f.is(FileFlag.DONT_CARE)) {
      out.append("#  A default, MAKEFILES, or -include/sinclude makefile.\n");
    }
    if (f.is(FileFlag.BUILTIN)) {
      out.append("#  Builtin rule\n");
    }
    out.append(
        f.is(FileFlag.TRIED_IMPLICIT)
            ? "#  Implicit rule search has been done.\n"
            : "#  Implicit rule search has not been done.\n");
    if (f.getStem() != null) {
      out.append("#  Implicit/static pattern stem: '").append(f.getStem()).append("'\n");
    }
    if (f.is(FileFlag.INTERMEDIATE)) {
      out.append("#  File is an intermediate prerequisite.\n");
    }
    if (f.is(FileFlag.NOT_INTERMEDIATE)) {
      out.append("#  File is a prerequisite of .NOTINTERMEDIATE.\n");
    }
    if (f.is(FileFlag.SECONDARY)) {
      out.append("#  File is secondary (prerequisite of .SECONDARY).\n");
    }
    if (!f.getAlsoMake().isEmpty()) {
      out.append("#  Also makes:");
      for (Dependency d : f.getAlsoMake()) {
        out.append(' ').append(d.displayName());
      }
      out.append('\n');
    }

    long mtime = f.getLastMtime();
    if (mtime == FileTimestamp.UNKNOWN) {
      out.append("#  Modification time never checked.\n");
    } else if (mtime == FileTimestamp.NONEXISTENT) {
      out.append("#  File does not exist.\n");
    } else if (mtime == FileTimestamp.OLD) {
      out.append("#  File is very old.\n");
    } else {
      out.append("#  Last modified ").append(FileTimestamp.format(mtime, zone)).append('\n');
    }
    out.append(
        f.is(FileFlag.UPDATED)
            ? "#  File has been updated.\n"
            : "#  File has not been updated.\n");

    switch (f.getCommandState()) {
      case RUNNING:
        out.append("#  Recipe currently running (THIS IS A BUG).\n");
        break;
      case DEPS_RUNNING:
        out.append("#  Dependencies recipe running (THIS IS A BUG).\n");
        break;
      case NOT_STARTED:
      case FINISHED:
        switch (f.getUpdateStatus()) {
          case NONE:
            break;
          case SUCCESS:
            out.append("#  Successfully updated.\n");
            break;
          case QUESTION:
            out.append("#  Needs to be updated (-q is set).\n");
            break;
          case FAILED:
            out.append("#  Failed to be updated.\n");
            break;
        }
        break;
    }

    Recipe recipe = f.getRecipe();
    if (recipe != null) {
      appendRecipe(out, recipe);
    }
  }

  /** Normal prerequisites first, then the order-only ones after {@code | }. */
  private static void appendPrereqs(StringBuilder out, List<Dependency> deps) {
    boolean anyOrderOnly = false;
    for (Dependency d : deps) {
      if (d.isOrderOnly()) {
        anyOrderOnly = true;
        continue;
      }
      out.append(' ');
      appendPrereq(out, d);
    }
    if (anyOrderOnly) {
      out.append(" |");
      for (Dependency d : deps) {
        if (d.isOrderOnly()) {
          out.append(' ');
          appendPrereq(out, d);
        }
      }
    }
    out.append('\n');
  }

  private static void appendPrereq(StringBuilder out, Dependency d) {
    if (d.isWaitHere()) {
      out.append(".WAIT ");
    }
    out.append(d.displayName());
  }

  private static void appendRecipe(StringBuilder out, Recipe recipe) {
    out.append("#  recipe to execute");
    Location location = recipe.getLocation();
    if (location == null) {
      out.append(" (built-in):\n");
    } else {
      out.append(
          String.format(" (from '%s', line %d):\n", location.file(), location.line()));
    }
    for (String line : recipe.getLines()) {
      out.append('\t').append(line).append('\n');
    }
  }

  /**
   * Prints the name of every target, one per line, leaving out suffix rules and POSIX special
   * targets.
   */
  public void printTargets(PrintStream out) {
    for (FileNode f : registry.getFiles()) {
      if (!f.isTarget() || f.is(FileFlag.SUFFIX) || SpecialTarget.looksSpecial(f.getName())) {
        continue;
      }
      out.println(f.getName());
    }
    out.flush();
  }
}
