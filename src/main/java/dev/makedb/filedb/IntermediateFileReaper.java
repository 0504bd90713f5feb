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
import dev.makedb.events.Event;
import dev.makedb.events.EventHandler;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.NoSuchFileException;

/**
 * Deletes the intermediate files a run created, at the end of the run or when it is killed by a
 * signal.
 */
public final class IntermediateFileReaper {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final FileRegistry registry;
  private final BuildState state;
  private final FileDeleter deleter;
  private final PrintStream out;

  public IntermediateFileReaper(FileRegistry registry, FileDeleter deleter, PrintStream out) {
    this.registry = checkNotNull(registry);
    this.state = registry.getState();
    this.deleter = checkNotNull(deleter);
    this.out = checkNotNull(out);
  }

  /**
   * Whether {@code f} is deleted by the reaper: it is intermediate, not secondary, not kept by
   * {@code .NOTINTERMEDIATE}, not a command line goal, not precious unless it is an optional
   * makefile, and something may have created it.
   */
  public static boolean isEligibleForDeletion(FileNode f) {
    return f.is(FileFlag.INTERMEDIATE)
        && (f.is(FileFlag.DONT_CARE) || !f.is(FileFlag.PRECIOUS))
        && !f.is(FileFlag.SECONDARY)
        && !f.is(FileFlag.NOT_INTERMEDIATE)
        && !f.is(FileFlag.CMD_TARGET)
        && f.getUpdateStatus() != UpdateStatus.NONE;
  }

  /**
   * Deletes every eligible intermediate file.
   *
   * <p>On a normal finish the deletions are echoed as one {@code rm} line on the output stream,
   * unless the run is silent. When {@code signal} is set each deletion is reported on the error
   * channel instead. Under {@code -n} nothing is deleted. A file that is already gone is skipped
   * quietly; any other failure is reported and the sweep goes on.
   */
  public void removeIntermediates(boolean signal) {
    MakeOptions options = state.getOptions();
    if (options.question() || options.touch() || state.isAllSecondary()
        || state.isNoIntermediates()) {
      return;
    }
    if (signal && options.justPrint()) {
      return;
    }

    EventHandler handler = state.getEventHandler();
    boolean doneAny = false;
    for (FileNode f : registry.getFiles()) {
      if (!isEligibleForDeletion(f)) {
        continue;
      }
      IOException failure = null;
      if (!options.justPrint()) {
        try {
          deleter.delete(f.getName());
        } catch (NoSuchFileException e) {
          continue;
        } catch (IOException e) {
          failure = e;
        }
      }
      if (f.is(FileFlag.DONT_CARE)) {
        continue;
      }
      if (signal) {
        handler.handle(
            Event.errorf(null, "*** deleting intermediate file '%s'", f.getName()));
      } else {
        if (!doneAny) {
          logger.atFine().log("Removing intermediate files...");
        }
        if (!state.isRunSilent()) {
          out.print(doneAny ? " " : "rm ");
          out.print(f.getName());
          out.flush();
          doneAny = true;
        }
      }
      if (failure != null) {
        if (doneAny) {
          out.println();
          out.flush();
        }
        handler.handle(
            Event.errorf(null, "unlink: %s: %s", f.getName(), describe(failure)));
        // Start the rm line over.
        doneAny = false;
      }
    }

    if (doneAny && !signal) {
      out.println();
      out.flush();
    }
  }

  private static String describe(IOException e) {
    String reason = e.getMessage();
    return reason != null ? reason : e.getClass().getSimpleName();
  }
}
