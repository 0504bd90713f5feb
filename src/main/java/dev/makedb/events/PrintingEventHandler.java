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
package dev.makedb.events;

import java.io.PrintStream;

/**
 * Writes events the way make prints its diagnostics: errors and warnings go to the error stream
 * prefixed by their location, or by the program name when they have none; info and progress
 * messages go to the output stream as they are.
 */
public class PrintingEventHandler implements EventHandler {
  private final String programName;
  private final PrintStream out;
  private final PrintStream err;

  public PrintingEventHandler(String programName, PrintStream out, PrintStream err) {
    this.programName = programName;
    this.out = out;
    this.err = err;
  }

  @Override
  public void handle(Event event) {
    switch (event.getKind()) {
      case INFO:
      case PROGRESS:
        out.println(event.getMessage());
        out.flush();
        return;
      case WARNING:
        err.println(prefix(event) + "warning: " + event.getMessage());
        break;
      case ERROR:
        err.println(prefix(event) + event.getMessage());
        break;
    }
    err.flush();
  }

  private String prefix(Event event) {
    Location location = event.getLocation();
    return (location != null ? location.toString() : programName) + ": ";
  }
}
