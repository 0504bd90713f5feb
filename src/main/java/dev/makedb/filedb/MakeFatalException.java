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

import dev.makedb.events.Location;
import javax.annotation.Nullable;

/**
 * An error after which the run cannot continue: inconsistent colon kinds on a merge, or a file
 * that is both intermediate and not intermediate.
 */
public class MakeFatalException extends Exception {
  @Nullable private final Location location;

  public MakeFatalException(String message) {
    this(null, message);
  }

  public MakeFatalException(@Nullable Location location, String message) {
    super(message);
    this.location = location;
  }

  public MakeFatalException(String message, Throwable cause) {
    super(message, cause);
    this.location = null;
  }

  @Nullable
  public Location getLocation() {
    return location;
  }

  /** The message as make prints it, prefixed with the location when there is one. */
  public String getFormattedMessage() {
    return (location != null ? location + ": " : "") + getMessage() + ".  Stop.";
  }
}
