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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.FormatMethod;
import com.google.errorprone.annotations.FormatString;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A diagnostic reported by the file database: an error, a warning, or informational or progress
 * output. Events are delivered to an {@link EventHandler}; none of them stops the run.
 */
public final class Event {
  private final EventKind kind;
  @Nullable private final Location location;
  private final String message;

  private Event(EventKind kind, @Nullable Location location, String message) {
    this.kind = checkNotNull(kind);
    this.location = location;
    this.message = checkNotNull(message);
  }

  public static Event of(EventKind kind, @Nullable Location location, String message) {
    return new Event(kind, location, message);
  }

  public static Event error(@Nullable Location location, String message) {
    return new Event(EventKind.ERROR, location, message);
  }

  public static Event error(String message) {
    return error(null, message);
  }

  @FormatMethod
  public static Event errorf(
      @Nullable Location location, @FormatString String format, Object... args) {
    return error(location, String.format(format, args));
  }

  public static Event warn(@Nullable Location location, String message) {
    return new Event(EventKind.WARNING, location, message);
  }

  public static Event info(String message) {
    return new Event(EventKind.INFO, null, message);
  }

  public static Event progress(String message) {
    return new Event(EventKind.PROGRESS, null, message);
  }

  public EventKind getKind() {
    return kind;
  }

  @Nullable
  public Location getLocation() {
    return location;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Event)) {
      return false;
    }
    Event that = (Event) other;
    return kind == that.kind
        && Objects.equals(location, that.location)
        && message.equals(that.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, location, message);
  }

  @Override
  public String toString() {
    return kind + " " + (location != null ? location + ": " : "") + message;
  }
}
