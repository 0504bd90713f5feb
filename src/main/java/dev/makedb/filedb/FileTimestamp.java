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

import dev.makedb.events.Event;
import dev.makedb.events.EventHandler;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import javax.annotation.Nullable;

/**
 * File modification times packed into a {@code long}.
 *
 * <p>The three smallest values are sentinels. Ordinary timestamps hold the seconds since the
 * epoch shifted left by {@link #LO_BITS} bits plus the nanoseconds, offset by
 * {@link #ORDINARY_MIN}, so that packed values compare like the times they represent.
 */
public final class FileTimestamp {
  /** The file has not been looked at yet. */
  public static final long UNKNOWN = 0;
  /** The file does not exist. */
  public static final long NONEXISTENT = 1;
  /** The file is older than any other file. */
  public static final long OLD = 2;
  public static final long ORDINARY_MIN = 3;
  /** The file is newer than any other file. */
  public static final long NEW = Long.MAX_VALUE;

  static final int LO_BITS = 30;
  private static final long LO_MASK = (1L << LO_BITS) - 1;
  private static final int NANOS_PER_SECOND = 1_000_000_000;

  public static final long ORDINARY_MAX =
      ((NEW >> LO_BITS) << LO_BITS) + ORDINARY_MIN + NANOS_PER_SECOND - 1;

  private static final DateTimeFormatter DATE_TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private FileTimestamp() {}

  /**
   * Packs a timestamp. A time the encoding cannot hold is clamped to the nearest ordinary
   * value and reported as an error naming {@code fileName}, or the current time if it is null.
   */
  public static long of(
      @Nullable String fileName, long seconds, int nanos, EventHandler eventHandler) {
    long product = seconds << LO_BITS;
    long ts = product + ORDINARY_MIN + nanos;
    if (seconds < 0
        || seconds > seconds(ORDINARY_MAX)
        || product > ts
        || ts > ORDINARY_MAX) {
      ts = seconds <= OLD ? ORDINARY_MIN : ORDINARY_MAX;
      eventHandler.handle(
          Event.errorf(
              null,
              "%s: timestamp out of range: substituting %s",
              fileName != null ? fileName : "Current time",
              format(ts)));
    }
    return ts;
  }

  public static long of(Instant instant, EventHandler eventHandler) {
    return of(null, instant.getEpochSecond(), instant.getNano(), eventHandler);
  }

  public static long now(EventHandler eventHandler) {
    return of(Instant.now(), eventHandler);
  }

  /** Seconds since the epoch of an ordinary timestamp. */
  public static long seconds(long ts) {
    return (ts - ORDINARY_MIN) >> LO_BITS;
  }

  /** Nanosecond part of an ordinary timestamp. */
  public static int nanos(long ts) {
    return (int) ((ts - ORDINARY_MIN) & LO_MASK);
  }

  public static boolean isOrdinary(long ts) {
    return ts >= ORDINARY_MIN && ts <= ORDINARY_MAX;
  }

  public static String format(long ts) {
    return format(ts, ZoneId.systemDefault());
  }

  /**
   * Renders {@code ts} as local date and time followed by the nanoseconds as a fraction with
   * trailing zeros removed, e.g. {@code 2024-03-01 12:00:05.25}.
   */
  public static String format(long ts, ZoneId zone) {
    long s = seconds(ts);
    StringBuilder out = new StringBuilder();
    try {
      out.append(LocalDateTime.ofInstant(Instant.ofEpochSecond(s), zone).format(DATE_TIME));
    } catch (DateTimeException e) {
      out.append(s);
    }
    String fraction = String.format("%09d", nanos(ts));
    int end = fraction.length();
    while (end > 0 && fraction.charAt(end - 1) == '0') {
      end--;
    }
    if (end > 0) {
      out.append('.').append(fraction, 0, end);
    }
    return out.toString();
  }
}
