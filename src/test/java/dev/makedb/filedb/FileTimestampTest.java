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

import static com.google.common.truth.Truth.assertThat;

import dev.makedb.events.EventKind;
import dev.makedb.events.StoredEventHandler;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link FileTimestamp}. */
@RunWith(JUnit4.class)
public final class FileTimestampTest {
  private final StoredEventHandler events = new StoredEventHandler();

  @Test
  public void sentinelsSortBeforeOrdinaryTimes() {
    long epoch = FileTimestamp.of(null, 0, 0, events);

    assertThat(FileTimestamp.UNKNOWN).isLessThan(FileTimestamp.NONEXISTENT);
    assertThat(FileTimestamp.NONEXISTENT).isLessThan(FileTimestamp.OLD);
    assertThat(FileTimestamp.OLD).isLessThan(epoch);
    assertThat(epoch).isEqualTo(FileTimestamp.ORDINARY_MIN);
    assertThat(FileTimestamp.ORDINARY_MAX).isLessThan(FileTimestamp.NEW);
  }

  @Test
  public void packedValuesCompareLikeTimes() {
    long early = FileTimestamp.of("f", 1_700_000_000L, 999_999_999, events);
    long later = FileTimestamp.of("f", 1_700_000_001L, 0, events);

    assertThat(early).isLessThan(later);
    assertThat(FileTimestamp.seconds(early)).isEqualTo(1_700_000_000L);
    assertThat(FileTimestamp.nanos(early)).isEqualTo(999_999_999);
    assertThat(FileTimestamp.isOrdinary(early)).isTrue();
    assertThat(events.isEmpty()).isTrue();
  }

  @Test
  public void fromInstant() {
    long ts = FileTimestamp.of(Instant.ofEpochSecond(42, 7), events);

    assertThat(FileTimestamp.seconds(ts)).isEqualTo(42);
    assertThat(FileTimestamp.nanos(ts)).isEqualTo(7);
  }

  @Test
  public void negativeTimeClampedToMinimum() {
    long ts = FileTimestamp.of("ancient.c", -5, 0, events);

    assertThat(ts).isEqualTo(FileTimestamp.ORDINARY_MIN);
    assertThat(events.getEvents(EventKind.ERROR)).hasSize(1);
    assertThat(events.getEvents().get(0).getMessage())
        .startsWith("ancient.c: timestamp out of range: substituting ");
  }

  @Test
  public void hugeTimeClampedToMaximum() {
    long ts = FileTimestamp.of(null, 1L << 40, 0, events);

    assertThat(ts).isEqualTo(FileTimestamp.ORDINARY_MAX);
    assertThat(events.getEvents().get(0).getMessage())
        .startsWith("Current time: timestamp out of range: substituting ");
  }

  @Test
  public void now_isOrdinary() {
    assertThat(FileTimestamp.isOrdinary(FileTimestamp.now(events))).isTrue();
    assertThat(FileTimestamp.isOrdinary(FileTimestamp.NONEXISTENT)).isFalse();
  }

  @Test
  public void format_trimsFraction() {
    long ts = FileTimestamp.of(null, 86_400 + 3_661, 250_000_000, events);

    assertThat(FileTimestamp.format(ts, ZoneOffset.UTC)).isEqualTo("1970-01-02 01:01:01.25");
  }

  @Test
  public void format_wholeSeconds() {
    long ts = FileTimestamp.of(null, 0, 0, events);

    assertThat(FileTimestamp.format(ts, ZoneOffset.UTC)).isEqualTo("1970-01-01 00:00:00");
  }
}
