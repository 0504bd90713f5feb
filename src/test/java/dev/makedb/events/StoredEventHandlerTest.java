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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link StoredEventHandler}. */
@RunWith(JUnit4.class)
public final class StoredEventHandlerTest {
  private final StoredEventHandler handler = new StoredEventHandler();

  @Test
  public void keepsEventsInOrder() {
    Event warning = Event.warn(Location.fromFileLine("Makefile", 3), "overriding recipe");
    Event error = Event.error("missing separator");

    handler.handle(warning);
    handler.handle(error);

    assertThat(handler.getEvents()).containsExactly(warning, error).inOrder();
    assertThat(handler.getEvents(EventKind.ERROR)).containsExactly(error);
    assertThat(handler.hasErrors()).isTrue();
  }

  @Test
  public void warningsAreNotErrors() {
    handler.handle(Event.warn(null, "careful"));

    assertThat(handler.hasErrors()).isFalse();
    assertThat(handler.isEmpty()).isFalse();
  }

  @Test
  public void clear() {
    handler.handle(Event.info("Nothing to be done"));

    handler.clear();

    assertThat(handler.isEmpty()).isTrue();
  }
}
