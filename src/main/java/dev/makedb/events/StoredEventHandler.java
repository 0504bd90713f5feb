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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/** Keeps every event it receives, in arrival order. */
public class StoredEventHandler implements EventHandler {
  private final List<Event> events = new ArrayList<>();
  private boolean hasErrors;

  @Override
  public synchronized void handle(Event event) {
    hasErrors |= event.getKind() == EventKind.ERROR;
    events.add(event);
  }

  public synchronized ImmutableList<Event> getEvents() {
    return ImmutableList.copyOf(events);
  }

  public synchronized ImmutableList<Event> getEvents(EventKind kind) {
    return events.stream()
        .filter(e -> e.getKind() == kind)
        .collect(ImmutableList.toImmutableList());
  }

  public synchronized boolean hasErrors() {
    return hasErrors;
  }

  public synchronized boolean isEmpty() {
    return events.isEmpty();
  }

  public synchronized void clear() {
    events.clear();
    hasErrors = false;
  }
}
