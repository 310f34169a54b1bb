// Copyright 2025 The Bazel Authors. All rights reserved.
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

package build.solution.events;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/** Stores error and warning events for later retrieval. Not thread-safe. */
public final class StoredEventHandler implements EventHandler {

  private final List<Event> events = new ArrayList<>();

  @Override
  public void handle(Event event) {
    events.add(event);
  }

  /** Returns the stored events, in the order they were reported. */
  public ImmutableList<Event> getEvents() {
    return ImmutableList.copyOf(events);
  }

  /** Returns the stored events of the given kind. */
  public ImmutableList<Event> getEvents(EventKind kind) {
    ImmutableList.Builder<Event> result = ImmutableList.builder();
    for (Event event : events) {
      if (event.getKind() == kind) {
        result.add(event);
      }
    }
    return result.build();
  }

  public boolean isEmpty() {
    return events.isEmpty();
  }

  /** Replays all stored events on {@code handler}. */
  public void replayOn(EventHandler handler) {
    for (Event event : events) {
      handler.handle(event);
    }
  }

  public void clear() {
    events.clear();
  }
}
