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

import com.google.common.base.Preconditions;

/**
 * TeeEventHandler forwards events to two delegate EventHandlers: typically the per-parse
 * {@link StoredEventHandler} and the handler supplied by the caller.
 */
public class TeeEventHandler implements EventHandler {
  private final EventHandler primary;
  private final EventHandler secondary;

  public TeeEventHandler(EventHandler primary, EventHandler secondary) {
    this.primary = Preconditions.checkNotNull(primary);
    this.secondary = Preconditions.checkNotNull(secondary);
  }

  /** Returns {@code primary} alone when {@code secondary} is the no-op handler. */
  public static EventHandler of(EventHandler primary, EventHandler secondary) {
    return secondary == EventHandler.NOOP ? primary : new TeeEventHandler(primary, secondary);
  }

  @Override
  public void handle(Event event) {
    primary.handle(event);
    secondary.handle(event);
  }
}
