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

import build.solution.syntax.Location;
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.FormatMethod;
import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * An event is a diagnostic reported while reading a solution: a warning or an informational note.
 */
@Immutable
public final class Event {

  private final EventKind kind;
  @Nullable private final Location location;
  private final String message;

  private Event(EventKind kind, @Nullable Location location, String message) {
    this.kind = Preconditions.checkNotNull(kind);
    this.location = location;
    this.message = Preconditions.checkNotNull(message);
  }

  @FormatMethod
  public static Event warn(@Nullable Location location, String format, Object... args) {
    return new Event(EventKind.WARNING, location, String.format(format, args));
  }

  @FormatMethod
  public static Event info(@Nullable Location location, String format, Object... args) {
    return new Event(EventKind.INFO, location, String.format(format, args));
  }

  public EventKind getKind() {
    return kind;
  }

  /** Returns the location this event refers to, or null if it is not tied to a line. */
  @Nullable
  public Location getLocation() {
    return location;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    return kind + " " + (location != null ? location + ": " : "") + message;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Event that)) {
      return false;
    }
    return kind == that.kind
        && Objects.equals(location, that.location)
        && message.equals(that.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, location, message);
  }
}
