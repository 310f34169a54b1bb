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

package build.solution.model;

import build.solution.syntax.Location;
import com.google.errorprone.annotations.FormatMethod;
import javax.annotation.Nullable;

/**
 * Thrown when parsed blocks cannot be assembled into a consistent {@link SolutionModel}: a
 * duplicate project identifier, a parent that does not exist or is not a folder, or a cycle in the
 * parent chain.
 */
public final class SolutionModelException extends Exception {

  @Nullable private final Location location;

  public SolutionModelException(@Nullable Location location, String message) {
    super(location == null ? message : location + ": " + message);
    this.location = location;
  }

  @FormatMethod
  static SolutionModelException of(@Nullable Location location, String format, Object... args) {
    return new SolutionModelException(location, String.format(format, args));
  }

  /** Returns the location of the offending declaration, or null if it was not read from text. */
  @Nullable
  public Location getLocation() {
    return location;
  }
}
