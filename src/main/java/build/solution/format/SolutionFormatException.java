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

package build.solution.format;

import java.nio.file.Path;
import javax.annotation.Nullable;

/**
 * Thrown when a solution file cannot be read or written by a serializer: an I/O failure, a
 * malformed structured document, or a file whose format cannot be determined. Grammar errors of
 * the legacy format are not wrapped in this exception.
 */
public final class SolutionFormatException extends Exception {

  @Nullable private final Path path;

  public SolutionFormatException(@Nullable Path path, String message) {
    super(path == null ? message : path + ": " + message);
    this.path = path;
  }

  public SolutionFormatException(@Nullable Path path, String message, Throwable cause) {
    super(path == null ? message : path + ": " + message, cause);
    this.path = path;
  }

  /** Returns the file being read or written, or null. */
  @Nullable
  public Path getPath() {
    return path;
  }
}
