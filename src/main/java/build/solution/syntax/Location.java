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

package build.solution.syntax;

import com.google.common.base.Preconditions;

/**
 * A Location denotes a position within a solution descriptor: a file name, a 1-based line and a
 * 1-based column. A line or column of zero means unknown.
 */
public record Location(String file, int line, int column) {

  /** The location used for problems that are not attributable to any particular line. */
  public static final Location BUILTIN = new Location("<builtin>", 0, 0);

  public Location {
    Preconditions.checkNotNull(file);
    Preconditions.checkArgument(line >= 0 && column >= 0, "negative line or column");
  }

  /** Returns the location of the start of the given line of {@code file}. */
  public static Location ofLine(String file, int line) {
    return new Location(file, line, 1);
  }

  /** Returns the location of the whole of {@code file}, without a line. */
  public static Location ofFile(String file) {
    return new Location(file, 0, 0);
  }

  /** Returns "file:line:column", omitting unknown parts. */
  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder(file);
    if (line != 0) {
      buf.append(':').append(line);
      if (column != 0) {
        buf.append(':').append(column);
      }
    }
    return buf.toString();
  }
}
