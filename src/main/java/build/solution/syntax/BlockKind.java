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

/** The kinds of block of the legacy grammar, with their opening and closing markers. */
public enum BlockKind {
  PROJECT("Project", "EndProject"),
  PROJECT_SECTION("ProjectSection", "EndProjectSection"),
  GLOBAL("Global", "EndGlobal"),
  GLOBAL_SECTION("GlobalSection", "EndGlobalSection");

  private final String openMarker;
  private final String closeMarker;

  BlockKind(String openMarker, String closeMarker) {
    this.openMarker = openMarker;
    this.closeMarker = closeMarker;
  }

  /** Returns the keyword that opens a block of this kind, e.g. {@code ProjectSection}. */
  public String openMarker() {
    return openMarker;
  }

  /** Returns the line that closes a block of this kind, e.g. {@code EndProjectSection}. */
  public String closeMarker() {
    return closeMarker;
  }
}
