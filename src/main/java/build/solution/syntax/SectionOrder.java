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

import javax.annotation.Nullable;

/** The ordering qualifier written after {@code =} on a section's opening line. */
public enum SectionOrder {
  PRE_PROJECT("preProject", BlockKind.PROJECT_SECTION),
  POST_PROJECT("postProject", BlockKind.PROJECT_SECTION),
  PRE_SOLUTION("preSolution", BlockKind.GLOBAL_SECTION),
  POST_SOLUTION("postSolution", BlockKind.GLOBAL_SECTION);

  private final String token;
  private final BlockKind sectionKind;

  SectionOrder(String token, BlockKind sectionKind) {
    this.token = token;
    this.sectionKind = sectionKind;
  }

  /** Returns the qualifier as written in the descriptor. */
  public String token() {
    return token;
  }

  /** Returns the kind of section this qualifier may be used with. */
  public BlockKind sectionKind() {
    return sectionKind;
  }

  /** Returns the qualifier with the given spelling, or null if there is none. */
  @Nullable
  public static SectionOrder fromToken(String token) {
    for (SectionOrder order : values()) {
      if (order.token.equals(token)) {
        return order;
      }
    }
    return null;
  }
}
