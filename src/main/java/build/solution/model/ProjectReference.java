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

/**
 * An entry of a web project's {@code ProjectReferences} list: the identifier of the referenced
 * project and the display name it was written with, usually the name of the assembly it produces.
 */
public record ProjectReference(String id, String displayName) {

  @Override
  public String toString() {
    return id + "|" + displayName;
  }
}
