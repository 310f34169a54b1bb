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
 * The configuration a project builds in when the solution builds in a given solution
 * configuration.
 *
 * @param configurationName the project's own configuration, e.g. {@code Release}
 * @param platformName the project's own platform; empty when the mapping names none
 * @param buildEnabled whether the project is built at all in that solution configuration
 */
public record ProjectConfiguration(
    String configurationName, String platformName, boolean buildEnabled) {

  /** Returns {@code Configuration|Platform}, or just the configuration if there is no platform. */
  public String fullName() {
    return platformName.isEmpty() ? configurationName : configurationName + "|" + platformName;
  }
}
