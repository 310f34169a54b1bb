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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import javax.annotation.Nullable;

/**
 * One entry of a solution: a buildable project or a solution folder.
 *
 * <p>Entries refer to each other by identifier only (parent, dependencies, references). An entry
 * is a plain value and knows nothing of the model it belongs to; use {@link SolutionModel} to
 * navigate.
 */
@AutoValue
public abstract class ProjectEntry {

  /**
   * The identifier as declared, braces included, e.g. {@code
   * {6185CC21-BE89-448A-B3C0-D1C27112E595}}.
   */
  public abstract String id();

  /** The display name. */
  public abstract String name();

  /**
   * The path of the project file relative to the solution, as declared. For a folder this is
   * usually its name; it has no file system counterpart.
   */
  public abstract String relativePath();

  /** The type token from the block header, as declared. */
  public abstract String typeToken();

  public abstract ProjectType type();

  /** The identifier of the enclosing folder, or null for a top-level entry. */
  @Nullable
  public abstract String parentId();

  /** Identifiers of projects that must be built first, in declaration order, duplicates kept. */
  public abstract ImmutableList<String> dependencies();

  /** The decoded {@code ProjectReferences} of a web project, display names included. */
  public abstract ImmutableList<ProjectReference> projectReferenceEntries();

  /**
   * Per build configuration name, the web compiler parameters of a web project, in the order the
   * configurations first appear. Empty for other entries.
   */
  public abstract ImmutableMap<String, WebCompilerParameters> webConfigurations();

  /**
   * Per solution configuration full name ({@code Debug|Any CPU}), the configuration this project
   * builds in. A solution configuration without a key here is not built for this project.
   */
  public abstract ImmutableMap<String, ProjectConfiguration> projectConfigurations();

  /** The target framework of a web project, unescaped, or null if none is declared. */
  @Nullable
  public abstract String targetFrameworkMoniker();

  /**
   * Lines of the {@code WebsiteProperties} section that are neither references, the target
   * framework nor web compiler parameters, values as written.
   */
  public abstract ImmutableList<OpaqueSection.Entry> websiteProperties();

  /** Project sections of other kinds, in declaration order. */
  public abstract ImmutableList<OpaqueSection> sections();

  /** Identifiers of the referenced projects, in declaration order. */
  public ImmutableList<String> projectReferences() {
    ImmutableList.Builder<String> ids = ImmutableList.builder();
    for (ProjectReference reference : projectReferenceEntries()) {
      ids.add(reference.id());
    }
    return ids.build();
  }

  public boolean isFolder() {
    return type() == ProjectType.SOLUTION_FOLDER;
  }

  /** Returns the web compiler parameters for {@code configurationName}, or null. */
  @Nullable
  public WebCompilerParameters getWebConfiguration(String configurationName) {
    return webConfigurations().get(configurationName);
  }

  @Override
  public final String toString() {
    return type() + " " + name() + " " + id();
  }

  public static Builder builder() {
    return new AutoValue_ProjectEntry.Builder()
        .relativePath("")
        .typeToken("")
        .type(ProjectType.UNRECOGNIZED)
        .dependencies(ImmutableList.of())
        .projectReferenceEntries(ImmutableList.of())
        .webConfigurations(ImmutableMap.of())
        .projectConfigurations(ImmutableMap.of())
        .websiteProperties(ImmutableList.of())
        .sections(ImmutableList.of());
  }

  public abstract Builder toBuilder();

  /** Builder for {@link ProjectEntry}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder id(String id);

    public abstract Builder name(String name);

    public abstract Builder relativePath(String relativePath);

    public abstract Builder typeToken(String typeToken);

    public abstract Builder type(ProjectType type);

    public abstract Builder parentId(@Nullable String parentId);

    public abstract Builder dependencies(ImmutableList<String> dependencies);

    public abstract Builder projectReferenceEntries(ImmutableList<ProjectReference> references);

    public abstract Builder webConfigurations(
        ImmutableMap<String, WebCompilerParameters> webConfigurations);

    public abstract Builder projectConfigurations(
        ImmutableMap<String, ProjectConfiguration> projectConfigurations);

    public abstract Builder targetFrameworkMoniker(@Nullable String targetFrameworkMoniker);

    public abstract Builder websiteProperties(ImmutableList<OpaqueSection.Entry> properties);

    public abstract Builder sections(ImmutableList<OpaqueSection> sections);

    public abstract ProjectEntry build();
  }
}
