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

import build.solution.events.Event;
import build.solution.syntax.Location;
import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * The model of a solution: its projects and folders in declaration order, the solution
 * configurations, and the global sections that are not interpreted.
 *
 * <p>A SolutionModel is immutable. It is built once, from one descriptor, by {@link
 * ProjectModelBuilder} or by a structured-format serializer, and the {@link Builder} checks the
 * structural invariants: identifiers are unique (compared case-insensitively), every parent
 * identifier names a folder of the same model, and the parent chains are free of cycles.
 */
public final class SolutionModel {

  public static final String DEFAULT_CONFIGURATION = "Debug";
  public static final String MIXED_PLATFORMS = "Mixed Platforms";
  public static final String ANY_CPU = "Any CPU";

  /** The global section that holds solution-level properties such as {@code HideSolutionNode}. */
  public static final String SOLUTION_PROPERTIES = "SolutionProperties";

  // Characters a unique project name may not contain.
  private static final CharMatcher UNIQUE_NAME_INVALID = CharMatcher.anyOf("%$@;.()'");
  private static final CharMatcher BRACES = CharMatcher.anyOf("{}");

  // Global sections whose content lives in the entries and configurations, never opaquely.
  private static final ImmutableSet<String> INTERPRETED_SECTIONS =
      ImmutableSet.of(
          ConfigurationMapper.SOLUTION_CONFIGURATION_PLATFORMS,
          ConfigurationMapper.PROJECT_CONFIGURATION_PLATFORMS,
          ProjectModelBuilder.NESTED_PROJECTS);

  private final String file;
  private final String formatVersion;
  @Nullable private final String productDescription;
  @Nullable private final String visualStudioVersion;
  @Nullable private final String minimumVisualStudioVersion;
  private final ImmutableList<ProjectEntry> projects;
  private final ImmutableList<SolutionConfiguration> solutionConfigurations;
  private final ImmutableList<OpaqueSection> globalSections;
  private final ImmutableList<Event> warnings;

  // Keyed by the upper-cased identifier.
  private final ImmutableMap<String, ProjectEntry> projectsById;
  private final ImmutableMap<String, String> uniqueNamesById;
  // Keyed by the upper-cased unique name.
  private final ImmutableMap<String, ProjectEntry> projectsByUniqueName;

  private SolutionModel(
      Builder builder,
      ImmutableMap<String, ProjectEntry> projectsById,
      ImmutableMap<String, String> uniqueNamesById) {
    this.file = builder.file;
    this.formatVersion = builder.formatVersion;
    this.productDescription = builder.productDescription;
    this.visualStudioVersion = builder.visualStudioVersion;
    this.minimumVisualStudioVersion = builder.minimumVisualStudioVersion;
    this.projects = builder.projects.build();
    this.solutionConfigurations = builder.solutionConfigurations.build();
    this.globalSections = builder.globalSections.build();
    this.warnings = builder.warnings.build();
    this.projectsById = projectsById;
    this.uniqueNamesById = uniqueNamesById;

    Map<String, ProjectEntry> byUniqueName = new HashMap<>();
    for (ProjectEntry project : projects) {
      byUniqueName.putIfAbsent(key(uniqueNamesById.get(key(project.id()))), project);
    }
    this.projectsByUniqueName = ImmutableMap.copyOf(byUniqueName);
  }

  /** The path of the descriptor this model was read from, as given to the reader. */
  public String getFile() {
    return file;
  }

  /** The format version from the header, e.g. {@code 12.00}. */
  public String getFormatVersion() {
    return formatVersion;
  }

  /** The product named in the first comment, e.g. {@code Visual Studio Version 17}, or null. */
  @Nullable
  public String getProductDescription() {
    return productDescription;
  }

  @Nullable
  public String getVisualStudioVersion() {
    return visualStudioVersion;
  }

  @Nullable
  public String getMinimumVisualStudioVersion() {
    return minimumVisualStudioVersion;
  }

  /** All entries, projects and folders, in declaration order. */
  public ImmutableList<ProjectEntry> getProjects() {
    return projects;
  }

  public ImmutableList<SolutionConfiguration> getSolutionConfigurations() {
    return solutionConfigurations;
  }

  /**
   * The global sections other than the configuration tables and the nesting table, in declaration
   * order.
   */
  public ImmutableList<OpaqueSection> getGlobalSections() {
    return globalSections;
  }

  /** The recoverable problems found while reading the descriptor. */
  public ImmutableList<Event> getWarnings() {
    return warnings;
  }

  /** Returns the entry with the given identifier, compared case-insensitively, or null. */
  @Nullable
  public ProjectEntry getProject(String id) {
    return projectsById.get(key(id));
  }

  /** Returns the relative path of the entry with the given identifier, or null. */
  @Nullable
  public String getProjectRelativePath(String id) {
    ProjectEntry project = getProject(id);
    return project == null ? null : project.relativePath();
  }

  /**
   * Returns the unique name of {@code project}: its name with the characters {@code %$@;.()'}
   * replaced by underscores, prefixed with the names of its enclosing folders and a backslash
   * each.
   *
   * <p>When two entries end up with the same name, the one whose name was changed by the
   * replacement gets {@code _} and its identifier without braces appended. A web project addressed
   * by a URL with a port other than the default one gets {@code :} and the port appended, if
   * another entry has the same name.
   */
  public String getUniqueName(ProjectEntry project) {
    String name = uniqueNamesById.get(key(project.id()));
    Preconditions.checkArgument(name != null, "%s is not part of this solution", project);
    return name;
  }

  /** Returns the entry with the given unique name, compared case-insensitively, or null. */
  @Nullable
  public ProjectEntry getProjectByUniqueName(String uniqueName) {
    return projectsByUniqueName.get(key(uniqueName));
  }

  /**
   * Returns the display path of {@code project}. For a project that is its relative path. For a
   * folder it is a virtual path built from the folder names, e.g. {@code /Libraries/Core/}.
   */
  public String getDisplayPath(ProjectEntry project) {
    if (!project.isFolder()) {
      return project.relativePath();
    }
    List<String> names = new ArrayList<>();
    for (ProjectEntry folder = project; folder != null; folder = parentOf(folder)) {
      names.add(0, folder.name());
    }
    return "/" + String.join("/", names) + "/";
  }

  /** Returns the entries whose parent is the entry with the given identifier. */
  public ImmutableList<ProjectEntry> getChildren(String parentId) {
    ImmutableList.Builder<ProjectEntry> children = ImmutableList.builder();
    for (ProjectEntry project : projects) {
      if (project.parentId() != null && Ascii.equalsIgnoreCase(project.parentId(), parentId)) {
        children.add(project);
      }
    }
    return children.build();
  }

  /** Whether {@code project} is built: it is not a folder, a shared or a deployment project. */
  public boolean isBuildable(ProjectEntry project) {
    return project.type().isBuildable();
  }

  public boolean containsWebProjects() {
    for (ProjectEntry project : projects) {
      if (project.type() == ProjectType.WEB_PROJECT) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the configuration {@code project} builds in for the given solution configuration, such
   * as {@code Debug|Any CPU}, or null if the project is not part of that configuration.
   */
  @Nullable
  public ProjectConfiguration getProjectConfiguration(
      ProjectEntry project, String solutionConfigurationName) {
    for (Map.Entry<String, ProjectConfiguration> entry :
        project.projectConfigurations().entrySet()) {
      if (Ascii.equalsIgnoreCase(entry.getKey(), solutionConfigurationName)) {
        return entry.getValue();
      }
    }
    return null;
  }

  /** Returns {@code Debug} if declared, else the first configuration name, else null. */
  @Nullable
  public String getDefaultConfigurationName() {
    for (SolutionConfiguration configuration : solutionConfigurations) {
      if (Ascii.equalsIgnoreCase(configuration.configurationName(), DEFAULT_CONFIGURATION)) {
        return configuration.configurationName();
      }
    }
    return solutionConfigurations.isEmpty()
        ? null
        : solutionConfigurations.get(0).configurationName();
  }

  /**
   * Returns {@code Mixed Platforms} if declared, else {@code Any CPU} if declared, else the first
   * platform name, else null.
   */
  @Nullable
  public String getDefaultPlatformName() {
    for (String preferred : ImmutableList.of(MIXED_PLATFORMS, ANY_CPU)) {
      for (SolutionConfiguration configuration : solutionConfigurations) {
        if (Ascii.equalsIgnoreCase(configuration.platformName(), preferred)) {
          return configuration.platformName();
        }
      }
    }
    return solutionConfigurations.isEmpty() ? null : solutionConfigurations.get(0).platformName();
  }

  /** Returns the first global section with the given name, or null. */
  @Nullable
  public OpaqueSection getGlobalSection(String name) {
    for (OpaqueSection section : globalSections) {
      if (section.name().equals(name)) {
        return section;
      }
    }
    return null;
  }

  /** Returns a key of the {@code SolutionProperties} section, e.g. {@code HideSolutionNode}. */
  @Nullable
  public String getGlobalProperty(String key) {
    OpaqueSection properties = getGlobalSection(SOLUTION_PROPERTIES);
    return properties == null ? null : properties.get(key);
  }

  @Override
  public String toString() {
    return "SolutionModel(" + file + ", " + projects.size() + " projects)";
  }

  @Nullable
  private ProjectEntry parentOf(ProjectEntry project) {
    return project.parentId() == null ? null : projectsById.get(key(project.parentId()));
  }

  // The names of the enclosing folders and of the entry, joined by backslashes.
  private static String qualifiedName(
      ProjectEntry project, Map<String, ProjectEntry> byId, boolean replaceInvalid) {
    String name =
        replaceInvalid ? UNIQUE_NAME_INVALID.replaceFrom(project.name(), '_') : project.name();
    ProjectEntry parent = project.parentId() == null ? null : byId.get(key(project.parentId()));
    return parent == null ? name : qualifiedName(parent, byId, replaceInvalid) + "\\" + name;
  }

  // The port of a URL when it is not the default one of its scheme, else -1.
  private static int nonDefaultPort(String path) {
    URI uri;
    try {
      uri = new URI(path);
    } catch (URISyntaxException e) {
      // Not a URL.
      return -1;
    }
    if (!uri.isAbsolute() || uri.getPort() == -1) {
      return -1;
    }
    String scheme = Ascii.toLowerCase(uri.getScheme());
    int defaultPort = scheme.equals("http") ? 80 : scheme.equals("https") ? 443 : -1;
    return uri.getPort() == defaultPort ? -1 : uri.getPort();
  }

  private static boolean hasNamesake(ProjectEntry project, List<ProjectEntry> entries) {
    for (ProjectEntry other : entries) {
      if (other != project && Ascii.equalsIgnoreCase(other.name(), project.name())) {
        return true;
      }
    }
    return false;
  }

  /** Assigns every entry its unique name, keyed by the upper-cased identifier. */
  private static ImmutableMap<String, String> assignUniqueNames(
      List<ProjectEntry> entries,
      Map<String, ProjectEntry> byId,
      Map<ProjectEntry, Location> locations)
      throws SolutionModelException {
    Map<String, ProjectEntry> byUniqueName = new HashMap<>();
    Map<String, String> uniqueNames = new HashMap<>();
    Set<String> originalNames = new HashSet<>();
    for (ProjectEntry project : entries) {
      String uniqueName = qualifiedName(project, byId, true);
      String originalName = qualifiedName(project, byId, false);
      if (project.type() == ProjectType.WEB_PROJECT) {
        int port = nonDefaultPort(project.relativePath());
        if (port != -1 && hasNamesake(project, entries)) {
          uniqueName = uniqueName + ":" + port;
          originalName = originalName + ":" + port;
        }
      }

      ProjectEntry previous = byUniqueName.get(key(uniqueName));
      if (previous != null) {
        if (!uniqueName.equals(project.name())) {
          // The replacement changed this entry's name.
          uniqueName = uniqueName + "_" + BRACES.trimFrom(project.id());
        } else if (!uniqueName.equals(previous.name())) {
          // The replacement changed the earlier entry's name.
          String renamed = uniqueName + "_" + BRACES.trimFrom(previous.id());
          byUniqueName.remove(key(uniqueName));
          byUniqueName.put(key(renamed), previous);
          uniqueNames.put(key(previous.id()), renamed);
        }
      }

      boolean taken = byUniqueName.containsKey(key(uniqueName));
      if (taken || !originalNames.add(key(originalName))) {
        throw SolutionModelException.of(
            locations.get(project),
            "project name '%s' is not unique in this solution",
            taken ? uniqueName : project.name());
      }
      byUniqueName.put(key(uniqueName), project);
      uniqueNames.put(key(project.id()), uniqueName);
    }
    return ImmutableMap.copyOf(uniqueNames);
  }

  private static String key(String id) {
    return Ascii.toUpperCase(id);
  }

  public static Builder builder(String file) {
    return new Builder(file);
  }

  /** Builder for {@link SolutionModel}. Not thread-safe. */
  public static final class Builder {
    private final String file;
    private String formatVersion = "12.00";
    @Nullable private String productDescription;
    @Nullable private String visualStudioVersion;
    @Nullable private String minimumVisualStudioVersion;
    private final ImmutableList.Builder<ProjectEntry> projects = ImmutableList.builder();
    private final ImmutableList.Builder<SolutionConfiguration> solutionConfigurations =
        ImmutableList.builder();
    private final ImmutableList.Builder<OpaqueSection> globalSections = ImmutableList.builder();
    private final ImmutableList.Builder<Event> warnings = ImmutableList.builder();

    // Where each entry was declared, for error messages; absent for entries not read from text.
    private final Map<ProjectEntry, Location> locations = new HashMap<>();

    private Builder(String file) {
      this.file = Preconditions.checkNotNull(file);
    }

    @CanIgnoreReturnValue
    public Builder setFormatVersion(String formatVersion) {
      this.formatVersion = Preconditions.checkNotNull(formatVersion);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setProductDescription(@Nullable String productDescription) {
      this.productDescription = productDescription;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setVisualStudioVersion(@Nullable String visualStudioVersion) {
      this.visualStudioVersion = visualStudioVersion;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setMinimumVisualStudioVersion(@Nullable String minimumVisualStudioVersion) {
      this.minimumVisualStudioVersion = minimumVisualStudioVersion;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addProject(ProjectEntry project) {
      projects.add(project);
      return this;
    }

    /** Adds an entry read from text at {@code location}. */
    @CanIgnoreReturnValue
    public Builder addProject(ProjectEntry project, Location location) {
      locations.put(project, location);
      return addProject(project);
    }

    @CanIgnoreReturnValue
    public Builder addSolutionConfiguration(SolutionConfiguration configuration) {
      solutionConfigurations.add(configuration);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addGlobalSection(OpaqueSection section) {
      globalSections.add(section);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addWarnings(Iterable<Event> events) {
      warnings.addAll(events);
      return this;
    }

    /**
     * Builds the model.
     *
     * @throws SolutionModelException if an identifier or a name is declared twice, a parent
     *     identifier does not name a folder of this model, the parent chains contain a cycle, or a
     *     global section carries a name that is interpreted
     */
    public SolutionModel build() throws SolutionModelException {
      for (OpaqueSection section : globalSections.build()) {
        if (INTERPRETED_SECTIONS.contains(section.name())) {
          throw SolutionModelException.of(
              null, "global section %s cannot be kept uninterpreted", section.name());
        }
      }

      ImmutableList<ProjectEntry> entries = projects.build();
      Map<String, ProjectEntry> byId = new HashMap<>();
      for (ProjectEntry project : entries) {
        ProjectEntry previous = byId.putIfAbsent(key(project.id()), project);
        if (previous != null) {
          throw SolutionModelException.of(
              locations.get(project),
              "project identifier %s of '%s' is already used by '%s'",
              project.id(),
              project.name(),
              previous.name());
        }
      }

      for (ProjectEntry project : entries) {
        if (project.parentId() == null) {
          continue;
        }
        ProjectEntry parent = byId.get(key(project.parentId()));
        if (parent == null) {
          throw SolutionModelException.of(
              locations.get(project),
              "parent %s of '%s' is not declared in this solution",
              project.parentId(),
              project.name());
        }
        if (!parent.isFolder()) {
          throw SolutionModelException.of(
              locations.get(project),
              "parent '%s' of '%s' is not a solution folder",
              parent.name(),
              project.name());
        }
      }

      for (ProjectEntry project : entries) {
        Set<String> seen = new HashSet<>();
        for (ProjectEntry current = project;
            current.parentId() != null;
            current = byId.get(key(current.parentId()))) {
          if (!seen.add(key(current.id()))) {
            throw SolutionModelException.of(
                locations.get(project),
                "the parent chain of '%s' contains a cycle",
                project.name());
          }
        }
      }

      return new SolutionModel(
          this, ImmutableMap.copyOf(byId), assignUniqueNames(entries, byId, locations));
    }
  }
}
