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

import build.solution.syntax.RawBlock;
import build.solution.syntax.SolutionOptions;
import build.solution.syntax.SyntaxError;
import com.google.common.base.Ascii;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Decodes the configuration tables of the global block.
 *
 * <p>{@code SolutionConfigurationPlatforms} declares the solution configurations, one per line
 * as {@code Debug|Any CPU = Debug|Any CPU}. {@code ProjectConfigurationPlatforms} maps each of
 * them, per project, to the project's own configuration:
 *
 * <pre>
 * {id}.Debug|Any CPU.ActiveCfg = Debug|x86
 * {id}.Debug|Any CPU.Build.0 = Debug|x86
 * </pre>
 *
 * A project with an {@code ActiveCfg} line but no {@code Build.0} line for a solution configuration
 * is mapped with building disabled. A project with neither is not part of that configuration.
 */
public final class ConfigurationMapper {

  public static final String SOLUTION_CONFIGURATION_PLATFORMS = "SolutionConfigurationPlatforms";
  public static final String PROJECT_CONFIGURATION_PLATFORMS = "ProjectConfigurationPlatforms";

  public static final String ACTIVE_CFG = "ActiveCfg";
  public static final String BUILD_ENABLED = "Build.0";

  // A line of the solution configuration table that carries no configuration.
  private static final String DESCRIPTION = "DESCRIPTION";

  private final SolutionOptions options;
  private final ImmutableList<SolutionConfiguration> solutionConfigurations;
  // Lines of the project table keyed by their upper-cased key; keys compare case-insensitively.
  private final ImmutableMap<String, RawBlock.Property> projectTable;

  private ConfigurationMapper(
      SolutionOptions options,
      ImmutableList<SolutionConfiguration> solutionConfigurations,
      ImmutableMap<String, RawBlock.Property> projectTable) {
    this.options = options;
    this.solutionConfigurations = solutionConfigurations;
    this.projectTable = projectTable;
  }

  /**
   * Reads both tables. Either section may be absent.
   *
   * @throws SyntaxError.Exception if a solution configuration line is malformed
   */
  public static ConfigurationMapper create(
      SolutionOptions options,
      @Nullable RawBlock solutionConfigurationSection,
      @Nullable RawBlock projectConfigurationSection)
      throws SyntaxError.Exception {
    return create(
        options,
        solutionConfigurationSection == null
            ? ImmutableList.of()
            : ImmutableList.of(solutionConfigurationSection),
        projectConfigurationSection);
  }

  /**
   * Reads the solution configurations of every given section, in order, and the project table of
   * {@code projectConfigurationSection}, which may be absent.
   *
   * @throws SyntaxError.Exception if a solution configuration line is malformed
   */
  public static ConfigurationMapper create(
      SolutionOptions options,
      List<RawBlock> solutionConfigurationSections,
      @Nullable RawBlock projectConfigurationSection)
      throws SyntaxError.Exception {
    ImmutableList.Builder<SolutionConfiguration> solutionConfigurations = ImmutableList.builder();
    for (RawBlock section : solutionConfigurationSections) {
      solutionConfigurations.addAll(parseSolutionConfigurations(section, options));
    }

    Map<String, RawBlock.Property> projectTable = new HashMap<>();
    if (projectConfigurationSection != null) {
      for (RawBlock.Property property : projectConfigurationSection.properties()) {
        projectTable.putIfAbsent(Ascii.toUpperCase(property.key()), property);
      }
    }
    return new ConfigurationMapper(
        options, solutionConfigurations.build(), ImmutableMap.copyOf(projectTable));
  }

  private static ImmutableList<SolutionConfiguration> parseSolutionConfigurations(
      RawBlock section, SolutionOptions options) throws SyntaxError.Exception {
    ImmutableList.Builder<SolutionConfiguration> result = ImmutableList.builder();
    for (RawBlock.Property property : section.properties()) {
      if (Ascii.equalsIgnoreCase(property.key(), DESCRIPTION)) {
        continue;
      }
      if (!property.hasValue() || !property.key().equals(property.value())) {
        throw new SyntaxError.Exception(
            SyntaxError.of(
                property.location(),
                property.key(),
                "invalid solution configuration '%s': expected 'Configuration%sPlatform ="
                    + " Configuration%sPlatform' with both sides equal",
                property.key(),
                options.pairSeparator(),
                options.pairSeparator()));
      }
      List<String> parts = Splitter.on(options.pairSeparator()).splitToList(property.key());
      if (parts.size() != 2) {
        throw new SyntaxError.Exception(
            SyntaxError.of(
                property.location(),
                property.key(),
                "invalid solution configuration '%s': expected exactly one '%s'",
                property.key(),
                options.pairSeparator()));
      }
      result.add(new SolutionConfiguration(parts.get(0), parts.get(1)));
    }
    return result.build();
  }

  /** The solution configurations, in declaration order. */
  public ImmutableList<SolutionConfiguration> getSolutionConfigurations() {
    return solutionConfigurations;
  }

  /**
   * Returns the configurations of the project with identifier {@code projectId}, keyed by the full
   * name of each solution configuration it is part of, in the order the solution configurations
   * are declared.
   *
   * @throws SyntaxError.Exception if a project configuration has more than one pair separator
   */
  public ImmutableMap<String, ProjectConfiguration> map(String projectId)
      throws SyntaxError.Exception {
    Map<String, ProjectConfiguration> result = new LinkedHashMap<>();
    for (SolutionConfiguration configuration : solutionConfigurations) {
      String prefix =
          projectId
              + "."
              + configuration.configurationName()
              + options.pairSeparator()
              + configuration.platformName()
              + ".";
      RawBlock.Property active = projectTable.get(Ascii.toUpperCase(prefix + ACTIVE_CFG));
      if (active == null || !active.hasValue()) {
        continue;
      }
      boolean buildEnabled = projectTable.containsKey(Ascii.toUpperCase(prefix + BUILD_ENABLED));
      result.putIfAbsent(
          configuration.fullName(), parseProjectConfiguration(active, buildEnabled));
    }
    return ImmutableMap.copyOf(result);
  }

  // "Debug|x86" or just "Debug": some project types have no platform.
  private ProjectConfiguration parseProjectConfiguration(
      RawBlock.Property property, boolean buildEnabled) throws SyntaxError.Exception {
    List<String> parts = Splitter.on(options.pairSeparator()).splitToList(property.value());
    if (parts.size() > 2) {
      throw new SyntaxError.Exception(
          SyntaxError.of(
              property.location(),
              property.value(),
              "invalid project configuration '%s': expected at most one '%s'",
              property.value(),
              options.pairSeparator()));
    }
    return new ProjectConfiguration(
        parts.get(0), parts.size() == 2 ? parts.get(1) : "", buildEnabled);
  }
}
