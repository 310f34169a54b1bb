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
import build.solution.events.EventHandler;
import build.solution.syntax.BlockParser;
import build.solution.syntax.Location;
import build.solution.syntax.RawBlock;
import build.solution.syntax.SolutionOptions;
import build.solution.syntax.SyntaxError;
import build.solution.vfs.PathNormalizer;
import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * Assembles the blocks of a parsed descriptor into the entries of a {@link SolutionModel}.
 *
 * <p>Entries keep the order in which their project blocks were declared. Nesting, read from the
 * {@code NestedProjects} global sections, only sets parent identifiers; it never reorders. The
 * configuration tables and the nesting tables are interpreted, however often they appear; every
 * other global section is carried along as an {@link OpaqueSection}.
 */
public final class ProjectModelBuilder {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  public static final String NESTED_PROJECTS = "NestedProjects";

  /** Prefix of the name given to a project declared with an empty one. */
  public static final String EMPTY_PROJECT_NAME_PREFIX = "EmptyProjectName.";

  // Project files of this extension are from a C++ format that needs to be upgraded to be built.
  private static final String OLD_CPP_EXTENSION = ".vcproj";

  private final SolutionOptions options;
  private final EventHandler eventHandler;
  private final ReferenceListDecoder referenceDecoder;
  private final WebsitePropertiesExtractor websiteExtractor;
  @Nullable private final PathNormalizer pathNormalizer;

  public ProjectModelBuilder(SolutionOptions options, EventHandler eventHandler) {
    this.options = options;
    this.eventHandler = eventHandler;
    this.referenceDecoder = new ReferenceListDecoder(options, eventHandler);
    this.websiteExtractor = new WebsitePropertiesExtractor(options, referenceDecoder);
    this.pathNormalizer =
        options.normalizePathSeparators() ? new PathNormalizer(options.pathSeparator()) : null;
  }

  /**
   * Assembles the entries of {@code blocks} into a model builder. The caller adds the collected
   * warnings and calls {@link SolutionModel.Builder#build}, which checks identifiers and parents.
   *
   * @throws SyntaxError.Exception if a configuration or nesting line is malformed
   * @throws SolutionModelException if the nesting table names a project that is not declared
   */
  public SolutionModel.Builder assemble(BlockParser.Result blocks)
      throws SyntaxError.Exception, SolutionModelException {
    SolutionModel.Builder model =
        SolutionModel.builder(blocks.file())
            .setFormatVersion(blocks.formatVersion())
            .setProductDescription(blocks.productDescription())
            .setVisualStudioVersion(blocks.getMetadata(BlockParser.VISUAL_STUDIO_VERSION))
            .setMinimumVisualStudioVersion(
                blocks.getMetadata(BlockParser.MINIMUM_VISUAL_STUDIO_VERSION));

    List<RawBlock> solutionConfigurations = new ArrayList<>();
    RawBlock projectConfigurations = null;
    List<RawBlock> nestedProjects = new ArrayList<>();
    for (RawBlock section : blocks.globalSections()) {
      String name = section.name();
      if (name.equals(ConfigurationMapper.SOLUTION_CONFIGURATION_PLATFORMS)) {
        solutionConfigurations.add(section);
      } else if (name.equals(ConfigurationMapper.PROJECT_CONFIGURATION_PLATFORMS)) {
        // A later project table replaces an earlier one.
        projectConfigurations = section;
      } else if (name.equals(NESTED_PROJECTS)) {
        nestedProjects.add(section);
      } else {
        model.addGlobalSection(OpaqueSection.of(section));
      }
    }

    ConfigurationMapper mapper =
        ConfigurationMapper.create(options, solutionConfigurations, projectConfigurations);
    for (SolutionConfiguration configuration : mapper.getSolutionConfigurations()) {
      model.addSolutionConfiguration(configuration);
    }

    Map<String, String> parents = readNesting(nestedProjects);
    Set<String> declared = new HashSet<>();
    for (RawBlock block : blocks.projects()) {
      ProjectEntry entry = buildEntry(block, parents, mapper);
      declared.add(Ascii.toUpperCase(entry.id()));
      model.addProject(entry, block.location());
    }
    checkNestedProjectsDeclared(nestedProjects, declared);

    logger.atFine().log(
        "Assembled %d entries and %d solution configurations from %s",
        blocks.projects().size(), mapper.getSolutionConfigurations().size(), blocks.file());
    return model;
  }

  private ProjectEntry buildEntry(
      RawBlock block, Map<String, String> parents, ConfigurationMapper mapper)
      throws SyntaxError.Exception {
    ImmutableList<String> header = block.header();
    String typeToken = header.get(0);
    String name = header.get(1);
    String path = header.get(2);
    String id = header.get(3);

    ProjectType type = ProjectType.classify(typeToken);
    if (type == ProjectType.UNRECOGNIZED && options.warnOnUnknownProjectTypes()) {
      warn(block.location(), "project '%s' has an unknown project type %s", name, typeToken);
    }
    if (typeToken.equalsIgnoreCase(ProjectType.CPP_TYPE)
        && Ascii.toLowerCase(path).endsWith(OLD_CPP_EXTENSION)) {
      warn(
          block.location(),
          "project '%s' is in an old C++ project format and must be upgraded to be built",
          name);
    }
    if (name.isEmpty()) {
      name = EMPTY_PROJECT_NAME_PREFIX + UUID.randomUUID();
      warn(block.location(), "project %s has no name; using '%s'", id, name);
    }
    if (pathNormalizer != null && type != ProjectType.SOLUTION_FOLDER) {
      path = pathNormalizer.normalize(path);
    }

    ProjectEntry.Builder entry =
        ProjectEntry.builder()
            .id(id)
            .name(name)
            .relativePath(path)
            .typeToken(typeToken)
            .type(type)
            .parentId(parents.get(Ascii.toUpperCase(id)));

    ImmutableList.Builder<String> dependencies = ImmutableList.builder();
    ImmutableList.Builder<OpaqueSection> sections = ImmutableList.builder();
    ImmutableList.Builder<ProjectReference> references = ImmutableList.builder();
    ImmutableList.Builder<OpaqueSection.Entry> websiteProperties = ImmutableList.builder();
    Map<String, WebCompilerParameters> webConfigurations = new LinkedHashMap<>();
    String targetFrameworkMoniker = null;
    for (RawBlock section : block.children()) {
      if (section.name().equals(ReferenceListDecoder.PROJECT_DEPENDENCIES)) {
        dependencies.addAll(referenceDecoder.decodeDependencies(section));
      } else if (section.name().equals(WebsitePropertiesExtractor.WEBSITE_PROPERTIES)) {
        WebsitePropertiesExtractor.WebsiteProperties website = websiteExtractor.extract(section);
        references.addAll(website.projectReferences());
        webConfigurations.putAll(website.webConfigurations());
        websiteProperties.addAll(website.otherProperties());
        if (website.targetFrameworkMoniker() != null) {
          targetFrameworkMoniker = website.targetFrameworkMoniker();
        }
      } else {
        sections.add(OpaqueSection.of(section));
      }
    }

    return entry
        .dependencies(dependencies.build())
        .projectReferenceEntries(references.build())
        .webConfigurations(ImmutableMap.copyOf(webConfigurations))
        .targetFrameworkMoniker(targetFrameworkMoniker)
        .websiteProperties(websiteProperties.build())
        .sections(sections.build())
        .projectConfigurations(
            type == ProjectType.SOLUTION_FOLDER ? ImmutableMap.of() : mapper.map(id))
        .build();
  }

  /**
   * Reads the {@code {child} = {parent}} lines of every nesting section into a map keyed by the
   * upper-cased child id. A later line for the same child replaces an earlier one.
   */
  private static Map<String, String> readNesting(List<RawBlock> sections)
      throws SyntaxError.Exception {
    Map<String, String> parents = new HashMap<>();
    for (RawBlock section : sections) {
      for (RawBlock.Property property : section.properties()) {
        if (!property.hasValue() || property.value().isEmpty()) {
          throw new SyntaxError.Exception(
              SyntaxError.of(
                  property.location(),
                  property.key(),
                  "invalid nesting entry '%s': expected '{child} = {parent}'",
                  property.key()));
        }
        parents.put(Ascii.toUpperCase(property.key()), property.value());
      }
    }
    return parents;
  }

  private static void checkNestedProjectsDeclared(List<RawBlock> sections, Set<String> declared)
      throws SolutionModelException {
    for (RawBlock section : sections) {
      for (RawBlock.Property property : section.properties()) {
        if (!declared.contains(Ascii.toUpperCase(property.key()))) {
          throw SolutionModelException.of(
              property.location(),
              "nested project %s is not declared in this solution",
              property.key());
        }
      }
    }
  }

  @FormatMethod
  private void warn(Location location, String format, Object... args) {
    Event event = Event.warn(location, format, args);
    logger.atWarning().log("%s", event);
    eventHandler.handle(event);
  }
}
