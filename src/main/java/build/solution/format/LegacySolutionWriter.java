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

import build.solution.model.ConfigurationMapper;
import build.solution.model.OpaqueSection;
import build.solution.model.ProjectConfiguration;
import build.solution.model.ProjectEntry;
import build.solution.model.ProjectModelBuilder;
import build.solution.model.ReferenceListDecoder;
import build.solution.model.SolutionConfiguration;
import build.solution.model.SolutionModel;
import build.solution.model.WebCompilerParameters;
import build.solution.model.WebsitePropertiesExtractor;
import build.solution.syntax.BlockKind;
import build.solution.syntax.BlockParser;
import build.solution.syntax.QuotedValues;
import build.solution.syntax.SectionOrder;
import build.solution.syntax.SolutionOptions;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Writes a {@link SolutionModel} as legacy descriptor text.
 *
 * <p>The output uses CR LF line endings and tab indentation, like the files the IDE writes.
 * Interpreted sections are regenerated from the model, so the order of sections within a block
 * may differ from the text the model was read from; reading the output back yields an equal model.
 */
public final class LegacySolutionWriter {

  private static final String NEWLINE = "\r\n";

  private final SolutionOptions options;
  private final StringBuilder out = new StringBuilder();

  private LegacySolutionWriter(SolutionOptions options) {
    this.options = options;
  }

  /** Returns the descriptor text for {@code model}. */
  public static String write(SolutionModel model, SolutionOptions options) {
    LegacySolutionWriter writer = new LegacySolutionWriter(options);
    writer.writeSolution(model);
    return writer.out.toString();
  }

  private void writeSolution(SolutionModel model) {
    // The IDE starts the file with an empty line.
    line(0, "");
    line(0, BlockParser.HEADER_PREFIX + model.getFormatVersion());
    if (model.getProductDescription() != null) {
      line(0, options.commentChar() + " " + model.getProductDescription());
    }
    if (model.getVisualStudioVersion() != null) {
      keyValue(0, BlockParser.VISUAL_STUDIO_VERSION, model.getVisualStudioVersion());
    }
    if (model.getMinimumVisualStudioVersion() != null) {
      keyValue(0, BlockParser.MINIMUM_VISUAL_STUDIO_VERSION, model.getMinimumVisualStudioVersion());
    }

    for (ProjectEntry project : model.getProjects()) {
      writeProject(project);
    }

    line(0, BlockKind.GLOBAL.openMarker());
    writeSolutionConfigurations(model);
    writeProjectConfigurations(model);
    for (OpaqueSection section : model.getGlobalSections()) {
      writeOpaqueSection(BlockKind.GLOBAL_SECTION, section);
    }
    writeNesting(model);
    line(0, BlockKind.GLOBAL.closeMarker());
  }

  private void writeProject(ProjectEntry project) {
    char quote = options.quoteChar();
    line(
        0,
        BlockKind.PROJECT.openMarker()
            + "("
            + QuotedValues.quote(project.typeToken(), quote)
            + ") "
            + options.keyValueSeparator()
            + " "
            + QuotedValues.quote(project.name(), quote)
            + ", "
            + QuotedValues.quote(project.relativePath(), quote)
            + ", "
            + QuotedValues.quote(project.id(), quote));
    writeWebsiteProperties(project);
    if (!project.dependencies().isEmpty()) {
      openSection(
          BlockKind.PROJECT_SECTION,
          ReferenceListDecoder.PROJECT_DEPENDENCIES,
          SectionOrder.POST_PROJECT);
      for (String dependency : project.dependencies()) {
        keyValue(2, dependency, dependency);
      }
      closeSection(BlockKind.PROJECT_SECTION);
    }
    for (OpaqueSection section : project.sections()) {
      writeOpaqueSection(BlockKind.PROJECT_SECTION, section);
    }
    line(0, BlockKind.PROJECT.closeMarker());
  }

  private void writeWebsiteProperties(ProjectEntry project) {
    if (project.projectReferenceEntries().isEmpty()
        && project.targetFrameworkMoniker() == null
        && project.webConfigurations().isEmpty()
        && project.websiteProperties().isEmpty()) {
      return;
    }
    char quote = options.quoteChar();
    openSection(
        BlockKind.PROJECT_SECTION,
        WebsitePropertiesExtractor.WEBSITE_PROPERTIES,
        SectionOrder.PRE_PROJECT);
    if (project.targetFrameworkMoniker() != null) {
      keyValue(
          2,
          WebsitePropertiesExtractor.TARGET_FRAMEWORK_MONIKER,
          QuotedValues.quote(escapePercent(project.targetFrameworkMoniker()), quote));
    }
    if (!project.projectReferenceEntries().isEmpty()) {
      keyValue(
          2,
          ReferenceListDecoder.PROJECT_REFERENCES,
          QuotedValues.quote(
              ReferenceListDecoder.encodeProjectReferences(
                  project.projectReferenceEntries(), options),
              quote));
    }
    for (Map.Entry<String, WebCompilerParameters> entry : project.webConfigurations().entrySet()) {
      for (WebCompilerParameters.Field field : WebCompilerParameters.Field.values()) {
        keyValue(
            2,
            entry.getKey()
                + "."
                + WebCompilerParameters.TOOL_NAMESPACE
                + "."
                + field.declaredName(),
            QuotedValues.quote(entry.getValue().get(field), quote));
      }
    }
    for (OpaqueSection.Entry property : project.websiteProperties()) {
      keyValue(2, property.key(), property.value());
    }
    closeSection(BlockKind.PROJECT_SECTION);
  }

  private void writeSolutionConfigurations(SolutionModel model) {
    if (model.getSolutionConfigurations().isEmpty()) {
      return;
    }
    openSection(
        BlockKind.GLOBAL_SECTION,
        ConfigurationMapper.SOLUTION_CONFIGURATION_PLATFORMS,
        SectionOrder.PRE_SOLUTION);
    for (SolutionConfiguration configuration : model.getSolutionConfigurations()) {
      String name = configurationName(configuration);
      keyValue(2, name, name);
    }
    closeSection(BlockKind.GLOBAL_SECTION);
  }

  private void writeProjectConfigurations(SolutionModel model) {
    boolean any = false;
    for (ProjectEntry project : model.getProjects()) {
      any |= !project.projectConfigurations().isEmpty();
    }
    if (!any) {
      return;
    }
    openSection(
        BlockKind.GLOBAL_SECTION,
        ConfigurationMapper.PROJECT_CONFIGURATION_PLATFORMS,
        SectionOrder.POST_SOLUTION);
    for (ProjectEntry project : model.getProjects()) {
      for (SolutionConfiguration configuration : model.getSolutionConfigurations()) {
        ProjectConfiguration mapped =
            project.projectConfigurations().get(configuration.fullName());
        if (mapped == null) {
          continue;
        }
        String prefix = project.id() + "." + configurationName(configuration) + ".";
        String value =
            mapped.platformName().isEmpty()
                ? mapped.configurationName()
                : mapped.configurationName() + options.pairSeparator() + mapped.platformName();
        keyValue(2, prefix + ConfigurationMapper.ACTIVE_CFG, value);
        if (mapped.buildEnabled()) {
          keyValue(2, prefix + ConfigurationMapper.BUILD_ENABLED, value);
        }
      }
    }
    closeSection(BlockKind.GLOBAL_SECTION);
  }

  private void writeNesting(SolutionModel model) {
    boolean any = false;
    for (ProjectEntry project : model.getProjects()) {
      any |= project.parentId() != null;
    }
    if (!any) {
      return;
    }
    openSection(
        BlockKind.GLOBAL_SECTION, ProjectModelBuilder.NESTED_PROJECTS, SectionOrder.PRE_SOLUTION);
    for (ProjectEntry project : model.getProjects()) {
      if (project.parentId() != null) {
        keyValue(2, project.id(), project.parentId());
      }
    }
    closeSection(BlockKind.GLOBAL_SECTION);
  }

  private void writeOpaqueSection(BlockKind kind, OpaqueSection section) {
    openSection(kind, section.name(), section.order());
    for (OpaqueSection.Entry entry : section.entries()) {
      keyValue(2, entry.key(), entry.value());
    }
    closeSection(kind);
  }

  private String configurationName(SolutionConfiguration configuration) {
    return configuration.configurationName()
        + options.pairSeparator()
        + configuration.platformName();
  }

  private void openSection(BlockKind kind, String name, SectionOrder order) {
    line(
        1,
        kind.openMarker()
            + "("
            + name
            + ") "
            + options.keyValueSeparator()
            + " "
            + order.token());
  }

  private void closeSection(BlockKind kind) {
    line(1, kind.closeMarker());
  }

  private void keyValue(int indent, String key, @Nullable String value) {
    if (value == null) {
      line(indent, key);
    } else {
      line(indent, key + " " + options.keyValueSeparator() + " " + value);
    }
  }

  private void line(int indent, String text) {
    for (int i = 0; i < indent; i++) {
      out.append('\t');
    }
    out.append(text).append(NEWLINE);
  }

  // The inverse of QuotedValues.unescapePercent for the characters older readers cannot take.
  private static String escapePercent(String value) {
    return value.replace("%", "%25").replace("=", "%3D");
  }
}
