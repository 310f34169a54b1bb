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

import build.solution.syntax.QuotedValues;
import build.solution.syntax.RawBlock;
import build.solution.syntax.SolutionOptions;
import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Extracts the contents of a web project's {@code WebsiteProperties} section.
 *
 * <p>Keys of the form {@code <Configuration>.AspNetCompiler.<Field>} populate one {@link
 * WebCompilerParameters} per configuration name; field names are matched case-sensitively and
 * unknown ones do not populate anything. {@code ProjectReferences} and {@code
 * TargetFrameworkMoniker} are decoded. Every other line, unknown compiler fields included, is kept
 * as written.
 */
public final class WebsitePropertiesExtractor {

  public static final String WEBSITE_PROPERTIES = "WebsiteProperties";
  public static final String TARGET_FRAMEWORK_MONIKER = "TargetFrameworkMoniker";

  /** The decoded contents of a {@code WebsiteProperties} section. */
  public record WebsiteProperties(
      ImmutableList<ProjectReference> projectReferences,
      @Nullable String targetFrameworkMoniker,
      ImmutableMap<String, WebCompilerParameters> webConfigurations,
      ImmutableList<OpaqueSection.Entry> otherProperties) {}

  private final SolutionOptions options;
  private final ReferenceListDecoder referenceDecoder;

  public WebsitePropertiesExtractor(
      SolutionOptions options, ReferenceListDecoder referenceDecoder) {
    this.options = options;
    this.referenceDecoder = referenceDecoder;
  }

  public WebsiteProperties extract(RawBlock section) {
    ImmutableList.Builder<ProjectReference> references = ImmutableList.builder();
    String targetFrameworkMoniker = null;
    Map<String, WebCompilerParameters.Builder> configurations = new LinkedHashMap<>();
    ImmutableList.Builder<OpaqueSection.Entry> other = ImmutableList.builder();

    for (RawBlock.Property property : section.properties()) {
      String key = property.key();
      if (!property.hasValue()) {
        other.add(new OpaqueSection.Entry(key, null));
      } else if (Ascii.equalsIgnoreCase(key, ReferenceListDecoder.PROJECT_REFERENCES)) {
        references.addAll(
            referenceDecoder.decodeProjectReferences(property.value(), property.location()));
      } else if (Ascii.equalsIgnoreCase(key, TARGET_FRAMEWORK_MONIKER)) {
        // "=" is written as "%3D" so that older readers can split the line.
        targetFrameworkMoniker =
            QuotedValues.unescapePercent(property.unquotedValue(options.quoteChar()));
      } else if (!extractCompilerParameter(property, configurations)) {
        other.add(new OpaqueSection.Entry(key, property.value()));
      }
    }

    ImmutableMap.Builder<String, WebCompilerParameters> webConfigurations = ImmutableMap.builder();
    for (Map.Entry<String, WebCompilerParameters.Builder> entry : configurations.entrySet()) {
      webConfigurations.put(entry.getKey(), entry.getValue().build());
    }
    return new WebsiteProperties(
        references.build(),
        targetFrameworkMoniker,
        webConfigurations.buildOrThrow(),
        other.build());
  }

  /**
   * Stores {@code <Configuration>.AspNetCompiler.<Field>} into the parameters of that
   * configuration. Returns false if the line is not a known compiler field; the configuration
   * still gets a record, with every field empty if need be.
   */
  private boolean extractCompilerParameter(
      RawBlock.Property property, Map<String, WebCompilerParameters.Builder> configurations) {
    String key = property.key();
    int dot = key.indexOf('.');
    if (dot <= 0) {
      return false;
    }
    String prefix = WebCompilerParameters.TOOL_NAMESPACE + ".";
    String rest = key.substring(dot + 1);
    if (!rest.startsWith(prefix)) {
      return false;
    }
    WebCompilerParameters.Builder parameters =
        configurations.computeIfAbsent(
            key.substring(0, dot), unused -> WebCompilerParameters.builder());
    WebCompilerParameters.Field field =
        WebCompilerParameters.Field.forDeclaredName(rest.substring(prefix.length()));
    if (field == null) {
      return false;
    }
    parameters.set(field, property.unquotedValue(options.quoteChar()));
    return true;
  }
}
