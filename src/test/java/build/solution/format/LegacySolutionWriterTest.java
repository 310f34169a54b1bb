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

import static build.solution.format.SampleSolutions.APP;
import static build.solution.format.SampleSolutions.SITE;
import static build.solution.format.SampleSolutions.WEB_SOLUTION;
import static com.google.common.truth.Truth.assertThat;

import build.solution.model.OpaqueSection;
import build.solution.model.ProjectConfiguration;
import build.solution.model.ProjectEntry;
import build.solution.model.ProjectType;
import build.solution.model.SolutionConfiguration;
import build.solution.model.SolutionModel;
import build.solution.model.SolutionParser;
import build.solution.model.WebCompilerParameters;
import build.solution.syntax.ParserInput;
import build.solution.syntax.SectionOrder;
import build.solution.syntax.SolutionOptions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link LegacySolutionWriter}. */
@RunWith(JUnit4.class)
public final class LegacySolutionWriterTest {

  private static SolutionModel parse(String text) throws Exception {
    return SolutionParser.parse(ParserInput.fromString(text, "written.sln"));
  }

  @Test
  public void testHeader() throws Exception {
    String text = LegacySolutionWriter.write(parse(WEB_SOLUTION), SolutionOptions.DEFAULT);
    assertThat(text)
        .startsWith(
            "\r\n"
                + "Microsoft Visual Studio Solution File, Format Version 12.00\r\n"
                + "# Visual Studio Version 17\r\n"
                + "VisualStudioVersion = 17.0.31903.59\r\n"
                + "MinimumVisualStudioVersion = 10.0.40219.1\r\n");
    assertThat(text).endsWith("EndGlobal\r\n");
  }

  @Test
  public void testReadingTheOutputYieldsAnEqualModel() throws Exception {
    SolutionModel original = parse(WEB_SOLUTION);
    SolutionModel reread =
        parse(LegacySolutionWriter.write(original, SolutionOptions.DEFAULT));

    assertThat(reread.getProjects()).containsExactlyElementsIn(original.getProjects()).inOrder();
    assertThat(reread.getSolutionConfigurations())
        .containsExactlyElementsIn(original.getSolutionConfigurations())
        .inOrder();
    assertThat(reread.getGlobalSections()).isEqualTo(original.getGlobalSections());
    assertThat(reread.getFormatVersion()).isEqualTo(original.getFormatVersion());
    assertThat(reread.getProductDescription()).isEqualTo(original.getProductDescription());
    assertThat(reread.getWarnings()).isEmpty();
  }

  @Test
  public void testWebsiteProperties() throws Exception {
    String text = LegacySolutionWriter.write(parse(WEB_SOLUTION), SolutionOptions.DEFAULT);
    assertThat(text)
        .contains(
            "\tProjectSection(WebsiteProperties) = preProject\r\n"
                + "\t\tTargetFrameworkMoniker = \".NETFramework,Version%3Dv4.0\"\r\n");
    // Every field is written, declared or not.
    assertThat(text).contains("\t\tDebug.AspNetCompiler.KeyFile = \"\"\r\n");
    assertThat(text).contains("\t\tRelease.AspNetCompiler.FixedNames = \"\"\r\n");
    assertThat(text).contains("\t\tDebug.AspNetCompiler.PhysicalPath = \"..\\Site\\\"\r\n");
    assertThat(text).contains("\t\tVWDPort = \"1234\"\r\n");
  }

  @Test
  public void testConfigurationTables() throws Exception {
    String text = LegacySolutionWriter.write(parse(WEB_SOLUTION), SolutionOptions.DEFAULT);
    assertThat(text)
        .contains(
            "\tGlobalSection(SolutionConfigurationPlatforms) = preSolution\r\n"
                + "\t\tDebug|Any CPU = Debug|Any CPU\r\n"
                + "\t\tRelease|Any CPU = Release|Any CPU\r\n"
                + "\tEndGlobalSection\r\n");
    assertThat(text)
        .contains(
            "\t\t" + APP + ".Release|Any CPU.ActiveCfg = Release|Any CPU\r\n"
                + "\t\t" + "{A5D1B7B2");
    assertThat(text).doesNotContain(APP + ".Release|Any CPU.Build.0");
    // A configuration without a platform is written without a separator.
    assertThat(text).contains(SITE + ".Debug|Any CPU.ActiveCfg = Debug\r\n");
  }

  @Test
  public void testModelBuiltInMemory() throws Exception {
    ProjectEntry folder =
        ProjectEntry.builder()
            .id("{F1}")
            .name("Tools")
            .relativePath("Tools")
            .typeToken(ProjectType.SOLUTION_FOLDER_TYPE)
            .type(ProjectType.SOLUTION_FOLDER)
            .build();
    ProjectEntry site =
        ProjectEntry.builder()
            .id("{W1}")
            .name("Say \"hi\"")
            .relativePath("C:\\Sites\\Hi\\")
            .typeToken(ProjectType.WEB_SITE_TYPE)
            .type(ProjectType.WEB_PROJECT)
            .parentId("{F1}")
            .targetFrameworkMoniker("a=b%c")
            .webConfigurations(
                ImmutableMap.of("Debug", WebCompilerParameters.builder().debug("true").build()))
            .projectConfigurations(
                ImmutableMap.of("Debug|x86", new ProjectConfiguration("Debug", "", true)))
            .sections(
                ImmutableList.of(
                    new OpaqueSection(
                        "Extra",
                        SectionOrder.POST_PROJECT,
                        ImmutableList.of(new OpaqueSection.Entry("flag", null)))))
            .build();
    SolutionModel model =
        SolutionModel.builder("memory.sln")
            .addProject(folder)
            .addProject(site)
            .addSolutionConfiguration(new SolutionConfiguration("Debug", "x86"))
            .build();

    String text = LegacySolutionWriter.write(model, SolutionOptions.DEFAULT);
    assertThat(text)
        .contains(
            "Project(\"" + ProjectType.WEB_SITE_TYPE + "\") = \"Say \"\"hi\"\"\","
                + " \"C:\\Sites\\Hi\\\", \"{W1}\"\r\n");
    assertThat(text).contains("\t\tTargetFrameworkMoniker = \"a%3Db%25c\"\r\n");
    assertThat(text).contains("\t\tflag\r\n");
    assertThat(text)
        .contains(
            "\tGlobalSection(NestedProjects) = preSolution\r\n"
                + "\t\t{W1} = {F1}\r\n"
                + "\tEndGlobalSection\r\n"
                + "EndGlobal\r\n");

    SolutionModel reread = parse(text);
    assertThat(reread.getProjects()).containsExactly(folder, site).inOrder();
    assertThat(reread.getProductDescription()).isNull();
    assertThat(reread.getVisualStudioVersion()).isNull();
  }

  @Test
  public void testEmptyModel() throws Exception {
    String text =
        LegacySolutionWriter.write(
            SolutionModel.builder("empty.sln").build(), SolutionOptions.DEFAULT);
    assertThat(text)
        .isEqualTo(
            "\r\nMicrosoft Visual Studio Solution File, Format Version 12.00\r\nGlobal\r\n"
                + "EndGlobal\r\n");
  }
}
