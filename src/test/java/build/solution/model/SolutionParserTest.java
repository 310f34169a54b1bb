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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import build.solution.events.EventKind;
import build.solution.events.StoredEventHandler;
import build.solution.syntax.ParserInput;
import build.solution.syntax.SectionOrder;
import build.solution.syntax.SolutionOptions;
import build.solution.syntax.SyntaxError;
import com.google.common.base.Joiner;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link SolutionParser}, from descriptor text to model. */
@RunWith(JUnit4.class)
public final class SolutionParserTest {

  static final String APP = "{6185CC21-BE89-448A-B3C0-D1C27112E595}";
  static final String LIB = "{A5D1B7B2-3C2E-4B0E-9B7B-2D8E4F1C0A11}";
  static final String SITE = "{E0F2D9B4-7A5C-4E31-8C21-6B9D3A7F1E22}";
  static final String FOLDER = "{3F2A1B0C-9D8E-4F7A-8B6C-5D4E3F2A1B00}";

  static final String SOLUTION =
      Joiner.on("\r\n")
          .join(
              "",
              "Microsoft Visual Studio Solution File, Format Version 12.00",
              "# Visual Studio Version 17",
              "VisualStudioVersion = 17.0.31903.59",
              "MinimumVisualStudioVersion = 10.0.40219.1",
              "Project(\"{FAE04EC0-301F-11D3-BF4B-00C04F79EFBC}\") = \"App\","
                  + " \"src\\App\\App.csproj\", \"" + APP + "\"",
              "\tProjectSection(ProjectDependencies) = postProject",
              "\t\t" + LIB + " = " + LIB,
              "\tEndProjectSection",
              "EndProject",
              "Project(\"{FAE04EC0-301F-11D3-BF4B-00C04F79EFBC}\") = \"Lib\","
                  + " \"src\\Lib\\Lib.csproj\", \"" + LIB + "\"",
              "EndProject",
              "Project(\"{E24C65DC-7377-472B-9ABA-BC803B73C61A}\") = \"Site\","
                  + " \"http://localhost/Site\", \"" + SITE + "\"",
              "\tProjectSection(WebsiteProperties) = preProject",
              "\t\tTargetFrameworkMoniker = \".NETFramework,Version%3Dv4.0\"",
              "\t\tProjectReferences = \"" + APP + "|App.dll;" + LIB + "|Lib.dll;\"",
              "\t\tDebug.AspNetCompiler.VirtualPath = \"/Site\"",
              "\t\tDebug.AspNetCompiler.Debug = \"True\"",
              "\t\tRelease.AspNetCompiler.VirtualPath = \"/Site\"",
              "\t\tVWDPort = \"1234\"",
              "\tEndProjectSection",
              "EndProject",
              "Project(\"{2150E333-8FDC-42A3-9474-1A3956D46DE8}\") = \"Libraries\", \"Libraries\","
                  + " \"" + FOLDER + "\"",
              "EndProject",
              "Global",
              "\tGlobalSection(SolutionConfigurationPlatforms) = preSolution",
              "\t\tDebug|Any CPU = Debug|Any CPU",
              "\t\tRelease|Any CPU = Release|Any CPU",
              "\tEndGlobalSection",
              "\tGlobalSection(ProjectConfigurationPlatforms) = postSolution",
              "\t\t" + APP + ".Debug|Any CPU.ActiveCfg = Debug|Any CPU",
              "\t\t" + APP + ".Debug|Any CPU.Build.0 = Debug|Any CPU",
              "\t\t" + APP + ".Release|Any CPU.ActiveCfg = Release|Any CPU",
              "\t\t" + LIB + ".Debug|Any CPU.ActiveCfg = Debug|Any CPU",
              "\t\t" + LIB + ".Debug|Any CPU.Build.0 = Debug|Any CPU",
              "\tEndGlobalSection",
              "\tGlobalSection(SolutionProperties) = preSolution",
              "\t\tHideSolutionNode = FALSE",
              "\tEndGlobalSection",
              "\tGlobalSection(NestedProjects) = preSolution",
              "\t\t" + LIB + " = " + FOLDER,
              "\tEndGlobalSection",
              "EndGlobal",
              "");

  static SolutionModel parse(String text) throws Exception {
    return SolutionParser.parse(ParserInput.fromString(text, "test.sln"));
  }

  @Test
  public void testHeader() throws Exception {
    SolutionModel model = parse(SOLUTION);
    assertThat(model.getFile()).isEqualTo("test.sln");
    assertThat(model.getFormatVersion()).isEqualTo("12.00");
    assertThat(model.getProductDescription()).isEqualTo("Visual Studio Version 17");
    assertThat(model.getVisualStudioVersion()).isEqualTo("17.0.31903.59");
    assertThat(model.getMinimumVisualStudioVersion()).isEqualTo("10.0.40219.1");
    assertThat(model.getWarnings()).isEmpty();
  }

  @Test
  public void testEntriesInDeclarationOrder() throws Exception {
    SolutionModel model = parse(SOLUTION);
    assertThat(model.getProjects()).hasSize(4);
    assertThat(model.getProjects().get(0).name()).isEqualTo("App");
    assertThat(model.getProjects().get(1).name()).isEqualTo("Lib");
    assertThat(model.getProjects().get(2).name()).isEqualTo("Site");
    assertThat(model.getProjects().get(3).name()).isEqualTo("Libraries");

    ProjectEntry app = model.getProject(APP);
    assertThat(app.relativePath()).isEqualTo("src\\App\\App.csproj");
    assertThat(app.type()).isEqualTo(ProjectType.PROJECT);
    assertThat(app.typeToken()).isEqualTo(ProjectType.CSHARP_TYPE);
    assertThat(app.parentId()).isNull();
    assertThat(model.getProject(FOLDER).isFolder()).isTrue();
  }

  @Test
  public void testDependenciesAndReferences() throws Exception {
    SolutionModel model = parse(SOLUTION);
    assertThat(model.getProject(APP).dependencies()).containsExactly(LIB);
    assertThat(model.getProject(APP).projectReferences()).isEmpty();
    assertThat(model.getProject(LIB).dependencies()).isEmpty();

    ProjectEntry site = model.getProject(SITE);
    assertThat(site.dependencies()).isEmpty();
    assertThat(site.projectReferences()).containsExactly(APP, LIB).inOrder();
    assertThat(site.projectReferenceEntries().get(0).displayName()).isEqualTo("App.dll");
  }

  @Test
  public void testWebProject() throws Exception {
    ProjectEntry site = parse(SOLUTION).getProject(SITE);
    assertThat(site.type()).isEqualTo(ProjectType.WEB_PROJECT);
    assertThat(site.relativePath()).isEqualTo("http://localhost/Site");
    assertThat(site.targetFrameworkMoniker()).isEqualTo(".NETFramework,Version=v4.0");
    assertThat(site.webConfigurations().keySet()).containsExactly("Debug", "Release").inOrder();

    WebCompilerParameters debug = site.getWebConfiguration("Debug");
    assertThat(debug.virtualPath()).isEqualTo("/Site");
    assertThat(debug.debug()).isEqualTo("True");
    assertThat(debug.physicalPath()).isEmpty();
    assertThat(site.getWebConfiguration("Release").debug()).isEmpty();
    assertThat(site.websiteProperties())
        .containsExactly(new OpaqueSection.Entry("VWDPort", "\"1234\""));
  }

  @Test
  public void testConfigurations() throws Exception {
    SolutionModel model = parse(SOLUTION);
    assertThat(model.getSolutionConfigurations())
        .containsExactly(
            new SolutionConfiguration("Debug", "Any CPU"),
            new SolutionConfiguration("Release", "Any CPU"))
        .inOrder();
    assertThat(model.getDefaultConfigurationName()).isEqualTo("Debug");
    assertThat(model.getDefaultPlatformName()).isEqualTo("Any CPU");

    ProjectEntry app = model.getProject(APP);
    assertThat(model.getProjectConfiguration(app, "Debug|Any CPU").buildEnabled()).isTrue();
    assertThat(model.getProjectConfiguration(app, "Release|Any CPU").buildEnabled()).isFalse();
    assertThat(model.getProjectConfiguration(model.getProject(LIB), "Release|Any CPU")).isNull();
    assertThat(model.getProject(FOLDER).projectConfigurations()).isEmpty();
  }

  @Test
  public void testNestingAndGlobalSections() throws Exception {
    SolutionModel model = parse(SOLUTION);
    assertThat(model.getProject(LIB).parentId()).isEqualTo(FOLDER);
    assertThat(model.getChildren(FOLDER)).containsExactly(model.getProject(LIB));
    assertThat(model.getUniqueName(model.getProject(LIB))).isEqualTo("Libraries\\Lib");

    // The configuration and nesting tables are interpreted, not carried.
    assertThat(model.getGlobalSections()).hasSize(1);
    OpaqueSection properties = model.getGlobalSections().get(0);
    assertThat(properties.name()).isEqualTo(SolutionModel.SOLUTION_PROPERTIES);
    assertThat(properties.order()).isEqualTo(SectionOrder.PRE_SOLUTION);
    assertThat(model.getGlobalProperty("HideSolutionNode")).isEqualTo("FALSE");
  }

  @Test
  public void testWarningsAreRecordedAndForwarded() throws Exception {
    String text =
        SOLUTION.replace(
            "Project(\"{FAE04EC0-301F-11D3-BF4B-00C04F79EFBC}\") = \"Lib\"",
            "Project(\"{00000000-0000-0000-0000-000000000000}\") = \"Lib\"");
    StoredEventHandler events = new StoredEventHandler();
    SolutionModel model =
        SolutionParser.parse(
            ParserInput.fromString(text, "test.sln"), SolutionOptions.DEFAULT, events);

    assertThat(model.getProject(LIB).type()).isEqualTo(ProjectType.UNRECOGNIZED);
    assertThat(model.getProject(LIB).relativePath()).isEqualTo("src\\Lib\\Lib.csproj");
    assertThat(model.getWarnings()).hasSize(1);
    assertThat(model.getWarnings().get(0).getKind()).isEqualTo(EventKind.WARNING);
    assertThat(model.getWarnings().get(0).getMessage()).contains("unknown project type");
    assertThat(events.getEvents()).isEqualTo(model.getWarnings());
  }

  @Test
  public void testUnknownNestedProjectIsRejected() {
    String text = SOLUTION.replace("\t\t" + LIB + " = " + FOLDER, "\t\t{DEADBEEF} = " + FOLDER);
    SolutionModelException e = assertThrows(SolutionModelException.class, () -> parse(text));
    assertThat(e).hasMessageThat().contains("nested project {DEADBEEF} is not declared");
  }

  @Test
  public void testDuplicateProjectIsRejected() {
    String text =
        SOLUTION
            .replace("\"src\\Lib\\Lib.csproj\", \"" + LIB, "\"src\\Lib\\Lib.csproj\", \"" + APP)
            .replace("\t\t" + LIB + " = " + FOLDER + "\r\n", "");
    SolutionModelException e = assertThrows(SolutionModelException.class, () -> parse(text));
    assertThat(e).hasMessageThat().contains("already used by 'App'");
    assertThat(e.getLocation().line()).isEqualTo(11);
  }

  @Test
  public void testStructuralErrorIsFatal() {
    String text = SOLUTION.replace("EndGlobal\r\n", "");
    assertThrows(SyntaxError.Exception.class, () -> parse(text));
  }

  @Test
  public void testEmptyDescriptorHasNoEntries() throws Exception {
    SolutionModel model =
        parse("Microsoft Visual Studio Solution File, Format Version 12.00\r\n");
    assertThat(model.getProjects()).isEmpty();
    assertThat(model.getSolutionConfigurations()).isEmpty();
  }
}
