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

import build.solution.events.EventKind;
import build.solution.events.StoredEventHandler;
import build.solution.syntax.BlockKind;
import build.solution.syntax.Location;
import build.solution.syntax.RawBlock;
import build.solution.syntax.SectionOrder;
import build.solution.syntax.SolutionOptions;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link ReferenceListDecoder}. */
@RunWith(JUnit4.class)
public final class ReferenceListDecoderTest {

  private static final Location LOCATION = Location.ofLine("a.sln", 7);

  private final StoredEventHandler events = new StoredEventHandler();
  private final ReferenceListDecoder decoder =
      new ReferenceListDecoder(SolutionOptions.DEFAULT, events);

  private static RawBlock dependencies(RawBlock.Property... properties) {
    return RawBlock.section(
        BlockKind.PROJECT_SECTION,
        ReferenceListDecoder.PROJECT_DEPENDENCIES,
        SectionOrder.POST_PROJECT,
        ImmutableList.copyOf(properties));
  }

  private static RawBlock.Property property(String key, String value) {
    return new RawBlock.Property(key, value, LOCATION);
  }

  @Test
  public void testDependenciesKeepOrderAndDuplicates() {
    ImmutableList<String> ids =
        decoder.decodeDependencies(
            dependencies(
                property("{B}", "{B}"), property("{A}", "{A}"), property("{B}", "{B}")));
    assertThat(ids).containsExactly("{B}", "{A}", "{B}").inOrder();
    assertThat(events.isEmpty()).isTrue();
  }

  @Test
  public void testMalformedDependenciesAreSkippedWithWarning() {
    ImmutableList<String> ids =
        decoder.decodeDependencies(
            dependencies(
                property("{A}", "{A}"),
                property("no-braces", "x"),
                new RawBlock.Property("{C}", null, LOCATION),
                property("{unclosed", "{unclosed"),
                property("{D}", "{D}")));
    assertThat(ids).containsExactly("{A}", "{D}").inOrder();
    assertThat(events.getEvents(EventKind.WARNING)).hasSize(3);
    assertThat(events.getEvents().get(0).getLocation()).isEqualTo(LOCATION);
  }

  @Test
  public void testProjectReferences() {
    ImmutableList<ProjectReference> references =
        decoder.decodeProjectReferences("\"{A}|Lib1.dll;{B}|Lib2.dll;\"", LOCATION);
    assertThat(references)
        .containsExactly(
            new ProjectReference("{A}", "Lib1.dll"), new ProjectReference("{B}", "Lib2.dll"))
        .inOrder();
    assertThat(events.isEmpty()).isTrue();
  }

  @Test
  public void testDisplayNameContainingTheListSeparator() {
    ImmutableList<ProjectReference> references =
        decoder.decodeProjectReferences(
            "\"{FD705688-88D1-4C22-9BFF-86235D89C2FC}|CSCla;ssLibra;ry1.dll;"
                + "{F0726D09-042B-4A7A-8A01-6BED2422BD5D}|VCClassLibrary1.dll;\"",
            LOCATION);
    assertThat(references)
        .containsExactly(
            new ProjectReference("{FD705688-88D1-4C22-9BFF-86235D89C2FC}", "CSCla;ssLibra;ry1.dll"),
            new ProjectReference("{F0726D09-042B-4A7A-8A01-6BED2422BD5D}", "VCClassLibrary1.dll"))
        .inOrder();
    assertThat(events.isEmpty()).isTrue();
  }

  @Test
  public void testMalformedReferencesAreSkippedWithWarning() {
    ImmutableList<ProjectReference> references =
        decoder.decodeProjectReferences("\"orphan;noid|x.dll;{A}|a.dll\"", LOCATION);
    assertThat(references).containsExactly(new ProjectReference("{A}", "a.dll"));
    assertThat(events.getEvents(EventKind.WARNING)).hasSize(2);
    assertThat(events.getEvents().get(0).getMessage()).contains("orphan");
    assertThat(events.getEvents().get(1).getMessage()).contains("noid|x.dll");
  }

  @Test
  public void testEmptyList() {
    assertThat(decoder.decodeProjectReferences("\"\"", LOCATION)).isEmpty();
    assertThat(decoder.decodeProjectReferences(";;", LOCATION)).isEmpty();
    assertThat(events.isEmpty()).isTrue();
  }

  @Test
  public void testCustomSeparators() {
    SolutionOptions options =
        SolutionOptions.builder().listSeparator(',').pairSeparator(':').build();
    ReferenceListDecoder custom = new ReferenceListDecoder(options, events);
    ImmutableList<ProjectReference> references =
        custom.decodeProjectReferences("{A}:a.dll,{B}:b.dll,", LOCATION);
    assertThat(references)
        .containsExactly(new ProjectReference("{A}", "a.dll"), new ProjectReference("{B}", "b.dll"))
        .inOrder();
    assertThat(ReferenceListDecoder.encodeProjectReferences(references, options))
        .isEqualTo("{A}:a.dll,{B}:b.dll,");
  }
}
