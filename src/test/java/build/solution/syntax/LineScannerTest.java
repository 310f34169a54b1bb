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

package build.solution.syntax;

import static com.google.common.truth.Truth.assertThat;

import build.solution.syntax.LineScanner.Line;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link LineScanner}. */
@RunWith(JUnit4.class)
public final class LineScannerTest {

  private static LineScanner scan(String content) {
    return new LineScanner(ParserInput.fromString(content, "a.sln"), SolutionOptions.DEFAULT);
  }

  @Test
  public void testLinesAreTrimmedAndNumbered() {
    LineScanner scanner = scan("a\r\n\r\n  # comment\r\n  b  \nc\rd");
    assertThat(scanner.getLines())
        .containsExactly(new Line(1, "a"), new Line(4, "b"), new Line(5, "c"), new Line(6, "d"))
        .inOrder();
    assertThat(scanner.getComments()).containsExactly(new Line(3, "# comment"));
  }

  @Test
  public void testBlankInputHasNoLines() {
    LineScanner scanner = scan(" \r\n\t\r\n");
    assertThat(scanner.getLines()).isEmpty();
    assertThat(scanner.getComments()).isEmpty();
  }

  @Test
  public void testByteOrderMarkIsNotPartOfTheFirstLine() {
    LineScanner scanner = scan("\uFEFFfirst\r\nsecond");
    assertThat(scanner.getLines().get(0)).isEqualTo(new Line(1, "first"));
  }

  @Test
  public void testCommentCharacterIsConfigurable() {
    LineScanner scanner =
        new LineScanner(
            ParserInput.fromString("; note\n# not a comment\n", "a.sln"),
            SolutionOptions.builder().commentChar(';').build());
    assertThat(scanner.getComments()).containsExactly(new Line(1, "; note"));
    assertThat(scanner.getLines()).containsExactly(new Line(2, "# not a comment"));
  }

  @Test
  public void testCommentMarkerInsideALineIsNotAComment() {
    LineScanner scanner = scan("key = value # trailing");
    assertThat(scanner.getLines()).containsExactly(new Line(1, "key = value # trailing"));
  }

  @Test
  public void testLocationOfLine() {
    LineScanner scanner = scan("\n\nthird");
    Line line = scanner.getLines().get(0);
    assertThat(scanner.locationOf(line)).isEqualTo(Location.ofLine("a.sln", 3));
    assertThat(scanner.locationOf(line).toString()).isEqualTo("a.sln:3:1");
  }
}
