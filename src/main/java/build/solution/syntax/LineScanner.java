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

import com.google.common.collect.ImmutableList;

/**
 * A scanner for solution descriptors. Splits the input into trimmed logical lines, dropping blank
 * lines and full-line comments, and remembering the 1-based number of each line for diagnostics.
 *
 * <p>Comments are not discarded entirely: the block parser needs the first one, which by
 * convention names the product that wrote the file.
 */
public final class LineScanner {

  /** A non-blank, non-comment line of input, trimmed. */
  public record Line(int number, String text) {
    @Override
    public String toString() {
      return number + ": " + text;
    }
  }

  private final ParserInput input;
  private final SolutionOptions options;

  // Results, computed by scan().
  private final ImmutableList<Line> lines;
  private final ImmutableList<Line> comments;

  public LineScanner(ParserInput input, SolutionOptions options) {
    this.input = input;
    this.options = options;
    ImmutableList.Builder<Line> lines = ImmutableList.builder();
    ImmutableList.Builder<Line> comments = ImmutableList.builder();
    scan(lines, comments);
    this.lines = lines.build();
    this.comments = comments.build();
  }

  private void scan(ImmutableList.Builder<Line> lines, ImmutableList.Builder<Line> comments) {
    String content = input.getContent();
    int lineNumber = 0;
    int pos = 0;
    int length = content.length();
    while (pos < length) {
      int end = pos;
      while (end < length && content.charAt(end) != '\n' && content.charAt(end) != '\r') {
        end++;
      }
      lineNumber++;
      String text = content.substring(pos, end).strip();
      if (!text.isEmpty()) {
        if (text.charAt(0) == options.commentChar()) {
          comments.add(new Line(lineNumber, text));
        } else {
          lines.add(new Line(lineNumber, text));
        }
      }
      // A CR LF pair terminates a single line.
      if (end < length && content.charAt(end) == '\r' && end + 1 < length
          && content.charAt(end + 1) == '\n') {
        end++;
      }
      pos = end + 1;
    }
  }

  /** Returns the apparent file name of the input. */
  public String getFile() {
    return input.getFile();
  }

  /** Returns the logical lines, in input order. */
  public ImmutableList<Line> getLines() {
    return lines;
  }

  /** Returns the comment lines, in input order, including their leading comment character. */
  public ImmutableList<Line> getComments() {
    return comments;
  }

  /** Returns the location of the given line. */
  public Location locationOf(Line line) {
    return Location.ofLine(input.getFile(), line.number());
  }
}
