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

import build.solution.events.Event;
import build.solution.events.EventHandler;
import build.solution.syntax.LineScanner.Line;
import build.solution.syntax.RawBlock.Property;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.FormatMethod;
import com.google.errorprone.annotations.FormatString;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * BlockParser recognizes the blocks of a legacy solution descriptor.
 *
 * <p>The grammar, over the logical lines produced by the {@link LineScanner}:
 *
 * <pre>
 * file          := header metadata* project* [global]
 * project       := 'Project(' Q ')' '=' Q ',' Q ',' Q  section*  'EndProject'
 * section       := 'ProjectSection(' name ')' '=' order  kv*  'EndProjectSection'
 * global        := 'Global'  globalsection*  'EndGlobal'
 * globalsection := 'GlobalSection(' name ')' '=' order  kv*  'EndGlobalSection'
 * kv            := key '=' value
 * </pre>
 *
 * where Q is a value enclosed in the configured quote character. The parser is a state machine:
 * only project blocks and a single global block are accepted at the top level, only project
 * sections inside a project, and only global sections inside the global block. Anything else that
 * opens a block in the wrong place, and any block left open at the end of input, is a fatal
 * {@link SyntaxError}. Section names are not interpreted here: every section, known or not, comes
 * out as a {@link RawBlock}.
 */
public final class BlockParser {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** The first line of every descriptor, followed by the format version. */
  public static final String HEADER_PREFIX =
      "Microsoft Visual Studio Solution File, Format Version ";

  // The header is on one of this many physical lines at the start of the input.
  private static final int HEADER_LINES = 2;

  /** Descriptors older than this cannot be read. */
  public static final int MIN_FORMAT_VERSION = 7;

  /** The newest format version known; newer ones are read with an informational note. */
  public static final int MAX_FORMAT_VERSION = 12;

  public static final String VISUAL_STUDIO_VERSION = "VisualStudioVersion";
  public static final String MINIMUM_VISUAL_STUDIO_VERSION = "MinimumVisualStudioVersion";

  private static final Pattern VERSION = Pattern.compile("(\\d+)(?:\\.\\d+)*");

  /** The result of parsing a descriptor into blocks. */
  public record Result(
      String file,
      String formatVersion,
      @Nullable String productDescription,
      ImmutableList<Property> metadata,
      ImmutableList<RawBlock> projects,
      @Nullable RawBlock global) {

    /** Returns the major format version, e.g. 12 for {@code 12.00}. */
    public int majorFormatVersion() {
      return parseMajorVersion(formatVersion);
    }

    /** Returns the value of a top-level {@code key = value} line such as VisualStudioVersion. */
    @Nullable
    public String getMetadata(String key) {
      for (Property property : metadata) {
        if (property.key().equals(key)) {
          return property.value();
        }
      }
      return null;
    }

    /** Returns the global sections, in declaration order. */
    public ImmutableList<RawBlock> globalSections() {
      return global == null ? ImmutableList.of() : global.children();
    }
  }

  private enum State {
    TOP,
    IN_PROJECT,
    IN_PROJECT_SECTION,
    IN_GLOBAL,
    IN_GLOBAL_SECTION,
    END
  }

  private final LineScanner scanner;
  private final SolutionOptions options;
  private final EventHandler eventHandler;

  private State state = State.TOP;

  // Blocks currently open, outermost first. At most two deep.
  private RawBlock.Builder outer;
  private RawBlock.Builder inner;
  private Line outerStart;
  private Line innerStart;

  private final ImmutableList.Builder<RawBlock> projects = ImmutableList.builder();
  private final ImmutableList.Builder<Property> metadata = ImmutableList.builder();
  private RawBlock global;

  private BlockParser(LineScanner scanner, SolutionOptions options, EventHandler eventHandler) {
    this.scanner = scanner;
    this.options = options;
    this.eventHandler = eventHandler;
  }

  /** Parses the input into blocks. */
  public static Result parse(ParserInput input, SolutionOptions options, EventHandler eventHandler)
      throws SyntaxError.Exception {
    return parse(new LineScanner(input, options), options, eventHandler);
  }

  /** Parses the lines of {@code scanner} into blocks. */
  public static Result parse(
      LineScanner scanner, SolutionOptions options, EventHandler eventHandler)
      throws SyntaxError.Exception {
    return new BlockParser(scanner, options, eventHandler).parseFile();
  }

  private Result parseFile() throws SyntaxError.Exception {
    ImmutableList<Line> lines = scanner.getLines();
    int headerIndex = findHeader(lines);
    String headerText = lines.get(headerIndex).text();
    String formatVersion =
        headerText.substring(Math.min(headerText.length(), HEADER_PREFIX.length())).strip();
    checkFormatVersion(lines.get(headerIndex), formatVersion);

    for (int i = headerIndex + 1; i < lines.size(); i++) {
      parseLine(lines.get(i));
    }
    checkAllClosed();

    Result result =
        new Result(
            scanner.getFile(),
            formatVersion,
            productDescription(),
            metadata.build(),
            projects.build(),
            global);
    logger.atFine().log(
        "Parsed %s: %d project blocks, %d global sections",
        result.file(), result.projects().size(), result.globalSections().size());
    return result;
  }

  /** Returns whether the input of {@code scanner} has the header on its first or second line. */
  public static boolean hasHeader(LineScanner scanner) {
    return headerIndex(scanner.getLines()) >= 0;
  }

  // The index among lines of the header, or -1.
  private static int headerIndex(ImmutableList<Line> lines) {
    for (int i = 0; i < lines.size() && lines.get(i).number() <= HEADER_LINES; i++) {
      if (lines.get(i).text().startsWith(HEADER_PREFIX.strip())) {
        return i;
      }
    }
    return -1;
  }

  private int findHeader(ImmutableList<Line> lines) throws SyntaxError.Exception {
    int index = headerIndex(lines);
    if (index >= 0) {
      return index;
    }
    Location location =
        lines.isEmpty() ? Location.ofFile(scanner.getFile()) : scanner.locationOf(lines.get(0));
    throw new SyntaxError.Exception(
        SyntaxError.of(
            location,
            lines.isEmpty() ? null : lines.get(0).text(),
            "no solution file header found; expected '%s<version>'",
            HEADER_PREFIX));
  }

  private void checkFormatVersion(Line header, String formatVersion) throws SyntaxError.Exception {
    if (!VERSION.matcher(formatVersion).matches()) {
      throw error(header, formatVersion, "invalid format version '%s'", formatVersion);
    }
    int major = parseMajorVersion(formatVersion);
    if (major < MIN_FORMAT_VERSION) {
      throw error(
          header,
          formatVersion,
          "format version %s is not supported; expected a version between %d and %d",
          formatVersion,
          MIN_FORMAT_VERSION,
          MAX_FORMAT_VERSION);
    }
    if (major > MAX_FORMAT_VERSION) {
      eventHandler.handle(
          Event.info(
              scanner.locationOf(header),
              "format version %s is newer than the newest known version %d",
              formatVersion,
              MAX_FORMAT_VERSION));
    }
  }

  static int parseMajorVersion(String version) {
    Matcher matcher = VERSION.matcher(version);
    Preconditions.checkArgument(matcher.matches(), "invalid version: %s", version);
    return Integer.parseInt(matcher.group(1));
  }

  // The first comment names the product that wrote the file, e.g. "# Visual Studio 15".
  @Nullable
  private String productDescription() {
    if (scanner.getComments().isEmpty()) {
      return null;
    }
    return scanner.getComments().get(0).text().substring(1).strip();
  }

  private void parseLine(Line line) throws SyntaxError.Exception {
    String text = line.text();
    switch (state) {
      case TOP:
        if (text.startsWith(BlockKind.PROJECT.openMarker() + "(")) {
          openOuter(line, parseProjectHeader(line));
          state = State.IN_PROJECT;
        } else if (text.equals(BlockKind.GLOBAL.openMarker())) {
          openOuter(line, RawBlock.builder(BlockKind.GLOBAL, scanner.locationOf(line)));
          state = State.IN_GLOBAL;
        } else if (isOpener(text) || isCloser(text)) {
          throw error(line, text, "'%s' is not allowed outside of a block", keyword(text));
        } else {
          parseMetadata(line);
        }
        break;

      case IN_PROJECT:
        if (text.equals(BlockKind.PROJECT.closeMarker())) {
          projects.add(outer.build());
          closeOuter();
          state = State.TOP;
        } else if (text.startsWith(BlockKind.PROJECT_SECTION.openMarker() + "(")) {
          openInner(line, parseSectionHeader(line, BlockKind.PROJECT_SECTION));
          state = State.IN_PROJECT_SECTION;
        } else if (isOpener(text) || isCloser(text)) {
          throw error(
              line,
              text,
              "'%s' is not allowed inside the Project block starting at line %d",
              keyword(text),
              outerStart.number());
        }
        // Other lines inside a project block carry nothing we read.
        break;

      case IN_PROJECT_SECTION:
        if (text.equals(BlockKind.PROJECT_SECTION.closeMarker())) {
          outer.addChild(inner.build());
          closeInner();
          state = State.IN_PROJECT;
        } else if (isOpener(text) || isCloser(text)) {
          throw error(
              line,
              text,
              "'%s' is not allowed inside the ProjectSection starting at line %d",
              keyword(text),
              innerStart.number());
        } else {
          inner.addProperty(parseProperty(line));
        }
        break;

      case IN_GLOBAL:
        if (text.equals(BlockKind.GLOBAL.closeMarker())) {
          global = outer.build();
          closeOuter();
          state = State.END;
        } else if (text.startsWith(BlockKind.GLOBAL_SECTION.openMarker() + "(")) {
          openInner(line, parseSectionHeader(line, BlockKind.GLOBAL_SECTION));
          state = State.IN_GLOBAL_SECTION;
        } else if (isOpener(text) || isCloser(text)) {
          throw error(
              line,
              text,
              "'%s' is not allowed inside the Global block starting at line %d",
              keyword(text),
              outerStart.number());
        }
        break;

      case IN_GLOBAL_SECTION:
        if (text.equals(BlockKind.GLOBAL_SECTION.closeMarker())) {
          outer.addChild(inner.build());
          closeInner();
          state = State.IN_GLOBAL;
        } else if (isOpener(text) || isCloser(text)) {
          throw error(
              line,
              text,
              "'%s' is not allowed inside the GlobalSection starting at line %d",
              keyword(text),
              innerStart.number());
        } else {
          inner.addProperty(parseProperty(line));
        }
        break;

      case END:
        if (isOpener(text) || isCloser(text)) {
          throw error(line, text, "'%s' is not allowed after EndGlobal", keyword(text));
        }
        parseMetadata(line);
        break;
    }
  }

  private void checkAllClosed() throws SyntaxError.Exception {
    if (inner != null) {
      throw unterminated(innerStart, inner.build());
    }
    if (outer != null) {
      throw unterminated(outerStart, outer.build());
    }
  }

  private SyntaxError.Exception unterminated(Line start, RawBlock block) {
    String what =
        block.name() != null
            ? block.kind().openMarker() + "(" + block.name() + ")"
            : block.kind().openMarker();
    return error(
        start,
        start.text(),
        "%s starting at line %d is not terminated; expected '%s'",
        what,
        start.number(),
        block.kind().closeMarker());
  }

  private void openOuter(Line line, RawBlock.Builder block) {
    outer = block;
    outerStart = line;
  }

  private void closeOuter() {
    outer = null;
    outerStart = null;
  }

  private void openInner(Line line, RawBlock.Builder block) {
    inner = block;
    innerStart = line;
  }

  private void closeInner() {
    inner = null;
    innerStart = null;
  }

  private static boolean isOpener(String text) {
    return text.startsWith(BlockKind.PROJECT.openMarker() + "(")
        || text.startsWith(BlockKind.PROJECT_SECTION.openMarker() + "(")
        || text.startsWith(BlockKind.GLOBAL_SECTION.openMarker() + "(")
        || text.equals(BlockKind.GLOBAL.openMarker());
  }

  private static boolean isCloser(String text) {
    for (BlockKind kind : BlockKind.values()) {
      if (text.equals(kind.closeMarker())) {
        return true;
      }
    }
    return false;
  }

  // Returns the leading keyword of an opening or closing line, for error messages.
  private static String keyword(String text) {
    int paren = text.indexOf('(');
    return paren < 0 ? text : text.substring(0, paren);
  }

  /**
   * Parses {@code Project("{type}") = "name", "path", "{id}"}, quoted with the configured quote
   * character.
   */
  private RawBlock.Builder parseProjectHeader(Line line) throws SyntaxError.Exception {
    String text = line.text();
    ImmutableList.Builder<String> fields = ImmutableList.builder();

    int pos = BlockKind.PROJECT.openMarker().length() + 1;
    pos = readQuotedField(line, pos, "project type", fields);
    pos = expect(line, pos, ')');
    pos = expect(line, pos, options.keyValueSeparator());
    pos = readQuotedField(line, pos, "project name", fields);
    pos = expect(line, pos, ',');
    pos = readQuotedField(line, pos, "project path", fields);
    pos = expect(line, pos, ',');
    pos = readQuotedField(line, pos, "project identifier", fields);
    pos = skipWhitespace(text, pos);
    if (pos != text.length()) {
      throw error(line, text.substring(pos), "unexpected text after the project identifier");
    }
    return RawBlock.builder(BlockKind.PROJECT, scanner.locationOf(line)).header(fields.build());
  }

  private int readQuotedField(Line line, int pos, String what, ImmutableList.Builder<String> out)
      throws SyntaxError.Exception {
    String text = line.text();
    char quote = options.quoteChar();
    pos = skipWhitespace(text, pos);
    if (pos >= text.length() || text.charAt(pos) != quote) {
      throw error(line, text, "missing %s: expected a value in %s quotes", what, quote);
    }
    StringBuilder value = new StringBuilder();
    int end = QuotedValues.scanQuoted(text, pos, quote, value);
    if (end < 0) {
      throw error(line, text.substring(pos), "unterminated quoted %s", what);
    }
    out.add(value.toString().strip());
    return end;
  }

  private int expect(Line line, int pos, char c) throws SyntaxError.Exception {
    String text = line.text();
    pos = skipWhitespace(text, pos);
    if (pos >= text.length() || text.charAt(pos) != c) {
      throw error(
          line,
          pos < text.length() ? text.substring(pos) : text,
          "malformed project line: expected '%s' at column %d",
          c,
          pos + 1);
    }
    return pos + 1;
  }

  private static int skipWhitespace(String text, int pos) {
    while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
      pos++;
    }
    return pos;
  }

  /** Parses {@code ProjectSection(Name) = order} or {@code GlobalSection(Name) = order}. */
  private RawBlock.Builder parseSectionHeader(Line line, BlockKind kind)
      throws SyntaxError.Exception {
    String text = line.text();
    int open = kind.openMarker().length();
    int close = text.indexOf(')', open);
    if (close < 0) {
      throw error(line, text, "missing ')' after the %s name", kind.openMarker());
    }
    String name = text.substring(open + 1, close).strip();
    if (name.isEmpty()) {
      throw error(line, text, "missing %s name", kind.openMarker());
    }
    int separator = text.indexOf(options.keyValueSeparator(), close);
    if (separator < 0) {
      throw error(line, text, "missing order qualifier for %s(%s)", kind.openMarker(), name);
    }
    String token = text.substring(separator + 1).strip();
    SectionOrder order = SectionOrder.fromToken(token);
    if (order == null) {
      throw error(line, token, "invalid section order '%s'", token);
    }
    if (order.sectionKind() != kind) {
      throw error(line, token, "order '%s' is not valid for a %s", token, kind.openMarker());
    }
    return RawBlock.builder(kind, scanner.locationOf(line)).name(name).order(order);
  }

  private Property parseProperty(Line line) {
    String text = line.text();
    int separator = text.indexOf(options.keyValueSeparator());
    if (separator < 0) {
      return new Property(text, null, scanner.locationOf(line));
    }
    return new Property(
        text.substring(0, separator).strip(),
        text.substring(separator + 1).strip(),
        scanner.locationOf(line));
  }

  // Top-level lines such as "VisualStudioVersion = 17.0.31903.59". Lines without a separator
  // carry nothing we read.
  private void parseMetadata(Line line) {
    if (line.text().indexOf(options.keyValueSeparator()) >= 0) {
      metadata.add(parseProperty(line));
    }
  }

  @FormatMethod
  private SyntaxError.Exception error(
      Line line, @Nullable String token, @FormatString String format, Object... args) {
    return new SyntaxError.Exception(
        SyntaxError.of(scanner.locationOf(line), token, format, args));
  }
}
