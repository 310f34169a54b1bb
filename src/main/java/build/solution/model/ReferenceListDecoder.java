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
import build.solution.syntax.Location;
import build.solution.syntax.QuotedValues;
import build.solution.syntax.RawBlock;
import build.solution.syntax.SolutionOptions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Decodes the two kinds of project lists of a descriptor: the build dependencies of a {@code
 * ProjectDependencies} section, and the {@code ProjectReferences} list of a web project.
 *
 * <p>Malformed entries are dropped and reported as warnings; they never fail the parse.
 */
public final class ReferenceListDecoder {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** The project section listing build dependencies. */
  public static final String PROJECT_DEPENDENCIES = "ProjectDependencies";

  /** The key of the web project reference list inside {@code WebsiteProperties}. */
  public static final String PROJECT_REFERENCES = "ProjectReferences";

  private final SolutionOptions options;
  private final EventHandler eventHandler;

  public ReferenceListDecoder(SolutionOptions options, EventHandler eventHandler) {
    this.options = options;
    this.eventHandler = eventHandler;
  }

  /**
   * Decodes a {@code ProjectDependencies} section, whose lines have the form {@code {id} = {id}}.
   * Returns the identifiers in declaration order, duplicates kept.
   */
  public ImmutableList<String> decodeDependencies(RawBlock section) {
    ImmutableList.Builder<String> ids = ImmutableList.builder();
    for (RawBlock.Property property : section.properties()) {
      if (!property.hasValue()) {
        warn(
            property.location(),
            "ignoring dependency line '%s': expected '{id} = {id}'",
            property.key());
        continue;
      }
      String id = extractId(property.key());
      if (id == null) {
        warn(
            property.location(),
            "ignoring dependency '%s': no identifier in braces",
            property.key());
        continue;
      }
      ids.add(id);
    }
    return ids.build();
  }

  /**
   * Decodes a reference list such as {@code "{A}|Lib1.dll;{B}|Lib2.dll;"}. The value may still be
   * enclosed in quotes.
   *
   * <p>A display name may itself contain the list separator: a fragment without a pair separator
   * that follows a valid entry is taken to continue that entry's display name. A fragment without
   * a pair separator at the start of the list, and an entry without an identifier in braces, are
   * dropped with a warning.
   */
  public ImmutableList<ProjectReference> decodeProjectReferences(String value, Location location) {
    String list = QuotedValues.unquote(value.strip(), options.quoteChar());
    List<ProjectReference> references = new ArrayList<>();
    boolean lastWasValid = false;
    for (String fragment : Splitter.on(options.listSeparator()).omitEmptyStrings().split(list)) {
      int bar = fragment.indexOf(options.pairSeparator());
      if (bar < 0) {
        if (lastWasValid) {
          ProjectReference last = references.remove(references.size() - 1);
          references.add(
              new ProjectReference(
                  last.id(), last.displayName() + options.listSeparator() + fragment));
        } else {
          warn(
              location,
              "ignoring project reference '%s': missing '%s'",
              fragment,
              options.pairSeparator());
        }
        continue;
      }
      String id = extractId(fragment.substring(0, bar));
      if (id == null) {
        warn(location, "ignoring project reference '%s': no identifier in braces", fragment);
        lastWasValid = false;
        continue;
      }
      references.add(new ProjectReference(id, fragment.substring(bar + 1)));
      lastWasValid = true;
    }
    return ImmutableList.copyOf(references);
  }

  /** Encodes references back into the list form, without enclosing quotes. */
  public static String encodeProjectReferences(
      Iterable<ProjectReference> references, SolutionOptions options) {
    StringBuilder buf = new StringBuilder();
    for (ProjectReference reference : references) {
      buf.append(reference.id())
          .append(options.pairSeparator())
          .append(reference.displayName())
          .append(options.listSeparator());
    }
    return buf.toString();
  }

  // Returns the "{...}" part of text, or null if there is none.
  @Nullable
  private static String extractId(String text) {
    int open = text.indexOf('{');
    if (open < 0) {
      return null;
    }
    int close = text.indexOf('}', open);
    if (close < 0) {
      return null;
    }
    return text.substring(open, close + 1);
  }

  @FormatMethod
  private void warn(Location location, String format, Object... args) {
    Event event = Event.warn(location, format, args);
    logger.atWarning().log("%s", event);
    eventHandler.handle(event);
  }
}
