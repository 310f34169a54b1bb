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

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import java.io.File;

/**
 * SolutionOptions is the set of options that affect the reading of a single solution descriptor:
 * the punctuation of the legacy grammar, and what the model builder does with declared paths.
 *
 * <p>The quote and delimiter characters are a property of the grammar, not of the host: callers
 * that pre-process descriptors with their own quoting may substitute them, and the scanner and
 * decoders honor whichever characters they are given. The {@link #DEFAULT} options describe the
 * descriptors written by the IDE.
 *
 * <p>Options are passed at call time. Nothing in this package reads process-wide state to decide
 * how to parse.
 */
@AutoValue
public abstract class SolutionOptions {

  /** The default options, matching descriptors as written by the IDE. */
  public static final SolutionOptions DEFAULT = builder().build();

  /**
   * The character that opens and closes quoted values. A doubled quote inside a value escapes it.
   */
  public abstract char quoteChar();

  /** A line whose first non-blank character is this one is a comment. */
  public abstract char commentChar();

  /** Separates the key from the value in {@code key = value} lines. */
  public abstract char keyValueSeparator();

  /**
   * Separates the entries of a reference list, e.g. {@code ;} in {@code "{A}|a.dll;{B}|b.dll;"}.
   */
  public abstract char listSeparator();

  /**
   * Separates the parts of a pair: identifier and display name in a reference list, configuration
   * and platform in a configuration name.
   */
  public abstract char pairSeparator();

  /**
   * During model building, rewrite the separators of declared paths to {@link #pathSeparator}.
   * Off by default, so that writing the model back reproduces the declared text.
   */
  public abstract boolean normalizePathSeparators();

  /** The separator that declared paths are rewritten to when normalization is requested. */
  public abstract char pathSeparator();

  /** Report a warning for project type tokens that are not recognized. */
  public abstract boolean warnOnUnknownProjectTypes();

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_SolutionOptions.Builder()
        .quoteChar('"')
        .commentChar('#')
        .keyValueSeparator('=')
        .listSeparator(';')
        .pairSeparator('|')
        .normalizePathSeparators(false)
        .pathSeparator(File.separatorChar)
        .warnOnUnknownProjectTypes(true);
  }

  public abstract Builder toBuilder();

  /** Builder for {@link SolutionOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder quoteChar(char value);

    public abstract Builder commentChar(char value);

    public abstract Builder keyValueSeparator(char value);

    public abstract Builder listSeparator(char value);

    public abstract Builder pairSeparator(char value);

    public abstract Builder normalizePathSeparators(boolean value);

    public abstract Builder pathSeparator(char value);

    public abstract Builder warnOnUnknownProjectTypes(boolean value);

    abstract SolutionOptions autoBuild();

    public SolutionOptions build() {
      SolutionOptions options = autoBuild();
      Preconditions.checkArgument(
          options.quoteChar() != options.keyValueSeparator(),
          "quote character must differ from the key/value separator");
      Preconditions.checkArgument(
          options.listSeparator() != options.pairSeparator(),
          "list separator must differ from the pair separator");
      return options;
    }
  }
}
