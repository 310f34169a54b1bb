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

import com.google.errorprone.annotations.FormatMethod;
import com.google.errorprone.annotations.FormatString;
import javax.annotation.Nullable;

/**
 * A SyntaxError represents a structural error in a solution descriptor: an unterminated block, a
 * section opened where it is not allowed, a malformed header line or configuration entry. Syntax
 * errors are fatal; the parser stops at the first one.
 */
public final class SyntaxError {

  private final Location location;
  private final String message;
  @Nullable private final String token;

  public SyntaxError(Location location, String message, @Nullable String token) {
    this.location = location;
    this.message = message;
    this.token = token;
  }

  @FormatMethod
  public static SyntaxError of(
      Location location, @Nullable String token, @FormatString String format, Object... args) {
    return new SyntaxError(location, String.format(format, args), token);
  }

  /** Returns the location of the offending line. */
  public Location location() {
    return location;
  }

  /** Returns a description of the error. */
  public String message() {
    return message;
  }

  /** Returns the offending token or line text, or null if none applies. */
  @Nullable
  public String token() {
    return token;
  }

  /** Returns a string of the form {@code "file:line: message"}. */
  @Override
  public String toString() {
    return location + ": " + message;
  }

  /**
   * A SyntaxError.Exception is a checked exception that holds the syntax error that caused a
   * solution descriptor to be rejected.
   */
  public static final class Exception extends java.lang.Exception {

    private final SyntaxError error;

    public Exception(SyntaxError error) {
      super(error.toString());
      this.error = error;
    }

    public SyntaxError error() {
      return error;
    }
  }
}
