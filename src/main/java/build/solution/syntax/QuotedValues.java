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

/**
 * Quoting and escaping rules of the legacy grammar.
 *
 * <p>A quoted value is delimited by the configured quote character. Inside it, a doubled quote
 * character stands for one literal quote character. Backslashes are not escapes: they are path
 * separators, and a value such as {@code "C:\Sites\App\"} ends with one.
 */
public final class QuotedValues {

  private QuotedValues() {}

  /**
   * Scans a quoted value of {@code line} whose opening quote is at {@code start}, appending the
   * unescaped value to {@code out}.
   *
   * @return the index just past the closing quote, or -1 if the value is not terminated
   */
  public static int scanQuoted(CharSequence line, int start, char quote, StringBuilder out) {
    if (start >= line.length() || line.charAt(start) != quote) {
      return -1;
    }
    int i = start + 1;
    while (i < line.length()) {
      char c = line.charAt(i);
      if (c == quote) {
        if (i + 1 < line.length() && line.charAt(i + 1) == quote) {
          out.append(quote);
          i += 2;
          continue;
        }
        return i + 1;
      }
      out.append(c);
      i++;
    }
    return -1;
  }

  /**
   * Strips a single pair of enclosing quotes from {@code value} and unescapes doubled quotes. A
   * value that is not enclosed in quotes is returned as is.
   */
  public static String unquote(String value, char quote) {
    if (value.length() >= 2
        && value.charAt(0) == quote
        && value.charAt(value.length() - 1) == quote) {
      StringBuilder buf = new StringBuilder(value.length());
      int end = scanQuoted(value, 0, quote, buf);
      if (end == value.length()) {
        return buf.toString();
      }
      // An interior lone quote: keep everything between the outer quotes verbatim.
      return value.substring(1, value.length() - 1);
    }
    return value;
  }

  /** Encloses {@code value} in quotes, doubling any quote characters it contains. */
  public static String quote(String value, char quote) {
    StringBuilder buf = new StringBuilder(value.length() + 2);
    buf.append(quote);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == quote) {
        buf.append(quote);
      }
      buf.append(c);
    }
    return buf.append(quote).toString();
  }

  /**
   * Replaces {@code %XX} hex escapes with the characters they denote. Older writers escaped
   * {@code =} as {@code %3D} in property values. Malformed escapes are kept verbatim.
   */
  public static String unescapePercent(String value) {
    if (value.indexOf('%') < 0) {
      return value;
    }
    StringBuilder buf = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '%'
          && i + 2 < value.length()
          && isHex(value.charAt(i + 1))
          && isHex(value.charAt(i + 2))) {
        buf.append((char) Integer.parseInt(value.substring(i + 1, i + 3), 16));
        i += 2;
      } else {
        buf.append(c);
      }
    }
    return buf.toString();
  }

  private static boolean isHex(char c) {
    return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
  }
}
