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

package build.solution.vfs;

import com.google.common.base.CharMatcher;

/**
 * Rewrites the separators of declared paths.
 *
 * <p>Descriptors are usually written on Windows, with backslashes. A host with another separator
 * can ask for paths in its own form; otherwise paths stay exactly as declared so that writing the
 * model back reproduces the original text. URLs, as used by web projects hosted on a server, are
 * never rewritten.
 */
public final class PathNormalizer {

  private static final CharMatcher SEPARATORS = CharMatcher.anyOf("\\/");

  private final char separator;

  public PathNormalizer(char separator) {
    this.separator = separator;
  }

  /** Returns {@code path} with every backslash and forward slash replaced by the separator. */
  public String normalize(String path) {
    if (isUrl(path)) {
      return path;
    }
    return SEPARATORS.replaceFrom(path, separator);
  }

  /** Whether {@code path} is a URL such as {@code http://localhost/site/}. */
  public static boolean isUrl(String path) {
    return path.contains("://");
  }
}
