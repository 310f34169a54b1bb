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

package build.solution.format;

import build.solution.syntax.BlockParser;
import build.solution.syntax.LineScanner;
import build.solution.syntax.ParserInput;
import build.solution.syntax.SolutionOptions;
import com.google.common.base.Ascii;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.annotation.Nullable;

/** The file formats a solution can be stored in. */
public enum SolutionFormat {
  /** The line-oriented text format. */
  LEGACY(".sln"),
  /** The XML format. */
  STRUCTURED(".slnx");

  // Enough of the file to see past a byte order mark and the first line to the header.
  private static final int SIGNATURE_LENGTH = 256;

  private final String extension;

  SolutionFormat(String extension) {
    this.extension = extension;
  }

  /** The file name extension, including the dot. */
  public String extension() {
    return extension;
  }

  /** Returns the format that a file of this format converts to. */
  public SolutionFormat other() {
    return this == LEGACY ? STRUCTURED : LEGACY;
  }

  /** Returns {@code path} with its extension replaced by this format's. */
  public Path siblingOf(Path path) {
    String fileName = path.getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
    return path.resolveSibling(stem + extension);
  }

  /** Returns the format whose extension {@code path} has, compared case-insensitively, or null. */
  @Nullable
  public static SolutionFormat fromExtension(Path path) {
    String fileName = Ascii.toLowerCase(path.getFileName().toString());
    for (SolutionFormat format : values()) {
      if (fileName.endsWith(format.extension)) {
        return format;
      }
    }
    return null;
  }

  /**
   * Determines the format of {@code path}, by its extension if that is a known one, and otherwise
   * by the first characters of its content: an XML document, or a legacy header on the first or
   * second line.
   *
   * @throws SolutionFormatException if the file cannot be read or its format is not recognized
   */
  public static SolutionFormat detect(Path path) throws SolutionFormatException {
    SolutionFormat byExtension = fromExtension(path);
    if (byExtension != null) {
      return byExtension;
    }

    byte[] signature;
    try (InputStream in = Files.newInputStream(path)) {
      signature = in.readNBytes(SIGNATURE_LENGTH);
    } catch (IOException e) {
      throw new SolutionFormatException(path, "cannot read file: " + e.getMessage(), e);
    }
    ParserInput start =
        ParserInput.fromString(
            new String(signature, ParserInput.charsetOf(signature)), path.toString());
    if (start.getContent().strip().startsWith("<")) {
      return STRUCTURED;
    }
    if (BlockParser.hasHeader(new LineScanner(start, SolutionOptions.DEFAULT))) {
      return LEGACY;
    }
    throw new SolutionFormatException(path, "not a solution file in a known format");
  }
}
