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

import static java.nio.charset.StandardCharsets.UTF_16BE;
import static java.nio.charset.StandardCharsets.UTF_16LE;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Preconditions;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;

/** The apparent name and contents of a solution descriptor to be parsed. */
public final class ParserInput {

  private static final char BYTE_ORDER_MARK = '\uFEFF';

  private final String content;
  private final String file;

  private ParserInput(String content, String file) {
    this.content = Preconditions.checkNotNull(content);
    this.file = Preconditions.checkNotNull(file);
  }

  /** Returns the content of the input. A leading byte order mark is not part of the content. */
  public String getContent() {
    return content;
  }

  /** Returns the apparent file name of the input, used in locations. */
  public String getFile() {
    return file;
  }

  /** Returns an input that reads from a string. */
  public static ParserInput fromString(String content, String file) {
    if (!content.isEmpty() && content.charAt(0) == BYTE_ORDER_MARK) {
      content = content.substring(1);
    }
    return new ParserInput(content, file);
  }

  /**
   * Returns the charset that {@code bytes} announce with a byte order mark: UTF-8, UTF-16LE or
   * UTF-16BE. Without a mark they are taken to be UTF-8.
   */
  public static Charset charsetOf(byte[] bytes) {
    if (startsWith(bytes, 0xFF, 0xFE)) {
      return UTF_16LE;
    }
    if (startsWith(bytes, 0xFE, 0xFF)) {
      return UTF_16BE;
    }
    return UTF_8;
  }

  /**
   * Returns an input that reads from {@code bytes}, decoded in the charset their byte order mark
   * announces, or UTF-8 without one.
   *
   * @throws CharacterCodingException if the bytes are not valid text in that charset
   */
  public static ParserInput fromBytes(byte[] bytes, String file) throws CharacterCodingException {
    Charset charset = charsetOf(bytes);
    String content =
        charset
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(ByteBuffer.wrap(bytes))
            .toString();
    return fromString(content, file);
  }

  /**
   * Returns an input that reads the contents of the file at {@code path}, decoded as {@link
   * #fromBytes} does.
   *
   * @throws IOException if the file cannot be read or is not valid text
   */
  public static ParserInput readFile(Path path) throws IOException {
    byte[] bytes = Files.readAllBytes(path);
    try {
      return fromBytes(bytes, path.toString());
    } catch (CharacterCodingException e) {
      throw new IOException(
          String.format("%s is not valid %s text", path, charsetOf(bytes).name()), e);
    }
  }

  private static boolean startsWith(byte[] bytes, int first, int second) {
    return bytes.length >= 2 && (bytes[0] & 0xFF) == first && (bytes[1] & 0xFF) == second;
  }
}
