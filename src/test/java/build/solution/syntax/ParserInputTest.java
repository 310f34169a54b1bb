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
import static java.nio.charset.StandardCharsets.UTF_16BE;
import static java.nio.charset.StandardCharsets.UTF_16LE;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import com.google.common.primitives.Bytes;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link ParserInput}. */
@RunWith(JUnit4.class)
public final class ParserInputTest {

  private static final String TEXT = "Project(\"{T}\") = \"Café\", \"café.csproj\", \"{A}\"";

  private Path root;

  @Before
  public void setUp() throws Exception {
    root = Files.createDirectories(Jimfs.newFileSystem(Configuration.unix()).getPath("/work"));
  }

  private static byte[] withMark(Charset charset, String text) {
    return ("\uFEFF" + text).getBytes(charset);
  }

  @Test
  public void testPlainUtf8() throws Exception {
    ParserInput input = ParserInput.fromBytes(TEXT.getBytes(UTF_8), "a.sln");
    assertThat(input.getContent()).isEqualTo(TEXT);
    assertThat(input.getFile()).isEqualTo("a.sln");
  }

  @Test
  public void testUtf8ByteOrderMarkIsDropped() throws Exception {
    byte[] bytes = withMark(UTF_8, TEXT);
    assertThat(ParserInput.charsetOf(bytes)).isEqualTo(UTF_8);
    assertThat(ParserInput.fromBytes(bytes, "a.sln").getContent()).isEqualTo(TEXT);
  }

  @Test
  public void testUtf16LittleEndian() throws Exception {
    byte[] bytes = withMark(UTF_16LE, TEXT);
    assertThat(ParserInput.charsetOf(bytes)).isEqualTo(UTF_16LE);
    assertThat(ParserInput.fromBytes(bytes, "a.sln").getContent()).isEqualTo(TEXT);
  }

  @Test
  public void testUtf16BigEndian() throws Exception {
    byte[] bytes = withMark(UTF_16BE, TEXT);
    assertThat(ParserInput.charsetOf(bytes)).isEqualTo(UTF_16BE);
    assertThat(ParserInput.fromBytes(bytes, "a.sln").getContent()).isEqualTo(TEXT);
  }

  @Test
  public void testSingleByteTextIsRejected() {
    // "Café" in windows-1252: the last byte is not valid UTF-8.
    byte[] bytes = Bytes.concat("Caf".getBytes(UTF_8), new byte[] {(byte) 0xE9, '\r', '\n'});
    assertThrows(CharacterCodingException.class, () -> ParserInput.fromBytes(bytes, "a.sln"));
  }

  @Test
  public void testReadFile() throws Exception {
    Path path = root.resolve("a.sln");
    Files.write(path, withMark(UTF_16LE, TEXT));
    ParserInput input = ParserInput.readFile(path);
    assertThat(input.getContent()).isEqualTo(TEXT);
    assertThat(input.getFile()).isEqualTo("/work/a.sln");
  }

  @Test
  public void testReadFileReportsUndecodableText() throws Exception {
    Path path = root.resolve("a.sln");
    Files.write(path, new byte[] {'C', 'a', 'f', (byte) 0xE9});
    IOException e = assertThrows(IOException.class, () -> ParserInput.readFile(path));
    assertThat(e).hasMessageThat().isEqualTo("/work/a.sln is not valid UTF-8 text");
    assertThat(e).hasCauseThat().isInstanceOf(CharacterCodingException.class);
  }
}
