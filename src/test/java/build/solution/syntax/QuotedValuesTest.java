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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link QuotedValues}. */
@RunWith(JUnit4.class)
public final class QuotedValuesTest {

  @Test
  public void testScanQuoted() {
    StringBuilder out = new StringBuilder();
    int end = QuotedValues.scanQuoted("x = \"abc\", rest", 4, '"', out);
    assertThat(out.toString()).isEqualTo("abc");
    assertThat(end).isEqualTo(9);
  }

  @Test
  public void testScanQuotedUnescapesDoubledQuotes() {
    StringBuilder out = new StringBuilder();
    int end = QuotedValues.scanQuoted("\"say \"\"hi\"\"\"", 0, '"', out);
    assertThat(out.toString()).isEqualTo("say \"hi\"");
    assertThat(end).isEqualTo(12);
  }

  @Test
  public void testScanQuotedUnterminated() {
    assertThat(QuotedValues.scanQuoted("\"abc", 0, '"', new StringBuilder())).isEqualTo(-1);
    assertThat(QuotedValues.scanQuoted("abc", 0, '"', new StringBuilder())).isEqualTo(-1);
  }

  @Test
  public void testBackslashIsNotAnEscape() {
    assertThat(QuotedValues.unquote("\"C:\\Sites\\App\\\"", '"')).isEqualTo("C:\\Sites\\App\\");
  }

  @Test
  public void testUnquote() {
    assertThat(QuotedValues.unquote("\"value\"", '"')).isEqualTo("value");
    assertThat(QuotedValues.unquote("value", '"')).isEqualTo("value");
    assertThat(QuotedValues.unquote("\"\"", '"')).isEmpty();
    assertThat(QuotedValues.unquote("'a''b'", '\'')).isEqualTo("a'b");
  }

  @Test
  public void testUnquoteKeepsLoneInteriorQuote() {
    assertThat(QuotedValues.unquote("\"a\"b\"", '"')).isEqualTo("a\"b");
  }

  @Test
  public void testQuoteDoublesQuotes() {
    assertThat(QuotedValues.quote("a\"b", '"')).isEqualTo("\"a\"\"b\"");
    assertThat(QuotedValues.unquote(QuotedValues.quote("a\"b", '"'), '"')).isEqualTo("a\"b");
  }

  @Test
  public void testUnescapePercent() {
    assertThat(QuotedValues.unescapePercent(".NETFramework,Version%3Dv4.0"))
        .isEqualTo(".NETFramework,Version=v4.0");
    assertThat(QuotedValues.unescapePercent("100%")).isEqualTo("100%");
    assertThat(QuotedValues.unescapePercent("%zz%3d")).isEqualTo("%zz=");
  }
}
