// Copyright 2026 The Bazel Authors. All rights reserved.
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

package net.djls.java.syntax;

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of tokenization behavior of the {@link Lexer}. */
@RunWith(JUnit4.class)
public class LexerTest {

  private final List<SyntaxError> errors = new ArrayList<>();

  private Lexer createLexer(String input) {
    errors.clear();
    return new Lexer(ParserInput.fromString(input, ""), FileOptions.DEFAULT, errors);
  }

  // Returns the kinds (and values, where present) of all tokens of src.
  private String values(String src) {
    Lexer lexer = createLexer(src);
    StringBuilder buf = new StringBuilder();
    do {
      lexer.nextToken();
      if (buf.length() > 0) {
        buf.append(' ');
      }
      buf.append(lexer.kind.name());
      if (lexer.value != null) {
        buf.append('(').append(lexer.value).append(')');
      }
    } while (lexer.kind != TokenKind.EOF);
    return buf.toString();
  }

  private void check(String src, String wantTokens) {
    assertThat(values(src)).isEqualTo(wantTokens);
    assertThat(errors).isEmpty();
  }

  @Test
  public void testAssignment() throws Exception {
    check("bits = token.split_contents()",
        "IDENTIFIER(bits) EQUALS IDENTIFIER(token) DOT IDENTIFIER(split_contents)"
            + " LPAREN RPAREN NEWLINE EOF");
  }

  @Test
  public void testIntegers() throws Exception {
    check("12345-", "INT(12345) MINUS NEWLINE EOF");
    check("0x1f", "INT(31) NEWLINE EOF");
    check("0o17", "INT(15) NEWLINE EOF");
  }

  @Test
  public void testStrings() throws Exception {
    check("\"by\"", "STRING(by) NEWLINE EOF");
    check("'as'", "STRING(as) NEWLINE EOF");
    check("'it\\'s'", "STRING(it's) NEWLINE EOF");
    check("\"\"\"doc\nstring\"\"\"", "STRING(doc\nstring) NEWLINE EOF");
  }

  @Test
  public void testPrefixedStrings() throws Exception {
    check("r'a\\d'", "STRING(a\\d) NEWLINE EOF");
    check("b'x'", "STRING(x) NEWLINE EOF");
    check("rb'x'", "STRING(x) NEWLINE EOF");
    check("u'x'", "STRING(x) NEWLINE EOF");
    // A lone prefix letter is an ordinary identifier.
    check("r + b", "IDENTIFIER(r) PLUS IDENTIFIER(b) NEWLINE EOF");
  }

  @Test
  public void testComparisonOperators() throws Exception {
    check("len(bits) != 3",
        "IDENTIFIER(len) LPAREN IDENTIFIER(bits) RPAREN NOT_EQUALS INT(3) NEWLINE EOF");
    check("a <= b >= c == d",
        "IDENTIFIER(a) LESS_EQUALS IDENTIFIER(b) GREATER_EQUALS IDENTIFIER(c)"
            + " EQUALS_EQUALS IDENTIFIER(d) NEWLINE EOF");
    check("a not in b", "IDENTIFIER(a) NOT IN IDENTIFIER(b) NEWLINE EOF");
  }

  @Test
  public void testIndentation() throws Exception {
    check("1\n2\n3", "INT(1) NEWLINE INT(2) NEWLINE INT(3) NEWLINE EOF");
    check(
        "1\n  2\n  3\n4 ",
        "INT(1) NEWLINE INDENT INT(2) NEWLINE INT(3) NEWLINE OUTDENT INT(4) NEWLINE EOF");
    check(
        "1\n  2\n    3\n  4\n5",
        "INT(1) NEWLINE INDENT INT(2) NEWLINE INDENT INT(3) NEWLINE "
            + "OUTDENT INT(4) NEWLINE OUTDENT INT(5) NEWLINE EOF");
  }

  @Test
  public void testIndentationInsideParens() throws Exception {
    check("foo(1,\n  2)", "IDENTIFIER(foo) LPAREN INT(1) COMMA INT(2) RPAREN NEWLINE EOF");
  }

  @Test
  public void testComments() throws Exception {
    check("x # trailing\ny", "IDENTIFIER(x) NEWLINE IDENTIFIER(y) NEWLINE EOF");
  }

  @Test
  public void testMatchIsSoftKeyword() throws Exception {
    check("match bits:", "MATCH IDENTIFIER(bits) COLON NEWLINE EOF");
    check("match = 1", "IDENTIFIER(match) EQUALS INT(1) NEWLINE EOF");
    check("match.group(1)",
        "IDENTIFIER(match) DOT IDENTIFIER(group) LPAREN INT(1) RPAREN NEWLINE EOF");
    check("match(x)", "IDENTIFIER(match) LPAREN IDENTIFIER(x) RPAREN NEWLINE EOF");
  }

  @Test
  public void testCaseIsSoftKeyword() throws Exception {
    check("case [_, x]:",
        "CASE LBRACKET IDENTIFIER(_) COMMA IDENTIFIER(x) RBRACKET COLON NEWLINE EOF");
    check("case = 'x'", "IDENTIFIER(case) EQUALS STRING(x) NEWLINE EOF");
  }

  @Test
  public void testUnclosedString() throws Exception {
    values("'abc");
    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).message()).isEqualTo("unclosed string literal");
  }
}
