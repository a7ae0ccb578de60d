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


package net.djls.java.extract;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import net.djls.java.syntax.FileOptions;
import net.djls.java.syntax.ParserInput;
import net.djls.java.syntax.SourceFile;
import net.djls.java.syntax.SyntaxError;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of inferring end tags and intermediates from compile functions. */
@RunWith(JUnit4.class)
public final class BlockSpecExtractorTest {

  private static SourceFile parse(String... lines) throws SyntaxError.Exception {
    return SourceFile.parseOrThrow(ParserInput.fromLines(lines), FileOptions.DEFAULT);
  }

  // Extracts the block structure of the first function in the lines.
  private static BlockSpec extract(String... lines) throws SyntaxError.Exception {
    return BlockSpecExtractor.extract(parse(lines).getFunctions().get(0));
  }

  @Test
  public void testIfWithElifAndElse() throws Exception {
    BlockSpec spec =
        extract(
            "def do_if(parser, token):",
            "    nodelist = parser.parse(('elif', 'else', 'endif'))",
            "    token = parser.next_token()",
            "    while token.contents.startswith('elif'):",
            "        nodelist = parser.parse(('elif', 'else', 'endif'))",
            "        token = parser.next_token()",
            "    if token.contents == 'else':",
            "        nodelist = parser.parse(('endif',))",
            "        token = parser.next_token()",
            "    if token.contents != 'endif':",
            "        raise TemplateSyntaxError('Malformed template tag')",
            "    return IfNode(nodelist)");
    assertThat(spec).isEqualTo(BlockSpec.create("endif", ImmutableList.of("else", "elif"), false));
    assertThat(spec.intermediates()).containsExactly("elif", "else").inOrder();
  }

  @Test
  public void testForWithEmpty() throws Exception {
    BlockSpec spec =
        extract(
            "def do_for(parser, token):",
            "    nodelist_loop = parser.parse(('empty', 'endfor'))",
            "    token = parser.next_token()",
            "    if token.contents == 'empty':",
            "        nodelist_empty = parser.parse(('endfor',))",
            "        parser.delete_first_token()",
            "    else:",
            "        nodelist_empty = None",
            "    return ForNode(nodelist_loop, nodelist_empty)");
    assertThat(spec).isEqualTo(BlockSpec.create("endfor", ImmutableList.of("empty"), false));
  }

  @Test
  public void testSingleStopToken() throws Exception {
    BlockSpec spec =
        extract(
            "def spaceless(parser, token):",
            "    nodelist = parser.parse(('endspaceless',))",
            "    parser.delete_first_token()",
            "    return SpacelessNode(nodelist)");
    assertThat(spec).isEqualTo(BlockSpec.closedBy("endspaceless"));
  }

  @Test
  public void testStopTokenWithArgumentsUsesCommandWord() throws Exception {
    BlockSpec spec =
        extract(
            "def do_tag(parser, token):",
            "    nodelist = parser.parse(['endtag now'])",
            "    return Node(nodelist)");
    assertThat(spec).isEqualTo(BlockSpec.closedBy("endtag"));
  }

  @Test
  public void testSuccessiveParseCalls() throws Exception {
    BlockSpec spec =
        extract(
            "def do_tag(parser, token):",
            "    head = parser.parse(('middle',))",
            "    parser.delete_first_token()",
            "    tail = parser.parse(('endtag',))",
            "    parser.delete_first_token()",
            "    return Node(head, tail)");
    assertThat(spec).isEqualTo(BlockSpec.create("endtag", ImmutableList.of("middle"), false));
  }

  @Test
  public void testSkipPastIsOpaque() throws Exception {
    BlockSpec spec =
        extract(
            "def comment(parser, token):",
            "    parser.skip_past('endcomment')",
            "    return CommentNode()");
    assertThat(spec).isEqualTo(BlockSpec.create("endcomment", ImmutableList.of(), true));
  }

  @Test
  public void testSeveralSkipPastTokensLeaveEndUnknown() throws Exception {
    BlockSpec spec =
        extract(
            "def verbatim(parser, token):",
            "    if token.contents == 'verbatim':",
            "        parser.skip_past('endverbatim')",
            "    else:",
            "        parser.skip_past('endraw')",
            "    return Node()");
    assertThat(spec.endTag()).isNull();
    assertThat(spec.opaque()).isTrue();
  }

  @Test
  public void testStopTokensWithoutEndAreAmbiguous() throws Exception {
    assertThat(
            extract(
                "def do_tag(parser, token):",
                "    nodelist = parser.parse(('stop', 'halt'))",
                "    return Node(nodelist)"))
        .isNull();
  }

  @Test
  public void testTwoEndTokensLeaveEndUnknown() throws Exception {
    BlockSpec spec =
        extract(
            "def do_tag(parser, token):",
            "    nodelist = parser.parse(('else', 'endtag', 'endothertag'))",
            "    token = parser.next_token()",
            "    if token.contents == 'else':",
            "        nodelist = parser.parse(('endtag', 'endothertag'))",
            "    return Node(nodelist)");
    assertThat(spec.endTag()).isNull();
    assertThat(spec.intermediates()).containsExactly("else");
  }

  @Test
  public void testFormattedEndTagIsDynamic() throws Exception {
    BlockSpec spec =
        extract(
            "def do_block(parser, token):",
            "    tag_name = token.split_contents()[0]",
            "    nodelist = parser.parse((f'end{tag_name}',))",
            "    return Node(nodelist)");
    assertThat(spec).isEqualTo(BlockSpec.create(null, ImmutableList.of(), false));
  }

  @Test
  public void testParserAttributeOfSelf() throws Exception {
    BlockSpec spec =
        extract(
            "def compile(self, token):",
            "    nodelist = self.parser.parse(('endwidget',))",
            "    return Node(nodelist)");
    assertThat(spec).isEqualTo(BlockSpec.closedBy("endwidget"));
  }

  @Test
  public void testNextTokenLoop() throws Exception {
    BlockSpec spec =
        extract(
            "def do_block_translate(parser, token):",
            "    bits = token.split_contents()",
            "    singular = []",
            "    plural = []",
            "    while parser.tokens:",
            "        token = parser.next_token()",
            "        if token.token_type in (TokenType.VAR, TokenType.TEXT):",
            "            singular.append(token)",
            "        else:",
            "            break",
            "    if counter:",
            "        if token.contents.strip() != 'plural':",
            "            raise TemplateSyntaxError('no other block tags allowed')",
            "        while parser.tokens:",
            "            token = parser.next_token()",
            "            if token.token_type in (TokenType.VAR, TokenType.TEXT):",
            "                plural.append(token)",
            "            else:",
            "                break",
            "    end_tag_name = 'end%s' % bits[0]",
            "    if token.contents.strip() != end_tag_name:",
            "        raise TemplateSyntaxError('unclosed tag')",
            "    return BlockTranslateNode(singular, plural)");
    assertThat(spec).isEqualTo(BlockSpec.create(null, ImmutableList.of("plural"), false));
  }

  @Test
  public void testNoBlockStructure() throws Exception {
    assertThat(
            extract(
                "def regroup(parser, token):",
                "    bits = token.split_contents()",
                "    target = parser.compile_filter(bits[1])",
                "    return RegroupNode(target)"))
        .isNull();
  }

  @Test
  public void testSimpleBlockTagEndName() throws Exception {
    SourceFile file =
        parse(
            "@register.simple_block_tag",
            "def repeat(context, content):",
            "    return content",
            "",
            "@register.simple_block_tag(end_name='stop')",
            "def loop(context, content):",
            "    return content",
            "",
            "@register.simple_tag",
            "def plain(value):",
            "    return value");
    ImmutableList<Registration> regs = RegistrationCollector.collect(file);
    assertThat(regs.get(1).endName()).isEqualTo("stop");
    assertThat(BlockSpecExtractor.forRegistration(regs.get(0), file.getFunction("repeat")))
        .isEqualTo(BlockSpec.closedBy("endrepeat"));
    assertThat(BlockSpecExtractor.forRegistration(regs.get(1), file.getFunction("loop")))
        .isEqualTo(BlockSpec.closedBy("stop"));
    assertThat(BlockSpecExtractor.forRegistration(regs.get(2), file.getFunction("plain")))
        .isNull();
  }
}
