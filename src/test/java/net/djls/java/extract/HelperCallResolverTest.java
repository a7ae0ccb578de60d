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

/** Tests of following calls into functions of the same module. */
@RunWith(JUnit4.class)
public final class HelperCallResolverTest {

  private static SourceFile parse(String... lines) throws SyntaxError.Exception {
    return SourceFile.parseOrThrow(ParserInput.fromLines(lines), FileOptions.DEFAULT);
  }

  private static Constraint min(int n) {
    return Constraint.length(ArgumentCountConstraint.min(n));
  }

  @Test
  public void testHelperGuardsApplyToCaller() throws Exception {
    SourceFile file =
        parse(
            "def parse_bits(bits):",
            "    if len(bits) != 3:",
            "        raise TemplateSyntaxError('x')",
            "    return bits[1]",
            "",
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    value = parse_bits(bits)",
            "    return Node(value)");
    TagAnalyzer analyzer = new TagAnalyzer(file.getFunctions());
    TagRule rule = analyzer.analyze(file.getFunction("do_tag"));
    assertThat(rule.constraints())
        .isEqualTo(ConstraintSet.of(Constraint.length(ArgumentCountConstraint.exact(3))));
    assertThat(rule.extractedArgs())
        .containsExactly(
            ExtractedArg.variable("value", 0, true), ExtractedArg.variable("arg1", 1, true))
        .inOrder();
    assertThat(analyzer.helperSummaryCount()).isEqualTo(1);
  }

  @Test
  public void testHelperPopsApplyToCaller() throws Exception {
    SourceFile file =
        parse(
            "def strip_name(bits):",
            "    bits.pop(0)",
            "",
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    strip_name(bits)",
            "    if len(bits) < 2:",
            "        raise TemplateSyntaxError('x')");
    TagRule rule = new TagAnalyzer(file.getFunctions()).analyze(file.getFunction("do_tag"));
    assertThat(rule.constraints()).isEqualTo(ConstraintSet.of(min(3)));
  }

  @Test
  public void testReboundParameterForgetsCallerList() throws Exception {
    SourceFile file =
        parse(
            "def normalize(bits):",
            "    bits.pop(0)",
            "    bits = [b.lower() for b in bits]",
            "",
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    normalize(bits)",
            "    if len(bits) < 2:",
            "        raise TemplateSyntaxError('x')");
    TagRule rule = new TagAnalyzer(file.getFunctions()).analyze(file.getFunction("do_tag"));
    assertThat(rule.constraints().isEmpty()).isTrue();
  }

  @Test
  public void testHelperReturningFilteredListYieldsNoLength() throws Exception {
    SourceFile file =
        parse(
            "def clean(bits):",
            "    return [b for b in bits if b != ',']",
            "",
            "def do_tag(parser, token):",
            "    bits = clean(token.split_contents())",
            "    if len(bits) != 4:",
            "        raise TemplateSyntaxError('x')");
    TagRule rule = new TagAnalyzer(file.getFunctions()).analyze(file.getFunction("do_tag"));
    assertThat(rule.constraints().lengthConstraints()).isEmpty();
  }

  @Test
  public void testHelperPartitioningBitsYieldsNoLength() throws Exception {
    SourceFile file =
        parse(
            "def parse_bits(bits):",
            "    args = []",
            "    kwargs = []",
            "    for bit in bits[1:]:",
            "        if '=' in bit:",
            "            kwargs.append(bit)",
            "        else:",
            "            args.append(bit)",
            "    return args, kwargs",
            "",
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    args, kwargs = parse_bits(bits)",
            "    if len(args) != 2:",
            "        raise TemplateSyntaxError('x')",
            "    return Node(args, kwargs)");
    TagRule rule = new TagAnalyzer(file.getFunctions()).analyze(file.getFunction("do_tag"));
    assertThat(rule.constraints().lengthConstraints()).isEmpty();
  }

  @Test
  public void testHelperReturningSliceIsTracked() throws Exception {
    SourceFile file =
        parse(
            "def args_of(token):",
            "    return token.split_contents()[1:]",
            "",
            "def do_tag(parser, token):",
            "    args = args_of(token)",
            "    if len(args) > 2:",
            "        raise TemplateSyntaxError('x')");
    TagRule rule = new TagAnalyzer(file.getFunctions()).analyze(file.getFunction("do_tag"));
    assertThat(rule.constraints())
        .isEqualTo(ConstraintSet.of(Constraint.length(ArgumentCountConstraint.max(3))));
  }

  @Test
  public void testSelfRecursionTerminates() throws Exception {
    SourceFile file =
        parse(
            "def check(bits):",
            "    if len(bits) < 2:",
            "        raise TemplateSyntaxError('x')",
            "    return check(bits[1:])",
            "",
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    result = check(bits)");
    TagRule rule = new TagAnalyzer(file.getFunctions()).analyze(file.getFunction("do_tag"));
    assertThat(rule.constraints()).isEqualTo(ConstraintSet.of(min(2)));
  }

  @Test
  public void testMutualRecursionTerminates() throws Exception {
    SourceFile file =
        parse(
            "def ping(bits):",
            "    return pong(bits)",
            "",
            "def pong(bits):",
            "    return ping(bits)",
            "",
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    ping(bits)");
    TagRule rule = new TagAnalyzer(file.getFunctions()).analyze(file.getFunction("do_tag"));
    assertThat(rule.hasContent()).isFalse();
  }

  @Test
  public void testHelpersAreFollowedOneLevelDeep() throws Exception {
    SourceFile file =
        parse(
            "def inner(bits):",
            "    if len(bits) != 2:",
            "        raise TemplateSyntaxError('x')",
            "",
            "def outer(bits):",
            "    inner(bits)",
            "",
            "def do_tag(parser, token):",
            "    outer(token.split_contents())");
    TagRule rule = new TagAnalyzer(file.getFunctions()).analyze(file.getFunction("do_tag"));
    assertThat(rule.constraints().isEmpty()).isTrue();

    AnalysisOptions deeper = AnalysisOptions.DEFAULT.toBuilder().maxHelperDepth(2).build();
    TagRule deep = new TagAnalyzer(file.getFunctions(), deeper).analyze(file.getFunction("do_tag"));
    assertThat(deep.constraints())
        .isEqualTo(ConstraintSet.of(Constraint.length(ArgumentCountConstraint.exact(2))));
  }

  @Test
  public void testSummariesAreShared() throws Exception {
    SourceFile file =
        parse(
            "def check(bits):",
            "    if len(bits) != 2:",
            "        raise TemplateSyntaxError('x')",
            "",
            "def do_one(parser, token):",
            "    check(token.split_contents())",
            "",
            "def do_two(parser, token):",
            "    check(token.split_contents())");
    TagAnalyzer analyzer = new TagAnalyzer(file.getFunctions());
    TagRule one = analyzer.analyze(file.getFunction("do_one"));
    TagRule two = analyzer.analyze(file.getFunction("do_two"));
    assertThat(one.constraints()).isEqualTo(two.constraints());
    assertThat(analyzer.helperSummaryCount()).isEqualTo(1);
  }

  @Test
  public void testKeywordArguments() throws Exception {
    SourceFile file =
        parse(
            "def check(bits, *, expected=3):",
            "    if len(bits) != 3:",
            "        raise TemplateSyntaxError('x')",
            "",
            "def do_tag(parser, token):",
            "    check(bits=token.split_contents())");
    TagRule rule = new TagAnalyzer(file.getFunctions()).analyze(file.getFunction("do_tag"));
    assertThat(rule.constraints())
        .isEqualTo(ConstraintSet.of(Constraint.length(ArgumentCountConstraint.exact(3))));
  }

  @Test
  public void testReduceReturns() {
    AbstractValue element = AbstractValue.splitElement(SplitPosition.forward(1));
    assertThat(HelperCallResolver.reduceReturns(ImmutableList.of()))
        .isEqualTo(AbstractValue.UNKNOWN);
    assertThat(
            HelperCallResolver.reduceReturns(ImmutableList.of(element, AbstractValue.UNKNOWN)))
        .isEqualTo(element);
    assertThat(
            HelperCallResolver.reduceReturns(
                ImmutableList.of(element, AbstractValue.intLiteral(1))))
        .isEqualTo(AbstractValue.UNKNOWN);
  }
}
