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
import com.google.common.collect.ImmutableSet;
import net.djls.java.syntax.FileOptions;
import net.djls.java.syntax.ParserInput;
import net.djls.java.syntax.SourceFile;
import net.djls.java.syntax.SyntaxError;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the inference of tag rules from compile functions. */
@RunWith(JUnit4.class)
public final class TagAnalyzerTest {

  private static SourceFile parse(String... lines) throws SyntaxError.Exception {
    return SourceFile.parseOrThrow(ParserInput.fromLines(lines), FileOptions.DEFAULT);
  }

  // Parses the lines and analyzes the function named do_tag.
  private static TagRule analyze(String... lines) throws SyntaxError.Exception {
    SourceFile file = parse(lines);
    return new TagAnalyzer(file.getFunctions()).analyze(file.getFunction("do_tag"));
  }

  private static Constraint min(int n) {
    return Constraint.length(ArgumentCountConstraint.min(n));
  }

  private static Constraint max(int n) {
    return Constraint.length(ArgumentCountConstraint.max(n));
  }

  private static Constraint exact(int n) {
    return Constraint.length(ArgumentCountConstraint.exact(n));
  }

  private static Constraint keyword(int index, String literal) {
    return Constraint.keyword(SplitPosition.forward(index), literal);
  }

  private static final String[] REGROUP = {
    "def do_tag(parser, token):",
    "    bits = token.split_contents()",
    "    if len(bits) != 6:",
    "        raise TemplateSyntaxError('regroup tag takes five arguments')",
    "    target = parser.compile_filter(bits[1])",
    "    if bits[2] != 'by':",
    "        raise TemplateSyntaxError(\"second argument to regroup tag must be 'by'\")",
    "    if bits[4] != 'as':",
    "        raise TemplateSyntaxError(\"next-to-last argument to regroup tag must be 'as'\")",
    "    var_name = bits[5]",
    "    return RegroupNode(target, bits[3], var_name)",
  };

  @Test
  public void testExactLengthWithKeywords() throws Exception {
    TagRule rule = analyze(REGROUP);
    assertThat(rule.constraints())
        .isEqualTo(ConstraintSet.of(exact(6), keyword(2, "by"), keyword(4, "as")));
    assertThat(rule.supportsAsVar()).isTrue();
    assertThat(rule.options()).isNull();
  }

  @Test
  public void testExtractedArgs() throws Exception {
    TagRule rule = analyze(REGROUP);
    assertThat(rule.extractedArgs())
        .containsExactly(
            ExtractedArg.variable("arg0", 0, true),
            ExtractedArg.literal("by", 1, true),
            ExtractedArg.variable("arg2", 2, true),
            ExtractedArg.literal("as", 3, true),
            ExtractedArg.variable("var_name", 4, true))
        .inOrder();
  }

  @Test
  public void testMinimumWithBackwardKeyword() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    if len(bits) < 4:",
            "        raise TemplateSyntaxError('for statements need at least four words')",
            "    if bits[-2] != 'in':",
            "        raise TemplateSyntaxError('for statements should use the format for x in y')");
    assertThat(rule.constraints())
        .isEqualTo(ConstraintSet.of(min(4), Constraint.keyword(SplitPosition.backward(2), "in")));
    assertThat(rule.supportsAsVar()).isFalse();
  }

  @Test
  public void testFrontPopShiftsLengths() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    args = token.split_contents()",
            "    tag_name = args.pop(0)",
            "    if len(args) < 1:",
            "        raise TemplateSyntaxError('needs an argument')",
            "    if args[0] != 'on':",
            "        raise TemplateSyntaxError('expected on')");
    assertThat(rule.constraints()).isEqualTo(ConstraintSet.of(min(2), keyword(1, "on")));
  }

  @Test
  public void testBackPopShiftsNegativeIndices() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    name = bits.pop()",
            "    if bits[-1] != 'as':",
            "        raise TemplateSyntaxError('expected as')");
    assertThat(rule.constraints())
        .isEqualTo(ConstraintSet.of(Constraint.keyword(SplitPosition.backward(2), "as")));
    assertThat(rule.supportsAsVar()).isTrue();
  }

  @Test
  public void testDelShiftsLengths() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    del bits[0]",
            "    if len(bits) != 2:",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints()).isEqualTo(ConstraintSet.of(exact(3)));
  }

  @Test
  public void testSliceAndNotIn() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()[1:]",
            "    if len(bits) not in (1, 2):",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints())
        .isEqualTo(
            ConstraintSet.of(
                Constraint.length(ArgumentCountConstraint.oneOf(ImmutableList.of(2, 3)))));
  }

  @Test
  public void testStarUnpacking() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    tag_name, *args = token.split_contents()",
            "    if len(args) > 2:",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints()).isEqualTo(ConstraintSet.of(max(3)));
  }

  @Test
  public void testNegatedCondition() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    if not len(bits) == 3:",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints()).isEqualTo(ConstraintSet.of(exact(3)));
  }

  @Test
  public void testNegatedRange() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    if not (2 <= len(bits) <= 4):",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints()).isEqualTo(ConstraintSet.of(min(2), max(4)));
  }

  @Test
  public void testDisjunctionKeepsBothSides() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    if len(bits) > 3 or bits[1] != 'x':",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints()).isEqualTo(ConstraintSet.of(max(3), keyword(1, "x")));
  }

  @Test
  public void testConjunctionDropsLengths() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    if len(bits) == 3 and bits[1] != 'on':",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints()).isEqualTo(ConstraintSet.of(keyword(1, "on")));
  }

  @Test
  public void testChoice() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    if bits[1] not in ('on', 'off'):",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints())
        .isEqualTo(
            ConstraintSet.of(
                Constraint.choice(SplitPosition.forward(1), ImmutableList.of("on", "off"))));
    assertThat(rule.extractedArgs().get(0).kind()).isEqualTo(ExtractedArg.Kind.CHOICE);
    assertThat(rule.extractedArgs().get(0).choices()).containsExactly("on", "off").inOrder();
  }

  @Test
  public void testTagNameComparisonIgnored() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    if bits[0] != 'mytag':",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints().isEmpty()).isTrue();
    assertThat(rule.hasContent()).isFalse();
  }

  @Test
  public void testOtherExceptionsAreNotGuards() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    if len(bits) != 2:",
            "        raise ValueError('x')");
    assertThat(rule.constraints().isEmpty()).isTrue();
  }

  @Test
  public void testConfiguredValidationErrors() throws Exception {
    SourceFile file =
        parse(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    if len(bits) != 2:",
            "        raise InvalidTag('x')");
    AnalysisOptions options =
        AnalysisOptions.builder()
            .validationErrorNames(ImmutableSet.of("TemplateSyntaxError", "InvalidTag"))
            .build();
    TagRule rule =
        new TagAnalyzer(file.getFunctions(), options).analyze(file.getFunction("do_tag"));
    assertThat(rule.constraints()).isEqualTo(ConstraintSet.of(exact(2)));
  }

  @Test
  public void testKeywordChecksUnderElementTestAreDropped() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    if bits[1] == 'for':",
            "        if bits[2] != 'in':",
            "            raise TemplateSyntaxError('x')");
    assertThat(rule.constraints().isEmpty()).isTrue();
  }

  @Test
  public void testNestedGuardUnderLengthTest() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    if len(bits) > 2:",
            "        if bits[2] != 'as':",
            "            raise TemplateSyntaxError('x')");
    assertThat(rule.constraints()).isEqualTo(ConstraintSet.of(keyword(2, "as")));
  }

  @Test
  public void testLoopVariableHasUnresolvedPosition() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    for bit in bits[1:]:",
            "        if bit not in ('a', 'b'):",
            "            raise TemplateSyntaxError('x')");
    assertThat(rule.constraints())
        .isEqualTo(
            ConstraintSet.of(
                Constraint.choice(SplitPosition.unresolvedForward(), ImmutableList.of("a", "b"))));
    assertThat(rule.extractedArgs()).isEmpty();
  }

  @Test
  public void testFilteredListIsNotTracked() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = [b for b in token.split_contents() if b]",
            "    if len(bits) < 2:",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints().lengthConstraints()).isEmpty();
  }

  @Test
  public void testListPassedToUnknownFunctionIsForgotten() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    consume(bits)",
            "    if len(bits) < 2:",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints().isEmpty()).isTrue();
  }

  @Test
  public void testMutatedListIsForgotten() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    bits.append('x')",
            "    if len(bits) < 2:",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints().isEmpty()).isTrue();
  }

  @Test
  public void testCustomParameterNames() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(p, t):",
            "    bits = t.split_contents()",
            "    if len(bits) != 2:",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints()).isEqualTo(ConstraintSet.of(exact(2)));
  }

  @Test
  public void testContentsSplit() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = token.contents.split()",
            "    if len(bits) != 2:",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints()).isEqualTo(ConstraintSet.of(exact(2)));
  }

  @Test
  public void testOptionLoop() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    if len(bits) < 2:",
            "        raise TemplateSyntaxError('x')",
            "    options = {}",
            "    remaining_bits = bits[2:]",
            "    while remaining_bits:",
            "        option = remaining_bits.pop(0)",
            "        if option in options:",
            "            raise TemplateSyntaxError('duplicate')",
            "        if option == 'with':",
            "            value = token_kwargs(remaining_bits, parser, support_legacy=False)",
            "        elif option == 'only':",
            "            value = True",
            "        else:",
            "            raise TemplateSyntaxError('unknown option')",
            "        options[option] = value");
    assertThat(rule.constraints()).isEqualTo(ConstraintSet.of(min(2)));
    assertThat(rule.options())
        .isEqualTo(OptionLoop.create(ImmutableList.of("with", "only"), true, false));
  }

  @Test
  public void testMatchStatement() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    match token.split_contents():",
            "        case [_, x]:",
            "            pass",
            "        case [_, x, 'silent']:",
            "            pass",
            "        case [_, 'reset']:",
            "            pass",
            "        case _:",
            "            raise TemplateSyntaxError('x')");
    assertThat(rule.constraints())
        .isEqualTo(
            ConstraintSet.of(
                Constraint.length(ArgumentCountConstraint.oneOf(ImmutableList.of(2, 3))),
                keyword(2, "silent")));
  }

  @Test
  public void testAnalysisIsDeterministic() throws Exception {
    SourceFile file = parse(REGROUP);
    TagAnalyzer analyzer = new TagAnalyzer(file.getFunctions());
    TagRule first = analyzer.analyze(file.getFunction("do_tag"));
    TagRule second = analyzer.analyze(file.getFunction("do_tag"));
    TagRule fresh = new TagAnalyzer(file.getFunctions()).analyze(file.getFunction("do_tag"));
    assertThat(second).isEqualTo(first);
    assertThat(fresh).isEqualTo(first);
    assertThat(fresh.constraints().toString()).isEqualTo(first.constraints().toString());
  }

  @Test
  public void testUnparseableConstructsAreTolerated() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    try:",
            "        name = bits[1]",
            "    except IndexError as e:",
            "        raise TemplateSyntaxError('x') from e",
            "    with lock:",
            "        bits = sorted(bits)",
            "    async def later():",
            "        pass",
            "    if len(bits) > 5:",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints().isEmpty()).isTrue();
  }

  @Test
  public void testPopsInOneAssignmentTakeSuccessiveElements() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    name, kw = bits.pop(), bits.pop()",
            "    if kw != 'as':",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints())
        .isEqualTo(ConstraintSet.of(Constraint.keyword(SplitPosition.backward(2), "as")));
  }

  @Test
  public void testPopsInOneGuardTakeSuccessiveElements() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    tag_name = bits.pop(0)",
            "    if bits.pop(0) != 'a' or bits.pop(0) != 'b':",
            "        raise TemplateSyntaxError('x')",
            "    if len(bits) != 1:",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints())
        .isEqualTo(ConstraintSet.of(keyword(1, "a"), keyword(2, "b"), exact(4)));
  }

  @Test
  public void testPopInsideForLoopLeavesLengthUnknown() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    for x in extra:",
            "        bits.pop(0)",
            "        if len(bits) < 2:",
            "            raise TemplateSyntaxError('x')",
            "    if len(bits) > 3:",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints().lengthConstraints()).isEmpty();
  }

  @Test
  public void testOpaqueParserMethodKeepsListTracked() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    value = parser.compile_filter(bits)",
            "    if len(bits) != 2:",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints()).isEqualTo(ConstraintSet.of(exact(2)));
  }

  @Test
  public void testOtherParserMethodForgetsList() throws Exception {
    TagRule rule =
        analyze(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    parser.consume(bits)",
            "    if len(bits) != 2:",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints().lengthConstraints()).isEmpty();
  }

  @Test
  public void testOpaqueParserMethodsAreConfigurable() throws Exception {
    SourceFile file =
        parse(
            "def do_tag(parser, token):",
            "    bits = token.split_contents()",
            "    value = parser.compile_filter(bits)",
            "    if len(bits) != 2:",
            "        raise TemplateSyntaxError('x')");
    AnalysisOptions options =
        AnalysisOptions.DEFAULT.toBuilder().opaqueParserMethods(ImmutableSet.of()).build();
    TagRule rule =
        new TagAnalyzer(file.getFunctions(), options).analyze(file.getFunction("do_tag"));
    assertThat(rule.constraints().lengthConstraints()).isEmpty();
  }
}
