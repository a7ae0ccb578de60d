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

/** Tests of constraints inferred from {@code match} statements over the split token. */
@RunWith(JUnit4.class)
public final class MatchArmsTest {

  // Analyzes do_tag, whose body is the given lines indented one level.
  private static TagRule analyzeBody(String... body) throws SyntaxError.Exception {
    ImmutableList.Builder<String> lines = ImmutableList.builder();
    lines.add("def do_tag(parser, token):");
    for (String line : body) {
      lines.add("    " + line);
    }
    SourceFile file =
        SourceFile.parseOrThrow(
            ParserInput.fromLines(lines.build().toArray(new String[0])), FileOptions.DEFAULT);
    return new TagAnalyzer(file.getFunctions()).analyze(file.getFunction("do_tag"));
  }

  private static Constraint length(ArgumentCountConstraint count) {
    return Constraint.length(count);
  }

  @Test
  public void testStarArmGivesMinimum() throws Exception {
    TagRule rule =
        analyzeBody(
            "match token.split_contents():",
            "    case [_, 'for', x, 'in', *rest]:",
            "        pass",
            "    case _:",
            "        raise TemplateSyntaxError('x')",
            "if len(rest) > 2:",
            "    raise TemplateSyntaxError('too many')");
    assertThat(rule.constraints())
        .isEqualTo(
            ConstraintSet.of(
                length(ArgumentCountConstraint.min(4)), length(ArgumentCountConstraint.max(6))));
    assertThat(rule.extractedArgs().get(1)).isEqualTo(ExtractedArg.variable("x", 1, true));
  }

  @Test
  public void testOrPatternAlternativesMustAgree() throws Exception {
    TagRule rule =
        analyzeBody(
            "match token.split_contents():",
            "    case [_, 'on'] | [_, 'off']:",
            "        pass",
            "    case _:",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints())
        .isEqualTo(ConstraintSet.of(length(ArgumentCountConstraint.exact(2))));
  }

  @Test
  public void testSharedKeyword() throws Exception {
    TagRule rule =
        analyzeBody(
            "match token.split_contents():",
            "    case [_, x, 'as', name]:",
            "        pass",
            "    case [_, x, 'as', name, 'silent']:",
            "        pass",
            "    case _:",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints())
        .isEqualTo(
            ConstraintSet.of(
                length(ArgumentCountConstraint.oneOf(ImmutableList.of(4, 5))),
                Constraint.keyword(SplitPosition.forward(2), "as"),
                Constraint.keyword(SplitPosition.forward(4), "silent")));
    assertThat(rule.supportsAsVar()).isTrue();
  }

  @Test
  public void testContiguousLengthsBecomeRange() throws Exception {
    TagRule rule =
        analyzeBody(
            "match token.split_contents():",
            "    case [_]:",
            "        pass",
            "    case [_, a]:",
            "        pass",
            "    case [_, a, b]:",
            "        pass",
            "    case _:",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints())
        .isEqualTo(
            ConstraintSet.of(
                length(ArgumentCountConstraint.min(1)), length(ArgumentCountConstraint.max(3))));
  }

  @Test
  public void testCatchAllArmAdmitsAnything() throws Exception {
    TagRule rule =
        analyzeBody(
            "match token.split_contents():",
            "    case [_, 'x']:",
            "        pass",
            "    case other:",
            "        pass");
    assertThat(rule.constraints().isEmpty()).isTrue();
  }

  @Test
  public void testUnknownPatternYieldsNothing() throws Exception {
    TagRule rule =
        analyzeBody(
            "match token.split_contents():",
            "    case [_, 'x']:",
            "        pass",
            "    case Foo(a=1):",
            "        pass",
            "    case _:",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints().isEmpty()).isTrue();
  }

  @Test
  public void testUntrackedSubject() throws Exception {
    TagRule rule =
        analyzeBody(
            "match foo:",
            "    case [_, 'x']:",
            "        pass",
            "    case _:",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints().isEmpty()).isTrue();
  }

  @Test
  public void testSubjectAfterPop() throws Exception {
    TagRule rule =
        analyzeBody(
            "bits = token.split_contents()",
            "bits.pop(0)",
            "match bits:",
            "    case ['on']:",
            "        pass",
            "    case _:",
            "        raise TemplateSyntaxError('x')");
    assertThat(rule.constraints())
        .isEqualTo(
            ConstraintSet.of(
                length(ArgumentCountConstraint.exact(2)),
                Constraint.keyword(SplitPosition.forward(1), "on")));
  }
}
