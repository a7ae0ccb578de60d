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
import com.google.common.collect.ImmutableMap;
import net.djls.java.syntax.CallExpression;
import net.djls.java.syntax.Expression;
import net.djls.java.syntax.ParserInput;
import net.djls.java.syntax.SyntaxError;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the abstract evaluation of expressions. */
@RunWith(JUnit4.class)
public final class ExpressionEvaluatorTest {

  private AnalysisContext ctx;

  @Before
  public void setUp() {
    ctx =
        new AnalysisContext(
            Environment.forTagFunction("parser", "token"),
            AnalysisOptions.DEFAULT,
            new HelperCallResolver(ImmutableMap.of()),
            "do_tag",
            0);
    ctx.env().bind("bits", AbstractValue.freshSplit());
  }

  private AbstractValue eval(String src) throws SyntaxError.Exception {
    return ExpressionEvaluator.eval(ctx, Expression.parse(ParserInput.fromLines(src)));
  }

  private static AbstractValue element(SplitPosition position) {
    return AbstractValue.splitElement(position);
  }

  @Test
  public void testSplitSources() throws Exception {
    assertThat(eval("token.split_contents()")).isEqualTo(AbstractValue.freshSplit());
    assertThat(eval("parser.token.split_contents()")).isEqualTo(AbstractValue.freshSplit());
    assertThat(eval("token.contents.split()")).isEqualTo(AbstractValue.freshSplit());
    assertThat(eval("token.contents.split(None, 1)"))
        .isEqualTo(
            AbstractValue.tuple(
                ImmutableList.of(element(SplitPosition.forward(0)), AbstractValue.UNKNOWN)));
    assertThat(eval("other.split_contents()")).isEqualTo(AbstractValue.UNKNOWN);
    assertThat(eval("token.split_contents(1)")).isEqualTo(AbstractValue.UNKNOWN);
  }

  @Test
  public void testIndices() throws Exception {
    assertThat(eval("bits[2]")).isEqualTo(element(SplitPosition.forward(2)));
    assertThat(eval("bits[-1]")).isEqualTo(element(SplitPosition.backward(1)));
    assertThat(eval("bits[i]")).isEqualTo(AbstractValue.UNKNOWN);
    ctx.env().update("bits", AbstractValue.splitResult(SplitOffsets.of(1, 2)));
    assertThat(eval("bits[0]")).isEqualTo(element(SplitPosition.forward(1)));
    assertThat(eval("bits[-1]")).isEqualTo(element(SplitPosition.backward(3)));
  }

  @Test
  public void testSlices() throws Exception {
    assertThat(eval("bits[1:]"))
        .isEqualTo(AbstractValue.splitResult(SplitOffsets.of(1, 0)));
    assertThat(eval("bits[1:-1]"))
        .isEqualTo(AbstractValue.splitResult(SplitOffsets.of(1, 1)));
    assertThat(eval("bits[:2]")).isEqualTo(AbstractValue.UNKNOWN);
    assertThat(eval("bits[-2:]")).isEqualTo(AbstractValue.UNKNOWN);
    assertThat(eval("bits[::2]")).isEqualTo(AbstractValue.UNKNOWN);
  }

  @Test
  public void testLengths() throws Exception {
    assertThat(eval("len(bits)")).isEqualTo(AbstractValue.splitLength(SplitOffsets.fresh()));
    assertThat(eval("len(bits[2:])"))
        .isEqualTo(AbstractValue.splitLength(SplitOffsets.of(2, 0)));
    assertThat(eval("len(('a', 'b'))")).isEqualTo(AbstractValue.intLiteral(2));
    assertThat(eval("len(x)")).isEqualTo(AbstractValue.UNKNOWN);
  }

  @Test
  public void testCopiesKeepTheSplit() throws Exception {
    assertThat(eval("list(bits)")).isEqualTo(AbstractValue.freshSplit());
    assertThat(eval("tuple(bits[1:])"))
        .isEqualTo(AbstractValue.splitResult(SplitOffsets.of(1, 0)));
  }

  @Test
  public void testLiterals() throws Exception {
    assertThat(eval("-3")).isEqualTo(AbstractValue.intLiteral(-3));
    assertThat(eval("'as'")).isEqualTo(AbstractValue.strLiteral("as"));
    assertThat(eval("('a', 1)"))
        .isEqualTo(
            AbstractValue.tuple(
                ImmutableList.of(AbstractValue.strLiteral("a"), AbstractValue.intLiteral(1))));
    assertThat(eval("['a']"))
        .isEqualTo(AbstractValue.listOf(ImmutableList.of(AbstractValue.strLiteral("a"))));
    assertThat(eval("{'a'}"))
        .isEqualTo(AbstractValue.listOf(ImmutableList.of(AbstractValue.strLiteral("a"))));
    assertThat(eval("[a, *b]")).isEqualTo(AbstractValue.UNKNOWN);
    assertThat(eval("1.5")).isEqualTo(AbstractValue.UNKNOWN);
  }

  @Test
  public void testPopValues() throws Exception {
    assertThat(eval("bits.pop(0)")).isEqualTo(element(SplitPosition.forward(0)));
    assertThat(eval("bits.pop()")).isEqualTo(element(SplitPosition.backward(1)));
    assertThat(eval("bits.pop(-1)")).isEqualTo(element(SplitPosition.backward(1)));
    assertThat(eval("bits.pop(2)")).isEqualTo(AbstractValue.UNKNOWN);
    // Evaluation alone does not consume the element.
    assertThat(ctx.env().lookup("bits")).isEqualTo(AbstractValue.freshSplit());
  }

  @Test
  public void testPopKind() throws Exception {
    assertThat(ExpressionEvaluator.popKind(ctx, call("bits.pop()")))
        .isEqualTo(ExpressionEvaluator.PopKind.BACK);
    assertThat(ExpressionEvaluator.popKind(ctx, call("bits.pop(0)")))
        .isEqualTo(ExpressionEvaluator.PopKind.FRONT);
    assertThat(ExpressionEvaluator.popKind(ctx, call("bits.pop(1)")))
        .isEqualTo(ExpressionEvaluator.PopKind.OTHER);
  }

  @Test
  public void testUnknownCalls() throws Exception {
    assertThat(eval("parser.compile_filter(bits[1])")).isEqualTo(AbstractValue.UNKNOWN);
    assertThat(eval("helper(bits)")).isEqualTo(AbstractValue.UNKNOWN);
    assertThat(eval("a if b else c")).isEqualTo(AbstractValue.UNKNOWN);
  }

  private static CallExpression call(String src) throws SyntaxError.Exception {
    return (CallExpression) Expression.parse(ParserInput.fromLines(src));
  }
}
