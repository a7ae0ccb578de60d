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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;

/** Tests of parser. */
@RunWith(TestParameterInjector.class)
public final class ParserTest {

  private static Expression parseExpression(String... lines) throws SyntaxError.Exception {
    return Expression.parse(ParserInput.fromLines(lines));
  }

  // Joins the lines, parses, and returns the statements, failing on any error.
  private static ImmutableList<Statement> parseStatements(String... lines)
      throws SyntaxError.Exception {
    return SourceFile.parseOrThrow(ParserInput.fromLines(lines), FileOptions.DEFAULT)
        .getStatements();
  }

  private static Statement parseStatement(String... lines) throws SyntaxError.Exception {
    return Iterables.getOnlyElement(parseStatements(lines));
  }

  private static String parseStatementError(String... lines) {
    SourceFile file = SourceFile.parse(ParserInput.fromLines(lines));
    if (file.ok()) {
      throw new AssertionError("parseStatementError() succeeded unexpectedly");
    }
    return file.errors().get(0).message();
  }

  @Test
  public void testComparison() throws Exception {
    Expression e = parseExpression("len(bits) != 3");
    assertThat(e.kind()).isEqualTo(Expression.Kind.BINARY_OPERATOR);
    BinaryOperatorExpression binop = (BinaryOperatorExpression) e;
    assertThat(binop.getOperator()).isEqualTo(TokenKind.NOT_EQUALS);
    assertThat(binop.isComparison()).isTrue();
    assertThat(binop.getX().kind()).isEqualTo(Expression.Kind.CALL);
    assertThat(((IntLiteral) binop.getY()).getIntValue()).isEqualTo(3);
  }

  @Test
  public void testFormattedStrings() throws Exception {
    StringLiteral fstring = (StringLiteral) parseExpression("f\"end{tag_name}\"");
    assertThat(fstring.getValue()).isEqualTo("end{tag_name}");
    assertThat(fstring.isFormatted()).isTrue();
    assertThat(((StringLiteral) parseExpression("rf'{x}'")).isFormatted()).isTrue();
    assertThat(((StringLiteral) parseExpression("'end' f'{x}'")).isFormatted()).isTrue();
    assertThat(((StringLiteral) parseExpression("'end{x}'")).isFormatted()).isFalse();
  }

  @Test
  public void testMembershipOperators() throws Exception {
    BinaryOperatorExpression notIn =
        (BinaryOperatorExpression) parseExpression("bits[1] not in ('a', 'b')");
    assertThat(notIn.getOperator()).isEqualTo(TokenKind.NOT_IN);
    assertThat(notIn.getX().kind()).isEqualTo(Expression.Kind.INDEX);
    assertThat(((ListExpression) notIn.getY()).isTuple()).isTrue();

    BinaryOperatorExpression isNot = (BinaryOperatorExpression) parseExpression("x is not None");
    assertThat(isNot.getOperator()).isEqualTo(TokenKind.IS_NOT);
  }

  @Test
  public void testChainedComparison() throws Exception {
    Expression e = parseExpression("2 <= len(bits) <= 4");
    assertThat(e.kind()).isEqualTo(Expression.Kind.CHAINED_COMPARISON);
    ChainedComparison chain = (ChainedComparison) e;
    assertThat(chain.getOperands()).hasSize(3);
    assertThat(chain.getOperators())
        .containsExactly(TokenKind.LESS_EQUALS, TokenKind.LESS_EQUALS)
        .inOrder();
  }

  @Test
  public void testPrecedence() throws Exception {
    assertThat(parseExpression("not a and b or c").toString())
        .isEqualTo("(((not a) and b) or c)");
    assertThat(parseExpression("a + b * c").toString()).isEqualTo("(a + (b * c))");
    assertThat(parseExpression("-x ** 2").toString()).isEqualTo("(-(x ** 2))");
  }

  @Test
  public void testNegativeIndex() throws Exception {
    IndexExpression index = (IndexExpression) parseExpression("bits[-1]");
    assertThat(index.getKey().kind()).isEqualTo(Expression.Kind.UNARY_OPERATOR);
    UnaryOperatorExpression minus = (UnaryOperatorExpression) index.getKey();
    assertThat(minus.getOperator()).isEqualTo(TokenKind.MINUS);
    assertThat(((IntLiteral) minus.getX()).getIntValue()).isEqualTo(1);
  }

  @Test
  public void testSlices() throws Exception {
    SliceExpression slice = (SliceExpression) parseExpression("bits[1:-2]");
    assertThat(slice.getStart().toString()).isEqualTo("1");
    assertThat(slice.getStop().toString()).isEqualTo("(-2)");
    assertThat(slice.getStep()).isNull();
    assertThat(parseExpression("bits[::2]").toString()).isEqualTo("bits[::2]");
  }

  @Test
  public void testCallArguments() throws Exception {
    CallExpression call = (CallExpression) parseExpression("f(a, 'b', *rest, key=1, **kw)");
    assertThat(call.getArguments()).hasSize(5);
    assertThat(call.getArguments().get(0)).isInstanceOf(Argument.Positional.class);
    assertThat(call.getArguments().get(2)).isInstanceOf(Argument.Star.class);
    assertThat(call.getArguments().get(3)).isInstanceOf(Argument.Keyword.class);
    assertThat(call.getArguments().get(4)).isInstanceOf(Argument.StarStar.class);
    assertThat(call.getArguments().get(3).getName()).isEqualTo("key");
  }

  @Test
  public void testTupleShapes() throws Exception {
    assertThat(((ListExpression) parseExpression("(a,)")).isTuple()).isTrue();
    assertThat(((ListExpression) parseExpression("[a]")).isTuple()).isFalse();
    assertThat(((ListExpression) parseExpression("{a, b}")).getShape())
        .isEqualTo(ListExpression.Shape.SET);
  }

  @Test
  public void testLambdaAndConditional() throws Exception {
    assertThat(parseExpression("lambda x: x").kind()).isEqualTo(Expression.Kind.LAMBDA);
    assertThat(parseExpression("a if b else c").kind()).isEqualTo(Expression.Kind.CONDITIONAL);
  }

  @Test
  public void testComprehension() throws Exception {
    assertThat(parseExpression("[b for b in bits if b]").kind())
        .isEqualTo(Expression.Kind.COMPREHENSION);
    assertThat(parseExpression("{k: v for k, v in items}").kind())
        .isEqualTo(Expression.Kind.COMPREHENSION);
  }

  @Test
  public void testDefStatement() throws Exception {
    DefStatement def =
        (DefStatement)
            parseStatement(
                "@register.tag(name='foo')",
                "def do_foo(parser, token, *args, limit=3, **kwargs):",
                "    return FooNode()");
    assertThat(def.getName()).isEqualTo("do_foo");
    assertThat(def.getDecorators()).hasSize(1);
    ImmutableList<Parameter> params = def.getParameters();
    assertThat(params).hasSize(5);
    assertThat(params.get(0)).isInstanceOf(Parameter.Mandatory.class);
    assertThat(params.get(2)).isInstanceOf(Parameter.Star.class);
    assertThat(params.get(3)).isInstanceOf(Parameter.Optional.class);
    assertThat(params.get(3).getDefaultValue().toString()).isEqualTo("3");
    assertThat(params.get(4)).isInstanceOf(Parameter.StarStar.class);
    assertThat(params.get(4).getName()).isEqualTo("kwargs");
  }

  @Test
  public void testAsyncDef() throws Exception {
    DefStatement def = (DefStatement) parseStatement("async def f():", "    await g()");
    assertThat(def.isAsync()).isTrue();
  }

  @Test
  public void testIfElifElse() throws Exception {
    IfStatement stmt =
        (IfStatement)
            parseStatement(
                "if len(bits) == 2:",
                "    pass",
                "elif len(bits) == 3:",
                "    pass",
                "else:",
                "    raise TemplateSyntaxError('bad')");
    IfStatement elif = (IfStatement) Iterables.getOnlyElement(stmt.getElseBlock());
    assertThat(elif.isElif()).isTrue();
    RaiseStatement raise = (RaiseStatement) Iterables.getOnlyElement(elif.getElseBlock());
    assertThat(raise.getExceptionName()).isEqualTo("TemplateSyntaxError");
  }

  @Test
  public void testQualifiedRaise() throws Exception {
    RaiseStatement raise =
        (RaiseStatement) parseStatement("raise template.TemplateSyntaxError('x') from err");
    assertThat(raise.getExceptionName()).isEqualTo("TemplateSyntaxError");
    assertThat(raise.getCause()).isNotNull();
  }

  @Test
  public void testAugmentedAssignment() throws Exception {
    AssignmentStatement assign = (AssignmentStatement) parseStatement("i += 1");
    assertThat(assign.getOperator()).isEqualTo(TokenKind.PLUS);
  }

  @Test
  public void testTupleAssignment() throws Exception {
    AssignmentStatement assign =
        (AssignmentStatement) parseStatement("tag_name, *rest = token.split_contents()");
    ListExpression lhs = (ListExpression) assign.getLHS();
    assertThat(lhs.getElements()).hasSize(2);
    assertThat(lhs.getElements().get(1).kind()).isEqualTo(Expression.Kind.STARRED);
  }

  private enum CompoundStatement {
    FOR(Statement.Kind.FOR, "for b in bits:", "    pass", "else:", "    pass"),
    WHILE(Statement.Kind.WHILE, "while bits:", "    bits.pop(0)"),
    TRY(
        Statement.Kind.TRY,
        "try:",
        "    x = 1",
        "except (ValueError, KeyError) as e:",
        "    pass",
        "finally:",
        "    pass"),
    WITH(Statement.Kind.WITH, "with open(f) as fh, g():", "    pass"),
    CLASS(
        Statement.Kind.CLASS,
        "class Node(template.Node):",
        "    def render(self, context):",
        "        return ''"),
    FROM_IMPORT(Statement.Kind.IMPORT, "from django import template"),
    IMPORT(Statement.Kind.IMPORT, "import os.path as p"),
    DEL(Statement.Kind.DEL, "del bits[0], bits[-1]"),
    ASSERT(Statement.Kind.ASSERT, "assert bits, 'msg'"),
    GLOBAL(Statement.Kind.GLOBAL, "global counter");

    final Statement.Kind kind;
    final String[] lines;

    CompoundStatement(Statement.Kind kind, String... lines) {
      this.kind = kind;
      this.lines = lines;
    }
  }

  @Test
  public void testStatementKinds(@TestParameter CompoundStatement stmt) throws Exception {
    assertThat(parseStatement(stmt.lines).kind()).isEqualTo(stmt.kind);
  }

  @Test
  public void testMatchStatement() throws Exception {
    MatchStatement match =
        (MatchStatement)
            parseStatement(
                "match bits:",
                "    case [_, x]:",
                "        pass",
                "    case [_, 'for', *rest] if rest:",
                "        pass",
                "    case ['a'] | ['b']:",
                "        pass",
                "    case _:",
                "        raise TemplateSyntaxError('x')");
    ImmutableList<MatchStatement.Case> cases = match.getCases();
    assertThat(cases).hasSize(4);

    assertThat(cases.get(0).getPattern().toString()).isEqualTo("[_, x]");

    Pattern.Sequence star = (Pattern.Sequence) cases.get(1).getPattern();
    assertThat(star.getStarIndex()).isEqualTo(2);
    assertThat(cases.get(1).getGuard()).isNotNull();

    assertThat(cases.get(2).getPattern().kind()).isEqualTo(Pattern.Kind.OR);

    Pattern.As wildcard = (Pattern.As) cases.get(3).getPattern();
    assertThat(wildcard.isWildcard()).isTrue();
    assertThat(wildcard.isIrrefutable()).isTrue();
  }

  @Test
  public void testOpenSequencePattern() throws Exception {
    MatchStatement match =
        (MatchStatement) parseStatement("match x:", "    case a, b:", "        pass");
    Pattern.Sequence seq = (Pattern.Sequence) match.getCases().get(0).getPattern();
    assertThat(seq.getElements()).hasSize(2);
    assertThat(seq.getStarIndex()).isEqualTo(-1);
  }

  @Test
  public void testMatchAsName() throws Exception {
    ImmutableList<Statement> stmts = parseStatements("match = re.match(p, s)", "match.group(1)");
    assertThat(stmts.get(0).kind()).isEqualTo(Statement.Kind.ASSIGNMENT);
    assertThat(stmts.get(1).kind()).isEqualTo(Statement.Kind.EXPRESSION);
  }

  @Test
  public void testSyntaxErrors() throws Exception {
    assertThat(parseStatementError("def f(:", "    pass")).isNotEmpty();
    SyntaxError.Exception ex =
        assertThrows(SyntaxError.Exception.class, () -> parseExpression("a b"));
    assertThat(ex.errors()).isNotEmpty();
  }

  @Test
  public void testGetFunctions() throws Exception {
    SourceFile file =
        SourceFile.parseOrThrow(
            ParserInput.fromLines(
                "import x",
                "def helper(bits):",
                "    return bits",
                "def do_tag(parser, token):",
                "    return helper(token.split_contents())"),
            FileOptions.DEFAULT);
    assertThat(file.getFunctions()).hasSize(2);
    assertThat(file.getFunction("do_tag").getParameters()).hasSize(2);
    assertThat(file.getFunction("missing")).isNull();
  }
}
