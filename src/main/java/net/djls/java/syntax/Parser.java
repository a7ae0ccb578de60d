// Copyright 2014 The Bazel Authors. All rights reserved.
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

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** Parser is a recursive-descent parser for the Python subset found in template tag libraries. */
final class Parser {

  private static final EnumSet<TokenKind> STATEMENT_TERMINATOR_SET =
      EnumSet.of(TokenKind.EOF, TokenKind.NEWLINE, TokenKind.SEMI);

  private static final EnumSet<TokenKind> LIST_TERMINATOR_SET =
      EnumSet.of(TokenKind.EOF, TokenKind.RBRACKET, TokenKind.SEMI);

  private static final EnumSet<TokenKind> DICT_TERMINATOR_SET =
      EnumSet.of(TokenKind.EOF, TokenKind.RBRACE, TokenKind.SEMI);

  private static final EnumSet<TokenKind> EXPR_LIST_TERMINATOR_SET =
      EnumSet.of(
          TokenKind.EOF,
          TokenKind.NEWLINE,
          TokenKind.COLON,
          TokenKind.EQUALS,
          TokenKind.IN,
          TokenKind.RBRACE,
          TokenKind.RBRACKET,
          TokenKind.RPAREN,
          TokenKind.SEMI);

  private static final EnumSet<TokenKind> EXPR_TERMINATOR_SET =
      EnumSet.of(
          TokenKind.COLON,
          TokenKind.COMMA,
          TokenKind.EOF,
          TokenKind.FOR,
          TokenKind.MINUS,
          TokenKind.NEWLINE,
          TokenKind.PERCENT,
          TokenKind.PLUS,
          TokenKind.RBRACKET,
          TokenKind.RPAREN,
          TokenKind.SLASH);

  /** Current lookahead token. May be mutated by the parser. */
  private final Lexer token; // token.kind is a prettier alias for lexer.kind

  private final FileOptions options;

  private final Lexer lexer;
  private final FileLocations locs;
  private final List<SyntaxError> errors;

  private static final Map<TokenKind, TokenKind> augmentedAssignments =
      new ImmutableMap.Builder<TokenKind, TokenKind>()
          .put(TokenKind.PLUS_EQUALS, TokenKind.PLUS)
          .put(TokenKind.MINUS_EQUALS, TokenKind.MINUS)
          .put(TokenKind.STAR_EQUALS, TokenKind.STAR)
          .put(TokenKind.STAR_STAR_EQUALS, TokenKind.STAR_STAR)
          .put(TokenKind.SLASH_EQUALS, TokenKind.SLASH)
          .put(TokenKind.SLASH_SLASH_EQUALS, TokenKind.SLASH_SLASH)
          .put(TokenKind.PERCENT_EQUALS, TokenKind.PERCENT)
          .put(TokenKind.AMPERSAND_EQUALS, TokenKind.AMPERSAND)
          .put(TokenKind.AT_EQUALS, TokenKind.AT)
          .put(TokenKind.CARET_EQUALS, TokenKind.CARET)
          .put(TokenKind.PIPE_EQUALS, TokenKind.PIPE)
          .put(TokenKind.GREATER_GREATER_EQUALS, TokenKind.GREATER_GREATER)
          .put(TokenKind.LESS_LESS_EQUALS, TokenKind.LESS_LESS)
          .buildOrThrow();

  /**
   * Highest precedence goes last. Based on:
   * https://docs.python.org/3/reference/expressions.html#operator-precedence
   *
   * <p>Unary {@code + - ~}, {@code **} and {@code await} bind tighter than all of these and are
   * handled by {@link #parseFactor}.
   */
  private static final List<EnumSet<TokenKind>> operatorPrecedence =
      ImmutableList.of(
          EnumSet.of(TokenKind.OR),
          EnumSet.of(TokenKind.AND),
          EnumSet.of(TokenKind.NOT),
          EnumSet.of(
              TokenKind.EQUALS_EQUALS,
              TokenKind.NOT_EQUALS,
              TokenKind.LESS,
              TokenKind.LESS_EQUALS,
              TokenKind.GREATER,
              TokenKind.GREATER_EQUALS,
              TokenKind.IN,
              TokenKind.NOT_IN,
              TokenKind.IS,
              TokenKind.IS_NOT),
          EnumSet.of(TokenKind.PIPE),
          EnumSet.of(TokenKind.CARET),
          EnumSet.of(TokenKind.AMPERSAND),
          EnumSet.of(TokenKind.GREATER_GREATER, TokenKind.LESS_LESS),
          EnumSet.of(TokenKind.MINUS, TokenKind.PLUS),
          EnumSet.of(
              TokenKind.SLASH,
              TokenKind.SLASH_SLASH,
              TokenKind.STAR,
              TokenKind.AT,
              TokenKind.PERCENT));

  // Index of the comparison operators in operatorPrecedence.
  private static final int COMPARISON_PRECEDENCE = 3;

  // Index of '|' in operatorPrecedence; a starred expression '*x' binds at this level.
  private static final int BITWISE_OR_PRECEDENCE = 4;

  private int errorsCount;
  private boolean recoveryMode; // stop reporting errors until next statement

  // Intern string literals, as some files contain many literals for the same string.
  private final Map<String, String> stringInterner = new HashMap<>();

  private Parser(Lexer lexer, List<SyntaxError> errors, FileOptions options) {
    this.lexer = lexer;
    this.locs = lexer.locs;
    this.errors = errors;
    this.token = lexer;
    this.options = options;
    nextToken();
  }

  private String intern(String s) {
    String prev = stringInterner.putIfAbsent(s, s);
    return prev != null ? prev : s;
  }

  // Returns a token's string form as used in error messages.
  private static String tokenString(TokenKind kind, @Nullable Object value) {
    return kind == TokenKind.STRING
        ? "\"" + value + "\""
        : value == null ? kind.toString() : value.toString();
  }

  // Main entry point for parsing a file.
  static SourceFile parseFile(ParserInput input, FileOptions options) {
    List<SyntaxError> errors = new ArrayList<>();
    Lexer lexer = new Lexer(input, options, errors);
    Parser parser = new Parser(lexer, errors, options);
    ImmutableList<Statement> statements = parser.parseFileInput();
    return SourceFile.create(lexer.locs, statements, options, errors);
  }

  // stmt = simple_stmt
  //      | def_stmt | class_stmt | decorated
  //      | if_stmt | for_stmt | while_stmt | try_stmt | with_stmt | match_stmt
  //      | ASYNC (def_stmt | for_stmt | with_stmt)
  private void parseStatement(ImmutableList.Builder<Statement> list) {
    switch (token.kind) {
      case DEF:
        list.add(parseDefStatement(ImmutableList.of(), /* isAsync= */ false));
        break;
      case CLASS:
        list.add(parseClassStatement(ImmutableList.of()));
        break;
      case AT:
        list.add(parseDecorated());
        break;
      case IF:
        list.add(parseIfStatement());
        break;
      case FOR:
        list.add(parseForStatement());
        break;
      case WHILE:
        list.add(parseWhileStatement());
        break;
      case TRY:
        list.add(parseTryStatement());
        break;
      case WITH:
        list.add(parseWithStatement());
        break;
      case MATCH:
        list.add(parseMatchStatement());
        break;
      case ASYNC:
        nextToken();
        if (token.kind == TokenKind.DEF) {
          list.add(parseDefStatement(ImmutableList.of(), /* isAsync= */ true));
        } else if (token.kind == TokenKind.FOR) {
          list.add(parseForStatement());
        } else if (token.kind == TokenKind.WITH) {
          list.add(parseWithStatement());
        } else {
          syntaxError("expected 'def', 'for' or 'with' after 'async'");
          parseSimpleStatement(list);
        }
        break;
      default:
        parseSimpleStatement(list);
    }
  }

  /** Parses an expression, possibly followed by newlines. */
  static Expression parseExpression(ParserInput input, FileOptions options)
      throws SyntaxError.Exception {
    List<SyntaxError> errors = new ArrayList<>();
    Lexer lexer = new Lexer(input, options, errors);
    Parser parser = new Parser(lexer, errors, options);
    Expression result = null;
    try {
      result = parser.parseExpr();
      while (parser.token.kind == TokenKind.NEWLINE) {
        parser.nextToken();
      }
      parser.expect(TokenKind.EOF);
    } catch (StackOverflowError ex) {
      // See rationale at parseFileInput.
      parser.reportError(
          lexer.end,
          "internal error: stack overflow while parsing Python expression <<%s>>.\n%s",
          new String(input.getContent()),
          Throwables.getStackTraceAsString(ex));
    }
    if (!errors.isEmpty()) {
      throw new SyntaxError.Exception(errors);
    }
    return result;
  }

  // Parses every kind of expression, including unparenthesized tuples and starred elements.
  //
  // In Python the corresponding grammar production is called `star_expressions`.
  //
  // In many cases we need to use parseTest() in place of parseExpr() to avoid ambiguity, e.g.:
  //
  //   f(x, y)  vs  f((x, y))
  private Expression parseExpr() {
    Expression e = parseTestOrStar();
    if (token.kind != TokenKind.COMMA) {
      return e;
    }

    // unparenthesized tuple
    ImmutableList.Builder<Expression> elems = ImmutableList.builder();
    elems.add(e);
    parseExprList(elems);
    return new ListExpression(locs, ListExpression.Shape.TUPLE, -1, elems.build(), -1);
  }

  // yield_or_expr = yield_expr | expr
  private Expression parseYieldOrExpr() {
    return token.kind == TokenKind.YIELD ? parseYield() : parseExpr();
  }

  // yield_expr = YIELD [FROM test | expr]
  private Expression parseYield() {
    int yieldOffset = expect(TokenKind.YIELD);
    if (token.kind == TokenKind.FROM) {
      nextToken();
      return new YieldExpression(locs, yieldOffset, /* isFrom= */ true, parseTest());
    }
    Expression value = null;
    if (!EXPR_LIST_TERMINATOR_SET.contains(token.kind)) {
      value = parseExpr();
    }
    return new YieldExpression(locs, yieldOffset, /* isFrom= */ false, value);
  }

  @FormatMethod
  private void reportError(int offset, String format, Object... args) {
    errorsCount++;
    // Limit the number of reported errors to avoid spamming output.
    if (errorsCount <= 5) {
      Location location = locs.getLocation(offset);
      errors.add(new SyntaxError(location, String.format(format, args)));
    }
  }

  private void syntaxError(String message) {
    syntaxError(token.start, token.kind, token.value, message);
  }

  private void syntaxError(int offset, TokenKind tokenKind, Object tokenValue, String message) {
    if (!recoveryMode) {
      if (tokenKind == TokenKind.INDENT) {
        reportError(offset, "indentation error");
      } else {
        reportError(
            offset, "syntax error at '%s': %s", tokenString(tokenKind, tokenValue), message);
      }
      recoveryMode = true;
    }
  }

  // Consumes the current token and returns its position, like nextToken.
  // Reports a syntax error if the new token is not of the expected kind.
  private int expect(TokenKind kind) {
    if (token.kind != kind) {
      syntaxError("expected " + kind);
    }
    return nextToken();
  }

  // Like expect, but stops recovery mode if the token was expected.
  private int expectAndRecover(TokenKind kind) {
    if (token.kind != kind) {
      syntaxError("expected " + kind);
    } else {
      recoveryMode = false;
    }
    return nextToken();
  }

  // Consumes tokens past the first token belonging to terminatingTokens.
  // It returns the end offset of the terminating token.
  private int syncPast(EnumSet<TokenKind> terminatingTokens) {
    Preconditions.checkState(terminatingTokens.contains(TokenKind.EOF));
    while (!terminatingTokens.contains(token.kind)) {
      nextToken();
    }
    int end = token.end;
    // read past the synchronization token
    nextToken();
    return end;
  }

  /**
   * Consume tokens until we reach the first token that has a kind that is in the set of
   * terminatingTokens.
   *
   * @return the end offset of the terminating token.
   */
  private int syncTo(EnumSet<TokenKind> terminatingTokens) {
    // EOF must be in the set to prevent an infinite loop
    Preconditions.checkState(terminatingTokens.contains(TokenKind.EOF));
    // read past the problematic token
    int previous = token.end;
    nextToken();
    int current = previous;
    while (!terminatingTokens.contains(token.kind)) {
      nextToken();
      previous = current;
      current = token.end;
    }
    return previous;
  }

  private int nextToken() {
    int prev = token.start;
    if (token.kind != TokenKind.EOF) {
      lexer.nextToken();
    }
    return prev;
  }

  // Returns an "Identifier" whose content is the input from start to end.
  private Identifier makeErrorExpression(int start, int end) {
    // It's tempting to define a dedicated BadExpression type,
    // but it is convenient for parseIdent to return an Identifier
    // even when it fails.
    return new Identifier(locs, lexer.bufferSlice(start, end), start);
  }

  // arg = IDENTIFIER '=' test
  //     | test
  //     | *args
  //     | **kwargs
  private Argument parseArgument() {
    Expression expr;

    // parse **expr
    if (token.kind == TokenKind.STAR_STAR) {
      int starStarOffset = nextToken();
      expr = parseTest();
      return new Argument.StarStar(locs, starStarOffset, expr);
    }

    // parse *expr
    if (token.kind == TokenKind.STAR) {
      int starOffset = nextToken();
      expr = parseTest();
      return new Argument.Star(locs, starOffset, expr);
    }

    // IDENTIFIER  or  IDENTIFIER = test
    expr = parseTest();
    if (expr instanceof Identifier id) {
      // parse a named argument
      if (token.kind == TokenKind.EQUALS) {
        nextToken();
        Expression arg = parseTest();
        return new Argument.Keyword(locs, id, arg);
      }
    }

    // parse a positional argument
    return new Argument.Positional(locs, expr);
  }

  // param = IDENTIFIER [':' test] [ '=' test ]
  //       | * [IDENTIFIER [':' test]]
  //       | ** IDENTIFIER [':' test]
  // Type annotations are only available on def statements (not lambdas)
  private Parameter parseParameter(boolean defStatement) {
    Expression type = null;

    // **kwargs
    if (token.kind == TokenKind.STAR_STAR) {
      int starStarOffset = nextToken();
      Identifier id = parseIdent();
      if (defStatement) {
        type = maybeParseTypeAnnotationAfter(TokenKind.COLON);
      }
      return new Parameter.StarStar(locs, starStarOffset, id, type);
    }

    // * or *args
    if (token.kind == TokenKind.STAR) {
      int starOffset = nextToken();
      if (token.kind == TokenKind.IDENTIFIER) {
        Identifier id = parseIdent();
        if (defStatement) {
          type = maybeParseTypeAnnotationAfter(TokenKind.COLON);
        }
        return new Parameter.Star(locs, starOffset, id, type);
      }
      return new Parameter.Star(locs, starOffset, null, null);
    }

    // name
    Identifier id = parseIdent();

    // name: type
    if (defStatement) {
      type = maybeParseTypeAnnotationAfter(TokenKind.COLON);
    }

    // name=default
    if (token.kind == TokenKind.EQUALS) {
      nextToken();
      Expression expr = parseTest();
      return new Parameter.Optional(locs, id, type, expr);
    }

    return new Parameter.Mandatory(locs, id, type);
  }

  @Nullable
  private Expression maybeParseTypeAnnotationAfter(TokenKind expectedToken) {
    if (token.kind == expectedToken) {
      nextToken();
      return parseTest();
    }
    return null;
  }

  // call_suffix = '(' arg_list? ')'
  private Expression parseCallSuffix(Expression fn) {
    ImmutableList<Argument> args = ImmutableList.of();
    expect(TokenKind.LPAREN);
    if (token.kind != TokenKind.RPAREN) {
      args = parseArguments(); // (includes optional trailing comma)
    }
    int rparenOffset = expect(TokenKind.RPAREN);
    return new CallExpression(locs, fn, args, rparenOffset);
  }

  // Parse a list of call arguments.
  //
  // arg_list = ( (arg ',')* arg ','? )?
  //          | test comprehension_clauses      // f(x for x in y)
  private ImmutableList<Argument> parseArguments() {
    boolean seenArg = false;
    ImmutableList.Builder<Argument> list = ImmutableList.builder();
    while (token.kind != TokenKind.RPAREN && token.kind != TokenKind.EOF) {
      if (seenArg) {
        expect(TokenKind.COMMA);
        // If nonempty, the list may end with a comma.
        if (token.kind == TokenKind.RPAREN) {
          break;
        }
      }
      Argument arg = parseArgument();
      if (!seenArg && token.kind == TokenKind.FOR && arg instanceof Argument.Positional) {
        // sole generator-expression argument; the call's parens delimit it
        Expression body = arg.getValue();
        ImmutableList<Comprehension.Clause> clauses = parseComprehensionClauses(TokenKind.RPAREN);
        return ImmutableList.of(
            new Argument.Positional(
                locs,
                new Comprehension(
                    locs,
                    Comprehension.Shape.GENERATOR,
                    body.getStartOffset(),
                    body,
                    clauses,
                    token.start - 1)));
      }
      list.add(arg);
      seenArg = true;
    }
    return list.build();
  }

  // selector_suffix = '.' IDENTIFIER
  private Expression parseSelectorSuffix(Expression e) {
    int dotOffset = expect(TokenKind.DOT);
    if (token.kind == TokenKind.IDENTIFIER) {
      Identifier id = parseIdent();
      return new DotExpression(locs, e, dotOffset, id);
    }

    syntaxError("expected identifier after dot");
    syncTo(EXPR_TERMINATOR_SET);
    return e;
  }

  // expr_list parses a comma-separated list of expression. It assumes that the
  // first expression was already parsed, so it starts with a comma.
  // It is used to parse tuples and list elements.
  //
  // expr_list = ( ',' test_or_star )* ','?
  private void parseExprList(ImmutableList.Builder<Expression> list) {
    //  terminating tokens for an expression list
    while (token.kind == TokenKind.COMMA) {
      expect(TokenKind.COMMA);
      if (EXPR_LIST_TERMINATOR_SET.contains(token.kind)) {
        break;
      }
      list.add(parseTestOrStar());
    }
  }

  // dict_entry_list = ( (dict_entry ',')* dict_entry ','? )?
  private List<DictExpression.Entry> parseDictEntryList() {
    ImmutableList.Builder<DictExpression.Entry> list = ImmutableList.builder();
    // the terminating token for a dict entry list
    while (token.kind != TokenKind.RBRACE && token.kind != TokenKind.EOF) {
      list.add(parseDictEntry());
      if (token.kind == TokenKind.COMMA) {
        nextToken();
      } else {
        break;
      }
    }
    return list.build();
  }

  // dict_entry = test ':' test
  //            | '**' test
  private DictExpression.Entry parseDictEntry() {
    if (token.kind == TokenKind.STAR_STAR) {
      int starStarOffset = nextToken();
      Expression value = parseTest(BITWISE_OR_PRECEDENCE);
      return new DictExpression.Entry(locs, null, starStarOffset, value);
    }
    Expression key = parseTest();
    int colonOffset = expect(TokenKind.COLON);
    Expression value = parseTest();
    return new DictExpression.Entry(locs, key, colonOffset, value);
  }

  // expr = STRING+
  private StringLiteral parseStringLiteral() {
    Preconditions.checkState(token.kind == TokenKind.STRING);
    int start = token.start;
    String value = (String) token.value;
    boolean formatted = isFormatted(token.raw);
    int end = token.end;
    nextToken();
    // implicit concatenation: "abc" "def"
    if (token.kind == TokenKind.STRING) {
      StringBuilder buf = new StringBuilder(value);
      while (token.kind == TokenKind.STRING) {
        buf.append((String) token.value);
        formatted |= isFormatted(token.raw);
        end = token.end;
        nextToken();
      }
      value = buf.toString();
    }
    return new StringLiteral(locs, start, intern(value), formatted, end);
  }

  // Reports whether the source text of a string token has an f prefix.
  private static boolean isFormatted(String raw) {
    for (int i = 0; i < raw.length() && raw.charAt(i) != '\'' && raw.charAt(i) != '"'; i++) {
      if (raw.charAt(i) == 'f' || raw.charAt(i) == 'F') {
        return true;
      }
    }
    return false;
  }

  //  primary = INT
  //          | FLOAT
  //          | STRING+
  //          | IDENTIFIER
  //          | '...'
  //          | list_expression
  //          | '(' ')'                    // a tuple with zero elements
  //          | '(' expr ')'               // a parenthesized expression
  //          | '(' yield_expr ')'
  //          | '(' test comprehension_suffix ')'
  //          | dict_or_set_expression
  private Expression parsePrimary() {
    switch (token.kind) {
      case INT:
        {
          IntLiteral literal = new IntLiteral(locs, token.raw, token.start, (Number) token.value);
          nextToken();
          return literal;
        }

      case FLOAT:
        {
          FloatLiteral literal =
              new FloatLiteral(locs, token.raw, token.start, (double) token.value);
          nextToken();
          return literal;
        }

      case STRING:
        return parseStringLiteral();

      case IDENTIFIER:
        return parseIdent();

      case ELLIPSIS:
        return new Ellipsis(locs, nextToken());

      case LBRACKET: // [...]
        return parseListMaker();

      case LBRACE: // {...}
        return parseDictOrSetExpression();

      case LPAREN:
        {
          int lparenOffset = nextToken();

          // empty tuple: ()
          if (token.kind == TokenKind.RPAREN) {
            int rparen = nextToken();
            return new ListExpression(
                locs, ListExpression.Shape.TUPLE, lparenOffset, ImmutableList.of(), rparen);
          }

          // (yield x)
          if (token.kind == TokenKind.YIELD) {
            Expression e = parseYield();
            expect(TokenKind.RPAREN);
            return e;
          }

          Expression e = parseTestOrStar();

          // parenthesized expression: (e)
          if (token.kind == TokenKind.RPAREN) {
            nextToken();
            return e;
          }

          // non-empty tuple: (e,) or (e, ..., e)
          if (token.kind == TokenKind.COMMA) {
            ImmutableList.Builder<Expression> elems = ImmutableList.builder();
            elems.add(e);
            parseExprList(elems);
            int rparenOffset = expect(TokenKind.RPAREN);
            return new ListExpression(
                locs, ListExpression.Shape.TUPLE, lparenOffset, elems.build(), rparenOffset);
          }

          // (expr for vars in expr), a generator expression
          if (token.kind == TokenKind.FOR) {
            return parseComprehensionSuffix(
                lparenOffset, e, TokenKind.RPAREN, Comprehension.Shape.GENERATOR);
          }

          expect(TokenKind.RPAREN);
          int end = syncTo(EXPR_TERMINATOR_SET);
          return makeErrorExpression(lparenOffset, end);
        }

      default:
        {
          int start = token.start;
          syntaxError("expected expression");
          int end = syncTo(EXPR_TERMINATOR_SET);
          return makeErrorExpression(start, end);
        }
    }
  }

  // primary_with_suffix = primary (selector_suffix | slice_suffix | call_suffix)*
  private Expression parsePrimaryWithSuffix() {
    Expression e = parsePrimary();
    while (true) {
      if (token.kind == TokenKind.DOT) {
        e = parseSelectorSuffix(e);
      } else if (token.kind == TokenKind.LBRACKET) {
        e = parseSliceSuffix(e);
      } else if (token.kind == TokenKind.LPAREN) {
        e = parseCallSuffix(e);
      } else {
        return e;
      }
    }
  }

  // factor = ('+' | '-' | '~') factor
  //        | power
  // power  = [AWAIT] primary_with_suffix ['**' factor]
  private Expression parseFactor() {
    if (token.kind == TokenKind.MINUS
        || token.kind == TokenKind.PLUS
        || token.kind == TokenKind.TILDE) {
      TokenKind op = token.kind;
      int offset = nextToken();
      Expression x = parseFactor();
      return new UnaryOperatorExpression(locs, op, offset, x);
    }
    Expression x;
    if (token.kind == TokenKind.AWAIT) {
      int awaitOffset = nextToken();
      x = new AwaitExpression(locs, awaitOffset, parsePrimaryWithSuffix());
    } else {
      x = parsePrimaryWithSuffix();
    }
    if (token.kind == TokenKind.STAR_STAR) {
      // right-associative, and binds tighter than a unary operator on its left
      int opOffset = nextToken();
      Expression y = parseFactor();
      return new BinaryOperatorExpression(locs, x, TokenKind.STAR_STAR, opOffset, y);
    }
    return x;
  }

  // slice_suffix = '[' expr? ':' expr?  ':' expr? ']'
  //              | '[' expr? ':' expr? ']'
  //              | '[' expr ']'
  private Expression parseSliceSuffix(Expression e) {
    int lbracketOffset = expect(TokenKind.LBRACKET);
    Expression start = null;
    Expression end = null;
    Expression step = null;

    if (token.kind != TokenKind.COLON) {
      start = parseExpr();

      // index x[i]
      if (token.kind == TokenKind.RBRACKET) {
        int rbracketOffset = expect(TokenKind.RBRACKET);
        return new IndexExpression(locs, e, lbracketOffset, start, rbracketOffset);
      }
    }

    // slice or substring x[i:j] or x[i:j:k]
    expect(TokenKind.COLON);
    if (token.kind != TokenKind.COLON && token.kind != TokenKind.RBRACKET) {
      end = parseTest();
    }
    if (token.kind == TokenKind.COLON) {
      expect(TokenKind.COLON);
      if (token.kind != TokenKind.RBRACKET) {
        step = parseTest();
      }
    }
    int rbracketOffset = expect(TokenKind.RBRACKET);
    return new SliceExpression(locs, e, lbracketOffset, start, end, step, rbracketOffset);
  }

  // Equivalent to 'exprlist' rule in Python grammar.
  // loop_variables = loop_variable ( ',' loop_variable )* ','?
  // loop_variable = ['*'] primary_with_suffix
  private Expression parseForLoopVariables() {
    // We cannot reuse parseExpr because it would parse the 'in' operator.
    // e.g.  "for i in e: pass"  -> we want to parse only "i" here.
    Expression e1 = parseForLoopVariable();
    if (token.kind != TokenKind.COMMA) {
      return e1;
    }

    // unparenthesized tuple
    ImmutableList.Builder<Expression> elems = ImmutableList.builder();
    elems.add(e1);
    while (token.kind == TokenKind.COMMA) {
      expect(TokenKind.COMMA);
      if (EXPR_LIST_TERMINATOR_SET.contains(token.kind)) {
        break;
      }
      elems.add(parseForLoopVariable());
    }
    return new ListExpression(locs, ListExpression.Shape.TUPLE, -1, elems.build(), -1);
  }

  private Expression parseForLoopVariable() {
    if (token.kind == TokenKind.STAR) {
      int starOffset = nextToken();
      return new StarredExpression(locs, starOffset, parsePrimaryWithSuffix());
    }
    return parsePrimaryWithSuffix();
  }

  // comprehension_suffix = comprehension_clauses closing_bracket
  private Expression parseComprehensionSuffix(
      int loffset, Node body, TokenKind closingBracket, Comprehension.Shape shape) {
    ImmutableList<Comprehension.Clause> clauses = parseComprehensionClauses(closingBracket);
    if (token.kind != closingBracket) {
      int end = syncPast(LIST_TERMINATOR_SET);
      return makeErrorExpression(loffset, end);
    }
    int roffset = expect(closingBracket);
    return new Comprehension(locs, shape, loffset, body, clauses, roffset);
  }

  // comprehension_clauses = (ASYNC? 'FOR' loop_variables 'IN' test_no_cond
  //                          | 'IF' test_no_cond)+
  private ImmutableList<Comprehension.Clause> parseComprehensionClauses(TokenKind closingBracket) {
    ImmutableList.Builder<Comprehension.Clause> clauses = ImmutableList.builder();
    while (true) {
      if (token.kind == TokenKind.ASYNC) {
        nextToken();
      }
      if (token.kind == TokenKind.FOR) {
        int forOffset = nextToken();
        Expression vars = parseForLoopVariables();
        expect(TokenKind.IN);
        // The expression cannot be a ternary expression ('x if y else z') due to
        // conflicts in Python grammar ('if' is used by the comprehension).
        Expression seq = parseTest(0);
        clauses.add(new Comprehension.For(locs, forOffset, vars, seq));
      } else if (token.kind == TokenKind.IF) {
        int ifOffset = nextToken();
        // [x for x in li if 1, 2]  # parse error
        // [x for x in li if (1, 2)]  # ok
        Expression cond = parseTestNoCond();
        clauses.add(new Comprehension.If(locs, ifOffset, cond));
      } else if (token.kind == closingBracket) {
        break;
      } else {
        syntaxError("expected '" + closingBracket + "', 'for' or 'if'");
        break;
      }
    }
    return clauses.build();
  }

  // list_maker = '[' ']'
  //            | '[' expr ']'
  //            | '[' expr expr_list ']'
  //            | '[' expr comprehension_suffix ']'
  private Expression parseListMaker() {
    int lbracketOffset = expect(TokenKind.LBRACKET);
    if (token.kind == TokenKind.RBRACKET) { // empty List
      int rbracketOffset = nextToken();
      return new ListExpression(
          locs, ListExpression.Shape.LIST, lbracketOffset, ImmutableList.of(), rbracketOffset);
    }

    Expression expression = parseTestOrStar();
    switch (token.kind) {
      case RBRACKET:
        // [e], singleton list
        {
          int rbracketOffset = nextToken();
          return new ListExpression(
              locs,
              ListExpression.Shape.LIST,
              lbracketOffset,
              ImmutableList.of(expression),
              rbracketOffset);
        }

      case FOR:
      case ASYNC:
        // [e for x in y], list comprehension
        return parseComprehensionSuffix(
            lbracketOffset, expression, TokenKind.RBRACKET, Comprehension.Shape.LIST);

      case COMMA:
        // [e, ...], list expression
        {
          ImmutableList.Builder<Expression> elems = ImmutableList.builder();
          elems.add(expression);
          parseExprList(elems);
          if (token.kind == TokenKind.RBRACKET) {
            int rbracketOffset = nextToken();
            return new ListExpression(
                locs, ListExpression.Shape.LIST, lbracketOffset, elems.build(), rbracketOffset);
          }

          expect(TokenKind.RBRACKET);
          int end = syncPast(LIST_TERMINATOR_SET);
          return makeErrorExpression(lbracketOffset, end);
        }

      default:
        {
          syntaxError("expected ',', 'for' or ']'");
          int end = syncPast(LIST_TERMINATOR_SET);
          return makeErrorExpression(lbracketOffset, end);
        }
    }
  }

  // dict_or_set_expression = '{' '}'
  //                        | '{' dict_entry_list '}'
  //                        | '{' dict_entry comprehension_suffix '}'
  //                        | '{' test_or_star expr_list '}'
  //                        | '{' test comprehension_suffix '}'
  private Expression parseDictOrSetExpression() {
    int lbraceOffset = expect(TokenKind.LBRACE);
    if (token.kind == TokenKind.RBRACE) { // empty Dict
      int rbraceOffset = nextToken();
      return new DictExpression(locs, lbraceOffset, ImmutableList.of(), rbraceOffset);
    }

    DictExpression.Entry entry;
    if (token.kind == TokenKind.STAR_STAR) {
      entry = parseDictEntry();
    } else {
      Expression first = parseTestOrStar();
      if (token.kind != TokenKind.COLON) {
        return parseSetTail(lbraceOffset, first);
      }
      int colonOffset = nextToken();
      entry = new DictExpression.Entry(locs, first, colonOffset, parseTest());
    }

    if (token.kind == TokenKind.FOR || token.kind == TokenKind.ASYNC) {
      // Dict comprehension
      return parseComprehensionSuffix(
          lbraceOffset, entry, TokenKind.RBRACE, Comprehension.Shape.DICT);
    }

    ImmutableList.Builder<DictExpression.Entry> entries = ImmutableList.builder();
    entries.add(entry);
    if (token.kind == TokenKind.COMMA) {
      expect(TokenKind.COMMA);
      entries.addAll(parseDictEntryList());
    }
    if (token.kind == TokenKind.RBRACE) {
      int rbraceOffset = nextToken();
      return new DictExpression(locs, lbraceOffset, entries.build(), rbraceOffset);
    }

    expect(TokenKind.RBRACE);
    int end = syncPast(DICT_TERMINATOR_SET);
    return makeErrorExpression(lbraceOffset, end);
  }

  // Parses the remainder of a set display or set comprehension after its first element.
  private Expression parseSetTail(int lbraceOffset, Expression first) {
    if (token.kind == TokenKind.FOR || token.kind == TokenKind.ASYNC) {
      return parseComprehensionSuffix(
          lbraceOffset, first, TokenKind.RBRACE, Comprehension.Shape.SET);
    }
    ImmutableList.Builder<Expression> elems = ImmutableList.builder();
    elems.add(first);
    parseExprList(elems);
    if (token.kind == TokenKind.RBRACE) {
      int rbraceOffset = nextToken();
      return new ListExpression(
          locs, ListExpression.Shape.SET, lbraceOffset, elems.build(), rbraceOffset);
    }
    expect(TokenKind.RBRACE);
    int end = syncPast(DICT_TERMINATOR_SET);
    return makeErrorExpression(lbraceOffset, end);
  }

  private Identifier parseIdent() {
    if (token.kind != TokenKind.IDENTIFIER) {
      int start = token.start;
      int end = expect(TokenKind.IDENTIFIER);
      return makeErrorExpression(start, end);
    }

    String name = (String) token.value;
    int offset = nextToken();
    return new Identifier(locs, name, offset);
  }

  // binop_expression = binop_expression OP binop_expression
  //                  | factor
  // This function takes care of precedence between operators (see operatorPrecedence for
  // the order), and it assumes left-to-right associativity.
  private Expression parseBinOpExpression(int prec) {
    Expression x = parseTest(prec + 1);
    // The loop is not strictly needed, but it prevents risks of stack overflow. Depth is
    // limited to number of different precedence levels (operatorPrecedence.size()).
    for (; ; ) {
      TokenKind op = token.kind;
      if (!operatorPrecedence.get(prec).contains(op)) {
        return x;
      }
      int opOffset = nextToken();
      Expression y = parseTest(prec + 1);
      x = new BinaryOperatorExpression(locs, x, op, opOffset, y);
    }
  }

  // comparison = bitwise_or (comp_op bitwise_or)*
  // comp_op = '<' | '>' | '==' | '>=' | '<=' | '!=' | 'in' | 'not' 'in' | 'is' | 'is' 'not'
  //
  // A single comparison yields a BinaryOperatorExpression; a chain of two or more yields a
  // ChainedComparison.
  private Expression parseComparison() {
    Expression x = parseTest(COMPARISON_PRECEDENCE + 1);
    ImmutableList.Builder<Expression> operands = null;
    ImmutableList.Builder<TokenKind> operators = null;
    int count = 0;
    int firstOpOffset = -1;
    TokenKind firstOp = null;
    Expression firstY = null;
    for (; ; ) {
      TokenKind op = token.kind;
      if (op == TokenKind.NOT) {
        // If NOT appears when we expect a binary operator, it must be followed by IN.
        expect(TokenKind.NOT);
        if (token.kind != TokenKind.IN) {
          syntaxError("expected 'in'");
        }
        op = TokenKind.NOT_IN;
      } else if (op == TokenKind.IS) {
        int isOffset = nextToken();
        if (token.kind == TokenKind.NOT) {
          op = TokenKind.IS_NOT;
        } else {
          Expression y = parseTest(COMPARISON_PRECEDENCE + 1);
          count++;
          if (count == 1) {
            firstOp = TokenKind.IS;
            firstOpOffset = isOffset;
            firstY = y;
          } else {
            if (operands == null) {
              operands = ImmutableList.<Expression>builder().add(x, firstY);
              operators = ImmutableList.<TokenKind>builder().add(firstOp);
            }
            operands.add(y);
            operators.add(TokenKind.IS);
          }
          continue;
        }
      } else if (!operatorPrecedence.get(COMPARISON_PRECEDENCE).contains(op)) {
        break;
      }
      int opOffset = nextToken();
      Expression y = parseTest(COMPARISON_PRECEDENCE + 1);
      count++;
      if (count == 1) {
        firstOp = op;
        firstOpOffset = opOffset;
        firstY = y;
      } else {
        if (operands == null) {
          operands = ImmutableList.<Expression>builder().add(x, firstY);
          operators = ImmutableList.<TokenKind>builder().add(firstOp);
        }
        operands.add(y);
        operators.add(op);
      }
    }
    if (count == 0) {
      return x;
    } else if (count == 1) {
      return new BinaryOperatorExpression(locs, x, firstOp, firstOpOffset, firstY);
    }
    return new ChainedComparison(locs, operands.build(), operators.build());
  }

  // Parses any expression except for an unparenthesized tuple.
  //
  // In Python the corresponding grammar production is called `expression` (or previously, in
  // Python 3.8 and older, `test`).
  private Expression parseTest() {
    int start = token.start;
    if (token.kind == TokenKind.LAMBDA) {
      return parseLambda(/* allowCond= */ true);
    }

    Expression expr = parseTest(0);
    if (token.kind == TokenKind.IF) {
      nextToken();
      Expression condition = parseTest(0);
      if (token.kind == TokenKind.ELSE) {
        nextToken();
        Expression elseClause = parseTest();
        return new ConditionalExpression(locs, expr, condition, elseClause);
      } else {
        reportError(start, "missing else clause in conditional expression or semicolon before if");
        return expr; // Try to recover from error: drop the if and the expression after it. Ouch.
      }
    }
    return expr;
  }

  // test_or_star = '*' bitwise_or | test
  private Expression parseTestOrStar() {
    if (token.kind == TokenKind.STAR) {
      int starOffset = nextToken();
      return new StarredExpression(locs, starOffset, parseTest(BITWISE_OR_PRECEDENCE));
    }
    return parseTest();
  }

  private Expression parseTest(int prec) {
    if (prec >= operatorPrecedence.size()) {
      return parseFactor();
    }
    if (token.kind == TokenKind.NOT && operatorPrecedence.get(prec).contains(TokenKind.NOT)) {
      return parseNotExpression(prec);
    }
    if (prec == COMPARISON_PRECEDENCE) {
      return parseComparison();
    }
    return parseBinOpExpression(prec);
  }

  // parseLambda parses a lambda expression.
  // The allowCond flag allows the body to be an 'a if b else c' conditional.
  private LambdaExpression parseLambda(boolean allowCond) {
    int lambdaOffset = expect(TokenKind.LAMBDA);
    ImmutableList<Parameter> params = parseParameters(/* defStatement= */ false);
    expect(TokenKind.COLON);
    Expression body = allowCond ? parseTest() : parseTestNoCond();
    return new LambdaExpression(locs, lambdaOffset, params, body);
  }

  // parseTestNoCond parses a single-component expression without
  // consuming a trailing 'if expr else expr'.
  private Expression parseTestNoCond() {
    if (token.kind == TokenKind.LAMBDA) {
      return parseLambda(/* allowCond= */ false);
    }
    return parseTest(0);
  }

  // not_expr = 'not' expr
  private Expression parseNotExpression(int prec) {
    int notOffset = expect(TokenKind.NOT);
    Expression x = parseTest(prec);
    return new UnaryOperatorExpression(locs, TokenKind.NOT, notOffset, x);
  }

  // file_input = ('\n' | stmt)* EOF
  // The terminating newline is injected by the lexer even if not present in the input.
  private ImmutableList<Statement> parseFileInput() {
    ImmutableList.Builder<Statement> list = ImmutableList.builder();
    try {
      while (token.kind != TokenKind.EOF) {
        if (token.kind == TokenKind.NEWLINE) {
          expectAndRecover(TokenKind.NEWLINE);
        } else if (recoveryMode) {
          // If there was a parse error, we want to recover here
          // before starting a new top-level statement.
          syncTo(STATEMENT_TERMINATOR_SET);
          recoveryMode = false;
        } else {
          parseStatement(list);
        }
      }
    } catch (StackOverflowError ex) {
      // JVM threads have very limited stack, and deeply nested inputs can
      // easily cause the parser to consume all available stack. It is hard
      // to anticipate all the possible recursions in the parser, especially
      // when considering error recovery.
      //
      // So, for robustness, the parser treats StackOverflowError as a parse
      // error.
      reportError(
          token.end,
          "internal error: stack overflow in Python parser while parsing %s.\n%s",
          locs.file(),
          Throwables.getStackTraceAsString(ex));
    }
    return list.build();
  }

  // simple_stmt = small_stmt (';' small_stmt)* ';'? NEWLINE
  private void parseSimpleStatement(ImmutableList.Builder<Statement> list) {
    list.add(parseSmallStatement());

    while (token.kind == TokenKind.SEMI) {
      nextToken();
      if (token.kind == TokenKind.NEWLINE) {
        break;
      }
      list.add(parseSmallStatement());
    }
    expectAndRecover(TokenKind.NEWLINE);
  }

  //     small_stmt = assign_stmt
  //                | expr
  //                | return_stmt | raise_stmt
  //                | import_stmt | from_stmt
  //                | del_stmt | assert_stmt | global_stmt
  //                | BREAK | CONTINUE | PASS
  //
  //     assign_stmt = expr ('=' expr)* '=' yield_or_expr
  //                 | expr augassign yield_or_expr
  //                 | expr ':' test ['=' yield_or_expr]
  //
  //     augassign = '+=' | '-=' | '*=' | '/=' | '%=' | '//=' | '&=' | '|=' | '^=' |'<<=' | '>>='
  //               | '**=' | '@='
  private Statement parseSmallStatement() {
    switch (token.kind) {
      case RETURN:
        return parseReturnStatement();
      case BREAK:
      case CONTINUE:
      case PASS:
        {
          TokenKind kind = token.kind;
          int offset = nextToken();
          return new FlowStatement(locs, kind, offset);
        }
      case RAISE:
        return parseRaiseStatement();
      case IMPORT:
        return parseImportStatement();
      case FROM:
        return parseFromImportStatement();
      case DEL:
        return parseDelStatement();
      case ASSERT:
        return parseAssertStatement();
      case GLOBAL:
      case NONLOCAL:
        return parseGlobalStatement();
      default:
        break;
    }

    Expression lhs = parseYieldOrExpr();

    // lhs: type [= rhs]
    if (token.kind == TokenKind.COLON) {
      int colonOffset = nextToken();
      Expression type = parseTest();
      Expression rhs = null;
      if (token.kind == TokenKind.EQUALS) {
        nextToken();
        rhs = parseYieldOrExpr();
      }
      return new AssignmentStatement(
          locs, ImmutableList.of(lhs), type, null, colonOffset, rhs);
    }

    // lhs += rhs
    TokenKind op = augmentedAssignments.get(token.kind);
    if (op != null) {
      int opOffset = nextToken();
      Expression rhs = parseYieldOrExpr();
      return new AssignmentStatement(locs, ImmutableList.of(lhs), null, op, opOffset, rhs);
    }

    // lhs = rhs  or  a = b = rhs
    if (token.kind == TokenKind.EQUALS) {
      ImmutableList.Builder<Expression> targets = ImmutableList.builder();
      targets.add(lhs);
      int opOffset = nextToken();
      Expression rhs = parseYieldOrExpr();
      while (token.kind == TokenKind.EQUALS) {
        nextToken();
        targets.add(rhs);
        rhs = parseYieldOrExpr();
      }
      return new AssignmentStatement(locs, targets.build(), null, null, opOffset, rhs);
    }

    return new ExpressionStatement(locs, lhs);
  }

  // if_stmt = IF expr ':' suite [ELIF expr ':' suite]* [ELSE ':' suite]?
  private IfStatement parseIfStatement() {
    int ifOffset = expect(TokenKind.IF);
    Expression cond = parseTest();
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();
    IfStatement ifStmt = new IfStatement(locs, TokenKind.IF, ifOffset, cond, body);
    IfStatement tail = ifStmt;
    while (token.kind == TokenKind.ELIF) {
      int elifOffset = expect(TokenKind.ELIF);
      cond = parseTest();
      expect(TokenKind.COLON);
      body = parseSuite();
      IfStatement elif = new IfStatement(locs, TokenKind.ELIF, elifOffset, cond, body);
      tail.setElseBlock(ImmutableList.of(elif));
      tail = elif;
    }
    if (token.kind == TokenKind.ELSE) {
      expect(TokenKind.ELSE);
      expect(TokenKind.COLON);
      body = parseSuite();
      tail.setElseBlock(body);
    }
    return ifStmt;
  }

  // Parses an optional "else: suite" clause of a loop.
  private ImmutableList<Statement> parseOptionalElse() {
    if (token.kind != TokenKind.ELSE) {
      return ImmutableList.of();
    }
    expect(TokenKind.ELSE);
    expect(TokenKind.COLON);
    return parseSuite();
  }

  // for_stmt = FOR loop_variables IN expr ':' suite [ELSE ':' suite]
  private ForStatement parseForStatement() {
    int forOffset = expect(TokenKind.FOR);
    Expression vars = parseForLoopVariables();
    expect(TokenKind.IN);
    Expression collection = parseExpr();
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();
    ImmutableList<Statement> elseBlock = parseOptionalElse();
    return new ForStatement(locs, forOffset, vars, collection, body, elseBlock);
  }

  // while_stmt = WHILE test ':' suite [ELSE ':' suite]
  private WhileStatement parseWhileStatement() {
    int whileOffset = expect(TokenKind.WHILE);
    Expression cond = parseTest();
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();
    ImmutableList<Statement> elseBlock = parseOptionalElse();
    return new WhileStatement(locs, whileOffset, cond, body, elseBlock);
  }

  // try_stmt = TRY ':' suite (EXCEPT [test [AS IDENTIFIER]] ':' suite)*
  //            [ELSE ':' suite] [FINALLY ':' suite]
  private TryStatement parseTryStatement() {
    int tryOffset = expect(TokenKind.TRY);
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();
    ImmutableList.Builder<TryStatement.Handler> handlers = ImmutableList.builder();
    boolean hasHandler = false;
    while (token.kind == TokenKind.EXCEPT) {
      int exceptOffset = nextToken();
      Expression type = null;
      Identifier name = null;
      if (token.kind != TokenKind.COLON) {
        type = parseExpr();
        if (token.kind == TokenKind.AS) {
          nextToken();
          name = parseIdent();
        }
      }
      expect(TokenKind.COLON);
      handlers.add(new TryStatement.Handler(locs, exceptOffset, type, name, parseSuite()));
      hasHandler = true;
    }
    ImmutableList<Statement> elseBlock = ImmutableList.of();
    if (hasHandler && token.kind == TokenKind.ELSE) {
      elseBlock = parseOptionalElse();
    }
    ImmutableList<Statement> finallyBlock = ImmutableList.of();
    if (token.kind == TokenKind.FINALLY) {
      nextToken();
      expect(TokenKind.COLON);
      finallyBlock = parseSuite();
    } else if (!hasHandler) {
      syntaxError("expected 'except' or 'finally' block");
    }
    return new TryStatement(
        locs, tryOffset, body, handlers.build(), elseBlock, finallyBlock);
  }

  // with_stmt = WITH with_item (',' with_item)* ':' suite
  // with_item = test [AS target]
  private WithStatement parseWithStatement() {
    int withOffset = expect(TokenKind.WITH);
    ImmutableList.Builder<WithStatement.Item> items = ImmutableList.builder();
    do {
      if (token.kind == TokenKind.COMMA) {
        nextToken();
      }
      Expression context = parseTest();
      Expression target = null;
      if (token.kind == TokenKind.AS) {
        nextToken();
        target = parseForLoopVariable();
      }
      items.add(new WithStatement.Item(locs, context, target));
    } while (token.kind == TokenKind.COMMA);
    expect(TokenKind.COLON);
    return new WithStatement(locs, withOffset, items.build(), parseSuite());
  }

  // decorated = ('@' test NEWLINE)+ (def_stmt | class_stmt | ASYNC def_stmt)
  private Statement parseDecorated() {
    ImmutableList.Builder<Expression> decorators = ImmutableList.builder();
    while (token.kind == TokenKind.AT) {
      nextToken();
      decorators.add(parseTest());
      expectAndRecover(TokenKind.NEWLINE);
    }
    if (token.kind == TokenKind.CLASS) {
      return parseClassStatement(decorators.build());
    }
    boolean isAsync = false;
    if (token.kind == TokenKind.ASYNC) {
      nextToken();
      isAsync = true;
    }
    return parseDefStatement(decorators.build(), isAsync);
  }

  // def_stmt = DEF IDENTIFIER '(' parameters ')' ['->' test] ':' suite
  private DefStatement parseDefStatement(ImmutableList<Expression> decorators, boolean isAsync) {
    int defOffset = expect(TokenKind.DEF);
    Identifier ident = parseIdent();
    expect(TokenKind.LPAREN);
    ImmutableList<Parameter> params = parseParameters(/* defStatement= */ true);
    expect(TokenKind.RPAREN);
    Expression returnType = maybeParseTypeAnnotationAfter(TokenKind.RARROW);
    expect(TokenKind.COLON);
    ImmutableList<Statement> block = parseSuite();
    return new DefStatement(
        locs, defOffset, decorators, ident, params, returnType, block, isAsync);
  }

  // class_stmt = CLASS IDENTIFIER ['(' arg_list ')'] ':' suite
  private ClassStatement parseClassStatement(ImmutableList<Expression> decorators) {
    int classOffset = expect(TokenKind.CLASS);
    Identifier ident = parseIdent();
    ImmutableList<Argument> bases = ImmutableList.of();
    if (token.kind == TokenKind.LPAREN) {
      nextToken();
      if (token.kind != TokenKind.RPAREN) {
        bases = parseArguments();
      }
      expect(TokenKind.RPAREN);
    }
    expect(TokenKind.COLON);
    return new ClassStatement(locs, classOffset, decorators, ident, bases, parseSuite());
  }

  // Parse a list of function parameters.
  // The positional-only marker '/' is accepted and dropped.
  private ImmutableList<Parameter> parseParameters(boolean defStatement) {
    boolean hasParam = false;
    ImmutableList.Builder<Parameter> list = ImmutableList.builder();

    while (token.kind != TokenKind.RPAREN
        && token.kind != TokenKind.COLON
        && token.kind != TokenKind.EOF) {
      if (hasParam) {
        expect(TokenKind.COMMA);
        // The list may end with a comma.
        if (token.kind == TokenKind.RPAREN || token.kind == TokenKind.COLON) {
          break;
        }
      }
      hasParam = true;
      if (token.kind == TokenKind.SLASH) {
        nextToken();
        continue;
      }
      list.add(parseParameter(defStatement));
    }
    return list.build();
  }

  // suite is typically what follows a colon (e.g. after def or for).
  // suite = simple_stmt
  //       | NEWLINE INDENT stmt+ OUTDENT
  private ImmutableList<Statement> parseSuite() {
    ImmutableList.Builder<Statement> list = ImmutableList.builder();
    if (token.kind == TokenKind.NEWLINE) {
      expect(TokenKind.NEWLINE);
      if (token.kind != TokenKind.INDENT) {
        reportError(token.start, "expected an indented block");
        return list.build();
      }
      expect(TokenKind.INDENT);
      while (token.kind != TokenKind.OUTDENT && token.kind != TokenKind.EOF) {
        parseStatement(list);
      }
      expectAndRecover(TokenKind.OUTDENT);
    } else {
      parseSimpleStatement(list);
    }
    return list.build();
  }

  // return_stmt = RETURN [expr]
  private ReturnStatement parseReturnStatement() {
    int returnOffset = expect(TokenKind.RETURN);

    Expression result = null;
    if (!STATEMENT_TERMINATOR_SET.contains(token.kind)) {
      result = parseExpr();
    }
    return new ReturnStatement(locs, returnOffset, result);
  }

  // raise_stmt = RAISE [test [FROM test]]
  private RaiseStatement parseRaiseStatement() {
    int raiseOffset = expect(TokenKind.RAISE);
    Expression exception = null;
    Expression cause = null;
    if (!STATEMENT_TERMINATOR_SET.contains(token.kind)) {
      exception = parseTest();
      if (token.kind == TokenKind.FROM) {
        nextToken();
        cause = parseTest();
      }
    }
    return new RaiseStatement(locs, raiseOffset, exception, cause);
  }

  // import_stmt = IMPORT dotted_name [AS IDENTIFIER] (',' dotted_name [AS IDENTIFIER])*
  private ImportStatement parseImportStatement() {
    int importOffset = expect(TokenKind.IMPORT);
    ImmutableList.Builder<ImportStatement.Binding> bindings = ImmutableList.builder();
    int end;
    do {
      if (token.kind == TokenKind.COMMA) {
        nextToken();
      }
      String name = parseDottedName();
      end = token.start;
      String alias = null;
      if (token.kind == TokenKind.AS) {
        nextToken();
        alias = parseIdent().getName();
        end = token.start;
      }
      bindings.add(new ImportStatement.Binding(name, alias));
    } while (token.kind == TokenKind.COMMA);
    return new ImportStatement(locs, importOffset, null, bindings.build(), end);
  }

  // from_stmt = FROM ('.' | '...')* [dotted_name] IMPORT ('*' | '(' import_names ')' |
  //             import_names)
  // import_names = IDENTIFIER [AS IDENTIFIER] (',' IDENTIFIER [AS IDENTIFIER])* [',']
  private ImportStatement parseFromImportStatement() {
    int fromOffset = expect(TokenKind.FROM);
    StringBuilder module = new StringBuilder();
    while (token.kind == TokenKind.DOT || token.kind == TokenKind.ELLIPSIS) {
      module.append(token.kind == TokenKind.DOT ? "." : "...");
      nextToken();
    }
    if (token.kind != TokenKind.IMPORT) {
      module.append(parseDottedName());
    }
    expect(TokenKind.IMPORT);
    ImmutableList.Builder<ImportStatement.Binding> bindings = ImmutableList.builder();
    if (token.kind == TokenKind.STAR) {
      int end = token.end;
      nextToken();
      bindings.add(new ImportStatement.Binding("*", null));
      return new ImportStatement(locs, fromOffset, module.toString(), bindings.build(), end);
    }
    boolean parenthesized = token.kind == TokenKind.LPAREN;
    if (parenthesized) {
      nextToken();
    }
    int end = token.start;
    while (token.kind == TokenKind.IDENTIFIER) {
      String name = parseIdent().getName();
      String alias = null;
      if (token.kind == TokenKind.AS) {
        nextToken();
        alias = parseIdent().getName();
      }
      bindings.add(new ImportStatement.Binding(name, alias));
      end = token.start;
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      nextToken();
    }
    if (parenthesized) {
      end = token.end;
      expect(TokenKind.RPAREN);
    }
    return new ImportStatement(locs, fromOffset, module.toString(), bindings.build(), end);
  }

  // dotted_name = IDENTIFIER ('.' IDENTIFIER)*
  private String parseDottedName() {
    StringBuilder name = new StringBuilder(parseIdent().getName());
    while (token.kind == TokenKind.DOT) {
      nextToken();
      name.append('.').append(parseIdent().getName());
    }
    return name.toString();
  }

  // del_stmt = DEL expr
  private DelStatement parseDelStatement() {
    int delOffset = expect(TokenKind.DEL);
    Expression targets = parseExpr();
    ImmutableList<Expression> list =
        targets instanceof ListExpression tuple && tuple.isTuple() && tuple.getStartOffset() >= 0
            ? tuple.getElements()
            : ImmutableList.of(targets);
    return new DelStatement(locs, delOffset, list);
  }

  // assert_stmt = ASSERT test [',' test]
  private AssertStatement parseAssertStatement() {
    int assertOffset = expect(TokenKind.ASSERT);
    Expression condition = parseTest();
    Expression message = null;
    if (token.kind == TokenKind.COMMA) {
      nextToken();
      message = parseTest();
    }
    return new AssertStatement(locs, assertOffset, condition, message);
  }

  // global_stmt = (GLOBAL | NONLOCAL) IDENTIFIER (',' IDENTIFIER)*
  private GlobalStatement parseGlobalStatement() {
    TokenKind kind = token.kind;
    int offset = nextToken();
    ImmutableList.Builder<Identifier> names = ImmutableList.builder();
    names.add(parseIdent());
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      names.add(parseIdent());
    }
    return new GlobalStatement(locs, kind, offset, names.build());
  }

  // match_stmt = MATCH expr ':' NEWLINE INDENT case_block+ OUTDENT
  // case_block = CASE patterns [IF test] ':' suite
  private MatchStatement parseMatchStatement() {
    int matchOffset = expect(TokenKind.MATCH);
    Expression subject = parseExpr();
    expect(TokenKind.COLON);
    ImmutableList.Builder<MatchStatement.Case> cases = ImmutableList.builder();
    expect(TokenKind.NEWLINE);
    if (token.kind != TokenKind.INDENT) {
      reportError(token.start, "expected an indented block of 'case' clauses");
      return new MatchStatement(locs, matchOffset, subject, cases.build());
    }
    expect(TokenKind.INDENT);
    while (token.kind != TokenKind.OUTDENT && token.kind != TokenKind.EOF) {
      if (token.kind != TokenKind.CASE) {
        syntaxError("expected 'case'");
        parseStatement(ImmutableList.builder()); // discard
        continue;
      }
      int caseOffset = nextToken();
      Pattern pattern = parsePatterns();
      Expression guard = null;
      if (token.kind == TokenKind.IF) {
        nextToken();
        guard = parseTest();
      }
      expect(TokenKind.COLON);
      cases.add(new MatchStatement.Case(locs, caseOffset, pattern, guard, parseSuite()));
    }
    expectAndRecover(TokenKind.OUTDENT);
    return new MatchStatement(locs, matchOffset, subject, cases.build());
  }

  // patterns = open_sequence_pattern | pattern
  // open_sequence_pattern = maybe_star_pattern ',' [maybe_star_pattern (',' maybe_star_pattern)*
  //                         [',']]
  private Pattern parsePatterns() {
    int start = token.start;
    Pattern first = parseMaybeStarPattern();
    if (token.kind != TokenKind.COMMA) {
      return first;
    }
    ImmutableList.Builder<Pattern> elems = ImmutableList.builder();
    elems.add(first);
    int end = first.getEndOffset();
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      if (token.kind == TokenKind.COLON || token.kind == TokenKind.IF) {
        break;
      }
      Pattern p = parseMaybeStarPattern();
      elems.add(p);
      end = p.getEndOffset();
    }
    return new Pattern.Sequence(locs, elems.build(), start, end);
  }

  // maybe_star_pattern = '*' IDENTIFIER | pattern
  private Pattern parseMaybeStarPattern() {
    if (token.kind == TokenKind.STAR) {
      int starOffset = nextToken();
      Identifier id = parseIdent();
      Identifier name = id.getName().equals("_") ? null : id;
      return new Pattern.Star(locs, starOffset, name, id.getEndOffset());
    }
    return parsePattern();
  }

  // pattern = or_pattern [AS IDENTIFIER]
  private Pattern parsePattern() {
    Pattern p = parseOrPattern();
    if (token.kind == TokenKind.AS) {
      nextToken();
      Identifier name = parseIdent();
      return new Pattern.As(locs, p, name, p.getStartOffset(), name.getEndOffset());
    }
    return p;
  }

  // or_pattern = closed_pattern ('|' closed_pattern)*
  private Pattern parseOrPattern() {
    Pattern p = parseClosedPattern();
    if (token.kind != TokenKind.PIPE) {
      return p;
    }
    ImmutableList.Builder<Pattern> alternatives = ImmutableList.builder();
    alternatives.add(p);
    while (token.kind == TokenKind.PIPE) {
      nextToken();
      alternatives.add(parseClosedPattern());
    }
    return new Pattern.Or(locs, alternatives.build());
  }

  // closed_pattern = literal_pattern | capture_pattern | wildcard_pattern | value_pattern
  //                | group_pattern | sequence_pattern | mapping_pattern | class_pattern
  private Pattern parseClosedPattern() {
    switch (token.kind) {
      case STRING:
        return new Pattern.Value(locs, parseStringLiteral());
      case INT:
      case FLOAT:
        return new Pattern.Value(locs, parsePrimary());
      case MINUS:
        {
          int minusOffset = nextToken();
          Expression number = parsePrimary();
          return new Pattern.Value(
              locs, new UnaryOperatorExpression(locs, TokenKind.MINUS, minusOffset, number));
        }
      case IDENTIFIER:
        {
          Identifier id = parseIdent();
          Expression name = id;
          while (token.kind == TokenKind.DOT) {
            name = parseSelectorSuffix(name);
          }
          if (token.kind == TokenKind.LPAREN) {
            return parseClassPattern(name);
          }
          if (name != id) {
            return new Pattern.Value(locs, name);
          }
          switch (id.getName()) {
            case "_":
              return new Pattern.As(locs, null, null, id.getStartOffset(), id.getEndOffset());
            case "None":
            case "True":
            case "False":
              return new Pattern.Value(locs, id);
            default:
              return new Pattern.As(locs, null, id, id.getStartOffset(), id.getEndOffset());
          }
        }
      case LPAREN:
        {
          int lparenOffset = nextToken();
          if (token.kind == TokenKind.RPAREN) {
            int rparenOffset = nextToken();
            return new Pattern.Sequence(locs, ImmutableList.of(), lparenOffset, rparenOffset + 1);
          }
          Pattern first = parseMaybeStarPattern();
          if (token.kind == TokenKind.RPAREN && first.kind() != Pattern.Kind.STAR) {
            nextToken();
            return first; // group pattern
          }
          return parseSequencePatternTail(lparenOffset, first, TokenKind.RPAREN);
        }
      case LBRACKET:
        {
          int lbracketOffset = nextToken();
          if (token.kind == TokenKind.RBRACKET) {
            int rbracketOffset = nextToken();
            return new Pattern.Sequence(
                locs, ImmutableList.of(), lbracketOffset, rbracketOffset + 1);
          }
          return parseSequencePatternTail(
              lbracketOffset, parseMaybeStarPattern(), TokenKind.RBRACKET);
        }
      case LBRACE:
        return parseMappingPattern();
      default:
        {
          int start = token.start;
          syntaxError("expected pattern");
          int end = syncTo(EXPR_TERMINATOR_SET);
          return new Pattern.Value(locs, makeErrorExpression(start, end));
        }
    }
  }

  // Parses the elements after the first of a bracketed sequence pattern, and the closing bracket.
  private Pattern parseSequencePatternTail(int loffset, Pattern first, TokenKind closingBracket) {
    ImmutableList.Builder<Pattern> elems = ImmutableList.builder();
    elems.add(first);
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      if (token.kind == closingBracket) {
        break;
      }
      elems.add(parseMaybeStarPattern());
    }
    int roffset = expect(closingBracket);
    return new Pattern.Sequence(locs, elems.build(), loffset, roffset + 1);
  }

  // class_pattern = name_or_attr '(' [pattern_arguments [',']] ')'
  private Pattern parseClassPattern(Expression cls) {
    expect(TokenKind.LPAREN);
    ImmutableList.Builder<Pattern> positional = ImmutableList.builder();
    ImmutableList.Builder<Identifier> keywordNames = ImmutableList.builder();
    ImmutableList.Builder<Pattern> keywordPatterns = ImmutableList.builder();
    while (token.kind != TokenKind.RPAREN && token.kind != TokenKind.EOF) {
      Pattern p = parsePattern();
      if (token.kind == TokenKind.EQUALS
          && p instanceof Pattern.As as
          && as.getPattern() == null
          && as.getName() != null) {
        nextToken();
        keywordNames.add(as.getName());
        keywordPatterns.add(parsePattern());
      } else {
        positional.add(p);
      }
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      nextToken();
    }
    int rparenOffset = expect(TokenKind.RPAREN);
    return new Pattern.ClassPattern(
        locs,
        cls,
        positional.build(),
        keywordNames.build(),
        keywordPatterns.build(),
        rparenOffset);
  }

  // mapping_pattern = '{' [key ':' pattern (',' key ':' pattern)* [',' '**' IDENTIFIER]] '}'
  private Pattern parseMappingPattern() {
    int lbraceOffset = expect(TokenKind.LBRACE);
    ImmutableList.Builder<Expression> keys = ImmutableList.builder();
    ImmutableList.Builder<Pattern> values = ImmutableList.builder();
    Identifier rest = null;
    while (token.kind != TokenKind.RBRACE && token.kind != TokenKind.EOF) {
      if (token.kind == TokenKind.STAR_STAR) {
        nextToken();
        rest = parseIdent();
      } else {
        Pattern key = parseClosedPattern();
        keys.add(
            key instanceof Pattern.Value value
                ? value.getValue()
                : makeErrorExpression(key.getStartOffset(), key.getEndOffset()));
        expect(TokenKind.COLON);
        values.add(parsePattern());
      }
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      nextToken();
    }
    int rbraceOffset = expect(TokenKind.RBRACE);
    return new Pattern.Mapping(
        locs, lbraceOffset, keys.build(), values.build(), rest, rbraceOffset);
  }
}
