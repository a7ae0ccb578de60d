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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;
import net.djls.java.syntax.AssignmentStatement;
import net.djls.java.syntax.BinaryOperatorExpression;
import net.djls.java.syntax.CallExpression;
import net.djls.java.syntax.DefStatement;
import net.djls.java.syntax.DotExpression;
import net.djls.java.syntax.Expression;
import net.djls.java.syntax.ExpressionStatement;
import net.djls.java.syntax.ForStatement;
import net.djls.java.syntax.Identifier;
import net.djls.java.syntax.IfStatement;
import net.djls.java.syntax.IndexExpression;
import net.djls.java.syntax.LambdaExpression;
import net.djls.java.syntax.ListExpression;
import net.djls.java.syntax.NodeVisitor;
import net.djls.java.syntax.Statement;
import net.djls.java.syntax.StringLiteral;
import net.djls.java.syntax.TokenKind;
import net.djls.java.syntax.TryStatement;
import net.djls.java.syntax.WhileStatement;

/**
 * Infers the block structure of a tag from its compile function.
 *
 * <p>The stop tokens of {@code parser.parse((...))} calls are split into intermediates and end
 * tags by what the function does once it has stopped: a token after which it parses again is an
 * intermediate, one after which it finishes closes the block. An end tag is only reported when the
 * source names exactly one; otherwise it is left null.
 */
final class BlockSpecExtractor {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final Splitter WORDS = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  private BlockSpecExtractor() {}

  /**
   * Returns the block structure of a tag registered as {@code reg} and implemented by {@code
   * function}, or null if it is not a block tag.
   */
  @Nullable
  static BlockSpec forRegistration(Registration reg, @Nullable DefStatement function) {
    if (reg.kind() == Registration.Kind.SIMPLE_BLOCK_TAG) {
      // Django closes these with end_name, which defaults to "end" and the tag name.
      return BlockSpec.closedBy(reg.endName() != null ? reg.endName() : "end" + reg.name());
    }
    if (reg.kind() != Registration.Kind.TAG || function == null) {
      return null;
    }
    return extract(function);
  }

  /** Returns the block structure of the compile function {@code function}, if it has one. */
  @Nullable
  static BlockSpec extract(DefStatement function) {
    if (function.getParameters().isEmpty()) {
      return null;
    }
    String parser = function.getParameters().get(0).getName();
    if (parser == null) {
      return null;
    }
    List<Statement> body = function.getBody();
    BlockSpec spec;
    List<String> skipped = skipPastTokens(body, parser);
    if (!skipped.isEmpty()) {
      String endTag = skipped.size() == 1 ? skipped.get(0) : null;
      spec = BlockSpec.create(endTag, ImmutableList.of(), true);
    } else {
      List<List<String>> stopLists = stopTokenLists(body, parser);
      if (!stopLists.isEmpty()) {
        spec = classify(body, parser, stopLists);
      } else if (hasDynamicEndParse(body, parser)) {
        spec = BlockSpec.create(null, ImmutableList.of(), false);
      } else {
        spec = fromNextTokenLoop(body, parser);
      }
    }
    if (spec != null) {
      logger.atFine().log("%s: %s", function.getName(), spec);
    }
    return spec;
  }

  private static List<String> skipPastTokens(List<Statement> body, String parser) {
    Set<String> tokens = new LinkedHashSet<>();
    for (CallExpression call : callsIn(body)) {
      if (isParserMethodCall(call, parser, "skip_past")) {
        Expression arg = firstPositional(call);
        if (arg instanceof StringLiteral lit && !lit.isFormatted()) {
          tokens.add(lit.getValue());
        }
      }
    }
    return new ArrayList<>(tokens);
  }

  /** Returns the stop tokens of each {@code parser.parse((...))} call, in source order. */
  private static List<List<String>> stopTokenLists(List<Statement> body, String parser) {
    List<List<String>> result = new ArrayList<>();
    for (CallExpression call : callsIn(body)) {
      List<String> tokens = stopTokens(call, parser);
      if (!tokens.isEmpty()) {
        result.add(tokens);
      }
    }
    return result;
  }

  /** Returns the command words of the string literals a parse call stops at. */
  private static List<String> stopTokens(CallExpression call, String parser) {
    List<String> tokens = new ArrayList<>();
    if (isParserMethodCall(call, parser, "parse")
        && firstPositional(call) instanceof ListExpression list) {
      for (Expression elem : list.getElements()) {
        String word = commandWord(elem);
        if (word != null) {
          tokens.add(word);
        }
      }
    }
    return tokens;
  }

  @Nullable
  private static BlockSpec classify(
      List<Statement> body, String parser, List<List<String>> stopLists) {
    Set<String> all = new LinkedHashSet<>();
    for (List<String> tokens : stopLists) {
      all.addAll(tokens);
    }
    Set<String> intermediates = new LinkedHashSet<>();
    Set<String> endTags = new LinkedHashSet<>();
    classifyBody(body, parser, all, intermediates, endTags);

    // The closing token is often never checked: it is whatever is left.
    if (!intermediates.isEmpty()) {
      for (String token : all) {
        if (!intermediates.contains(token)) {
          endTags.add(token);
        }
      }
    }
    if (intermediates.isEmpty() && endTags.isEmpty()) {
      if (stopLists.size() >= 2) {
        // Successive parse calls: the last one runs to the end of the block.
        endTags.addAll(Iterables.getLast(stopLists));
        for (List<String> tokens : stopLists.subList(0, stopLists.size() - 1)) {
          intermediates.addAll(tokens);
        }
      } else {
        List<String> tokens = stopLists.get(0);
        if (tokens.size() == 1) {
          endTags.add(tokens.get(0));
        } else {
          splitByEndPrefix(tokens, intermediates, endTags);
          if (endTags.isEmpty()) {
            return null;
          }
        }
      }
    }
    intermediates.removeAll(endTags);
    if (intermediates.isEmpty() && endTags.isEmpty()) {
      return null;
    }
    String endTag = endTags.size() == 1 ? Iterables.getOnlyElement(endTags) : null;
    return BlockSpec.create(endTag, intermediates, false);
  }

  private static void classifyBody(
      List<Statement> body,
      String parser,
      Set<String> known,
      Set<String> intermediates,
      Set<String> endTags) {
    for (Statement st : body) {
      if (st instanceof IfStatement ifStmt) {
        String token = checkedToken(ifStmt.getCondition(), known);
        if (token != null) {
          addByFollowingParse(token, ifStmt.getThenBlock(), parser, intermediates, endTags);
        }
        classifyBody(ifStmt.getThenBlock(), parser, known, intermediates, endTags);
        if (ifStmt.getElseBlock() != null) {
          // An elif is an if statement alone in the else block.
          classifyBody(ifStmt.getElseBlock(), parser, known, intermediates, endTags);
        }
      } else if (st instanceof WhileStatement loop) {
        String token = checkedToken(loop.getCondition(), known);
        if (token == null) {
          token = startsWithToken(loop.getCondition(), known);
        }
        if (token != null) {
          addByFollowingParse(token, loop.getBody(), parser, intermediates, endTags);
        }
        classifyBody(loop.getBody(), parser, known, intermediates, endTags);
      } else if (st instanceof ForStatement loop) {
        classifyBody(loop.getBody(), parser, known, intermediates, endTags);
      } else if (st instanceof TryStatement tryStmt) {
        classifyBody(tryStmt.getBody(), parser, known, intermediates, endTags);
      }
    }
  }

  /** A token whose branch parses further is an intermediate; one whose branch does not, an end. */
  private static void addByFollowingParse(
      String token,
      List<Statement> branch,
      String parser,
      Set<String> intermediates,
      Set<String> endTags) {
    if (hasParseCall(branch, parser)) {
      intermediates.add(token);
    } else {
      endTags.add(token);
    }
  }

  private static void splitByEndPrefix(
      Iterable<String> tokens, Set<String> intermediates, Set<String> endTags) {
    for (String token : tokens) {
      if (token.startsWith("end")) {
        endTags.add(token);
      } else {
        intermediates.add(token);
      }
    }
  }

  private static boolean hasParseCall(List<Statement> body, String parser) {
    for (CallExpression call : callsIn(body)) {
      if (!stopTokens(call, parser).isEmpty()) {
        return true;
      }
    }
    return false;
  }

  /** Matches {@code token.contents == "else"} and the like against a known stop token. */
  @Nullable
  private static String checkedToken(Expression cond, Set<String> known) {
    if (!(cond instanceof BinaryOperatorExpression cmp) || !cmp.isComparison()) {
      return null;
    }
    Expression literal;
    if (isTokenContents(cmp.getX())) {
      literal = cmp.getY();
    } else if (isTokenContents(cmp.getY())) {
      literal = cmp.getX();
    } else {
      return null;
    }
    String word = commandWord(literal);
    return word != null && known.contains(word) ? word : null;
  }

  /** Matches {@code token.contents.startswith("elif")} against a known stop token. */
  @Nullable
  private static String startsWithToken(Expression cond, Set<String> known) {
    if (cond instanceof CallExpression call
        && "startswith".equals(call.getFunctionName())
        && call.getFunction() instanceof DotExpression dot
        && isTokenContents(dot.getObject())) {
      String word = commandWord(firstPositional(call));
      return word != null && known.contains(word) ? word : null;
    }
    return null;
  }

  /**
   * Reports whether {@code expr} reads the contents of a token: {@code token.contents}, or a call
   * on or index into it such as {@code token.contents.split()[0]}.
   */
  private static boolean isTokenContents(Expression expr) {
    if (expr instanceof DotExpression dot) {
      return dot.getField().getName().equals("contents") && dot.getObject() instanceof Identifier;
    }
    if (expr instanceof CallExpression call && call.getFunction() instanceof DotExpression dot) {
      return isTokenContents(dot.getObject());
    }
    if (expr instanceof IndexExpression index) {
      return isTokenContents(index.getObject());
    }
    return false;
  }

  private static boolean hasDynamicEndParse(List<Statement> body, String parser) {
    for (CallExpression call : callsIn(body)) {
      if (isParserMethodCall(call, parser, "parse")
          && firstPositional(call) instanceof ListExpression list) {
        for (Expression elem : list.getElements()) {
          if (isEndTemplate(elem)) {
            return true;
          }
        }
      }
    }
    return false;
  }

  /** Matches {@code f"end{name}"}, an end tag computed from the tag name. */
  private static boolean isEndTemplate(Expression expr) {
    return expr instanceof StringLiteral lit
        && lit.isFormatted()
        && lit.getValue().startsWith("end")
        && lit.getValue().contains("{");
  }

  /**
   * Handles tags such as {@code blocktranslate} that read tokens one at a time in a {@code while
   * parser.tokens} loop and compare their contents, instead of calling {@code parser.parse}.
   */
  @Nullable
  private static BlockSpec fromNextTokenLoop(List<Statement> body, String parser) {
    if (!hasNextTokenLoop(body, parser)) {
      return null;
    }
    Set<String> compared = new LinkedHashSet<>();
    boolean[] dynamicEnd = {false};
    new NodeVisitor() {
      @Override
      public void visit(IfStatement node) {
        if (node.getCondition() instanceof BinaryOperatorExpression cmp
            && cmp.isComparison()
            && (isTokenContents(cmp.getX()) || isTokenContents(cmp.getY()))) {
          for (Expression side : ImmutableList.of(cmp.getX(), cmp.getY())) {
            if (side instanceof StringLiteral lit && !lit.isFormatted()) {
              compared.add(lit.getValue());
            }
          }
        }
        super.visit(node);
      }

      @Override
      public void visit(AssignmentStatement node) {
        if (node.getRHS() != null && isEndFormat(node.getRHS())) {
          dynamicEnd[0] = true;
        }
        super.visit(node);
      }

      @Override
      public void visit(DefStatement node) {}
    }.visitBlock(body);

    Set<String> intermediates = new LinkedHashSet<>();
    Set<String> endTags = new LinkedHashSet<>();
    splitByEndPrefix(compared, intermediates, endTags);
    String endTag = endTags.size() == 1 ? Iterables.getOnlyElement(endTags) : null;
    if (endTag == null && !dynamicEnd[0] && intermediates.isEmpty()) {
      return null;
    }
    return BlockSpec.create(endTag, intermediates, false);
  }

  /** Matches {@code "end%s" % bits[0]} and {@code f"end{bits[0]}"}. */
  private static boolean isEndFormat(Expression expr) {
    if (expr instanceof BinaryOperatorExpression op
        && op.getOperator() == TokenKind.PERCENT
        && op.getX() instanceof StringLiteral lit) {
      return lit.getValue().startsWith("end") && lit.getValue().contains("%");
    }
    return isEndTemplate(expr);
  }

  /** Reports whether a {@code while parser.tokens:} loop calls {@code parser.next_token()}. */
  private static boolean hasNextTokenLoop(List<Statement> body, String parser) {
    boolean[] found = {false};
    new NodeVisitor() {
      @Override
      public void visit(WhileStatement node) {
        if (node.getCondition() instanceof DotExpression dot
            && dot.getField().getName().equals("tokens")
            && isParserReceiver(dot.getObject(), parser)) {
          for (Statement st : node.getBody()) {
            Expression expr = null;
            if (st instanceof ExpressionStatement exprStmt) {
              expr = exprStmt.getExpression();
            } else if (st instanceof AssignmentStatement assign) {
              expr = assign.getRHS();
            }
            if (expr instanceof CallExpression call
                && isParserMethodCall(call, parser, "next_token")) {
              found[0] = true;
            }
          }
        }
        super.visit(node);
      }

      @Override
      public void visit(DefStatement node) {}
    }.visitBlock(body);
    return found[0];
  }

  private static boolean isParserMethodCall(CallExpression call, String parser, String method) {
    return method.equals(call.getFunctionName())
        && call.getFunction() instanceof DotExpression dot
        && isParserReceiver(dot.getObject(), parser);
  }

  /** Matches the parser parameter, or {@code self.parser} in a class-based tag. */
  private static boolean isParserReceiver(Expression expr, String parser) {
    if (expr instanceof Identifier id) {
      return id.getName().equals(parser);
    }
    return expr instanceof DotExpression dot
        && dot.getField().getName().equals("parser")
        && dot.getObject() instanceof Identifier id
        && (id.getName().equals(parser) || id.getName().equals("self"));
  }

  /** Returns the first word of a plain string literal, or null. */
  @Nullable
  private static String commandWord(@Nullable Expression expr) {
    if (!(expr instanceof StringLiteral lit) || lit.isFormatted()) {
      return null;
    }
    return Iterables.getFirst(WORDS.split(lit.getValue()), null);
  }

  @Nullable
  private static Expression firstPositional(CallExpression call) {
    List<Expression> args = call.getPositionalArguments();
    return args != null && !args.isEmpty() ? args.get(0) : null;
  }

  /** Returns the calls in {@code body} in source order, outside nested functions. */
  private static List<CallExpression> callsIn(List<Statement> body) {
    List<CallExpression> calls = new ArrayList<>();
    new NodeVisitor() {
      @Override
      public void visit(CallExpression node) {
        calls.add(node);
        super.visit(node);
      }

      @Override
      public void visit(DefStatement node) {}

      @Override
      public void visit(LambdaExpression node) {}
    }.visitBlock(body);
    return calls;
  }
}
