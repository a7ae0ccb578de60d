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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import net.djls.java.syntax.Argument;
import net.djls.java.syntax.CallExpression;
import net.djls.java.syntax.DotExpression;
import net.djls.java.syntax.Expression;
import net.djls.java.syntax.Identifier;
import net.djls.java.syntax.IndexExpression;
import net.djls.java.syntax.IntLiteral;
import net.djls.java.syntax.LambdaExpression;
import net.djls.java.syntax.ListExpression;
import net.djls.java.syntax.NodeVisitor;
import net.djls.java.syntax.SliceExpression;
import net.djls.java.syntax.StringLiteral;
import net.djls.java.syntax.TokenKind;
import net.djls.java.syntax.UnaryOperatorExpression;

/**
 * Maps expressions to abstract values in the environment of an {@link AnalysisContext}.
 *
 * <p>Evaluation has no effect on the environment: a {@code bits.pop(0)} call evaluates to the
 * element it removes, and the removal itself is applied by {@link StatementWalker} once the
 * enclosing statement has been evaluated. Several pops of one list within a statement are
 * ordered by {@link #pinPops}. Anything not recognized evaluates to {@link
 * AbstractValue#UNKNOWN}.
 */
final class ExpressionEvaluator {

  // Indices beyond this are not plausible token positions.
  private static final int MAX_INDEX = 1 << 16;

  /** Builtins that neither consume nor retain a list passed to them. */
  static final ImmutableSet<String> PURE_BUILTINS =
      ImmutableSet.of(
          "all", "any", "bool", "enumerate", "filter", "int", "isinstance", "iter", "len", "list",
          "map", "max", "min", "print", "range", "repr", "reversed", "set", "sorted", "str",
          "sum", "tuple", "zip");

  private ExpressionEvaluator() {}

  static AbstractValue eval(AnalysisContext ctx, Expression expr) {
    AbstractValue pinned = ctx.pinned(expr);
    if (pinned != null) {
      return pinned;
    }
    switch (expr.kind()) {
      case IDENTIFIER:
        return ctx.env().lookup(((Identifier) expr).getName());
      case INT_LITERAL:
        {
          Integer value = ((IntLiteral) expr).getIntValue();
          return value != null ? AbstractValue.intLiteral(value) : AbstractValue.UNKNOWN;
        }
      case STRING_LITERAL:
        return AbstractValue.strLiteral(((StringLiteral) expr).getValue());
      case UNARY_OPERATOR:
        return evalUnaryOperator(ctx, (UnaryOperatorExpression) expr);
      case LIST_EXPR:
        return evalList(ctx, (ListExpression) expr);
      case CALL:
        return evalCall(ctx, (CallExpression) expr);
      case INDEX:
        return evalIndex(ctx, (IndexExpression) expr);
      case SLICE:
        return evalSlice(ctx, (SliceExpression) expr);
      case AWAIT:
      case BINARY_OPERATOR:
      case CHAINED_COMPARISON:
      case COMPREHENSION:
      case CONDITIONAL:
      case DICT_EXPR:
      case DOT:
      case ELLIPSIS:
      case FLOAT_LITERAL:
      case LAMBDA:
      case STARRED:
      case YIELD:
        return AbstractValue.UNKNOWN;
    }
    throw new IllegalArgumentException("unexpected expression: " + expr.kind());
  }

  private static AbstractValue evalUnaryOperator(AnalysisContext ctx, UnaryOperatorExpression u) {
    if (u.getOperator() == TokenKind.MINUS) {
      AbstractValue x = eval(ctx, u.getX());
      if (x.kind() == AbstractValue.Kind.INT_LITERAL) {
        return AbstractValue.intLiteral(-x.getInt());
      }
    }
    return AbstractValue.UNKNOWN;
  }

  private static AbstractValue evalList(AnalysisContext ctx, ListExpression list) {
    ImmutableList.Builder<AbstractValue> elements = ImmutableList.builder();
    for (Expression elem : list.getElements()) {
      if (elem.kind() == Expression.Kind.STARRED) {
        return AbstractValue.UNKNOWN;
      }
      elements.add(eval(ctx, elem));
    }
    // Sets only ever matter as the right operand of "in", where they behave like lists.
    return list.isTuple()
        ? AbstractValue.tuple(elements.build())
        : AbstractValue.listOf(elements.build());
  }

  private static AbstractValue evalCall(AnalysisContext ctx, CallExpression call) {
    Expression fn = call.getFunction();
    if (fn instanceof DotExpression dot) {
      return evalMethodCall(ctx, call, dot.getObject(), dot.getField().getName());
    }
    if (!(fn instanceof Identifier id)) {
      return AbstractValue.UNKNOWN;
    }
    String name = id.getName();
    List<Expression> args = call.getPositionalArguments();
    switch (name) {
      case "len":
        if (args != null && args.size() == 1) {
          AbstractValue x = eval(ctx, args.get(0));
          if (x.isSplitResult()) {
            return AbstractValue.splitLength(x.getOffsets());
          }
          if (x.kind() == AbstractValue.Kind.TUPLE || x.kind() == AbstractValue.Kind.LIST_OF) {
            return AbstractValue.intLiteral(x.getElements().size());
          }
        }
        return AbstractValue.UNKNOWN;
      case "list":
      case "tuple":
        // Copying a split result yields an equal list.
        if (args != null && args.size() == 1) {
          AbstractValue x = eval(ctx, args.get(0));
          if (x.isSplitResult()) {
            return x;
          }
        }
        return AbstractValue.UNKNOWN;
      default:
        break;
    }
    HelperSummary helper = resolveHelperCall(ctx, call);
    return helper != null ? helper.returnValue() : AbstractValue.UNKNOWN;
  }

  private static AbstractValue evalMethodCall(
      AnalysisContext ctx, CallExpression call, Expression receiver, String method) {
    List<Argument> args = call.getArguments();
    switch (method) {
      case "split_contents":
        if (args.isEmpty() && isTokenExpression(ctx, receiver)) {
          return AbstractValue.freshSplit();
        }
        return AbstractValue.UNKNOWN;
      case "split":
        if (receiver instanceof DotExpression contents
            && contents.getField().getName().equals("contents")
            && isTokenExpression(ctx, contents.getObject())) {
          if (args.isEmpty()) {
            return AbstractValue.freshSplit();
          }
          if (isNoneThenOne(call)) {
            // The tag name, then the unsplit remainder.
            return AbstractValue.tuple(
                ImmutableList.of(
                    AbstractValue.splitElement(SplitPosition.forward(0)), AbstractValue.UNKNOWN));
          }
        }
        return AbstractValue.UNKNOWN;
      case "pop":
        {
          AbstractValue list = eval(ctx, receiver);
          if (!list.isSplitResult()) {
            return AbstractValue.UNKNOWN;
          }
          PopKind pop = popKind(ctx, call);
          if (pop == PopKind.BACK) {
            return AbstractValue.splitElement(list.getOffsets().resolveIndex(-1));
          } else if (pop == PopKind.FRONT) {
            return AbstractValue.splitElement(list.getOffsets().resolveIndex(0));
          }
          return AbstractValue.UNKNOWN;
        }
      default:
        // Parser methods and everything else are opaque.
        return AbstractValue.UNKNOWN;
    }
  }

  /**
   * Pins the value of each pop in {@code expr}, and of each later mention of a list it popped
   * from, in evaluation order. In {@code a, b = bits.pop(), bits.pop()} the second pop yields the
   * element before the one the first pop removed. The pins hold until {@link
   * AnalysisContext#unpin}.
   */
  static void pinPops(AnalysisContext ctx, Expression expr) {
    Map<String, AbstractValue> popped = new HashMap<>();
    Map<Expression, AbstractValue> pins = new IdentityHashMap<>();
    new NodeVisitor() {
      @Override
      public void visit(Identifier node) {
        AbstractValue list = popped.get(node.getName());
        if (list != null) {
          pins.put(node, list);
        }
      }

      @Override
      public void visit(CallExpression node) {
        super.visit(node);
        if (!(node.getFunction() instanceof DotExpression dot)
            || !dot.getField().getName().equals("pop")
            || !(dot.getObject() instanceof Identifier receiver)) {
          return;
        }
        String name = receiver.getName();
        AbstractValue list = popped.getOrDefault(name, ctx.env().lookup(name));
        if (!list.isSplitResult()) {
          return;
        }
        switch (popKind(ctx, node)) {
          case FRONT:
            pins.put(node, AbstractValue.splitElement(list.getOffsets().resolveIndex(0)));
            popped.put(name, list.afterFrontPop());
            break;
          case BACK:
            pins.put(node, AbstractValue.splitElement(list.getOffsets().resolveIndex(-1)));
            popped.put(name, list.afterBackPop());
            break;
          case OTHER:
            pins.put(node, AbstractValue.UNKNOWN);
            popped.put(name, AbstractValue.UNKNOWN);
            break;
        }
      }

      @Override
      public void visit(LambdaExpression node) {}
    }.visit(expr);
    if (!pins.isEmpty()) {
      ctx.pin(pins);
    }
  }

  /** Reports whether {@code expr} denotes the token: {@code token} or {@code parser.token}. */
  private static boolean isTokenExpression(AnalysisContext ctx, Expression expr) {
    AbstractValue value = eval(ctx, expr);
    if (value.kind() == AbstractValue.Kind.TOKEN_HANDLE) {
      return true;
    }
    return expr instanceof DotExpression dot
        && dot.getField().getName().equals("token")
        && eval(ctx, dot.getObject()).kind() == AbstractValue.Kind.PARSER_HANDLE;
  }

  private static boolean isNoneThenOne(CallExpression call) {
    List<Expression> args = call.getPositionalArguments();
    return args != null
        && args.size() == 2
        && args.get(0) instanceof Identifier none
        && none.isNone()
        && args.get(1) instanceof IntLiteral one
        && Integer.valueOf(1).equals(one.getIntValue());
  }

  /** Which end of a list a {@code pop} call removes from. */
  enum PopKind {
    FRONT,
    BACK,
    OTHER,
  }

  /** Classifies a {@code x.pop(...)} call by its argument. */
  static PopKind popKind(AnalysisContext ctx, CallExpression call) {
    List<Expression> args = call.getPositionalArguments();
    if (args == null || call.getArguments().size() != args.size()) {
      return PopKind.OTHER;
    }
    if (args.isEmpty()) {
      return PopKind.BACK;
    }
    if (args.size() == 1) {
      AbstractValue index = eval(ctx, args.get(0));
      if (index.kind() == AbstractValue.Kind.INT_LITERAL) {
        if (index.getInt() == 0) {
          return PopKind.FRONT;
        } else if (index.getInt() == -1) {
          return PopKind.BACK;
        }
      }
    }
    return PopKind.OTHER;
  }

  private static AbstractValue evalIndex(AnalysisContext ctx, IndexExpression index) {
    AbstractValue object = eval(ctx, index.getObject());
    AbstractValue key = eval(ctx, index.getKey());
    if (key.kind() != AbstractValue.Kind.INT_LITERAL || Math.abs(key.getInt()) > MAX_INDEX) {
      return AbstractValue.UNKNOWN;
    }
    int i = (int) key.getInt();
    switch (object.kind()) {
      case SPLIT_RESULT:
        return AbstractValue.splitElement(object.getOffsets().resolveIndex(i));
      case TUPLE:
      case LIST_OF:
        {
          List<AbstractValue> elements = object.getElements();
          int j = i >= 0 ? i : elements.size() + i;
          return j >= 0 && j < elements.size() ? elements.get(j) : AbstractValue.UNKNOWN;
        }
      default:
        return AbstractValue.UNKNOWN;
    }
  }

  private static AbstractValue evalSlice(AnalysisContext ctx, SliceExpression slice) {
    AbstractValue object = eval(ctx, slice.getObject());
    if (!object.isSplitResult() || slice.getStep() != null) {
      return AbstractValue.UNKNOWN;
    }
    Integer start = null;
    Integer stop = null;
    if (slice.getStart() != null) {
      start = intBound(ctx, slice.getStart());
      if (start == null) {
        return AbstractValue.UNKNOWN;
      }
    }
    if (slice.getStop() != null) {
      stop = intBound(ctx, slice.getStop());
      if (stop == null) {
        return AbstractValue.UNKNOWN;
      }
    }
    return object.slice(start, stop);
  }

  @Nullable
  private static Integer intBound(AnalysisContext ctx, Expression bound) {
    AbstractValue value = eval(ctx, bound);
    if (value.kind() != AbstractValue.Kind.INT_LITERAL || Math.abs(value.getInt()) > MAX_INDEX) {
      return null;
    }
    return (int) value.getInt();
  }

  /**
   * Returns the summary of a call to a same-module helper, or null if {@code call} does not call
   * one with plain positional and keyword arguments.
   */
  @Nullable
  static HelperSummary resolveHelperCall(AnalysisContext ctx, CallExpression call) {
    if (!(call.getFunction() instanceof Identifier id)
        || !ctx.resolver().isHelper(id.getName())) {
      return null;
    }
    ImmutableList.Builder<AbstractValue> positional = ImmutableList.builder();
    ImmutableMap.Builder<String, AbstractValue> keywords = ImmutableMap.builder();
    for (Argument arg : call.getArguments()) {
      if (arg instanceof Argument.Positional) {
        positional.add(eval(ctx, arg.getValue()));
      } else if (arg instanceof Argument.Keyword) {
        keywords.put(arg.getName(), eval(ctx, arg.getValue()));
      } else {
        return null;
      }
    }
    return ctx.resolver()
        .resolve(ctx, id.getName(), positional.build(), keywords.buildKeepingLast());
  }
}
