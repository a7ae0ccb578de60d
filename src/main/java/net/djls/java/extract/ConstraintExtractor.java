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
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import net.djls.java.syntax.BinaryOperatorExpression;
import net.djls.java.syntax.ChainedComparison;
import net.djls.java.syntax.Expression;
import net.djls.java.syntax.NodeVisitor;
import net.djls.java.syntax.TokenKind;
import net.djls.java.syntax.UnaryOperatorExpression;

/**
 * Turns the condition of a guard, an {@code if} whose body raises a validation error, into the
 * constraints that valid input must satisfy.
 *
 * <p>The condition describes invalid input. {@code len(bits) < 3} raising means at least three
 * pieces are required; {@code bits[2] != "by"} raising means the third piece must be {@code by}.
 * Operands the analysis does not track yield no constraint.
 */
final class ConstraintExtractor {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private ConstraintExtractor() {}

  /** Returns the constraints implied by a guard raising when {@code condition} holds. */
  static ConstraintSet extract(AnalysisContext ctx, Expression condition) {
    return extract(ctx, condition, false);
  }

  private static ConstraintSet extract(AnalysisContext ctx, Expression cond, boolean negated) {
    switch (cond.kind()) {
      case UNARY_OPERATOR:
        {
          UnaryOperatorExpression unary = (UnaryOperatorExpression) cond;
          if (unary.getOperator() == TokenKind.NOT) {
            return extract(ctx, unary.getX(), !negated);
          }
          return ConstraintSet.EMPTY;
        }
      case BINARY_OPERATOR:
        {
          BinaryOperatorExpression binop = (BinaryOperatorExpression) cond;
          TokenKind op = binop.getOperator();
          if (op == TokenKind.AND || op == TokenKind.OR) {
            ConstraintSet x = extract(ctx, binop.getX(), negated);
            ConstraintSet y = extract(ctx, binop.getY(), negated);
            // De Morgan: "not (a and b)" fires when either side is false.
            boolean disjunction = (op == TokenKind.OR) != negated;
            return disjunction ? x.or(y) : x.and(y);
          }
          if (binop.isComparison()) {
            TokenKind effective = negated ? negate(op) : op;
            if (effective == null) {
              return ConstraintSet.EMPTY;
            }
            return comparison(ctx, binop.getX(), effective, binop.getY());
          }
          return ConstraintSet.EMPTY;
        }
      case CHAINED_COMPARISON:
        return range(ctx, (ChainedComparison) cond, negated);
      default:
        return ConstraintSet.EMPTY;
    }
  }

  /** Returns the operator of the negated comparison, or null if there is none. */
  @Nullable
  static TokenKind negate(TokenKind op) {
    switch (op) {
      case LESS:
        return TokenKind.GREATER_EQUALS;
      case GREATER_EQUALS:
        return TokenKind.LESS;
      case GREATER:
        return TokenKind.LESS_EQUALS;
      case LESS_EQUALS:
        return TokenKind.GREATER;
      case EQUALS_EQUALS:
        return TokenKind.NOT_EQUALS;
      case NOT_EQUALS:
        return TokenKind.EQUALS_EQUALS;
      case IN:
        return TokenKind.NOT_IN;
      case NOT_IN:
        return TokenKind.IN;
      case IS:
        return TokenKind.IS_NOT;
      case IS_NOT:
        return TokenKind.IS;
      default:
        return null;
    }
  }

  /** Returns the operator with its operands swapped: {@code a < b} is {@code b > a}. */
  @Nullable
  private static TokenKind swap(TokenKind op) {
    switch (op) {
      case LESS:
        return TokenKind.GREATER;
      case GREATER:
        return TokenKind.LESS;
      case LESS_EQUALS:
        return TokenKind.GREATER_EQUALS;
      case GREATER_EQUALS:
        return TokenKind.LESS_EQUALS;
      case EQUALS_EQUALS:
      case NOT_EQUALS:
        return op;
      default:
        return null;
    }
  }

  private static ConstraintSet comparison(
      AnalysisContext ctx, Expression left, TokenKind op, Expression right) {
    AbstractValue x = ExpressionEvaluator.eval(ctx, left);
    AbstractValue y = ExpressionEvaluator.eval(ctx, right);

    if (x.kind() == AbstractValue.Kind.SPLIT_LENGTH) {
      if (y.kind() == AbstractValue.Kind.INT_LITERAL) {
        return length(x.getOffsets(), op, y.getInt());
      }
      if (op == TokenKind.NOT_IN) {
        return lengthNotIn(x.getOffsets(), y);
      }
    } else if (y.kind() == AbstractValue.Kind.SPLIT_LENGTH
        && x.kind() == AbstractValue.Kind.INT_LITERAL) {
      TokenKind swapped = swap(op);
      return swapped != null ? length(y.getOffsets(), swapped, x.getInt()) : ConstraintSet.EMPTY;
    }

    if (x.kind() == AbstractValue.Kind.SPLIT_ELEMENT) {
      return element(x.getPosition(), op, y);
    } else if (y.kind() == AbstractValue.Kind.SPLIT_ELEMENT && op == TokenKind.NOT_EQUALS) {
      return element(y.getPosition(), op, x);
    }

    logger.atFiner().log("no constraint from comparison of %s and %s", x, y);
    return ConstraintSet.EMPTY;
  }

  /** Constraints from a guard raising when {@code len op n} holds. */
  private static ConstraintSet length(SplitOffsets offsets, TokenKind op, long n) {
    if (n < 0 || n > Integer.MAX_VALUE / 2) {
      return ConstraintSet.EMPTY;
    }
    int count = (int) n;
    switch (op) {
      case LESS:
        return lengthSet(ArgumentCountConstraint.min(offsets.resolveLength(count)));
      case LESS_EQUALS:
        return lengthSet(ArgumentCountConstraint.min(offsets.resolveLength(count + 1)));
      case GREATER:
        return lengthSet(ArgumentCountConstraint.max(offsets.resolveLength(count)));
      case GREATER_EQUALS:
        // "len >= 0" always holds; the guard can never pass.
        return count > 0
            ? lengthSet(ArgumentCountConstraint.max(offsets.resolveLength(count - 1)))
            : ConstraintSet.EMPTY;
      case NOT_EQUALS:
        return lengthSet(ArgumentCountConstraint.exact(offsets.resolveLength(count)));
      default:
        // A single forbidden length is not expressible.
        return ConstraintSet.EMPTY;
    }
  }

  private static ConstraintSet lengthNotIn(SplitOffsets offsets, AbstractValue collection) {
    if (collection.kind() != AbstractValue.Kind.TUPLE
        && collection.kind() != AbstractValue.Kind.LIST_OF) {
      return ConstraintSet.EMPTY;
    }
    List<Integer> counts = new ArrayList<>();
    for (AbstractValue v : collection.getElements()) {
      if (v.kind() != AbstractValue.Kind.INT_LITERAL
          || v.getInt() < 0
          || v.getInt() > Integer.MAX_VALUE / 2) {
        return ConstraintSet.EMPTY;
      }
      counts.add(offsets.resolveLength((int) v.getInt()));
    }
    if (counts.isEmpty()) {
      return ConstraintSet.EMPTY;
    }
    return lengthSet(ArgumentCountConstraint.oneOf(counts));
  }

  private static ConstraintSet lengthSet(ArgumentCountConstraint count) {
    return ConstraintSet.of(Constraint.length(count));
  }

  /** Constraints from a guard raising when {@code element op other} holds. */
  private static ConstraintSet element(SplitPosition position, TokenKind op, AbstractValue other) {
    if (position.isTagName()) {
      return ConstraintSet.EMPTY;
    }
    if (op == TokenKind.NOT_EQUALS && other.kind() == AbstractValue.Kind.STR_LITERAL) {
      return ConstraintSet.of(Constraint.keyword(position, other.getString()));
    }
    if (op == TokenKind.NOT_IN
        && (other.kind() == AbstractValue.Kind.TUPLE
            || other.kind() == AbstractValue.Kind.LIST_OF)) {
      ImmutableList.Builder<String> choices = ImmutableList.builder();
      for (AbstractValue v : other.getElements()) {
        if (v.kind() != AbstractValue.Kind.STR_LITERAL) {
          return ConstraintSet.EMPTY;
        }
        choices.add(v.getString());
      }
      ImmutableList<String> literals = choices.build();
      if (literals.isEmpty()) {
        return ConstraintSet.EMPTY;
      }
      return ConstraintSet.of(
          literals.size() == 1
              ? Constraint.keyword(position, literals.get(0))
              : Constraint.choice(position, literals));
    }
    return ConstraintSet.EMPTY;
  }

  /**
   * Constraints from {@code A <= len <= B} style ranges. Only the negated form, raising outside
   * the range, is expressible.
   */
  private static ConstraintSet range(
      AnalysisContext ctx, ChainedComparison chain, boolean negated) {
    ImmutableList<Expression> operands = chain.getOperands();
    ImmutableList<TokenKind> ops = chain.getOperators();
    if (!negated || operands.size() != 3) {
      return ConstraintSet.EMPTY;
    }
    AbstractValue lo = ExpressionEvaluator.eval(ctx, operands.get(0));
    AbstractValue len = ExpressionEvaluator.eval(ctx, operands.get(1));
    AbstractValue hi = ExpressionEvaluator.eval(ctx, operands.get(2));
    TokenKind loOp = ops.get(0);
    TokenKind hiOp = ops.get(1);
    if (isDescending(loOp) && isDescending(hiOp)) {
      AbstractValue tmp = lo;
      lo = hi;
      hi = tmp;
      TokenKind tmpOp = swap(loOp);
      loOp = swap(hiOp);
      hiOp = tmpOp;
    }
    if (len.kind() != AbstractValue.Kind.SPLIT_LENGTH
        || lo.kind() != AbstractValue.Kind.INT_LITERAL
        || hi.kind() != AbstractValue.Kind.INT_LITERAL
        || !isAscending(loOp)
        || !isAscending(hiOp)) {
      return ConstraintSet.EMPTY;
    }
    long min = loOp == TokenKind.LESS_EQUALS ? lo.getInt() : lo.getInt() + 1;
    long max = hiOp == TokenKind.LESS_EQUALS ? hi.getInt() : hi.getInt() - 1;
    if (min < 0 || max < min || max > Integer.MAX_VALUE / 2) {
      return ConstraintSet.EMPTY;
    }
    SplitOffsets offsets = len.getOffsets();
    return ConstraintSet.of(
        Constraint.length(ArgumentCountConstraint.min(offsets.resolveLength((int) min))),
        Constraint.length(ArgumentCountConstraint.max(offsets.resolveLength((int) max))));
  }

  private static boolean isAscending(@Nullable TokenKind op) {
    return op == TokenKind.LESS || op == TokenKind.LESS_EQUALS;
  }

  private static boolean isDescending(TokenKind op) {
    return op == TokenKind.GREATER || op == TokenKind.GREATER_EQUALS;
  }

  /**
   * Reports whether {@code condition} compares a piece of the split list. Keyword constraints
   * inside the body of such an {@code if} depend on that piece and are discarded.
   */
  static boolean comparesElement(AnalysisContext ctx, Expression condition) {
    boolean[] found = {false};
    new NodeVisitor() {
      @Override
      public void visit(BinaryOperatorExpression node) {
        if (node.isComparison() && (isElement(node.getX()) || isElement(node.getY()))) {
          found[0] = true;
        }
        super.visit(node);
      }

      @Override
      public void visit(ChainedComparison node) {
        for (Expression operand : node.getOperands()) {
          if (isElement(operand)) {
            found[0] = true;
          }
        }
        super.visit(node);
      }

      private boolean isElement(Expression e) {
        return ExpressionEvaluator.eval(ctx, e).kind() == AbstractValue.Kind.SPLIT_ELEMENT;
      }
    }.visit(condition);
    return found[0];
  }
}
