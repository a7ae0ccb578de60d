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
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import net.djls.java.syntax.Argument;
import net.djls.java.syntax.AssignmentStatement;
import net.djls.java.syntax.CallExpression;
import net.djls.java.syntax.ClassStatement;
import net.djls.java.syntax.DefStatement;
import net.djls.java.syntax.DelStatement;
import net.djls.java.syntax.DotExpression;
import net.djls.java.syntax.Expression;
import net.djls.java.syntax.ExpressionStatement;
import net.djls.java.syntax.ForStatement;
import net.djls.java.syntax.Identifier;
import net.djls.java.syntax.IfStatement;
import net.djls.java.syntax.IndexExpression;
import net.djls.java.syntax.LambdaExpression;
import net.djls.java.syntax.ListExpression;
import net.djls.java.syntax.MatchStatement;
import net.djls.java.syntax.NodeVisitor;
import net.djls.java.syntax.ReturnStatement;
import net.djls.java.syntax.SliceExpression;
import net.djls.java.syntax.StarredExpression;
import net.djls.java.syntax.Statement;
import net.djls.java.syntax.StringLiteral;
import net.djls.java.syntax.TryStatement;
import net.djls.java.syntax.WhileStatement;
import net.djls.java.syntax.WithStatement;

/**
 * Walks the statements of a function in source order, updating the environment and collecting
 * the constraints of the guards it passes.
 *
 * <p>Branches are not forked: every arm of an {@code if} runs against the one environment, and a
 * guard's condition is evaluated against the bindings at that point of the walk.
 */
final class StatementWalker {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  // List methods that change a list in place other than by popping.
  private static final ImmutableSet<String> MUTATORS =
      ImmutableSet.of("append", "extend", "insert", "remove", "clear", "reverse", "sort");

  private StatementWalker() {}

  /** Walks {@code statements} and returns the combined result. */
  static WalkResult walk(AnalysisContext ctx, List<Statement> statements) {
    WalkResult result = WalkResult.EMPTY;
    for (Statement st : statements) {
      result = result.or(exec(ctx, st));
    }
    return result;
  }

  private static WalkResult exec(AnalysisContext ctx, Statement st) {
    switch (st.kind()) {
      case ASSIGNMENT:
        return execAssignment(ctx, (AssignmentStatement) st);
      case EXPRESSION:
        {
          Expression expr = ((ExpressionStatement) st).getExpression();
          ExpressionEvaluator.pinPops(ctx, expr);
          return WalkResult.of(applyEffects(ctx, expr));
        }
      case IF:
        return execIf(ctx, (IfStatement) st);
      case FOR:
        return execFor(ctx, (ForStatement) st);
      case WHILE:
        return execWhile(ctx, (WhileStatement) st);
      case MATCH:
        return execMatch(ctx, (MatchStatement) st);
      case TRY:
        return execTry(ctx, (TryStatement) st);
      case WITH:
        return execWith(ctx, (WithStatement) st);
      case RETURN:
        return execReturn(ctx, (ReturnStatement) st);
      case DEL:
        execDel(ctx, (DelStatement) st);
        return WalkResult.EMPTY;
      case DEF:
        ctx.env().bind(((DefStatement) st).getName(), AbstractValue.UNKNOWN);
        return WalkResult.EMPTY;
      case CLASS:
        ctx.env().bind(((ClassStatement) st).getIdentifier().getName(), AbstractValue.UNKNOWN);
        return WalkResult.EMPTY;
      case ASSERT:
      case FLOW:
      case GLOBAL:
      case IMPORT:
      case RAISE:
        return WalkResult.EMPTY;
    }
    throw new IllegalArgumentException("unexpected statement: " + st.kind());
  }

  private static WalkResult execAssignment(AnalysisContext ctx, AssignmentStatement node) {
    Expression rhs = node.getRHS();
    if (rhs == null) {
      return WalkResult.EMPTY;
    }
    AbstractValue value = evalStatementExpression(ctx, rhs);
    ConstraintSet constraints = applyEffects(ctx, rhs);
    if (node.isAugmented()) {
      // "x += ..." extends a list in place or rebinds anything else.
      Expression lhs = node.getLHS();
      if (lhs instanceof Identifier id) {
        ctx.env().bind(id.getName(), AbstractValue.UNKNOWN);
      } else {
        invalidateBase(ctx, lhs);
      }
      return WalkResult.of(constraints);
    }
    for (Expression target : node.getTargets()) {
      assign(ctx, target, value);
    }
    return WalkResult.of(constraints);
  }

  /** Binds {@code value} to the target {@code lhs}. */
  private static void assign(AnalysisContext ctx, Expression lhs, AbstractValue value) {
    if (lhs instanceof Identifier id) {
      ctx.env().bind(id.getName(), value);
    } else if (lhs instanceof ListExpression list) {
      assignSequence(ctx, list.getElements(), value);
    } else if (lhs instanceof StarredExpression star) {
      assign(ctx, star.getValue(), AbstractValue.UNKNOWN);
    } else if (lhs instanceof SliceExpression slice && slice.getObject() instanceof Identifier id) {
      // "bits[:] = x" replaces the contents.
      ctx.env().update(id.getName(), value.isSplitResult() ? value : AbstractValue.UNKNOWN);
    }
    // Assigning an element or attribute leaves the tracked length unchanged.
  }

  private static void assignSequence(
      AnalysisContext ctx, List<Expression> targets, AbstractValue value) {
    int n = targets.size();
    int star = -1;
    for (int i = 0; i < n; i++) {
      if (targets.get(i) instanceof StarredExpression) {
        star = i;
        break;
      }
    }
    if (value.isSplitResult()) {
      SplitOffsets offsets = value.getOffsets();
      for (int i = 0; i < n; i++) {
        Expression target = targets.get(i);
        if (i == star) {
          int after = n - star - 1;
          assign(
              ctx,
              ((StarredExpression) target).getValue(),
              AbstractValue.splitResult(
                  SplitOffsets.of(offsets.front() + star, offsets.back() + after)));
        } else if (star >= 0 && i > star) {
          assign(ctx, target, AbstractValue.splitElement(offsets.resolveIndex(i - n)));
        } else {
          assign(ctx, target, AbstractValue.splitElement(offsets.resolveIndex(i)));
        }
      }
      return;
    }
    if (value.kind() == AbstractValue.Kind.TUPLE || value.kind() == AbstractValue.Kind.LIST_OF) {
      ImmutableList<AbstractValue> elements = value.getElements();
      for (int i = 0; i < n; i++) {
        boolean known = (star < 0 || i < star) && i < elements.size();
        assign(ctx, targets.get(i), known ? elements.get(i) : AbstractValue.UNKNOWN);
      }
      return;
    }
    for (Expression target : targets) {
      assign(ctx, target, AbstractValue.UNKNOWN);
    }
  }

  private static WalkResult execIf(AnalysisContext ctx, IfStatement node) {
    Expression cond = node.getCondition();
    ConstraintSet guard = ConstraintSet.EMPTY;
    ExpressionEvaluator.pinPops(ctx, cond);
    if (ctx.raisesValidationError(node.getThenBlock())) {
      guard = ConstraintExtractor.extract(ctx, cond);
      logger.atFine().log(
          "%s: guard at %s yields %s", ctx.functionName(), node.getStartLocation(), guard);
    }
    boolean elementTest = ConstraintExtractor.comparesElement(ctx, cond);
    ConstraintSet condEffects = applyEffects(ctx, cond);

    WalkResult body = walk(ctx, node.getThenBlock());
    if (elementTest) {
      // Checks made only when some piece has a particular value hold only for that value.
      body = body.withConstraints(body.constraints().withoutPositional());
    }
    WalkResult result = WalkResult.of(guard.or(condEffects)).or(body);
    if (node.getElseBlock() != null) {
      result = result.or(walk(ctx, node.getElseBlock()));
    }
    return result;
  }

  private static WalkResult execFor(AnalysisContext ctx, ForStatement node) {
    AbstractValue iterable = evalStatementExpression(ctx, node.getIterable());
    ConstraintSet effects = applyEffects(ctx, node.getIterable());
    AbstractValue element =
        iterable.isSplitResult()
            ? AbstractValue.splitElement(SplitPosition.unresolvedForward())
            : AbstractValue.UNKNOWN;
    if (node.getVars() instanceof Identifier var) {
      ctx.env().bind(var.getName(), element);
    } else {
      assign(ctx, node.getVars(), AbstractValue.UNKNOWN);
    }

    // The body is walked once, but any list it changes has an unknown length on every pass.
    for (String name : touchedNames(null, node.getBody())) {
      if (isList(ctx.env().lookup(name))) {
        ctx.env().invalidate(name);
      }
    }
    ImmutableMap<String, AbstractValue> before = ctx.env().snapshot();
    WalkResult body = walk(ctx, node.getBody());
    invalidateChangedLists(ctx, before);
    return WalkResult.of(effects).or(body).or(walk(ctx, node.getElseBlock()));
  }

  private static WalkResult execWhile(AnalysisContext ctx, WhileStatement node) {
    OptionLoop loop = OptionLoopDetector.detect(ctx, node);
    if (loop != null) {
      logger.atFine().log("%s: option loop %s", ctx.functionName(), loop);
    } else {
      logger.atFiner().log(
          "%s: while loop at %s is opaque", ctx.functionName(), node.getStartLocation());
    }
    // The body runs an unknown number of times; whatever it touches is no longer tracked.
    for (String name : touchedNames(node.getCondition(), node.getBody())) {
      ctx.env().invalidate(name);
    }
    WalkResult result = loop != null ? WalkResult.ofOptionLoop(loop) : WalkResult.EMPTY;
    return result.or(walk(ctx, node.getElseBlock()));
  }

  private static WalkResult execMatch(AnalysisContext ctx, MatchStatement node) {
    AbstractValue subject = evalStatementExpression(ctx, node.getSubject());
    ConstraintSet effects = applyEffects(ctx, node.getSubject());
    ConstraintSet arms = MatchArms.extract(ctx, node, subject);
    logger.atFine().log("%s: match over %s yields %s", ctx.functionName(), subject, arms);
    WalkResult result = WalkResult.of(effects.or(arms));
    for (MatchStatement.Case arm : node.getCases()) {
      MatchArms.bindCaptures(ctx, arm.getPattern(), subject);
      result = result.or(walk(ctx, arm.getBody()));
    }
    return result;
  }

  private static WalkResult execTry(AnalysisContext ctx, TryStatement node) {
    WalkResult result = walk(ctx, node.getBody());
    for (TryStatement.Handler handler : node.getHandlers()) {
      if (handler.getName() != null) {
        ctx.env().bind(handler.getName().getName(), AbstractValue.UNKNOWN);
      }
      result = result.or(walk(ctx, handler.getBody()));
    }
    return result.or(walk(ctx, node.getElseBlock())).or(walk(ctx, node.getFinallyBlock()));
  }

  private static WalkResult execWith(AnalysisContext ctx, WithStatement node) {
    ConstraintSet effects = ConstraintSet.EMPTY;
    for (WithStatement.Item item : node.getItems()) {
      ExpressionEvaluator.pinPops(ctx, item.getContext());
      effects = effects.or(applyEffects(ctx, item.getContext()));
      if (item.getTarget() != null) {
        assign(ctx, item.getTarget(), AbstractValue.UNKNOWN);
      }
    }
    return WalkResult.of(effects).or(walk(ctx, node.getBody()));
  }

  private static WalkResult execReturn(AnalysisContext ctx, ReturnStatement node) {
    if (node.getResult() == null) {
      return WalkResult.ofReturn(AbstractValue.UNKNOWN);
    }
    AbstractValue value = evalStatementExpression(ctx, node.getResult());
    ConstraintSet effects = applyEffects(ctx, node.getResult());
    return WalkResult.ofReturn(value).withConstraints(effects);
  }

  private static void execDel(AnalysisContext ctx, DelStatement node) {
    for (Expression target : node.getTargets()) {
      if (target instanceof Identifier id) {
        ctx.env().bind(id.getName(), AbstractValue.UNKNOWN);
      } else if (target instanceof IndexExpression index
          && index.getObject() instanceof Identifier id) {
        AbstractValue key = ExpressionEvaluator.eval(ctx, index.getKey());
        boolean isInt = key.kind() == AbstractValue.Kind.INT_LITERAL;
        if (isInt && key.getInt() == 0) {
          ctx.env().applyFrontPop(id.getName());
        } else if (isInt && key.getInt() == -1) {
          ctx.env().applyBackPop(id.getName());
        } else {
          ctx.env().invalidate(id.getName());
        }
      } else if (target instanceof SliceExpression slice
          && slice.getObject() instanceof Identifier id) {
        ctx.env().update(id.getName(), afterDeletingSlice(ctx, slice));
      }
    }
  }

  /** Returns the value of a list after {@code del list[:n]} or {@code del list[-k:]}. */
  private static AbstractValue afterDeletingSlice(AnalysisContext ctx, SliceExpression slice) {
    AbstractValue list = ExpressionEvaluator.eval(ctx, slice.getObject());
    if (!list.isSplitResult() || slice.getStep() != null) {
      return AbstractValue.UNKNOWN;
    }
    Expression start = slice.getStart();
    Expression stop = slice.getStop();
    if (start == null && stop != null) {
      AbstractValue n = ExpressionEvaluator.eval(ctx, stop);
      if (n.kind() == AbstractValue.Kind.INT_LITERAL && n.getInt() >= 0 && n.getInt() < 1 << 16) {
        return list.slice((int) n.getInt(), null);
      }
    } else if (start != null && stop == null) {
      AbstractValue k = ExpressionEvaluator.eval(ctx, start);
      if (k.kind() == AbstractValue.Kind.INT_LITERAL && k.getInt() < 0 && k.getInt() > -(1 << 16)) {
        return list.slice(null, (int) k.getInt());
      }
    }
    return AbstractValue.UNKNOWN;
  }

  /** Evaluates the top-level expression of a statement, ahead of applyEffects. */
  private static AbstractValue evalStatementExpression(AnalysisContext ctx, Expression expr) {
    ExpressionEvaluator.pinPops(ctx, expr);
    return ExpressionEvaluator.eval(ctx, expr);
  }

  /**
   * Applies the effects of the calls in {@code expr}, which has just been evaluated: pops remove
   * elements, helpers and external functions act on the lists passed to them. Returns the
   * constraints of the helpers called, and releases the values pinned for the statement.
   */
  private static ConstraintSet applyEffects(AnalysisContext ctx, @Nullable Expression expr) {
    ConstraintSet result = expr != null ? applyCallEffects(ctx, expr) : ConstraintSet.EMPTY;
    ctx.unpin();
    return result;
  }

  private static ConstraintSet applyCallEffects(AnalysisContext ctx, Expression expr) {
    List<CallExpression> calls = callsIn(expr);
    if (calls.isEmpty()) {
      return ConstraintSet.EMPTY;
    }
    // Helpers see the arguments as they were when the expression was evaluated.
    Map<CallExpression, HelperSummary> helpers = new LinkedHashMap<>();
    for (CallExpression call : calls) {
      HelperSummary summary = ExpressionEvaluator.resolveHelperCall(ctx, call);
      if (summary != null && summary.analyzed()) {
        helpers.put(call, summary);
      }
    }
    ConstraintSet result = ConstraintSet.EMPTY;
    for (CallExpression call : calls) {
      HelperSummary summary = helpers.get(call);
      if (summary != null) {
        result = result.or(summary.constraints());
        applyArgumentEffects(ctx, call, summary);
      } else {
        applyCallEffect(ctx, call);
      }
    }
    return result;
  }

  private static void applyArgumentEffects(
      AnalysisContext ctx, CallExpression call, HelperSummary summary) {
    List<Expression> positional = call.getPositionalArguments();
    for (Map.Entry<Integer, AbstractValue> effect : summary.argumentEffects().entrySet()) {
      if (positional.get(effect.getKey()) instanceof Identifier id) {
        ctx.env().update(id.getName(), effect.getValue());
      }
    }
  }

  private static void applyCallEffect(AnalysisContext ctx, CallExpression call) {
    Expression fn = call.getFunction();
    if (fn instanceof DotExpression dot) {
      if (dot.getObject() instanceof StringLiteral) {
        return; // "sep".join(bits)
      }
      if (dot.getObject() instanceof Identifier receiver) {
        String name = receiver.getName();
        AbstractValue value = ctx.env().lookup(name);
        String method = dot.getField().getName();
        if (method.equals("pop") && value.isSplitResult()) {
          switch (ExpressionEvaluator.popKind(ctx, call)) {
            case FRONT:
              ctx.env().applyFrontPop(name);
              break;
            case BACK:
              ctx.env().applyBackPop(name);
              break;
            case OTHER:
              ctx.env().invalidate(name);
              break;
          }
          return;
        }
        if (MUTATORS.contains(method) && isList(value)) {
          ctx.env().invalidate(name);
          return;
        }
        if (value.kind() == AbstractValue.Kind.TOKEN_HANDLE) {
          return;
        }
        if (value.kind() == AbstractValue.Kind.PARSER_HANDLE
            && ctx.options().opaqueParserMethods().contains(method)) {
          logger.atFinest().log("%s.%s leaves its arguments intact", name, method);
          return;
        }
      }
      invalidateArguments(ctx, call);
      return;
    }
    if (fn instanceof Identifier id) {
      if (ctx.options().tokenKwargsFunctions().contains(id.getName())) {
        logger.atFiner().log("%s consumes its arguments", id.getName());
        invalidateArguments(ctx, call);
        return;
      }
      if (ExpressionEvaluator.PURE_BUILTINS.contains(id.getName())) {
        return;
      }
    }
    invalidateArguments(ctx, call);
  }

  /** Forgets the lists passed by name to a function the analysis does not follow. */
  private static void invalidateArguments(AnalysisContext ctx, CallExpression call) {
    for (Argument arg : call.getArguments()) {
      if ((arg instanceof Argument.Positional || arg instanceof Argument.Keyword)
          && arg.getValue() instanceof Identifier id
          && isList(ctx.env().lookup(id.getName()))) {
        logger.atFiner().log("%s passed to %s is no longer tracked", id.getName(), call);
        ctx.env().invalidate(id.getName());
      }
    }
  }

  private static void invalidateBase(AnalysisContext ctx, Expression target) {
    if (target instanceof IndexExpression index && index.getObject() instanceof Identifier id) {
      ctx.env().invalidate(id.getName());
    } else if (target instanceof SliceExpression slice
        && slice.getObject() instanceof Identifier id) {
      ctx.env().invalidate(id.getName());
    }
  }

  private static boolean isList(AbstractValue value) {
    return value.isSplitResult() || value.kind() == AbstractValue.Kind.LIST_OF;
  }

  /** Returns the calls in {@code expr}, innermost first. Lambda bodies are skipped. */
  private static List<CallExpression> callsIn(Expression expr) {
    List<CallExpression> calls = new ArrayList<>();
    new NodeVisitor() {
      @Override
      public void visit(CallExpression node) {
        super.visit(node);
        calls.add(node);
      }

      @Override
      public void visit(LambdaExpression node) {}
    }.visit(expr);
    return calls;
  }

  /** Lists a loop body changed in place or rebound no longer hold known values afterwards. */
  private static void invalidateChangedLists(
      AnalysisContext ctx, ImmutableMap<String, AbstractValue> before) {
    for (Map.Entry<String, AbstractValue> e : before.entrySet()) {
      if (isList(e.getValue()) && !ctx.env().lookup(e.getKey()).equals(e.getValue())) {
        ctx.env().update(e.getKey(), AbstractValue.UNKNOWN);
      }
    }
  }

  /**
   * Returns the names a loop may rebind or mutate: assignment targets, receivers of methods, and
   * names passed to functions.
   */
  private static Set<String> touchedNames(@Nullable Expression condition, List<Statement> body) {
    Set<String> names = new LinkedHashSet<>();
    NodeVisitor collector =
        new NodeVisitor() {
          @Override
          public void visit(AssignmentStatement node) {
            for (Expression target : node.getTargets()) {
              addTargetNames(target);
            }
            super.visit(node);
          }

          @Override
          public void visit(ForStatement node) {
            addTargetNames(node.getVars());
            super.visit(node);
          }

          @Override
          public void visit(DelStatement node) {
            for (Expression target : node.getTargets()) {
              addTargetNames(target);
            }
            super.visit(node);
          }

          @Override
          public void visit(CallExpression node) {
            if (node.getFunction() instanceof DotExpression dot
                && dot.getObject() instanceof Identifier receiver) {
              names.add(receiver.getName());
            }
            boolean pure =
                node.getFunction() instanceof Identifier fn
                    && ExpressionEvaluator.PURE_BUILTINS.contains(fn.getName());
            if (!pure) {
              for (Argument arg : node.getArguments()) {
                if (arg.getValue() instanceof Identifier id) {
                  names.add(id.getName());
                }
              }
            }
            super.visit(node);
          }

          private void addTargetNames(Expression target) {
            if (target instanceof Identifier id) {
              names.add(id.getName());
            } else if (target instanceof ListExpression list) {
              for (Expression e : list.getElements()) {
                addTargetNames(e);
              }
            } else if (target instanceof StarredExpression star) {
              addTargetNames(star.getValue());
            } else if (target instanceof IndexExpression index) {
              addTargetNames(index.getObject());
            } else if (target instanceof SliceExpression slice) {
              addTargetNames(slice.getObject());
            }
          }
        };
    if (condition != null) {
      collector.visit(condition);
    }
    collector.visitBlock(body);
    return names;
  }
}
