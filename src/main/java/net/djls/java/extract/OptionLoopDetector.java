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

import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import net.djls.java.syntax.AssignmentStatement;
import net.djls.java.syntax.BinaryOperatorExpression;
import net.djls.java.syntax.CallExpression;
import net.djls.java.syntax.DotExpression;
import net.djls.java.syntax.Expression;
import net.djls.java.syntax.Identifier;
import net.djls.java.syntax.IfStatement;
import net.djls.java.syntax.IntLiteral;
import net.djls.java.syntax.ListExpression;
import net.djls.java.syntax.Statement;
import net.djls.java.syntax.StringLiteral;
import net.djls.java.syntax.TokenKind;
import net.djls.java.syntax.WhileStatement;

/**
 * Recognizes the option-parsing loop:
 *
 * <pre>
 * while remaining_bits:
 *     option = remaining_bits.pop(0)
 *     if option in options:
 *         raise TemplateSyntaxError("duplicate option")
 *     if option == "with":
 *         ...
 *     elif option == "only":
 *         ...
 *     else:
 *         raise TemplateSyntaxError("unknown option")
 * </pre>
 */
final class OptionLoopDetector {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private OptionLoopDetector() {}

  /** Returns the option loop {@code loop} implements, or null if it is not one. */
  @Nullable
  static OptionLoop detect(AnalysisContext ctx, WhileStatement loop) {
    if (!(loop.getCondition() instanceof Identifier list)) {
      return null;
    }
    AbstractValue listValue = ctx.env().lookup(list.getName());
    if (!listValue.isSplitResult() && !listValue.isUnknown()) {
      return null;
    }
    String option = null;
    for (Statement st : loop.getBody()) {
      option = frontPopTarget(st, list.getName());
      if (option != null) {
        break;
      }
    }
    if (option == null) {
      return null;
    }

    List<String> options = new ArrayList<>();
    boolean rejectsUnknown = false;
    boolean allowsDuplicates = true;
    for (Statement st : loop.getBody()) {
      if (!(st instanceof IfStatement)) {
        continue;
      }
      IfStatement arm = (IfStatement) st;
      while (true) {
        Expression test = arm.getCondition();
        if (isDuplicateCheck(test, option)) {
          allowsDuplicates = false;
        } else {
          addOptions(test, option, options);
        }
        List<Statement> elseBlock = arm.getElseBlock();
        if (elseBlock == null) {
          break;
        }
        if (elseBlock.size() == 1
            && elseBlock.get(0) instanceof IfStatement elif
            && elif.isElif()) {
          arm = elif;
          continue;
        }
        if (ctx.raisesValidationError(elseBlock)) {
          rejectsUnknown = true;
        }
        break;
      }
    }
    if (options.isEmpty()) {
      logger.atFiner().log("loop over %s pops %s but dispatches on no literal", list, option);
      return null;
    }
    return OptionLoop.create(options, rejectsUnknown, allowsDuplicates);
  }

  /** Returns {@code x} if {@code st} is {@code x = list.pop(0)}. */
  @Nullable
  private static String frontPopTarget(Statement st, String list) {
    if (!(st instanceof AssignmentStatement assign)
        || assign.isAugmented()
        || assign.getRHS() == null
        || !(assign.getLHS() instanceof Identifier target)
        || !(assign.getRHS() instanceof CallExpression call)
        || !(call.getFunction() instanceof DotExpression dot)
        || !dot.getField().getName().equals("pop")
        || !(dot.getObject() instanceof Identifier receiver)
        || !receiver.getName().equals(list)) {
      return null;
    }
    List<Expression> args = call.getPositionalArguments();
    if (args == null
        || args.size() != 1
        || !(args.get(0) instanceof IntLiteral index)
        || !Integer.valueOf(0).equals(index.getIntValue())) {
      return null;
    }
    return target.getName();
  }

  /** Reports whether {@code test} is {@code option in seen}. */
  private static boolean isDuplicateCheck(Expression test, String option) {
    return test instanceof BinaryOperatorExpression binop
        && binop.getOperator() == TokenKind.IN
        && isName(binop.getX(), option)
        && binop.getY() instanceof Identifier;
  }

  private static void addOptions(Expression test, String option, List<String> options) {
    if (!(test instanceof BinaryOperatorExpression binop)) {
      return;
    }
    TokenKind op = binop.getOperator();
    if (op == TokenKind.OR) {
      addOptions(binop.getX(), option, options);
      addOptions(binop.getY(), option, options);
    } else if (op == TokenKind.EQUALS_EQUALS) {
      if (isName(binop.getX(), option) && binop.getY() instanceof StringLiteral lit) {
        addOption(lit.getValue(), options);
      } else if (isName(binop.getY(), option) && binop.getX() instanceof StringLiteral lit) {
        addOption(lit.getValue(), options);
      }
    } else if (op == TokenKind.IN
        && isName(binop.getX(), option)
        && binop.getY() instanceof ListExpression choices) {
      for (Expression e : choices.getElements()) {
        if (e instanceof StringLiteral lit) {
          addOption(lit.getValue(), options);
        }
      }
    }
  }

  private static void addOption(String value, List<String> options) {
    if (!options.contains(value)) {
      options.add(value);
    }
  }

  private static boolean isName(Expression e, String name) {
    return e instanceof Identifier id && id.getName().equals(name);
  }
}
