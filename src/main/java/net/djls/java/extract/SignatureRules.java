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
import java.util.ArrayList;
import java.util.List;
import net.djls.java.syntax.CallExpression;
import net.djls.java.syntax.DefStatement;
import net.djls.java.syntax.Expression;
import net.djls.java.syntax.Identifier;
import net.djls.java.syntax.Parameter;

/**
 * Rules of tags whose arguments the template library parses on the function's behalf: the tag
 * accepts what the function's signature accepts.
 */
public final class SignatureRules {

  private SignatureRules() {}

  /**
   * Returns the rule of a {@code simple_tag}, {@code inclusion_tag} or {@code simple_block_tag}
   * implemented by {@code function}.
   */
  public static TagRule forSignature(DefStatement function, Registration.Kind kind) {
    List<Parameter> positional = new ArrayList<>();
    List<Parameter> keywordOnly = new ArrayList<>();
    Parameter varargs = null;
    boolean afterStar = false;
    boolean kwargs = false;
    for (Parameter param : function.getParameters()) {
      if (param instanceof Parameter.StarStar) {
        kwargs = true;
      } else if (param instanceof Parameter.Star) {
        afterStar = true;
        varargs = param.getName() != null ? param : null;
      } else if (afterStar) {
        keywordOnly.add(param);
      } else {
        positional.add(param);
      }
    }
    // Block tags always receive the context first and the rendered content last.
    boolean blockTag = kind == Registration.Kind.SIMPLE_BLOCK_TAG;
    if ((blockTag || takesContext(function)) && !positional.isEmpty()) {
      positional.remove(0);
    }
    if (blockTag && !positional.isEmpty()) {
      positional.remove(positional.size() - 1);
    }

    int required = 0;
    for (Parameter param : positional) {
      if (param.getDefaultValue() == null) {
        required++;
      }
    }
    ImmutableList.Builder<Constraint> constraints = ImmutableList.builder();
    if (required > 0) {
      constraints.add(Constraint.length(ArgumentCountConstraint.min(required + 1)));
    }
    if (varargs == null && !kwargs) {
      constraints.add(
          Constraint.length(
              ArgumentCountConstraint.max(positional.size() + keywordOnly.size() + 1)));
    }

    ImmutableList.Builder<ExtractedArg> args = ImmutableList.builder();
    int position = 0;
    for (Parameter param : positional) {
      args.add(argument(param, position++, ExtractedArg.Kind.VARIABLE));
    }
    if (varargs != null) {
      args.add(
          ExtractedArg.create(
              varargs.getName(),
              position++,
              ExtractedArg.Kind.VARARGS,
              false,
              null,
              ImmutableList.of()));
    }
    for (Parameter param : keywordOnly) {
      args.add(argument(param, position++, ExtractedArg.Kind.KEYWORD));
    }
    args.add(ExtractedArg.literal("as", position++, false));
    args.add(ExtractedArg.variable("varname", position, false));

    return TagRule.create(ConstraintSet.copyOf(constraints.build()), args.build(), null, true);
  }

  private static ExtractedArg argument(Parameter param, int position, ExtractedArg.Kind kind) {
    Expression defaultValue = param.getDefaultValue();
    return ExtractedArg.create(
        param.getName(),
        position,
        kind,
        defaultValue == null,
        defaultValue != null ? defaultValue.prettyPrint() : null,
        ImmutableList.of());
  }

  /** Reports whether a decorator of {@code function} passes {@code takes_context=True}. */
  static boolean takesContext(DefStatement function) {
    for (Expression decorator : function.getDecorators()) {
      if (decorator instanceof CallExpression call
          && call.getKeywordArgument("takes_context") instanceof Identifier value
          && value.getName().equals("True")) {
        return true;
      }
    }
    return false;
  }
}
