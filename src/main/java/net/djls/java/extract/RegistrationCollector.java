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
import java.util.List;
import javax.annotation.Nullable;
import net.djls.java.syntax.Argument;
import net.djls.java.syntax.CallExpression;
import net.djls.java.syntax.ClassStatement;
import net.djls.java.syntax.DefStatement;
import net.djls.java.syntax.DotExpression;
import net.djls.java.syntax.Expression;
import net.djls.java.syntax.ExpressionStatement;
import net.djls.java.syntax.Identifier;
import net.djls.java.syntax.SourceFile;
import net.djls.java.syntax.Statement;
import net.djls.java.syntax.StringLiteral;

/**
 * Finds the tags and filters a module registers, by decorator ({@code @register.tag("name")}) or
 * by call ({@code register.tag("name", compile_fn)}).
 */
public final class RegistrationCollector {

  private static final ImmutableMap<String, Registration.Kind> METHODS =
      ImmutableMap.of(
          "tag", Registration.Kind.TAG,
          "simple_tag", Registration.Kind.SIMPLE_TAG,
          "inclusion_tag", Registration.Kind.INCLUSION_TAG,
          "simple_block_tag", Registration.Kind.SIMPLE_BLOCK_TAG,
          "filter", Registration.Kind.FILTER);

  private static final ImmutableList<String> TAG_FUNCTION_KEYWORDS =
      ImmutableList.of("compile_function", "func");
  private static final ImmutableList<String> FILTER_FUNCTION_KEYWORDS =
      ImmutableList.of("filter_func", "func");

  private RegistrationCollector() {}

  /** Returns the registrations of {@code file}, in source order. */
  public static ImmutableList<Registration> collect(SourceFile file) {
    ImmutableList.Builder<Registration> result = ImmutableList.builder();
    collect(file.getStatements(), result);
    return result.build();
  }

  private static void collect(List<Statement> body, ImmutableList.Builder<Registration> result) {
    for (Statement st : body) {
      if (st instanceof DefStatement def) {
        for (Expression decorator : def.getDecorators()) {
          Registration reg = fromDecorator(decorator, def.getName());
          if (reg != null) {
            result.add(reg);
          }
        }
      } else if (st instanceof ExpressionStatement expr
          && expr.getExpression() instanceof CallExpression call) {
        Registration reg = fromCall(call);
        if (reg != null) {
          result.add(reg);
        }
      } else if (st instanceof ClassStatement cls) {
        collect(cls.getBody(), result);
      }
    }
  }

  @Nullable
  private static Registration.Kind kindOf(Expression fn) {
    return fn instanceof DotExpression dot ? METHODS.get(dot.getField().getName()) : null;
  }

  @Nullable
  private static Registration fromDecorator(Expression decorator, String function) {
    Registration.Kind kind = kindOf(decorator);
    if (kind != null) {
      return Registration.create(function, kind, function);
    }
    if (!(decorator instanceof CallExpression call)) {
      return null;
    }
    kind = kindOf(call.getFunction());
    if (kind == null) {
      return null;
    }
    String name = stringKeyword(call, "name");
    if (name == null && (kind == Registration.Kind.TAG || kind == Registration.Kind.FILTER)) {
      name = firstStringArgument(call);
    }
    return Registration.create(
        name != null ? name : function, kind, function, stringKeyword(call, "end_name"));
  }

  @Nullable
  private static Registration fromCall(CallExpression call) {
    Registration reg = registrationOf(call);
    String endName = stringKeyword(call, "end_name");
    if (reg == null || endName == null) {
      return reg;
    }
    return Registration.create(reg.name(), reg.kind(), reg.functionName(), endName);
  }

  @Nullable
  private static Registration registrationOf(CallExpression call) {
    Registration.Kind kind = kindOf(call.getFunction());
    if (kind == null) {
      return null;
    }
    String nameOverride = stringKeyword(call, "name");
    String functionKeyword =
        callableKeyword(
            call,
            kind == Registration.Kind.FILTER ? FILTER_FUNCTION_KEYWORDS : TAG_FUNCTION_KEYWORDS);
    List<Expression> args = call.getPositionalArguments();
    if (args == null) {
      return null;
    }
    if (args.size() >= 2 && args.get(0) instanceof StringLiteral lit) {
      String function = callableName(args.get(1));
      return Registration.create(
          nameOverride != null ? nameOverride : lit.getValue(),
          kind,
          function != null ? function : functionKeyword);
    }
    if (args.size() == 1 && args.get(0) instanceof StringLiteral lit && functionKeyword != null) {
      return Registration.create(
          nameOverride != null ? nameOverride : lit.getValue(), kind, functionKeyword);
    }
    if (args.size() == 1) {
      String function = callableName(args.get(0));
      if (nameOverride != null) {
        return Registration.create(
            nameOverride, kind, function != null ? function : functionKeyword);
      }
      if (function != null) {
        return Registration.create(function, kind, function);
      }
    }
    if (nameOverride != null) {
      return Registration.create(nameOverride, kind, functionKeyword);
    }
    return null;
  }

  @Nullable
  private static String stringKeyword(CallExpression call, String keyword) {
    Expression value = call.getKeywordArgument(keyword);
    return value instanceof StringLiteral lit ? lit.getValue() : null;
  }

  @Nullable
  private static String callableKeyword(CallExpression call, List<String> keywords) {
    for (Argument arg : call.getArguments()) {
      if (arg instanceof Argument.Keyword
          && keywords.contains(arg.getName())
          && arg.getValue() instanceof Identifier id) {
        return id.getName();
      }
    }
    return null;
  }

  @Nullable
  private static String firstStringArgument(CallExpression call) {
    List<Expression> args = call.getPositionalArguments();
    return args != null && !args.isEmpty() && args.get(0) instanceof StringLiteral lit
        ? lit.getValue()
        : null;
  }

  /** Returns {@code f} or {@code a.b.f} for a (dotted) name, null otherwise. */
  @Nullable
  private static String callableName(Expression e) {
    if (e instanceof Identifier id) {
      return id.getName();
    }
    if (e instanceof DotExpression dot) {
      String base = callableName(dot.getObject());
      return base != null ? base + "." + dot.getField().getName() : null;
    }
    return null;
  }
}
