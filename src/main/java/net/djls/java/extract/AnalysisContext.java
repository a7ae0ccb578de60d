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

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import net.djls.java.syntax.Expression;
import net.djls.java.syntax.RaiseStatement;
import net.djls.java.syntax.Statement;

/**
 * The frame of one function analysis: its environment, the function being analyzed, and how deep
 * in helper calls it sits.
 */
final class AnalysisContext {

  private final Environment env;
  private final AnalysisOptions options;
  private final HelperCallResolver resolver;
  private final String functionName;
  private final int depth;

  // Values fixed for the nodes of the statement being evaluated, keyed by node identity.
  private Map<Expression, AbstractValue> pinned = ImmutableMap.of();

  AnalysisContext(
      Environment env,
      AnalysisOptions options,
      HelperCallResolver resolver,
      String functionName,
      int depth) {
    this.env = env;
    this.options = options;
    this.resolver = resolver;
    this.functionName = functionName;
    this.depth = depth;
  }

  Environment env() {
    return env;
  }

  AnalysisOptions options() {
    return options;
  }

  HelperCallResolver resolver() {
    return resolver;
  }

  String functionName() {
    return functionName;
  }

  /** Zero for a tag function, one for a helper it calls, and so on. */
  int depth() {
    return depth;
  }

  /** Returns the value pinned to {@code expr} for the current statement, if any. */
  @Nullable
  AbstractValue pinned(Expression expr) {
    return pinned.get(expr);
  }

  void pin(Map<Expression, AbstractValue> values) {
    pinned = values;
  }

  void unpin() {
    pinned = ImmutableMap.of();
  }

  /** Returns the frame of a helper called from this one. */
  AnalysisContext forHelper(String helperName, Environment helperEnv) {
    return new AnalysisContext(helperEnv, options, resolver, helperName, depth + 1);
  }

  /** Reports whether {@code body} raises a validation error at its top level. */
  boolean raisesValidationError(List<Statement> body) {
    for (Statement st : body) {
      if (st instanceof RaiseStatement raise
          && raise.getExceptionName() != null
          && options.validationErrorNames().contains(raise.getExceptionName())) {
        return true;
      }
    }
    return false;
  }
}
