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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.djls.java.syntax.DefStatement;
import net.djls.java.syntax.Parameter;

/**
 * Infers the argument grammar of template tags from the source of their compile functions.
 *
 * <p>A compile function receives a parser and a token, splits the token's contents and raises a
 * validation error when the pieces are malformed. The analyzer walks the function without running
 * it, tracking what each variable holds relative to the split, and turns each such guard into
 * constraints. Evidence it cannot interpret is dropped: a rule may say less than the function
 * checks, but never more.
 *
 * <p>An analyzer serves one module; calls to other functions of the module are followed one level
 * deep, and their summaries are shared by all tags analyzed with the same instance. Instances are
 * not thread-safe.
 */
public final class TagAnalyzer {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final AnalysisOptions options;
  private final HelperCallResolver resolver;

  /**
   * Creates an analyzer for tags whose helpers are among {@code functions}, the top-level
   * functions of their module.
   */
  public TagAnalyzer(List<DefStatement> functions, AnalysisOptions options) {
    Map<String, DefStatement> byName = new LinkedHashMap<>();
    for (DefStatement def : functions) {
      byName.put(def.getName(), def); // the last definition wins
    }
    this.options = Preconditions.checkNotNull(options);
    this.resolver = new HelperCallResolver(ImmutableMap.copyOf(byName));
  }

  public TagAnalyzer(List<DefStatement> functions) {
    this(functions, AnalysisOptions.DEFAULT);
  }

  /** Returns the rule of the tag compiled by {@code function}. */
  public TagRule analyze(DefStatement function) {
    ImmutableList<String> params = positionalParameterNames(function);
    String parser = params.size() > 0 ? params.get(0) : "parser";
    String token = params.size() > 1 ? params.get(1) : "token";
    Environment env = Environment.forTagFunction(parser, token);
    AnalysisContext ctx = new AnalysisContext(env, options, resolver, function.getName(), 0);

    WalkResult result = StatementWalker.walk(ctx, function.getBody());
    TagRule rule =
        RuleAssembler.assemble(result.constraints(), result.optionLoop(), env.snapshot());
    logger.atFine().log(
        "%s: constraints %s, options %s", function.getName(), rule.constraints(), rule.options());
    return rule;
  }

  /** Returns the number of helper summaries computed so far. */
  int helperSummaryCount() {
    return resolver.memoSize();
  }

  private static ImmutableList<String> positionalParameterNames(DefStatement function) {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Parameter param : function.getParameters()) {
      if (param instanceof Parameter.Star || param instanceof Parameter.StarStar) {
        break;
      }
      names.add(param.getName());
    }
    return names.build();
  }
}
