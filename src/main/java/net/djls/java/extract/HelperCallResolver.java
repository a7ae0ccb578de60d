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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import net.djls.java.syntax.DefStatement;
import net.djls.java.syntax.Parameter;

/**
 * Analyzes calls to functions defined in the same module as the tag being analyzed.
 *
 * <p>A helper's body is walked with a fresh environment holding the caller's argument values, so
 * pops and guards inside the helper are tracked against the caller's lists. Inlining stops at
 * {@link AnalysisOptions#maxHelperDepth}, and a function calling itself yields an unknown result.
 * Summaries are memoized by callee and argument values; one resolver serves every tag of a module.
 */
final class HelperCallResolver {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final ImmutableMap<String, DefStatement> functions;
  private final Map<Key, HelperSummary> memo = new HashMap<>();
  private final Set<Key> inProgress = new HashSet<>();

  HelperCallResolver(ImmutableMap<String, DefStatement> functions) {
    this.functions = functions;
  }

  @AutoValue
  abstract static class Key {
    abstract String name();

    abstract ImmutableList<AbstractValue> positional();

    abstract ImmutableMap<String, AbstractValue> keywords();

    abstract int depth();

    static Key create(
        String name,
        ImmutableList<AbstractValue> positional,
        ImmutableMap<String, AbstractValue> keywords,
        int depth) {
      return new AutoValue_HelperCallResolver_Key(name, positional, keywords, depth);
    }
  }

  /** Reports whether {@code name} is a function of this module. */
  boolean isHelper(String name) {
    return functions.containsKey(name);
  }

  /** Returns the number of summaries computed so far. */
  int memoSize() {
    return memo.size();
  }

  /** Returns the summary of calling helper {@code name} from {@code caller}. */
  HelperSummary resolve(
      AnalysisContext caller,
      String name,
      ImmutableList<AbstractValue> positional,
      ImmutableMap<String, AbstractValue> keywords) {
    DefStatement def = functions.get(name);
    if (def == null) {
      return HelperSummary.UNKNOWN;
    }
    if (name.equals(caller.functionName())) {
      logger.atFiner().log("%s calls itself; result unknown", name);
      return HelperSummary.UNKNOWN;
    }
    if (caller.depth() >= caller.options().maxHelperDepth()) {
      logger.atFiner().log(
          "not following %s from %s: depth %d reached",
          name, caller.functionName(), caller.depth());
      return HelperSummary.UNKNOWN;
    }
    Key key = Key.create(name, positional, keywords, caller.depth());
    HelperSummary summary = memo.get(key);
    if (summary != null) {
      return summary;
    }
    if (!inProgress.add(key)) {
      logger.atFiner().log("cyclic call to %s; result unknown", name);
      return HelperSummary.UNKNOWN;
    }
    try {
      summary = analyze(caller, def, positional, keywords);
    } finally {
      inProgress.remove(key);
    }
    memo.put(key, summary);
    return summary;
  }

  private HelperSummary analyze(
      AnalysisContext caller,
      DefStatement def,
      ImmutableList<AbstractValue> positional,
      ImmutableMap<String, AbstractValue> keywords) {
    Map<String, AbstractValue> params = new LinkedHashMap<>();
    // Parameter name for each positional argument consumed.
    Map<Integer, String> positionalParams = new HashMap<>();
    boolean keywordOnly = false;
    int next = 0;
    for (Parameter param : def.getParameters()) {
      String paramName = param.getName();
      if (param instanceof Parameter.Star) {
        keywordOnly = true;
        if (paramName != null) {
          params.put(paramName, AbstractValue.UNKNOWN);
        }
      } else if (param instanceof Parameter.StarStar) {
        params.put(paramName, AbstractValue.UNKNOWN);
      } else if (!keywordOnly && next < positional.size()) {
        positionalParams.put(next, paramName);
        params.put(paramName, positional.get(next++));
      } else {
        params.put(paramName, keywords.getOrDefault(paramName, AbstractValue.UNKNOWN));
      }
    }

    Environment env = Environment.withBindings(params);
    AnalysisContext ctx = caller.forHelper(def.getName(), env);
    WalkResult result = StatementWalker.walk(ctx, def.getBody());

    ImmutableMap.Builder<Integer, AbstractValue> effects = ImmutableMap.builder();
    for (Map.Entry<Integer, String> e : positionalParams.entrySet()) {
      AbstractValue before = positional.get(e.getKey());
      AbstractValue after = env.lookup(e.getValue());
      if (before.isSplitResult() && !after.equals(before)) {
        // A rebound parameter no longer says what happened to the caller's list.
        effects.put(e.getKey(), env.wasReassigned(e.getValue()) ? AbstractValue.UNKNOWN : after);
      }
    }
    AbstractValue returnValue = reduceReturns(result.returns());
    logger.atFine().log(
        "helper %s%s returns %s with %s", def.getName(), positional, returnValue,
        result.constraints());
    return HelperSummary.create(returnValue, result.constraints(), effects.buildOrThrow());
  }

  /**
   * Combines the values of a function's return statements: their common value if they agree, the
   * common value of the known ones if those agree, and unknown otherwise.
   */
  static AbstractValue reduceReturns(ImmutableList<AbstractValue> returns) {
    if (returns.isEmpty()) {
      return AbstractValue.UNKNOWN;
    }
    AbstractValue known = null;
    for (AbstractValue value : returns) {
      if (value.isUnknown()) {
        continue;
      }
      if (known == null) {
        known = value;
      } else if (!known.equals(value)) {
        return AbstractValue.UNKNOWN;
      }
    }
    return known != null ? known : AbstractValue.UNKNOWN;
  }
}
