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
import com.google.common.collect.ImmutableMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The variable bindings of one function analysis.
 *
 * <p>An environment is created per analyzed function and discarded afterwards. Branches of an
 * {@code if} share one environment; a binding made in one arm is visible after the statement.
 * Names that are never bound look up as {@link AbstractValue#UNKNOWN}.
 */
final class Environment {

  private final Map<String, AbstractValue> bindings = new LinkedHashMap<>();

  // Names rebound by assignment since creation, as opposed to mutated in place by pops.
  private final Set<String> reassigned = new HashSet<>();

  private Environment() {}

  /** Returns the environment of a tag function whose parser and token parameters are named. */
  static Environment forTagFunction(String parserName, String tokenName) {
    Environment env = new Environment();
    env.bindings.put(parserName, AbstractValue.PARSER_HANDLE);
    env.bindings.put(tokenName, AbstractValue.TOKEN_HANDLE);
    return env;
  }

  /** Returns an environment holding the given parameter bindings, as for a helper call. */
  static Environment withBindings(Map<String, AbstractValue> parameters) {
    Environment env = new Environment();
    env.bindings.putAll(parameters);
    return env;
  }

  AbstractValue lookup(String name) {
    return bindings.getOrDefault(name, AbstractValue.UNKNOWN);
  }

  /** Binds {@code name} by assignment. */
  void bind(String name, AbstractValue value) {
    Preconditions.checkNotNull(value);
    bindings.put(name, value);
    reassigned.add(name);
  }

  /** Replaces the value of {@code name} as an in-place mutation of the object it refers to. */
  void update(String name, AbstractValue value) {
    Preconditions.checkNotNull(value);
    bindings.put(name, value);
  }

  /** Records that the list bound to {@code name} lost its first element. */
  void applyFrontPop(String name) {
    update(name, lookup(name).afterFrontPop());
  }

  /** Records that the list bound to {@code name} lost its last element. */
  void applyBackPop(String name) {
    update(name, lookup(name).afterBackPop());
  }

  /** Forgets what is known about the object bound to {@code name}. */
  void invalidate(String name) {
    if (bindings.containsKey(name)) {
      update(name, AbstractValue.UNKNOWN);
    }
  }

  /** Reports whether {@code name} has been rebound by assignment. */
  boolean wasReassigned(String name) {
    return reassigned.contains(name);
  }

  /** Returns a snapshot of the current bindings, in binding order. */
  ImmutableMap<String, AbstractValue> snapshot() {
    return ImmutableMap.copyOf(bindings);
  }

  @Override
  public String toString() {
    return bindings.toString();
  }
}
