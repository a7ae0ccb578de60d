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
import com.google.common.collect.ImmutableMap;

/**
 * The effect of calling a same-module helper with given argument values: what it returns, the
 * constraints its guards impose on those arguments, and what became of list arguments it mutated.
 */
@AutoValue
abstract class HelperSummary {

  /** The summary of a call that was not followed. */
  static final HelperSummary UNKNOWN =
      new AutoValue_HelperSummary(
          AbstractValue.UNKNOWN, ConstraintSet.EMPTY, ImmutableMap.of(), false);

  abstract AbstractValue returnValue();

  abstract ConstraintSet constraints();

  /**
   * New values of positional arguments the helper changed, keyed by argument index. A list the
   * helper popped from keeps being tracked; one it handed elsewhere becomes unknown.
   */
  abstract ImmutableMap<Integer, AbstractValue> argumentEffects();

  /** Whether the helper's body was analyzed. Arguments of a call not followed are invalidated. */
  abstract boolean analyzed();

  static HelperSummary create(
      AbstractValue returnValue,
      ConstraintSet constraints,
      ImmutableMap<Integer, AbstractValue> argumentEffects) {
    return new AutoValue_HelperSummary(returnValue, constraints, argumentEffects, true);
  }
}
