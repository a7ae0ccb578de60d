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
import javax.annotation.Nullable;

/** What walking a block of statements produced. */
@AutoValue
abstract class WalkResult {

  static final WalkResult EMPTY = create(ConstraintSet.EMPTY, null, ImmutableList.of());

  abstract ConstraintSet constraints();

  @Nullable
  abstract OptionLoop optionLoop();

  /** Values of the {@code return} statements reached, in source order. */
  abstract ImmutableList<AbstractValue> returns();

  static WalkResult create(
      ConstraintSet constraints,
      @Nullable OptionLoop optionLoop,
      ImmutableList<AbstractValue> returns) {
    return new AutoValue_WalkResult(constraints, optionLoop, returns);
  }

  static WalkResult of(ConstraintSet constraints) {
    return constraints.isEmpty() ? EMPTY : create(constraints, null, ImmutableList.of());
  }

  static WalkResult ofOptionLoop(OptionLoop loop) {
    return create(ConstraintSet.EMPTY, loop, ImmutableList.of());
  }

  static WalkResult ofReturn(AbstractValue value) {
    return create(ConstraintSet.EMPTY, null, ImmutableList.of(value));
  }

  /**
   * Combines the results of two pieces of code that both run. Constraints are unioned; the first
   * option loop found wins.
   */
  WalkResult or(WalkResult other) {
    if (other == EMPTY) {
      return this;
    }
    if (this == EMPTY) {
      return other;
    }
    return create(
        constraints().or(other.constraints()),
        optionLoop() != null ? optionLoop() : other.optionLoop(),
        ImmutableList.<AbstractValue>builder().addAll(returns()).addAll(other.returns()).build());
  }

  WalkResult withConstraints(ConstraintSet constraints) {
    return create(constraints, optionLoop(), returns());
  }
}
