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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import java.util.Arrays;

/**
 * An immutable, insertion-ordered set of {@link Constraint}s inferred from one or more guards.
 *
 * <p>Sets describe the condition under which a guard raises, so they compose as follows:
 *
 * <ul>
 *   <li>{@link #or}: the guard fires if either side holds, so each side's constraints are
 *       necessary on their own. The result is the union.
 *   <li>{@link #and}: the guard fires only if both sides hold at once. A length bound alone no
 *       longer implies an error, so length constraints are dropped; keyword and choice constraints
 *       are kept.
 * </ul>
 */
public final class ConstraintSet {

  public static final ConstraintSet EMPTY = new ConstraintSet(ImmutableSet.of());

  private final ImmutableSet<Constraint> constraints;

  private ConstraintSet(ImmutableSet<Constraint> constraints) {
    this.constraints = constraints;
  }

  public static ConstraintSet of(Constraint... constraints) {
    return copyOf(Arrays.asList(constraints));
  }

  public static ConstraintSet copyOf(Iterable<Constraint> constraints) {
    ImmutableSet<Constraint> set = ImmutableSet.copyOf(constraints);
    return set.isEmpty() ? EMPTY : new ConstraintSet(set);
  }

  /** Returns the union of this set and {@code other}. */
  public ConstraintSet or(ConstraintSet other) {
    if (other.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return other;
    }
    return copyOf(Iterables.concat(constraints, other.constraints));
  }

  /** Returns the keyword and choice constraints of both sets; length constraints are dropped. */
  public ConstraintSet and(ConstraintSet other) {
    return copyOf(
        Iterables.filter(
            Iterables.concat(constraints, other.constraints), c -> !c.isLength()));
  }

  /** Returns this set without its keyword and choice constraints. */
  public ConstraintSet withoutPositional() {
    return copyOf(Iterables.filter(constraints, Constraint::isLength));
  }

  public boolean isEmpty() {
    return constraints.isEmpty();
  }

  public ImmutableList<Constraint> asList() {
    return constraints.asList();
  }

  public ImmutableList<ArgumentCountConstraint> lengthConstraints() {
    ImmutableList.Builder<ArgumentCountConstraint> result = ImmutableList.builder();
    for (Constraint c : constraints) {
      if (c.isLength()) {
        result.add(c.getCount());
      }
    }
    return result.build();
  }

  public ImmutableList<Constraint> ofKind(Constraint.Kind kind) {
    return ImmutableList.copyOf(Iterables.filter(constraints, c -> c.kind() == kind));
  }

  @Override
  public boolean equals(Object that) {
    return that instanceof ConstraintSet other && constraints.equals(other.constraints);
  }

  @Override
  public int hashCode() {
    return constraints.hashCode();
  }

  @Override
  public String toString() {
    return "{" + Joiner.on(", ").join(constraints) + "}";
  }
}
