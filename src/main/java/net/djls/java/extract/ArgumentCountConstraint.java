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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Collection;

/**
 * A bound on the number of pieces a tag's contents split into, counting the tag name itself.
 */
@AutoValue
public abstract class ArgumentCountConstraint {

  /** The kind of bound. */
  public enum Kind {
    MIN,
    MAX,
    EXACT,
    ONE_OF,
  }

  public abstract Kind kind();

  /** Returns the bound, or for {@link Kind#ONE_OF} the admissible counts in ascending order. */
  public abstract ImmutableList<Integer> values();

  public static ArgumentCountConstraint min(int n) {
    return new AutoValue_ArgumentCountConstraint(Kind.MIN, ImmutableList.of(n));
  }

  public static ArgumentCountConstraint max(int n) {
    return new AutoValue_ArgumentCountConstraint(Kind.MAX, ImmutableList.of(n));
  }

  public static ArgumentCountConstraint exact(int n) {
    return new AutoValue_ArgumentCountConstraint(Kind.EXACT, ImmutableList.of(n));
  }

  public static ArgumentCountConstraint oneOf(Collection<Integer> counts) {
    Preconditions.checkArgument(!counts.isEmpty(), "empty OneOf");
    return new AutoValue_ArgumentCountConstraint(
        Kind.ONE_OF, ImmutableSortedSet.copyOf(counts).asList());
  }

  /** Returns the single bound of a MIN, MAX or EXACT constraint. */
  public int value() {
    Preconditions.checkState(kind() != Kind.ONE_OF, "%s has several values", this);
    return values().get(0);
  }

  /** Reports whether a split of {@code count} pieces satisfies this bound. */
  public boolean admits(int count) {
    switch (kind()) {
      case MIN:
        return count >= value();
      case MAX:
        return count <= value();
      case EXACT:
        return count == value();
      case ONE_OF:
        return values().contains(count);
    }
    throw new IllegalStateException(kind().toString());
  }

  @Override
  public final String toString() {
    switch (kind()) {
      case MIN:
        return "Min(" + value() + ")";
      case MAX:
        return "Max(" + value() + ")";
      case EXACT:
        return "Exact(" + value() + ")";
      case ONE_OF:
        return "OneOf(" + values() + ")";
    }
    throw new IllegalStateException(kind().toString());
  }
}
