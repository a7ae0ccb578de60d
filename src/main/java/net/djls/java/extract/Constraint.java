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
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Collection;
import javax.annotation.Nullable;

/**
 * One fact about valid uses of a tag: a bound on its argument count, a position that must hold a
 * given keyword, or a position that must hold one of a fixed set of words.
 */
@AutoValue
public abstract class Constraint {

  /** The kind of constraint. */
  public enum Kind {
    LENGTH,
    KEYWORD,
    CHOICE,
  }

  public abstract Kind kind();

  @Nullable
  abstract ArgumentCountConstraint count();

  @Nullable
  abstract SplitPosition position();

  /** The keyword (one element) or the admissible choices. */
  public abstract ImmutableList<String> literals();

  public static Constraint length(ArgumentCountConstraint count) {
    return new AutoValue_Constraint(Kind.LENGTH, count, null, ImmutableList.of());
  }

  public static Constraint keyword(SplitPosition position, String literal) {
    return new AutoValue_Constraint(Kind.KEYWORD, null, position, ImmutableList.of(literal));
  }

  public static Constraint choice(SplitPosition position, Collection<String> literals) {
    Preconditions.checkArgument(!literals.isEmpty(), "empty choice");
    return new AutoValue_Constraint(
        Kind.CHOICE, null, position, ImmutableList.copyOf(literals));
  }

  public boolean isLength() {
    return kind() == Kind.LENGTH;
  }

  public ArgumentCountConstraint getCount() {
    Preconditions.checkState(isLength(), "%s is not a length constraint", this);
    return count();
  }

  public SplitPosition getPosition() {
    Preconditions.checkState(!isLength(), "%s has no position", this);
    return position();
  }

  /** Returns the required keyword of a KEYWORD constraint. */
  public String getKeyword() {
    Preconditions.checkState(kind() == Kind.KEYWORD, "%s is not a keyword constraint", this);
    return literals().get(0);
  }

  @Override
  public final String toString() {
    switch (kind()) {
      case LENGTH:
        return "Length(" + count() + ")";
      case KEYWORD:
        return "Keyword(" + position() + ", \"" + literals().get(0) + "\")";
      case CHOICE:
        return "Choice(" + position() + ", [" + Joiner.on(", ").join(literals()) + "])";
    }
    throw new IllegalStateException(kind().toString());
  }
}
