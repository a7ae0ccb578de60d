// Copyright 2014 The Bazel Authors. All rights reserved.
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

package net.djls.java.syntax;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * Syntax node for an assignment statement ({@code lhs = rhs}), a chained assignment ({@code a = b
 * = rhs}), an augmented assignment statement ({@code lhs op= rhs}) or an annotated declaration
 * ({@code lhs: T [= rhs]}).
 */
public final class AssignmentStatement extends Statement {

  private final ImmutableList<Expression> targets; // non-empty, left to right

  @Nullable private final Expression type;

  @Nullable private final TokenKind op;
  private final int opOffset;

  @Nullable private final Expression rhs; // null only for a bare annotation "x: int"

  /**
   * Constructs an assignment statement. An augmented assignment ({@code op != null}) or an
   * annotated one ({@code type != null}) has exactly one target.
   */
  AssignmentStatement(
      FileLocations locs,
      ImmutableList<Expression> targets,
      @Nullable Expression type,
      @Nullable TokenKind op,
      int opOffset,
      @Nullable Expression rhs) {
    super(locs, Kind.ASSIGNMENT);
    Preconditions.checkArgument(!targets.isEmpty());
    this.targets = targets;
    this.type = type;
    this.op = op;
    this.opOffset = opOffset;
    this.rhs = rhs;
    if (op != null || type != null) {
      Preconditions.checkState(
          targets.size() == 1, "Can't chain augmented or annotated assignment");
    }
    if (rhs == null) {
      Preconditions.checkState(type != null, "Assignment without RHS must be annotated");
    }
  }

  /** Returns the assignment targets. The RHS value is bound to each in turn. */
  public ImmutableList<Expression> getTargets() {
    return targets;
  }

  /** Returns the LHS of the assignment, the first target. */
  public Expression getLHS() {
    return targets.get(0);
  }

  /** Returns the type annotation (if present) of the variable on the LHS. */
  @Nullable
  public Expression getType() {
    return type;
  }

  /** Returns the operator of an augmented assignment, or null for an ordinary assignment. */
  @Nullable
  public TokenKind getOperator() {
    return op;
  }

  /** Returns the location of the assignment operator. */
  public Location getOperatorLocation() {
    return locs.getLocation(opOffset);
  }

  @Override
  public int getStartOffset() {
    return targets.get(0).getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return rhs != null ? rhs.getEndOffset() : type.getEndOffset();
  }

  /** Reports whether this is an augmented assignment ({@code getOperator() != null}). */
  public boolean isAugmented() {
    return op != null;
  }

  /** Returns the RHS of the assignment, or null for a bare annotation. */
  @Nullable
  public Expression getRHS() {
    return rhs;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
