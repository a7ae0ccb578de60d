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

package net.djls.java.syntax;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Syntax node for a chain of two or more comparisons, {@code a < b <= c}, which means {@code a < b
 * and b <= c} with {@code b} evaluated once.
 */
public final class ChainedComparison extends Expression {

  private final ImmutableList<Expression> operands;
  private final ImmutableList<TokenKind> operators;

  ChainedComparison(
      FileLocations locs, ImmutableList<Expression> operands, ImmutableList<TokenKind> operators) {
    super(locs, Kind.CHAINED_COMPARISON);
    Preconditions.checkArgument(operators.size() >= 2);
    Preconditions.checkArgument(operands.size() == operators.size() + 1);
    this.operands = operands;
    this.operators = operators;
  }

  /** Returns the operands, one more than the operators. */
  public ImmutableList<Expression> getOperands() {
    return operands;
  }

  /** Returns the comparison operators, in source order. */
  public ImmutableList<TokenKind> getOperators() {
    return operators;
  }

  @Override
  public int getStartOffset() {
    return operands.get(0).getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return operands.get(operands.size() - 1).getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
