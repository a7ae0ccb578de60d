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

/** Syntax node for an if-else expression. */
public final class ConditionalExpression extends Expression {

  private final Expression thenCase;
  private final Expression condition;
  private final Expression elseCase;

  public Expression getThenCase() {
    return thenCase;
  }

  public Expression getCondition() {
    return condition;
  }

  public Expression getElseCase() {
    return elseCase;
  }

  /** Constructor for a conditional expression */
  ConditionalExpression(
      FileLocations locs, Expression thenCase, Expression condition, Expression elseCase) {
    super(locs, Kind.CONDITIONAL);
    this.thenCase = thenCase;
    this.condition = condition;
    this.elseCase = elseCase;
  }

  @Override
  public int getStartOffset() {
    return thenCase.getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return elseCase.getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
