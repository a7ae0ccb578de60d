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

import com.google.common.collect.ImmutableList;

/** Syntax node for a while loop statement, {@code while cond: ... [else: ...]}. */
public final class WhileStatement extends Statement {

  private final int whileOffset;
  private final Expression condition;
  private final ImmutableList<Statement> body; // non-empty if well formed
  private final ImmutableList<Statement> elseBlock; // empty if absent

  WhileStatement(
      FileLocations locs,
      int whileOffset,
      Expression condition,
      ImmutableList<Statement> body,
      ImmutableList<Statement> elseBlock) {
    super(locs, Kind.WHILE);
    this.whileOffset = whileOffset;
    this.condition = condition;
    this.body = body;
    this.elseBlock = elseBlock;
  }

  public Expression getCondition() {
    return condition;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  /** Returns the statements of the {@code else} clause, or an empty list if there is none. */
  public ImmutableList<Statement> getElseBlock() {
    return elseBlock;
  }

  @Override
  public int getStartOffset() {
    return whileOffset;
  }

  @Override
  public int getEndOffset() {
    ImmutableList<Statement> last = elseBlock.isEmpty() ? body : elseBlock;
    return last.isEmpty()
        ? condition.getEndOffset() // wrong, but tree is ill formed
        : last.get(last.size() - 1).getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
