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

/** Syntax node for {@code await x}. */
public final class AwaitExpression extends Expression {

  private final int awaitOffset;
  private final Expression value;

  AwaitExpression(FileLocations locs, int awaitOffset, Expression value) {
    super(locs, Kind.AWAIT);
    this.awaitOffset = awaitOffset;
    this.value = value;
  }

  public Expression getValue() {
    return value;
  }

  @Override
  public int getStartOffset() {
    return awaitOffset;
  }

  @Override
  public int getEndOffset() {
    return value.getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
