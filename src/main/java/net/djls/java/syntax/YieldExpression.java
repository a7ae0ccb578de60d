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

import javax.annotation.Nullable;

/** Syntax node for {@code yield [x]} and {@code yield from x}. */
public final class YieldExpression extends Expression {

  private final int yieldOffset;
  private final boolean isFrom;
  @Nullable private final Expression value;

  YieldExpression(FileLocations locs, int yieldOffset, boolean isFrom, @Nullable Expression value) {
    super(locs, Kind.YIELD);
    this.yieldOffset = yieldOffset;
    this.isFrom = isFrom;
    this.value = value;
  }

  /** Reports whether this is a {@code yield from} expression. */
  public boolean isFrom() {
    return isFrom;
  }

  @Nullable
  public Expression getValue() {
    return value;
  }

  @Override
  public int getStartOffset() {
    return yieldOffset;
  }

  @Override
  public int getEndOffset() {
    return value != null ? value.getEndOffset() : yieldOffset + "yield".length();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
