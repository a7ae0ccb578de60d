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

import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/** Syntax node for a function call expression. */
public final class CallExpression extends Expression {

  private final Expression function;
  private final ImmutableList<Argument> arguments;
  private final int rparenOffset;

  CallExpression(
      FileLocations locs,
      Expression function,
      ImmutableList<Argument> arguments,
      int rparenOffset) {
    super(locs, Kind.CALL);
    this.function = function;
    this.arguments = arguments;
    this.rparenOffset = rparenOffset;
  }

  /** Returns the function that is called. */
  public Expression getFunction() {
    return function;
  }

  /** Returns the arguments in source order. */
  public ImmutableList<Argument> getArguments() {
    return arguments;
  }

  /** Returns the positional arguments in source order, or null if any argument is starred. */
  @Nullable
  public ImmutableList<Expression> getPositionalArguments() {
    ImmutableList.Builder<Expression> positional = ImmutableList.builder();
    for (Argument arg : arguments) {
      if (arg instanceof Argument.Positional) {
        positional.add(arg.getValue());
      } else if (!(arg instanceof Argument.Keyword)) {
        return null;
      }
    }
    return positional.build();
  }

  /** Returns the value of the named keyword argument, or null if there is none. */
  @Nullable
  public Expression getKeywordArgument(String name) {
    for (Argument arg : arguments) {
      if (name.equals(arg.getName())) {
        return arg.getValue();
      }
    }
    return null;
  }

  /**
   * Returns the name of the called function if it is a plain identifier ({@code f(...)}), or the
   * attribute name if it is a method call ({@code x.f(...)}); null otherwise.
   */
  @Nullable
  public String getFunctionName() {
    if (function instanceof Identifier id) {
      return id.getName();
    } else if (function instanceof DotExpression dot) {
      return dot.getField().getName();
    }
    return null;
  }

  @Override
  public int getStartOffset() {
    return function.getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return rparenOffset + 1;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
