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
import javax.annotation.Nullable;

/** Syntax node for {@code try: ... except ...: ... else: ... finally: ...}. */
public final class TryStatement extends Statement {

  /** An {@code except [type [as name]]:} clause. */
  public static final class Handler extends Node {
    private final int exceptOffset;
    @Nullable private final Expression type;
    @Nullable private final Identifier name;
    private final ImmutableList<Statement> body;

    Handler(
        FileLocations locs,
        int exceptOffset,
        @Nullable Expression type,
        @Nullable Identifier name,
        ImmutableList<Statement> body) {
      super(locs);
      this.exceptOffset = exceptOffset;
      this.type = type;
      this.name = name;
      this.body = body;
    }

    /** Returns the caught exception type, or null for a bare {@code except:}. */
    @Nullable
    public Expression getType() {
      return type;
    }

    @Nullable
    public Identifier getName() {
      return name;
    }

    public ImmutableList<Statement> getBody() {
      return body;
    }

    @Override
    public int getStartOffset() {
      return exceptOffset;
    }

    @Override
    public int getEndOffset() {
      return body.isEmpty() ? exceptOffset + "except".length() : lastOf(body).getEndOffset();
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  private final int tryOffset;
  private final ImmutableList<Statement> body;
  private final ImmutableList<Handler> handlers;
  private final ImmutableList<Statement> elseBlock; // empty if absent
  private final ImmutableList<Statement> finallyBlock; // empty if absent

  TryStatement(
      FileLocations locs,
      int tryOffset,
      ImmutableList<Statement> body,
      ImmutableList<Handler> handlers,
      ImmutableList<Statement> elseBlock,
      ImmutableList<Statement> finallyBlock) {
    super(locs, Kind.TRY);
    this.tryOffset = tryOffset;
    this.body = body;
    this.handlers = handlers;
    this.elseBlock = elseBlock;
    this.finallyBlock = finallyBlock;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  public ImmutableList<Handler> getHandlers() {
    return handlers;
  }

  public ImmutableList<Statement> getElseBlock() {
    return elseBlock;
  }

  public ImmutableList<Statement> getFinallyBlock() {
    return finallyBlock;
  }

  @Override
  public int getStartOffset() {
    return tryOffset;
  }

  @Override
  public int getEndOffset() {
    if (!finallyBlock.isEmpty()) {
      return lastOf(finallyBlock).getEndOffset();
    } else if (!elseBlock.isEmpty()) {
      return lastOf(elseBlock).getEndOffset();
    } else if (!handlers.isEmpty()) {
      return handlers.get(handlers.size() - 1).getEndOffset();
    }
    return body.isEmpty() ? tryOffset + "try".length() : lastOf(body).getEndOffset();
  }

  private static Statement lastOf(ImmutableList<Statement> block) {
    return block.get(block.size() - 1);
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
