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

/**
 * Syntax node for {@code import a.b as c} and {@code from .a import b as c, d} (or {@code *}).
 */
public final class ImportStatement extends Statement {

  /** One imported name and the local name it is bound to. */
  public static final class Binding {
    private final String name; // dotted module name, attribute name, or "*"
    @Nullable private final String alias;

    Binding(String name, @Nullable String alias) {
      this.name = name;
      this.alias = alias;
    }

    public String getName() {
      return name;
    }

    @Nullable
    public String getAlias() {
      return alias;
    }

    /**
     * Returns the name bound in the importing module: the alias if present, otherwise the first
     * component of the dotted name.
     */
    public String getLocalName() {
      if (alias != null) {
        return alias;
      }
      int dot = name.indexOf('.');
      return dot < 0 ? name : name.substring(0, dot);
    }
  }

  private final int startOffset;
  @Nullable private final String module; // non-null for "from ... import"
  private final ImmutableList<Binding> bindings;
  private final int endOffset;

  ImportStatement(
      FileLocations locs,
      int startOffset,
      @Nullable String module,
      ImmutableList<Binding> bindings,
      int endOffset) {
    super(locs, Kind.IMPORT);
    this.startOffset = startOffset;
    this.module = module;
    this.bindings = bindings;
    this.endOffset = endOffset;
  }

  /** Returns the module of a {@code from} import, including leading dots; null otherwise. */
  @Nullable
  public String getModule() {
    return module;
  }

  public ImmutableList<Binding> getBindings() {
    return bindings;
  }

  @Override
  public int getStartOffset() {
    return startOffset;
  }

  @Override
  public int getEndOffset() {
    return endOffset;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
