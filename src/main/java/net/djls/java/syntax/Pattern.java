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
import javax.annotation.Nullable;

/**
 * Syntax node for a pattern of a {@code case} clause.
 *
 * <p>Patterns are represented by the subclasses Value, As, Sequence, Star, Or, ClassPattern and
 * Mapping. A capture pattern {@code x} is an As pattern with no subpattern, and the wildcard
 * {@code _} is an As pattern with neither subpattern nor name.
 */
public abstract class Pattern extends Node {

  /** Kind of the pattern, for use in a switch. */
  public enum Kind {
    VALUE,
    AS,
    SEQUENCE,
    STAR,
    OR,
    CLASS,
    MAPPING,
  }

  private final Kind kind;

  private Pattern(FileLocations locs, Kind kind) {
    super(locs);
    this.kind = kind;
  }

  public final Kind kind() {
    return kind;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  /**
   * A literal or dotted-name value pattern, such as {@code "on"}, {@code -1}, {@code None} or
   * {@code Color.RED}.
   */
  public static final class Value extends Pattern {
    private final Expression value;

    Value(FileLocations locs, Expression value) {
      super(locs, Kind.VALUE);
      this.value = value;
    }

    public Expression getValue() {
      return value;
    }

    @Override
    public int getStartOffset() {
      return value.getStartOffset();
    }

    @Override
    public int getEndOffset() {
      return value.getEndOffset();
    }
  }

  /** A capture ({@code x}), wildcard ({@code _}), or as-pattern ({@code p as x}). */
  public static final class As extends Pattern {
    @Nullable private final Pattern pattern;
    @Nullable private final Identifier name;
    private final int startOffset;
    private final int endOffset;

    As(
        FileLocations locs,
        @Nullable Pattern pattern,
        @Nullable Identifier name,
        int startOffset,
        int endOffset) {
      super(locs, Kind.AS);
      this.pattern = pattern;
      this.name = name;
      this.startOffset = startOffset;
      this.endOffset = endOffset;
    }

    /** Returns the subpattern of {@code p as x}, or null for a capture or wildcard. */
    @Nullable
    public Pattern getPattern() {
      return pattern;
    }

    /** Returns the bound name, or null for the wildcard. */
    @Nullable
    public Identifier getName() {
      return name;
    }

    /** Reports whether this is the irrefutable wildcard {@code _}. */
    public boolean isWildcard() {
      return pattern == null && name == null;
    }

    /** Reports whether this pattern matches any subject (a capture or the wildcard). */
    public boolean isIrrefutable() {
      return pattern == null;
    }

    @Override
    public int getStartOffset() {
      return startOffset;
    }

    @Override
    public int getEndOffset() {
      return endOffset;
    }
  }

  /** A sequence pattern, {@code [a, "b", *rest]} or {@code (a, b)}. */
  public static final class Sequence extends Pattern {
    private final ImmutableList<Pattern> elements;
    private final int startOffset;
    private final int endOffset;

    Sequence(
        FileLocations locs, ImmutableList<Pattern> elements, int startOffset, int endOffset) {
      super(locs, Kind.SEQUENCE);
      this.elements = elements;
      this.startOffset = startOffset;
      this.endOffset = endOffset;
    }

    public ImmutableList<Pattern> getElements() {
      return elements;
    }

    /** Returns the index of the star element, or -1 if the sequence has a fixed length. */
    public int getStarIndex() {
      for (int i = 0; i < elements.size(); i++) {
        if (elements.get(i).kind() == Kind.STAR) {
          return i;
        }
      }
      return -1;
    }

    @Override
    public int getStartOffset() {
      return startOffset;
    }

    @Override
    public int getEndOffset() {
      return endOffset;
    }
  }

  /** A star element of a sequence pattern, {@code *rest} or {@code *_}. */
  public static final class Star extends Pattern {
    private final int starOffset;
    @Nullable private final Identifier name; // null for *_
    private final int endOffset;

    Star(FileLocations locs, int starOffset, @Nullable Identifier name, int endOffset) {
      super(locs, Kind.STAR);
      this.starOffset = starOffset;
      this.name = name;
      this.endOffset = endOffset;
    }

    @Nullable
    public Identifier getName() {
      return name;
    }

    @Override
    public int getStartOffset() {
      return starOffset;
    }

    @Override
    public int getEndOffset() {
      return endOffset;
    }
  }

  /** An or-pattern, {@code "a" | "b"}. */
  public static final class Or extends Pattern {
    private final ImmutableList<Pattern> alternatives;

    Or(FileLocations locs, ImmutableList<Pattern> alternatives) {
      super(locs, Kind.OR);
      Preconditions.checkArgument(alternatives.size() >= 2);
      this.alternatives = alternatives;
    }

    public ImmutableList<Pattern> getAlternatives() {
      return alternatives;
    }

    @Override
    public int getStartOffset() {
      return alternatives.get(0).getStartOffset();
    }

    @Override
    public int getEndOffset() {
      return alternatives.get(alternatives.size() - 1).getEndOffset();
    }
  }

  /** A class pattern, {@code Point(x, y=0)}. */
  public static final class ClassPattern extends Pattern {
    private final Expression cls;
    private final ImmutableList<Pattern> positional;
    private final ImmutableList<Identifier> keywordNames;
    private final ImmutableList<Pattern> keywordPatterns;
    private final int rparenOffset;

    ClassPattern(
        FileLocations locs,
        Expression cls,
        ImmutableList<Pattern> positional,
        ImmutableList<Identifier> keywordNames,
        ImmutableList<Pattern> keywordPatterns,
        int rparenOffset) {
      super(locs, Kind.CLASS);
      Preconditions.checkArgument(keywordNames.size() == keywordPatterns.size());
      this.cls = cls;
      this.positional = positional;
      this.keywordNames = keywordNames;
      this.keywordPatterns = keywordPatterns;
      this.rparenOffset = rparenOffset;
    }

    public Expression getCls() {
      return cls;
    }

    public ImmutableList<Pattern> getPositional() {
      return positional;
    }

    public ImmutableList<Identifier> getKeywordNames() {
      return keywordNames;
    }

    public ImmutableList<Pattern> getKeywordPatterns() {
      return keywordPatterns;
    }

    @Override
    public int getStartOffset() {
      return cls.getStartOffset();
    }

    @Override
    public int getEndOffset() {
      return rparenOffset + 1;
    }
  }

  /** A mapping pattern, {@code {"k": v, **rest}}. */
  public static final class Mapping extends Pattern {
    private final int lbraceOffset;
    private final ImmutableList<Expression> keys;
    private final ImmutableList<Pattern> values;
    @Nullable private final Identifier rest;
    private final int rbraceOffset;

    Mapping(
        FileLocations locs,
        int lbraceOffset,
        ImmutableList<Expression> keys,
        ImmutableList<Pattern> values,
        @Nullable Identifier rest,
        int rbraceOffset) {
      super(locs, Kind.MAPPING);
      Preconditions.checkArgument(keys.size() == values.size());
      this.lbraceOffset = lbraceOffset;
      this.keys = keys;
      this.values = values;
      this.rest = rest;
      this.rbraceOffset = rbraceOffset;
    }

    public ImmutableList<Expression> getKeys() {
      return keys;
    }

    public ImmutableList<Pattern> getValues() {
      return values;
    }

    @Nullable
    public Identifier getRest() {
      return rest;
    }

    @Override
    public int getStartOffset() {
      return lbraceOffset;
    }

    @Override
    public int getEndOffset() {
      return rbraceOffset + 1;
    }
  }
}
