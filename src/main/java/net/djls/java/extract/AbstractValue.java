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

package net.djls.java.extract;

import com.google.auto.value.AutoValue;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * What the analysis knows about a value at a given point of a tag function.
 *
 * <p>The domain is deliberately small: a value is either one of the two handles a tag function
 * receives, something derived from splitting the token's contents, a literal, a tuple or list of
 * those, or {@link #UNKNOWN}. Transformations return new values; nothing here is mutable.
 */
@AutoValue
public abstract class AbstractValue {

  /** The shape of an abstract value. */
  public enum Kind {
    UNKNOWN,
    TOKEN_HANDLE,
    PARSER_HANDLE,
    SPLIT_RESULT,
    SPLIT_ELEMENT,
    SPLIT_LENGTH,
    INT_LITERAL,
    STR_LITERAL,
    TUPLE,
    LIST_OF,
  }

  public static final AbstractValue UNKNOWN = create(Kind.UNKNOWN);
  public static final AbstractValue TOKEN_HANDLE = create(Kind.TOKEN_HANDLE);
  public static final AbstractValue PARSER_HANDLE = create(Kind.PARSER_HANDLE);

  public abstract Kind kind();

  @Nullable
  abstract SplitOffsets offsets();

  @Nullable
  abstract SplitPosition position();

  abstract long intValue();

  @Nullable
  abstract String strValue();

  abstract ImmutableList<AbstractValue> elements();

  private static AbstractValue create(Kind kind) {
    return new AutoValue_AbstractValue(kind, null, null, 0, null, ImmutableList.of());
  }

  public static AbstractValue splitResult(SplitOffsets offsets) {
    return new AutoValue_AbstractValue(
        Kind.SPLIT_RESULT, offsets, null, 0, null, ImmutableList.of());
  }

  public static AbstractValue freshSplit() {
    return splitResult(SplitOffsets.fresh());
  }

  public static AbstractValue splitElement(SplitPosition position) {
    return new AutoValue_AbstractValue(
        Kind.SPLIT_ELEMENT, null, position, 0, null, ImmutableList.of());
  }

  public static AbstractValue splitLength(SplitOffsets offsets) {
    return new AutoValue_AbstractValue(
        Kind.SPLIT_LENGTH, offsets, null, 0, null, ImmutableList.of());
  }

  public static AbstractValue intLiteral(long value) {
    return new AutoValue_AbstractValue(
        Kind.INT_LITERAL, null, null, value, null, ImmutableList.of());
  }

  public static AbstractValue strLiteral(String value) {
    return new AutoValue_AbstractValue(Kind.STR_LITERAL, null, null, 0, value, ImmutableList.of());
  }

  public static AbstractValue tuple(List<AbstractValue> elements) {
    return new AutoValue_AbstractValue(
        Kind.TUPLE, null, null, 0, null, ImmutableList.copyOf(elements));
  }

  public static AbstractValue listOf(List<AbstractValue> elements) {
    return new AutoValue_AbstractValue(
        Kind.LIST_OF, null, null, 0, null, ImmutableList.copyOf(elements));
  }

  public boolean isUnknown() {
    return kind() == Kind.UNKNOWN;
  }

  public boolean isSplitResult() {
    return kind() == Kind.SPLIT_RESULT;
  }

  /** Returns the offsets of a split result or split length. */
  public SplitOffsets getOffsets() {
    Preconditions.checkState(
        kind() == Kind.SPLIT_RESULT || kind() == Kind.SPLIT_LENGTH, "%s has no offsets", this);
    return offsets();
  }

  /** Returns the position of a split element. */
  public SplitPosition getPosition() {
    Preconditions.checkState(kind() == Kind.SPLIT_ELEMENT, "%s has no position", this);
    return position();
  }

  public long getInt() {
    Preconditions.checkState(kind() == Kind.INT_LITERAL, "%s is not an int", this);
    return intValue();
  }

  public String getString() {
    Preconditions.checkState(kind() == Kind.STR_LITERAL, "%s is not a string", this);
    return strValue();
  }

  /** Returns the elements of a tuple or list. */
  public ImmutableList<AbstractValue> getElements() {
    Preconditions.checkState(
        kind() == Kind.TUPLE || kind() == Kind.LIST_OF, "%s has no elements", this);
    return elements();
  }

  /**
   * Returns the value of this list after removing its first element. Anything but a split result
   * is no longer tracked.
   */
  public AbstractValue afterFrontPop() {
    return isSplitResult() ? splitResult(offsets().afterFrontPop()) : UNKNOWN;
  }

  /** Returns the value of this list after removing its last element. */
  public AbstractValue afterBackPop() {
    return isSplitResult() ? splitResult(offsets().afterBackPop()) : UNKNOWN;
  }

  /**
   * Returns the value of {@code this[start:stop]}, where a null bound is absent. Only slices that
   * keep a contiguous run anchored at both original ends are tracked: a non-negative start and a
   * negative or absent stop.
   */
  public AbstractValue slice(@Nullable Integer start, @Nullable Integer stop) {
    if (!isSplitResult()) {
      return UNKNOWN;
    }
    SplitOffsets result = offsets();
    if (start != null) {
      if (start < 0) {
        return UNKNOWN;
      }
      result = result.afterSliceFrom(start);
    }
    if (stop != null) {
      if (stop >= 0) {
        return UNKNOWN;
      }
      result = result.afterTruncate(-stop);
    }
    return splitResult(result);
  }

  @Override
  public final String toString() {
    switch (kind()) {
      case UNKNOWN:
        return "Unknown";
      case TOKEN_HANDLE:
        return "TokenHandle";
      case PARSER_HANDLE:
        return "ParserHandle";
      case SPLIT_RESULT:
        return "SplitResult(" + offsets() + ")";
      case SPLIT_ELEMENT:
        return "SplitElement(" + position() + ")";
      case SPLIT_LENGTH:
        return "SplitLength(" + offsets() + ")";
      case INT_LITERAL:
        return "Int(" + intValue() + ")";
      case STR_LITERAL:
        return "Str(\"" + strValue() + "\")";
      case TUPLE:
        return "Tuple[" + Joiner.on(", ").join(elements()) + "]";
      case LIST_OF:
        return "ListOf[" + Joiner.on(", ").join(elements()) + "]";
    }
    throw new IllegalStateException(kind().toString());
  }
}
