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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import javax.annotation.Nullable;
import net.djls.java.syntax.Expression;
import net.djls.java.syntax.MatchStatement;
import net.djls.java.syntax.Pattern;
import net.djls.java.syntax.StringLiteral;

/**
 * Constraints from a {@code match} over a split list.
 *
 * <p>Each arm whose body does not raise a validation error admits one shape of input. The lengths
 * the admissible arms accept bound the argument count; a literal shared by every admissible arm
 * at a position is a required keyword.
 */
final class MatchArms {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private MatchArms() {}

  /**
   * The shape of a sequence pattern: {@code elements} with an optional star at {@code starIndex}.
   * Capture and wildcard patterns are the empty sequence with a star.
   */
  private static final class Shape {
    final ImmutableList<Pattern> elements;
    final int starIndex;

    Shape(ImmutableList<Pattern> elements, int starIndex) {
      this.elements = elements;
      this.starIndex = starIndex;
    }

    boolean isFixed() {
      return starIndex < 0;
    }

    int minLength() {
      return isFixed() ? elements.size() : elements.size() - 1;
    }

    /** Reports whether an input matching this shape can have an element at index {@code p}. */
    boolean covers(int p) {
      return !isFixed() || p < elements.size();
    }

    /** Returns the literal this shape requires at index {@code p}, if any. */
    @Nullable
    String literalAt(int p) {
      if (!isFixed() && p >= starIndex) {
        return null;
      }
      return literal(elements.get(p));
    }
  }

  /** Returns the constraints of {@code match}, whose subject evaluates to {@code subject}. */
  static ConstraintSet extract(AnalysisContext ctx, MatchStatement match, AbstractValue subject) {
    if (!subject.isSplitResult()) {
      return ConstraintSet.EMPTY;
    }
    List<Shape> shapes = new ArrayList<>();
    for (MatchStatement.Case arm : match.getCases()) {
      if (ctx.raisesValidationError(arm.getBody())) {
        continue;
      }
      for (Pattern alternative : alternatives(arm.getPattern())) {
        Shape shape = shape(alternative);
        if (shape == null) {
          logger.atFiner().log("match arm pattern %s has no known length", alternative.kind());
          return ConstraintSet.EMPTY;
        }
        shapes.add(shape);
      }
    }
    if (shapes.isEmpty()) {
      return ConstraintSet.EMPTY;
    }

    SplitOffsets offsets = subject.getOffsets();
    List<Constraint> result = new ArrayList<>();
    result.addAll(lengths(shapes, offsets));
    for (Shape shape : shapes) {
      if (!shape.isFixed()) {
        continue;
      }
      for (int p = 0; p < shape.elements.size(); p++) {
        String literal = shape.literalAt(p);
        SplitPosition position = offsets.resolveIndex(p);
        if (literal != null && !position.isTagName() && agreeAt(shapes, p, literal)) {
          result.add(Constraint.keyword(position, literal));
        }
      }
    }
    return ConstraintSet.copyOf(result);
  }

  private static List<Constraint> lengths(List<Shape> shapes, SplitOffsets offsets) {
    TreeSet<Integer> fixed = new TreeSet<>();
    int min = Integer.MAX_VALUE;
    boolean variable = false;
    for (Shape shape : shapes) {
      min = Math.min(min, shape.minLength());
      if (shape.isFixed()) {
        fixed.add(offsets.resolveLength(shape.minLength()));
      } else {
        variable = true;
      }
    }
    if (variable) {
      return min > 0
          ? ImmutableList.of(
              Constraint.length(ArgumentCountConstraint.min(offsets.resolveLength(min))))
          : ImmutableList.of();
    }
    if (fixed.size() == 1) {
      return ImmutableList.of(Constraint.length(ArgumentCountConstraint.exact(fixed.first())));
    }
    // A contiguous run of three or more lengths reads better as a range.
    if (fixed.size() > 2 && fixed.last() - fixed.first() + 1 == fixed.size()) {
      return ImmutableList.of(
          Constraint.length(ArgumentCountConstraint.min(fixed.first())),
          Constraint.length(ArgumentCountConstraint.max(fixed.last())));
    }
    return ImmutableList.of(Constraint.length(ArgumentCountConstraint.oneOf(fixed)));
  }

  private static boolean agreeAt(List<Shape> shapes, int p, String literal) {
    for (Shape shape : shapes) {
      if (shape.covers(p) && !literal.equals(shape.literalAt(p))) {
        return false;
      }
    }
    return true;
  }

  /** Returns the alternatives of an or-pattern, looking through {@code p as x}. */
  private static List<Pattern> alternatives(Pattern pattern) {
    List<Pattern> result = new ArrayList<>();
    if (pattern instanceof Pattern.Or or) {
      for (Pattern alt : or.getAlternatives()) {
        result.addAll(alternatives(alt));
      }
    } else if (pattern instanceof Pattern.As as && as.getPattern() != null) {
      result.addAll(alternatives(as.getPattern()));
    } else {
      result.add(pattern);
    }
    return result;
  }

  @Nullable
  private static Shape shape(Pattern pattern) {
    if (pattern instanceof Pattern.Sequence seq) {
      return new Shape(seq.getElements(), seq.getStarIndex());
    }
    if (pattern instanceof Pattern.As as && as.isIrrefutable()) {
      return new Shape(ImmutableList.of(pattern), 0);
    }
    return null;
  }

  @Nullable
  private static String literal(Pattern pattern) {
    if (pattern instanceof Pattern.Value value) {
      Expression e = value.getValue();
      if (e instanceof StringLiteral lit) {
        return lit.getValue();
      }
    }
    return null;
  }

  /**
   * Binds the names captured by a sequence {@code pattern} to the pieces of the split
   * list they match.
   */
  static void bindCaptures(AnalysisContext ctx, Pattern pattern, AbstractValue subject) {
    if (!subject.isSplitResult() || !(pattern instanceof Pattern.Sequence seq)) {
      return;
    }
    SplitOffsets offsets = subject.getOffsets();
    ImmutableList<Pattern> elements = seq.getElements();
    int star = seq.getStarIndex();
    for (int i = 0; i < elements.size(); i++) {
      Pattern element = elements.get(i);
      if (i == star) {
        Pattern.Star rest = (Pattern.Star) element;
        if (rest.getName() != null) {
          int after = elements.size() - star - 1;
          ctx.env()
              .bind(
                  rest.getName().getName(),
                  AbstractValue.splitResult(
                      SplitOffsets.of(offsets.front() + star, offsets.back() + after)));
        }
      } else if (element instanceof Pattern.As as && as.isIrrefutable() && as.getName() != null) {
        SplitPosition position =
            star < 0 || i < star
                ? offsets.resolveIndex(i)
                : offsets.resolveIndex(i - elements.size());
        ctx.env().bind(as.getName().getName(), AbstractValue.splitElement(position));
      }
    }
  }
}
