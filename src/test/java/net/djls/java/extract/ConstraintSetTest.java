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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link ConstraintSet} and the constraint types it holds. */
@RunWith(JUnit4.class)
public final class ConstraintSetTest {

  private static final Constraint MIN_2 = Constraint.length(ArgumentCountConstraint.min(2));
  private static final Constraint MAX_4 = Constraint.length(ArgumentCountConstraint.max(4));
  private static final Constraint BY =
      Constraint.keyword(SplitPosition.forward(2), "by");
  private static final Constraint ON_OFF =
      Constraint.choice(SplitPosition.backward(1), ImmutableList.of("on", "off"));

  @Test
  public void testEqualityIgnoresOrder() {
    assertThat(ConstraintSet.of(MIN_2, BY)).isEqualTo(ConstraintSet.of(BY, MIN_2));
    assertThat(ConstraintSet.of(MIN_2, MIN_2)).isEqualTo(ConstraintSet.of(MIN_2));
    assertThat(ConstraintSet.of()).isSameInstanceAs(ConstraintSet.EMPTY);
  }

  @Test
  public void testOrIsUnion() {
    assertThat(ConstraintSet.of(MIN_2).or(ConstraintSet.of(BY, MIN_2)))
        .isEqualTo(ConstraintSet.of(MIN_2, BY));
    assertThat(ConstraintSet.EMPTY.or(ConstraintSet.of(BY))).isEqualTo(ConstraintSet.of(BY));
  }

  @Test
  public void testAndDropsLengths() {
    assertThat(ConstraintSet.of(MIN_2, BY).and(ConstraintSet.of(MAX_4, ON_OFF)))
        .isEqualTo(ConstraintSet.of(BY, ON_OFF));
    assertThat(ConstraintSet.of(MIN_2).and(ConstraintSet.of(MAX_4)).isEmpty()).isTrue();
  }

  @Test
  public void testWithoutPositional() {
    assertThat(ConstraintSet.of(MIN_2, BY, ON_OFF, MAX_4).withoutPositional())
        .isEqualTo(ConstraintSet.of(MIN_2, MAX_4));
  }

  @Test
  public void testAccessors() {
    ConstraintSet set = ConstraintSet.of(MIN_2, BY, MAX_4, ON_OFF);
    assertThat(set.lengthConstraints())
        .containsExactly(ArgumentCountConstraint.min(2), ArgumentCountConstraint.max(4))
        .inOrder();
    assertThat(set.ofKind(Constraint.Kind.KEYWORD)).containsExactly(BY);
    assertThat(set.ofKind(Constraint.Kind.CHOICE)).containsExactly(ON_OFF);
  }

  @Test
  public void testToString() {
    assertThat(ConstraintSet.of(MIN_2, BY, ON_OFF).toString())
        .isEqualTo("{Length(Min(2)), Keyword(Forward(2), \"by\"), Choice(Backward(1), [on, off])}");
    assertThat(Constraint.keyword(SplitPosition.unresolvedForward(), "x").toString())
        .isEqualTo("Keyword(Forward(?), \"x\")");
  }

  @Test
  public void testCountConstraints() {
    ArgumentCountConstraint oneOf = ArgumentCountConstraint.oneOf(ImmutableList.of(4, 2, 4));
    assertThat(oneOf.values()).containsExactly(2, 4).inOrder();
    assertThat(oneOf.toString()).isEqualTo("OneOf([2, 4])");
    assertThat(oneOf.admits(4)).isTrue();
    assertThat(oneOf.admits(3)).isFalse();
    assertThat(ArgumentCountConstraint.min(2).admits(5)).isTrue();
    assertThat(ArgumentCountConstraint.max(2).admits(3)).isFalse();
    assertThat(ArgumentCountConstraint.exact(3).admits(3)).isTrue();
    assertThrows(IllegalStateException.class, oneOf::value);
    assertThrows(
        IllegalArgumentException.class, () -> ArgumentCountConstraint.oneOf(ImmutableList.of()));
  }

  @Test
  public void testConstraintAccessorsCheckKind() {
    assertThat(BY.getKeyword()).isEqualTo("by");
    assertThat(BY.getPosition()).isEqualTo(SplitPosition.forward(2));
    assertThrows(IllegalStateException.class, MIN_2::getPosition);
    assertThrows(IllegalStateException.class, BY::getCount);
    assertThrows(IllegalStateException.class, ON_OFF::getKeyword);
  }
}
