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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of index and length arithmetic relative to the original split. */
@RunWith(JUnit4.class)
public final class SplitOffsetsTest {

  @Test
  public void testFreshOffsetsAreIdentity() {
    SplitOffsets fresh = SplitOffsets.fresh();
    assertThat(fresh.resolveIndex(3)).isEqualTo(SplitPosition.forward(3));
    assertThat(fresh.resolveIndex(-1)).isEqualTo(SplitPosition.backward(1));
    assertThat(fresh.resolveLength(4)).isEqualTo(4);
  }

  @Test
  public void testPopsAndSlicesAccumulate() {
    SplitOffsets offsets = SplitOffsets.fresh().afterFrontPop().afterSliceFrom(2).afterBackPop();
    assertThat(offsets).isEqualTo(SplitOffsets.of(3, 1));
    assertThat(offsets.resolveIndex(0)).isEqualTo(SplitPosition.forward(3));
    assertThat(offsets.resolveIndex(-2)).isEqualTo(SplitPosition.backward(3));
    assertThat(offsets.resolveLength(1)).isEqualTo(5);
    assertThat(offsets.afterTruncate(2)).isEqualTo(SplitOffsets.of(3, 3));
  }

  @Test
  public void testNegativeOffsetsRejected() {
    assertThrows(IllegalArgumentException.class, () -> SplitOffsets.of(-1, 0));
  }

  @Test
  public void testPositions() {
    assertThat(SplitPosition.forward(0).isTagName()).isTrue();
    assertThat(SplitPosition.backward(1).isTagName()).isFalse();
    assertThat(SplitPosition.unresolvedForward().isTagName()).isFalse();
    assertThat(SplitPosition.unresolvedForward().isResolved()).isFalse();
    assertThrows(IllegalStateException.class, () -> SplitPosition.unresolvedForward().getIndex());
    assertThrows(IllegalArgumentException.class, () -> SplitPosition.backward(0));
    assertThat(SplitPosition.backward(2).toString()).isEqualTo("Backward(2)");
  }

  @Test
  public void testValuesFollowTheirList() {
    AbstractValue split = AbstractValue.freshSplit();
    assertThat(split.afterFrontPop())
        .isEqualTo(AbstractValue.splitResult(SplitOffsets.of(1, 0)));
    assertThat(split.afterBackPop().afterBackPop())
        .isEqualTo(AbstractValue.splitResult(SplitOffsets.of(0, 2)));
    assertThat(split.slice(2, -1)).isEqualTo(AbstractValue.splitResult(SplitOffsets.of(2, 1)));
    assertThat(split.slice(null, 3)).isEqualTo(AbstractValue.UNKNOWN);
    assertThat(AbstractValue.intLiteral(1).afterFrontPop()).isEqualTo(AbstractValue.UNKNOWN);
    assertThat(split.toString()).isEqualTo("SplitResult(front=0, back=0)");
  }
}
