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
import com.google.common.base.Preconditions;

/**
 * The number of elements consumed from either end of a split result since the original split.
 *
 * <p>All index and length arithmetic of the analysis goes through {@link #resolveIndex} and
 * {@link #resolveLength}, so that a check written against a popped or sliced list is expressed in
 * terms of the original list.
 */
@AutoValue
public abstract class SplitOffsets {

  private static final SplitOffsets FRESH = of(0, 0);

  public abstract int front();

  public abstract int back();

  public static SplitOffsets of(int front, int back) {
    Preconditions.checkArgument(front >= 0 && back >= 0, "negative offsets (%s, %s)", front, back);
    return new AutoValue_SplitOffsets(front, back);
  }

  /** Returns the offsets of a list straight out of a split. */
  public static SplitOffsets fresh() {
    return FRESH;
  }

  SplitOffsets afterFrontPop() {
    return of(front() + 1, back());
  }

  SplitOffsets afterBackPop() {
    return of(front(), back() + 1);
  }

  /** Offsets of {@code list[n:]}. */
  SplitOffsets afterSliceFrom(int n) {
    return of(front() + n, back());
  }

  /** Offsets of {@code list[:-k]}. */
  SplitOffsets afterTruncate(int k) {
    return of(front(), back() + k);
  }

  /**
   * Maps an index into the current list to a position in the original one. Non-negative indices
   * count from the front; negative ones from the back.
   */
  public SplitPosition resolveIndex(int index) {
    if (index >= 0) {
      return SplitPosition.forward(front() + index);
    }
    return SplitPosition.backward(-index + back());
  }

  /** Maps a length of the current list to the corresponding length of the original one. */
  public int resolveLength(int length) {
    return length + front() + back();
  }

  @Override
  public final String toString() {
    return "front=" + front() + ", back=" + back();
  }
}
