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
import javax.annotation.Nullable;

/**
 * A position within the list produced by splitting a tag's contents.
 *
 * <p>{@code Forward(n)} counts from the start, where position 0 is the tag name itself; {@code
 * Backward(n)} counts from the end, where {@code Backward(1)} is the last piece. A forward
 * position may be unresolved when it denotes "some element of the remaining list", as produced by
 * iterating over a split result.
 */
@AutoValue
public abstract class SplitPosition {

  /** The end of the list a position counts from. */
  public enum Direction {
    FORWARD,
    BACKWARD,
  }

  public abstract Direction direction();

  /** Returns the index, or null if the position is unresolved. */
  @Nullable
  abstract Integer index();

  public static SplitPosition forward(int index) {
    Preconditions.checkArgument(index >= 0, "negative forward index %s", index);
    return new AutoValue_SplitPosition(Direction.FORWARD, index);
  }

  public static SplitPosition backward(int index) {
    Preconditions.checkArgument(index >= 1, "backward index must be at least 1, got %s", index);
    return new AutoValue_SplitPosition(Direction.BACKWARD, index);
  }

  /** Returns a forward position whose index is not known. */
  public static SplitPosition unresolvedForward() {
    return new AutoValue_SplitPosition(Direction.FORWARD, null);
  }

  public boolean isForward() {
    return direction() == Direction.FORWARD;
  }

  public boolean isResolved() {
    return index() != null;
  }

  /** Returns the resolved index. Fails if the position is unresolved. */
  public int getIndex() {
    Preconditions.checkState(isResolved(), "position %s is unresolved", this);
    return index();
  }

  /** Reports whether this is the resolved forward position 0, the tag name. */
  public boolean isTagName() {
    return isForward() && isResolved() && index() == 0;
  }

  @Override
  public final String toString() {
    String name = isForward() ? "Forward" : "Backward";
    return name + "(" + (isResolved() ? index().toString() : "?") + ")";
  }
}
