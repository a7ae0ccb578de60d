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
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A "pop the next piece and dispatch on its value" loop that parses keyword options trailing the
 * positional arguments of a tag, such as {@code {% include "x" with a=1 only %}}.
 */
@AutoValue
public abstract class OptionLoop {

  /** The option keywords, in the order the loop tests them. */
  public abstract ImmutableList<String> options();

  /** Whether a piece matching no option raises an error. */
  public abstract boolean rejectsUnknown();

  /** Whether an option may be given more than once. */
  public abstract boolean allowsDuplicates();

  public static OptionLoop create(
      List<String> options, boolean rejectsUnknown, boolean allowsDuplicates) {
    return new AutoValue_OptionLoop(
        ImmutableList.copyOf(options), rejectsUnknown, allowsDuplicates);
  }
}
