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
import javax.annotation.Nullable;

/** The inferred argument grammar of one template tag. */
@AutoValue
public abstract class TagRule {

  /** Constraints every valid use of the tag satisfies. */
  public abstract ConstraintSet constraints();

  public abstract ImmutableList<ExtractedArg> extractedArgs();

  @Nullable
  public abstract OptionLoop options();

  /** Whether the tag accepts a trailing {@code as varname}. */
  public abstract boolean supportsAsVar();

  public static TagRule create(
      ConstraintSet constraints,
      ImmutableList<ExtractedArg> extractedArgs,
      @Nullable OptionLoop options,
      boolean supportsAsVar) {
    return new AutoValue_TagRule(constraints, extractedArgs, options, supportsAsVar);
  }

  /** Reports whether the rule says anything about the tag's arguments. */
  public boolean hasContent() {
    return !constraints().isEmpty() || !extractedArgs().isEmpty() || options() != null;
  }
}
