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
import com.google.common.collect.ImmutableMap;

/**
 * The tag rules, block structures and filter arities of one template library module, keyed by
 * registered name.
 */
@AutoValue
public abstract class ExtractionResult {

  public abstract ImmutableMap<String, TagRule> tagRules();

  public abstract ImmutableMap<String, FilterArity> filterArities();

  public abstract ImmutableMap<String, BlockSpec> blockSpecs();

  public static ExtractionResult create(
      ImmutableMap<String, TagRule> tagRules,
      ImmutableMap<String, FilterArity> filterArities,
      ImmutableMap<String, BlockSpec> blockSpecs) {
    return new AutoValue_ExtractionResult(tagRules, filterArities, blockSpecs);
  }
}
