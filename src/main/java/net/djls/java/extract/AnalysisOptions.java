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
import com.google.common.collect.ImmutableSet;

/** Tunables of the tag analysis. */
@AutoValue
public abstract class AnalysisOptions {

  /** The default options, matching how template libraries are conventionally written. */
  public static final AnalysisOptions DEFAULT = builder().build();

  /**
   * Names of exception classes whose {@code raise} marks a validation failure. A raise matches by
   * bare name ({@code raise E(...)}) or attribute name ({@code raise template.E(...)}).
   */
  public abstract ImmutableSet<String> validationErrorNames();

  /** How many levels of same-module helper calls are analyzed. */
  public abstract int maxHelperDepth();

  /** Methods of the parser handle that are summarized as unknown. */
  public abstract ImmutableSet<String> opaqueParserMethods();

  /** Functions known to consume the tracked token list passed to them. */
  public abstract ImmutableSet<String> tokenKwargsFunctions();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_AnalysisOptions.Builder()
        .validationErrorNames(ImmutableSet.of("TemplateSyntaxError"))
        .maxHelperDepth(1)
        .opaqueParserMethods(
            ImmutableSet.of(
                "compile_filter", "parse", "delete_first_token", "next_token", "skip_past"))
        .tokenKwargsFunctions(ImmutableSet.of("token_kwargs"));
  }

  /** Builder for {@link AnalysisOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder validationErrorNames(ImmutableSet<String> names);

    public abstract Builder maxHelperDepth(int depth);

    public abstract Builder opaqueParserMethods(ImmutableSet<String> methods);

    public abstract Builder tokenKwargsFunctions(ImmutableSet<String> functions);

    public abstract AnalysisOptions build();
  }
}
