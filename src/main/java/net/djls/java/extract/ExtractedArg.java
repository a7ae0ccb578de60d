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

/** A named argument slot of a tag, as offered to a user completing or snippeting the tag. */
@AutoValue
public abstract class ExtractedArg {

  /** What a slot holds. */
  public enum Kind {
    /** A fixed keyword, such as {@code as} or {@code by}. */
    LITERAL,
    /** A template variable or expression. */
    VARIABLE,
    /** One of a fixed set of words. */
    CHOICE,
    /** Any number of trailing arguments. */
    VARARGS,
    /** A keyword-only argument, written {@code name=value}. */
    KEYWORD,
  }

  public abstract String name();

  /** Zero-based argument index, not counting the tag name. */
  public abstract int position();

  public abstract Kind kind();

  public abstract boolean required();

  /** The default value as written in source, if any. */
  @Nullable
  public abstract String defaultValue();

  /** The admissible words of a {@link Kind#CHOICE} slot. */
  public abstract ImmutableList<String> choices();

  public static ExtractedArg variable(String name, int position, boolean required) {
    return create(name, position, Kind.VARIABLE, required, null, ImmutableList.of());
  }

  public static ExtractedArg literal(String keyword, int position, boolean required) {
    return create(keyword, position, Kind.LITERAL, required, null, ImmutableList.of());
  }

  public static ExtractedArg create(
      String name,
      int position,
      Kind kind,
      boolean required,
      @Nullable String defaultValue,
      ImmutableList<String> choices) {
    return new AutoValue_ExtractedArg(name, position, kind, required, defaultValue, choices);
  }
}
