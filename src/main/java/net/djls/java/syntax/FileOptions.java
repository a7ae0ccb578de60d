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

package net.djls.java.syntax;

import com.google.auto.value.AutoValue;

/**
 * FileOptions is a set of options that affect the scanning and parsing of a single Python source
 * file. The {@link #DEFAULT} options accept the language as CPython does; stricter options exist
 * for callers that want to reject constructs CPython only warns about.
 */
@AutoValue
public abstract class FileOptions {

  /** The default options, matching what CPython accepts. */
  public static final FileOptions DEFAULT = builder().build();

  /**
   * During lexing, report an error for unknown escape sequences such as {@code "\d"} in non-raw
   * string literals, instead of keeping the backslash (CPython only emits a warning).
   */
  public abstract boolean restrictStringEscapes();

  /** During lexing, accept tab characters in indentation. Each tab counts as one column. */
  public abstract boolean allowTabIndentation();

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_FileOptions.Builder()
        .restrictStringEscapes(false)
        .allowTabIndentation(true);
  }

  public abstract Builder toBuilder();

  /** This javadoc comment states that FileOptions.Builder is a builder for FileOptions. */
  @AutoValue.Builder
  public abstract static class Builder {
    // AutoValue why u make me say it 3 times?
    public abstract Builder restrictStringEscapes(boolean value);

    public abstract Builder allowTabIndentation(boolean value);

    public abstract FileOptions build();
  }
}
