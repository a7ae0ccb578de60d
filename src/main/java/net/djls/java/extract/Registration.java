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
import javax.annotation.Nullable;

/** A tag or filter registered with a template library. */
@AutoValue
public abstract class Registration {

  /** How a name was registered. */
  public enum Kind {
    /** {@code register.tag}: the function compiles the tag from parser and token. */
    TAG,
    SIMPLE_TAG,
    INCLUSION_TAG,
    SIMPLE_BLOCK_TAG,
    FILTER;

    public boolean isTag() {
      return this != FILTER;
    }
  }

  /** The name templates use. */
  public abstract String name();

  public abstract Kind kind();

  /** The registered function, possibly dotted ({@code module.func}), if it is named. */
  @Nullable
  public abstract String functionName();

  /** The {@code end_name} given to {@code simple_block_tag}, if any. */
  @Nullable
  public abstract String endName();

  public static Registration create(String name, Kind kind, @Nullable String functionName) {
    return create(name, kind, functionName, null);
  }

  public static Registration create(
      String name, Kind kind, @Nullable String functionName, @Nullable String endName) {
    return new AutoValue_Registration(name, kind, functionName, endName);
  }
}
