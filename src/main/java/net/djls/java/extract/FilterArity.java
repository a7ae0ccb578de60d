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
import java.util.ArrayList;
import java.util.List;
import net.djls.java.syntax.DefStatement;
import net.djls.java.syntax.Parameter;

/** Whether a filter takes an argument, as in {@code value|default:"x"}. */
@AutoValue
public abstract class FilterArity {

  public abstract boolean expectsArg();

  /** Whether the argument may be omitted. */
  public abstract boolean argOptional();

  public static FilterArity create(boolean expectsArg, boolean argOptional) {
    return new AutoValue_FilterArity(expectsArg, argOptional);
  }

  /**
   * Returns the arity of the filter implemented by {@code function}. The first positional
   * parameter, after a leading {@code self}, receives the filtered value; any further one is the
   * argument.
   */
  public static FilterArity of(DefStatement function) {
    List<Parameter> positional = new ArrayList<>();
    for (Parameter param : function.getParameters()) {
      if (param instanceof Parameter.Star || param instanceof Parameter.StarStar) {
        break;
      }
      positional.add(param);
    }
    if (!positional.isEmpty() && "self".equals(positional.get(0).getName())) {
      positional.remove(0);
    }
    if (positional.size() <= 1) {
      return create(false, false);
    }
    boolean optional = true;
    for (Parameter extra : positional.subList(1, positional.size())) {
      optional &= extra.getDefaultValue() != null;
    }
    return create(true, optional);
  }
}
