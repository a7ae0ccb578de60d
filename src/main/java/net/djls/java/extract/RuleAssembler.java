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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import javax.annotation.Nullable;

/** Combines the results of analyzing a tag function into its {@link TagRule}. */
final class RuleAssembler {

  private RuleAssembler() {}

  static TagRule assemble(
      ConstraintSet constraints,
      @Nullable OptionLoop options,
      ImmutableMap<String, AbstractValue> bindings) {
    ImmutableList<ExtractedArg> args = extractArgs(constraints, bindings);
    boolean asVar = false;
    for (Constraint c : constraints.ofKind(Constraint.Kind.KEYWORD)) {
      asVar |= c.getKeyword().equals("as");
    }
    return TagRule.create(constraints, args, options, asVar);
  }

  /**
   * Reconstructs the positional argument slots the constraints imply. Keyword and choice
   * constraints name their slots; the others take the name of the variable the piece was bound to,
   * or {@code arg<i>}.
   */
  static ImmutableList<ExtractedArg> extractArgs(
      ConstraintSet constraints, Map<String, AbstractValue> bindings) {
    int pieces = 0;
    int lowerBound = 0;
    Integer exact = null;
    for (ArgumentCountConstraint count : constraints.lengthConstraints()) {
      switch (count.kind()) {
        case EXACT:
          exact = count.value();
          pieces = Math.max(pieces, count.value());
          lowerBound = Math.max(lowerBound, count.value());
          break;
        case MIN:
          pieces = Math.max(pieces, count.value());
          lowerBound = Math.max(lowerBound, count.value());
          break;
        case MAX:
          pieces = Math.max(pieces, count.value());
          break;
        case ONE_OF:
          pieces = Math.max(pieces, count.values().get(count.values().size() - 1));
          lowerBound = Math.max(lowerBound, count.values().get(0));
          break;
      }
    }
    for (Constraint c : constraints.asList()) {
      Integer p = c.isLength() ? null : forwardIndex(c.getPosition(), exact);
      if (p != null) {
        pieces = Math.max(pieces, p + 1);
      }
    }
    int slots = pieces - 1;
    if (slots <= 0) {
      return ImmutableList.of();
    }

    ExtractedArg[] args = new ExtractedArg[slots];
    for (Constraint c : constraints.asList()) {
      Integer p = c.isLength() ? null : forwardIndex(c.getPosition(), exact);
      if (p == null || p == 0) {
        continue;
      }
      int i = p - 1;
      if (c.kind() == Constraint.Kind.KEYWORD) {
        args[i] = ExtractedArg.literal(c.getKeyword(), i, true);
      } else {
        args[i] =
            ExtractedArg.create(
                c.literals().get(0), i, ExtractedArg.Kind.CHOICE, true, null, c.literals());
      }
    }
    for (Map.Entry<String, AbstractValue> e : bindings.entrySet()) {
      AbstractValue value = e.getValue();
      if (value.kind() != AbstractValue.Kind.SPLIT_ELEMENT) {
        continue;
      }
      Integer p = forwardIndex(value.getPosition(), exact);
      if (p != null && p > 0 && p <= slots
          && (args[p - 1] == null || args[p - 1].kind() == ExtractedArg.Kind.VARIABLE)) {
        args[p - 1] = ExtractedArg.variable(e.getKey(), p - 1, p < lowerBound);
      }
    }
    ImmutableList.Builder<ExtractedArg> result = ImmutableList.builder();
    for (int i = 0; i < slots; i++) {
      result.add(
          args[i] != null ? args[i] : ExtractedArg.variable("arg" + i, i, i + 1 < lowerBound));
    }
    return result.build();
  }

  /** Returns the forward index of {@code position}, using an exact length to map backward ones. */
  @Nullable
  private static Integer forwardIndex(SplitPosition position, @Nullable Integer exact) {
    if (!position.isResolved()) {
      return null;
    }
    if (position.isForward()) {
      return position.getIndex();
    }
    if (exact != null && position.getIndex() <= exact) {
      return exact - position.getIndex();
    }
    return null;
  }
}
