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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import net.djls.java.syntax.ParserInput;
import net.djls.java.syntax.SourceFile;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of rules derived from the signatures of library-parsed tags. */
@RunWith(JUnit4.class)
public final class SignatureRulesTest {

  private static TagRule rule(Registration.Kind kind, String... lines) {
    SourceFile file = SourceFile.parse(ParserInput.fromLines(lines));
    assertThat(file.errors()).isEmpty();
    return SignatureRules.forSignature(file.getFunctions().get(0), kind);
  }

  private static ConstraintSet lengths(ArgumentCountConstraint... counts) {
    ImmutableList.Builder<Constraint> constraints = ImmutableList.builder();
    for (ArgumentCountConstraint count : counts) {
      constraints.add(Constraint.length(count));
    }
    return ConstraintSet.copyOf(constraints.build());
  }

  @Test
  public void testRequiredAndDefaultedParameters() {
    TagRule rule =
        rule(
            Registration.Kind.SIMPLE_TAG,
            "@register.simple_tag",
            "def greet(name, greeting=None):",
            "    return greeting");
    assertThat(rule.constraints())
        .isEqualTo(lengths(ArgumentCountConstraint.min(2), ArgumentCountConstraint.max(3)));
    assertThat(rule.extractedArgs())
        .containsExactly(
            ExtractedArg.variable("name", 0, true),
            ExtractedArg.create(
                "greeting", 1, ExtractedArg.Kind.VARIABLE, false, "None", ImmutableList.of()),
            ExtractedArg.literal("as", 2, false),
            ExtractedArg.variable("varname", 3, false))
        .inOrder();
    assertThat(rule.supportsAsVar()).isTrue();
    assertThat(rule.options()).isNull();
  }

  @Test
  public void testTakesContextDropsFirstParameter() {
    TagRule rule =
        rule(
            Registration.Kind.SIMPLE_TAG,
            "@register.simple_tag(takes_context=True)",
            "def user_name(context, fmt):",
            "    return fmt");
    assertThat(rule.constraints())
        .isEqualTo(lengths(ArgumentCountConstraint.min(2), ArgumentCountConstraint.max(2)));
    assertThat(rule.extractedArgs().get(0)).isEqualTo(ExtractedArg.variable("fmt", 0, true));
  }

  @Test
  public void testTakesContextFalseKeepsFirstParameter() {
    TagRule rule =
        rule(
            Registration.Kind.SIMPLE_TAG,
            "@register.simple_tag(takes_context=False)",
            "def echo(context, fmt):",
            "    return fmt");
    assertThat(rule.constraints())
        .isEqualTo(lengths(ArgumentCountConstraint.min(3), ArgumentCountConstraint.max(3)));
  }

  @Test
  public void testVarargsRemoveUpperBound() {
    TagRule rule =
        rule(
            Registration.Kind.INCLUSION_TAG,
            "@register.inclusion_tag('list.html')",
            "def show(first, *rest, limit=3):",
            "    return {}");
    assertThat(rule.constraints()).isEqualTo(lengths(ArgumentCountConstraint.min(2)));
    assertThat(rule.extractedArgs().get(1))
        .isEqualTo(
            ExtractedArg.create(
                "rest", 1, ExtractedArg.Kind.VARARGS, false, null, ImmutableList.of()));
    assertThat(rule.extractedArgs().get(2))
        .isEqualTo(
            ExtractedArg.create(
                "limit", 2, ExtractedArg.Kind.KEYWORD, false, "3", ImmutableList.of()));
  }

  @Test
  public void testKwargsRemoveUpperBound() {
    TagRule rule =
        rule(
            Registration.Kind.SIMPLE_TAG,
            "@register.simple_tag",
            "def attrs(**kwargs):",
            "    return kwargs");
    assertThat(rule.constraints().isEmpty()).isTrue();
    assertThat(rule.extractedArgs())
        .containsExactly(
            ExtractedArg.literal("as", 0, false), ExtractedArg.variable("varname", 1, false))
        .inOrder();
  }

  @Test
  public void testKeywordOnlyAfterBareStarCountTowardsUpperBound() {
    TagRule rule =
        rule(
            Registration.Kind.SIMPLE_TAG,
            "@register.simple_tag",
            "def fmt(value, *, sep=','):",
            "    return value");
    assertThat(rule.constraints())
        .isEqualTo(lengths(ArgumentCountConstraint.min(2), ArgumentCountConstraint.max(3)));
    assertThat(rule.extractedArgs().get(1).kind()).isEqualTo(ExtractedArg.Kind.KEYWORD);
  }

  @Test
  public void testBlockTagDropsContextAndContent() {
    TagRule rule =
        rule(
            Registration.Kind.SIMPLE_BLOCK_TAG,
            "@register.simple_block_tag",
            "def box(context, title, level=1, content=None):",
            "    return content");
    assertThat(rule.constraints())
        .isEqualTo(lengths(ArgumentCountConstraint.min(2), ArgumentCountConstraint.max(3)));
    assertThat(rule.extractedArgs().get(0)).isEqualTo(ExtractedArg.variable("title", 0, true));
    assertThat(rule.extractedArgs().get(1).defaultValue()).isEqualTo("1");
  }
}
