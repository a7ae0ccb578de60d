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
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Resources;
import net.djls.java.syntax.ParserInput;
import org.junit.BeforeClass;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of extracting every rule of a template library module. */
@RunWith(JUnit4.class)
public final class TagExtractorTest {

  private static ExtractionResult result;

  @BeforeClass
  public static void extractSample() throws Exception {
    String source =
        Resources.toString(Resources.getResource(TagExtractorTest.class, "sample_tags.py"), UTF_8);
    result = new TagExtractor().extract(ParserInput.fromString(source, "sample_tags.py"));
  }

  private static Constraint length(ArgumentCountConstraint count) {
    return Constraint.length(count);
  }

  @Test
  public void testRegisteredTags() {
    assertThat(result.tagRules().keySet())
        .containsExactly(
            "regroup", "cycle", "include", "now", "current_time", "show_results", "repeat")
        .inOrder();
  }

  @Test
  public void testCompileFunctionTags() {
    assertThat(result.tagRules().get("regroup").constraints())
        .isEqualTo(
            ConstraintSet.of(
                length(ArgumentCountConstraint.exact(6)),
                Constraint.keyword(SplitPosition.forward(2), "by"),
                Constraint.keyword(SplitPosition.forward(4), "as")));
    assertThat(result.tagRules().get("cycle").constraints())
        .isEqualTo(ConstraintSet.of(length(ArgumentCountConstraint.min(2))));
  }

  @Test
  public void testTagRegisteredByCall() {
    TagRule include = result.tagRules().get("include");
    assertThat(include.constraints())
        .isEqualTo(ConstraintSet.of(length(ArgumentCountConstraint.min(2))));
    assertThat(include.options()).isNotNull();
    assertThat(include.options().options()).containsExactly("with", "only").inOrder();
    assertThat(include.options().rejectsUnknown()).isTrue();
    assertThat(include.options().allowsDuplicates()).isFalse();
  }

  @Test
  public void testHelperConstraints() {
    TagRule now = result.tagRules().get("now");
    assertThat(now.constraints())
        .isEqualTo(ConstraintSet.of(Constraint.keyword(SplitPosition.backward(2), "as")));
    assertThat(now.supportsAsVar()).isTrue();
  }

  @Test
  public void testSimpleTagSignature() {
    TagRule rule = result.tagRules().get("current_time");
    assertThat(rule.constraints())
        .isEqualTo(
            ConstraintSet.of(
                length(ArgumentCountConstraint.min(2)), length(ArgumentCountConstraint.max(3))));
    assertThat(rule.extractedArgs())
        .containsExactly(
            ExtractedArg.variable("format_string", 0, true),
            ExtractedArg.create(
                "tz", 1, ExtractedArg.Kind.VARIABLE, false, "None", ImmutableList.of()),
            ExtractedArg.literal("as", 2, false),
            ExtractedArg.variable("varname", 3, false))
        .inOrder();
  }

  @Test
  public void testInclusionTagSignature() {
    TagRule rule = result.tagRules().get("show_results");
    assertThat(rule.constraints())
        .isEqualTo(ConstraintSet.of(length(ArgumentCountConstraint.min(2))));
    assertThat(rule.extractedArgs().get(1).kind()).isEqualTo(ExtractedArg.Kind.VARARGS);
    assertThat(rule.extractedArgs().get(2))
        .isEqualTo(
            ExtractedArg.create(
                "limit", 2, ExtractedArg.Kind.KEYWORD, false, "3", ImmutableList.of()));
  }

  @Test
  public void testSimpleBlockTagSignature() {
    TagRule rule = result.tagRules().get("repeat");
    assertThat(rule.constraints())
        .isEqualTo(
            ConstraintSet.of(
                length(ArgumentCountConstraint.min(2)), length(ArgumentCountConstraint.max(2))));
    assertThat(rule.extractedArgs().get(0)).isEqualTo(ExtractedArg.variable("count", 0, true));
  }

  @Test
  public void testBlockSpecs() {
    assertThat(result.blockSpecs())
        .containsExactly(
            "ifchanged", BlockSpec.create("endifchanged", ImmutableList.of("else"), false),
            "comment", BlockSpec.create("endcomment", ImmutableList.of(), true),
            "repeat", BlockSpec.closedBy("endrepeat"))
        .inOrder();
  }

  @Test
  public void testFilters() {
    assertThat(result.filterArities())
        .containsExactly(
            "lower", FilterArity.create(false, false),
            "cut", FilterArity.create(true, false),
            "default_if_none", FilterArity.create(true, true))
        .inOrder();
  }

  @Test
  public void testSyntaxErrorsAreReported() {
    ExtractionException e =
        assertThrows(
            ExtractionException.class,
            () ->
                new TagExtractor()
                    .extract(ParserInput.fromString("def broken(:\n    pass\n", "broken.py")));
    assertThat(e.errors()).isNotEmpty();
    assertThat(e).hasMessageThat().contains("broken.py");
  }
}
