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

import net.djls.java.syntax.DefStatement;
import net.djls.java.syntax.ParserInput;
import net.djls.java.syntax.SourceFile;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class FilterArityTest {

  private static FilterArity arity(String def) {
    SourceFile file = SourceFile.parse(ParserInput.fromLines(def, "    return value"));
    assertThat(file.errors()).isEmpty();
    DefStatement function = file.getFunctions().get(0);
    return FilterArity.of(function);
  }

  @Test
  public void testValueOnly() {
    assertThat(arity("def lower(value):")).isEqualTo(FilterArity.create(false, false));
  }

  @Test
  public void testRequiredArgument() {
    assertThat(arity("def cut(value, arg):")).isEqualTo(FilterArity.create(true, false));
  }

  @Test
  public void testOptionalArgument() {
    assertThat(arity("def date(value, arg=None):")).isEqualTo(FilterArity.create(true, true));
  }

  @Test
  public void testLeadingSelfIsSkipped() {
    assertThat(arity("def lower(self, value):")).isEqualTo(FilterArity.create(false, false));
    assertThat(arity("def cut(self, value, arg):")).isEqualTo(FilterArity.create(true, false));
  }

  @Test
  public void testStarParametersEndThePositionalOnes() {
    assertThat(arity("def join(value, *args, **kwargs):"))
        .isEqualTo(FilterArity.create(false, false));
  }

  @Test
  public void testNoParameters() {
    assertThat(arity("def nothing():")).isEqualTo(FilterArity.create(false, false));
  }
}
