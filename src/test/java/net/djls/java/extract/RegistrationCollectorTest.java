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

@RunWith(JUnit4.class)
public final class RegistrationCollectorTest {

  private static ImmutableList<Registration> collect(String... lines) {
    SourceFile file = SourceFile.parse(ParserInput.fromLines(lines));
    assertThat(file.errors()).isEmpty();
    return RegistrationCollector.collect(file);
  }

  @Test
  public void testBareDecorators() {
    assertThat(
            collect(
                "@register.tag",
                "def regroup(parser, token):",
                "    pass",
                "@register.filter",
                "def lower(value):",
                "    pass"))
        .containsExactly(
            Registration.create("regroup", Registration.Kind.TAG, "regroup"),
            Registration.create("lower", Registration.Kind.FILTER, "lower"))
        .inOrder();
  }

  @Test
  public void testDecoratorNames() {
    assertThat(
            collect(
                "@register.tag('cycle')",
                "def do_cycle(parser, token):",
                "    pass",
                "@register.tag(name='now')",
                "def do_now(parser, token):",
                "    pass",
                "@register.filter(name='cut', is_safe=True)",
                "def cut_filter(value, arg):",
                "    pass",
                "@register.simple_tag(takes_context=True, name='greet')",
                "def greeting(context):",
                "    pass",
                "@register.inclusion_tag('results.html')",
                "def show_results(poll):",
                "    pass"))
        .containsExactly(
            Registration.create("cycle", Registration.Kind.TAG, "do_cycle"),
            Registration.create("now", Registration.Kind.TAG, "do_now"),
            Registration.create("cut", Registration.Kind.FILTER, "cut_filter"),
            Registration.create("greet", Registration.Kind.SIMPLE_TAG, "greeting"),
            Registration.create("show_results", Registration.Kind.INCLUSION_TAG, "show_results"))
        .inOrder();
  }

  @Test
  public void testCallForms() {
    assertThat(
            collect(
                "register.tag('include', do_include)",
                "register.tag(do_block)",
                "register.tag('url', compile_function=url_tag)",
                "register.filter('upper', filters.upper)",
                "register.filter(name='slug', filter_func=slugify)",
                "register.simple_tag(lambda: 1, name='one')",
                "register.tag('x')"))
        .containsExactly(
            Registration.create("include", Registration.Kind.TAG, "do_include"),
            Registration.create("do_block", Registration.Kind.TAG, "do_block"),
            Registration.create("url", Registration.Kind.TAG, "url_tag"),
            Registration.create("upper", Registration.Kind.FILTER, "filters.upper"),
            Registration.create("slug", Registration.Kind.FILTER, "slugify"),
            Registration.create("one", Registration.Kind.SIMPLE_TAG, null))
        .inOrder();
  }

  @Test
  public void testClassBodiesAreSearched() {
    assertThat(
            collect(
                "class Tags:",
                "    @register.tag",
                "    def inner(parser, token):",
                "        pass"))
        .containsExactly(Registration.create("inner", Registration.Kind.TAG, "inner"));
  }

  @Test
  public void testUnrelatedCodeIsIgnored() {
    assertThat(
            collect(
                "@property",
                "def name(self):",
                "    pass",
                "@functools.wraps(f)",
                "def wrapper(parser, token):",
                "    pass",
                "print('tag')",
                "x = register.tag"))
        .isEmpty();
  }
}
