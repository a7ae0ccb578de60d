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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** A test case for {@link ParserInput}. */
@RunWith(JUnit4.class)
public final class ParserInputTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  @Test
  public void testFromString() {
    String content = "Content provided as a string.";
    String pathName = "/the/name/of/the/content.py";
    ParserInput input = ParserInput.fromString(content, pathName);
    assertThat(new String(input.getContent())).isEqualTo(content);
    assertThat(input.getFile()).isEqualTo(pathName);
  }

  @Test
  public void testFromLines() {
    ParserInput input = ParserInput.fromLines("def f():", "    pass");
    assertThat(new String(input.getContent())).isEqualTo("def f():\n    pass");
    assertThat(input.getFile()).isEmpty();
  }

  @Test
  public void testReadFile() throws IOException {
    Path path = tmp.newFile("tags.py").toPath();
    Files.write(path, "x = 'éclair'\n".getBytes(UTF_8));
    ParserInput input = ParserInput.readFile(path);
    assertThat(new String(input.getContent())).isEqualTo("x = 'éclair'\n");
    assertThat(input.getFile()).isEqualTo(path.toString());
  }

  @Test
  public void testReadMissingFile() {
    Path path = tmp.getRoot().toPath().resolve("missing.py");
    assertThrows(NoSuchFileException.class, () -> ParserInput.readFile(path));
  }
}
