// Copyright 2014 The Bazel Authors. All rights reserved.
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

import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Syntax tree for a Python module (a template tag library, typically).
 *
 * <p>A SourceFile is produced by {@link #parse}, which never throws: syntax errors are recorded in
 * {@link #errors}, and the statements are a best-effort recovery.
 */
public final class SourceFile extends Node {

  private final ImmutableList<Statement> statements;
  private final FileOptions options;
  final List<SyntaxError> errors; // appended to by the parser

  private SourceFile(
      FileLocations locs,
      ImmutableList<Statement> statements,
      FileOptions options,
      List<SyntaxError> errors) {
    super(locs);
    this.statements = statements;
    this.options = options;
    this.errors = errors;
  }

  static SourceFile create(
      FileLocations locs,
      ImmutableList<Statement> statements,
      FileOptions options,
      List<SyntaxError> errors) {
    return new SourceFile(locs, statements, options, errors);
  }

  /** Returns an unmodifiable view of the list of scanner and parser errors for this file. */
  public ImmutableList<SyntaxError> errors() {
    return ImmutableList.copyOf(errors);
  }

  /** Returns true if the file parsed without errors. */
  public boolean ok() {
    return errors.isEmpty();
  }

  /** Returns an (immutable, ordered) list of statements in this Python module. */
  public ImmutableList<Statement> getStatements() {
    return statements;
  }

  /** Returns the options specified when parsing this file. */
  public FileOptions getOptions() {
    return options;
  }

  /**
   * Returns the top-level function of the given name, or null if none is defined. If several
   * definitions share the name, the last one wins, as it would at run time.
   */
  @Nullable
  public DefStatement getFunction(String name) {
    DefStatement result = null;
    for (Statement stmt : statements) {
      if (stmt instanceof DefStatement def && def.getName().equals(name)) {
        result = def;
      }
    }
    return result;
  }

  /** Returns the top-level function definitions, in source order. */
  public ImmutableList<DefStatement> getFunctions() {
    ImmutableList.Builder<DefStatement> functions = ImmutableList.builder();
    for (Statement stmt : statements) {
      if (stmt instanceof DefStatement def) {
        functions.add(def);
      }
    }
    return functions.build();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public int getStartOffset() {
    return 0;
  }

  @Override
  public int getEndOffset() {
    return statements.isEmpty() ? 0 : statements.get(statements.size() - 1).getEndOffset();
  }

  /**
   * Parse the specified file, returning its syntax tree with its errors. The resulting file may
   * be incomplete if there were errors.
   */
  public static SourceFile parse(ParserInput input, FileOptions options) {
    return Parser.parseFile(input, options);
  }

  /** Parse a Python file with default options. */
  public static SourceFile parse(ParserInput input) {
    return parse(input, FileOptions.DEFAULT);
  }

  /**
   * Parse the specified file, throwing a {@link SyntaxError.Exception} carrying all errors if it
   * is not well formed.
   */
  public static SourceFile parseOrThrow(ParserInput input, FileOptions options)
      throws SyntaxError.Exception {
    SourceFile file = parse(input, options);
    if (!file.ok()) {
      throw new SyntaxError.Exception(file.errors());
    }
    return file;
  }
}
