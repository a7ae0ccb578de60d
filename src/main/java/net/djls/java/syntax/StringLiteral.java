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

/**
 * Syntax node for a string literal. Adjacent literals ({@code "a" "b"}) are concatenated into a
 * single node by the parser; byte and formatted strings are represented by the text between
 * their quotes.
 */
public final class StringLiteral extends Expression {

  private final int startOffset;
  private final String value;
  private final boolean formatted;
  private final int endOffset;

  StringLiteral(
      FileLocations locs, int startOffset, String value, boolean formatted, int endOffset) {
    super(locs, Kind.STRING_LITERAL);
    this.startOffset = startOffset;
    this.value = value;
    this.formatted = formatted;
    this.endOffset = endOffset;
  }

  /** Returns the value denoted by the string literal */
  public String getValue() {
    return value;
  }

  /**
   * Reports whether this is an f-string. The value of an f-string keeps its replacement fields
   * as written, braces included.
   */
  public boolean isFormatted() {
    return formatted;
  }

  @Override
  public int getStartOffset() {
    return startOffset;
  }

  @Override
  public int getEndOffset() {
    return endOffset;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
