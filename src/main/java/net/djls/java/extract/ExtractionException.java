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
import net.djls.java.syntax.SyntaxError;

/** Thrown when a module cannot be analyzed because its source does not parse. */
public final class ExtractionException extends Exception {

  private final ImmutableList<SyntaxError> errors;

  public ExtractionException(String file, SyntaxError.Exception cause) {
    super("cannot extract rules from " + file + ": " + cause.getMessage(), cause);
    this.errors = cause.errors();
  }

  public ImmutableList<SyntaxError> errors() {
    return errors;
  }
}
