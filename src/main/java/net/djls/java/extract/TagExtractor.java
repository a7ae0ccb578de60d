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

import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import java.util.LinkedHashMap;
import java.util.Map;
import net.djls.java.syntax.DefStatement;
import net.djls.java.syntax.FileOptions;
import net.djls.java.syntax.ParserInput;
import net.djls.java.syntax.SourceFile;
import net.djls.java.syntax.SyntaxError;

/**
 * Extracts the rules and block structure of every tag and the arity of every filter a template
 * library module registers.
 */
public final class TagExtractor {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final AnalysisOptions options;

  public TagExtractor(AnalysisOptions options) {
    this.options = options;
  }

  public TagExtractor() {
    this(AnalysisOptions.DEFAULT);
  }

  /** Parses and analyzes the module {@code input}. */
  public ExtractionResult extract(ParserInput input) throws ExtractionException {
    SourceFile file;
    try {
      file = SourceFile.parseOrThrow(input, FileOptions.DEFAULT);
    } catch (SyntaxError.Exception e) {
      logger.atWarning().log("%s does not parse: %s", input.getFile(), e.getMessage());
      throw new ExtractionException(input.getFile(), e);
    }
    return extract(file);
  }

  /**
   * Analyzes an already parsed module. Registrations of functions the module does not define are
   * skipped, as are rules that say nothing. A {@code simple_block_tag} keeps its end tag even
   * then, since Django supplies it.
   */
  public ExtractionResult extract(SourceFile file) {
    TagAnalyzer analyzer = new TagAnalyzer(file.getFunctions(), options);
    Map<String, TagRule> tags = new LinkedHashMap<>();
    Map<String, FilterArity> filters = new LinkedHashMap<>();
    Map<String, BlockSpec> blocks = new LinkedHashMap<>();
    for (Registration reg : RegistrationCollector.collect(file)) {
      DefStatement function =
          reg.functionName() != null ? file.getFunction(reg.functionName()) : null;
      if (reg.kind().isTag()) {
        BlockSpec block = BlockSpecExtractor.forRegistration(reg, function);
        if (block != null) {
          blocks.put(reg.name(), block);
        }
      }
      if (function == null) {
        logger.atFine().log("%s: %s is not defined here", reg.name(), reg.functionName());
        continue;
      }
      switch (reg.kind()) {
        case FILTER:
          filters.put(reg.name(), FilterArity.of(function));
          break;
        case TAG:
          putIfContent(tags, reg.name(), analyzer.analyze(function));
          break;
        case SIMPLE_TAG:
        case INCLUSION_TAG:
        case SIMPLE_BLOCK_TAG:
          putIfContent(tags, reg.name(), SignatureRules.forSignature(function, reg.kind()));
          break;
      }
    }
    logger.atFine().log(
        "%s: %d tag rules, %d block tags, %d filters",
        file.getFile(), tags.size(), blocks.size(), filters.size());
    return ExtractionResult.create(
        ImmutableMap.copyOf(tags), ImmutableMap.copyOf(filters), ImmutableMap.copyOf(blocks));
  }

  private static void putIfContent(Map<String, TagRule> tags, String name, TagRule rule) {
    if (rule.hasContent()) {
      tags.put(name, rule);
    } else {
      tags.remove(name);
    }
  }
}
