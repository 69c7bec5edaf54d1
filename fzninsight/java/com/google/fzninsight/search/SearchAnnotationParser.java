// Copyright 2010-2025 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.fzninsight.search;

import com.google.common.collect.ImmutableList;
import com.google.fzninsight.flatzinc.FznSyntax;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Parses the search annotations of a solve item.
 *
 * <p>Only {@code int_search(vars, var_strategy, val_strategy, completeness)} and {@code
 * seq_search([...])} are understood. Anything else yields an empty result, never an error.
 */
public final class SearchAnnotationParser {
  private static final Logger logger = Logger.getLogger(SearchAnnotationParser.class.getName());

  private static final String INT_SEARCH = "int_search(";
  private static final String SEQ_SEARCH = "seq_search(";

  private SearchAnnotationParser() {}

  /**
   * Parses the outermost recognized search call in {@code annotations}.
   *
   * <p>A {@code seq_search} is looked for first, since it may contain {@code int_search} phases.
   */
  public static Optional<SearchNode> parse(String annotations) {
    if (annotations == null || annotations.isEmpty()) {
      return Optional.empty();
    }
    int start = annotations.indexOf(SEQ_SEARCH);
    if (start == -1) {
      start = annotations.indexOf(INT_SEARCH);
    }
    if (start == -1) {
      return Optional.empty();
    }
    return FznSyntax.extractCall(annotations, start)
        .flatMap(SearchAnnotationParser::parseExpression);
  }

  /** Parses a single search call, {@code int_search(...)} or {@code seq_search(...)}. */
  static Optional<SearchNode> parseExpression(String expression) {
    final String expr = expression.trim();
    if (expr.startsWith(INT_SEARCH) && expr.endsWith(")")) {
      return parseIntSearch(inner(expr, INT_SEARCH));
    }
    if (expr.startsWith(SEQ_SEARCH) && expr.endsWith(")")) {
      return parseSeqSearch(inner(expr, SEQ_SEARCH));
    }
    logger.log(Level.FINE, "Ignoring unrecognized search annotation: {0}", expr);
    return Optional.empty();
  }

  private static String inner(String expr, String prefix) {
    return expr.substring(prefix.length(), expr.length() - 1);
  }

  private static Optional<SearchNode> parseIntSearch(String inner) {
    final List<String> args = FznSyntax.splitTopLevelCommas(inner);
    if (args.size() != 4) {
      logger.log(Level.FINE, "int_search expects 4 arguments, got {0}", args.size());
      return Optional.empty();
    }
    return Optional.of(
        new IntSearch(FznSyntax.parseVarList(args.get(0)), args.get(1), args.get(2), args.get(3)));
  }

  private static Optional<SearchNode> parseSeqSearch(String inner) {
    final List<String> args = FznSyntax.splitTopLevelCommas(inner);
    if (args.isEmpty()) {
      return Optional.empty();
    }
    final String first = args.get(0);
    final List<String> elements =
        FznSyntax.parseBracketList(first).orElseGet(() -> ImmutableList.of(first));
    final ImmutableList.Builder<SearchNode> phases = ImmutableList.builder();
    for (String element : elements) {
      parseExpression(element).ifPresent(phases::add);
    }
    final ImmutableList<SearchNode> parsed = phases.build();
    if (parsed.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new SeqSearch(parsed));
  }
}
