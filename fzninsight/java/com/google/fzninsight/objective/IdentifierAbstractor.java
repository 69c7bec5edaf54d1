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

package com.google.fzninsight.objective;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.fzninsight.flatzinc.FznModel;
import com.google.fzninsight.flatzinc.FznSyntax;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Replaces model identifiers in an expression by the placeholders a, b, ..., z, aa, ab, ...
 *
 * <p>The objective is always "a"; other identifiers get the next placeholder in order of first
 * appearance. Only the spelling of identifiers changes.
 */
public final class IdentifierAbstractor {
  /** The placeholder of the objective. */
  public static final String OBJECTIVE_PLACEHOLDER = "a";

  // Never replaced, even when a declared identifier has the same spelling.
  static final ImmutableSet<String> RESERVED =
      ImmutableSet.of("max", "min", "bool2int", "if", "then", "else", "true", "false");

  private static final int ALPHABET_SIZE = 26;

  private IdentifierAbstractor() {}

  /**
   * Rewrites {@code expression}, replacing every declared scalar or array identifier and the
   * objective.
   */
  public static AbstractedExpression abstractIdentifiers(
      FznModel model, String objective, String expression) {
    final String objectiveName = objective == null ? "" : objective.trim();
    final Map<String, String> mapping = new LinkedHashMap<>();
    if (!objectiveName.isEmpty()) {
      mapping.put(objectiveName, OBJECTIVE_PLACEHOLDER);
    }
    final Matcher m = FznSyntax.identifierPattern().matcher(expression.trim());
    final StringBuilder out = new StringBuilder();
    int next = 1;
    while (m.find()) {
      final String token = m.group();
      String replacement = token;
      if (!RESERVED.contains(token.toLowerCase(Locale.ROOT))
          && (token.equals(objectiveName) || model.isDeclared(token))) {
        replacement = mapping.get(token);
        if (replacement == null) {
          replacement = placeholder(next++);
          mapping.put(token, replacement);
        }
      }
      m.appendReplacement(out, Matcher.quoteReplacement(replacement));
    }
    m.appendTail(out);
    return new AbstractedExpression(
        out.toString(), OBJECTIVE_PLACEHOLDER, ImmutableMap.copyOf(mapping));
  }

  /** Returns the placeholder of rank {@code index}: 0 is a, 25 is z, 26 is aa. */
  static String placeholder(int index) {
    final StringBuilder sb = new StringBuilder();
    int n = index;
    while (n >= 0) {
      sb.append((char) ('a' + n % ALPHABET_SIZE));
      n = n / ALPHABET_SIZE - 1;
    }
    return sb.reverse().toString();
  }
}
