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

package com.google.fzninsight.flatzinc;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Low level scanning helpers shared by the FlatZinc extraction and reconstruction code. */
public final class FznSyntax {
  private static final Pattern INT_LITERAL = Pattern.compile("-?\\d+");
  private static final Pattern IDENTIFIER_TOKEN = Pattern.compile("\\b[A-Za-z]\\w*\\b");

  private FznSyntax() {}

  /**
   * Extracts {@code name(...)} starting at {@code start}.
   *
   * <p>Finds the first '(' at or after {@code start} and returns the text from {@code start} up to
   * and including the matching ')'. Only parentheses are balanced; brackets and braces are not
   * tracked. Returns an empty result when there is no '(' or the call is not closed before the end
   * of the text.
   */
  public static Optional<String> extractCall(String text, int start) {
    if (start < 0 || start >= text.length()) {
      return Optional.empty();
    }
    final int open = text.indexOf('(', start);
    if (open == -1) {
      return Optional.empty();
    }
    int depth = 0;
    for (int i = open; i < text.length(); ++i) {
      final char ch = text.charAt(i);
      if (ch == '(') {
        depth++;
      } else if (ch == ')') {
        depth--;
        if (depth == 0) {
          return Optional.of(text.substring(start, i + 1));
        }
      }
    }
    return Optional.empty();
  }

  /**
   * Splits {@code s} on commas that are not nested in (), [] or {}.
   *
   * <p>Inside braces, parentheses and brackets are not counted. Segments are trimmed and empty ones
   * are dropped.
   */
  public static ImmutableList<String> splitTopLevelCommas(String s) {
    final ImmutableList.Builder<String> parts = ImmutableList.builder();
    final StringBuilder buf = new StringBuilder();
    int depthParen = 0;
    int depthBracket = 0;
    int depthBrace = 0;
    for (int i = 0; i < s.length(); ++i) {
      final char ch = s.charAt(i);
      switch (ch) {
        case '(':
          if (depthBrace == 0) {
            depthParen++;
          }
          break;
        case ')':
          if (depthBrace == 0) {
            depthParen = Math.max(0, depthParen - 1);
          }
          break;
        case '[':
          if (depthBrace == 0) {
            depthBracket++;
          }
          break;
        case ']':
          if (depthBrace == 0) {
            depthBracket = Math.max(0, depthBracket - 1);
          }
          break;
        case '{':
          depthBrace++;
          break;
        case '}':
          depthBrace = Math.max(0, depthBrace - 1);
          break;
        default:
          break;
      }
      if (ch == ',' && depthParen == 0 && depthBracket == 0 && depthBrace == 0) {
        addIfNotBlank(parts, buf);
        buf.setLength(0);
        continue;
      }
      buf.append(ch);
    }
    addIfNotBlank(parts, buf);
    return parts.build();
  }

  private static void addIfNotBlank(ImmutableList.Builder<String> parts, StringBuilder buf) {
    final String part = buf.toString().trim();
    if (!part.isEmpty()) {
      parts.add(part);
    }
  }

  /**
   * Returns the elements of a bracketed list {@code [a, b, c]}, or an empty result if {@code expr}
   * is not bracketed.
   */
  public static Optional<ImmutableList<String>> parseBracketList(String expr) {
    final String trimmed = expr.trim();
    if (!trimmed.startsWith("[") || !trimmed.endsWith("]") || trimmed.length() < 2) {
      return Optional.empty();
    }
    return Optional.of(splitTopLevelCommas(trimmed.substring(1, trimmed.length() - 1)));
  }

  /** Parses a variable list argument: a bracketed list or a single identifier. */
  public static ImmutableList<String> parseVarList(String expr) {
    final String trimmed = expr.trim();
    if (trimmed.isEmpty()) {
      return ImmutableList.of();
    }
    return parseBracketList(trimmed).orElseGet(() -> ImmutableList.of(trimmed));
  }

  /** Returns true if {@code token} is an optionally negative decimal integer. */
  public static boolean isIntLiteral(String token) {
    return token != null && INT_LITERAL.matcher(token.trim()).matches();
  }

  /** Parses an integer literal, empty if {@code token} is not one or does not fit a long. */
  public static OptionalLong parseIntLiteral(String token) {
    if (!isIntLiteral(token)) {
      return OptionalLong.empty();
    }
    try {
      return OptionalLong.of(Long.parseLong(token.trim()));
    } catch (NumberFormatException e) {
      return OptionalLong.empty();
    }
  }

  /** Returns the identifier-like tokens of {@code text}, in order, duplicates included. */
  public static ImmutableList<String> identifierTokens(String text) {
    final ImmutableList.Builder<String> tokens = ImmutableList.builder();
    final Matcher m = IDENTIFIER_TOKEN.matcher(text);
    while (m.find()) {
      tokens.add(m.group());
    }
    return tokens.build();
  }

  /** Returns the pattern matching identifier-like tokens. */
  public static Pattern identifierPattern() {
    return IDENTIFIER_TOKEN;
  }
}
