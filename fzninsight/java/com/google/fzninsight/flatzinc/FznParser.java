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
import com.google.common.collect.ImmutableSet;
import com.google.fzninsight.search.SearchAnnotationParser;
import com.google.fzninsight.search.SearchNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a {@link FznModel} from FlatZinc text.
 *
 * <p>FlatZinc is scanned rather than parsed: declarations are matched with patterns, constraint
 * calls are cut out with balanced parentheses. Malformed fragments are skipped. A constraint
 * without a statement terminator stops the scan, and whatever was recovered so far is returned.
 */
public final class FznParser {
  private static final Logger logger = Logger.getLogger(FznParser.class.getName());

  private static final String DOMAIN_SPEC = "int|bool|-?\\d+\\.\\.-?\\d+|\\{[^}]*\\}";

  // Anchored at line start so that "of var int: x" inside arrays does not match.
  private static final Pattern SCALAR =
      Pattern.compile(
          "^\\s*var\\s+(?<spec>"
              + DOMAIN_SPEC
              + ")\\s*:\\s*(?<name>\\w+)(?:\\s*::\\s*(?<ann>[^;]*))?\\s*;",
          Pattern.MULTILINE);

  private static final Pattern ARRAY =
      Pattern.compile(
          "\\barray\\s*\\[(?<index>[^\\]]+)\\]\\s*of\\s*(?<var>var\\s+)?(?<elem>"
              + DOMAIN_SPEC
              + ")\\s*:\\s*(?<name>\\w+)(?:\\s*::\\s*(?<ann>[^=;]+))?"
              + "(?:\\s*=\\s*\\[(?<body>.*?)\\])?\\s*;",
          Pattern.DOTALL);

  private static final Pattern INDEX_RANGE = Pattern.compile("(-?\\d+)\\.\\.(-?\\d+)");

  private static final Pattern CONSTRAINT_START =
      Pattern.compile("\\bconstraint\\s+(?<type>\\w+)\\s*\\(");

  private static final Pattern DEFINES_VAR =
      Pattern.compile("\\bdefines_var\\s*\\(\\s*(?<name>\\w+)\\s*\\)");

  private static final Pattern SOLVE =
      Pattern.compile(
          "\\bsolve\\s*(?:::\\s*(?<ann>.*?))?\\s*(?<goal>satisfy|maximize|minimize)"
              + "\\s*(?<objective>\\w+)?\\s*;",
          Pattern.DOTALL);

  private FznParser() {}

  /**
   * Reads and parses a UTF-8 FlatZinc file.
   *
   * @throws IOException if the file cannot be read. This is the only failure; malformed content
   *     gives a partial model.
   */
  public static FznModel parseFile(Path path) throws IOException {
    final String text = Files.readString(path, StandardCharsets.UTF_8);
    logger.fine("Parsing " + path + " (" + text.length() + " characters)");
    return parse(text);
  }

  /** Parses FlatZinc text. Never throws on malformed content. */
  public static FznModel parse(String text) {
    final FznModel.Builder builder = FznModel.newBuilder();
    scanScalars(text, builder);
    scanArrays(text, builder);
    scanConstraints(text, builder);
    scanSolve(text, builder);
    final FznModel model = builder.build();
    logger.fine("Extracted " + model);
    return model;
  }

  private static void scanScalars(String text, FznModel.Builder builder) {
    final Matcher m = SCALAR.matcher(text);
    while (m.find()) {
      final String spec = m.group("spec");
      final String name = m.group("name");
      final Origin origin = OriginClassifier.classify(name, m.group("ann"));
      switch (spec) {
        case "bool":
          builder.addVariable(FznVariable.bool(name, origin));
          break;
        case "int":
          builder.addVariable(new FznVariable(name, VarType.INT, null, origin));
          break;
        default:
          final Optional<Interval> domain = Interval.parse(spec);
          if (domain.isEmpty()) {
            logger.log(
                Level.FINE, "Ignoring malformed domain {0} of {1}", new Object[] {spec, name});
          }
          builder.addVariable(new FznVariable(name, VarType.INT, domain.orElse(null), origin));
          break;
      }
    }
  }

  private static void scanArrays(String text, FznModel.Builder builder) {
    final Matcher m = ARRAY.matcher(text);
    while (m.find()) {
      final String name = m.group("name");
      final String body = m.group("body");
      final ImmutableList<String> elements =
          body == null ? ImmutableList.of() : FznSyntax.splitTopLevelCommas(body);
      final VarType elementType = "bool".equals(m.group("elem")) ? VarType.BOOL : VarType.INT;
      builder.addArray(
          new FznArray(
              name,
              elementType,
              m.group("var") != null,
              declaredLength(m.group("index")),
              elements,
              OriginClassifier.classify(name, m.group("ann"))));
    }
  }

  private static OptionalLong declaredLength(String indexSpec) {
    final Matcher m = INDEX_RANGE.matcher(indexSpec.trim());
    if (!m.matches()) {
      return OptionalLong.empty();
    }
    try {
      final long lo = Long.parseLong(m.group(1));
      final long hi = Long.parseLong(m.group(2));
      return Interval.countValues(Math.min(lo, hi), Math.max(lo, hi));
    } catch (NumberFormatException e) {
      return OptionalLong.empty();
    }
  }

  private static void scanConstraints(String text, FznModel.Builder builder) {
    final Matcher m = CONSTRAINT_START.matcher(text);
    int pos = 0;
    while (pos < text.length() && m.find(pos)) {
      final String type = m.group("type");
      final int callStart = m.start("type");
      final Optional<String> call = FznSyntax.extractCall(text, callStart);
      if (call.isEmpty()) {
        logger.log(Level.FINE, "Skipping unterminated call to {0}", type);
        pos = m.end();
        continue;
      }
      final int callEnd = callStart + call.get().length();
      final int semi = text.indexOf(';', callEnd);
      if (semi == -1) {
        logger.warning(
            "Constraint " + type + " has no terminating ';', ignoring the rest of the input");
        break;
      }
      final String callText = call.get();
      final String args = callText.substring(callText.indexOf('(') + 1, callText.length() - 1);
      final String annotations = text.substring(callEnd, semi).trim();
      builder.addConstraint(new FznConstraint(type, args, annotations, definedVars(annotations)));
      pos = semi + 1;
    }
  }

  private static ImmutableSet<String> definedVars(String annotations) {
    if (annotations.isEmpty()) {
      return ImmutableSet.of();
    }
    final ImmutableSet.Builder<String> names = ImmutableSet.builder();
    final Matcher m = DEFINES_VAR.matcher(annotations);
    while (m.find()) {
      names.add(m.group("name"));
    }
    return names.build();
  }

  private static void scanSolve(String text, FznModel.Builder builder) {
    final Matcher m = SOLVE.matcher(text);
    if (!m.find()) {
      logger.fine("No solve item found");
      return;
    }
    final ProblemType goal = ProblemType.fromKeyword(m.group("goal"));
    final String objective = goal.isOptimization() ? m.group("objective") : null;
    final String annotations = m.group("ann");
    final SearchNode search =
        annotations == null ? null : SearchAnnotationParser.parse(annotations).orElse(null);
    builder.setSolve(goal, objective, search);
  }
}
