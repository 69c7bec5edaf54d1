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

package com.google.fzninsight.summary;

import com.google.common.base.Splitter;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Natural language tables used to describe search strategies and constraints.
 *
 * <p>The constraint description table is read from the classpath resource {@value
 * #DESCRIPTIONS_RESOURCE} on first use and shared, read-only, by the whole process.
 */
public final class Phrases {
  private static final Logger logger = Logger.getLogger(Phrases.class.getName());

  static final String DESCRIPTIONS_RESOURCE = "constraint_descriptions.properties";

  static final ImmutableMap<String, String> SEARCH_VAR_STRATEGY =
      ImmutableMap.of(
          "input_order", "the input order",
          "first_fail", "a first-fail strategy",
          "anti_first_fail", "an anti first-fail strategy",
          "smallest", "a smallest-domain strategy",
          "largest", "a largest-domain strategy");

  static final ImmutableMap<String, String> SEARCH_VALUE_STRATEGY =
      ImmutableMap.of(
          "indomain_min", "assigning the minimum value",
          "indomain_max", "assigning the maximum value",
          "indomain_split", "splitting the domain",
          "indomain_split_random", "splitting the domain randomly");

  static final ImmutableMap<String, String> SEARCH_COMPLETENESS =
      ImmutableMap.of(
          "complete", "exploring the entire search space",
          "incomplete", "using an incomplete exploration strategy");

  static final ImmutableMap<String, String> CONSTRAINT_TEXT =
      ImmutableMap.<String, String>builder()
          .put(
              "int_lin_eq",
              "Linear equality constraints enforce that weighted sums of integer variables equal"
                  + " a constant")
          .put(
              "int_lin_le",
              "Linear inequality constraints restrict weighted sums of integer variables to be"
                  + " less than or equal to a constant")
          .put(
              "int_lin_ge",
              "Linear inequality constraints restrict weighted sums of integer variables to be"
                  + " greater than or equal to a constant")
          .put(
              "int_eq",
              "Equality constraints enforce that pairs of integer variables take the same value")
          .put(
              "int_ne",
              "Disequality constraints enforce that pairs of integer variables take different"
                  + " values")
          .put(
              "int_le",
              "Ordering constraints enforce that one integer variable is less than or equal to"
                  + " another")
          .put(
              "bool_clause",
              "Boolean clause constraints represent disjunctions over Boolean literals")
          .put(
              "bool_clause_reif",
              "Reified Boolean clauses link the satisfaction of a clause to a Boolean variable")
          .put(
              "bool2int",
              "Boolean-to-integer channeling constraints map Boolean values to integer variables")
          .put(
              "all_different",
              "All-different constraints enforce that all involved variables take pairwise"
                  + " distinct values")
          .put(
              "element",
              "Element constraints link a variable to a value selected from an array using an"
                  + " index")
          .put(
              "int_times",
              "Multiplicative constraints enforce that one integer variable equals the product of"
                  + " two others")
          .put(
              "int_max",
              "Maximum constraints bind a variable to the maximum value among a set of variables")
          .buildOrThrow();

  private static final String FZN_PREFIX = "fzn_";
  private static final Splitter UNDERSCORE = Splitter.on('_').omitEmptyStrings();

  private static final Supplier<ImmutableMap<String, String>> descriptionTable =
      Suppliers.memoize(() -> loadTable(DESCRIPTIONS_RESOURCE));

  private Phrases() {}

  /** Returns the phrase for a variable selection token, or the token itself. */
  public static String varStrategy(String token) {
    return SEARCH_VAR_STRATEGY.getOrDefault(token, token);
  }

  /** Returns the phrase for a value selection token, or the token itself. */
  public static String valueStrategy(String token) {
    return SEARCH_VALUE_STRATEGY.getOrDefault(token, token);
  }

  /** Returns the phrase for a completeness token, or the token itself. */
  public static String completeness(String token) {
    return SEARCH_COMPLETENESS.getOrDefault(token, token);
  }

  /**
   * Returns a sentence describing constraints of type {@code type}.
   *
   * <p>Looks in the description table, then in the built-in texts, and falls back to a generic
   * sentence.
   */
  public static String describeConstraint(String type) {
    return resolveDescription(type, descriptionTable.get())
        .or(() -> Optional.ofNullable(CONSTRAINT_TEXT.get(type)))
        .orElse("Constraints of type " + type + " restrict relationships between variables");
  }

  /**
   * Looks up {@code type} in {@code table}: the exact name first, then without the "fzn_" prefix
   * and its last "_" token, then dropping trailing tokens one at a time.
   */
  static Optional<String> resolveDescription(String type, ImmutableMap<String, String> table) {
    final String name = type == null ? "" : type.trim();
    if (name.isEmpty()) {
      return Optional.empty();
    }
    Optional<String> found = lookup(table, name);
    if (found.isPresent()) {
      return found;
    }
    List<String> parts = new ArrayList<>(UNDERSCORE.splitToList(name));
    if (name.startsWith(FZN_PREFIX)) {
      parts = new ArrayList<>(UNDERSCORE.splitToList(name.substring(FZN_PREFIX.length())));
      if (parts.size() >= 2) {
        parts.remove(parts.size() - 1);
        found = lookup(table, String.join("_", parts));
        if (found.isPresent()) {
          return found;
        }
      }
    }
    while (parts.size() >= 2) {
      parts.remove(parts.size() - 1);
      found = lookup(table, String.join("_", parts));
      if (found.isPresent()) {
        return found;
      }
    }
    return Optional.empty();
  }

  private static Optional<String> lookup(ImmutableMap<String, String> table, String key) {
    final String value = table.get(key);
    if (value == null || value.trim().isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  /** Returns the description table, loading it on first use. */
  static ImmutableMap<String, String> descriptions() {
    return descriptionTable.get();
  }

  /**
   * Loads a properties table from the classpath, next to this class. Keys and values are trimmed,
   * blank entries are dropped. A missing or unreadable table is logged and gives an empty map.
   */
  static ImmutableMap<String, String> loadTable(String resource) {
    final InputStream in = Phrases.class.getResourceAsStream(resource);
    if (in == null) {
      logger.warning("Table " + resource + " not found");
      return ImmutableMap.of();
    }
    final Properties properties = new Properties();
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      properties.load(reader);
    } catch (IOException | IllegalArgumentException e) {
      logger.log(Level.WARNING, "Cannot read table " + resource, e);
      return ImmutableMap.of();
    }
    final ImmutableMap.Builder<String, String> table = ImmutableMap.builder();
    for (String key : properties.stringPropertyNames()) {
      final String value = properties.getProperty(key).trim();
      if (!key.trim().isEmpty() && !value.isEmpty()) {
        table.put(key.trim(), value);
      }
    }
    return table.buildKeepingLast();
  }
}
