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

import com.google.fzninsight.flatzinc.FznConstraint;
import com.google.fzninsight.flatzinc.FznModel;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/** Lists the constraint types of a model with their counts and average arity. */
public final class ConstraintDescriber {
  private ConstraintDescriber() {}

  /**
   * Returns one line per constraint type, sorted by type, e.g. {@code "  int_lin_le: 3
   * constraints with average arity 2.00 (linear inequality constraints ...)"}.
   */
  public static String describe(FznModel model) {
    final Map<String, long[]> stats = collect(model);
    final List<String> lines = new ArrayList<>();
    for (Map.Entry<String, long[]> entry : stats.entrySet()) {
      lines.add(formatType(entry.getKey(), entry.getValue(), Optional.empty()));
    }
    return String.join("\n", lines);
  }

  /** Same as {@link #describe(FznModel)}, grouped by category when {@code categorize} is set. */
  public static String describe(FznModel model, boolean categorize) {
    return categorize
        ? describeByCategory(model, ConstraintCategories.defaults())
        : describe(model);
  }

  /**
   * Groups the constraint types under their primary category, with a header line per category
   * giving its number of types, constraints and average arity. Categories are sorted, with
   * {@value ConstraintCategories#UNCATEGORIZED} last, and separated by blank lines.
   */
  static String describeByCategory(FznModel model, ConstraintCategories categories) {
    final Map<String, long[]> stats = collect(model);
    final Map<String, List<String>> typesByCategory = new TreeMap<>();
    for (String type : stats.keySet()) {
      typesByCategory
          .computeIfAbsent(categories.primaryCategory(type), category -> new ArrayList<>())
          .add(type);
    }
    final List<String> order = new ArrayList<>(typesByCategory.keySet());
    if (order.remove(ConstraintCategories.UNCATEGORIZED)) {
      order.add(ConstraintCategories.UNCATEGORIZED);
    }
    final List<String> blocks = new ArrayList<>();
    for (String category : order) {
      final List<String> types = typesByCategory.get(category);
      long count = 0;
      long aritySum = 0;
      for (String type : types) {
        count += stats.get(type)[COUNT];
        aritySum += stats.get(type)[ARITY_SUM];
      }
      final StringBuilder block =
          new StringBuilder(
              String.format(
                  Locale.ROOT,
                  "%s: %d %s, %d %s (avg arity %.2f)",
                  category,
                  types.size(),
                  types.size() == 1 ? "type" : "types",
                  count,
                  count == 1 ? "constraint" : "constraints",
                  aritySum / (double) count));
      for (String type : types) {
        block
            .append('\n')
            .append(formatType(type, stats.get(type), categories.description(type)));
      }
      blocks.add(block.toString());
    }
    return String.join("\n\n", blocks);
  }

  // Constraint count and arity sum per type, sorted by type.
  private static Map<String, long[]> collect(FznModel model) {
    final Map<String, long[]> stats = new TreeMap<>();
    for (FznConstraint ct : model.getConstraints()) {
      final long[] typeStats = stats.computeIfAbsent(ct.getType(), type -> new long[2]);
      typeStats[COUNT]++;
      typeStats[ARITY_SUM] += ModelStatistics.arity(model, ct);
    }
    return stats;
  }

  private static String formatType(String type, long[] typeStats, Optional<String> description) {
    final long count = typeStats[COUNT];
    return String.format(
        Locale.ROOT,
        "  %s: %d %s with average arity %.2f (%s)",
        type,
        count,
        count == 1 ? "constraint" : "constraints",
        typeStats[ARITY_SUM] / (double) count,
        toParenthetical(description.orElseGet(() -> Phrases.describeConstraint(type))));
  }

  // Lower-cases the first letter and drops the final period.
  static String toParenthetical(String description) {
    String text = description.trim();
    if (text.endsWith(".")) {
      text = text.substring(0, text.length() - 1);
    }
    if (!text.isEmpty() && Character.isUpperCase(text.charAt(0))) {
      text = Character.toLowerCase(text.charAt(0)) + text.substring(1);
    }
    return text;
  }

  private static final int COUNT = 0;
  private static final int ARITY_SUM = 1;
}
