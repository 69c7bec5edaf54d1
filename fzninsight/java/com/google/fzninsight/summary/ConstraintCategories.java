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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Splitter;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.Ordering;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Groups constraint types into categories such as "Arithmetic" or "Global".
 *
 * <p>The table {@code constraint_categories.properties} maps a constraint name to
 * {@code Category[, Category...] | description}. A type that belongs to several categories is
 * reported under the alphabetically first one; a type with no entry is {@value #UNCATEGORIZED}.
 */
public final class ConstraintCategories {
  public static final String UNCATEGORIZED = "Uncategorized";

  static final String CATEGORIES_RESOURCE = "constraint_categories.properties";

  private static final String FZN_PREFIX = "fzn_";
  private static final Splitter ENTRY = Splitter.on('|').limit(2).trimResults();
  private static final Splitter CATEGORY_LIST = Splitter.on(',').trimResults().omitEmptyStrings();
  private static final Splitter UNDERSCORE = Splitter.on('_').omitEmptyStrings();

  private static final Supplier<ConstraintCategories> defaultTable =
      Suppliers.memoize(() -> fromTable(Phrases.loadTable(CATEGORIES_RESOURCE)));

  ConstraintCategories(
      ImmutableSetMultimap<String, String> categories, ImmutableMap<String, String> descriptions) {
    this.categories = checkNotNull(categories);
    this.descriptions = checkNotNull(descriptions);
  }

  /** Returns the categories of the bundled table, loaded on first use. */
  public static ConstraintCategories defaults() {
    return defaultTable.get();
  }

  /** Builds the categories from raw table entries. Entries without a category are ignored. */
  static ConstraintCategories fromTable(Map<String, String> table) {
    final ImmutableSetMultimap.Builder<String, String> categories = ImmutableSetMultimap.builder();
    final ImmutableMap.Builder<String, String> descriptions = ImmutableMap.builder();
    for (Map.Entry<String, String> entry : table.entrySet()) {
      final String type = entry.getKey().trim();
      final List<String> parts = ENTRY.splitToList(entry.getValue());
      final List<String> names = CATEGORY_LIST.splitToList(parts.get(0));
      if (type.isEmpty() || names.isEmpty()) {
        continue;
      }
      categories.putAll(type, names);
      if (parts.size() == 2 && !parts.get(1).isEmpty()) {
        descriptions.put(type, parts.get(1));
      }
    }
    return new ConstraintCategories(categories.build(), descriptions.buildKeepingLast());
  }

  /** Returns the category {@code type} is reported under. */
  public String primaryCategory(String type) {
    final Optional<String> key = resolveKey(type, categories.keySet());
    if (key.isEmpty()) {
      return UNCATEGORIZED;
    }
    final ImmutableSet<String> names = categories.get(key.get());
    return names.isEmpty() ? UNCATEGORIZED : Ordering.natural().min(names);
  }

  /** Returns the categorized description of {@code type}, if any. */
  public Optional<String> description(String type) {
    return resolveKey(type, descriptions.keySet()).map(descriptions::get);
  }

  /**
   * Finds the table key for {@code type}: the exact name, then the name without its "fzn_" prefix,
   * then either name with trailing "_" tokens dropped one at a time.
   */
  static Optional<String> resolveKey(String type, Set<String> keys) {
    final String name = type == null ? "" : type.trim();
    if (name.isEmpty() || keys.isEmpty()) {
      return Optional.empty();
    }
    if (keys.contains(name)) {
      return Optional.of(name);
    }
    final List<String> candidates = new ArrayList<>();
    if (name.startsWith(FZN_PREFIX)) {
      candidates.add(name.substring(FZN_PREFIX.length()));
    }
    candidates.add(name);
    for (String candidate : candidates) {
      if (keys.contains(candidate)) {
        return Optional.of(candidate);
      }
      final List<String> parts = new ArrayList<>(UNDERSCORE.splitToList(candidate));
      while (parts.size() >= 2) {
        parts.remove(parts.size() - 1);
        final String shorter = String.join("_", parts);
        if (keys.contains(shorter)) {
          return Optional.of(shorter);
        }
      }
    }
    return Optional.empty();
  }

  private final ImmutableSetMultimap<String, String> categories;
  private final ImmutableMap<String, String> descriptions;
}
