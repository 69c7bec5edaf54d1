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

import com.google.fzninsight.flatzinc.FznArray;
import com.google.fzninsight.flatzinc.FznModel;
import com.google.fzninsight.flatzinc.FznSyntax;
import com.google.fzninsight.flatzinc.FznVariable;
import com.google.fzninsight.flatzinc.Origin;
import com.google.fzninsight.flatzinc.VarType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Describes the variables of a model: how many there are, of which type and origin, and how their
 * domain sizes are distributed.
 *
 * <p>Decision arrays count as their element variables. An element named in the body of a user
 * array is a user variable, even if its own declaration is marked as introduced. A decision array
 * without a body contributes its declared length of variables with unknown domains. Constants are
 * not variables.
 */
public final class VariableDescriber {
  /** Number of domain-size buckets. */
  static final int BUCKETS = 4;

  static final String NO_VARIABLES = "The model contains no variables.";

  private VariableDescriber() {}

  /** Returns one sentence per line: counts, domain-size buckets, unknown domains. */
  public static String describe(FznModel model) {
    final Tally tally = new Tally();
    final Set<String> userElements = userArrayElements(model);
    final List<Long> sizes = new ArrayList<>();
    final Set<String> counted = new HashSet<>();

    for (FznVariable var : model.getVariables().values()) {
      if (var.isConstant()) {
        continue;
      }
      final String name = var.getName();
      final Origin origin = userElements.contains(name) ? Origin.USER : var.getOrigin();
      if (counted.add(name)) {
        tally.add(origin, var.getType(), 1);
      }
      if (var.getType() == VarType.INT) {
        if (var.getDomain().isPresent()) {
          sizes.add(var.getDomain().get().size());
        } else {
          tally.unknownDomains++;
        }
      }
    }

    for (FznArray array : model.getArrays().values()) {
      if (!array.isDecision()) {
        continue;
      }
      if (!array.getElements().isEmpty()) {
        for (String element : array.getElements()) {
          if (FznSyntax.isIntLiteral(element)
              || model.isConstant(element)
              || !counted.add(element)) {
            continue;
          }
          // Declared elements were counted with the scalars.
          if (model.variable(element).isEmpty()) {
            tally.add(array.getOrigin(), array.getElementType(), 1);
            if (array.getElementType() == VarType.INT) {
              tally.unknownDomains++;
            }
          }
        }
        continue;
      }
      final OptionalLong length = array.variableCount();
      if (length.isPresent()) {
        tally.anonymous += length.getAsLong();
        tally.add(array.getOrigin(), array.getElementType(), length.getAsLong());
        if (array.getElementType() == VarType.INT) {
          tally.unknownDomains += length.getAsLong();
        }
      }
    }

    final List<String> lines = new ArrayList<>();
    final long total = counted.size() + tally.anonymous;
    if (total == 0) {
      lines.add(NO_VARIABLES);
    } else {
      lines.add(
          String.format(
              Locale.ROOT,
              "The model contains %d variables (%d integer, %d Boolean): %d compiler-introduced"
                  + " and %d user-introduced.",
              total,
              tally.byType(VarType.INT),
              tally.byType(VarType.BOOL),
              tally.byOrigin(Origin.INTRODUCED),
              tally.byOrigin(Origin.USER)));
    }
    if (!sizes.isEmpty()) {
      lines.add(describeDomainSizes(sizes));
    }
    if (tally.unknownDomains > 0) {
      lines.add(tally.unknownDomains + " integer variables have unknown domains.");
    }
    return String.join("\n", lines);
  }

  /**
   * Splits [min size, max size] into {@link #BUCKETS} near-equal ranges and reports the share and
   * average size of the non-empty ones.
   */
  static String describeDomainSizes(List<Long> sizes) {
    final long minSize = Collections.min(sizes);
    final long maxSize = Collections.max(sizes);
    final long span = maxSize - minSize + 1;
    final List<String> buckets = new ArrayList<>();
    for (int i = 0; i < BUCKETS; ++i) {
      final long lo = minSize + bucketOffset(span, i);
      final long hi = i == BUCKETS - 1 ? maxSize : minSize + bucketOffset(span, i + 1) - 1;
      if (hi < lo) {
        continue;
      }
      long count = 0;
      double sum = 0;
      for (long size : sizes) {
        if (size >= lo && size <= hi) {
          count++;
          sum += size;
        }
      }
      if (count == 0) {
        continue;
      }
      buckets.add(
          String.format(
              Locale.ROOT,
              "%.1f%% have domain size in [%d, %d] (avg size %.2f)",
              100.0 * count / sizes.size(),
              lo,
              hi,
              sum / count));
    }
    return String.format(
        Locale.ROOT,
        "Among %d integer variables with known finite domains, %s.",
        sizes.size(), String.join("; ", buckets));
  }

  // floor(span * i / BUCKETS) without overflowing span * i.
  private static long bucketOffset(long span, int i) {
    return (span / BUCKETS) * i + (span % BUCKETS) * i / BUCKETS;
  }

  private static Set<String> userArrayElements(FznModel model) {
    final Set<String> names = new HashSet<>();
    for (FznArray array : model.getArrays().values()) {
      if (!array.isDecision() || array.getOrigin() != Origin.USER) {
        continue;
      }
      for (String element : array.getElements()) {
        if (!FznSyntax.isIntLiteral(element)) {
          names.add(element);
        }
      }
    }
    return names;
  }

  // Variable counts by origin and type.
  private static final class Tally {
    Tally() {
      for (Origin origin : Origin.values()) {
        counts.put(origin, new EnumMap<>(VarType.class));
      }
    }

    void add(Origin origin, VarType type, long count) {
      counts.get(origin).merge(type, count, Long::sum);
    }

    long byType(VarType type) {
      long sum = 0;
      for (Map<VarType, Long> byType : counts.values()) {
        sum += byType.getOrDefault(type, 0L);
      }
      return sum;
    }

    long byOrigin(Origin origin) {
      long sum = 0;
      for (long count : counts.get(origin).values()) {
        sum += count;
      }
      return sum;
    }

    private final Map<Origin, Map<VarType, Long>> counts = new EnumMap<>(Origin.class);
    long anonymous;
    long unknownDomains;
  }
}
