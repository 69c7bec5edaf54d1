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
import com.google.fzninsight.flatzinc.FznVariable;
import com.google.fzninsight.flatzinc.Interval;
import com.google.fzninsight.search.IntSearch;
import com.google.fzninsight.search.SearchNode;
import com.google.fzninsight.search.SeqSearch;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/** Describes the search annotation of a model. */
public final class SearchDescriber {
  static final String NO_SEARCH = "No explicit search strategy is specified.";

  private SearchDescriber() {}

  /** Describes the search annotation of {@code model}. */
  public static String describe(FznModel model) {
    return describe(model.getSearch().orElse(null), model);
  }

  /**
   * Describes {@code search}, which may be null. The model, which may also be null, is used to
   * give the type and domain of a single searched scalar or array.
   */
  public static String describe(SearchNode search, FznModel model) {
    if (search instanceof IntSearch) {
      return "The model suggests an " + describeIntSearch((IntSearch) search, model) + ".";
    }
    if (search instanceof SeqSearch) {
      final List<String> phases = new ArrayList<>();
      for (SearchNode phase : ((SeqSearch) search).getPhases()) {
        if (phase instanceof IntSearch) {
          phases.add(describeIntSearch((IntSearch) phase, model));
        } else {
          phases.add(stripPeriod(describe(phase, null)));
        }
      }
      final StringBuilder sb =
          new StringBuilder("The model suggests a sequential search strategy with ")
              .append(phases.size())
              .append(" phases: ");
      for (int i = 0; i < phases.size(); ++i) {
        if (i > 0) {
          sb.append("; ");
        }
        sb.append('(').append(i + 1).append(") ").append(phases.get(i));
      }
      return sb.append('.').toString();
    }
    return NO_SEARCH;
  }

  private static String describeIntSearch(IntSearch search, FznModel model) {
    final String strategy =
        String.format(
            "using %s, %s, and %s",
            Phrases.varStrategy(search.getVarStrategy()),
            Phrases.valueStrategy(search.getValStrategy()),
            Phrases.completeness(search.getCompleteness()));
    final List<String> vars = search.getVars();
    if (model != null && vars.size() == 1) {
      final String name = vars.get(0);
      final Optional<FznVariable> scalar = model.variable(name);
      if (scalar.isPresent()) {
        return String.format(
            "integer search on 1 %s variable with %s, %s",
            scalar.get().getType(), domainText(scalar.get().getDomain()), strategy);
      }
      final Optional<FznArray> array = model.array(name);
      if (array.isPresent()) {
        return describeArraySearch(model, array.get(), strategy);
      }
    }
    final int count = vars.size();
    return String.format(
        "integer search on %d %s, %s", count, count == 1 ? "variable" : "variables", strategy);
  }

  private static String describeArraySearch(FznModel model, FznArray array, String strategy) {
    final OptionalLong length = array.getDeclaredLength();
    final String lengthText =
        length.isPresent() ? "length " + length.getAsLong() : "unknown length";
    final OptionalLong count = array.variableCount();
    final String subject =
        count.isPresent()
            ? count.getAsLong() + " " + array.getElementType() + " variables"
            : array.getElementType() + " variables";
    return String.format(
        "integer search on %s with %s, (from 1 array, %s), %s",
        subject, domainText(elementEnvelope(model, array)), lengthText, strategy);
  }

  // Envelope of the declared domains of the array elements.
  private static Optional<Interval> elementEnvelope(FznModel model, FznArray array) {
    Interval envelope = null;
    for (String element : array.getElements()) {
      final Optional<Interval> domain = model.variable(element).flatMap(FznVariable::getDomain);
      if (domain.isEmpty()) {
        continue;
      }
      if (envelope == null) {
        envelope = domain.get();
      } else {
        final long lo = Math.min(envelope.min(), domain.get().min());
        final long hi = Math.max(envelope.max(), domain.get().max());
        if (Interval.countValues(lo, hi).isEmpty()) {
          return Optional.empty();
        }
        envelope = envelope.span(domain.get());
      }
    }
    return Optional.ofNullable(envelope);
  }

  private static String domainText(Optional<Interval> domain) {
    return domain.map(d -> "domain " + d).orElse("domain unknown");
  }

  private static String stripPeriod(String text) {
    return text.endsWith(".") ? text.substring(0, text.length() - 1) : text;
  }
}
