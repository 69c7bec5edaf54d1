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

import com.google.fzninsight.flatzinc.FznModel;
import com.google.fzninsight.flatzinc.FznVariable;
import com.google.fzninsight.flatzinc.Interval;
import com.google.fzninsight.flatzinc.ProblemType;
import com.google.fzninsight.objective.ObjectiveFormulation;
import java.util.Locale;
import java.util.Optional;

/** Describes the solve goal of a model and its reconstructed objective. */
public final class ProblemDescriber {
  /** Longest abstracted objective expression shown before truncation. */
  public static final int DEFAULT_MAX_LENGTH = 100;

  private static final String ELLIPSIS = "…";

  private ProblemDescriber() {}

  /** Describes the problem with the default depth and length limits. */
  public static String describe(FznModel model) {
    return describe(model, ObjectiveFormulation.DEFAULT_MAX_DEPTH, DEFAULT_MAX_LENGTH);
  }

  public static String describe(FznModel model, int maxDepth, int maxLength) {
    final Optional<ProblemType> goal = model.getProblemType();
    if (goal.isEmpty()) {
      return "Problem type could not be determined.";
    }
    if (!goal.get().isOptimization()) {
      return "This is a satisfaction problem.";
    }
    final String direction = goal.get() == ProblemType.MINIMIZE ? "minimization" : "maximization";
    final StringBuilder sb = new StringBuilder("This is a " + direction + " problem.");
    final Optional<FznVariable> objective = model.getObjective().flatMap(model::variable);
    if (objective.isEmpty()) {
      return sb.append(" Objective variable could not be determined.").toString();
    }
    final String name = objective.get().getName();
    final int degree = ModelStatistics.variableDegrees(model).getOrDefault(name, 0);
    sb.append(" The objective is to ").append(goal.get().keyword());
    final Optional<Interval> domain = objective.get().getDomain();
    if (domain.isEmpty()) {
      sb.append(" an objective variable with unknown domain and degree ").append(degree);
    } else {
      final Interval d = domain.get();
      sb.append(
          String.format(
              Locale.ROOT,
              " an objective variable with domain [%d, %d] (size %d, mean %.2f) and degree %d",
              d.min(),
              d.max(),
              d.size(),
              d.mean(),
              degree));
    }
    sb.append('.');
    describeObjectiveFunction(model, maxDepth, maxLength)
        .ifPresent(text -> sb.append(' ').append(text).append('.'));
    return sb.toString();
  }

  /**
   * Returns "The objective function is in the form: goal a where a = expr", or the same sentence
   * without the where clause when nothing could be reconstructed. Empty for satisfaction problems.
   */
  public static Optional<String> describeObjectiveFunction(
      FznModel model, int maxDepth, int maxLength) {
    final Optional<ObjectiveFormulation> formulation = ObjectiveFormulation.of(model, maxDepth);
    if (formulation.isEmpty()) {
      return Optional.empty();
    }
    final ObjectiveFormulation f = formulation.get();
    final String head =
        "The objective function is in the form: "
            + f.getGoal().keyword()
            + " "
            + f.getObjectivePlaceholder();
    final String expression = truncate(f.getAbstractedExpression(), maxLength);
    if (f.isReconstructed() && !expression.isEmpty()) {
      return Optional.of(head + " where " + f.getObjectivePlaceholder() + " = " + expression);
    }
    return Optional.of(head);
  }

  static String truncate(String text, int maxLength) {
    if (text.length() <= maxLength) {
      return text;
    }
    return text.substring(0, Math.max(0, maxLength - 1)) + ELLIPSIS;
  }
}
