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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.CharMatcher;
import com.google.fzninsight.flatzinc.FznModel;
import com.google.fzninsight.flatzinc.ProblemType;
import java.util.Optional;

/**
 * The reconstructed objective of an optimization model, with its placeholder form.
 *
 * <p>Example: for {@code constraint int_plus(x, y, obj) :: defines_var(obj); solve maximize obj;}
 * the expression is {@code (x + y)} and its abstracted form {@code (b + c)}, the objective being
 * {@code a}.
 */
public final class ObjectiveFormulation {
  /** Levels of definitions expanded by default. */
  public static final int DEFAULT_MAX_DEPTH = 2;

  private ObjectiveFormulation(
      ProblemType goal, String objective, String expression, AbstractedExpression abstracted) {
    this.goal = checkNotNull(goal);
    this.objective = checkNotNull(objective);
    this.expression = checkNotNull(expression);
    this.abstracted = checkNotNull(abstracted);
  }

  /** Same as {@code of(model, DEFAULT_MAX_DEPTH)}. */
  public static Optional<ObjectiveFormulation> of(FznModel model) {
    return of(model, DEFAULT_MAX_DEPTH);
  }

  /**
   * Reconstructs the objective of {@code model}.
   *
   * @return empty unless the model minimizes or maximizes a named objective
   */
  public static Optional<ObjectiveFormulation> of(FznModel model, int maxDepth) {
    final Optional<ProblemType> goal = model.getProblemType();
    final Optional<String> objective = model.getObjective();
    if (goal.isEmpty() || !goal.get().isOptimization() || objective.isEmpty()) {
      return Optional.empty();
    }
    final String expression =
        normalizeWhitespace(
            ExpressionReconstructor.reconstruct(model, objective.get(), maxDepth));
    if (expression.isEmpty()) {
      return Optional.empty();
    }
    final AbstractedExpression abstracted =
        IdentifierAbstractor.abstractIdentifiers(model, objective.get(), expression);
    return Optional.of(
        new ObjectiveFormulation(goal.get(), objective.get(), expression, abstracted));
  }

  static String normalizeWhitespace(String text) {
    return CharMatcher.whitespace().trimAndCollapseFrom(text, ' ');
  }

  /** Returns minimize or maximize. */
  public ProblemType getGoal() {
    return goal;
  }

  /** Returns the objective identifier. */
  public String getObjective() {
    return objective;
  }

  /** Returns the reconstructed expression over model identifiers. */
  public String getExpression() {
    return expression;
  }

  /** Returns the expression over placeholders. */
  public String getAbstractedExpression() {
    return normalizeWhitespace(abstracted.getExpression());
  }

  /** Returns the placeholder of the objective. */
  public String getObjectivePlaceholder() {
    return abstracted.getObjectivePlaceholder();
  }

  public AbstractedExpression getAbstracted() {
    return abstracted;
  }

  /** Returns true if the objective was expanded into something other than its own name. */
  public boolean isReconstructed() {
    return !expression.equals(objective);
  }

  @Override
  public String toString() {
    return String.format("%s %s = %s", goal, objective, expression);
  }

  private final ProblemType goal;
  private final String objective;
  private final String expression;
  private final AbstractedExpression abstracted;
}
