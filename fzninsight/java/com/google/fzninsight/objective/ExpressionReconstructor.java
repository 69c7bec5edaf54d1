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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.fzninsight.flatzinc.FznConstraint;
import com.google.fzninsight.flatzinc.FznModel;
import com.google.fzninsight.flatzinc.FznSyntax;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Rebuilds a symbolic expression for a variable by following {@code defines_var} annotations.
 *
 * <p>The definitions graph of a FlatZinc model may contain cycles. The walk is bounded by a depth
 * counter and by the set of identifiers currently being expanded; when either stops it, the bare
 * identifier is returned. Not being able to reconstruct anything is the common case, the result is
 * then the identifier itself.
 */
public final class ExpressionReconstructor {
  private ExpressionReconstructor(FznModel model) {
    this.model = checkNotNull(model);
  }

  /**
   * Returns the best expression for {@code name}, expanding at most {@code maxDepth} levels of
   * definitions.
   */
  public static String reconstruct(FznModel model, String name, int maxDepth) {
    checkArgument(maxDepth >= 0, "negative depth: %s", maxDepth);
    return new ExpressionReconstructor(model).expand(name.trim(), maxDepth, new HashSet<>());
  }

  private String expand(String name, int depth, Set<String> visited) {
    if (name.isEmpty() || FznSyntax.isIntLiteral(name)) {
      return name;
    }
    if (model.isConstant(name)) {
      return Long.toString(model.variable(name).get().getDomain().get().min());
    }
    if (depth <= 0 || visited.contains(name)) {
      return name;
    }
    final Optional<FznConstraint> defining = model.definitionOf(name);
    if (defining.isEmpty()) {
      return name;
    }
    visited.add(name);
    try {
      final DefinitionShape shape = DefinitionShapes.classify(model, name, defining.get());
      final String expr = shape.render(operand -> expand(operand.trim(), depth - 1, visited));
      return expr.isEmpty() ? name : expr;
    } finally {
      visited.remove(name);
    }
  }

  private final FznModel model;
}
