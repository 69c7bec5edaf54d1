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

import java.util.ArrayList;
import java.util.List;

/**
 * A variable isolated from {@code sum(ai * xi) == c}.
 *
 * <p>With {@code at} the coefficient of the defined variable and {@code rest} the sum of the other
 * terms, the variable equals {@code (c - rest) / at}. The rendering is a formula, it is never
 * evaluated.
 */
public final class LinearDefinition implements DefinitionShape {
  public LinearDefinition(
      long[] coefficients, String[] variables, long constant, int definedIndex) {
    checkArgument(
        coefficients.length == variables.length,
        "coefficients and variables have mismatched lengths");
    checkArgument(
        definedIndex >= 0 && definedIndex < variables.length,
        "wrong index of the defined variable: %s",
        definedIndex);
    this.coefficients = coefficients.clone();
    this.variables = variables.clone();
    this.constant = constant;
    this.definedIndex = definedIndex;
  }

  /** Returns the coefficient of the defined variable. */
  public long getDefinedCoefficient() {
    return coefficients[definedIndex];
  }

  public long getConstant() {
    return constant;
  }

  @Override
  public String render(OperandRenderer operands) {
    final String rest = renderRest(operands);
    final long at = coefficients[definedIndex];
    if (at == -1) {
      if (constant == 0) {
        return rest;
      }
      return String.format("(%s - %d)", rest, constant);
    }
    if (at == 1) {
      if (constant == 0) {
        return rest.equals(ZERO) ? ZERO : String.format("(-(%s))", rest);
      }
      if (rest.equals(ZERO)) {
        return Long.toString(constant);
      }
      return String.format("(%d - (%s))", constant, rest);
    }
    if (rest.equals(ZERO)) {
      return String.format("(%d / %d)", constant, at);
    }
    return String.format("((%d - (%s)) / %d)", constant, rest, at);
  }

  /** Renders the terms other than the defined one, "0" when none remains. */
  String renderRest(OperandRenderer operands) {
    final List<String> pieces = new ArrayList<>();
    for (int i = 0; i < variables.length; ++i) {
      final long coeff = coefficients[i];
      if (i == definedIndex || coeff == 0) {
        continue;
      }
      final String term = operands.render(variables[i]);
      if (coeff == 1) {
        pieces.add(term);
      } else if (coeff == -1) {
        pieces.add("-(" + term + ")");
      } else {
        pieces.add(coeff + "*(" + term + ")");
      }
    }
    if (pieces.isEmpty()) {
      return ZERO;
    }
    return String.join(" + ", pieces).replace("+ -(", "- (");
  }

  private static final String ZERO = "0";

  private final long[] coefficients;
  private final String[] variables;
  private final long constant;
  private final int definedIndex;
}
