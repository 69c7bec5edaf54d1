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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableSet;
import com.google.fzninsight.flatzinc.FznConstraint;
import com.google.fzninsight.flatzinc.FznModel;
import com.google.fzninsight.flatzinc.FznParser;
import org.junit.jupiter.api.Test;

/** Tests the classification of defining constraints. */
public final class DefinitionShapesTest {
  private static final DefinitionShape.OperandRenderer IDENTITY = operand -> operand;

  private static final FznModel MODEL =
      FznParser.parse(
          String.join(
              "\n",
              "array [1..2] of int: weights = [3, -2];",
              "array [1..2] of var int: pair = [p, q];",
              "var int: p;",
              "var int: q;",
              "var int: r;"));

  private static String render(String definedName, String type, String args) {
    return DefinitionShapes.classify(
            MODEL, definedName, new FznConstraint(type, args, "", ImmutableSet.of()))
        .render(IDENTITY);
  }

  @Test
  public void testClassify_binaryOperations() {
    assertThat(render("r", "int_max", "p, q, r")).isEqualTo("max(p, q)");
    assertThat(render("r", "int_min", "p, q, r")).isEqualTo("min(p, q)");
    assertThat(render("r", "int_plus", "p, 2, r")).isEqualTo("(p + 2)");
    assertThat(render("r", "int_minus", "p, q, r")).isEqualTo("(p - q)");
    assertThat(render("r", "int_times", "p, q, r")).isEqualTo("(p * q)");
  }

  @Test
  public void testClassify_outputArgumentMustBeTheDefinedName() {
    assertThat(render("p", "int_plus", "p, q, r")).isEqualTo("int_plus(p, q, r)");
    assertThat(render("r", "int_plus", "p, r")).isEqualTo("int_plus(p, r)");
  }

  @Test
  public void testClassify_elements() {
    assertThat(render("r", "array_var_int_element", "p, pair, r")).isEqualTo("pair[p]");
    assertThat(render("r", "array_bool_element", "p, [true, false], r"))
        .isEqualTo("[true, false][p]");
  }

  @Test
  public void testClassify_ifThenElse() {
    assertThat(render("r", "fzn_if_then_else_var_int", "c, p, q, r"))
        .isEqualTo("(if c then p else q)");
    assertThat(render("r", "fzn_if_then_else_var_bool", "c, p, r"))
        .isEqualTo("(if c then p else 0)");
  }

  @Test
  public void testClassify_boolToInt() {
    assertThat(render("r", "bool2int", "b, r")).isEqualTo("bool2int(b)");
    assertThat(render("b", "bool2int", "b, r")).isEqualTo("bool2int(b, r)");
  }

  @Test
  public void testClassify_linearWithNamedArrays() {
    // 3 * p - 2 * q = 6, rows resolved from a parameter array and a decision array.
    assertThat(render("p", "int_lin_eq", "weights, pair, 6")).isEqualTo("((6 - (-2*(q))) / 3)");
  }

  @Test
  public void testClassify_linearFallsBack() {
    // A decision array is not a coefficient row.
    assertThat(render("p", "int_lin_eq", "pair, [p, q], 0"))
        .isEqualTo("int_lin_eq(pair, [p, q], 0)");
    // Mismatched lengths.
    assertThat(render("p", "int_lin_eq", "[1], [p, q], 0")).isEqualTo("int_lin_eq([1], [p, q], 0)");
    // Defined name absent from the row.
    assertThat(render("r", "int_lin_eq", "[1, 1], [p, q], 0"))
        .isEqualTo("int_lin_eq([1, 1], [p, q], 0)");
    // Non literal constant.
    assertThat(render("p", "int_lin_eq", "[1, 1], [p, q], k"))
        .isEqualTo("int_lin_eq([1, 1], [p, q], k)");
  }

  @Test
  public void testResolveArrays() {
    assertThat(DefinitionShapes.resolveIntArray(MODEL, "weights").get())
        .asList()
        .containsExactly(3L, -2L)
        .inOrder();
    assertThat(DefinitionShapes.resolveIntArray(MODEL, "[1, x]")).isEmpty();
    assertThat(DefinitionShapes.resolveIdentifierArray(MODEL, "pair").get())
        .containsExactly("p", "q")
        .inOrder();
    assertThat(DefinitionShapes.resolveIdentifierArray(MODEL, "weights")).isEmpty();
    assertThat(DefinitionShapes.resolveIdentifierArray(MODEL, "unknown")).isEmpty();
  }
}
