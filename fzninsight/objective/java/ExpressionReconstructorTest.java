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
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.fzninsight.flatzinc.FznModel;
import com.google.fzninsight.flatzinc.FznParser;
import org.junit.jupiter.api.Test;

/** Tests the expansion of definitions into expressions. */
public final class ExpressionReconstructorTest {
  private static final String CHAIN =
      String.join(
          "\n",
          "var int: u;",
          "var int: v;",
          "var int: x;",
          "var int: y;",
          "var int: t :: var_is_introduced;",
          "var int: obj :: output_var;",
          "constraint int_plus(u, v, x) :: defines_var(x);",
          "constraint int_times(x, y, t) :: defines_var(t);",
          "constraint int_plus(t, 1, obj) :: defines_var(obj);",
          "solve minimize obj;");

  @Test
  public void testReconstruct_depthBoundsExpansion() {
    final FznModel model = FznParser.parse(CHAIN);
    assertThat(ExpressionReconstructor.reconstruct(model, "obj", 0)).isEqualTo("obj");
    assertThat(ExpressionReconstructor.reconstruct(model, "obj", 1)).isEqualTo("(t + 1)");
    assertThat(ExpressionReconstructor.reconstruct(model, "obj", 2)).isEqualTo("((x * y) + 1)");
    assertThat(ExpressionReconstructor.reconstruct(model, "obj", 3))
        .isEqualTo("(((u + v) * y) + 1)");
    assertThat(ExpressionReconstructor.reconstruct(model, "obj", 10))
        .isEqualTo("(((u + v) * y) + 1)");
  }

  @Test
  public void testReconstruct_negativeDepth() {
    final FznModel model = FznParser.parse(CHAIN);
    assertThrows(
        IllegalArgumentException.class,
        () -> ExpressionReconstructor.reconstruct(model, "obj", -1));
  }

  @Test
  public void testReconstruct_cycleStopsAtVisitedName() {
    final FznModel model =
        FznParser.parse(
            String.join(
                "\n",
                "var int: a;",
                "var int: b;",
                "constraint int_plus(b, 1, a) :: defines_var(a);",
                "constraint int_plus(a, 1, b) :: defines_var(b);"));
    assertThat(ExpressionReconstructor.reconstruct(model, "a", 5)).isEqualTo("((a + 1) + 1)");
    assertThat(ExpressionReconstructor.reconstruct(model, "b", 5)).isEqualTo("((b + 1) + 1)");
  }

  @Test
  public void testReconstruct_literalsAndConstants() {
    final FznModel model =
        FznParser.parse(
            String.join(
                "\n",
                "var int: x;",
                "var 5..5: k;",
                "var int: obj;",
                "constraint int_max(x, k, obj) :: defines_var(obj);"));
    assertThat(ExpressionReconstructor.reconstruct(model, "-12", 2)).isEqualTo("-12");
    assertThat(ExpressionReconstructor.reconstruct(model, "k", 0)).isEqualTo("5");
    assertThat(ExpressionReconstructor.reconstruct(model, "obj", 2)).isEqualTo("max(x, 5)");
    assertThat(ExpressionReconstructor.reconstruct(model, "undeclared", 2))
        .isEqualTo("undeclared");
  }

  @Test
  public void testReconstruct_linearEquation() {
    final FznModel model =
        FznParser.parse(
            String.join(
                "\n",
                "array [1..3] of int: coeffs = [1, 1, -1];",
                "var int: x;",
                "var int: y;",
                "var int: z;",
                "constraint int_lin_eq(coeffs, [x, y, z], 10) :: defines_var(z);"));
    assertThat(ExpressionReconstructor.reconstruct(model, "z", 2)).isEqualTo("(x + y - 10)");
  }

  @Test
  public void testReconstruct_elementAndConditional() {
    final FznModel model =
        FznParser.parse(
            String.join(
                "\n",
                "array [1..3] of int: costs = [4, 8, 15];",
                "var 1..3: i;",
                "var bool: b;",
                "var int: c;",
                "var int: e;",
                "var int: obj;",
                "constraint array_int_element(i, costs, c) :: defines_var(c);",
                "constraint bool2int(b, e) :: defines_var(e);",
                "constraint fzn_if_then_else_var_int(b, c, e, obj) :: defines_var(obj);"));
    assertThat(ExpressionReconstructor.reconstruct(model, "obj", 2))
        .isEqualTo("(if b then costs[i] else bool2int(b))");
  }

  @Test
  public void testReconstruct_unrecognizedCallKeepsRawArguments() {
    final FznModel model =
        FznParser.parse(
            String.join(
                "\n",
                "var int: x;",
                "var int: obj;",
                "constraint int_abs(x, obj) :: defines_var(obj);"));
    assertThat(ExpressionReconstructor.reconstruct(model, "obj", 2)).isEqualTo("int_abs(x, obj)");
  }
}
