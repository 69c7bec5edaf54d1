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

import com.google.fzninsight.flatzinc.FznModel;
import com.google.fzninsight.flatzinc.FznParser;
import com.google.fzninsight.flatzinc.ProblemType;
import org.junit.jupiter.api.Test;

/** Tests the objective reconstruction of whole models. */
public final class ObjectiveFormulationTest {
  @Test
  public void testOf_plusObjective() {
    final FznModel model =
        FznParser.parse(
            String.join(
                "\n",
                "var int: x;",
                "var int: y;",
                "var int: obj :: output_var;",
                "constraint int_plus(x, y, obj) :: defines_var(obj);",
                "solve maximize obj;"));
    final ObjectiveFormulation formulation = ObjectiveFormulation.of(model).get();
    assertThat(formulation.getGoal()).isEqualTo(ProblemType.MAXIMIZE);
    assertThat(formulation.getObjective()).isEqualTo("obj");
    assertThat(formulation.getExpression()).isEqualTo("(x + y)");
    assertThat(formulation.getAbstractedExpression()).isEqualTo("(b + c)");
    assertThat(formulation.getObjectivePlaceholder()).isEqualTo("a");
    assertThat(formulation.isReconstructed()).isTrue();
    assertThat(formulation.toString()).isEqualTo("maximize obj = (x + y)");
  }

  @Test
  public void testOf_undefinedObjective() {
    final FznModel model = FznParser.parse("var 0..10: cost;\nsolve minimize cost;\n");
    final ObjectiveFormulation formulation = ObjectiveFormulation.of(model).get();
    assertThat(formulation.getExpression()).isEqualTo("cost");
    assertThat(formulation.getAbstractedExpression()).isEqualTo("a");
    assertThat(formulation.isReconstructed()).isFalse();
  }

  @Test
  public void testOf_depthIsConfigurable() {
    final FznModel model =
        FznParser.parse(
            String.join(
                "\n",
                "var int: x;",
                "var int: y;",
                "var int: t;",
                "var int: obj;",
                "constraint int_times(x, y, t) :: defines_var(t);",
                "constraint int_minus(t, 3, obj) :: defines_var(obj);",
                "solve minimize obj;"));
    assertThat(ObjectiveFormulation.of(model, 1).get().getExpression()).isEqualTo("(t - 3)");
    assertThat(ObjectiveFormulation.of(model).get().getExpression()).isEqualTo("((x * y) - 3)");
  }

  @Test
  public void testOf_noOptimizationGoal() {
    assertThat(ObjectiveFormulation.of(FznParser.parse("var int: x;\nsolve satisfy;\n")))
        .isEmpty();
    assertThat(ObjectiveFormulation.of(FznParser.parse("var int: x;\n"))).isEmpty();
    assertThat(ObjectiveFormulation.of(FznParser.parse("var int: x;\nsolve minimize ;\n")))
        .isEmpty();
  }

  @Test
  public void testNormalizeWhitespace() {
    assertThat(ObjectiveFormulation.normalizeWhitespace("  (x +\n\t y)  ")).isEqualTo("(x + y)");
  }
}
