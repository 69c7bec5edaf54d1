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

import static com.google.common.truth.Truth.assertThat;

import com.google.fzninsight.flatzinc.FznConstraint;
import com.google.fzninsight.flatzinc.FznModel;
import com.google.fzninsight.flatzinc.FznParser;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests degrees and arities. */
public final class ModelStatisticsTest {
  private static final FznModel MODEL =
      FznParser.parse(
          String.join(
              "\n",
              "var 1..10: x;",
              "var 1..10: y;",
              "var 3..3: k;",
              "array [1..2] of var int: xs = [x, y];",
              "array [1..4] of var int: ys;",
              "constraint int_le(x, y);",
              "constraint int_lin_le([1, 1], [x, k], 5);",
              "constraint all_different(xs);",
              "constraint all_different(ys);",
              "constraint int_eq(x, x);",
              "constraint all_different([x, y, xs, xs]);"));

  @Test
  public void testVariableDegrees() {
    // int_eq(x, x) mentions x twice.
    assertThat(ModelStatistics.variableDegrees(MODEL))
        .containsExactly("x", 5, "y", 2, "k", 1);
  }

  @Test
  public void testVariableDegrees_countsEveryMention() {
    final FznModel model =
        FznParser.parse(
            "var int: x;\nvar int: y;\nconstraint int_lin_eq([1, 1], [x, x], 0);\n");
    assertThat(ModelStatistics.variableDegrees(model)).containsExactly("x", 2, "y", 0);
  }

  @Test
  public void testArity() {
    final List<FznConstraint> constraints = MODEL.getConstraints();
    assertThat(ModelStatistics.arity(MODEL, constraints.get(0))).isEqualTo(2);
    // The constant k does not count.
    assertThat(ModelStatistics.arity(MODEL, constraints.get(1))).isEqualTo(1);
    assertThat(ModelStatistics.arity(MODEL, constraints.get(2))).isEqualTo(2);
    // Body unknown, the declared length is used.
    assertThat(ModelStatistics.arity(MODEL, constraints.get(3))).isEqualTo(4);
    assertThat(ModelStatistics.arity(MODEL, constraints.get(4))).isEqualTo(1);
    assertThat(ModelStatistics.arity(MODEL, constraints.get(5))).isEqualTo(2);
  }

  @Test
  public void testEmptyModel() {
    final FznModel model = FznParser.parse("");
    assertThat(ModelStatistics.variableDegrees(model)).isEmpty();
  }
}
