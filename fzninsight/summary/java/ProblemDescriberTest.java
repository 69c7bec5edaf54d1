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

import com.google.fzninsight.flatzinc.FznModel;
import com.google.fzninsight.flatzinc.FznParser;
import org.junit.jupiter.api.Test;

/** Tests the problem sentences. */
public final class ProblemDescriberTest {
  @Test
  public void testDescribe_goals() {
    assertThat(ProblemDescriber.describe(FznParser.parse("var int: x;\n")))
        .isEqualTo("Problem type could not be determined.");
    assertThat(ProblemDescriber.describe(FznParser.parse("var int: x;\nsolve satisfy;\n")))
        .isEqualTo("This is a satisfaction problem.");
    assertThat(ProblemDescriber.describe(FznParser.parse("solve minimize cost;\n")))
        .isEqualTo(
            "This is a minimization problem. Objective variable could not be determined.");
  }

  @Test
  public void testDescribe_objectiveWithDomain() {
    final FznModel model =
        FznParser.parse(
            String.join(
                "\n",
                "var 0..10: cost;",
                "constraint int_le(cost, 5);",
                "solve minimize cost;"));
    assertThat(ProblemDescriber.describe(model))
        .isEqualTo(
            "This is a minimization problem. The objective is to minimize an objective variable"
                + " with domain [0, 10] (size 11, mean 5.00) and degree 1. The objective function"
                + " is in the form: minimize a.");
  }

  @Test
  public void testDescribe_reconstructedObjective() {
    final FznModel model =
        FznParser.parse(
            String.join(
                "\n",
                "var int: x;",
                "var int: y;",
                "var int: obj :: output_var;",
                "constraint int_plus(x, y, obj) :: defines_var(obj);",
                "solve maximize obj;"));
    assertThat(ProblemDescriber.describe(model))
        .isEqualTo(
            "This is a maximization problem. The objective is to maximize an objective variable"
                + " with unknown domain and degree 1. The objective function is in the form:"
                + " maximize a where a = (b + c).");
    assertThat(ProblemDescriber.describeObjectiveFunction(model, 0, 100))
        .hasValue("The objective function is in the form: maximize a");
    assertThat(ProblemDescriber.describeObjectiveFunction(model, 2, 4))
        .hasValue("The objective function is in the form: maximize a where a = (b …");
  }

  @Test
  public void testDescribeObjectiveFunction_satisfaction() {
    assertThat(
            ProblemDescriber.describeObjectiveFunction(
                FznParser.parse("solve satisfy;"), 2, 100))
        .isEmpty();
  }

  @Test
  public void testTruncate() {
    assertThat(ProblemDescriber.truncate("abcdef", 6)).isEqualTo("abcdef");
    assertThat(ProblemDescriber.truncate("abcdef", 4)).isEqualTo("abc…");
    assertThat(ProblemDescriber.truncate("abcdef", 1)).isEqualTo("…");
  }
}
