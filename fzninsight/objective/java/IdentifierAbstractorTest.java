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
import org.junit.jupiter.api.Test;

/** Tests the placeholder rewriting of expressions. */
public final class IdentifierAbstractorTest {
  private static final FznModel MODEL =
      FznParser.parse(
          String.join(
              "\n",
              "var int: x;",
              "var int: y;",
              "var int: max;",
              "var int: obj;",
              "array [1..2] of int: costs = [1, 2];"));

  @Test
  public void testPlaceholder() {
    assertThat(IdentifierAbstractor.placeholder(0)).isEqualTo("a");
    assertThat(IdentifierAbstractor.placeholder(1)).isEqualTo("b");
    assertThat(IdentifierAbstractor.placeholder(25)).isEqualTo("z");
    assertThat(IdentifierAbstractor.placeholder(26)).isEqualTo("aa");
    assertThat(IdentifierAbstractor.placeholder(27)).isEqualTo("ab");
    assertThat(IdentifierAbstractor.placeholder(52)).isEqualTo("ba");
  }

  @Test
  public void testAbstract_orderOfFirstAppearance() {
    final AbstractedExpression abstracted =
        IdentifierAbstractor.abstractIdentifiers(MODEL, "obj", "((y * x) + costs[y] - obj)");
    assertThat(abstracted.getExpression()).isEqualTo("((b * c) + d[b] - a)");
    assertThat(abstracted.getObjectivePlaceholder()).isEqualTo("a");
    assertThat(abstracted.getPlaceholders())
        .containsExactly("obj", "a", "y", "b", "x", "c", "costs", "d")
        .inOrder();
  }

  @Test
  public void testAbstract_isDeterministic() {
    final String expression = "max(x, y) + x";
    assertThat(IdentifierAbstractor.abstractIdentifiers(MODEL, "obj", expression).getExpression())
        .isEqualTo(
            IdentifierAbstractor.abstractIdentifiers(MODEL, "obj", expression).getExpression());
  }

  @Test
  public void testAbstract_reservedWordsAndUndeclaredNamesAreKept() {
    final AbstractedExpression abstracted =
        IdentifierAbstractor.abstractIdentifiers(
            MODEL, "obj", "max(x, max) + bool2int(flag) + (if true then y else 3)");
    assertThat(abstracted.getExpression())
        .isEqualTo("max(b, max) + bool2int(flag) + (if true then c else 3)");
  }

  @Test
  public void testAbstract_undeclaredObjective() {
    final AbstractedExpression abstracted =
        IdentifierAbstractor.abstractIdentifiers(MODEL, "goal", "goal");
    assertThat(abstracted.getExpression()).isEqualTo("a");
  }
}
