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

import org.junit.jupiter.api.Test;

/** Tests the isolation of a variable from a linear equation. */
public final class LinearDefinitionTest {
  private static final DefinitionShape.OperandRenderer IDENTITY = operand -> operand;

  private static String render(long[] coeffs, String[] vars, long constant, int index) {
    return new LinearDefinition(coeffs, vars, constant, index).render(IDENTITY);
  }

  @Test
  public void testRender_minusOneCoefficient() {
    final String[] vars = {"x", "y", "z"};
    assertThat(render(new long[] {1, 1, -1}, vars, 10, 2)).isEqualTo("(x + y - 10)");
    assertThat(render(new long[] {1, 1, -1}, vars, 0, 2)).isEqualTo("x + y");
    assertThat(render(new long[] {1, -1, -1}, vars, 0, 2)).isEqualTo("x - (y)");
  }

  @Test
  public void testRender_plusOneCoefficient() {
    final String[] vars = {"x", "t"};
    assertThat(render(new long[] {2, 1}, vars, 6, 1)).isEqualTo("(6 - (2*(x)))");
    assertThat(render(new long[] {2, 1}, vars, 0, 1)).isEqualTo("(-(2*(x)))");
    assertThat(render(new long[] {0, 1}, vars, 7, 1)).isEqualTo("7");
    assertThat(render(new long[] {0, 1}, vars, 0, 1)).isEqualTo("0");
  }

  @Test
  public void testRender_otherCoefficient() {
    final String[] vars = {"t", "y"};
    assertThat(render(new long[] {3, -1}, vars, 0, 0)).isEqualTo("((0 - (-(y))) / 3)");
    assertThat(render(new long[] {4, 0}, vars, 12, 0)).isEqualTo("(12 / 4)");
  }

  @Test
  public void testRender_expandsOperands() {
    final LinearDefinition def =
        new LinearDefinition(new long[] {1, 1, -1}, new String[] {"x", "y", "z"}, 0, 2);
    assertThat(def.render(operand -> operand.toUpperCase())).isEqualTo("X + Y");
    assertThat(def.getDefinedCoefficient()).isEqualTo(-1);
    assertThat(def.getConstant()).isEqualTo(0);
  }

  @Test
  public void testConstructor_invalidArguments() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new LinearDefinition(new long[] {1}, new String[] {"x", "y"}, 0, 0));
    assertThrows(
        IllegalArgumentException.class,
        () -> new LinearDefinition(new long[] {1, 1}, new String[] {"x", "y"}, 0, 2));
  }
}
