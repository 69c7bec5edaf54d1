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

package com.google.fzninsight.flatzinc;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

public final class OriginClassifierTest {
  @Test
  public void testReservedNames() {
    assertThat(OriginClassifier.classify("X_INTRODUCED_12_", null)).isEqualTo(Origin.INTRODUCED);
    assertThat(OriginClassifier.classify("obj_INTRODUCED", "")).isEqualTo(Origin.INTRODUCED);
  }

  @Test
  public void testAnnotations() {
    assertThat(OriginClassifier.classify("t", "is_defined_var")).isEqualTo(Origin.INTRODUCED);
    assertThat(OriginClassifier.classify("t", "output_var :: VAR_IS_INTRODUCED"))
        .isEqualTo(Origin.INTRODUCED);
    assertThat(OriginClassifier.classify("t", "is_introduced")).isEqualTo(Origin.INTRODUCED);
  }

  @Test
  public void testUserDeclarations() {
    assertThat(OriginClassifier.classify("cost", null)).isEqualTo(Origin.USER);
    assertThat(OriginClassifier.classify("cost", "output_var")).isEqualTo(Origin.USER);
  }
}
