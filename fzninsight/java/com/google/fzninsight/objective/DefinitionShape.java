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

/**
 * How a defining constraint computes the variable it defines.
 *
 * <p>Each recognized constraint family has its own shape; anything else is an {@link
 * UnrecognizedCall}. Operands are kept as identifiers or literals and rendered through an {@link
 * OperandRenderer}, which is where the reconstruction recurses.
 */
public interface DefinitionShape {
  /** Renders one operand, an identifier or an integer literal, as an expression. */
  @FunctionalInterface
  interface OperandRenderer {
    String render(String operand);
  }

  /** Returns the expression computing the defined variable. */
  String render(OperandRenderer operands);
}
