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

import static com.google.common.base.Preconditions.checkNotNull;

/** {@code out = op(left, right)} for the binary integer primitives. */
public final class BinaryOperation implements DefinitionShape {
  /** A binary operator and its rendering. */
  public enum Operator {
    MAX("max(%s, %s)"),
    MIN("min(%s, %s)"),
    PLUS("(%s + %s)"),
    MINUS("(%s - %s)"),
    TIMES("(%s * %s)");

    Operator(String format) {
      this.format = format;
    }

    String format(String left, String right) {
      return String.format(format, left, right);
    }

    private final String format;
  }

  public BinaryOperation(Operator operator, String left, String right) {
    this.operator = checkNotNull(operator);
    this.left = checkNotNull(left);
    this.right = checkNotNull(right);
  }

  public Operator getOperator() {
    return operator;
  }

  @Override
  public String render(OperandRenderer operands) {
    return operator.format(operands.render(left), operands.render(right));
  }

  private final Operator operator;
  private final String left;
  private final String right;
}
