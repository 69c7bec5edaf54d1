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

/** {@code out = if cond then thenValue else elseValue endif}. */
public final class IfThenElse implements DefinitionShape {
  /** The else value of the then-only form. */
  static final String DEFAULT_ELSE = "0";

  public IfThenElse(String condition, String thenValue, String elseValue) {
    this.condition = checkNotNull(condition);
    this.thenValue = checkNotNull(thenValue);
    this.elseValue = checkNotNull(elseValue);
  }

  @Override
  public String render(OperandRenderer operands) {
    return String.format(
        "(if %s then %s else %s)",
        operands.render(condition), operands.render(thenValue), operands.render(elseValue));
  }

  private final String condition;
  private final String thenValue;
  private final String elseValue;
}
