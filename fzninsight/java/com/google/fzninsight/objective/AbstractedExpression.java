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

import com.google.common.collect.ImmutableMap;

/** An expression whose model identifiers were replaced by placeholders. */
public final class AbstractedExpression {
  AbstractedExpression(
      String expression, String objectivePlaceholder, ImmutableMap<String, String> placeholders) {
    this.expression = checkNotNull(expression);
    this.objectivePlaceholder = checkNotNull(objectivePlaceholder);
    this.placeholders = checkNotNull(placeholders);
  }

  /** Returns the rewritten expression. */
  public String getExpression() {
    return expression;
  }

  /** Returns the placeholder standing for the objective, always "a". */
  public String getObjectivePlaceholder() {
    return objectivePlaceholder;
  }

  /** Maps each replaced identifier to its placeholder, in order of assignment. */
  public ImmutableMap<String, String> getPlaceholders() {
    return placeholders;
  }

  @Override
  public String toString() {
    return expression;
  }

  private final String expression;
  private final String objectivePlaceholder;
  private final ImmutableMap<String, String> placeholders;
}
