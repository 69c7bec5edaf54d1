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

package com.google.fzninsight.search;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.Objects;

/** {@code int_search(vars, var_strategy, val_strategy, completeness)}. */
public final class IntSearch implements SearchNode {
  public IntSearch(
      ImmutableList<String> vars, String varStrategy, String valStrategy, String completeness) {
    this.vars = checkNotNull(vars);
    this.varStrategy = checkNotNull(varStrategy);
    this.valStrategy = checkNotNull(valStrategy);
    this.completeness = checkNotNull(completeness);
  }

  @Override
  public Kind getKind() {
    return Kind.INT_SEARCH;
  }

  /** Returns the searched identifiers: the list elements, or the single scalar or array name. */
  public ImmutableList<String> getVars() {
    return vars;
  }

  /** Returns the variable selection token, e.g. "first_fail". */
  public String getVarStrategy() {
    return varStrategy;
  }

  /** Returns the value selection token, e.g. "indomain_min". */
  public String getValStrategy() {
    return valStrategy;
  }

  /** Returns the completeness token, e.g. "complete". */
  public String getCompleteness() {
    return completeness;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof IntSearch)) {
      return false;
    }
    IntSearch other = (IntSearch) o;
    return vars.equals(other.vars)
        && varStrategy.equals(other.varStrategy)
        && valStrategy.equals(other.valStrategy)
        && completeness.equals(other.completeness);
  }

  @Override
  public int hashCode() {
    return Objects.hash(vars, varStrategy, valStrategy, completeness);
  }

  @Override
  public String toString() {
    return String.format(
        "int_search(%s, %s, %s, %s)", vars, varStrategy, valStrategy, completeness);
  }

  private final ImmutableList<String> vars;
  private final String varStrategy;
  private final String valStrategy;
  private final String completeness;
}
