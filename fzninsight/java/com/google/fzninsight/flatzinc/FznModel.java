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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.fzninsight.search.SearchNode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A FlatZinc model recovered from text.
 *
 * <p>The model is immutable. It is produced by {@link FznParser} through a {@link Builder}; the
 * definitions map is derived from the constraints when the builder is frozen.
 */
public final class FznModel {
  private FznModel(Builder builder) {
    this.variables = ImmutableMap.copyOf(builder.variables);
    this.arrays = ImmutableMap.copyOf(builder.arrays);
    this.constraints = builder.constraints.build();
    this.definitions = buildDefinitions(constraints);
    this.problemType = builder.problemType;
    this.objective = builder.objective;
    this.search = builder.search;
  }

  // First defining constraint wins, later annotations for the same variable are ignored.
  private static ImmutableMap<String, FznConstraint> buildDefinitions(
      ImmutableList<FznConstraint> constraints) {
    final Map<String, FznConstraint> definitions = new LinkedHashMap<>();
    for (FznConstraint ct : constraints) {
      for (String name : ct.getDefinedVars()) {
        definitions.putIfAbsent(name, ct);
      }
    }
    return ImmutableMap.copyOf(definitions);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Scalar variables by name, in declaration order. */
  public ImmutableMap<String, FznVariable> getVariables() {
    return variables;
  }

  /** Arrays by name, in declaration order. */
  public ImmutableMap<String, FznArray> getArrays() {
    return arrays;
  }

  /** Constraints in file order. */
  public ImmutableList<FznConstraint> getConstraints() {
    return constraints;
  }

  /** Maps each defined variable to the first constraint annotated {@code defines_var(it)}. */
  public ImmutableMap<String, FznConstraint> getDefinitions() {
    return definitions;
  }

  public Optional<FznConstraint> definitionOf(String name) {
    return Optional.ofNullable(definitions.get(name));
  }

  public Optional<FznVariable> variable(String name) {
    return Optional.ofNullable(variables.get(name));
  }

  public Optional<FznArray> array(String name) {
    return Optional.ofNullable(arrays.get(name));
  }

  /** Returns true if {@code name} is a declared scalar whose domain holds a single value. */
  public boolean isConstant(String name) {
    final FznVariable var = variables.get(name);
    return var != null && var.isConstant();
  }

  /** Returns true if {@code name} is a declared scalar or array. */
  public boolean isDeclared(String name) {
    return variables.containsKey(name) || arrays.containsKey(name);
  }

  /** Returns the solve goal, empty if no solve item was recognized. */
  public Optional<ProblemType> getProblemType() {
    return Optional.ofNullable(problemType);
  }

  /** Returns the objective identifier of a minimize or maximize goal, if one was given. */
  public Optional<String> getObjective() {
    return Optional.ofNullable(objective);
  }

  /** Returns the search annotation of the solve item, if one was recognized. */
  public Optional<SearchNode> getSearch() {
    return Optional.ofNullable(search);
  }

  @Override
  public String toString() {
    return String.format(
        "FznModel(%d variables, %d arrays, %d constraints, %d definitions, goal %s)",
        variables.size(),
        arrays.size(),
        constraints.size(),
        definitions.size(),
        problemType == null ? "unknown" : problemType.keyword());
  }

  /** Accumulates the declarations of one extraction pass. */
  public static final class Builder {
    private final Map<String, FznVariable> variables = new LinkedHashMap<>();
    private final Map<String, FznArray> arrays = new LinkedHashMap<>();
    private final ImmutableList.Builder<FznConstraint> constraints = ImmutableList.builder();
    private ProblemType problemType;
    private String objective;
    private SearchNode search;
    private boolean built;

    private Builder() {}

    public Builder addVariable(FznVariable var) {
      checkState(!built, "model already built");
      variables.put(var.getName(), var);
      return this;
    }

    public Builder addArray(FznArray array) {
      checkState(!built, "model already built");
      arrays.put(array.getName(), array);
      return this;
    }

    public Builder addConstraint(FznConstraint ct) {
      checkState(!built, "model already built");
      constraints.add(ct);
      return this;
    }

    /** Sets the solve goal; {@code objective} and {@code search} may be null. */
    public Builder setSolve(ProblemType problemType, String objective, SearchNode search) {
      checkState(!built, "model already built");
      this.problemType = problemType;
      this.objective = objective;
      this.search = search;
      return this;
    }

    public FznModel build() {
      checkState(!built, "model already built");
      built = true;
      return new FznModel(this);
    }
  }

  private final ImmutableMap<String, FznVariable> variables;
  private final ImmutableMap<String, FznArray> arrays;
  private final ImmutableList<FznConstraint> constraints;
  private final ImmutableMap<String, FznConstraint> definitions;
  private final ProblemType problemType;
  private final String objective;
  private final SearchNode search;
}
