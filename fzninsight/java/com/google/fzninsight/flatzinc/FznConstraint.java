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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * A constraint statement, {@code constraint type(args) :: annotations;}.
 *
 * <p>The arguments are kept as raw text and split on demand.
 */
public final class FznConstraint {
  public FznConstraint(
      String type, String rawArgs, String annotations, ImmutableSet<String> definedVars) {
    this.type = checkNotNull(type);
    this.rawArgs = checkNotNull(rawArgs);
    this.annotations = checkNotNull(annotations);
    this.definedVars = checkNotNull(definedVars);
  }

  /** Returns the constraint name, e.g. "int_lin_eq". */
  public String getType() {
    return type;
  }

  /** Returns the text between the outer parentheses of the call. */
  public String getRawArgs() {
    return rawArgs;
  }

  /** Returns the trailing annotation text, including the leading "::", or "" if none. */
  public String getAnnotations() {
    return annotations;
  }

  /** Returns the variables named by {@code defines_var(...)} annotations, in order. */
  public ImmutableSet<String> getDefinedVars() {
    return definedVars;
  }

  /** Returns the top-level arguments. */
  public ImmutableList<String> args() {
    return FznSyntax.splitTopLevelCommas(rawArgs);
  }

  /** Returns the call without annotations, {@code type(args)}. */
  public String callText() {
    return type + "(" + rawArgs + ")";
  }

  @Override
  public String toString() {
    return annotations.isEmpty() ? callText() : callText() + " " + annotations;
  }

  private final String type;
  private final String rawArgs;
  private final String annotations;
  private final ImmutableSet<String> definedVars;
}
