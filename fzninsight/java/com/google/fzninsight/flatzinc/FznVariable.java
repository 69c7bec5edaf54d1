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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Optional;

/** A scalar variable declaration, {@code var <spec>: name :: annotations;}. */
public final class FznVariable {
  /**
   * Creates a variable.
   *
   * @param name the declared identifier
   * @param type the element kind
   * @param domain the declared domain, or null when the declaration is unbounded ({@code var int})
   * @param origin user or compiler-introduced
   */
  public FznVariable(String name, VarType type, Interval domain, Origin origin) {
    this.name = checkNotNull(name);
    this.type = checkNotNull(type);
    this.origin = checkNotNull(origin);
    checkArgument(
        type != VarType.BOOL || Interval.BOOLEAN.equals(domain),
        "Boolean variable %s must have domain [0, 1]",
        name);
    this.domain = domain;
  }

  /** Creates a Boolean variable, whose domain is always [0, 1]. */
  public static FznVariable bool(String name, Origin origin) {
    return new FznVariable(name, VarType.BOOL, Interval.BOOLEAN, origin);
  }

  public String getName() {
    return name;
  }

  public VarType getType() {
    return type;
  }

  /** Returns the domain, empty when the variable was declared without bounds. */
  public Optional<Interval> getDomain() {
    return Optional.ofNullable(domain);
  }

  public Origin getOrigin() {
    return origin;
  }

  /**
   * Returns true if the domain is a single value. Such a variable is a constant in disguise and is
   * rendered as that value everywhere.
   */
  public boolean isConstant() {
    return domain != null && domain.isSingleton();
  }

  @Override
  public String toString() {
    final String bounds = domain == null ? type.keyword() : domain.toString();
    return String.format("%s(%s)", name, bounds);
  }

  private final String name;
  private final VarType type;
  private final Interval domain;
  private final Origin origin;
}
