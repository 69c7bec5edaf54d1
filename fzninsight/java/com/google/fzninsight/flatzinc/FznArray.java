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
import java.util.OptionalLong;

/**
 * An array declaration, {@code array [lo..hi] of [var] <spec>: name :: annotations = [body];}.
 *
 * <p>The declared length and the element list are independent: a declaration without a body has no
 * elements but may still have a length. Consumers must reconcile the two, see {@link
 * #variableCount()}.
 */
public final class FznArray {
  public FznArray(
      String name,
      VarType elementType,
      boolean decision,
      OptionalLong declaredLength,
      ImmutableList<String> elements,
      Origin origin) {
    this.name = checkNotNull(name);
    this.elementType = checkNotNull(elementType);
    this.decision = decision;
    this.declaredLength = checkNotNull(declaredLength);
    this.elements = checkNotNull(elements);
    this.origin = checkNotNull(origin);
  }

  public String getName() {
    return name;
  }

  public VarType getElementType() {
    return elementType;
  }

  /** Returns true for arrays of decision variables ({@code of var ...}), false for parameters. */
  public boolean isDecision() {
    return decision;
  }

  /** Returns |hi - lo| + 1 from the index range, when the range is numeric. */
  public OptionalLong getDeclaredLength() {
    return declaredLength;
  }

  /** Returns the element references of the body: identifiers or integer literals. */
  public ImmutableList<String> getElements() {
    return elements;
  }

  public Origin getOrigin() {
    return origin;
  }

  /** Number of elements: the body size when a body was given, otherwise the declared length. */
  public OptionalLong variableCount() {
    if (!elements.isEmpty()) {
      return OptionalLong.of(elements.size());
    }
    return declaredLength;
  }

  @Override
  public String toString() {
    return String.format(
        "%s: array of %s%s, %d elements", name, decision ? "var " : "", elementType,
        elements.size());
  }

  private final String name;
  private final VarType elementType;
  private final boolean decision;
  private final OptionalLong declaredLength;
  private final ImmutableList<String> elements;
  private final Origin origin;
}
