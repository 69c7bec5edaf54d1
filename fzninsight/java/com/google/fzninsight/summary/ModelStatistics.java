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

package com.google.fzninsight.summary;

import com.google.common.collect.ImmutableMap;
import com.google.fzninsight.flatzinc.FznArray;
import com.google.fzninsight.flatzinc.FznConstraint;
import com.google.fzninsight.flatzinc.FznModel;
import com.google.fzninsight.flatzinc.FznSyntax;
import com.google.fzninsight.flatzinc.FznVariable;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

/** Counting helpers over a {@link FznModel}. */
public final class ModelStatistics {
  private ModelStatistics() {}

  /**
   * Maps every scalar variable to its number of mentions in constraint arguments. A variable
   * mentioned twice by one constraint counts twice.
   */
  public static ImmutableMap<String, Integer> variableDegrees(FznModel model) {
    final Map<String, Integer> degrees = new LinkedHashMap<>();
    for (String name : model.getVariables().keySet()) {
      degrees.put(name, 0);
    }
    for (FznConstraint ct : model.getConstraints()) {
      for (String token : FznSyntax.identifierTokens(ct.getRawArgs())) {
        degrees.computeIfPresent(token, (name, degree) -> degree + 1);
      }
    }
    return ImmutableMap.copyOf(degrees);
  }

  /**
   * Returns the number of variables a constraint ranges over.
   *
   * <p>Non-constant scalars count once. A decision array counts as its element variables when its
   * body is known, or as its declared length otherwise.
   */
  public static long arity(FznModel model, FznConstraint ct) {
    final Set<String> mentioned = new LinkedHashSet<>();
    final Set<String> seenArrays = new HashSet<>();
    long anonymous = 0;
    for (String token : FznSyntax.identifierTokens(ct.getRawArgs())) {
      if (isNonConstantScalar(model, token)) {
        mentioned.add(token);
        continue;
      }
      final FznArray array = model.getArrays().get(token);
      if (array == null || !array.isDecision() || !seenArrays.add(token)) {
        continue;
      }
      if (!array.getElements().isEmpty()) {
        for (String element : array.getElements()) {
          if (isNonConstantScalar(model, element)) {
            mentioned.add(element);
          }
        }
      } else {
        final OptionalLong length = array.getDeclaredLength();
        if (length.isPresent()) {
          anonymous += length.getAsLong();
        }
      }
    }
    return mentioned.size() + anonymous;
  }

  private static boolean isNonConstantScalar(FznModel model, String name) {
    final FznVariable var = model.getVariables().get(name);
    return var != null && !var.isConstant();
  }
}
