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

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Classifies declarations as user-authored or compiler-introduced.
 *
 * <p>This is a heuristic. Producers of FlatZinc do not agree on a convention, so both false
 * negatives and false positives are expected.
 */
public final class OriginClassifier {
  private static final Pattern RESERVED_NAME = Pattern.compile("X_INTRODUCED_\\d+_");
  private static final String[] INTRODUCED_ANNOTATIONS = {
    "is_defined_var", "var_is_introduced", "is_introduced"
  };

  private OriginClassifier() {}

  /**
   * Classifies the declaration {@code name} carrying the annotation text {@code annotations}, which
   * may be null.
   */
  public static Origin classify(String name, String annotations) {
    if (name != null && (RESERVED_NAME.matcher(name).matches() || name.contains("INTRODUCED"))) {
      return Origin.INTRODUCED;
    }
    if (annotations == null || annotations.isEmpty()) {
      return Origin.USER;
    }
    final String lowered = annotations.toLowerCase(Locale.ROOT);
    for (String token : INTRODUCED_ANNOTATIONS) {
      if (lowered.contains(token)) {
        return Origin.INTRODUCED;
      }
    }
    return Origin.USER;
  }
}
