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

/** The solve goal of a FlatZinc model. */
public enum ProblemType {
  SATISFY("satisfy"),
  MINIMIZE("minimize"),
  MAXIMIZE("maximize");

  ProblemType(String keyword) {
    this.keyword = keyword;
  }

  /** Returns the keyword used in the solve item. */
  public String keyword() {
    return keyword;
  }

  /** Returns true for minimize and maximize. */
  public boolean isOptimization() {
    return this != SATISFY;
  }

  /** Returns the goal spelled {@code keyword}. */
  public static ProblemType fromKeyword(String keyword) {
    for (ProblemType type : values()) {
      if (type.keyword.equals(keyword)) {
        return type;
      }
    }
    throw new IllegalArgumentException("unknown solve goal: " + keyword);
  }

  @Override
  public String toString() {
    return keyword;
  }

  private final String keyword;
}
