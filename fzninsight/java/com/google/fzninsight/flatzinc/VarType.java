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

/** Element kind of a FlatZinc scalar or array. */
public enum VarType {
  INT("int"),
  BOOL("bool");

  VarType(String keyword) {
    this.keyword = keyword;
  }

  /** Returns the FlatZinc keyword, "int" or "bool". */
  public String keyword() {
    return keyword;
  }

  @Override
  public String toString() {
    return keyword;
  }

  private final String keyword;
}
