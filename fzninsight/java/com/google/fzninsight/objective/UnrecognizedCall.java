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

/** A defining constraint that could not be simplified, rendered as the literal call. */
public final class UnrecognizedCall implements DefinitionShape {
  public UnrecognizedCall(String type, String rawArgs) {
    this.type = checkNotNull(type);
    this.rawArgs = checkNotNull(rawArgs);
  }

  @Override
  public String render(OperandRenderer operands) {
    return type + "(" + rawArgs + ")";
  }

  private final String type;
  private final String rawArgs;
}
