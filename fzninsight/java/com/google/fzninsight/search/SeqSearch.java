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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;

/** {@code seq_search([phase, ...])}, never empty. */
public final class SeqSearch implements SearchNode {
  public SeqSearch(ImmutableList<SearchNode> phases) {
    checkArgument(!phases.isEmpty(), "seq_search needs at least one phase");
    this.phases = phases;
  }

  @Override
  public Kind getKind() {
    return Kind.SEQ_SEARCH;
  }

  public ImmutableList<SearchNode> getPhases() {
    return phases;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SeqSearch && phases.equals(((SeqSearch) o).phases);
  }

  @Override
  public int hashCode() {
    return phases.hashCode();
  }

  @Override
  public String toString() {
    return "seq_search(" + phases + ")";
  }

  private final ImmutableList<SearchNode> phases;
}
