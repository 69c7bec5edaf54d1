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

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An immutable integer interval [min, max] with {@code min <= max}.
 *
 * <p>This is the summary representation of a FlatZinc domain: a set domain {@code {1,3,5}} is kept
 * as its envelope [1, 5], the gaps are not tracked. The number of values must fit a long, so
 * [Long.MIN_VALUE, Long.MAX_VALUE] is not an interval.
 */
public final class Interval {
  private static final Pattern RANGE = Pattern.compile("(-?\\d+)\\.\\.(-?\\d+)");
  private static final Pattern SET = Pattern.compile("\\{\\s*(.*?)\\s*\\}", Pattern.DOTALL);

  /** The Boolean domain [0, 1]. */
  public static final Interval BOOLEAN = new Interval(0, 1);

  public Interval(long min, long max) {
    checkArgument(min <= max, "inverted interval [%s, %s]", min, max);
    checkArgument(
        countValues(min, max).isPresent(), "interval [%s, %s] is too large", min, max);
    this.min = min;
    this.max = max;
  }

  /** Creates the singleton interval [value, value]. */
  public static Interval singleton(long value) {
    return new Interval(value, value);
  }

  /**
   * Parses a domain spec, either a range {@code lo..hi} or a literal set {@code {v1, v2, ...}}.
   *
   * <p>Ranges are order-normalized, so {@code 10..1} gives [1, 10]. Sets collapse to the envelope
   * of their values. Any other input, non-integer tokens or an empty set gives an empty result.
   */
  public static Optional<Interval> parse(String spec) {
    if (spec == null) {
      return Optional.empty();
    }
    final String trimmed = spec.trim();
    try {
      Matcher range = RANGE.matcher(trimmed);
      if (range.matches()) {
        final long lo = Long.parseLong(range.group(1));
        final long hi = Long.parseLong(range.group(2));
        return of(Math.min(lo, hi), Math.max(lo, hi));
      }
      Matcher set = SET.matcher(trimmed);
      if (set.matches()) {
        final List<String> items = FznSyntax.splitTopLevelCommas(set.group(1));
        if (items.isEmpty()) {
          return Optional.empty();
        }
        long lo = Long.MAX_VALUE;
        long hi = Long.MIN_VALUE;
        for (String item : items) {
          final long value = Long.parseLong(item);
          lo = Math.min(lo, value);
          hi = Math.max(hi, value);
        }
        return of(lo, hi);
      }
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
    return Optional.empty();
  }

  // Empty when the interval is too large to be represented.
  private static Optional<Interval> of(long min, long max) {
    if (countValues(min, max).isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new Interval(min, max));
  }

  /**
   * Returns {@code hi - lo + 1}, the number of integers in [lo, hi], or an empty result if it does
   * not fit a long.
   */
  public static OptionalLong countValues(long lo, long hi) {
    try {
      return OptionalLong.of(Math.addExact(Math.subtractExact(hi, lo), 1));
    } catch (ArithmeticException e) {
      return OptionalLong.empty();
    }
  }

  public long min() {
    return min;
  }

  public long max() {
    return max;
  }

  /** Returns (min + max) / 2. */
  public double mean() {
    return (min + (double) max) / 2.0;
  }

  /** Returns the number of values in the interval, max - min + 1. */
  public long size() {
    return countValues(min, max).getAsLong();
  }

  /** Returns true if the interval holds a single value, so the variable is really a constant. */
  public boolean isSingleton() {
    return min == max;
  }

  /**
   * Returns the smallest interval containing both this one and {@code other}.
   *
   * @throws IllegalArgumentException if the union is too large
   */
  public Interval span(Interval other) {
    return new Interval(Math.min(min, other.min), Math.max(max, other.max));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Interval)) {
      return false;
    }
    Interval other = (Interval) o;
    return min == other.min && max == other.max;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(min) * 31 + Long.hashCode(max);
  }

  @Override
  public String toString() {
    return String.format("[%d, %d]", min, max);
  }

  private final long min;
  private final long max;
}
