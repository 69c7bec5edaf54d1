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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.fzninsight.flatzinc.FznArray;
import com.google.fzninsight.flatzinc.FznConstraint;
import com.google.fzninsight.flatzinc.FznModel;
import com.google.fzninsight.flatzinc.FznSyntax;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/** Classifies a defining constraint into a {@link DefinitionShape}. */
public final class DefinitionShapes {
  private static final ImmutableMap<String, BinaryOperation.Operator> BINARY_OPERATIONS =
      ImmutableMap.of(
          "int_max", BinaryOperation.Operator.MAX,
          "int_min", BinaryOperation.Operator.MIN,
          "int_plus", BinaryOperation.Operator.PLUS,
          "int_minus", BinaryOperation.Operator.MINUS,
          "int_times", BinaryOperation.Operator.TIMES);

  private static final ImmutableSet<String> ELEMENTS =
      ImmutableSet.of(
          "array_int_element",
          "array_var_int_element",
          "array_bool_element",
          "array_var_bool_element");

  private static final ImmutableSet<String> IF_THEN_ELSE =
      ImmutableSet.of("fzn_if_then_else_var_int", "fzn_if_then_else_var_bool");

  private static final String BOOL2INT = "bool2int";
  private static final String INT_LIN_EQ = "int_lin_eq";

  private DefinitionShapes() {}

  /**
   * Returns the shape of {@code constraint} seen as the definition of {@code definedName}.
   *
   * <p>A constraint of a known family whose arity does not match, or whose output argument is not
   * {@code definedName}, is an {@link UnrecognizedCall}.
   */
  public static DefinitionShape classify(
      FznModel model, String definedName, FznConstraint constraint) {
    final String type = constraint.getType();
    final List<String> args = constraint.args();
    final Optional<DefinitionShape> shape;
    if (BINARY_OPERATIONS.containsKey(type)) {
      shape = binary(BINARY_OPERATIONS.get(type), args, definedName);
    } else if (ELEMENTS.contains(type)) {
      shape = element(args, definedName);
    } else if (IF_THEN_ELSE.contains(type)) {
      shape = ifThenElse(args, definedName);
    } else if (type.equals(BOOL2INT)) {
      shape = boolToInt(args, definedName);
    } else if (type.equals(INT_LIN_EQ)) {
      shape = linear(model, args, definedName);
    } else {
      shape = Optional.empty();
    }
    return shape.orElseGet(() -> new UnrecognizedCall(type, constraint.getRawArgs()));
  }

  private static Optional<DefinitionShape> binary(
      BinaryOperation.Operator op, List<String> args, String definedName) {
    if (args.size() != 3 || !args.get(2).equals(definedName)) {
      return Optional.empty();
    }
    return Optional.of(new BinaryOperation(op, args.get(0), args.get(1)));
  }

  private static Optional<DefinitionShape> element(List<String> args, String definedName) {
    if (args.size() != 3 || !args.get(2).equals(definedName)) {
      return Optional.empty();
    }
    return Optional.of(new ElementAccess(args.get(0), args.get(1)));
  }

  private static Optional<DefinitionShape> ifThenElse(List<String> args, String definedName) {
    if (args.size() == 4 && args.get(3).equals(definedName)) {
      return Optional.of(new IfThenElse(args.get(0), args.get(1), args.get(2)));
    }
    if (args.size() == 3 && args.get(2).equals(definedName)) {
      return Optional.of(new IfThenElse(args.get(0), args.get(1), IfThenElse.DEFAULT_ELSE));
    }
    return Optional.empty();
  }

  private static Optional<DefinitionShape> boolToInt(List<String> args, String definedName) {
    if (args.size() != 2 || !args.get(1).equals(definedName)) {
      return Optional.empty();
    }
    return Optional.of(new BoolToInt(args.get(0)));
  }

  private static Optional<DefinitionShape> linear(
      FznModel model, List<String> args, String definedName) {
    if (args.size() != 3) {
      return Optional.empty();
    }
    final Optional<long[]> coeffs = resolveIntArray(model, args.get(0));
    final Optional<ImmutableList<String>> vars = resolveIdentifierArray(model, args.get(1));
    final OptionalLong constant = FznSyntax.parseIntLiteral(args.get(2));
    if (coeffs.isEmpty() || vars.isEmpty() || constant.isEmpty()) {
      return Optional.empty();
    }
    if (coeffs.get().length != vars.get().size()) {
      return Optional.empty();
    }
    final int index = vars.get().indexOf(definedName);
    if (index == -1) {
      return Optional.empty();
    }
    return Optional.of(
        new LinearDefinition(
            coeffs.get(), vars.get().toArray(new String[0]), constant.getAsLong(), index));
  }

  /** Resolves a literal integer list, or the body of a named parameter array. */
  static Optional<long[]> resolveIntArray(FznModel model, String arg) {
    final Optional<ImmutableList<String>> literal = FznSyntax.parseBracketList(arg);
    final List<String> items;
    if (literal.isPresent()) {
      items = literal.get();
    } else {
      final Optional<FznArray> array = model.array(arg.trim());
      if (array.isEmpty() || array.get().isDecision()) {
        return Optional.empty();
      }
      items = array.get().getElements();
    }
    final long[] values = new long[items.size()];
    for (int i = 0; i < values.length; ++i) {
      final OptionalLong value = FznSyntax.parseIntLiteral(items.get(i));
      if (value.isEmpty()) {
        return Optional.empty();
      }
      values[i] = value.getAsLong();
    }
    return Optional.of(values);
  }

  /** Resolves a literal identifier list, or the body of a named decision array. */
  static Optional<ImmutableList<String>> resolveIdentifierArray(FznModel model, String arg) {
    final Optional<ImmutableList<String>> literal = FznSyntax.parseBracketList(arg);
    if (literal.isPresent()) {
      return literal;
    }
    return model
        .array(arg.trim())
        .filter(FznArray::isDecision)
        .map(FznArray::getElements);
  }
}
