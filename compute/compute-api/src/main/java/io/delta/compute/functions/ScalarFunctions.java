/*
 * Copyright (2026) The Delta Lake Project Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.delta.compute.functions;

import io.delta.compute.annotation.Evolving;
import io.delta.compute.internal.dispatch.OperatorResolver;
import io.delta.compute.internal.dispatch.VariantSelector;
import io.delta.compute.options.ArithmeticOptions;
import io.delta.compute.options.CompareOptions;
import io.delta.compute.options.ElementWiseAggregateOptions;
import io.delta.compute.options.NoOptions;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The scalar function entry points. Each constant fixes the arity and the options type of one
 * entry point, for example:
 *
 * <pre>{@code
 * Datum sum = ScalarFunctions.ADD.call(left, right, new ArithmeticOptions(true), context);
 * Datum found = ScalarFunctions.IS_IN.call(values, valueSet, context);
 * }</pre>
 */
@Evolving
public final class ScalarFunctions {
  private ScalarFunctions() {}

  ////////////////
  // Arithmetic //
  ////////////////

  public static final UnaryFunction<ArithmeticOptions> ABS =
      arithmeticUnary("abs", FunctionId.ABS, FunctionId.ABS_CHECKED);
  public static final UnaryFunction<ArithmeticOptions> NEGATE =
      arithmeticUnary("negate", FunctionId.NEGATE, FunctionId.NEGATE_CHECKED);
  public static final BinaryFunction<ArithmeticOptions> ADD =
      arithmeticBinary("add", FunctionId.ADD, FunctionId.ADD_CHECKED);
  public static final BinaryFunction<ArithmeticOptions> SUBTRACT =
      arithmeticBinary("subtract", FunctionId.SUBTRACT, FunctionId.SUBTRACT_CHECKED);
  public static final BinaryFunction<ArithmeticOptions> MULTIPLY =
      arithmeticBinary("multiply", FunctionId.MULTIPLY, FunctionId.MULTIPLY_CHECKED);
  public static final BinaryFunction<ArithmeticOptions> DIVIDE =
      arithmeticBinary("divide", FunctionId.DIVIDE, FunctionId.DIVIDE_CHECKED);
  public static final BinaryFunction<ArithmeticOptions> POWER =
      arithmeticBinary("power", FunctionId.POWER, FunctionId.POWER_CHECKED);

  ////////////////////////////
  // Element-wise aggregate //
  ////////////////////////////

  public static final VarArgsFunction<ElementWiseAggregateOptions> ELEMENT_WISE_MAX =
      elementWiseAggregate("element_wise_max", FunctionId.ELEMENT_WISE_MAX);
  public static final VarArgsFunction<ElementWiseAggregateOptions> ELEMENT_WISE_MIN =
      elementWiseAggregate("element_wise_min", FunctionId.ELEMENT_WISE_MIN);

  ////////////////
  // Set lookup //
  ////////////////

  public static final SetLookupFunction IS_IN = new SetLookupFunction("is_in", FunctionId.IS_IN);
  public static final SetLookupFunction INDEX_IN =
      new SetLookupFunction("index_in", FunctionId.INDEX_IN);

  /////////////
  // Boolean //
  /////////////

  public static final UnaryFunction<NoOptions> INVERT = unary("invert", FunctionId.INVERT);
  public static final BinaryFunction<NoOptions> AND = binary("and", FunctionId.AND);
  public static final BinaryFunction<NoOptions> AND_KLEENE =
      binary("and_kleene", FunctionId.AND_KLEENE);
  public static final BinaryFunction<NoOptions> OR = binary("or", FunctionId.OR);
  public static final BinaryFunction<NoOptions> OR_KLEENE =
      binary("or_kleene", FunctionId.OR_KLEENE);
  public static final BinaryFunction<NoOptions> XOR = binary("xor", FunctionId.XOR);
  public static final BinaryFunction<NoOptions> AND_NOT = binary("and_not", FunctionId.AND_NOT);
  public static final BinaryFunction<NoOptions> AND_NOT_KLEENE =
      binary("and_not_kleene", FunctionId.AND_NOT_KLEENE);

  ////////////////
  // Comparison //
  ////////////////

  public static final BinaryFunction<CompareOptions> COMPARE =
      new BinaryFunction<>(
          "compare",
          CompareOptions.class,
          OperatorResolver.resolver(),
          true /* forwardsOptions */,
          CompareOptions::defaults);

  //////////////
  // Validity //
  //////////////

  public static final UnaryFunction<NoOptions> IS_VALID = unary("is_valid", FunctionId.IS_VALID);
  public static final UnaryFunction<NoOptions> IS_NULL = unary("is_null", FunctionId.IS_NULL);
  public static final UnaryFunction<NoOptions> IS_NAN = unary("is_nan", FunctionId.IS_NAN);
  public static final BinaryFunction<NoOptions> FILL_NULL =
      binary("fill_null", FunctionId.FILL_NULL);
  public static final TernaryFunction<NoOptions> IF_ELSE =
      new TernaryFunction<>(
          "if_else",
          NoOptions.class,
          NameResolver.fixed(FunctionId.IF_ELSE),
          false /* forwardsOptions */,
          () -> NoOptions.INSTANCE);

  //////////////
  // Temporal //
  //////////////

  public static final UnaryFunction<NoOptions> YEAR = unary("year", FunctionId.YEAR);
  public static final UnaryFunction<NoOptions> MONTH = unary("month", FunctionId.MONTH);
  public static final UnaryFunction<NoOptions> DAY = unary("day", FunctionId.DAY);
  public static final UnaryFunction<NoOptions> DAY_OF_WEEK =
      unary("day_of_week", FunctionId.DAY_OF_WEEK);
  public static final UnaryFunction<NoOptions> DAY_OF_YEAR =
      unary("day_of_year", FunctionId.DAY_OF_YEAR);
  public static final UnaryFunction<NoOptions> ISO_YEAR = unary("iso_year", FunctionId.ISO_YEAR);
  public static final UnaryFunction<NoOptions> ISO_WEEK = unary("iso_week", FunctionId.ISO_WEEK);
  public static final UnaryFunction<NoOptions> ISO_CALENDAR =
      unary("iso_calendar", FunctionId.ISO_CALENDAR);
  public static final UnaryFunction<NoOptions> QUARTER = unary("quarter", FunctionId.QUARTER);
  public static final UnaryFunction<NoOptions> HOUR = unary("hour", FunctionId.HOUR);
  public static final UnaryFunction<NoOptions> MINUTE = unary("minute", FunctionId.MINUTE);
  public static final UnaryFunction<NoOptions> SECOND = unary("second", FunctionId.SECOND);
  public static final UnaryFunction<NoOptions> MILLISECOND =
      unary("millisecond", FunctionId.MILLISECOND);
  public static final UnaryFunction<NoOptions> MICROSECOND =
      unary("microsecond", FunctionId.MICROSECOND);
  public static final UnaryFunction<NoOptions> NANOSECOND =
      unary("nanosecond", FunctionId.NANOSECOND);
  public static final UnaryFunction<NoOptions> SUBSECOND =
      unary("subsecond", FunctionId.SUBSECOND);

  private static final List<FunctionBinding<?>> ALL =
      Collections.unmodifiableList(
          new ArrayList<>(
              Arrays.asList(
                  ABS, NEGATE, ADD, SUBTRACT, MULTIPLY, DIVIDE, POWER,
                  ELEMENT_WISE_MAX, ELEMENT_WISE_MIN,
                  IS_IN, INDEX_IN,
                  INVERT, AND, AND_KLEENE, OR, OR_KLEENE, XOR, AND_NOT, AND_NOT_KLEENE,
                  COMPARE,
                  IS_VALID, IS_NULL, IS_NAN, FILL_NULL, IF_ELSE,
                  YEAR, MONTH, DAY, DAY_OF_WEEK, DAY_OF_YEAR, ISO_YEAR, ISO_WEEK, ISO_CALENDAR,
                  QUARTER, HOUR, MINUTE, SECOND, MILLISECOND, MICROSECOND, NANOSECOND,
                  SUBSECOND)));

  /** @return every entry point, in declaration order */
  public static List<FunctionBinding<?>> all() {
    return ALL;
  }

  // Arithmetic consumes its options to pick the variant; kernels don't receive them.
  private static UnaryFunction<ArithmeticOptions> arithmeticUnary(
      String name, FunctionId base, FunctionId checked) {
    return new UnaryFunction<>(
        name,
        ArithmeticOptions.class,
        VariantSelector.checkedVariant(base, checked),
        false /* forwardsOptions */,
        ArithmeticOptions::defaults);
  }

  private static BinaryFunction<ArithmeticOptions> arithmeticBinary(
      String name, FunctionId base, FunctionId checked) {
    return new BinaryFunction<>(
        name,
        ArithmeticOptions.class,
        VariantSelector.checkedVariant(base, checked),
        false /* forwardsOptions */,
        ArithmeticOptions::defaults);
  }

  private static VarArgsFunction<ElementWiseAggregateOptions> elementWiseAggregate(
      String name, FunctionId functionId) {
    return new VarArgsFunction<>(
        name,
        ElementWiseAggregateOptions.class,
        NameResolver.fixed(functionId),
        true /* forwardsOptions */,
        ElementWiseAggregateOptions::defaults);
  }

  private static UnaryFunction<NoOptions> unary(String name, FunctionId functionId) {
    return new UnaryFunction<>(
        name,
        NoOptions.class,
        NameResolver.fixed(functionId),
        false /* forwardsOptions */,
        () -> NoOptions.INSTANCE);
  }

  private static BinaryFunction<NoOptions> binary(String name, FunctionId functionId) {
    return new BinaryFunction<>(
        name,
        NoOptions.class,
        NameResolver.fixed(functionId),
        false /* forwardsOptions */,
        () -> NoOptions.INSTANCE);
  }
}
