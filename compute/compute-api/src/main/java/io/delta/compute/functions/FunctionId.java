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

/**
 * Identifier of every function the compute layer can dispatch to. The registry name is the key
 * used to look the kernel up in a {@link io.delta.compute.engine.FunctionRegistry}.
 */
@Evolving
public enum FunctionId {
  // Arithmetic
  ABS("abs", Arity.UNARY),
  ABS_CHECKED("abs_checked", Arity.UNARY),
  NEGATE("negate", Arity.UNARY),
  NEGATE_CHECKED("negate_checked", Arity.UNARY),
  ADD("add", Arity.BINARY),
  ADD_CHECKED("add_checked", Arity.BINARY),
  SUBTRACT("subtract", Arity.BINARY),
  SUBTRACT_CHECKED("subtract_checked", Arity.BINARY),
  MULTIPLY("multiply", Arity.BINARY),
  MULTIPLY_CHECKED("multiply_checked", Arity.BINARY),
  DIVIDE("divide", Arity.BINARY),
  DIVIDE_CHECKED("divide_checked", Arity.BINARY),
  POWER("power", Arity.BINARY),
  POWER_CHECKED("power_checked", Arity.BINARY),

  // Element-wise aggregate
  ELEMENT_WISE_MAX("element_wise_max", Arity.VARARGS),
  ELEMENT_WISE_MIN("element_wise_min", Arity.VARARGS),

  // Set lookup
  IS_IN("is_in", Arity.UNARY),
  INDEX_IN("index_in", Arity.UNARY),

  // Boolean
  INVERT("invert", Arity.UNARY),
  AND("and", Arity.BINARY),
  AND_KLEENE("and_kleene", Arity.BINARY),
  OR("or", Arity.BINARY),
  OR_KLEENE("or_kleene", Arity.BINARY),
  XOR("xor", Arity.BINARY),
  AND_NOT("and_not", Arity.BINARY),
  AND_NOT_KLEENE("and_not_kleene", Arity.BINARY),

  // Comparison
  EQUAL("equal", Arity.BINARY),
  NOT_EQUAL("not_equal", Arity.BINARY),
  GREATER("greater", Arity.BINARY),
  GREATER_EQUAL("greater_equal", Arity.BINARY),
  LESS("less", Arity.BINARY),
  LESS_EQUAL("less_equal", Arity.BINARY),

  // Validity
  IS_VALID("is_valid", Arity.UNARY),
  IS_NULL("is_null", Arity.UNARY),
  IS_NAN("is_nan", Arity.UNARY),
  FILL_NULL("fill_null", Arity.BINARY),
  IF_ELSE("if_else", Arity.TERNARY),

  // Temporal
  YEAR("year", Arity.UNARY),
  MONTH("month", Arity.UNARY),
  DAY("day", Arity.UNARY),
  DAY_OF_WEEK("day_of_week", Arity.UNARY),
  DAY_OF_YEAR("day_of_year", Arity.UNARY),
  ISO_YEAR("iso_year", Arity.UNARY),
  ISO_WEEK("iso_week", Arity.UNARY),
  ISO_CALENDAR("iso_calendar", Arity.UNARY),
  QUARTER("quarter", Arity.UNARY),
  HOUR("hour", Arity.UNARY),
  MINUTE("minute", Arity.UNARY),
  SECOND("second", Arity.UNARY),
  MILLISECOND("millisecond", Arity.UNARY),
  MICROSECOND("microsecond", Arity.UNARY),
  NANOSECOND("nanosecond", Arity.UNARY),
  SUBSECOND("subsecond", Arity.UNARY);

  private final String registryName;
  private final Arity arity;

  FunctionId(String registryName, Arity arity) {
    this.registryName = registryName;
    this.arity = arity;
  }

  /** @return the name the kernel is registered under */
  public String getRegistryName() {
    return registryName;
  }

  public Arity getArity() {
    return arity;
  }

  @Override
  public String toString() {
    return registryName;
  }
}
