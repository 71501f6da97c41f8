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
package io.delta.compute.defaults.internal.kernels;

import io.delta.compute.defaults.engine.DefaultFunctionRegistry;
import io.delta.compute.engine.Kernel;
import io.delta.compute.functions.FunctionId;
import io.delta.compute.options.CompareOperator;
import io.delta.compute.types.*;
import java.util.function.IntPredicate;

/**
 * Kernels of the comparison functions. A null operand yields a null result.
 *
 * <p>Floating point operands follow IEEE 754: NaN is unordered, so every comparison involving
 * NaN is false except {@code not_equal}, and {@code 0.0} equals {@code -0.0}. Other types are
 * ordered by {@link KernelUtils#compareValues}.
 */
final class ComparisonKernels {
  private ComparisonKernels() {}

  /** A comparison function with its test on an ordering result and on two doubles. */
  enum Comparison {
    EQUAL(CompareOperator.EQUAL, cmp -> cmp == 0, (l, r) -> l == r),
    NOT_EQUAL(CompareOperator.NOT_EQUAL, cmp -> cmp != 0, (l, r) -> l != r),
    GREATER(CompareOperator.GREATER, cmp -> cmp > 0, (l, r) -> l > r),
    GREATER_EQUAL(CompareOperator.GREATER_EQUAL, cmp -> cmp >= 0, (l, r) -> l >= r),
    LESS(CompareOperator.LESS, cmp -> cmp < 0, (l, r) -> l < r),
    LESS_EQUAL(CompareOperator.LESS_EQUAL, cmp -> cmp <= 0, (l, r) -> l <= r);

    private final CompareOperator operator;
    private final IntPredicate ordered;
    private final DoubleComparison floating;

    Comparison(CompareOperator operator, IntPredicate ordered, DoubleComparison floating) {
      this.operator = operator;
      this.ordered = ordered;
      this.floating = floating;
    }

    CompareOperator getOperator() {
      return operator;
    }

    boolean test(Object left, Object right) {
      if (left instanceof Double || left instanceof Float) {
        return floating.test(((Number) left).doubleValue(), ((Number) right).doubleValue());
      }
      return ordered.test(KernelUtils.compareValues(left, right));
    }
  }

  @FunctionalInterface
  interface DoubleComparison {
    boolean test(double left, double right);
  }

  static void registerAll(DefaultFunctionRegistry registry) {
    for (Comparison comparison : Comparison.values()) {
      FunctionId functionId = comparison.getOperator().getFunctionId();
      registry.register(functionId, comparisonKernel(functionId.getRegistryName(), comparison));
    }
  }

  static Kernel comparisonKernel(String name, Comparison comparison) {
    return (arguments, options, context) -> {
      KernelUtils.checkSameType(name, arguments, ComparisonKernels::isComparable);
      return KernelUtils.mapRowsNullPropagating(
          name,
          arguments,
          BooleanType.BOOLEAN,
          values -> comparison.test(values[0], values[1]));
    };
  }

  static boolean isComparable(DataType type) {
    return ArithmeticKernels.isNumeric(type)
        || type instanceof BooleanType
        || type instanceof StringType
        || type instanceof BinaryType
        || type instanceof DateType
        || type instanceof TimestampType;
  }
}
