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
import io.delta.compute.options.ElementWiseAggregateOptions;
import io.delta.compute.types.DataType;

/**
 * Kernels of {@code element_wise_max} and {@code element_wise_min}. When nulls are skipped, a row
 * is null only if all its values are null; otherwise any null value makes the row null. NaN is
 * taken over null but never over a valid number.
 */
final class ElementWiseAggregateKernels {
  private ElementWiseAggregateKernels() {}

  static void registerAll(DefaultFunctionRegistry registry) {
    registry.register(FunctionId.ELEMENT_WISE_MAX, kernel(FunctionId.ELEMENT_WISE_MAX, true));
    registry.register(FunctionId.ELEMENT_WISE_MIN, kernel(FunctionId.ELEMENT_WISE_MIN, false));
  }

  private static Kernel kernel(FunctionId functionId, boolean max) {
    String name = functionId.getRegistryName();
    return (arguments, options, context) -> {
      ElementWiseAggregateOptions aggregateOptions =
          KernelUtils.optionsOrDefault(
              options,
              ElementWiseAggregateOptions.class,
              ElementWiseAggregateOptions.defaults());
      DataType type =
          KernelUtils.checkSameType(name, arguments, ComparisonKernels::isComparable);
      boolean skipNulls = aggregateOptions.isSkipNulls();
      return KernelUtils.mapRows(
          name,
          arguments,
          type,
          values -> {
            Object result = null;
            for (Object value : values) {
              if (value == null) {
                if (!skipNulls) {
                  return null;
                }
              } else if (result == null || isBetter(value, result, max)) {
                result = value;
              }
            }
            return result;
          });
    };
  }

  private static boolean isBetter(Object candidate, Object current, boolean max) {
    if (isNaN(candidate)) {
      return false;
    }
    if (isNaN(current)) {
      return true;
    }
    int cmp = KernelUtils.compareValues(candidate, current);
    return max ? cmp > 0 : cmp < 0;
  }

  private static boolean isNaN(Object value) {
    return (value instanceof Float && ((Float) value).isNaN())
        || (value instanceof Double && ((Double) value).isNaN());
  }
}
