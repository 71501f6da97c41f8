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

import io.delta.compute.data.Datum;
import io.delta.compute.defaults.engine.DefaultFunctionRegistry;
import io.delta.compute.defaults.internal.DefaultComputeErrors;
import io.delta.compute.functions.FunctionId;
import io.delta.compute.types.BooleanType;
import io.delta.compute.types.DataType;
import io.delta.compute.types.DictionaryType;
import java.util.Arrays;
import java.util.List;

/** Kernels of the null and NaN handling functions. */
final class ValidityKernels {
  private ValidityKernels() {}

  static void registerAll(DefaultFunctionRegistry registry) {
    registry.register(
        FunctionId.IS_VALID,
        (arguments, options, context) ->
            KernelUtils.mapRows(
                FunctionId.IS_VALID.getRegistryName(),
                arguments,
                BooleanType.BOOLEAN,
                values -> values[0] != null));

    registry.register(
        FunctionId.IS_NULL,
        (arguments, options, context) ->
            KernelUtils.mapRows(
                FunctionId.IS_NULL.getRegistryName(),
                arguments,
                BooleanType.BOOLEAN,
                values -> values[0] == null));

    registry.register(
        FunctionId.IS_NAN,
        (arguments, options, context) -> {
          String name = FunctionId.IS_NAN.getRegistryName();
          KernelUtils.checkSameType(name, arguments, ArithmeticKernels::isFloating);
          return KernelUtils.mapRowsNullPropagating(
              name,
              arguments,
              BooleanType.BOOLEAN,
              values -> Double.isNaN(((Number) values[0]).doubleValue()));
        });

    registry.register(
        FunctionId.FILL_NULL,
        (arguments, options, context) -> {
          String name = FunctionId.FILL_NULL.getRegistryName();
          DataType type = KernelUtils.checkSameType(name, arguments, ValidityKernels::isPlain);
          return KernelUtils.mapRows(
              name, arguments, type, values -> values[0] != null ? values[0] : values[1]);
        });

    registry.register(
        FunctionId.IF_ELSE,
        (arguments, options, context) -> {
          String name = FunctionId.IF_ELSE.getRegistryName();
          if (!(arguments.get(0).getDataType() instanceof BooleanType)) {
            throw DefaultComputeErrors.noMatchingKernel(name, arguments);
          }
          List<Datum> branches = Arrays.asList(arguments.get(1), arguments.get(2));
          DataType type = KernelUtils.checkSameType(name, branches, ValidityKernels::isPlain);
          return KernelUtils.mapRows(
              name,
              arguments,
              type,
              values -> {
                if (values[0] == null) {
                  return null;
                }
                return (Boolean) values[0] ? values[1] : values[2];
              });
        });
  }

  /** Types whose values are carried over as they are into the result. */
  private static boolean isPlain(DataType type) {
    return !(type instanceof DictionaryType);
  }
}
