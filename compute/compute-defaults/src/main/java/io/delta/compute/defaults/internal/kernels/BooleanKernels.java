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
import io.delta.compute.types.BooleanType;
import io.delta.compute.types.DataType;

/**
 * Kernels of the boolean functions. The plain variants return null when any operand is null. The
 * Kleene variants follow three-valued logic: {@code false and null} is false and {@code true or
 * null} is true.
 */
final class BooleanKernels {
  private BooleanKernels() {}

  static void registerAll(DefaultFunctionRegistry registry) {
    registry.register(
        FunctionId.INVERT,
        kernel(FunctionId.INVERT, values -> !(Boolean) values[0], true /* nullPropagating */));
    registry.register(
        FunctionId.AND,
        kernel(FunctionId.AND, values -> (Boolean) values[0] && (Boolean) values[1], true));
    registry.register(
        FunctionId.OR,
        kernel(FunctionId.OR, values -> (Boolean) values[0] || (Boolean) values[1], true));
    registry.register(
        FunctionId.XOR,
        kernel(FunctionId.XOR, values -> (Boolean) values[0] ^ (Boolean) values[1], true));
    registry.register(
        FunctionId.AND_NOT,
        kernel(FunctionId.AND_NOT, values -> (Boolean) values[0] && !(Boolean) values[1], true));
    registry.register(
        FunctionId.AND_KLEENE,
        kernel(FunctionId.AND_KLEENE, values -> andKleene(values[0], values[1]), false));
    registry.register(
        FunctionId.OR_KLEENE,
        kernel(FunctionId.OR_KLEENE, values -> orKleene(values[0], values[1]), false));
    registry.register(
        FunctionId.AND_NOT_KLEENE,
        kernel(
            FunctionId.AND_NOT_KLEENE,
            values -> andKleene(values[0], values[1] == null ? null : !(Boolean) values[1]),
            false));
  }

  static Boolean andKleene(Object left, Object right) {
    if (Boolean.FALSE.equals(left) || Boolean.FALSE.equals(right)) {
      return false;
    }
    if (left == null || right == null) {
      return null;
    }
    return true;
  }

  static Boolean orKleene(Object left, Object right) {
    if (Boolean.TRUE.equals(left) || Boolean.TRUE.equals(right)) {
      return true;
    }
    if (left == null || right == null) {
      return null;
    }
    return false;
  }

  private static Kernel kernel(
      FunctionId functionId, KernelUtils.RowFunction function, boolean nullPropagating) {
    String name = functionId.getRegistryName();
    return (arguments, options, context) -> {
      KernelUtils.checkSameType(name, arguments, BooleanKernels::isBoolean);
      if (nullPropagating) {
        return KernelUtils.mapRowsNullPropagating(name, arguments, BooleanType.BOOLEAN, function);
      }
      return KernelUtils.mapRows(name, arguments, BooleanType.BOOLEAN, function);
    };
  }

  private static boolean isBoolean(DataType type) {
    return type instanceof BooleanType;
  }
}
