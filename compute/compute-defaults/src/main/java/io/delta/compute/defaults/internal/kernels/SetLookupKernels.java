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
import io.delta.compute.defaults.internal.data.vector.VectorUtils;
import io.delta.compute.engine.Kernel;
import io.delta.compute.functions.FunctionId;
import io.delta.compute.options.SetLookupOptions;
import io.delta.compute.types.BooleanType;
import io.delta.compute.types.IntegerType;
import java.nio.ByteBuffer;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Kernels of {@code is_in} and {@code index_in}. A dictionary encoded probe is looked up by its
 * decoded values. A null probe value matches a null in the value set unless nulls are skipped.
 */
final class SetLookupKernels {
  private SetLookupKernels() {}

  static void registerAll(DefaultFunctionRegistry registry) {
    registry.register(FunctionId.IS_IN, isInKernel());
    registry.register(FunctionId.INDEX_IN, indexInKernel());
  }

  static Kernel isInKernel() {
    String name = FunctionId.IS_IN.getRegistryName();
    return (arguments, options, context) -> {
      SetLookupOptions lookupOptions =
          KernelUtils.requireOptions(name, options, SetLookupOptions.class);
      ValueSet valueSet = ValueSet.of(lookupOptions.getValueSet());
      boolean skipNulls = lookupOptions.isSkipNulls();
      return KernelUtils.mapRows(
          name,
          arguments,
          BooleanType.BOOLEAN,
          values -> {
            if (values[0] == null) {
              return !skipNulls && valueSet.nullIndex >= 0;
            }
            return valueSet.indexOf(values[0]) >= 0;
          });
    };
  }

  static Kernel indexInKernel() {
    String name = FunctionId.INDEX_IN.getRegistryName();
    return (arguments, options, context) -> {
      SetLookupOptions lookupOptions =
          KernelUtils.requireOptions(name, options, SetLookupOptions.class);
      ValueSet valueSet = ValueSet.of(lookupOptions.getValueSet());
      boolean skipNulls = lookupOptions.isSkipNulls();
      return KernelUtils.mapRows(
          name,
          arguments,
          IntegerType.INTEGER,
          values -> {
            int index;
            if (values[0] == null) {
              index = skipNulls ? -1 : valueSet.nullIndex;
            } else {
              index = valueSet.indexOf(values[0]);
            }
            return index < 0 ? null : index;
          });
    };
  }

  /** Position of the first occurrence of every distinct value of a value set. */
  private static final class ValueSet {
    private final Map<Object, Integer> firstIndex = new HashMap<>();
    private int nullIndex = -1;

    static ValueSet of(Datum values) {
      ValueSet valueSet = new ValueSet();
      List<Object> elements = VectorUtils.toJavaList(values);
      for (int i = 0; i < elements.size(); i++) {
        Object element = elements.get(i);
        if (element == null) {
          if (valueSet.nullIndex < 0) {
            valueSet.nullIndex = i;
          }
        } else {
          valueSet.firstIndex.putIfAbsent(key(element), i);
        }
      }
      return valueSet;
    }

    int indexOf(Object value) {
      Integer index = firstIndex.get(key(value));
      return index == null ? -1 : index;
    }

    // byte[] has identity equality
    private static Object key(Object value) {
      return value instanceof byte[] ? ByteBuffer.wrap((byte[]) value) : value;
    }
  }
}
