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

import io.delta.compute.data.ColumnVector;
import io.delta.compute.data.Datum;
import io.delta.compute.defaults.internal.DefaultComputeErrors;
import io.delta.compute.defaults.internal.data.vector.DefaultGenericVector;
import io.delta.compute.defaults.internal.data.vector.VectorUtils;
import io.delta.compute.options.FunctionOptions;
import io.delta.compute.types.DataType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Utility methods shared by the element-wise kernels. Arguments are read row by row: a scalar
 * argument is broadcast to every row, array and chunked array arguments must all have the same
 * length. The result is a scalar when every argument is a scalar, a chunked array with a single
 * chunk when any argument is chunked, and an array otherwise.
 */
final class KernelUtils {
  private KernelUtils() {}

  /** Computes the value of one result row from the values of the argument rows. */
  @FunctionalInterface
  interface RowFunction {
    Object apply(Object[] values);
  }

  /** Reads the value of an argument at a given row. */
  @FunctionalInterface
  interface ValueReader {
    Object get(int rowId);
  }

  static Datum mapRows(
      String functionName, List<Datum> arguments, DataType resultType, RowFunction function) {
    List<ValueReader> readers = new ArrayList<>(arguments.size());
    for (Datum argument : arguments) {
      readers.add(reader(functionName, argument));
    }
    Object[] values = new Object[arguments.size()];
    int length = resultLength(functionName, arguments);
    if (length < 0) {
      for (int i = 0; i < values.length; i++) {
        values[i] = readers.get(i).get(0);
      }
      return Datum.scalar(resultType, function.apply(values));
    }

    Object[] results = new Object[length];
    for (int rowId = 0; rowId < length; rowId++) {
      for (int i = 0; i < values.length; i++) {
        values[i] = readers.get(i).get(rowId);
      }
      results[rowId] = function.apply(values);
    }
    ColumnVector vector = DefaultGenericVector.fromArray(resultType, results);
    if (anyChunked(arguments)) {
      return Datum.chunkedArray(resultType, Collections.singletonList(vector));
    }
    return Datum.array(vector);
  }

  /** Same as {@link #mapRows} but any null argument value makes the result row null. */
  static Datum mapRowsNullPropagating(
      String functionName, List<Datum> arguments, DataType resultType, RowFunction function) {
    return mapRows(
        functionName,
        arguments,
        resultType,
        values -> {
          for (Object value : values) {
            if (value == null) {
              return null;
            }
          }
          return function.apply(values);
        });
  }

  static ValueReader reader(String functionName, Datum argument) {
    switch (argument.kind()) {
      case SCALAR:
        Object value = argument.getScalarValue();
        return rowId -> value;
      case ARRAY:
      case CHUNKED_ARRAY:
        ColumnVector vector = VectorUtils.asVector(argument);
        return rowId -> VectorUtils.getValueAsObject(vector, rowId);
      default:
        throw DefaultComputeErrors.unsupportedArgumentKind(functionName, argument.kind());
    }
  }

  /** Returns the common length of the array-like arguments, or -1 if all are scalars. */
  static int resultLength(String functionName, List<Datum> arguments) {
    long length = -1;
    boolean mismatch = false;
    List<Long> lengths = new ArrayList<>();
    for (Datum argument : arguments) {
      if (argument.kind() == Datum.Kind.TABLE) {
        throw DefaultComputeErrors.unsupportedArgumentKind(functionName, argument.kind());
      }
      if (argument.isArrayLike()) {
        lengths.add(argument.length());
        if (length < 0) {
          length = argument.length();
        } else if (length != argument.length()) {
          mismatch = true;
        }
      }
    }
    if (mismatch) {
      throw DefaultComputeErrors.lengthMismatch(functionName, lengths);
    }
    return (int) length;
  }

  /** Requires every argument to have the same type, accepted by {@code supported}. */
  static DataType checkSameType(
      String functionName, List<Datum> arguments, Predicate<DataType> supported) {
    for (Datum argument : arguments) {
      if (argument.kind() == Datum.Kind.TABLE) {
        throw DefaultComputeErrors.unsupportedArgumentKind(functionName, argument.kind());
      }
    }
    DataType type = arguments.get(0).getDataType();
    for (Datum argument : arguments) {
      if (!argument.getDataType().equals(type) || !supported.test(argument.getDataType())) {
        throw DefaultComputeErrors.noMatchingKernel(functionName, arguments);
      }
    }
    return type;
  }

  static <O extends FunctionOptions> O requireOptions(
      String functionName, Optional<FunctionOptions> options, Class<O> optionsType) {
    if (!options.isPresent() || !optionsType.isInstance(options.get())) {
      throw DefaultComputeErrors.missingOptions(functionName, optionsType);
    }
    return optionsType.cast(options.get());
  }

  static <O extends FunctionOptions> O optionsOrDefault(
      Optional<FunctionOptions> options, Class<O> optionsType, O defaultOptions) {
    if (options.isPresent() && optionsType.isInstance(options.get())) {
      return optionsType.cast(options.get());
    }
    return defaultOptions;
  }

  private static boolean anyChunked(List<Datum> arguments) {
    for (Datum argument : arguments) {
      if (argument.kind() == Datum.Kind.CHUNKED_ARRAY) {
        return true;
      }
    }
    return false;
  }

  /** Compares two non-null values of the same comparable type. */
  @SuppressWarnings("unchecked")
  static int compareValues(Object left, Object right) {
    if (left instanceof byte[]) {
      byte[] a = (byte[]) left;
      byte[] b = (byte[]) right;
      int n = Math.min(a.length, b.length);
      for (int i = 0; i < n; i++) {
        int cmp = Integer.compare(a[i] & 0xFF, b[i] & 0xFF);
        if (cmp != 0) {
          return cmp;
        }
      }
      return Integer.compare(a.length, b.length);
    }
    return ((Comparable<Object>) left).compareTo(right);
  }
}
