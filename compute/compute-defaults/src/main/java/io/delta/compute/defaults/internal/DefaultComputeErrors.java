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
package io.delta.compute.defaults.internal;

import static java.lang.String.format;

import io.delta.compute.data.Datum;
import io.delta.compute.exceptions.InvalidArgumentException;
import io.delta.compute.exceptions.KernelExecutionException;
import java.util.List;
import java.util.stream.Collectors;

public class DefaultComputeErrors {

  /**
   * Exception for when a function has no kernel for the given argument types.
   *
   * @param functionName registry name of the function
   * @param arguments the arguments of the call
   */
  public static KernelExecutionException noMatchingKernel(
      String functionName, List<Datum> arguments) {
    String types =
        arguments.stream()
            .map(arg -> arg.getDataType().toString())
            .collect(Collectors.joining(", "));
    return new KernelExecutionException(
        functionName,
        format("Function %s has no kernel matching input types (%s)", functionName, types));
  }

  public static KernelExecutionException unsupportedArgumentKind(
      String functionName, Datum.Kind kind) {
    return new KernelExecutionException(
        functionName, format("Function %s does not accept %s arguments", functionName, kind));
  }

  public static KernelExecutionException lengthMismatch(String functionName, List<Long> lengths) {
    return new KernelExecutionException(
        functionName,
        format(
            "Array arguments of %s must all have the same length, got %s", functionName, lengths));
  }

  public static KernelExecutionException overflow(String functionName) {
    return new KernelExecutionException(functionName, format("%s: overflow", functionName));
  }

  public static KernelExecutionException divideByZero(String functionName) {
    return new KernelExecutionException(functionName, format("%s: divide by zero", functionName));
  }

  public static KernelExecutionException negativePower(String functionName) {
    return new KernelExecutionException(
        functionName,
        format(
            "%s: integers to negative integer powers are not allowed", functionName));
  }

  public static InvalidArgumentException missingOptions(
      String functionName, Class<?> optionsType) {
    return new InvalidArgumentException(
        format(
            "Function %s requires options of type %s",
            functionName,
            optionsType.getSimpleName()));
  }

  public static InvalidArgumentException invalidTimeZone(String timeZone, Exception cause) {
    InvalidArgumentException e =
        new InvalidArgumentException(format("Invalid time zone: %s", timeZone));
    e.initCause(cause);
    return e;
  }
}
