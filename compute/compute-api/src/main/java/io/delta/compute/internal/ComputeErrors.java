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
package io.delta.compute.internal;

import static java.lang.String.format;

import io.delta.compute.data.Datum;
import io.delta.compute.exceptions.FunctionNotFoundException;
import io.delta.compute.exceptions.InvalidArgumentException;
import io.delta.compute.types.DataType;

/** Contains methods to create user-facing compute exceptions. */
public final class ComputeErrors {
  private ComputeErrors() {}

  public static InvalidArgumentException setLookupValueSetNotArrayLike(Datum valueSet) {
    return new InvalidArgumentException(
        format("Set lookup value set must be Array or ChunkedArray, got %s", valueSet.kind()));
  }

  public static InvalidArgumentException setLookupTypeMismatch(
      DataType probeType, DataType valueSetType) {
    return new InvalidArgumentException(
        format(
            "Array type didn't match type of values set: %s vs %s", probeType, valueSetType));
  }

  public static FunctionNotFoundException functionNotFound(String functionName) {
    return new FunctionNotFoundException(
        functionName,
        format("No function registered with name: %s", functionName));
  }
}
