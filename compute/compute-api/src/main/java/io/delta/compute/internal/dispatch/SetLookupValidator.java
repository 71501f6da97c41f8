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
package io.delta.compute.internal.dispatch;

import static java.util.Objects.requireNonNull;

import io.delta.compute.data.Datum;
import io.delta.compute.exceptions.InvalidArgumentException;
import io.delta.compute.internal.ComputeErrors;
import io.delta.compute.options.SetLookupOptions;
import io.delta.compute.types.DataType;
import io.delta.compute.types.DictionaryType;

/**
 * Checks a set lookup call ({@code is_in}, {@code index_in}) before it is dispatched.
 *
 * <ul>
 *   <li>the value set must be an array or a chunked array
 *   <li>a dictionary encoded probe is compared by its decoded value type
 *   <li>a non-empty value set must have exactly the probe's comparison type
 * </ul>
 *
 * An empty value set is accepted for a probe of any type: nothing is a member of it.
 */
public final class SetLookupValidator {
  private SetLookupValidator() {}

  /**
   * @param probe values looked up in the value set
   * @param options options of the call
   * @throws InvalidArgumentException if the call is rejected
   */
  public static void validate(Datum probe, SetLookupOptions options) {
    requireNonNull(probe, "probe is null");
    Datum valueSet = requireNonNull(options, "options is null").getValueSet();
    if (!valueSet.isArrayLike()) {
      throw ComputeErrors.setLookupValueSetNotArrayLike(valueSet);
    }
    DataType comparisonType = comparisonType(probe.getDataType());
    if (valueSet.length() > 0 && !comparisonType.equals(valueSet.getDataType())) {
      throw ComputeErrors.setLookupTypeMismatch(comparisonType, valueSet.getDataType());
    }
  }

  /** @return the value type of a dictionary type, the type itself otherwise */
  public static DataType comparisonType(DataType probeType) {
    if (probeType instanceof DictionaryType) {
      return ((DictionaryType) probeType).getValueType();
    }
    return probeType;
  }
}
