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
package io.delta.compute.types;

import io.delta.compute.annotation.Evolving;

/**
 * Base class for all logical data types carried by a {@link io.delta.compute.data.Datum}.
 *
 * <p>Two data types are interchangeable for kernel selection only when they are {@link
 * #equals(Object) equal}; the compute layer never coerces one type into another.
 */
@Evolving
public abstract class DataType {

  /**
   * Returns true iff this data is a nested data type (it is logically parameterized by other
   * types). For example {@link StructType} and {@link DictionaryType} are nested data types.
   */
  public abstract boolean isNested();

  @Override
  public abstract int hashCode();

  @Override
  public abstract boolean equals(Object obj);

  @Override
  public abstract String toString();
}
