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
package io.delta.compute.internal.data;

import static java.util.Objects.requireNonNull;

import io.delta.compute.data.ColumnVector;
import io.delta.compute.data.Datum;
import io.delta.compute.types.DataType;

/** A datum backed by a single contiguous {@link ColumnVector}. */
public class ArrayDatum implements Datum {
  private final ColumnVector vector;

  public ArrayDatum(ColumnVector vector) {
    this.vector = requireNonNull(vector, "vector is null");
  }

  @Override
  public Kind kind() {
    return Kind.ARRAY;
  }

  @Override
  public DataType getDataType() {
    return vector.getDataType();
  }

  @Override
  public long length() {
    return vector.getSize();
  }

  @Override
  public ColumnVector getArray() {
    return vector;
  }

  @Override
  public String toString() {
    return String.format("Array<%s>[%s]", getDataType(), length());
  }
}
