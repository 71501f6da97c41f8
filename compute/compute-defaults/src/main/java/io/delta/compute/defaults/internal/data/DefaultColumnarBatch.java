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
package io.delta.compute.defaults.internal.data;

import static io.delta.compute.internal.util.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import io.delta.compute.data.ColumnVector;
import io.delta.compute.data.ColumnarBatch;
import io.delta.compute.types.StructType;
import java.util.ArrayList;
import java.util.List;

/** {@link ColumnarBatch} over a list of column vectors of equal size. */
public class DefaultColumnarBatch implements ColumnarBatch {
  private final StructType schema;
  private final List<ColumnVector> columnVectors;
  private final int size;

  public DefaultColumnarBatch(int size, StructType schema, List<ColumnVector> columnVectors) {
    this.schema = requireNonNull(schema, "schema is null");
    this.columnVectors = new ArrayList<>(requireNonNull(columnVectors, "columnVectors is null"));
    checkArgument(
        schema.length() == columnVectors.size(),
        "schema has %s fields but %s vectors were given",
        schema.length(),
        columnVectors.size());
    for (int i = 0; i < columnVectors.size(); i++) {
      ColumnVector vector = columnVectors.get(i);
      checkArgument(
          vector.getSize() == size,
          "vector %s has %s rows, expected %s",
          i,
          vector.getSize(),
          size);
      checkArgument(
          vector.getDataType().equals(schema.at(i).getDataType()),
          "vector %s has type %s, schema declares %s",
          i,
          vector.getDataType(),
          schema.at(i).getDataType());
    }
    this.size = size;
  }

  @Override
  public StructType getSchema() {
    return schema;
  }

  @Override
  public ColumnVector getColumnVector(int ordinal) {
    checkArgument(
        ordinal >= 0 && ordinal < columnVectors.size(), "invalid column ordinal: %s", ordinal);
    return columnVectors.get(ordinal);
  }

  @Override
  public int getSize() {
    return size;
  }
}
