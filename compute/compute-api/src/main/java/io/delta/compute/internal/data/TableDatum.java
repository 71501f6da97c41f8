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

import io.delta.compute.data.ColumnarBatch;
import io.delta.compute.data.Datum;
import io.delta.compute.types.DataType;

/** A datum wrapping a {@link ColumnarBatch}; its data type is the batch schema. */
public class TableDatum implements Datum {
  private final ColumnarBatch batch;

  public TableDatum(ColumnarBatch batch) {
    this.batch = requireNonNull(batch, "batch is null");
  }

  @Override
  public Kind kind() {
    return Kind.TABLE;
  }

  @Override
  public DataType getDataType() {
    return batch.getSchema();
  }

  @Override
  public long length() {
    return batch.getSize();
  }

  @Override
  public ColumnarBatch getTable() {
    return batch;
  }

  @Override
  public String toString() {
    return String.format("Table<%s>[%s]", getDataType(), length());
  }
}
