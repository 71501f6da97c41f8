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
package io.delta.compute.data;

import io.delta.compute.annotation.Evolving;
import io.delta.compute.internal.data.ArrayDatum;
import io.delta.compute.internal.data.ChunkedArrayDatum;
import io.delta.compute.internal.data.ScalarDatum;
import io.delta.compute.internal.data.TableDatum;
import io.delta.compute.types.DataType;
import java.util.List;

/**
 * A value passed to or returned from a compute function: a single scalar, a flat array, a chunked
 * array or a table. Every datum carries a logical {@link DataType}; the data type of a table is its
 * schema.
 *
 * <p>Datums are owned by the caller. Functions only read their arguments for the duration of a
 * call.
 */
@Evolving
public interface Datum {

  /** The closed set of datum shapes. */
  enum Kind {
    SCALAR,
    ARRAY,
    CHUNKED_ARRAY,
    TABLE
  }

  /** @return the shape of this datum */
  Kind kind();

  /** @return the logical type of the values held by this datum */
  DataType getDataType();

  /**
   * The number of values held: 1 for a scalar, the number of rows for everything else.
   *
   * @return the length of this datum
   */
  long length();

  /** @return true iff this datum is an {@link Kind#ARRAY} or a {@link Kind#CHUNKED_ARRAY}. */
  default boolean isArrayLike() {
    return kind() == Kind.ARRAY || kind() == Kind.CHUNKED_ARRAY;
  }

  /**
   * @return the value of a {@link Kind#SCALAR} datum, {@code null} for a null scalar
   * @throws UnsupportedOperationException if this datum is not a scalar
   */
  default Object getScalarValue() {
    throw new UnsupportedOperationException("Not a scalar datum: " + this);
  }

  /**
   * @return the vector of an {@link Kind#ARRAY} datum
   * @throws UnsupportedOperationException if this datum is not an array
   */
  default ColumnVector getArray() {
    throw new UnsupportedOperationException("Not an array datum: " + this);
  }

  /**
   * @return the chunks of a {@link Kind#CHUNKED_ARRAY} datum
   * @throws UnsupportedOperationException if this datum is not a chunked array
   */
  default List<ColumnVector> getChunks() {
    throw new UnsupportedOperationException("Not a chunked array datum: " + this);
  }

  /**
   * @return the batch of a {@link Kind#TABLE} datum
   * @throws UnsupportedOperationException if this datum is not a table
   */
  default ColumnarBatch getTable() {
    throw new UnsupportedOperationException("Not a table datum: " + this);
  }

  /**
   * Create a scalar datum. See {@link ScalarDatum} for the Java representation of each type.
   *
   * @param dataType type of the scalar
   * @param value value of the scalar, {@code null} for a null scalar
   */
  static Datum scalar(DataType dataType, Object value) {
    return new ScalarDatum(dataType, value);
  }

  /** Create a null scalar of the given type. */
  static Datum nullScalar(DataType dataType) {
    return new ScalarDatum(dataType, null);
  }

  /** Wrap a column vector as an array datum. */
  static Datum array(ColumnVector vector) {
    return new ArrayDatum(vector);
  }

  /**
   * Create a chunked array datum. The type is given explicitly so that a chunked array with no
   * chunks is still typed.
   */
  static Datum chunkedArray(DataType dataType, List<ColumnVector> chunks) {
    return new ChunkedArrayDatum(dataType, chunks);
  }

  /** Wrap a columnar batch as a table datum. */
  static Datum table(ColumnarBatch batch) {
    return new TableDatum(batch);
  }
}
