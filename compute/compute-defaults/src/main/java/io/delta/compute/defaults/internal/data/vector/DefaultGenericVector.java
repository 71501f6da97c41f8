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
package io.delta.compute.defaults.internal.data.vector;

import static io.delta.compute.internal.util.Preconditions.checkArgument;

import io.delta.compute.data.ColumnVector;
import io.delta.compute.types.*;
import java.util.List;
import java.util.function.Function;

/** Generic column vector implementation to expose an array of objects as a column vector. */
public class DefaultGenericVector implements ColumnVector {

  public static DefaultGenericVector fromArray(DataType dataType, Object[] elements) {
    return new DefaultGenericVector(elements.length, dataType, rowId -> elements[rowId]);
  }

  public static DefaultGenericVector fromList(DataType dataType, List<?> elements) {
    return new DefaultGenericVector(elements.size(), dataType, elements::get);
  }

  private final int size;
  private final DataType dataType;
  private final Function<Integer, Object> rowIdToValueAccessor;

  protected DefaultGenericVector(
      int size, DataType dataType, Function<Integer, Object> rowIdToValueAccessor) {
    checkArgument(size >= 0, "invalid size: %s", size);
    checkArgument(
        !(dataType instanceof DictionaryType),
        "dictionary vectors must be created with DefaultDictionaryVector");
    this.size = size;
    this.dataType = dataType;
    this.rowIdToValueAccessor = rowIdToValueAccessor;
  }

  @Override
  public DataType getDataType() {
    return dataType;
  }

  @Override
  public int getSize() {
    return size;
  }

  @Override
  public void close() {}

  @Override
  public boolean isNullAt(int rowId) {
    assertValidRowId(rowId);
    return rowIdToValueAccessor.apply(rowId) == null;
  }

  @Override
  public boolean getBoolean(int rowId) {
    assertValidRowId(rowId);
    throwIfUnsafeAccess(BooleanType.class, "boolean");
    return (boolean) rowIdToValueAccessor.apply(rowId);
  }

  @Override
  public byte getByte(int rowId) {
    assertValidRowId(rowId);
    throwIfUnsafeAccess(ByteType.class, "byte");
    return (byte) rowIdToValueAccessor.apply(rowId);
  }

  @Override
  public short getShort(int rowId) {
    assertValidRowId(rowId);
    throwIfUnsafeAccess(ShortType.class, "short");
    return (short) rowIdToValueAccessor.apply(rowId);
  }

  @Override
  public int getInt(int rowId) {
    assertValidRowId(rowId);
    throwIfUnsafeAccess(IntegerType.class, DateType.class, "int");
    return (int) rowIdToValueAccessor.apply(rowId);
  }

  @Override
  public long getLong(int rowId) {
    assertValidRowId(rowId);
    throwIfUnsafeAccess(LongType.class, TimestampType.class, "long");
    return (long) rowIdToValueAccessor.apply(rowId);
  }

  @Override
  public float getFloat(int rowId) {
    assertValidRowId(rowId);
    throwIfUnsafeAccess(FloatType.class, "float");
    return (float) rowIdToValueAccessor.apply(rowId);
  }

  @Override
  public double getDouble(int rowId) {
    assertValidRowId(rowId);
    throwIfUnsafeAccess(DoubleType.class, "double");
    return (double) rowIdToValueAccessor.apply(rowId);
  }

  @Override
  public String getString(int rowId) {
    assertValidRowId(rowId);
    throwIfUnsafeAccess(StringType.class, "string");
    return (String) rowIdToValueAccessor.apply(rowId);
  }

  @Override
  public byte[] getBinary(int rowId) {
    assertValidRowId(rowId);
    throwIfUnsafeAccess(BinaryType.class, "binary");
    return (byte[]) rowIdToValueAccessor.apply(rowId);
  }

  /** Rows of a struct vector are lists holding one value per field. */
  @Override
  public ColumnVector getChild(int ordinal) {
    throwIfUnsafeAccess(StructType.class, "struct");
    StructType structType = (StructType) dataType;
    return new DefaultGenericVector(
        getSize(),
        structType.at(ordinal).getDataType(),
        rowId -> {
          List<?> row = (List<?>) rowIdToValueAccessor.apply(rowId);
          return row == null ? null : row.get(ordinal);
        });
  }

  private void throwIfUnsafeAccess(Class<? extends DataType> expDataType, String accessType) {
    if (!expDataType.isAssignableFrom(dataType.getClass())) {
      String msg =
          String.format(
              "Trying to access a `%s` value from vector of type `%s`", accessType, dataType);
      throw new UnsupportedOperationException(msg);
    }
  }

  private void throwIfUnsafeAccess(
      Class<? extends DataType> expDataType1,
      Class<? extends DataType> expDataType2,
      String accessType) {
    if (!(expDataType1.isAssignableFrom(dataType.getClass())
        || expDataType2.isAssignableFrom(dataType.getClass()))) {
      String msg =
          String.format(
              "Trying to access a `%s` value from vector of type `%s`", accessType, dataType);
      throw new UnsupportedOperationException(msg);
    }
  }

  private void assertValidRowId(int rowId) {
    checkArgument(
        rowId >= 0 && rowId < size, "Invalid rowId: %s, max allowed: %s", rowId, size - 1);
  }
}
