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

import io.delta.compute.data.ColumnVector;
import io.delta.compute.data.Datum;
import io.delta.compute.types.*;
import java.util.ArrayList;
import java.util.List;

public final class VectorUtils {

  private VectorUtils() {}

  /**
   * Returns the value of the given row in the Java representation used by scalar datums.
   * Dictionary encoded rows are decoded and struct rows are returned as a list of field values.
   */
  public static Object getValueAsObject(ColumnVector columnVector, int rowId) {
    if (columnVector.isNullAt(rowId)) {
      return null;
    }
    DataType dataType = columnVector.getDataType();
    if (dataType instanceof BooleanType) {
      return columnVector.getBoolean(rowId);
    } else if (dataType instanceof ByteType) {
      return columnVector.getByte(rowId);
    } else if (dataType instanceof ShortType) {
      return columnVector.getShort(rowId);
    } else if (dataType instanceof IntegerType || dataType instanceof DateType) {
      // DateType data is stored internally as the number of days since 1970-01-01
      return columnVector.getInt(rowId);
    } else if (dataType instanceof LongType || dataType instanceof TimestampType) {
      // TimestampType data is stored internally as the number of microseconds since the unix
      // epoch
      return columnVector.getLong(rowId);
    } else if (dataType instanceof FloatType) {
      return columnVector.getFloat(rowId);
    } else if (dataType instanceof DoubleType) {
      return columnVector.getDouble(rowId);
    } else if (dataType instanceof StringType) {
      return columnVector.getString(rowId);
    } else if (dataType instanceof BinaryType) {
      return columnVector.getBinary(rowId);
    } else if (dataType instanceof StructType) {
      StructType structType = (StructType) dataType;
      List<Object> fields = new ArrayList<>(structType.length());
      for (int ordinal = 0; ordinal < structType.length(); ordinal++) {
        fields.add(getValueAsObject(columnVector.getChild(ordinal), rowId));
      }
      return fields;
    } else if (dataType instanceof DictionaryType) {
      if (columnVector instanceof ChunkedColumnVector) {
        // each chunk carries its own dictionary
        return ((ChunkedColumnVector) columnVector).getDecodedValue(rowId);
      }
      long index = getDictionaryIndex(columnVector, (DictionaryType) dataType, rowId);
      return getValueAsObject(columnVector.getDictionary(), Math.toIntExact(index));
    } else if (dataType instanceof NullType) {
      return null;
    } else {
      throw new UnsupportedOperationException("unsupported data type: " + dataType);
    }
  }

  /** Collects the values of an array or chunked array datum, in order. */
  public static List<Object> toJavaList(Datum arrayLike) {
    ColumnVector vector = asVector(arrayLike);
    List<Object> values = new ArrayList<>(vector.getSize());
    for (int rowId = 0; rowId < vector.getSize(); rowId++) {
      values.add(getValueAsObject(vector, rowId));
    }
    return values;
  }

  /** Presents an array or chunked array datum as a single vector. */
  public static ColumnVector asVector(Datum arrayLike) {
    switch (arrayLike.kind()) {
      case ARRAY:
        return arrayLike.getArray();
      case CHUNKED_ARRAY:
        return new ChunkedColumnVector(arrayLike.getDataType(), arrayLike.getChunks());
      default:
        throw new IllegalArgumentException("Not an array-like datum: " + arrayLike);
    }
  }

  private static long getDictionaryIndex(
      ColumnVector vector, DictionaryType dataType, int rowId) {
    DataType indexType = dataType.getIndexType();
    if (indexType instanceof ByteType) {
      return vector.getByte(rowId);
    } else if (indexType instanceof ShortType) {
      return vector.getShort(rowId);
    } else if (indexType instanceof IntegerType) {
      return vector.getInt(rowId);
    } else {
      return vector.getLong(rowId);
    }
  }
}
