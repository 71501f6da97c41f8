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

import static io.delta.compute.internal.util.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import io.delta.compute.data.Datum;
import io.delta.compute.types.*;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A single value of a given type. The Java representation of the value is:
 *
 * <ul>
 *   <li>{@code bool}: {@link Boolean}
 *   <li>{@code int8}, {@code int16}: {@link Byte}, {@link Short}
 *   <li>{@code int32}, {@code date32}: {@link Integer}
 *   <li>{@code int64}, {@code timestamp}: {@link Long}
 *   <li>{@code float}, {@code double}: {@link Float}, {@link Double}
 *   <li>{@code string}, {@code binary}: {@link String}, {@code byte[]}
 *   <li>{@code struct}: a {@link List} with one value per field
 *   <li>{@code dictionary}: the decoded value, represented as for the dictionary's value type
 * </ul>
 */
public class ScalarDatum implements Datum {
  private final DataType dataType;
  private final Object value;

  public ScalarDatum(DataType dataType, Object value) {
    this.dataType = requireNonNull(dataType, "dataType is null");
    checkArgument(
        value == null || expectedJavaClass(dataType).isInstance(value),
        "Invalid value %s of class %s for scalar of type %s",
        value,
        value == null ? null : value.getClass().getSimpleName(),
        dataType);
    this.value = value;
  }

  @Override
  public Kind kind() {
    return Kind.SCALAR;
  }

  @Override
  public DataType getDataType() {
    return dataType;
  }

  @Override
  public long length() {
    return 1;
  }

  @Override
  public Object getScalarValue() {
    return value;
  }

  public boolean isNull() {
    return value == null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ScalarDatum that = (ScalarDatum) o;
    if (!dataType.equals(that.dataType)) {
      return false;
    }
    if (value instanceof byte[] && that.value instanceof byte[]) {
      return Arrays.equals((byte[]) value, (byte[]) that.value);
    }
    return Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    int valueHash =
        value instanceof byte[] ? Arrays.hashCode((byte[]) value) : Objects.hashCode(value);
    return 31 * dataType.hashCode() + valueHash;
  }

  @Override
  public String toString() {
    Object printable = value instanceof byte[] ? Arrays.toString((byte[]) value) : value;
    return String.format("Scalar<%s>(%s)", dataType, printable);
  }

  private static Class<?> expectedJavaClass(DataType dataType) {
    if (dataType instanceof DictionaryType) {
      return expectedJavaClass(((DictionaryType) dataType).getValueType());
    } else if (dataType instanceof BooleanType) {
      return Boolean.class;
    } else if (dataType instanceof ByteType) {
      return Byte.class;
    } else if (dataType instanceof ShortType) {
      return Short.class;
    } else if (dataType instanceof IntegerType || dataType instanceof DateType) {
      return Integer.class;
    } else if (dataType instanceof LongType || dataType instanceof TimestampType) {
      return Long.class;
    } else if (dataType instanceof FloatType) {
      return Float.class;
    } else if (dataType instanceof DoubleType) {
      return Double.class;
    } else if (dataType instanceof StringType) {
      return String.class;
    } else if (dataType instanceof BinaryType) {
      return byte[].class;
    } else if (dataType instanceof StructType) {
      return List.class;
    }
    // only the null scalar is representable for the null type
    return Void.class;
  }
}
