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

import java.util.*;
import java.util.stream.Collectors;

/** Base class for all primitive types {@link DataType}. */
public abstract class BasePrimitiveType extends DataType {
  /**
   * Create a primitive type {@link DataType}
   *
   * @param primitiveTypeName Primitive type name, e.g. {@code int32}.
   * @return {@link DataType} for given primitive type name
   */
  public static DataType createPrimitive(String primitiveTypeName) {
    return Optional.ofNullable(NameToPrimitiveType.MAP.get(primitiveTypeName))
        .orElseThrow(
            () -> new IllegalArgumentException("Unknown primitive type " + primitiveTypeName));
  }

  /** Is the given type name a primitive type? */
  public static boolean isPrimitiveType(String typeName) {
    return NameToPrimitiveType.MAP.containsKey(typeName);
  }

  /** For testing only */
  public static List<DataType> getAllPrimitiveTypes() {
    return NameToPrimitiveType.MAP.values().stream().collect(Collectors.toList());
  }

  /** Initialized lazily, subclasses must finish their own static initialization first. */
  private static final class NameToPrimitiveType {
    static final Map<String, DataType> MAP;

    static {
      Map<String, DataType> types = new LinkedHashMap<>();
      types.put("null", NullType.NULL);
      types.put("bool", BooleanType.BOOLEAN);
      types.put("int8", ByteType.BYTE);
      types.put("int16", ShortType.SHORT);
      types.put("int32", IntegerType.INTEGER);
      types.put("int64", LongType.LONG);
      types.put("float", FloatType.FLOAT);
      types.put("double", DoubleType.DOUBLE);
      types.put("string", StringType.STRING);
      types.put("binary", BinaryType.BINARY);
      types.put("date32", DateType.DATE);
      types.put("timestamp", TimestampType.TIMESTAMP);
      MAP = Collections.unmodifiableMap(types);
    }
  }

  private final String primitiveTypeName;

  protected BasePrimitiveType(String primitiveTypeName) {
    this.primitiveTypeName = primitiveTypeName;
  }

  @Override
  public boolean isNested() {
    return false;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    BasePrimitiveType that = (BasePrimitiveType) o;
    return primitiveTypeName.equals(that.primitiveTypeName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(primitiveTypeName);
  }

  @Override
  public String toString() {
    return primitiveTypeName;
  }
}
