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

import static io.delta.compute.internal.util.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import io.delta.compute.annotation.Evolving;
import java.util.Objects;

/**
 * Represents a dictionary encoded column: every value is stored as an index (of an integral
 * {@code indexType}) into a shared dictionary of decoded values of {@code valueType}.
 */
@Evolving
public final class DictionaryType extends DataType {
  private final DataType indexType;
  private final DataType valueType;

  public DictionaryType(DataType indexType, DataType valueType) {
    requireNonNull(indexType, "indexType is null");
    requireNonNull(valueType, "valueType is null");
    checkArgument(
        indexType instanceof ByteType
            || indexType instanceof ShortType
            || indexType instanceof IntegerType
            || indexType instanceof LongType,
        "Dictionary index type must be an integer type, got %s",
        indexType);
    this.indexType = indexType;
    this.valueType = valueType;
  }

  /** @return the type of the indices stored in each row */
  public DataType getIndexType() {
    return indexType;
  }

  /** @return the type of the decoded dictionary values */
  public DataType getValueType() {
    return valueType;
  }

  @Override
  public boolean isNested() {
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    DictionaryType that = (DictionaryType) o;
    return indexType.equals(that.indexType) && valueType.equals(that.valueType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(indexType, valueType);
  }

  @Override
  public String toString() {
    return String.format("dictionary<values=%s, indices=%s>", valueType, indexType);
  }
}
