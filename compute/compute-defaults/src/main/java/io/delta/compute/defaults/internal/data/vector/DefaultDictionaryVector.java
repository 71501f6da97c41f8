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
import static java.util.Objects.requireNonNull;

import io.delta.compute.data.ColumnVector;
import io.delta.compute.types.DataType;
import io.delta.compute.types.DictionaryType;

/**
 * Dictionary encoded column vector: row accessors return the index stored in {@code indices},
 * {@link #getDictionary()} returns the decoded values.
 */
public class DefaultDictionaryVector implements ColumnVector {
  private final DictionaryType dataType;
  private final ColumnVector indices;
  private final ColumnVector dictionary;

  public DefaultDictionaryVector(
      DictionaryType dataType, ColumnVector indices, ColumnVector dictionary) {
    this.dataType = requireNonNull(dataType, "dataType is null");
    this.indices = requireNonNull(indices, "indices is null");
    this.dictionary = requireNonNull(dictionary, "dictionary is null");
    checkArgument(
        dataType.getIndexType().equals(indices.getDataType()),
        "indices have type %s, expected %s",
        indices.getDataType(),
        dataType.getIndexType());
    checkArgument(
        dataType.getValueType().equals(dictionary.getDataType()),
        "dictionary has type %s, expected %s",
        dictionary.getDataType(),
        dataType.getValueType());
  }

  @Override
  public DataType getDataType() {
    return dataType;
  }

  @Override
  public int getSize() {
    return indices.getSize();
  }

  @Override
  public void close() {
    indices.close();
    dictionary.close();
  }

  @Override
  public boolean isNullAt(int rowId) {
    return indices.isNullAt(rowId);
  }

  @Override
  public byte getByte(int rowId) {
    return indices.getByte(rowId);
  }

  @Override
  public short getShort(int rowId) {
    return indices.getShort(rowId);
  }

  @Override
  public int getInt(int rowId) {
    return indices.getInt(rowId);
  }

  @Override
  public long getLong(int rowId) {
    return indices.getLong(rowId);
  }

  @Override
  public ColumnVector getDictionary() {
    return dictionary;
  }
}
