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
package io.delta.compute.utils;

import io.delta.compute.data.ColumnVector;
import io.delta.compute.types.DataType;
import java.util.List;

/** List backed vector for tests. Values use the Java representation of scalar datums. */
public class ListColumnVector implements ColumnVector {
  private final DataType dataType;
  private final List<?> values;

  public ListColumnVector(DataType dataType, List<?> values) {
    this.dataType = dataType;
    this.values = values;
  }

  @Override
  public DataType getDataType() {
    return dataType;
  }

  @Override
  public int getSize() {
    return values.size();
  }

  @Override
  public void close() {}

  @Override
  public boolean isNullAt(int rowId) {
    return values.get(rowId) == null;
  }

  @Override
  public boolean getBoolean(int rowId) {
    return (Boolean) values.get(rowId);
  }

  @Override
  public byte getByte(int rowId) {
    return (Byte) values.get(rowId);
  }

  @Override
  public int getInt(int rowId) {
    return (Integer) values.get(rowId);
  }

  @Override
  public long getLong(int rowId) {
    return (Long) values.get(rowId);
  }

  @Override
  public String getString(int rowId) {
    return (String) values.get(rowId);
  }
}
