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

import io.delta.compute.annotation.Evolving;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Struct type which contains one or more columns. Used as the schema of a table {@link
 * io.delta.compute.data.Datum} and as the result type of kernels that emit several fields per
 * row.
 */
@Evolving
public final class StructType extends DataType {

  private final List<StructField> fields;

  public StructType() {
    this(new ArrayList<>());
  }

  public StructType(List<StructField> fields) {
    this.fields = fields;
  }

  public StructType add(StructField field) {
    final List<StructField> fieldsCopy = new ArrayList<>(fields);
    fieldsCopy.add(field);
    return new StructType(fieldsCopy);
  }

  public StructType add(String name, DataType dataType) {
    return add(new StructField(name, dataType, true /* nullable */));
  }

  public StructType add(String name, DataType dataType, boolean nullable) {
    return add(new StructField(name, dataType, nullable));
  }

  public List<StructField> fields() {
    return Collections.unmodifiableList(fields);
  }

  public List<String> fieldNames() {
    return fields.stream().map(StructField::getName).collect(Collectors.toList());
  }

  public int length() {
    return fields.size();
  }

  public int indexOf(String fieldName) {
    return fieldNames().indexOf(fieldName);
  }

  public StructField at(int index) {
    return fields.get(index);
  }

  @Override
  public boolean isNested() {
    return true;
  }

  @Override
  public String toString() {
    return String.format(
        "struct<%s>",
        fields.stream().map(StructField::toString).collect(Collectors.joining(", ")));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    StructType that = (StructType) o;
    return fields.equals(that.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }
}
