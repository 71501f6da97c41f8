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
package io.delta.compute.options;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.core.JsonGenerator;
import io.delta.compute.annotation.Evolving;
import java.io.IOException;

/** Options for the comparison functions. */
@Evolving
public final class CompareOptions extends FunctionOptions {
  private final CompareOperator operator;

  public CompareOptions() {
    this(CompareOperator.EQUAL);
  }

  public CompareOptions(CompareOperator operator) {
    this.operator = requireNonNull(operator, "operator is null");
  }

  public static CompareOptions defaults() {
    return new CompareOptions();
  }

  public CompareOperator getOperator() {
    return operator;
  }

  @Override
  protected void writeFields(JsonGenerator generator) throws IOException {
    generator.writeStringField("op", operator.name());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return operator == ((CompareOptions) o).operator;
  }

  @Override
  public int hashCode() {
    return operator.hashCode();
  }

  @Override
  public String toString() {
    return "CompareOptions(op=" + operator + ")";
  }
}
