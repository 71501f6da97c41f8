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

import com.fasterxml.jackson.core.JsonGenerator;
import io.delta.compute.annotation.Evolving;
import java.io.IOException;

/**
 * Options for {@code element_wise_max} and {@code element_wise_min}. When {@code skipNulls} is
 * set, nulls are ignored and a row is null only if all of its inputs are null; otherwise any null
 * input makes the row null.
 */
@Evolving
public final class ElementWiseAggregateOptions extends FunctionOptions {
  private final boolean skipNulls;

  public ElementWiseAggregateOptions() {
    this(true);
  }

  public ElementWiseAggregateOptions(boolean skipNulls) {
    this.skipNulls = skipNulls;
  }

  public static ElementWiseAggregateOptions defaults() {
    return new ElementWiseAggregateOptions();
  }

  public boolean isSkipNulls() {
    return skipNulls;
  }

  @Override
  protected void writeFields(JsonGenerator generator) throws IOException {
    generator.writeBooleanField("skip_nulls", skipNulls);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return skipNulls == ((ElementWiseAggregateOptions) o).skipNulls;
  }

  @Override
  public int hashCode() {
    return Boolean.hashCode(skipNulls);
  }

  @Override
  public String toString() {
    return "ElementWiseAggregateOptions(skipNulls=" + skipNulls + ")";
  }
}
