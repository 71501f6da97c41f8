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
import io.delta.compute.data.Datum;
import java.io.IOException;
import java.util.Objects;

/**
 * Options for the set lookup functions {@code is_in} and {@code index_in}.
 *
 * <p>The value set must be an array or a chunked array; this is checked when the function is
 * called, not when the options are created. When {@code skipNulls} is false a null in the input
 * matches a null in the value set; when true nulls in the input never match.
 */
@Evolving
public final class SetLookupOptions extends FunctionOptions {
  private final Datum valueSet;
  private final boolean skipNulls;

  public SetLookupOptions(Datum valueSet) {
    this(valueSet, false);
  }

  public SetLookupOptions(Datum valueSet, boolean skipNulls) {
    this.valueSet = requireNonNull(valueSet, "valueSet is null");
    this.skipNulls = skipNulls;
  }

  public Datum getValueSet() {
    return valueSet;
  }

  public boolean isSkipNulls() {
    return skipNulls;
  }

  @Override
  protected void writeFields(JsonGenerator generator) throws IOException {
    generator.writeObjectFieldStart("value_set");
    generator.writeStringField("kind", valueSet.kind().name());
    generator.writeStringField("type", valueSet.getDataType().toString());
    generator.writeNumberField("length", valueSet.length());
    generator.writeEndObject();
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
    SetLookupOptions that = (SetLookupOptions) o;
    return skipNulls == that.skipNulls && valueSet.equals(that.valueSet);
  }

  @Override
  public int hashCode() {
    return Objects.hash(valueSet, skipNulls);
  }

  @Override
  public String toString() {
    return "SetLookupOptions(valueSet=" + valueSet + ", skipNulls=" + skipNulls + ")";
  }
}
