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

/** Options bound by functions that take no parameters. */
@Evolving
public final class NoOptions extends FunctionOptions {
  public static final NoOptions INSTANCE = new NoOptions();

  private NoOptions() {}

  @Override
  protected void writeFields(JsonGenerator generator) {
    // no fields
  }

  @Override
  public String toString() {
    return "NoOptions";
  }
}
