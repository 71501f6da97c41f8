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
import io.delta.compute.internal.util.JsonUtils;
import java.io.IOException;

/**
 * Base class for the immutable per-call parameter bundles accepted by compute functions. Each
 * function entry point binds exactly one options type.
 */
@Evolving
public abstract class FunctionOptions {

  /** @return the name of this options type, used in JSON and log output */
  public String getTypeName() {
    return getClass().getSimpleName();
  }

  /** @return a JSON rendering of this options record, e.g. for logging */
  public final String toJson() {
    return JsonUtils.generate(
        generator -> {
          generator.writeStartObject();
          generator.writeStringField("type", getTypeName());
          writeFields(generator);
          generator.writeEndObject();
        });
  }

  /** Write the fields of this record into the currently open JSON object. */
  protected abstract void writeFields(JsonGenerator generator) throws IOException;
}
