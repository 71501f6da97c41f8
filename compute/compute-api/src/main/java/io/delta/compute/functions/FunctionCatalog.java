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
package io.delta.compute.functions;

import static java.util.Objects.requireNonNull;

import io.delta.compute.annotation.Evolving;
import io.delta.compute.engine.FunctionRegistry;
import io.delta.compute.internal.util.JsonUtils;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/** Describes the entry points of {@link ScalarFunctions} and checks registries against them. */
@Evolving
public final class FunctionCatalog {
  private FunctionCatalog() {}

  /**
   * Render every entry point as JSON:
   *
   * <pre>{@code
   * [{"name":"add","arity":"2","options":"ArithmeticOptions",
   *   "functions":["add","add_checked"]}, ...]
   * }</pre>
   */
  public static String toJson() {
    return JsonUtils.generate(
        generator -> {
          generator.writeStartArray();
          for (FunctionBinding<?> binding : ScalarFunctions.all()) {
            generator.writeStartObject();
            generator.writeStringField("name", binding.getName());
            generator.writeStringField("arity", binding.getArity().toString());
            generator.writeStringField("options", binding.getOptionsType().getSimpleName());
            generator.writeArrayFieldStart("functions");
            for (FunctionId candidate : binding.getCandidates()) {
              generator.writeString(candidate.getRegistryName());
            }
            generator.writeEndArray();
            generator.writeEndObject();
          }
          generator.writeEndArray();
        });
  }

  /**
   * @param registry registry to check
   * @return the functions that {@code registry} has no kernel for, in declaration order
   */
  public static List<FunctionId> missingFrom(FunctionRegistry registry) {
    Set<String> registered = requireNonNull(registry, "registry is null").getFunctionNames();
    return Arrays.stream(FunctionId.values())
        .filter(functionId -> !registered.contains(functionId.getRegistryName()))
        .collect(Collectors.toList());
  }
}
