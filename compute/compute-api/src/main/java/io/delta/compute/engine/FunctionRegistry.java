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
package io.delta.compute.engine;

import io.delta.compute.annotation.Evolving;
import java.util.Optional;
import java.util.Set;

/** Catalog mapping function names to {@link Kernel}s. */
@Evolving
public interface FunctionRegistry {

  /**
   * Find the kernel registered under the given name.
   *
   * @param functionName registry name of the function, e.g. {@code add_checked}
   * @return the kernel, or {@link Optional#empty()} if no function has that name
   */
  Optional<Kernel> lookup(String functionName);

  /** @return the names of all functions currently registered */
  Set<String> getFunctionNames();
}
