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
import io.delta.compute.config.ConfigurationProvider;

/**
 * Interface encapsulating the resources a compute function call is executed with. Connectors
 * construct an implementation once and pass it explicitly to every call; the compute layer reads
 * from it and never mutates or caches anything reachable from it, so one context may be shared by
 * any number of concurrent callers.
 */
@Evolving
public interface ExecContext {

  /**
   * Get the registry that maps function names to kernels.
   *
   * @return An implementation of {@link FunctionRegistry}.
   */
  FunctionRegistry getFunctionRegistry();

  /**
   * Get the configuration consulted by kernels.
   *
   * @return An implementation of {@link ConfigurationProvider}.
   */
  ConfigurationProvider getConfiguration();
}
