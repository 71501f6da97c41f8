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
package io.delta.compute.defaults.engine;

import static java.util.Objects.requireNonNull;

import io.delta.compute.config.ConfigurationProvider;
import io.delta.compute.engine.ExecContext;
import io.delta.compute.engine.FunctionRegistry;

/** Default implementation of {@link ExecContext}. */
public class DefaultExecContext implements ExecContext {
  /** Zone id the temporal kernels use to derive calendar fields from timestamps. */
  public static final String TIME_ZONE_KEY = "delta.compute.temporal.timeZone";

  public static final String DEFAULT_TIME_ZONE = "UTC";

  private final FunctionRegistry functionRegistry;
  private final ConfigurationProvider configuration;

  protected DefaultExecContext(
      FunctionRegistry functionRegistry, ConfigurationProvider configuration) {
    this.functionRegistry = requireNonNull(functionRegistry, "functionRegistry is null");
    this.configuration = requireNonNull(configuration, "configuration is null");
  }

  @Override
  public FunctionRegistry getFunctionRegistry() {
    return functionRegistry;
  }

  @Override
  public ConfigurationProvider getConfiguration() {
    return configuration;
  }

  /** @return a context with the same configuration that resolves functions in {@code registry} */
  public DefaultExecContext withFunctionRegistry(FunctionRegistry registry) {
    return new DefaultExecContext(registry, configuration);
  }

  /**
   * Create an instance of {@link DefaultExecContext} with an empty configuration and the default
   * function registry.
   */
  public static DefaultExecContext create() {
    return create(MapConfigurationProvider.empty());
  }

  /**
   * Create an instance of {@link DefaultExecContext} with the default function registry.
   *
   * @param configuration configuration read by the registry and the kernels
   * @return an instance of {@link DefaultExecContext}.
   */
  public static DefaultExecContext create(ConfigurationProvider configuration) {
    return new DefaultExecContext(DefaultFunctionRegistry.create(configuration), configuration);
  }

  public static DefaultExecContext create(
      FunctionRegistry functionRegistry, ConfigurationProvider configuration) {
    return new DefaultExecContext(functionRegistry, configuration);
  }
}
