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

import static io.delta.compute.internal.util.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import io.delta.compute.config.ConfigurationProvider;
import io.delta.compute.defaults.internal.kernels.DefaultKernels;
import io.delta.compute.engine.FunctionRegistry;
import io.delta.compute.engine.Kernel;
import io.delta.compute.functions.FunctionCatalog;
import io.delta.compute.functions.FunctionId;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe in-memory {@link FunctionRegistry}. {@link #create()} returns a registry holding a
 * reference kernel for every function of the scalar function catalog.
 */
public class DefaultFunctionRegistry implements FunctionRegistry {
  private static final Logger logger = LoggerFactory.getLogger(DefaultFunctionRegistry.class);

  /** Whether {@link #create(ConfigurationProvider)} warns about catalog functions left unbound. */
  public static final String WARN_ON_MISSING_FUNCTIONS_KEY =
      "delta.compute.registry.warnOnMissingFunctions";

  private final ConcurrentMap<String, Kernel> kernels = new ConcurrentHashMap<>();

  protected DefaultFunctionRegistry() {}

  /**
   * Registers a kernel under the given name.
   *
   * @throws IllegalArgumentException if a kernel is already registered under that name
   */
  public DefaultFunctionRegistry register(String name, Kernel kernel) {
    return register(name, kernel, false /* allowOverwrite */);
  }

  public DefaultFunctionRegistry register(String name, Kernel kernel, boolean allowOverwrite) {
    requireNonNull(name, "name is null");
    requireNonNull(kernel, "kernel is null");
    if (allowOverwrite) {
      kernels.put(name, kernel);
    } else {
      Kernel existing = kernels.putIfAbsent(name, kernel);
      checkArgument(existing == null, "Already have a function registered with name: %s", name);
    }
    logger.debug("Registered kernel for function {}", name);
    return this;
  }

  public DefaultFunctionRegistry register(FunctionId functionId, Kernel kernel) {
    return register(functionId.getRegistryName(), kernel);
  }

  @Override
  public Optional<Kernel> lookup(String name) {
    return Optional.ofNullable(kernels.get(name));
  }

  @Override
  public Set<String> getFunctionNames() {
    return Collections.unmodifiableSet(new TreeSet<>(kernels.keySet()));
  }

  /** @return a registry without any function */
  public static DefaultFunctionRegistry empty() {
    return new DefaultFunctionRegistry();
  }

  /** @return a registry with the reference kernels of every catalog function */
  public static DefaultFunctionRegistry create() {
    DefaultFunctionRegistry registry = new DefaultFunctionRegistry();
    DefaultKernels.registerAll(registry);
    return registry;
  }

  /**
   * Same as {@link #create()}, additionally logging a warning for every catalog function without
   * a kernel unless {@link #WARN_ON_MISSING_FUNCTIONS_KEY} is {@code false}.
   */
  public static DefaultFunctionRegistry create(ConfigurationProvider configuration) {
    DefaultFunctionRegistry registry = create();
    if (configuration.getBoolean(WARN_ON_MISSING_FUNCTIONS_KEY, true)) {
      List<FunctionId> missing = FunctionCatalog.missingFrom(registry);
      for (FunctionId functionId : missing) {
        logger.warn("No kernel registered for function {}", functionId.getRegistryName());
      }
    }
    return registry;
  }
}
