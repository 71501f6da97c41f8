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
package io.delta.compute.defaults.internal.kernels;

import io.delta.compute.defaults.engine.DefaultFunctionRegistry;

/** Registers the reference kernels of every function of the scalar function catalog. */
public final class DefaultKernels {
  private DefaultKernels() {}

  public static void registerAll(DefaultFunctionRegistry registry) {
    ArithmeticKernels.registerAll(registry);
    ElementWiseAggregateKernels.registerAll(registry);
    SetLookupKernels.registerAll(registry);
    BooleanKernels.registerAll(registry);
    ComparisonKernels.registerAll(registry);
    ValidityKernels.registerAll(registry);
    TemporalKernels.registerAll(registry);
  }
}
