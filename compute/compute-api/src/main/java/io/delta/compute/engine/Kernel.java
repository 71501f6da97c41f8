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
import io.delta.compute.data.Datum;
import io.delta.compute.exceptions.KernelExecutionException;
import io.delta.compute.options.FunctionOptions;
import java.util.List;
import java.util.Optional;

/** Executable implementation of one named function, owned by a {@link FunctionRegistry}. */
@Evolving
@FunctionalInterface
public interface Kernel {

  /**
   * Execute the function.
   *
   * @param arguments arguments in call order, read only
   * @param options options record bound by the calling entry point, if it forwards one
   * @param context the context the call runs in
   * @return the result of the call, never {@code null}
   * @throws KernelExecutionException if the arguments cannot be processed
   */
  Datum execute(List<Datum> arguments, Optional<FunctionOptions> options, ExecContext context);
}
