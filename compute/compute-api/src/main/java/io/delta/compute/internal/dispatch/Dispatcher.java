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
package io.delta.compute.internal.dispatch;

import static io.delta.compute.internal.util.Preconditions.checkArgument;
import static io.delta.compute.internal.util.Preconditions.checkState;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

import io.delta.compute.data.Datum;
import io.delta.compute.engine.ExecContext;
import io.delta.compute.engine.Kernel;
import io.delta.compute.exceptions.FunctionNotFoundException;
import io.delta.compute.functions.FunctionId;
import io.delta.compute.internal.ComputeErrors;
import io.delta.compute.options.FunctionOptions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards a resolved function call to the kernel registered in the {@link ExecContext}. Kernel
 * failures are propagated unchanged; nothing is retried.
 */
public final class Dispatcher {
  private static final Logger logger = LoggerFactory.getLogger(Dispatcher.class);

  private Dispatcher() {}

  /**
   * Invoke the kernel registered for {@code functionId}.
   *
   * @param functionId resolved function
   * @param arguments arguments in call order; the count must match the function's arity
   * @param options options forwarded to the kernel, if any
   * @param context context holding the function registry
   * @return the kernel's result
   * @throws FunctionNotFoundException if the registry has no kernel for the function
   */
  public static Datum callFunction(
      FunctionId functionId,
      List<Datum> arguments,
      Optional<FunctionOptions> options,
      ExecContext context) {
    requireNonNull(functionId, "functionId is null");
    requireNonNull(arguments, "arguments is null");
    requireNonNull(options, "options is null");
    requireNonNull(context, "context is null");
    checkArgument(
        functionId.getArity().accepts(arguments.size()),
        "Function %s expects %s argument(s), got %s",
        functionId,
        functionId.getArity(),
        arguments.size());
    for (Datum argument : arguments) {
      requireNonNull(argument, "argument is null");
    }

    String functionName = functionId.getRegistryName();
    Kernel kernel =
        context
            .getFunctionRegistry()
            .lookup(functionName)
            .orElseThrow(() -> ComputeErrors.functionNotFound(functionName));

    if (logger.isDebugEnabled()) {
      logger.debug(
          "Dispatching {}({}) with options {}",
          functionName,
          arguments.stream().map(Object::toString).collect(joining(", ")),
          options.map(FunctionOptions::toJson).orElse("none"));
    }

    Datum result =
        kernel.execute(
            Collections.unmodifiableList(new ArrayList<>(arguments)), options, context);
    checkState(result != null, "Kernel for " + functionName + " returned null");
    return result;
  }
}
