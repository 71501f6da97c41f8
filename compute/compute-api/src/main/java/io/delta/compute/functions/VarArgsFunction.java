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
import io.delta.compute.data.Datum;
import io.delta.compute.engine.ExecContext;
import io.delta.compute.options.FunctionOptions;
import java.util.List;
import java.util.function.Supplier;

/**
 * Entry point taking one or more arguments.
 *
 * @param <O> options type bound by this entry point
 */
@Evolving
public final class VarArgsFunction<O extends FunctionOptions> extends FunctionBinding<O> {
  private final Supplier<O> defaultOptions;

  VarArgsFunction(
      String name,
      Class<O> optionsType,
      NameResolver<O> nameResolver,
      boolean forwardsOptions,
      Supplier<O> defaultOptions) {
    super(
        name, Arity.VARARGS, optionsType, nameResolver, ArgumentValidator.none(), forwardsOptions);
    this.defaultOptions = requireNonNull(defaultOptions, "defaultOptions is null");
  }

  /** Call with default options. */
  public Datum call(List<Datum> arguments, ExecContext context) {
    return call(arguments, defaultOptions.get(), context);
  }

  public Datum call(List<Datum> arguments, O options, ExecContext context) {
    return invoke(requireNonNull(arguments, "arguments is null"), options, context);
  }
}
