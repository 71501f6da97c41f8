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
import java.util.Arrays;
import java.util.function.Supplier;

/**
 * Entry point taking two arguments.
 *
 * @param <O> options type bound by this entry point
 */
@Evolving
public final class BinaryFunction<O extends FunctionOptions> extends FunctionBinding<O> {
  private final Supplier<O> defaultOptions;

  BinaryFunction(
      String name,
      Class<O> optionsType,
      NameResolver<O> nameResolver,
      boolean forwardsOptions,
      Supplier<O> defaultOptions) {
    super(
        name, Arity.BINARY, optionsType, nameResolver, ArgumentValidator.none(), forwardsOptions);
    this.defaultOptions = requireNonNull(defaultOptions, "defaultOptions is null");
  }

  /** Call with default options. */
  public Datum call(Datum left, Datum right, ExecContext context) {
    return call(left, right, defaultOptions.get(), context);
  }

  public Datum call(Datum left, Datum right, O options, ExecContext context) {
    return invoke(Arrays.asList(left, right), options, context);
  }
}
