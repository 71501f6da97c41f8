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

import static io.delta.compute.internal.util.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import io.delta.compute.annotation.Evolving;
import io.delta.compute.data.Datum;
import io.delta.compute.engine.ExecContext;
import io.delta.compute.internal.dispatch.Dispatcher;
import io.delta.compute.options.FunctionOptions;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A typed entry point of the compute layer: one name, a fixed {@link Arity} and exactly one bound
 * options type. Subclasses expose {@code call} methods whose signatures enforce the arity and the
 * options type, and share the resolve, validate and dispatch steps implemented here.
 *
 * @param <O> options type bound by this entry point
 */
@Evolving
public abstract class FunctionBinding<O extends FunctionOptions> {
  private final String name;
  private final Arity arity;
  private final Class<O> optionsType;
  private final NameResolver<O> nameResolver;
  private final ArgumentValidator<O> validator;
  private final boolean forwardsOptions;

  FunctionBinding(
      String name,
      Arity arity,
      Class<O> optionsType,
      NameResolver<O> nameResolver,
      ArgumentValidator<O> validator,
      boolean forwardsOptions) {
    this.name = requireNonNull(name, "name is null");
    this.arity = requireNonNull(arity, "arity is null");
    this.optionsType = requireNonNull(optionsType, "optionsType is null");
    this.nameResolver = requireNonNull(nameResolver, "nameResolver is null");
    this.validator = requireNonNull(validator, "validator is null");
    this.forwardsOptions = forwardsOptions;
    for (FunctionId candidate : nameResolver.candidates()) {
      checkArgument(
          candidate.getArity() == arity,
          "Entry point %s has arity %s but may dispatch to %s of arity %s",
          name,
          arity,
          candidate,
          candidate.getArity());
    }
  }

  /** @return the name of this entry point */
  public String getName() {
    return name;
  }

  public Arity getArity() {
    return arity;
  }

  /** @return the options type bound by this entry point */
  public Class<O> getOptionsType() {
    return optionsType;
  }

  /** @return the functions a call through this entry point may dispatch to */
  public Set<FunctionId> getCandidates() {
    return nameResolver.candidates();
  }

  /** @return whether the options record is passed on to the kernel */
  public boolean forwardsOptions() {
    return forwardsOptions;
  }

  /**
   * Resolve the function for {@code options}, without calling it.
   *
   * @param options options of the call
   * @return the function a call with these options dispatches to
   */
  public FunctionId resolve(O options) {
    return nameResolver.resolve(requireNonNull(options, "options is null"));
  }

  final Datum invoke(List<Datum> arguments, O options, ExecContext context) {
    requireNonNull(options, "options is null");
    requireNonNull(context, "context is null");
    validator.validate(arguments, options);
    return Dispatcher.callFunction(
        resolve(options),
        arguments,
        forwardsOptions ? Optional.<FunctionOptions>of(options) : Optional.empty(),
        context);
  }

  @Override
  public String toString() {
    return String.format("%s(arity=%s, options=%s)", name, arity, optionsType.getSimpleName());
  }
}
