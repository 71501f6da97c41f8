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
import io.delta.compute.options.FunctionOptions;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Function;

/**
 * Rule deciding which function an entry point dispatches to, given the options of the call.
 *
 * @param <O> options type bound by the entry point
 */
@Evolving
public interface NameResolver<O extends FunctionOptions> {

  /** @return the function to invoke for a call with the given options */
  FunctionId resolve(O options);

  /** @return every function {@link #resolve} may return */
  Set<FunctionId> candidates();

  /** A rule that always resolves to {@code functionId}. */
  static <O extends FunctionOptions> NameResolver<O> fixed(FunctionId functionId) {
    requireNonNull(functionId, "functionId is null");
    return of(options -> functionId, functionId);
  }

  /**
   * A rule backed by the given function.
   *
   * @param rule maps options to the function to invoke
   * @param candidates every function {@code rule} may return
   */
  static <O extends FunctionOptions> NameResolver<O> of(
      Function<O, FunctionId> rule, FunctionId... candidates) {
    requireNonNull(rule, "rule is null");
    Set<FunctionId> candidateSet =
        Collections.unmodifiableSet(EnumSet.copyOf(Arrays.asList(candidates)));
    return new NameResolver<O>() {
      @Override
      public FunctionId resolve(O options) {
        return rule.apply(options);
      }

      @Override
      public Set<FunctionId> candidates() {
        return candidateSet;
      }
    };
  }
}
