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

import io.delta.compute.annotation.Evolving;
import io.delta.compute.data.Datum;
import io.delta.compute.options.FunctionOptions;
import java.util.List;

/**
 * Check run on the arguments and options of a call before it is dispatched.
 *
 * @param <O> options type bound by the entry point
 */
@Evolving
@FunctionalInterface
public interface ArgumentValidator<O extends FunctionOptions> {

  /**
   * @throws io.delta.compute.exceptions.InvalidArgumentException if the call must be rejected
   */
  void validate(List<Datum> arguments, O options);

  /** A validator accepting every call. */
  static <O extends FunctionOptions> ArgumentValidator<O> none() {
    return (arguments, options) -> {};
  }
}
