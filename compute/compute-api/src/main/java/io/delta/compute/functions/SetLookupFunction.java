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
import io.delta.compute.engine.ExecContext;
import io.delta.compute.internal.dispatch.SetLookupValidator;
import io.delta.compute.options.SetLookupOptions;
import java.util.Collections;

/**
 * Entry point of a set lookup function. The probe is checked against the value set by {@link
 * SetLookupValidator} before the call is dispatched.
 */
@Evolving
public final class SetLookupFunction extends FunctionBinding<SetLookupOptions> {

  SetLookupFunction(String name, FunctionId functionId) {
    super(
        name,
        Arity.UNARY,
        SetLookupOptions.class,
        NameResolver.fixed(functionId),
        (arguments, options) -> SetLookupValidator.validate(arguments.get(0), options),
        true /* forwardsOptions */);
  }

  public Datum call(Datum values, SetLookupOptions options, ExecContext context) {
    return invoke(Collections.singletonList(values), options, context);
  }

  /** Same as calling with {@code new SetLookupOptions(valueSet)}. */
  public Datum call(Datum values, Datum valueSet, ExecContext context) {
    return call(values, new SetLookupOptions(valueSet), context);
  }
}
