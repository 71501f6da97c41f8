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
import static java.util.Objects.requireNonNull;

import io.delta.compute.functions.FunctionId;
import io.delta.compute.functions.NameResolver;
import io.delta.compute.options.ArithmeticOptions;

/** Chooses between the unchecked and the checked variant of an arithmetic function. */
public final class VariantSelector {
  private VariantSelector() {}

  /**
   * @param base function invoked when overflow is not checked, e.g. {@code add}
   * @param checked function invoked when overflow is checked, e.g. {@code add_checked}
   * @param options options of the call
   * @return {@code checked} iff {@link ArithmeticOptions#isCheckOverflow()}, {@code base} otherwise
   */
  public static FunctionId select(
      FunctionId base, FunctionId checked, ArithmeticOptions options) {
    return options.isCheckOverflow() ? checked : base;
  }

  /** Bind {@link #select} for the given pair of variants. */
  public static NameResolver<ArithmeticOptions> checkedVariant(
      FunctionId base, FunctionId checked) {
    requireNonNull(base, "base is null");
    requireNonNull(checked, "checked is null");
    checkArgument(
        base.getArity() == checked.getArity(),
        "Variants %s and %s have different arities",
        base,
        checked);
    return NameResolver.of(options -> select(base, checked, options), base, checked);
  }
}
