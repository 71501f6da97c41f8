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

import io.delta.compute.functions.FunctionId;
import io.delta.compute.functions.NameResolver;
import io.delta.compute.options.CompareOperator;
import io.delta.compute.options.CompareOptions;
import java.util.Arrays;

/** Maps a {@link CompareOperator} onto the comparison function it names. */
public final class OperatorResolver {
  private OperatorResolver() {}

  /**
   * Every operator constant is declared with its function, so the mapping is total and an
   * operator added without one does not compile.
   */
  public static FunctionId resolve(CompareOperator operator) {
    return operator.getFunctionId();
  }

  /** Resolver for the compare entry point. */
  public static NameResolver<CompareOptions> resolver() {
    return NameResolver.of(
        options -> resolve(options.getOperator()),
        Arrays.stream(CompareOperator.values())
            .map(CompareOperator::getFunctionId)
            .toArray(FunctionId[]::new));
  }
}
