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
package io.delta.compute.options;

import io.delta.compute.annotation.Evolving;
import io.delta.compute.functions.FunctionId;

/**
 * Comparison operators accepted by {@link CompareOptions}. Each operator is declared with the
 * function it dispatches to.
 */
@Evolving
public enum CompareOperator {
  EQUAL(FunctionId.EQUAL),
  NOT_EQUAL(FunctionId.NOT_EQUAL),
  GREATER(FunctionId.GREATER),
  GREATER_EQUAL(FunctionId.GREATER_EQUAL),
  LESS(FunctionId.LESS),
  LESS_EQUAL(FunctionId.LESS_EQUAL);

  private final FunctionId functionId;

  CompareOperator(FunctionId functionId) {
    this.functionId = functionId;
  }

  /** @return the comparison function this operator resolves to */
  public FunctionId getFunctionId() {
    return functionId;
  }
}
