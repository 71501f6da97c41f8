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
package io.delta.compute.exceptions;

import io.delta.compute.annotation.Evolving;

/** Thrown when the function registry has no kernel registered under the resolved name. */
@Evolving
public class FunctionNotFoundException extends ComputeException {
  private final String functionName;

  public FunctionNotFoundException(String functionName, String message) {
    super(message);
    this.functionName = functionName;
  }

  /** @return the registry name that could not be found */
  public String getFunctionName() {
    return functionName;
  }
}
