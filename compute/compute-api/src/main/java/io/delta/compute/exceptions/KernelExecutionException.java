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

/**
 * Thrown by a kernel that fails while executing, for example on integer overflow in a checked
 * arithmetic variant or when no kernel matches the argument types.
 */
@Evolving
public class KernelExecutionException extends ComputeException {
  private final String functionName;

  public KernelExecutionException(String functionName, String message) {
    super(message);
    this.functionName = functionName;
  }

  public KernelExecutionException(String functionName, String message, Throwable cause) {
    super(message, cause);
    this.functionName = functionName;
  }

  /** @return the registry name of the function whose kernel failed */
  public String getFunctionName() {
    return functionName;
  }
}
