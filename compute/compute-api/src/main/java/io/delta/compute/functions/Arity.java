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

/** Number of arguments a function accepts. */
@Evolving
public enum Arity {
  UNARY(1),
  BINARY(2),
  TERNARY(3),
  VARARGS(-1);

  private final int numArgs;

  Arity(int numArgs) {
    this.numArgs = numArgs;
  }

  /** @return whether a call with {@code numArguments} arguments matches this arity */
  public boolean accepts(int numArguments) {
    return this == VARARGS ? numArguments >= 1 : numArguments == numArgs;
  }

  @Override
  public String toString() {
    return this == VARARGS ? "varargs" : Integer.toString(numArgs);
  }
}
