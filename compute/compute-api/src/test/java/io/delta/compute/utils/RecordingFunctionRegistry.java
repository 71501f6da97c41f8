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
package io.delta.compute.utils;

import io.delta.compute.data.Datum;
import io.delta.compute.engine.FunctionRegistry;
import io.delta.compute.engine.Kernel;
import io.delta.compute.options.FunctionOptions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry for tests: every registered name answers with a fixed result and records the calls it
 * receives.
 */
public class RecordingFunctionRegistry implements FunctionRegistry {

  /** One kernel invocation. */
  public static class Call {
    public final String functionName;
    public final List<Datum> arguments;
    public final Optional<FunctionOptions> options;

    Call(String functionName, List<Datum> arguments, Optional<FunctionOptions> options) {
      this.functionName = functionName;
      this.arguments = arguments;
      this.options = options;
    }
  }

  private final Map<String, Kernel> kernels = new HashMap<>();
  private final List<Call> calls = new ArrayList<>();

  /** Registers a kernel recording its calls and returning {@code result}. */
  public RecordingFunctionRegistry withFunction(String name, Datum result) {
    kernels.put(
        name,
        (arguments, options, context) -> {
          calls.add(new Call(name, arguments, options));
          return result;
        });
    return this;
  }

  public RecordingFunctionRegistry withKernel(String name, Kernel kernel) {
    kernels.put(name, kernel);
    return this;
  }

  public List<Call> getCalls() {
    return Collections.unmodifiableList(calls);
  }

  public Call lastCall() {
    return calls.get(calls.size() - 1);
  }

  @Override
  public Optional<Kernel> lookup(String name) {
    return Optional.ofNullable(kernels.get(name));
  }

  @Override
  public Set<String> getFunctionNames() {
    return Collections.unmodifiableSet(kernels.keySet());
  }
}
