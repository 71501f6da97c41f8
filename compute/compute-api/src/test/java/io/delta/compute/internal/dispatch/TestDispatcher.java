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

import static io.delta.compute.utils.ComputeTestUtils.args;
import static io.delta.compute.utils.ComputeTestUtils.arrayOf;
import static io.delta.compute.utils.ComputeTestUtils.contextOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.delta.compute.data.Datum;
import io.delta.compute.engine.ExecContext;
import io.delta.compute.exceptions.FunctionNotFoundException;
import io.delta.compute.exceptions.KernelExecutionException;
import io.delta.compute.functions.FunctionId;
import io.delta.compute.options.CompareOperator;
import io.delta.compute.options.CompareOptions;
import io.delta.compute.options.FunctionOptions;
import io.delta.compute.types.BooleanType;
import io.delta.compute.types.IntegerType;
import io.delta.compute.utils.RecordingFunctionRegistry;
import java.util.Optional;
import org.junit.Test;

public class TestDispatcher {
  private static final Datum LEFT = arrayOf(IntegerType.INTEGER, 1, 2);
  private static final Datum RIGHT = arrayOf(IntegerType.INTEGER, 3, 4);
  private static final Datum RESULT = arrayOf(BooleanType.BOOLEAN, false, false);

  @Test
  public void forwardsArgumentsAndOptionsToKernel() {
    RecordingFunctionRegistry registry =
        new RecordingFunctionRegistry().withFunction("greater", RESULT);
    CompareOptions options = new CompareOptions(CompareOperator.GREATER);

    Datum result =
        Dispatcher.callFunction(
            FunctionId.GREATER,
            args(LEFT, RIGHT),
            Optional.<FunctionOptions>of(options),
            contextOf(registry));

    assertThat(result).isSameAs(RESULT);
    assertThat(registry.getCalls()).hasSize(1);
    assertThat(registry.lastCall().functionName).isEqualTo("greater");
    assertThat(registry.lastCall().arguments).containsExactly(LEFT, RIGHT);
    assertThat(registry.lastCall().options).containsSame(options);
  }

  @Test
  public void missingFunctionIsReportedByName() {
    ExecContext context = contextOf(new RecordingFunctionRegistry().withFunction("add", RESULT));

    assertThatThrownBy(
            () ->
                Dispatcher.callFunction(
                    FunctionId.ADD_CHECKED, args(LEFT, RIGHT), Optional.empty(), context))
        .isInstanceOf(FunctionNotFoundException.class)
        .hasMessageContaining("add_checked")
        .satisfies(
            e ->
                assertThat(((FunctionNotFoundException) e).getFunctionName())
                    .isEqualTo("add_checked"));
  }

  @Test
  public void kernelFailuresPropagateUnchanged() {
    KernelExecutionException failure = new KernelExecutionException("add_checked", "overflow");
    RecordingFunctionRegistry registry =
        new RecordingFunctionRegistry()
            .withKernel(
                "add_checked",
                (arguments, options, context) -> {
                  throw failure;
                });

    assertThatThrownBy(
            () ->
                Dispatcher.callFunction(
                    FunctionId.ADD_CHECKED,
                    args(LEFT, RIGHT),
                    Optional.empty(),
                    contextOf(registry)))
        .isSameAs(failure);
  }

  @Test
  public void argumentCountMustMatchArity() {
    RecordingFunctionRegistry registry =
        new RecordingFunctionRegistry().withFunction("add", RESULT);

    assertThatThrownBy(
            () ->
                Dispatcher.callFunction(
                    FunctionId.ADD, args(LEFT), Optional.empty(), contextOf(registry)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Function add expects 2 argument(s), got 1");
    assertThat(registry.getCalls()).isEmpty();
  }

  @Test
  public void kernelMustReturnAResult() {
    RecordingFunctionRegistry registry = new RecordingFunctionRegistry().withFunction("abs", null);

    assertThatThrownBy(
            () ->
                Dispatcher.callFunction(
                    FunctionId.ABS, args(LEFT), Optional.empty(), contextOf(registry)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("abs");
  }
}
