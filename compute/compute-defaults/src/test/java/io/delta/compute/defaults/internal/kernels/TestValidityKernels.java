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
package io.delta.compute.defaults.internal.kernels;

import static io.delta.compute.defaults.utils.DefaultComputeTestUtils.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.delta.compute.data.Datum;
import io.delta.compute.defaults.engine.DefaultExecContext;
import io.delta.compute.exceptions.KernelExecutionException;
import io.delta.compute.functions.ScalarFunctions;
import io.delta.compute.types.*;
import org.junit.Test;

public class TestValidityKernels {
  private static final DefaultExecContext CONTEXT = DefaultExecContext.create();

  @Test
  public void isValidAndIsNullAreNeverNull() {
    Datum values = arrayOf(StringType.STRING, "a", null);

    assertThat(valuesOf(ScalarFunctions.IS_VALID.call(values, CONTEXT)))
        .containsExactly(true, false);
    assertThat(valuesOf(ScalarFunctions.IS_NULL.call(values, CONTEXT)))
        .containsExactly(false, true);
    assertThat(ScalarFunctions.IS_NULL.call(Datum.nullScalar(DateType.DATE), CONTEXT))
        .isEqualTo(Datum.scalar(BooleanType.BOOLEAN, true));
  }

  @Test
  public void isNanOnFloatingPointOnly() {
    assertThat(
            valuesOf(
                ScalarFunctions.IS_NAN.call(
                    arrayOf(DoubleType.DOUBLE, Double.NaN, 1.0d, null), CONTEXT)))
        .containsExactly(true, false, null);
    assertThat(
            valuesOf(ScalarFunctions.IS_NAN.call(arrayOf(FloatType.FLOAT, Float.NaN), CONTEXT)))
        .containsExactly(true);

    assertThatThrownBy(
            () -> ScalarFunctions.IS_NAN.call(arrayOf(IntegerType.INTEGER, 1), CONTEXT))
        .isInstanceOf(KernelExecutionException.class)
        .hasMessageContaining("is_nan");
  }

  @Test
  public void fillNull() {
    Datum filled =
        ScalarFunctions.FILL_NULL.call(
            arrayOf(IntegerType.INTEGER, 1, null, 3),
            Datum.scalar(IntegerType.INTEGER, 0),
            CONTEXT);
    assertThat(valuesOf(filled)).containsExactly(1, 0, 3);

    Datum pairwise =
        ScalarFunctions.FILL_NULL.call(
            arrayOf(StringType.STRING, null, null),
            arrayOf(StringType.STRING, "x", null),
            CONTEXT);
    assertThat(valuesOf(pairwise)).containsExactly("x", null);
  }

  @Test
  public void ifElse() {
    Datum result =
        ScalarFunctions.IF_ELSE.call(
            arrayOf(BooleanType.BOOLEAN, true, false, null),
            arrayOf(LongType.LONG, 1L, 2L, 3L),
            Datum.scalar(LongType.LONG, -1L),
            CONTEXT);
    assertThat(valuesOf(result)).containsExactly(1L, -1L, null);

    assertThatThrownBy(
            () ->
                ScalarFunctions.IF_ELSE.call(
                    arrayOf(IntegerType.INTEGER, 1),
                    arrayOf(LongType.LONG, 1L),
                    arrayOf(LongType.LONG, 2L),
                    CONTEXT))
        .isInstanceOf(KernelExecutionException.class)
        .hasMessage("Function if_else has no kernel matching input types (int32, int64, int64)");
  }
}
