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
import io.delta.compute.data.Datum.Kind;
import io.delta.compute.defaults.engine.DefaultExecContext;
import io.delta.compute.defaults.internal.data.DefaultColumnarBatch;
import io.delta.compute.exceptions.KernelExecutionException;
import io.delta.compute.functions.ScalarFunctions;
import io.delta.compute.options.ArithmeticOptions;
import io.delta.compute.types.*;
import java.util.Collections;
import org.junit.Test;

public class TestArithmeticKernels {
  private static final DefaultExecContext CONTEXT = DefaultExecContext.create();
  private static final ArithmeticOptions CHECKED = new ArithmeticOptions(true);

  @Test
  public void addPropagatesNulls() {
    Datum result =
        ScalarFunctions.ADD.call(
            arrayOf(IntegerType.INTEGER, 1, null, 3),
            arrayOf(IntegerType.INTEGER, 10, 20, null),
            CONTEXT);

    assertThat(result.kind()).isEqualTo(Kind.ARRAY);
    assertThat(result.getDataType()).isEqualTo(IntegerType.INTEGER);
    assertThat(valuesOf(result)).containsExactly(11, null, null);
  }

  @Test
  public void uncheckedIntegerArithmeticWraps() {
    Datum sum =
        ScalarFunctions.ADD.call(
            arrayOf(IntegerType.INTEGER, Integer.MAX_VALUE),
            arrayOf(IntegerType.INTEGER, 1),
            CONTEXT);
    assertThat(valuesOf(sum)).containsExactly(Integer.MIN_VALUE);

    Datum byteSum =
        ScalarFunctions.ADD.call(
            arrayOf(ByteType.BYTE, (byte) 127), arrayOf(ByteType.BYTE, (byte) 1), CONTEXT);
    assertThat(valuesOf(byteSum)).containsExactly((byte) -128);

    Datum product =
        ScalarFunctions.MULTIPLY.call(
            arrayOf(LongType.LONG, Long.MAX_VALUE), arrayOf(LongType.LONG, 2L), CONTEXT);
    assertThat(valuesOf(product)).containsExactly(-2L);

    Datum abs = ScalarFunctions.ABS.call(arrayOf(ShortType.SHORT, Short.MIN_VALUE), CONTEXT);
    assertThat(valuesOf(abs)).containsExactly(Short.MIN_VALUE);
  }

  @Test
  public void checkedIntegerArithmeticFailsOnOverflow() {
    assertThatThrownBy(
            () ->
                ScalarFunctions.ADD.call(
                    arrayOf(IntegerType.INTEGER, 1, Integer.MAX_VALUE),
                    arrayOf(IntegerType.INTEGER, 1, 1),
                    CHECKED,
                    CONTEXT))
        .isInstanceOf(KernelExecutionException.class)
        .hasMessage("add_checked: overflow");

    assertThatThrownBy(
            () ->
                ScalarFunctions.SUBTRACT.call(
                    arrayOf(ByteType.BYTE, (byte) -128),
                    arrayOf(ByteType.BYTE, (byte) 1),
                    CHECKED,
                    CONTEXT))
        .isInstanceOf(KernelExecutionException.class)
        .hasMessageContaining("subtract_checked");

    assertThatThrownBy(
            () ->
                ScalarFunctions.NEGATE.call(
                    arrayOf(LongType.LONG, Long.MIN_VALUE), CHECKED, CONTEXT))
        .isInstanceOf(KernelExecutionException.class)
        .hasMessageContaining("negate_checked");

    Datum fits =
        ScalarFunctions.MULTIPLY.call(
            arrayOf(ShortType.SHORT, (short) 100),
            arrayOf(ShortType.SHORT, (short) 300),
            CHECKED,
            CONTEXT);
    assertThat(valuesOf(fits)).containsExactly((short) 30000);
  }

  @Test
  public void integerDivisionByZeroFailsInBothVariants() {
    for (ArithmeticOptions options :
        new ArithmeticOptions[] {ArithmeticOptions.defaults(), CHECKED}) {
      assertThatThrownBy(
              () ->
                  ScalarFunctions.DIVIDE.call(
                      arrayOf(IntegerType.INTEGER, 7),
                      arrayOf(IntegerType.INTEGER, 0),
                      options,
                      CONTEXT))
          .isInstanceOf(KernelExecutionException.class)
          .hasMessageContaining("divide by zero");
    }

    Datum quotient =
        ScalarFunctions.DIVIDE.call(
            arrayOf(IntegerType.INTEGER, 7, -7), arrayOf(IntegerType.INTEGER, 2, 2), CONTEXT);
    assertThat(valuesOf(quotient)).containsExactly(3, -3);
  }

  @Test
  public void floatingPointDivision() {
    Datum quotient =
        ScalarFunctions.DIVIDE.call(
            arrayOf(DoubleType.DOUBLE, 1.0d, 3.0d),
            arrayOf(DoubleType.DOUBLE, 0.0d, 2.0d),
            CONTEXT);
    assertThat(valuesOf(quotient)).containsExactly(Double.POSITIVE_INFINITY, 1.5d);

    assertThatThrownBy(
            () ->
                ScalarFunctions.DIVIDE.call(
                    arrayOf(FloatType.FLOAT, 1.0f),
                    arrayOf(FloatType.FLOAT, 0.0f),
                    CHECKED,
                    CONTEXT))
        .isInstanceOf(KernelExecutionException.class)
        .hasMessage("divide_checked: divide by zero");
  }

  @Test
  public void power() {
    Datum powers =
        ScalarFunctions.POWER.call(
            arrayOf(LongType.LONG, 2L, -3L, 0L, -1L),
            arrayOf(LongType.LONG, 10L, 3L, 0L, 1_000_000_001L),
            CHECKED,
            CONTEXT);
    assertThat(valuesOf(powers)).containsExactly(1024L, -27L, 1L, -1L);

    Datum wrapped =
        ScalarFunctions.POWER.call(
            arrayOf(IntegerType.INTEGER, 2), arrayOf(IntegerType.INTEGER, 31), CONTEXT);
    assertThat(valuesOf(wrapped)).containsExactly(Integer.MIN_VALUE);

    assertThatThrownBy(
            () ->
                ScalarFunctions.POWER.call(
                    arrayOf(IntegerType.INTEGER, 2),
                    arrayOf(IntegerType.INTEGER, 31),
                    CHECKED,
                    CONTEXT))
        .isInstanceOf(KernelExecutionException.class)
        .hasMessage("power_checked: overflow");

    assertThatThrownBy(
            () ->
                ScalarFunctions.POWER.call(
                    arrayOf(IntegerType.INTEGER, 2), arrayOf(IntegerType.INTEGER, -1), CONTEXT))
        .isInstanceOf(KernelExecutionException.class)
        .hasMessageContaining("negative integer powers");

    Datum floating =
        ScalarFunctions.POWER.call(
            arrayOf(DoubleType.DOUBLE, 2.0d), arrayOf(DoubleType.DOUBLE, -1.0d), CONTEXT);
    assertThat(valuesOf(floating)).containsExactly(0.5d);
  }

  @Test
  public void scalarsAreBroadcast() {
    Datum result =
        ScalarFunctions.SUBTRACT.call(
            arrayOf(LongType.LONG, 10L, 20L, null), Datum.scalar(LongType.LONG, 1L), CONTEXT);
    assertThat(valuesOf(result)).containsExactly(9L, 19L, null);

    Datum scalar =
        ScalarFunctions.MULTIPLY.call(
            Datum.scalar(FloatType.FLOAT, 1.5f), Datum.scalar(FloatType.FLOAT, 2.0f), CONTEXT);
    assertThat(scalar).isEqualTo(Datum.scalar(FloatType.FLOAT, 3.0f));

    Datum nullScalar =
        ScalarFunctions.NEGATE.call(Datum.nullScalar(IntegerType.INTEGER), CONTEXT);
    assertThat(nullScalar).isEqualTo(Datum.nullScalar(IntegerType.INTEGER));
  }

  @Test
  public void chunkedInputGivesChunkedResult() {
    Datum values =
        chunkedOf(
            IntegerType.INTEGER,
            vectorOf(IntegerType.INTEGER, -1, 2),
            vectorOf(IntegerType.INTEGER),
            vectorOf(IntegerType.INTEGER, -3));

    Datum result = ScalarFunctions.ABS.call(values, CONTEXT);

    assertThat(result.kind()).isEqualTo(Kind.CHUNKED_ARRAY);
    assertThat(result.length()).isEqualTo(3);
    assertThat(valuesOf(result)).containsExactly(1, 2, 3);
  }

  @Test
  public void operandTypesMustMatch() {
    assertThatThrownBy(
            () ->
                ScalarFunctions.ADD.call(
                    arrayOf(IntegerType.INTEGER, 1), arrayOf(LongType.LONG, 1L), CONTEXT))
        .isInstanceOf(KernelExecutionException.class)
        .hasMessage("Function add has no kernel matching input types (int32, int64)");

    assertThatThrownBy(
            () -> ScalarFunctions.NEGATE.call(arrayOf(StringType.STRING, "a"), CONTEXT))
        .isInstanceOf(KernelExecutionException.class)
        .hasMessageContaining("no kernel matching input types (string)");
  }

  @Test
  public void arrayLengthsMustMatch() {
    assertThatThrownBy(
            () ->
                ScalarFunctions.ADD.call(
                    arrayOf(IntegerType.INTEGER, 1, 2),
                    arrayOf(IntegerType.INTEGER, 1),
                    CONTEXT))
        .isInstanceOf(KernelExecutionException.class)
        .hasMessageContaining("same length");
  }

  @Test
  public void tablesAreRejected() {
    StructType schema = new StructType().add("a", IntegerType.INTEGER);
    Datum table =
        Datum.table(
            new DefaultColumnarBatch(
                1,
                schema,
                Collections.singletonList(vectorOf(IntegerType.INTEGER, 1))));

    assertThatThrownBy(() -> ScalarFunctions.ABS.call(table, CONTEXT))
        .isInstanceOf(KernelExecutionException.class)
        .hasMessageContaining("does not accept TABLE arguments");
  }
}
