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

import io.delta.compute.data.ColumnVector;
import io.delta.compute.data.Datum;
import io.delta.compute.defaults.engine.DefaultExecContext;
import io.delta.compute.exceptions.InvalidArgumentException;
import io.delta.compute.functions.ScalarFunctions;
import io.delta.compute.options.SetLookupOptions;
import io.delta.compute.types.*;
import org.junit.Test;

public class TestSetLookupKernels {
  private static final DefaultExecContext CONTEXT = DefaultExecContext.create();

  @Test
  public void isInWithNullsInValueSet() {
    Datum probe = arrayOf(StringType.STRING, "a", "x", null);
    Datum valueSet = arrayOf(StringType.STRING, "b", null, "a");

    Datum matched = ScalarFunctions.IS_IN.call(probe, valueSet, CONTEXT);
    assertThat(matched.getDataType()).isEqualTo(BooleanType.BOOLEAN);
    assertThat(valuesOf(matched)).containsExactly(true, false, true);

    Datum skipped =
        ScalarFunctions.IS_IN.call(probe, new SetLookupOptions(valueSet, true), CONTEXT);
    assertThat(valuesOf(skipped)).containsExactly(true, false, false);
  }

  @Test
  public void nullProbeWithoutNullInValueSet() {
    Datum probe = arrayOf(IntegerType.INTEGER, 1, null);
    Datum valueSet = arrayOf(IntegerType.INTEGER, 1, 2);

    assertThat(valuesOf(ScalarFunctions.IS_IN.call(probe, valueSet, CONTEXT)))
        .containsExactly(true, false);
    assertThat(valuesOf(ScalarFunctions.INDEX_IN.call(probe, valueSet, CONTEXT)))
        .containsExactly(0, null);
  }

  @Test
  public void indexInReturnsFirstMatch() {
    Datum probe = arrayOf(LongType.LONG, 7L, 9L, 8L, null);
    Datum valueSet =
        chunkedOf(
            LongType.LONG, vectorOf(LongType.LONG, 8L, 7L), vectorOf(LongType.LONG, 8L, null));

    Datum indices = ScalarFunctions.INDEX_IN.call(probe, valueSet, CONTEXT);
    assertThat(indices.getDataType()).isEqualTo(IntegerType.INTEGER);
    assertThat(valuesOf(indices)).containsExactly(1, null, 0, 3);

    Datum skipped =
        ScalarFunctions.INDEX_IN.call(probe, new SetLookupOptions(valueSet, true), CONTEXT);
    assertThat(valuesOf(skipped)).containsExactly(1, null, 0, null);
  }

  @Test
  public void dictionaryProbeIsDecoded() {
    ColumnVector dictionary = vectorOf(StringType.STRING, "red", "green", "blue");
    Datum probe = Datum.array(dictionaryOf(dictionary, (byte) 2, (byte) 0, null, (byte) 1));
    Datum valueSet = arrayOf(StringType.STRING, "green", "blue", "yellow");

    assertThat(valuesOf(ScalarFunctions.IS_IN.call(probe, valueSet, CONTEXT)))
        .containsExactly(true, false, false, true);
    assertThat(valuesOf(ScalarFunctions.INDEX_IN.call(probe, valueSet, CONTEXT)))
        .containsExactly(1, null, null, 0);
  }

  @Test
  public void emptyValueSetOfAnotherType() {
    Datum probe = arrayOf(IntegerType.INTEGER, 1, null, 3);
    Datum emptyValueSet = arrayOf(StringType.STRING);

    assertThat(valuesOf(ScalarFunctions.IS_IN.call(probe, emptyValueSet, CONTEXT)))
        .containsExactly(false, false, false);
    assertThat(valuesOf(ScalarFunctions.INDEX_IN.call(probe, emptyValueSet, CONTEXT)))
        .containsExactly(null, null, null);
  }

  @Test
  public void scalarProbe() {
    Datum valueSet = arrayOf(BinaryType.BINARY, new byte[] {1}, new byte[] {2, 3});
    Datum result =
        ScalarFunctions.INDEX_IN.call(
            Datum.scalar(BinaryType.BINARY, new byte[] {2, 3}), valueSet, CONTEXT);
    assertThat(result).isEqualTo(Datum.scalar(IntegerType.INTEGER, 1));
  }

  @Test
  public void mismatchedValueSetIsRejected() {
    Datum probe = arrayOf(IntegerType.INTEGER, 1, 2);
    Datum valueSet =
        chunkedOf(LongType.LONG, vectorOf(LongType.LONG, 1L, 2L, 3L, 4L, 5L));

    assertThatThrownBy(() -> ScalarFunctions.IS_IN.call(probe, valueSet, CONTEXT))
        .isInstanceOf(InvalidArgumentException.class)
        .hasMessageContaining("int32")
        .hasMessageContaining("int64");
  }
}
