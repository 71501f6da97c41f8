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

import static io.delta.compute.utils.ComputeTestUtils.arrayOf;
import static io.delta.compute.utils.ComputeTestUtils.chunkedOf;
import static io.delta.compute.utils.ComputeTestUtils.vectorOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.delta.compute.data.Datum;
import io.delta.compute.exceptions.InvalidArgumentException;
import io.delta.compute.options.SetLookupOptions;
import io.delta.compute.types.*;
import org.junit.Test;

public class TestSetLookupValidator {

  @Test
  public void matchingTypesPass() {
    Datum probe = arrayOf(IntegerType.INTEGER, 1, 2, null);
    Datum valueSet = arrayOf(IntegerType.INTEGER, 2, 3);
    assertThatNoException()
        .isThrownBy(() -> SetLookupValidator.validate(probe, new SetLookupOptions(valueSet)));
  }

  @Test
  public void mismatchedTypesNameBothTypes() {
    Datum probe = arrayOf(IntegerType.INTEGER, 1, 2);
    Datum valueSet =
        chunkedOf(
            LongType.LONG, vectorOf(LongType.LONG, 1L, 2L), vectorOf(LongType.LONG, 3L, 4L, 5L));
    assertThat(valueSet.length()).isEqualTo(5);

    assertThatThrownBy(
            () -> SetLookupValidator.validate(probe, new SetLookupOptions(valueSet)))
        .isInstanceOf(InvalidArgumentException.class)
        .hasMessage("Array type didn't match type of values set: int32 vs int64");
  }

  @Test
  public void dictionaryProbeIsComparedByValueType() {
    DictionaryType dictionaryType = new DictionaryType(ByteType.BYTE, StringType.STRING);
    Datum probe = Datum.scalar(dictionaryType, "b");
    Datum valueSet = arrayOf(StringType.STRING, "a", "b", "c");
    assertThatNoException()
        .isThrownBy(() -> SetLookupValidator.validate(probe, new SetLookupOptions(valueSet)));

    // the index type never matches
    Datum indexTypedSet = arrayOf(ByteType.BYTE, (byte) 0, (byte) 1);
    assertThatThrownBy(
            () -> SetLookupValidator.validate(probe, new SetLookupOptions(indexTypedSet)))
        .isInstanceOf(InvalidArgumentException.class)
        .hasMessageContaining("string")
        .hasMessageContaining("int8");
  }

  @Test
  public void comparisonType() {
    assertThat(SetLookupValidator.comparisonType(IntegerType.INTEGER))
        .isEqualTo(IntegerType.INTEGER);
    assertThat(
            SetLookupValidator.comparisonType(
                new DictionaryType(IntegerType.INTEGER, DateType.DATE)))
        .isEqualTo(DateType.DATE);
  }

  @Test
  public void scalarValueSetIsRejected() {
    Datum probe = arrayOf(IntegerType.INTEGER, 1, 2);
    // rejected even though the types agree
    Datum valueSet = Datum.scalar(IntegerType.INTEGER, 1);
    assertThatThrownBy(
            () -> SetLookupValidator.validate(probe, new SetLookupOptions(valueSet)))
        .isInstanceOf(InvalidArgumentException.class)
        .hasMessageContaining("Set lookup value set must be Array or ChunkedArray");
  }

  @Test
  public void emptyValueSetAcceptsAnyProbeType() {
    Datum emptyStrings = arrayOf(StringType.STRING);
    Datum emptyChunked = chunkedOf(LongType.LONG);

    for (Datum probe :
        new Datum[] {
          arrayOf(IntegerType.INTEGER, 1),
          Datum.scalar(DoubleType.DOUBLE, 1.5d),
          arrayOf(new DictionaryType(ByteType.BYTE, BinaryType.BINARY))
        }) {
      assertThatNoException()
          .isThrownBy(
              () -> SetLookupValidator.validate(probe, new SetLookupOptions(emptyStrings)));
      assertThatNoException()
          .isThrownBy(
              () -> SetLookupValidator.validate(probe, new SetLookupOptions(emptyChunked, true)));
    }
  }
}
