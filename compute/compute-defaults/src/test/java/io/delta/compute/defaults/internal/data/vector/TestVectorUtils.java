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
package io.delta.compute.defaults.internal.data.vector;

import static io.delta.compute.defaults.utils.DefaultComputeTestUtils.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.delta.compute.data.ColumnVector;
import io.delta.compute.data.Datum;
import io.delta.compute.types.*;
import java.util.Arrays;
import org.junit.Test;

public class TestVectorUtils {

  @Test
  public void decodesDictionaryVectors() {
    ColumnVector dictionary = vectorOf(StringType.STRING, "x", "y");
    ColumnVector encoded = dictionaryOf(dictionary, (byte) 1, null, (byte) 0);

    assertThat(VectorUtils.getValueAsObject(encoded, 0)).isEqualTo("y");
    assertThat(VectorUtils.getValueAsObject(encoded, 1)).isNull();
    assertThat(VectorUtils.getValueAsObject(encoded, 2)).isEqualTo("x");
    // row accessors return the index
    assertThat(encoded.getByte(0)).isEqualTo((byte) 1);
  }

  @Test
  public void genericVectorRejectsDictionaryType() {
    DictionaryType type = new DictionaryType(ByteType.BYTE, StringType.STRING);
    assertThatThrownBy(() -> DefaultGenericVector.fromArray(type, new Object[] {(byte) 0}))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("dictionary vectors must be created with DefaultDictionaryVector");
  }

  @Test
  public void chunksWithOwnDictionaries() {
    DictionaryType type = new DictionaryType(ByteType.BYTE, IntegerType.INTEGER);
    Datum chunked =
        chunkedOf(
            type,
            dictionaryOf(vectorOf(IntegerType.INTEGER, 10, 20), (byte) 1, (byte) 0),
            dictionaryOf(vectorOf(IntegerType.INTEGER, 30), (byte) 0));

    assertThat(VectorUtils.toJavaList(chunked)).containsExactly(20, 10, 30);
  }

  @Test
  public void chunkedViewSkipsEmptyChunks() {
    ChunkedColumnVector vector =
        new ChunkedColumnVector(
            LongType.LONG,
            Arrays.asList(
                vectorOf(LongType.LONG),
                vectorOf(LongType.LONG, 1L),
                vectorOf(LongType.LONG),
                vectorOf(LongType.LONG),
                vectorOf(LongType.LONG, 2L, null)));

    assertThat(vector.getSize()).isEqualTo(3);
    assertThat(vector.getLong(0)).isEqualTo(1L);
    assertThat(vector.getLong(1)).isEqualTo(2L);
    assertThat(vector.isNullAt(2)).isTrue();
    assertThatThrownBy(() -> vector.getLong(3)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void structRowsAreLists() {
    StructType type = new StructType().add("a", IntegerType.INTEGER).add("b", StringType.STRING);
    ColumnVector vector = vectorOf(type, Arrays.asList(1, "one"), null);

    assertThat(VectorUtils.getValueAsObject(vector, 0)).isEqualTo(Arrays.asList(1, "one"));
    assertThat(VectorUtils.getValueAsObject(vector, 1)).isNull();
    assertThat(vector.getChild(1).getString(0)).isEqualTo("one");
  }

  @Test
  public void typedAccessIsChecked() {
    ColumnVector vector = vectorOf(IntegerType.INTEGER, 1);
    assertThatThrownBy(() -> vector.getLong(0))
        .isInstanceOf(UnsupportedOperationException.class)
        .hasMessageContaining("int32");
  }
}
