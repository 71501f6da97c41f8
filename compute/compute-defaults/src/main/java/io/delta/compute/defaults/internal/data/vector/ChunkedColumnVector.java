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

import static io.delta.compute.internal.util.Preconditions.checkArgument;

import io.delta.compute.data.ColumnVector;
import io.delta.compute.types.DataType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Read-only view presenting the chunks of a chunked array as one contiguous vector. */
public class ChunkedColumnVector implements ColumnVector {
  private final DataType dataType;
  private final List<ColumnVector> chunks;
  // offsets[i] is the row id of the first row of chunk i
  private final int[] offsets;
  private final int size;

  public ChunkedColumnVector(DataType dataType, List<ColumnVector> chunks) {
    this.dataType = dataType;
    this.chunks = new ArrayList<>(chunks);
    this.offsets = new int[chunks.size()];
    long total = 0;
    for (int i = 0; i < chunks.size(); i++) {
      offsets[i] = (int) total;
      total += chunks.get(i).getSize();
    }
    checkArgument(total <= Integer.MAX_VALUE, "chunked array is too large: %s rows", total);
    this.size = (int) total;
  }

  @Override
  public DataType getDataType() {
    return dataType;
  }

  @Override
  public int getSize() {
    return size;
  }

  @Override
  public void close() {
    // chunks are owned by the chunked array
  }

  @Override
  public boolean isNullAt(int rowId) {
    int chunk = chunkOf(rowId);
    return chunks.get(chunk).isNullAt(rowId - offsets[chunk]);
  }

  @Override
  public boolean getBoolean(int rowId) {
    int chunk = chunkOf(rowId);
    return chunks.get(chunk).getBoolean(rowId - offsets[chunk]);
  }

  @Override
  public byte getByte(int rowId) {
    int chunk = chunkOf(rowId);
    return chunks.get(chunk).getByte(rowId - offsets[chunk]);
  }

  @Override
  public short getShort(int rowId) {
    int chunk = chunkOf(rowId);
    return chunks.get(chunk).getShort(rowId - offsets[chunk]);
  }

  @Override
  public int getInt(int rowId) {
    int chunk = chunkOf(rowId);
    return chunks.get(chunk).getInt(rowId - offsets[chunk]);
  }

  @Override
  public long getLong(int rowId) {
    int chunk = chunkOf(rowId);
    return chunks.get(chunk).getLong(rowId - offsets[chunk]);
  }

  @Override
  public float getFloat(int rowId) {
    int chunk = chunkOf(rowId);
    return chunks.get(chunk).getFloat(rowId - offsets[chunk]);
  }

  @Override
  public double getDouble(int rowId) {
    int chunk = chunkOf(rowId);
    return chunks.get(chunk).getDouble(rowId - offsets[chunk]);
  }

  @Override
  public byte[] getBinary(int rowId) {
    int chunk = chunkOf(rowId);
    return chunks.get(chunk).getBinary(rowId - offsets[chunk]);
  }

  @Override
  public String getString(int rowId) {
    int chunk = chunkOf(rowId);
    return chunks.get(chunk).getString(rowId - offsets[chunk]);
  }

  /** Returns the value of a row of a dictionary typed chunk, decoded. */
  public Object getDecodedValue(int rowId) {
    int chunk = chunkOf(rowId);
    return VectorUtils.getValueAsObject(chunks.get(chunk), rowId - offsets[chunk]);
  }

  private int chunkOf(int rowId) {
    checkArgument(rowId >= 0 && rowId < size, "invalid row access: %s", rowId);
    int index = Arrays.binarySearch(offsets, rowId);
    if (index < 0) {
      return -index - 2;
    }
    // skip empty chunks sharing the same offset
    while (index + 1 < offsets.length && offsets[index + 1] == rowId) {
      index++;
    }
    return index;
  }
}
