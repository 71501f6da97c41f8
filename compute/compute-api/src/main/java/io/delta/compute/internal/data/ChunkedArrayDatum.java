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
package io.delta.compute.internal.data;

import static io.delta.compute.internal.util.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import io.delta.compute.data.ColumnVector;
import io.delta.compute.data.Datum;
import io.delta.compute.types.DataType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A datum made of zero or more {@link ColumnVector} chunks of the same type. */
public class ChunkedArrayDatum implements Datum {
  private final DataType dataType;
  private final List<ColumnVector> chunks;
  private final long length;

  public ChunkedArrayDatum(DataType dataType, List<ColumnVector> chunks) {
    this.dataType = requireNonNull(dataType, "dataType is null");
    requireNonNull(chunks, "chunks is null");
    long totalLength = 0;
    for (int i = 0; i < chunks.size(); i++) {
      ColumnVector chunk = requireNonNull(chunks.get(i), "chunk is null");
      checkArgument(
          dataType.equals(chunk.getDataType()),
          "Chunk %s has type %s, expected %s",
          i,
          chunk.getDataType(),
          dataType);
      totalLength += chunk.getSize();
    }
    this.chunks = Collections.unmodifiableList(new ArrayList<>(chunks));
    this.length = totalLength;
  }

  @Override
  public Kind kind() {
    return Kind.CHUNKED_ARRAY;
  }

  @Override
  public DataType getDataType() {
    return dataType;
  }

  @Override
  public long length() {
    return length;
  }

  @Override
  public List<ColumnVector> getChunks() {
    return chunks;
  }

  @Override
  public String toString() {
    return String.format("ChunkedArray<%s>[%s, chunks=%s]", dataType, length, chunks.size());
  }
}
