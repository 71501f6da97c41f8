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
package io.delta.compute.options;

import com.fasterxml.jackson.core.JsonGenerator;
import io.delta.compute.annotation.Evolving;
import java.io.IOException;

/**
 * Options for arithmetic functions.
 *
 * <p>When {@code checkOverflow} is set the checked variant of the function is invoked, which fails
 * on integer overflow instead of wrapping around.
 */
@Evolving
public final class ArithmeticOptions extends FunctionOptions {
  private final boolean checkOverflow;

  public ArithmeticOptions() {
    this(false);
  }

  public ArithmeticOptions(boolean checkOverflow) {
    this.checkOverflow = checkOverflow;
  }

  public static ArithmeticOptions defaults() {
    return new ArithmeticOptions();
  }

  public boolean isCheckOverflow() {
    return checkOverflow;
  }

  @Override
  protected void writeFields(JsonGenerator generator) throws IOException {
    generator.writeBooleanField("check_overflow", checkOverflow);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return checkOverflow == ((ArithmeticOptions) o).checkOverflow;
  }

  @Override
  public int hashCode() {
    return Boolean.hashCode(checkOverflow);
  }

  @Override
  public String toString() {
    return "ArithmeticOptions(checkOverflow=" + checkOverflow + ")";
  }
}
