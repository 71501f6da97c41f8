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

import io.delta.compute.data.Datum;
import io.delta.compute.defaults.engine.DefaultExecContext;
import io.delta.compute.functions.ScalarFunctions;
import io.delta.compute.types.BooleanType;
import org.junit.Test;

public class TestBooleanKernels {
  private static final DefaultExecContext CONTEXT = DefaultExecContext.create();

  // every combination of true, false and null
  private static final Datum LEFT =
      arrayOf(BooleanType.BOOLEAN, true, true, true, false, false, false, null, null, null);
  private static final Datum RIGHT =
      arrayOf(BooleanType.BOOLEAN, true, false, null, true, false, null, true, false, null);

  @Test
  public void plainVariantsPropagateNulls() {
    assertThat(valuesOf(ScalarFunctions.AND.call(LEFT, RIGHT, CONTEXT)))
        .containsExactly(true, false, null, false, false, null, null, null, null);
    assertThat(valuesOf(ScalarFunctions.OR.call(LEFT, RIGHT, CONTEXT)))
        .containsExactly(true, true, null, true, false, null, null, null, null);
    assertThat(valuesOf(ScalarFunctions.XOR.call(LEFT, RIGHT, CONTEXT)))
        .containsExactly(false, true, null, true, false, null, null, null, null);
    assertThat(valuesOf(ScalarFunctions.AND_NOT.call(LEFT, RIGHT, CONTEXT)))
        .containsExactly(false, true, null, false, false, null, null, null, null);
    assertThat(valuesOf(ScalarFunctions.INVERT.call(LEFT, CONTEXT)))
        .containsExactly(false, false, false, true, true, true, null, null, null);
  }

  @Test
  public void kleeneVariants() {
    assertThat(valuesOf(ScalarFunctions.AND_KLEENE.call(LEFT, RIGHT, CONTEXT)))
        .containsExactly(true, false, null, false, false, false, null, false, null);
    assertThat(valuesOf(ScalarFunctions.OR_KLEENE.call(LEFT, RIGHT, CONTEXT)))
        .containsExactly(true, true, true, true, false, null, true, null, null);
    assertThat(valuesOf(ScalarFunctions.AND_NOT_KLEENE.call(LEFT, RIGHT, CONTEXT)))
        .containsExactly(false, true, null, false, false, false, false, null, null);
  }
}
