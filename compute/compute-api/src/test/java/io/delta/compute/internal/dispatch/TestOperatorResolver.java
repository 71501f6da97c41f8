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

import static org.assertj.core.api.Assertions.assertThat;

import io.delta.compute.functions.Arity;
import io.delta.compute.functions.FunctionId;
import io.delta.compute.options.CompareOperator;
import io.delta.compute.options.CompareOptions;
import java.util.EnumSet;
import java.util.Set;
import org.junit.Test;

public class TestOperatorResolver {

  @Test
  public void everyOperatorMapsToADistinctComparisonFunction() {
    Set<FunctionId> resolved = EnumSet.noneOf(FunctionId.class);
    for (CompareOperator operator : CompareOperator.values()) {
      FunctionId functionId = OperatorResolver.resolve(operator);
      assertThat(functionId.getRegistryName()).isNotEmpty();
      assertThat(functionId.getArity()).isEqualTo(Arity.BINARY);
      assertThat(resolved.add(functionId)).as("duplicate mapping for %s", operator).isTrue();
    }
    assertThat(resolved)
        .containsExactlyInAnyOrder(
            FunctionId.EQUAL,
            FunctionId.NOT_EQUAL,
            FunctionId.GREATER,
            FunctionId.GREATER_EQUAL,
            FunctionId.LESS,
            FunctionId.LESS_EQUAL);
  }

  @Test
  public void canonicalNames() {
    assertThat(OperatorResolver.resolve(CompareOperator.EQUAL).getRegistryName())
        .isEqualTo("equal");
    assertThat(OperatorResolver.resolve(CompareOperator.NOT_EQUAL).getRegistryName())
        .isEqualTo("not_equal");
    assertThat(OperatorResolver.resolve(CompareOperator.GREATER).getRegistryName())
        .isEqualTo("greater");
    assertThat(OperatorResolver.resolve(CompareOperator.GREATER_EQUAL).getRegistryName())
        .isEqualTo("greater_equal");
    assertThat(OperatorResolver.resolve(CompareOperator.LESS).getRegistryName())
        .isEqualTo("less");
    assertThat(OperatorResolver.resolve(CompareOperator.LESS_EQUAL).getRegistryName())
        .isEqualTo("less_equal");
  }

  @Test
  public void resolverUsesOperatorOfOptions() {
    assertThat(OperatorResolver.resolver().resolve(new CompareOptions(CompareOperator.LESS)))
        .isEqualTo(FunctionId.LESS);
    assertThat(OperatorResolver.resolver().resolve(CompareOptions.defaults()))
        .isEqualTo(FunctionId.EQUAL);
    assertThat(OperatorResolver.resolver().candidates()).hasSize(CompareOperator.values().length);
  }
}
