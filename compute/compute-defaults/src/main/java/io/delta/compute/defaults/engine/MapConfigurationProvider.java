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
package io.delta.compute.defaults.engine;

import static java.util.Objects.requireNonNull;

import io.delta.compute.config.ConfigurationProvider;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/** {@link ConfigurationProvider} backed by an immutable copy of a map. */
public class MapConfigurationProvider implements ConfigurationProvider {
  private final Map<String, String> entries;

  public MapConfigurationProvider(Map<String, String> entries) {
    this.entries = Collections.unmodifiableMap(new HashMap<>(requireNonNull(entries)));
  }

  public static MapConfigurationProvider empty() {
    return new MapConfigurationProvider(Collections.emptyMap());
  }

  @Override
  public String get(String key) throws NoSuchElementException {
    if (!entries.containsKey(key)) {
      throw new NoSuchElementException(String.format("No configuration value for key %s", key));
    }
    return entries.get(key);
  }

  @Override
  public Optional<String> getOptional(String key) {
    return Optional.ofNullable(entries.get(key));
  }

  @Override
  public String toString() {
    return "MapConfigurationProvider" + entries;
  }
}
