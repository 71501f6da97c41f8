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

import io.delta.compute.config.ConfigurationProvider;
import io.delta.compute.defaults.engine.DefaultExecContext;
import io.delta.compute.defaults.engine.DefaultFunctionRegistry;
import io.delta.compute.defaults.internal.DefaultComputeErrors;
import io.delta.compute.engine.Kernel;
import io.delta.compute.functions.FunctionId;
import io.delta.compute.types.*;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.IsoFields;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Kernels extracting calendar and clock fields from {@code date32} (days since the epoch) and
 * {@code timestamp} (microseconds since the epoch) values. Timestamps are interpreted in the zone
 * configured under {@link DefaultExecContext#TIME_ZONE_KEY}; the clock fields of a date are 0.
 */
final class TemporalKernels {
  private TemporalKernels() {}

  private static final ZoneId UTC = ZoneId.of("UTC");

  static final StructType ISO_CALENDAR_TYPE =
      new StructType()
          .add("iso_year", LongType.LONG)
          .add("iso_week", LongType.LONG)
          .add("iso_day_of_week", LongType.LONG);

  static void registerAll(DefaultFunctionRegistry registry) {
    registerField(registry, FunctionId.YEAR, time -> (long) time.getYear());
    registerField(registry, FunctionId.MONTH, time -> (long) time.getMonthValue());
    registerField(registry, FunctionId.DAY, time -> (long) time.getDayOfMonth());
    // Monday is 0
    registerField(
        registry, FunctionId.DAY_OF_WEEK, time -> (long) time.getDayOfWeek().getValue() - 1);
    registerField(registry, FunctionId.DAY_OF_YEAR, time -> (long) time.getDayOfYear());
    registerField(
        registry, FunctionId.ISO_YEAR, time -> (long) time.get(IsoFields.WEEK_BASED_YEAR));
    registerField(
        registry,
        FunctionId.ISO_WEEK,
        time -> (long) time.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
    registerField(
        registry, FunctionId.QUARTER, time -> (long) time.get(IsoFields.QUARTER_OF_YEAR));
    registerField(registry, FunctionId.HOUR, time -> (long) time.getHour());
    registerField(registry, FunctionId.MINUTE, time -> (long) time.getMinute());
    registerField(registry, FunctionId.SECOND, time -> (long) time.getSecond());
    registerField(
        registry, FunctionId.MILLISECOND, time -> (long) (time.getNano() / 1_000_000));
    registerField(
        registry, FunctionId.MICROSECOND, time -> (long) (time.getNano() / 1_000 % 1_000));
    registerField(registry, FunctionId.NANOSECOND, time -> (long) (time.getNano() % 1_000));

    registry.register(
        FunctionId.SUBSECOND,
        fieldKernel(
            FunctionId.SUBSECOND,
            DoubleType.DOUBLE,
            time -> time.getNano() / (double) TimeUnit.SECONDS.toNanos(1)));
    registry.register(
        FunctionId.ISO_CALENDAR,
        fieldKernel(
            FunctionId.ISO_CALENDAR,
            ISO_CALENDAR_TYPE,
            time ->
                Arrays.asList(
                    (long) time.get(IsoFields.WEEK_BASED_YEAR),
                    (long) time.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR),
                    (long) time.getDayOfWeek().getValue())));
  }

  private static void registerField(
      DefaultFunctionRegistry registry,
      FunctionId functionId,
      Function<ZonedDateTime, Long> field) {
    registry.register(functionId, fieldKernel(functionId, LongType.LONG, field::apply));
  }

  private static Kernel fieldKernel(
      FunctionId functionId, DataType resultType, Function<ZonedDateTime, Object> field) {
    String name = functionId.getRegistryName();
    return (arguments, options, context) -> {
      DataType type = KernelUtils.checkSameType(name, arguments, TemporalKernels::isTemporal);
      ZoneId zone = timeZone(context.getConfiguration());
      boolean isDate = type instanceof DateType;
      return KernelUtils.mapRowsNullPropagating(
          name,
          arguments,
          resultType,
          values -> {
            ZonedDateTime time =
                isDate
                    ? LocalDate.ofEpochDay((Integer) values[0]).atStartOfDay(UTC)
                    : toZonedDateTime((Long) values[0], zone);
            return field.apply(time);
          });
    };
  }

  static ZonedDateTime toZonedDateTime(long epochMicros, ZoneId zone) {
    long seconds = Math.floorDiv(epochMicros, 1_000_000L);
    long micros = Math.floorMod(epochMicros, 1_000_000L);
    return Instant.ofEpochSecond(seconds, micros * 1_000L).atZone(zone);
  }

  static ZoneId timeZone(ConfigurationProvider configuration) {
    String timeZone =
        configuration
            .getOptional(DefaultExecContext.TIME_ZONE_KEY)
            .orElse(DefaultExecContext.DEFAULT_TIME_ZONE);
    try {
      return ZoneId.of(timeZone.trim());
    } catch (DateTimeException e) {
      throw DefaultComputeErrors.invalidTimeZone(timeZone, e);
    }
  }

  static boolean isTemporal(DataType type) {
    return type instanceof DateType || type instanceof TimestampType;
  }
}
