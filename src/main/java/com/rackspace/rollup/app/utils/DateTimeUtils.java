/*
 * Copyright 2020 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.rollup.app.utils;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class DateTimeUtils {

  public static final String RELATIVE_TIME_PATTERN = "([0-9]+)(ms|s|m|h|d|w)-ago";
  public static final String EPOCH_MILLIS_PATTERN = "\\d{13,}";
  public static final String EPOCH_SECONDS_PATTERN = "\\d{1,12}";

  private static final Map<String, ChronoUnit> RELATIVE_UNITS = Map.of(
      "ms", ChronoUnit.MILLIS,
      "s", ChronoUnit.SECONDS,
      "m", ChronoUnit.MINUTES,
      "h", ChronoUnit.HOURS,
      "d", ChronoUnit.DAYS,
      "w", ChronoUnit.WEEKS
  );

  /**
   * Gets the absolute Instant instance for relativeTime.
   */
  public static Instant getAbsoluteTimeFromRelativeTime(String relativeTime, Instant now) {
    Matcher match = Pattern.compile(RELATIVE_TIME_PATTERN).matcher(relativeTime);
    if (match.matches()) {
      final Duration amount = RELATIVE_UNITS.get(match.group(2)).getDuration()
          .multipliedBy(Long.parseLong(match.group(1)));
      return now.minus(amount);
    } else {
      throw new IllegalArgumentException("Invalid relative time format");
    }
  }

  /**
   * Checks if the string time is valid Instant in UTC.
   */
  public static boolean isValidInstantInstance(String time) {
    try {
      Instant.parse(time);
      return true;
    } catch (DateTimeParseException dateTimeParseException) {
      return false;
    }
  }

  public static boolean isValidEpochMillis(String time) {
    return Pattern.compile(EPOCH_MILLIS_PATTERN).matcher(time).matches();
  }

  public static boolean isValidEpochSeconds(String time) {
    return Pattern.compile(EPOCH_SECONDS_PATTERN).matcher(time).matches();
  }

  /**
   * Gets the instance of Instant based on the format of argument.
   */
  public static Instant parseInstant(String instant, Instant now) {
    if (instant == null) {
      return now;
    }
    if (isValidInstantInstance(instant)) {
      return Instant.parse(instant);
    } else if (isValidEpochMillis(instant)) {
      return Instant.ofEpochMilli(Long.parseLong(instant));
    } else if (isValidEpochSeconds(instant)) {
      return Instant.ofEpochSecond(Long.parseLong(instant));
    } else {
      return getAbsoluteTimeFromRelativeTime(instant, now);
    }
  }

  /**
   * Converts a time value as returned by a JDBC driver. Values without an offset are taken
   * as UTC, except {@link Timestamp} which carries its own conversion.
   */
  public static Instant toInstant(Object value) {
    if (value == null) {
      return null;
    } else if (value instanceof Instant) {
      return (Instant) value;
    } else if (value instanceof java.sql.Date) {
      return ((java.sql.Date) value).toLocalDate().atStartOfDay(ZoneOffset.UTC).toInstant();
    } else if (value instanceof Timestamp) {
      return ((Timestamp) value).toInstant();
    } else if (value instanceof OffsetDateTime) {
      return ((OffsetDateTime) value).toInstant();
    } else if (value instanceof ZonedDateTime) {
      return ((ZonedDateTime) value).toInstant();
    } else if (value instanceof LocalDateTime) {
      return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
    } else if (value instanceof LocalDate) {
      return ((LocalDate) value).atStartOfDay(ZoneOffset.UTC).toInstant();
    } else if (value instanceof Date) {
      return ((Date) value).toInstant();
    } else if (value instanceof Number) {
      return Instant.ofEpochMilli(((Number) value).longValue());
    } else {
      return Instant.parse(value.toString());
    }
  }
}
