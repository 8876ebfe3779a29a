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

package com.rackspace.rollup.app.model;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Calendar buckets used both for the time dimension of aggregate rows and for partitioning.
 * All bucket math is done in UTC.
 */
public enum Granularity {
  MINUTE {
    @Override
    ZonedDateTime floor(ZonedDateTime ts) {
      return ts.truncatedTo(ChronoUnit.MINUTES);
    }

    @Override
    ZonedDateTime step(ZonedDateTime bucket) {
      return bucket.plusMinutes(1);
    }
  },
  HOUR {
    @Override
    ZonedDateTime floor(ZonedDateTime ts) {
      return ts.truncatedTo(ChronoUnit.HOURS);
    }

    @Override
    ZonedDateTime step(ZonedDateTime bucket) {
      return bucket.plusHours(1);
    }
  },
  DAY {
    @Override
    ZonedDateTime floor(ZonedDateTime ts) {
      return ts.truncatedTo(ChronoUnit.DAYS);
    }

    @Override
    ZonedDateTime step(ZonedDateTime bucket) {
      return bucket.plusDays(1);
    }
  },
  /**
   * ISO weeks, starting on Monday.
   */
  WEEK {
    @Override
    ZonedDateTime floor(ZonedDateTime ts) {
      return ts.truncatedTo(ChronoUnit.DAYS).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    @Override
    ZonedDateTime step(ZonedDateTime bucket) {
      return bucket.plusWeeks(1);
    }
  },
  MONTH {
    @Override
    ZonedDateTime floor(ZonedDateTime ts) {
      return ts.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1);
    }

    @Override
    ZonedDateTime step(ZonedDateTime bucket) {
      return bucket.plusMonths(1);
    }
  },
  QUARTER {
    @Override
    ZonedDateTime floor(ZonedDateTime ts) {
      final int firstMonth = ((ts.getMonthValue() - 1) / 3) * 3 + 1;
      return ts.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1).withMonth(firstMonth);
    }

    @Override
    ZonedDateTime step(ZonedDateTime bucket) {
      return bucket.plusMonths(3);
    }
  },
  YEAR {
    @Override
    ZonedDateTime floor(ZonedDateTime ts) {
      return ts.truncatedTo(ChronoUnit.DAYS).withDayOfYear(1);
    }

    @Override
    ZonedDateTime step(ZonedDateTime bucket) {
      return bucket.plusYears(1);
    }
  };

  abstract ZonedDateTime floor(ZonedDateTime ts);

  abstract ZonedDateTime step(ZonedDateTime bucket);

  public Instant truncate(Instant ts) {
    return floor(ts.atZone(ZoneOffset.UTC)).toInstant();
  }

  /**
   * @param bucket an aligned bucket start
   * @return the start of the following bucket
   */
  public Instant next(Instant bucket) {
    return step(bucket.atZone(ZoneOffset.UTC)).toInstant();
  }

  public boolean isAligned(Instant ts) {
    return truncate(ts).equals(ts);
  }

  /**
   * Indicates if every bucket of this granularity is an exact union of buckets of the other.
   */
  public boolean isMultipleOf(Granularity other) {
    if (this == other) {
      return true;
    }
    switch (other) {
      case MINUTE:
        return true;
      case HOUR:
        return this != MINUTE;
      case DAY:
        return ordinal() > DAY.ordinal();
      case MONTH:
        return this == QUARTER || this == YEAR;
      case QUARTER:
        return this == YEAR;
      default:
        return false;
    }
  }
}
