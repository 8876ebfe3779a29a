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

import java.time.Instant;
import lombok.Value;

/**
 * Half-open time range, <code>[start, end)</code>.
 */
@Value
public class TimeRange {
  Instant start;
  Instant end;

  public static TimeRange of(Instant start, Instant end) {
    if (!start.isBefore(end)) {
      throw new IllegalArgumentException("Range start must be before end: " + start + " " + end);
    }
    return new TimeRange(start, end);
  }

  public boolean contains(Instant ts) {
    return !ts.isBefore(start) && ts.isBefore(end);
  }

  public boolean covers(TimeRange other) {
    return !other.start.isBefore(start) && !other.end.isAfter(end);
  }

  public boolean overlaps(TimeRange other) {
    return start.isBefore(other.end) && other.start.isBefore(end);
  }
}
