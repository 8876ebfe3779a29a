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
import java.util.List;
import java.util.Map;
import lombok.Data;

@Data
public class RollupQuery {
  String cube;
  List<String> measures = List.of();
  List<String> dimensions = List.of();
  /**
   * Time grouping of the result, or null for totals over the whole range.
   */
  Granularity granularity;
  Instant start;
  Instant end;
  /**
   * Dimension name to the accepted values.
   */
  Map<String, List<String>> filters = Map.of();

  public TimeRange timeRange() {
    return TimeRange.of(start, end);
  }
}
