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

package com.rackspace.rollup.app.aggregate;

import java.time.Instant;
import java.util.Map;
import lombok.Data;

/**
 * One group of a rollup: the bucket it belongs to, its dimension values and the partial
 * aggregate of each measure. Rows held by a committed partition are never mutated.
 */
@Data
public class AggregateRow {
  /**
   * Null when the rows are not grouped by time.
   */
  Instant timestamp;
  Map<String, String> dimensions;
  Map<String, PartialAggregate> measures;
}
