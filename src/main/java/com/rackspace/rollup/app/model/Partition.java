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

import com.rackspace.rollup.app.aggregate.AggregateRow;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Committed snapshot of one partition. A refresh replaces the whole snapshot, so a reader
 * holding an instance always sees rows, checksum and refresh time that belong together.
 */
@Value
@Builder(toBuilder = true)
public class Partition {
  PartitionKey key;
  TimeRange timeRange;
  List<AggregateRow> rows;
  Instant lastRefreshed;
  String checksum;
  /**
   * Source watermark observed when the content was computed, for condition refresh policies.
   */
  String watermark;

  public int getRowCount() {
    return rows.size();
  }
}
