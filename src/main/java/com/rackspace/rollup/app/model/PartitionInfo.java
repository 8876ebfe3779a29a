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
import lombok.Data;

/**
 * Partition metadata exposed to operators; never carries the rows themselves.
 */
@Data
public class PartitionInfo {
  String storageId;
  String definitionId;
  Instant start;
  Instant end;
  int rowCount;
  Instant lastRefreshed;
  String checksum;
  PartitionStatus status;

  public static PartitionInfo from(Partition partition, PartitionStatus status) {
    return new PartitionInfo()
        .setStorageId(partition.getKey().getStorageId())
        .setDefinitionId(partition.getKey().getDefinitionId())
        .setStart(partition.getTimeRange().getStart())
        .setEnd(partition.getTimeRange().getEnd())
        .setRowCount(partition.getRowCount())
        .setLastRefreshed(partition.getLastRefreshed())
        .setChecksum(partition.getChecksum())
        .setStatus(status);
  }
}
