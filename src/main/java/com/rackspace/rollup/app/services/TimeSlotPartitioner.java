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

package com.rackspace.rollup.app.services;

import com.rackspace.rollup.app.aggregate.TemporalNormalizer;
import com.rackspace.rollup.app.exception.InvalidBucketException;
import com.rackspace.rollup.app.model.Granularity;
import com.rackspace.rollup.app.model.PartitionKey;
import com.rackspace.rollup.app.model.PreAggregationDefinition;
import com.rackspace.rollup.app.model.TenantIsolationKey;
import com.rackspace.rollup.app.model.TimeRange;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class TimeSlotPartitioner {

  /**
   * Derives the key of the partition starting at the given bucket.
   *
   * @throws InvalidBucketException if the bucket is not a partition boundary of the definition
   */
  public PartitionKey deriveKey(PreAggregationDefinition definition, TenantIsolationKey tenant,
                                Instant bucket) {
    final Granularity granularity = definition.getPartitionGranularity();
    if (!granularity.isAligned(bucket)) {
      throw new InvalidBucketException(String.format(
          "Bucket %s is not aligned to the %s partitions of %s", bucket, granularity,
          definition.getId()));
    }
    return new PartitionKey(definition.getId(), definition.getStructureVersion(), tenant, bucket);
  }

  public Instant partitionBucket(PreAggregationDefinition definition, Instant ts) {
    return ts.with(new TemporalNormalizer(definition.getPartitionGranularity()));
  }

  public TimeRange rangeOf(PreAggregationDefinition definition, Instant bucket) {
    return TimeRange.of(bucket, definition.getPartitionGranularity().next(bucket));
  }

  /**
   * @param start start of range, inclusive
   * @param end end of range, exclusive
   * @return the partition buckets overlapping the range in ascending order
   */
  public List<Instant> partitionsOverRange(PreAggregationDefinition definition, Instant start,
                                           Instant end) {
    final Granularity granularity = definition.getPartitionGranularity();
    final List<Instant> partitions = new ArrayList<>();
    if (!start.isBefore(end)) {
      return partitions;
    }

    for (Instant current = partitionBucket(definition, start);
        // use isBefore since 'end' is exclusive
        current.isBefore(end);
        current = granularity.next(current)
    ) {
      partitions.add(current);
    }

    return partitions;
  }
}
