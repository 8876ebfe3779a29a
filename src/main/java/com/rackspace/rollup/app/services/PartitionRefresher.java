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

import com.rackspace.rollup.app.exception.CrossTenantAccessException;
import com.rackspace.rollup.app.exception.RefreshTransientFailureException;
import com.rackspace.rollup.app.model.Partition;
import com.rackspace.rollup.app.model.PartitionKey;
import com.rackspace.rollup.app.model.PreAggregationDefinition;
import com.rackspace.rollup.app.model.RefreshPolicy;
import com.rackspace.rollup.app.model.TimeRange;
import com.rackspace.rollup.app.repos.PreAggregationStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Builds the content of one partition from the live source and commits it. Nothing is
 * written until the whole content is computed, so a failed or cancelled refresh leaves the
 * previously committed content in place.
 */
@Service
@Slf4j
public class PartitionRefresher {
  private final SourceQueryService sourceQueryService;
  private final PreAggregationStore store;
  private final HashService hashService;
  private final TimeSlotPartitioner partitioner;
  private final RefreshCondition refreshCondition;
  private final Timer refreshTimer;

  @Autowired
  public PartitionRefresher(SourceQueryService sourceQueryService,
                            PreAggregationStore store,
                            HashService hashService,
                            TimeSlotPartitioner partitioner,
                            RefreshCondition refreshCondition,
                            MeterRegistry meterRegistry) {
    this.sourceQueryService = sourceQueryService;
    this.store = store;
    this.hashService = hashService;
    this.partitioner = partitioner;
    this.refreshCondition = refreshCondition;
    this.refreshTimer = meterRegistry.timer("rollup.refresh.duration");
  }

  /**
   * @param startedAt recorded as the refresh time of the new content
   */
  public Mono<Partition> refresh(PreAggregationDefinition definition, PartitionKey key,
                                 Instant startedAt) {
    final TimeRange range = partitioner.rangeOf(definition, key.getBucket());
    final RefreshPolicy policy = definition.getRefreshPolicy();

    // the watermark is read first so that source changes during the build cause another refresh
    final Mono<Optional<String>> watermark = policy.getType() == RefreshPolicy.Type.CONDITION ?
        refreshCondition.currentWatermark(key.getTenant(), policy).map(Optional::of) :
        Mono.just(Optional.empty());

    return Mono.defer(() -> {
      final Timer.Sample sample = Timer.start();
      return watermark
          .flatMap(observed -> sourceQueryService.aggregate(key.getTenant(),
              definition.getCube(), range, definition.getGranularity(),
              definition.getDimensions(), definition.getMeasures(), Map.of())
              .map(rows -> Partition.builder()
                  .key(key)
                  .timeRange(range)
                  .rows(List.copyOf(rows))
                  .lastRefreshed(startedAt)
                  .checksum(hashService.checksum(rows))
                  .watermark(observed.orElse(null))
                  .build()))
          .flatMap(partition -> store.put(key.getTenant(), partition))
          .doOnSuccess(partition -> {
            sample.stop(refreshTimer);
            log.debug("Refreshed partition {} with {} rows, checksum {}", key,
                partition.getRowCount(), partition.getChecksum());
          });
    })
        .onErrorMap(e -> !(e instanceof CrossTenantAccessException),
            e -> new RefreshTransientFailureException(key, e))
        .checkpoint();
  }
}
