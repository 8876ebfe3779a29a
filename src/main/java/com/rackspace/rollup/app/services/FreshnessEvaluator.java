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

import com.rackspace.rollup.app.model.ConditionResult;
import com.rackspace.rollup.app.model.Partition;
import com.rackspace.rollup.app.model.PartitionKey;
import com.rackspace.rollup.app.model.PreAggregationDefinition;
import com.rackspace.rollup.app.model.RefreshPolicy;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Decides whether stored partitions may still be served and whether the scheduler should
 * rebuild them.
 */
@Service
@Slf4j
public class FreshnessEvaluator {
  private final RefreshCondition refreshCondition;
  /**
   * Partition key to the time it was invalidated; cleared by the first refresh started after.
   */
  private final ConcurrentMap<PartitionKey, Instant> invalidations = new ConcurrentHashMap<>();

  @Autowired
  public FreshnessEvaluator(RefreshCondition refreshCondition) {
    this.refreshCondition = refreshCondition;
  }

  /**
   * Applies the refresh policy. A condition that can't be evaluated leaves the partition
   * fresh, so an unavailable source doesn't cause a storm of refreshes.
   */
  public Mono<Boolean> isStale(Partition partition, RefreshPolicy policy, Instant now) {
    if (isInvalidated(partition.getKey())) {
      return Mono.just(true);
    }
    switch (policy.getType()) {
      case EVERY:
        return Mono.just(
            Duration.between(partition.getLastRefreshed(), now).compareTo(policy.getEvery()) >= 0);
      case CONDITION:
        return refreshCondition.evaluate(partition, policy)
            .map(result -> result == ConditionResult.STALE)
            .defaultIfEmpty(false);
      case EXTERNAL:
      default:
        return Mono.just(false);
    }
  }

  /**
   * Whether the partition may be used to answer queries. Partitions of an incremental
   * definition that are older than its update window are settled and stay servable until
   * invalidated.
   */
  public Mono<Boolean> isServable(Partition partition, PreAggregationDefinition definition,
                                  Instant now) {
    if (definition.isIncremental() && !inUpdateWindow(partition.getKey(), definition, now)) {
      return Mono.just(!isInvalidated(partition.getKey()));
    }
    return isStale(partition, definition.getRefreshPolicy(), now).map(stale -> !stale);
  }

  /**
   * Whether a scheduler pass should rebuild the partition. Partitions inside the update window
   * are always rebuilt.
   */
  public Mono<Boolean> needsRefresh(Partition partition, PreAggregationDefinition definition,
                                    Instant now) {
    if (inUpdateWindow(partition.getKey(), definition, now)) {
      return Mono.just(true);
    }
    if (definition.isIncremental()) {
      return Mono.just(isInvalidated(partition.getKey()));
    }
    return isStale(partition, definition.getRefreshPolicy(), now);
  }

  public boolean inUpdateWindow(PartitionKey key, PreAggregationDefinition definition,
                                Instant now) {
    return definition.isIncremental()
        && !key.getBucket().isBefore(now.minus(definition.getUpdateWindow()));
  }

  public void invalidate(PartitionKey key, Instant now) {
    log.debug("Invalidated partition {}", key);
    invalidations.merge(key, now, (existing, latest) -> latest.isAfter(existing) ? latest : existing);
  }

  public boolean isInvalidated(PartitionKey key) {
    return invalidations.containsKey(key);
  }

  /**
   * Clears an invalidation once a refresh that started at or after it has committed.
   */
  public void acknowledgeRefresh(PartitionKey key, Instant refreshStartedAt) {
    invalidations.computeIfPresent(key,
        (k, invalidatedAt) -> invalidatedAt.isAfter(refreshStartedAt) ? invalidatedAt : null);
  }
}
