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

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.rackspace.rollup.app.config.AppProperties;
import com.rackspace.rollup.app.model.ConditionResult;
import com.rackspace.rollup.app.model.Partition;
import com.rackspace.rollup.app.model.RefreshPolicy;
import com.rackspace.rollup.app.model.TenantIsolationKey;
import com.rackspace.rollup.app.model.WatermarkCacheKey;
import com.rackspace.rollup.app.repos.LiveDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * A partition is stale when the watermark query now returns something other than what it
 * returned when the partition was built. Watermarks are cached briefly per tenant and query
 * since many partitions share one.
 */
@Service
@Slf4j
public class WatermarkRefreshCondition implements RefreshCondition {
  private final LiveDataSource liveDataSource;
  private final AppProperties appProperties;
  private final AsyncCache<WatermarkCacheKey, String> watermarkCache;

  @Autowired
  public WatermarkRefreshCondition(LiveDataSource liveDataSource,
                                   AppProperties appProperties,
                                   AsyncCache<WatermarkCacheKey, String> watermarkCache) {
    this.liveDataSource = liveDataSource;
    this.appProperties = appProperties;
    this.watermarkCache = watermarkCache;
  }

  @Override
  public Mono<ConditionResult> evaluate(Partition partition, RefreshPolicy policy) {
    if (policy.getType() != RefreshPolicy.Type.CONDITION) {
      return Mono.just(ConditionResult.UNKNOWN);
    }
    if (partition.getWatermark() == null) {
      // built before the condition applied
      return Mono.just(ConditionResult.STALE);
    }

    final WatermarkCacheKey cacheKey =
        new WatermarkCacheKey(partition.getKey().getTenant(), policy.getConditionSql());
    return Mono.fromFuture(
        watermarkCache.get(cacheKey, (key, executor) ->
            currentWatermark(key.getTenant(), policy).toFuture()))
        .timeout(appProperties.getConditionTimeout())
        .map(current -> current.equals(partition.getWatermark()) ?
            ConditionResult.FRESH : ConditionResult.STALE)
        .defaultIfEmpty(ConditionResult.UNKNOWN)
        .onErrorResume(e -> {
          log.warn("Unable to evaluate refresh condition of {}: {}", partition.getKey(),
              e.getMessage());
          return Mono.just(ConditionResult.UNKNOWN);
        });
  }

  @Override
  public Mono<String> currentWatermark(TenantIsolationKey tenant, RefreshPolicy policy) {
    return liveDataSource.queryForValue(tenant, policy.getConditionSql())
        .map(String::valueOf)
        .defaultIfEmpty("");
  }
}
