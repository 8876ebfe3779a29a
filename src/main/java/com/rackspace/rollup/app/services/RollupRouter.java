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

import com.rackspace.rollup.app.model.CubeDefinition;
import com.rackspace.rollup.app.model.Partition;
import com.rackspace.rollup.app.model.PartitionKey;
import com.rackspace.rollup.app.model.PreAggregationDefinition;
import com.rackspace.rollup.app.model.QueryPlan;
import com.rackspace.rollup.app.model.RollupQuery;
import com.rackspace.rollup.app.model.TenantIsolationKey;
import com.rackspace.rollup.app.model.TimeRange;
import com.rackspace.rollup.app.repos.PreAggregationStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Chooses how a query is answered: entirely from stored partitions of one pre-aggregation,
 * from stored partitions completed by a live read of the trailing range, directly from the
 * live source, or not at all in rollup-only mode.
 */
@Service
@Slf4j
public class RollupRouter {
  /**
   * Full coverage first, then the fewest partitions, then the most recently refreshed, and
   * finally the definition id so that the choice is deterministic.
   */
  static final Comparator<Candidate> PREFERENCE = Comparator
      .comparing(Candidate::isLambda)
      .thenComparingInt(Candidate::getPartitionCount)
      .thenComparing(Candidate::getLastRefreshed, Comparator.reverseOrder())
      .thenComparing(Candidate::getDefinitionId);

  private final DefinitionRegistry definitionRegistry;
  private final PreAggregationStore store;
  private final FreshnessEvaluator freshnessEvaluator;
  private final RefreshJobTracker tracker;
  private final TimeSlotPartitioner partitioner;
  private final TenantConfigResolver tenantConfigResolver;
  private final Clock clock;

  @Autowired
  public RollupRouter(DefinitionRegistry definitionRegistry,
                      PreAggregationStore store,
                      FreshnessEvaluator freshnessEvaluator,
                      RefreshJobTracker tracker,
                      TimeSlotPartitioner partitioner,
                      TenantConfigResolver tenantConfigResolver,
                      Clock clock) {
    this.definitionRegistry = definitionRegistry;
    this.store = store;
    this.freshnessEvaluator = freshnessEvaluator;
    this.tracker = tracker;
    this.partitioner = partitioner;
    this.tenantConfigResolver = tenantConfigResolver;
    this.clock = clock;
  }

  public Mono<QueryPlan> route(RollupQuery query, TenantIsolationKey tenant) {
    return route(query, tenant, clock.instant());
  }

  public Mono<QueryPlan> route(RollupQuery query, TenantIsolationKey tenant, Instant now) {
    final CubeDefinition cube = definitionRegistry.cube(query.getCube());
    final List<PreAggregationDefinition> candidates = definitionRegistry.definitionsFor(cube)
        .stream()
        .filter(definition -> matches(definition, query))
        .collect(Collectors.toList());
    final boolean rollupOnly = tenantConfigResolver.resolve(tenant).isRollupOnly();

    return Flux.fromIterable(candidates)
        .concatMap(definition -> evaluate(definition, query, tenant, now))
        .collectList()
        .map(usable -> usable.stream()
            .min(PREFERENCE)
            .map(Candidate::getPlan)
            .orElseGet(() -> fallback(query, candidates, rollupOnly)))
        .doOnNext(plan -> log.debug("Routed query on {} over {} to {}", query.getCube(),
            query.timeRange(), plan));
  }

  /**
   * Whether the definition holds everything the query asks for, at a granularity the query's
   * time grouping and start can be derived from.
   */
  boolean matches(PreAggregationDefinition definition, RollupQuery query) {
    final Set<String> requiredDimensions = new HashSet<>(query.getDimensions());
    requiredDimensions.addAll(query.getFilters().keySet());
    if (!definition.dimensionNames().containsAll(requiredDimensions)
        || !definition.measureNames().containsAll(query.getMeasures())) {
      return false;
    }
    if (query.getGranularity() != null
        && !query.getGranularity().isMultipleOf(definition.getGranularity())) {
      return false;
    }
    if (!definition.getGranularity().isAligned(query.getStart())) {
      return false;
    }
    // an unaligned end can only be completed by a live read
    return definition.isLambda() || definition.getGranularity().isAligned(query.getEnd());
  }

  private Mono<Candidate> evaluate(PreAggregationDefinition definition, RollupQuery query,
                                   TenantIsolationKey tenant, Instant now) {
    final Instant servedEnd = definition.getGranularity().truncate(query.getEnd());
    final List<Instant> buckets =
        partitioner.partitionsOverRange(definition, query.getStart(), query.getEnd());

    return store.listByDefinition(tenant, definition)
        .collectMap(partition -> partition.getKey().getBucket())
        .flatMap(existing -> Flux.fromIterable(buckets)
            .concatMap(bucket -> isUsable(existing.get(bucket), definition, now))
            .collectList()
            .flatMap(usable -> Mono.justOrEmpty(
                decide(definition, query, buckets, usable, existing, servedEnd))));
  }

  private Mono<Boolean> isUsable(Partition partition, PreAggregationDefinition definition,
                                 Instant now) {
    if (partition == null || tracker.isExhausted(partition.getKey())) {
      return Mono.just(false);
    }
    return freshnessEvaluator.isServable(partition, definition, now);
  }

  /**
   * Usable partitions must form a prefix of the range. Any unusable partition after the
   * prefix means the gap isn't trailing and can't be filled by a single live read.
   */
  private Candidate decide(PreAggregationDefinition definition, RollupQuery query,
                           List<Instant> buckets, List<Boolean> usable,
                           Map<Instant, Partition> existing, Instant servedEnd) {
    int prefix = 0;
    while (prefix < usable.size() && usable.get(prefix)) {
      prefix++;
    }
    for (int i = prefix; i < usable.size(); i++) {
      if (usable.get(i)) {
        return null;
      }
    }

    final Instant gapStart;
    final int used;
    if (prefix == buckets.size()) {
      if (servedEnd.equals(query.getEnd())) {
        final List<PartitionKey> keys = keysOf(buckets, existing);
        return new Candidate(definition.getId(), QueryPlan.partitions(definition.getId(), keys),
            false, keys.size(), lastRefreshed(keys, existing));
      }
      // the tail of the last partition extends past the query end
      gapStart = servedEnd;
      used = partitioner.partitionBucket(definition, servedEnd).equals(servedEnd) ?
          buckets.size() - 1 : buckets.size();
    } else {
      gapStart = buckets.get(prefix);
      used = prefix;
    }

    if (!definition.isLambda() || !gapStart.isAfter(query.getStart()) || used == 0) {
      return null;
    }
    final List<PartitionKey> keys = keysOf(buckets.subList(0, used), existing);
    return new Candidate(definition.getId(),
        QueryPlan.lambda(definition.getId(), keys, TimeRange.of(gapStart, query.getEnd())),
        true, keys.size(), lastRefreshed(keys, existing));
  }

  private static List<PartitionKey> keysOf(List<Instant> buckets, Map<Instant, Partition> existing) {
    return buckets.stream()
        .map(bucket -> existing.get(bucket).getKey())
        .collect(Collectors.toList());
  }

  private static Instant lastRefreshed(List<PartitionKey> keys, Map<Instant, Partition> existing) {
    return keys.stream()
        .map(key -> existing.get(key.getBucket()).getLastRefreshed())
        .max(Comparator.naturalOrder())
        .orElse(Instant.EPOCH);
  }

  private QueryPlan fallback(RollupQuery query, List<PreAggregationDefinition> candidates,
                             boolean rollupOnly) {
    if (!rollupOnly) {
      return QueryPlan.passthrough(query.timeRange());
    }
    if (candidates.isEmpty()) {
      return QueryPlan.rejected(String.format(
          "No pre-aggregation of cube %s provides measures %s and dimensions %s at %s",
          query.getCube(), query.getMeasures(), query.getDimensions(),
          query.getGranularity() != null ? query.getGranularity() : "any granularity"));
    }
    return QueryPlan.rejected(String.format(
        "Pre-aggregations %s match but their partitions over %s are not all built and fresh",
        candidates.stream().map(PreAggregationDefinition::getId).collect(Collectors.toList()),
        query.timeRange()));
  }

  @Value
  static class Candidate {
    String definitionId;
    QueryPlan plan;
    boolean lambda;
    int partitionCount;
    Instant lastRefreshed;
  }
}
