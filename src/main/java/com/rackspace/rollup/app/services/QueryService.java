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

import com.rackspace.rollup.app.aggregate.AggregateRow;
import com.rackspace.rollup.app.aggregate.RowCollectors;
import com.rackspace.rollup.app.config.AppProperties;
import com.rackspace.rollup.app.exception.NoMatchingRollupException;
import com.rackspace.rollup.app.model.CubeDefinition;
import com.rackspace.rollup.app.model.DimensionDefinition;
import com.rackspace.rollup.app.model.MeasureDefinition;
import com.rackspace.rollup.app.model.Partition;
import com.rackspace.rollup.app.model.QueryPlan;
import com.rackspace.rollup.app.model.QueryResult;
import com.rackspace.rollup.app.model.RequestSecurityContext;
import com.rackspace.rollup.app.model.RollupQuery;
import com.rackspace.rollup.app.model.TenantIsolationKey;
import com.rackspace.rollup.app.model.TimeRange;
import com.rackspace.rollup.app.repos.PreAggregationStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Service
@Slf4j
public class QueryService {
  private final TenantContextResolver tenantContextResolver;
  private final DefinitionRegistry definitionRegistry;
  private final RollupRouter rollupRouter;
  private final PreAggregationStore store;
  private final SourceQueryService sourceQueryService;
  private final AppProperties appProperties;
  private final MeterRegistry meterRegistry;

  @Autowired
  public QueryService(TenantContextResolver tenantContextResolver,
                      DefinitionRegistry definitionRegistry,
                      RollupRouter rollupRouter,
                      PreAggregationStore store,
                      SourceQueryService sourceQueryService,
                      AppProperties appProperties,
                      MeterRegistry meterRegistry) {
    this.tenantContextResolver = tenantContextResolver;
    this.definitionRegistry = definitionRegistry;
    this.rollupRouter = rollupRouter;
    this.store = store;
    this.sourceQueryService = sourceQueryService;
    this.appProperties = appProperties;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Routes the query without executing it.
   */
  public Mono<QueryPlan> plan(RollupQuery query, RequestSecurityContext context) {
    return Mono.defer(() -> {
      final TenantIsolationKey tenant = tenantContextResolver.resolve(context);
      validate(query);
      return rollupRouter.route(query, tenant);
    });
  }

  public Mono<QueryResult> query(RollupQuery query, RequestSecurityContext context) {
    return Mono.defer(() -> {
      final TenantIsolationKey tenant = tenantContextResolver.resolve(context);
      validate(query);
      return rollupRouter.route(query, tenant)
          .flatMap(plan -> execute(query, tenant, plan));
    });
  }

  /**
   * Runs a plan produced for the same query and tenant.
   *
   * @throws NoMatchingRollupException via the returned mono when the plan is a rejection
   */
  public Mono<QueryResult> execute(RollupQuery query, TenantIsolationKey tenant, QueryPlan plan) {
    meterRegistry.counter("rollup.query", "plan", plan.getType().name()).increment();
    final CubeDefinition cube = definitionRegistry.cube(query.getCube());
    final List<MeasureDefinition> measures = measuresOf(cube, query);

    final Mono<List<AggregateRow>> rows;
    switch (plan.getType()) {
      case REJECTED:
        return Mono.error(new NoMatchingRollupException(plan));
      case PASSTHROUGH:
        rows = live(query, tenant, cube, measures, plan.getLiveRange());
        break;
      case LAMBDA:
        rows = Mono.zip(
            stored(query, tenant, plan, TimeRange.of(query.getStart(), plan.getLiveRange().getStart())),
            live(query, tenant, cube, measures, plan.getLiveRange()),
            (fromPartitions, fromLive) -> {
              final List<AggregateRow> combined = new ArrayList<>(fromPartitions);
              combined.addAll(fromLive);
              return combined;
            });
        break;
      case PARTITIONS:
      default:
        rows = stored(query, tenant, plan, query.timeRange());
        break;
    }

    return rows
        .map(collected -> collected.stream()
            .collect(RowCollectors.rollupCollector(query.getGranularity(), query.getDimensions(),
                measures)))
        .map(rolledUp -> new QueryResult()
            .setPlan(plan)
            .setRows(RowCollectors.finish(rolledUp, measures)))
        .checkpoint();
  }

  private Mono<List<AggregateRow>> stored(RollupQuery query, TenantIsolationKey tenant,
                                          QueryPlan plan, TimeRange served) {
    return Flux.fromIterable(plan.getPartitions())
        .concatMap(key -> store.get(tenant, key)
            .switchIfEmpty(Mono.error(() ->
                new IllegalStateException("Planned partition is missing: " + key))))
        .flatMapIterable(Partition::getRows)
        .filter(row -> served.contains(row.getTimestamp()))
        .filter(RowCollectors.rowFilter(query.getFilters()))
        .collectList();
  }

  private Mono<List<AggregateRow>> live(RollupQuery query, TenantIsolationKey tenant,
                                        CubeDefinition cube, List<MeasureDefinition> measures,
                                        TimeRange range) {
    final List<DimensionDefinition> dimensions = query.getDimensions().stream()
        .map(name -> cube.dimension(name).orElseThrow())
        .collect(Collectors.toList());
    return sourceQueryService.aggregate(tenant, cube, range, query.getGranularity(), dimensions,
        measures, query.getFilters())
        .retryWhen(appProperties.getRetryLiveQuery().build(QueryService::isTransient));
  }

  static boolean isTransient(Throwable e) {
    return e instanceof TimeoutException
        || e instanceof TransientDataAccessException
        || e instanceof DataAccessResourceFailureException;
  }

  private static List<MeasureDefinition> measuresOf(CubeDefinition cube, RollupQuery query) {
    return query.getMeasures().stream()
        .map(name -> cube.measure(name).orElseThrow())
        .collect(Collectors.toList());
  }

  private void validate(RollupQuery query) {
    if (query.getStart() == null || query.getEnd() == null) {
      throw new IllegalArgumentException("Query start and end are required");
    }
    if (!query.getStart().isBefore(query.getEnd())) {
      throw new IllegalArgumentException("Query start must be before end");
    }
    if (query.getMeasures() == null || query.getMeasures().isEmpty()) {
      throw new IllegalArgumentException("At least one measure is required");
    }
    if (query.getDimensions() == null) {
      query.setDimensions(List.of());
    }
    if (query.getFilters() == null) {
      query.setFilters(Map.of());
    }
    final CubeDefinition cube = definitionRegistry.cube(query.getCube());
    query.getMeasures().forEach(name -> cube.measure(name)
        .orElseThrow(() -> new IllegalArgumentException("Unknown measure " + name + " of cube " + cube.getName())));
    query.getDimensions().forEach(name -> cube.dimension(name)
        .orElseThrow(() -> new IllegalArgumentException("Unknown dimension " + name + " of cube " + cube.getName())));
    query.getFilters().keySet().forEach(name -> cube.dimension(name)
        .orElseThrow(() -> new IllegalArgumentException("Unknown filter dimension " + name + " of cube " + cube.getName())));
  }
}
