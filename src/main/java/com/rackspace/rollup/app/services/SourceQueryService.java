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
import com.rackspace.rollup.app.model.CubeDefinition;
import com.rackspace.rollup.app.model.DimensionDefinition;
import com.rackspace.rollup.app.model.Granularity;
import com.rackspace.rollup.app.model.MeasureDefinition;
import com.rackspace.rollup.app.model.TenantIsolationKey;
import com.rackspace.rollup.app.model.TimeRange;
import com.rackspace.rollup.app.repos.LiveDataSource;
import java.sql.Timestamp;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Reads raw rows of a cube from the tenant's live source and aggregates them.
 */
@Service
@Slf4j
public class SourceQueryService {
  private final LiveDataSource liveDataSource;

  @Autowired
  public SourceQueryService(LiveDataSource liveDataSource) {
    this.liveDataSource = liveDataSource;
  }

  /**
   * @param granularity bucket width of the result rows or null to aggregate over the whole range
   * @param filters dimension name to accepted values, applied to raw rows
   */
  public Mono<List<AggregateRow>> aggregate(TenantIsolationKey tenant, CubeDefinition cube,
                                            TimeRange range, Granularity granularity,
                                            List<DimensionDefinition> dimensions,
                                            List<MeasureDefinition> measures,
                                            Map<String, List<String>> filters) {
    final Map<String, String> columnsByDimension = cube.getDimensions().stream()
        .collect(Collectors.toMap(DimensionDefinition::getName, DimensionDefinition::getColumn));
    log.trace("Aggregating {} over {} for tenant {}", cube.getName(), range, tenant);
    return liveDataSource.query(tenant, cube.rangeQuery(),
        List.of(Timestamp.from(range.getStart()), Timestamp.from(range.getEnd())))
        .filter(RowCollectors.sourceFilter(filters, columnsByDimension))
        .collect(RowCollectors.sourceCollector(cube.getTimeDimension(), granularity, dimensions,
            measures))
        .checkpoint();
  }
}
