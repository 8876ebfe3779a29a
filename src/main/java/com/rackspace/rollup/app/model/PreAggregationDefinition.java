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

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A compiled rollup: which dimensions and measures of a cube are materialized, at which row
 * granularity, split into partitions of which width, and how those are kept fresh.
 */
@Value
@Builder
public class PreAggregationDefinition {
  String id;
  CubeDefinition cube;
  @Singular
  List<DimensionDefinition> dimensions;
  @Singular
  List<MeasureDefinition> measures;
  Granularity granularity;
  Granularity partitionGranularity;
  RefreshPolicy refreshPolicy;
  /**
   * Trailing span in which partitions are rebuilt on every scheduler pass. When set, older
   * partitions are considered settled.
   */
  Duration updateWindow;
  Instant buildRangeStart;
  /**
   * Null means "up to now".
   */
  Instant buildRangeEnd;
  @Builder.Default
  boolean lambda = true;
  /**
   * Hash of the cube, dimensions, measures and granularities. The refresh policy, update
   * window, build range and lambda flag don't change partition content and are left out.
   * Partitions built under another version are not reused.
   */
  String structureVersion;

  public String getSourceQuery() {
    return cube.rangeQuery();
  }

  public boolean isIncremental() {
    return updateWindow != null && !updateWindow.isZero();
  }

  public Set<String> dimensionNames() {
    return dimensions.stream().map(DimensionDefinition::getName).collect(Collectors.toSet());
  }

  public Set<String> measureNames() {
    return measures.stream().map(MeasureDefinition::getName).collect(Collectors.toSet());
  }
}
