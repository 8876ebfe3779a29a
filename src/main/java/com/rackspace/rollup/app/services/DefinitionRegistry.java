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

import com.rackspace.rollup.app.aggregate.AggregationType;
import com.rackspace.rollup.app.config.RollupModelProperties;
import com.rackspace.rollup.app.exception.InvalidBucketException;
import com.rackspace.rollup.app.exception.UnknownDefinitionException;
import com.rackspace.rollup.app.model.CubeDefinition;
import com.rackspace.rollup.app.model.DimensionDefinition;
import com.rackspace.rollup.app.model.Granularity;
import com.rackspace.rollup.app.model.MeasureDefinition;
import com.rackspace.rollup.app.model.PreAggregationDefinition;
import com.rackspace.rollup.app.model.RefreshPolicy;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Compiles the configured data model into immutable cube and pre-aggregation definitions.
 */
@Service
@Slf4j
public class DefinitionRegistry {
  static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofHours(1);

  private final Map<String, CubeDefinition> cubes = new LinkedHashMap<>();
  private final Map<String, PreAggregationDefinition> definitions = new LinkedHashMap<>();

  @Autowired
  public DefinitionRegistry(RollupModelProperties modelProperties, HashService hashService) {
    for (RollupModelProperties.Cube cube : modelProperties.getCubes()) {
      if (cubes.put(cube.getName(), compileCube(cube)) != null) {
        throw new IllegalStateException("Duplicate cube: " + cube.getName());
      }
    }
    for (RollupModelProperties.PreAggregation preAggregation : modelProperties.getPreAggregations()) {
      final PreAggregationDefinition definition = compile(preAggregation, hashService);
      if (definitions.put(definition.getId(), definition) != null) {
        throw new IllegalStateException("Duplicate pre-aggregation: " + definition.getId());
      }
      log.info("Registered pre-aggregation {} version {} on cube {}", definition.getId(),
          definition.getStructureVersion(), definition.getCube().getName());
    }
  }

  public CubeDefinition cube(String name) {
    final CubeDefinition cube = cubes.get(name);
    if (cube == null) {
      throw new UnknownDefinitionException("cube", name);
    }
    return cube;
  }

  public PreAggregationDefinition definition(String id) {
    final PreAggregationDefinition definition = definitions.get(id);
    if (definition == null) {
      throw new UnknownDefinitionException("pre-aggregation", id);
    }
    return definition;
  }

  public Collection<PreAggregationDefinition> definitions() {
    return definitions.values();
  }

  public List<PreAggregationDefinition> definitionsFor(CubeDefinition cube) {
    return definitions.values().stream()
        .filter(definition -> definition.getCube().getName().equals(cube.getName()))
        .collect(Collectors.toList());
  }

  private static CubeDefinition compileCube(RollupModelProperties.Cube cube) {
    final CubeDefinition.CubeDefinitionBuilder builder = CubeDefinition.builder()
        .name(cube.getName())
        .sql(cube.getSql())
        .timeDimension(cube.getTimeDimension());
    cube.getDimensions().forEach(dimension -> builder.dimension(new DimensionDefinition(
        dimension.getName(),
        StringUtils.defaultIfBlank(dimension.getColumn(), dimension.getName()))));
    cube.getMeasures().forEach(measure -> {
      if (measure.getColumn() == null && measure.getType() != AggregationType.COUNT) {
        throw new IllegalStateException(String.format(
            "Measure %s of cube %s needs a column", measure.getName(), cube.getName()));
      }
      builder.measure(new MeasureDefinition(measure.getName(), measure.getType(),
          measure.getColumn()));
    });
    return builder.build();
  }

  private PreAggregationDefinition compile(RollupModelProperties.PreAggregation preAggregation,
                                           HashService hashService) {
    final CubeDefinition cube = cube(preAggregation.getCube());
    final Granularity granularity = preAggregation.getGranularity();
    final Granularity partitionGranularity = preAggregation.getEffectivePartitionGranularity();
    if (!partitionGranularity.isMultipleOf(granularity)) {
      throw new InvalidBucketException(String.format(
          "Partition granularity %s of %s is not a multiple of its granularity %s",
          partitionGranularity, preAggregation.getId(), granularity));
    }

    final List<DimensionDefinition> dimensions = preAggregation.getDimensions().stream()
        .map(name -> cube.dimension(name)
            .orElseThrow(() -> new UnknownDefinitionException("dimension", cube.getName() + "." + name)))
        .collect(Collectors.toList());
    final List<MeasureDefinition> measures = preAggregation.getMeasures().stream()
        .map(name -> cube.measure(name)
            .orElseThrow(() -> new UnknownDefinitionException("measure", cube.getName() + "." + name)))
        .collect(Collectors.toList());

    final Instant buildRangeStart =
        partitionGranularity.truncate(Instant.parse(preAggregation.getBuildRangeStart()));
    final Instant buildRangeEnd = StringUtils.isBlank(preAggregation.getBuildRangeEnd()) ?
        null : Instant.parse(preAggregation.getBuildRangeEnd());

    return PreAggregationDefinition.builder()
        .id(preAggregation.getId())
        .cube(cube)
        .dimensions(dimensions)
        .measures(measures)
        .granularity(granularity)
        .partitionGranularity(partitionGranularity)
        .refreshPolicy(refreshPolicy(preAggregation.getRefresh()))
        .updateWindow(preAggregation.getUpdateWindow())
        .buildRangeStart(buildRangeStart)
        .buildRangeEnd(buildRangeEnd)
        .lambda(preAggregation.isLambda())
        .structureVersion(hashService.structureVersion(
            canonicalForm(preAggregation.getId(), cube, dimensions, measures, granularity,
                partitionGranularity)))
        .build();
  }

  private static RefreshPolicy refreshPolicy(RollupModelProperties.Refresh refresh) {
    if (refresh.getEvery() != null) {
      return RefreshPolicy.every(refresh.getEvery());
    } else if (StringUtils.isNotBlank(refresh.getSql())) {
      return RefreshPolicy.condition(refresh.getSql());
    } else if (refresh.isExternal()) {
      return RefreshPolicy.external();
    } else {
      return RefreshPolicy.every(DEFAULT_REFRESH_INTERVAL);
    }
  }

  /**
   * Everything that changes the content of the materialized rows. Refresh settings and build
   * range are excluded since they don't.
   */
  private static String canonicalForm(String id, CubeDefinition cube,
                                      List<DimensionDefinition> dimensions,
                                      List<MeasureDefinition> measures,
                                      Granularity granularity, Granularity partitionGranularity) {
    return String.join("|",
        id,
        cube.getName(),
        cube.getSql(),
        cube.getTimeDimension(),
        dimensions.stream()
            .map(d -> d.getName() + ":" + d.getColumn())
            .collect(Collectors.joining(",")),
        measures.stream()
            .map(m -> m.getName() + ":" + m.getType() + ":" + m.getColumn())
            .collect(Collectors.joining(",")),
        granularity.name(),
        partitionGranularity.name());
  }
}
