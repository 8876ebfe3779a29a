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

package com.rackspace.rollup.app.config;

import com.rackspace.rollup.app.aggregate.AggregationType;
import com.rackspace.rollup.app.config.configValidator.GranularityValidator;
import com.rackspace.rollup.app.model.Granularity;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationFormat;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * The data model: cubes queries address and the pre-aggregations materialized from them.
 */
@ConfigurationProperties("rollup.model")
@Component
@Data
@Validated
public class RollupModelProperties {

  @Valid
  List<Cube> cubes = new ArrayList<>();

  @Valid
  @GranularityValidator
  List<PreAggregation> preAggregations = new ArrayList<>();

  @Data
  public static class Cube {
    @NotBlank
    String name;

    /**
     * Table name or sub-select producing the raw rows.
     */
    @NotBlank
    String sql;

    /**
     * Column holding the event time of each raw row.
     */
    @NotBlank
    String timeDimension;

    @Valid
    List<Dimension> dimensions = new ArrayList<>();

    @Valid
    @NotEmpty
    List<Measure> measures = new ArrayList<>();
  }

  @Data
  public static class Dimension {
    @NotBlank
    String name;

    /**
     * Defaults to the dimension name.
     */
    String column;
  }

  @Data
  public static class Measure {
    @NotBlank
    String name;

    @NotNull
    AggregationType type;

    /**
     * May be omitted for count measures to count rows.
     */
    String column;
  }

  @Data
  public static class PreAggregation {
    /**
     * Becomes part of partition storage identifiers.
     */
    @NotBlank
    @Pattern(regexp = "[a-zA-Z0-9_]+")
    String id;

    @NotBlank
    String cube;

    List<String> dimensions = new ArrayList<>();

    @NotEmpty
    List<String> measures = new ArrayList<>();

    /**
     * Time bucket of the materialized rows.
     */
    @NotNull
    Granularity granularity = Granularity.DAY;

    /**
     * Width of one partition, defaults to the row granularity.
     */
    Granularity partitionGranularity;

    @NotNull
    @Valid
    Refresh refresh = new Refresh();

    /**
     * For example: 2d
     */
    @DurationFormat(DurationStyle.SIMPLE)
    Duration updateWindow;

    /**
     * ISO-8601 instant of the first partition to build.
     */
    @NotBlank
    String buildRangeStart;

    /**
     * ISO-8601 instant after which no partitions are built, or unset to build up to now.
     */
    String buildRangeEnd;

    /**
     * Allows queries extending past the last built partition to be completed from the live
     * source.
     */
    boolean lambda = true;

    public Granularity getEffectivePartitionGranularity() {
      return partitionGranularity != null ? partitionGranularity : granularity;
    }
  }

  /**
   * Exactly one of <code>every</code>, <code>sql</code> or <code>external</code> applies, in
   * that order of precedence. With nothing set the partitions refresh every hour.
   */
  @Data
  public static class Refresh {
    @DurationFormat(DurationStyle.SIMPLE)
    Duration every;

    /**
     * Watermark query; the partition refreshes when its result changes.
     */
    String sql;

    boolean external;
  }
}
