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

import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * The logical data source addressed by queries and pre-aggregations.
 */
@Value
@Builder
public class CubeDefinition {
  String name;
  /**
   * Table name or sub-select producing the raw rows.
   */
  String sql;
  String timeDimension;
  @Singular
  List<DimensionDefinition> dimensions;
  @Singular
  List<MeasureDefinition> measures;

  public Optional<DimensionDefinition> dimension(String name) {
    return dimensions.stream().filter(d -> d.getName().equals(name)).findFirst();
  }

  public Optional<MeasureDefinition> measure(String name) {
    return measures.stream().filter(m -> m.getName().equals(name)).findFirst();
  }

  /**
   * Parameterized query returning the raw rows whose time dimension lies in
   * <code>[?, ?)</code>.
   */
  public String rangeQuery() {
    final String source = StringUtils.startsWithIgnoreCase(sql.trim(), "select") ?
        "(" + sql + ")" : sql;
    return String.format("SELECT * FROM %s src WHERE src.%s >= ? AND src.%s < ?",
        source, timeDimension, timeDimension);
  }
}
