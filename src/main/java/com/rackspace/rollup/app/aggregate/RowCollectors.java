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

package com.rackspace.rollup.app.aggregate;

import com.rackspace.rollup.app.model.DimensionDefinition;
import com.rackspace.rollup.app.model.Granularity;
import com.rackspace.rollup.app.model.MeasureDefinition;
import com.rackspace.rollup.app.model.ResultRow;
import com.rackspace.rollup.app.utils.DateTimeUtils;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collector;
import java.util.stream.Collectors;

public class RowCollectors {

  private static final Comparator<AggregateRow> ROW_ORDER = Comparator
      .comparing(AggregateRow::getTimestamp, Comparator.nullsFirst(Comparator.naturalOrder()))
      .thenComparing(row -> dimensionKey(row.getDimensions()));

  /**
   * Aggregates raw source rows into partials grouped by time bucket and dimension values.
   *
   * @param granularity bucket width of the row timestamps or null to not group by time
   */
  public static Collector<Map<String, Object>, Map<GroupKey, AggregateRow>, List<AggregateRow>> sourceCollector(
      String timeColumn, Granularity granularity,
      List<DimensionDefinition> dimensions, List<MeasureDefinition> measures) {
    final TemporalNormalizer normalizer = granularity != null ? new TemporalNormalizer(granularity) : null;
    final List<String> dimensionNames = dimensions.stream()
        .map(DimensionDefinition::getName)
        .collect(Collectors.toList());
    return Collector.of(
        HashMap::new,
        (groups, in) -> {
          final Instant timestamp = normalizer != null ?
              DateTimeUtils.toInstant(in.get(timeColumn)).with(normalizer) : null;
          final List<String> values = new ArrayList<>(dimensions.size());
          for (DimensionDefinition dimension : dimensions) {
            values.add(stringValue(in.get(dimension.getColumn())));
          }
          final AggregateRow row = groups.computeIfAbsent(new GroupKey(timestamp, values),
              key -> newRow(key, dimensionNames, measures));
          for (MeasureDefinition measure : measures) {
            final PartialAggregate agg = row.getMeasures().get(measure.getName());
            if (measure.getColumn() == null) {
              measure.getType().accumulate(agg, 1);
            } else {
              final Double value = toDouble(in.get(measure.getColumn()));
              if (value != null) {
                measure.getType().accumulate(agg, value);
              }
            }
          }
        },
        (lhs, rhs) -> combine(lhs, rhs, measures),
        RowCollectors::sorted
    );
  }

  /**
   * Re-aggregates already aggregated rows into coarser groups. Input rows are left untouched.
   *
   * @param granularity target bucket width or null to collapse the time dimension
   */
  public static Collector<AggregateRow, Map<GroupKey, AggregateRow>, List<AggregateRow>> rollupCollector(
      Granularity granularity, List<String> dimensions, List<MeasureDefinition> measures) {
    final TemporalNormalizer normalizer = granularity != null ? new TemporalNormalizer(granularity) : null;
    return Collector.of(
        HashMap::new,
        (groups, in) -> {
          final Instant timestamp = normalizer != null ? in.getTimestamp().with(normalizer) : null;
          final List<String> values = new ArrayList<>(dimensions.size());
          for (String dimension : dimensions) {
            values.add(in.getDimensions().get(dimension));
          }
          final AggregateRow row = groups.computeIfAbsent(new GroupKey(timestamp, values),
              key -> newRow(key, dimensions, measures));
          mergeMeasures(row, in, measures);
        },
        (lhs, rhs) -> combine(lhs, rhs, measures),
        RowCollectors::sorted
    );
  }

  public static List<ResultRow> finish(List<AggregateRow> rows, List<MeasureDefinition> measures) {
    return rows.stream()
        .map(row -> {
          final Map<String, Double> values = new LinkedHashMap<>();
          for (MeasureDefinition measure : measures) {
            values.put(measure.getName(),
                measure.getType().result(row.getMeasures().get(measure.getName())));
          }
          return new ResultRow()
              .setTimestamp(row.getTimestamp())
              .setDimensions(row.getDimensions())
              .setMeasures(values);
        })
        .collect(Collectors.toList());
  }

  /**
   * Equality filters over raw source rows, dimension name to accepted values.
   */
  public static Predicate<Map<String, Object>> sourceFilter(Map<String, List<String>> filters,
                                                            Map<String, String> columnsByDimension) {
    return row -> filters.entrySet().stream()
        .allMatch(filter -> filter.getValue().contains(
            stringValue(row.get(columnsByDimension.get(filter.getKey())))));
  }

  public static Predicate<AggregateRow> rowFilter(Map<String, List<String>> filters) {
    return row -> filters.entrySet().stream()
        .allMatch(filter -> filter.getValue().contains(row.getDimensions().get(filter.getKey())));
  }

  private static AggregateRow newRow(GroupKey key, List<String> dimensionNames,
                                     List<MeasureDefinition> measures) {
    final Map<String, String> dimensions = new LinkedHashMap<>();
    for (int i = 0; i < dimensionNames.size(); i++) {
      dimensions.put(dimensionNames.get(i), key.getDimensionValues().get(i));
    }
    final Map<String, PartialAggregate> partials = new LinkedHashMap<>();
    for (MeasureDefinition measure : measures) {
      partials.put(measure.getName(), new PartialAggregate());
    }
    return new AggregateRow()
        .setTimestamp(key.getTimestamp())
        .setDimensions(dimensions)
        .setMeasures(partials);
  }

  private static void mergeMeasures(AggregateRow into, AggregateRow from,
                                    List<MeasureDefinition> measures) {
    for (MeasureDefinition measure : measures) {
      final PartialAggregate source = from.getMeasures().get(measure.getName());
      if (source != null) {
        measure.getType().merge(into.getMeasures().get(measure.getName()), source);
      }
    }
  }

  private static Map<GroupKey, AggregateRow> combine(Map<GroupKey, AggregateRow> lhs,
                                                     Map<GroupKey, AggregateRow> rhs,
                                                     List<MeasureDefinition> measures) {
    rhs.forEach((key, row) -> lhs.merge(key, row, (existing, incoming) -> {
      mergeMeasures(existing, incoming, measures);
      return existing;
    }));
    return lhs;
  }

  private static List<AggregateRow> sorted(Map<GroupKey, AggregateRow> groups) {
    final List<AggregateRow> rows = new ArrayList<>(groups.values());
    rows.sort(ROW_ORDER);
    return rows;
  }

  private static String dimensionKey(Map<String, String> dimensions) {
    return dimensions.values().stream()
        .map(value -> value == null ? "" : value)
        .collect(Collectors.joining("\u0000"));
  }

  static String stringValue(Object value) {
    return value == null ? null : value.toString();
  }

  static Double toDouble(Object value) {
    if (value == null) {
      return null;
    } else if (value instanceof Number) {
      return ((Number) value).doubleValue();
    } else if (value instanceof Boolean) {
      return ((Boolean) value) ? 1.0 : 0.0;
    } else {
      return Double.parseDouble(value.toString());
    }
  }
}
