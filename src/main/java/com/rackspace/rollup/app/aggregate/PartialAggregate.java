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

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.math.BigDecimal;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Re-aggregatable state of one measure within one group. Which fields are meaningful depends
 * on the {@link AggregationType} that maintains it.
 * <p>
 * Sums are accumulated exactly and rounded to {@link #sum} after every step, so the result
 * does not depend on the order in which rows or partials arrive.
 * </p>
 */
@Data
public class PartialAggregate {
  double min = Double.POSITIVE_INFINITY;
  double max = Double.NEGATIVE_INFINITY;
  double sum;
  long count;

  /**
   * Null once a non-finite value has been added, after which plain double addition is used.
   */
  @JsonIgnore
  @EqualsAndHashCode.Exclude
  @ToString.Exclude
  BigDecimal exactSum = BigDecimal.ZERO;

  public void addToSum(double value) {
    if (exactSum != null && Double.isFinite(value)) {
      exactSum = exactSum.add(new BigDecimal(value));
      sum = exactSum.doubleValue();
    } else {
      exactSum = null;
      sum += value;
    }
  }

  public void addToSum(PartialAggregate other) {
    if (exactSum != null && other.exactSum != null) {
      exactSum = exactSum.add(other.exactSum);
      sum = exactSum.doubleValue();
    } else {
      exactSum = null;
      sum += other.getSum();
    }
  }

  /**
   * Setting the sum directly restarts exact accumulation from that value.
   */
  public PartialAggregate setSum(double sum) {
    this.sum = sum;
    this.exactSum = Double.isFinite(sum) ? new BigDecimal(sum) : null;
    return this;
  }
}
