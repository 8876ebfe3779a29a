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

/**
 * The closed set of measure aggregations. Each one knows how to fold a raw value into a
 * {@link PartialAggregate}, how to combine two partials computed over disjoint rows, and how
 * to produce the final value. Combining partials gives the same result as aggregating the
 * union of the underlying rows, which is what lets stored partitions and live reads be mixed.
 */
public enum AggregationType {
  SUM {
    @Override
    public void accumulate(PartialAggregate agg, double value) {
      agg.addToSum(value);
      agg.setCount(agg.getCount() + 1);
    }

    @Override
    public void merge(PartialAggregate into, PartialAggregate from) {
      into.addToSum(from);
      into.setCount(into.getCount() + from.getCount());
    }

    @Override
    public Double result(PartialAggregate agg) {
      return agg.getCount() > 0 ? agg.getSum() : null;
    }
  },
  COUNT {
    @Override
    public void accumulate(PartialAggregate agg, double value) {
      agg.setCount(agg.getCount() + 1);
    }

    @Override
    public void merge(PartialAggregate into, PartialAggregate from) {
      into.setCount(into.getCount() + from.getCount());
    }

    @Override
    public Double result(PartialAggregate agg) {
      return (double) agg.getCount();
    }
  },
  /**
   * Kept as a sum and count pair; averaging averages would weight partitions wrongly.
   */
  AVG {
    @Override
    public void accumulate(PartialAggregate agg, double value) {
      SUM.accumulate(agg, value);
    }

    @Override
    public void merge(PartialAggregate into, PartialAggregate from) {
      SUM.merge(into, from);
    }

    @Override
    public Double result(PartialAggregate agg) {
      return agg.getCount() > 0 ? agg.getSum() / agg.getCount() : null;
    }
  },
  MIN {
    @Override
    public void accumulate(PartialAggregate agg, double value) {
      agg.setMin(Double.min(agg.getMin(), value));
      agg.setCount(agg.getCount() + 1);
    }

    @Override
    public void merge(PartialAggregate into, PartialAggregate from) {
      into.setMin(Double.min(into.getMin(), from.getMin()));
      into.setCount(into.getCount() + from.getCount());
    }

    @Override
    public Double result(PartialAggregate agg) {
      return agg.getCount() > 0 ? agg.getMin() : null;
    }
  },
  MAX {
    @Override
    public void accumulate(PartialAggregate agg, double value) {
      agg.setMax(Double.max(agg.getMax(), value));
      agg.setCount(agg.getCount() + 1);
    }

    @Override
    public void merge(PartialAggregate into, PartialAggregate from) {
      into.setMax(Double.max(into.getMax(), from.getMax()));
      into.setCount(into.getCount() + from.getCount());
    }

    @Override
    public Double result(PartialAggregate agg) {
      return agg.getCount() > 0 ? agg.getMax() : null;
    }
  };

  public abstract void accumulate(PartialAggregate agg, double value);

  public abstract void merge(PartialAggregate into, PartialAggregate from);

  /**
   * @return the final value or null when no non-null input contributed, matching SQL
   */
  public abstract Double result(PartialAggregate agg);
}
