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

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.rackspace.rollup.app.aggregate.AggregateRow;
import com.rackspace.rollup.app.aggregate.PartialAggregate;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

@Service
public class HashService {
  private static final Charset HASHING_CHARSET = StandardCharsets.UTF_8;

  private final HashFunction tokenFunction = Hashing.murmur3_128();
  private final HashFunction versionFunction = Hashing.murmur3_32_fixed();
  private final HashFunction checksumFunction = Hashing.sha256();

  /**
   * @return 32 hex characters identifying the given ordered values
   */
  public String tenantToken(List<String> values) {
    final Hasher hasher = tokenFunction.newHasher();
    values.forEach(value -> putField(hasher, value));
    return hasher.hash().toString();
  }

  /**
   * @return 8 hex characters
   */
  public String structureVersion(String canonicalDefinition) {
    return versionFunction.hashString(canonicalDefinition, HASHING_CHARSET).toString();
  }

  /**
   * Content checksum of partition rows, which must already be in their canonical order.
   */
  public String checksum(List<AggregateRow> rows) {
    final Hasher hasher = checksumFunction.newHasher();
    hasher.putInt(rows.size());
    for (AggregateRow row : rows) {
      hasher.putLong(row.getTimestamp() != null ? row.getTimestamp().getEpochSecond() : Long.MIN_VALUE);
      for (Map.Entry<String, String> dimension : row.getDimensions().entrySet()) {
        putField(hasher, dimension.getKey());
        putField(hasher, dimension.getValue());
      }
      for (Map.Entry<String, PartialAggregate> measure : row.getMeasures().entrySet()) {
        putField(hasher, measure.getKey());
        final PartialAggregate agg = measure.getValue();
        hasher.putDouble(agg.getSum())
            .putLong(agg.getCount())
            .putDouble(agg.getMin())
            .putDouble(agg.getMax());
      }
    }
    return hasher.hash().toString();
  }

  // length-prefixed so that field boundaries can't shift between values
  private static void putField(Hasher hasher, String value) {
    if (value == null) {
      hasher.putInt(-1);
    } else {
      hasher.putInt(value.length()).putString(value, HASHING_CHARSET);
    }
  }
}
