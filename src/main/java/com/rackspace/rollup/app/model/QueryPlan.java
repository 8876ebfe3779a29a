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
import lombok.Value;

/**
 * Routing decision for one query. Every listed partition covers exactly the part of the query
 * range it is used for; the live range, if any, covers the rest.
 */
@Value
public class QueryPlan {
  PlanType type;
  String definitionId;
  List<PartitionKey> partitions;
  TimeRange liveRange;
  String diagnostic;

  public static QueryPlan partitions(String definitionId, List<PartitionKey> partitions) {
    return new QueryPlan(PlanType.PARTITIONS, definitionId, List.copyOf(partitions), null, null);
  }

  public static QueryPlan lambda(String definitionId, List<PartitionKey> partitions,
                                 TimeRange liveRange) {
    return new QueryPlan(PlanType.LAMBDA, definitionId, List.copyOf(partitions), liveRange, null);
  }

  public static QueryPlan rejected(String diagnostic) {
    return new QueryPlan(PlanType.REJECTED, null, List.of(), null, diagnostic);
  }

  public static QueryPlan passthrough(TimeRange liveRange) {
    return new QueryPlan(PlanType.PASSTHROUGH, null, List.of(), liveRange, null);
  }
}
