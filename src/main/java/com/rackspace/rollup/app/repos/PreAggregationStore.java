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

package com.rackspace.rollup.app.repos;

import com.rackspace.rollup.app.model.Partition;
import com.rackspace.rollup.app.model.PartitionKey;
import com.rackspace.rollup.app.model.PreAggregationDefinition;
import com.rackspace.rollup.app.model.TenantIsolationKey;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Tenant-namespaced storage of built partitions. Every operation takes the calling tenant and
 * fails with {@link com.rackspace.rollup.app.exception.CrossTenantAccessException} when a key
 * belongs to another one.
 */
public interface PreAggregationStore {

  /**
   * @return the last committed content of the partition or empty when it was never built
   */
  Mono<Partition> get(TenantIsolationKey caller, PartitionKey key);

  /**
   * Atomically replaces the partition; readers observe either the previous or the new content.
   */
  Mono<Partition> put(TenantIsolationKey caller, Partition partition);

  /**
   * @return the caller's partitions of the current structure version, ordered by bucket
   */
  Flux<Partition> listByDefinition(TenantIsolationKey caller, PreAggregationDefinition definition);
}
