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

import com.rackspace.rollup.app.exception.CrossTenantAccessException;
import com.rackspace.rollup.app.model.Partition;
import com.rackspace.rollup.app.model.PartitionKey;
import com.rackspace.rollup.app.model.PreAggregationDefinition;
import com.rackspace.rollup.app.model.TenantIsolationKey;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Keeps partitions in memory, one namespace per tenant and one table per definition version.
 * Partitions are immutable, so replacing the map entry is the atomic commit.
 */
@Repository
@Slf4j
public class InMemoryPreAggregationStore implements PreAggregationStore {
  private final ConcurrentMap<TenantIsolationKey, ConcurrentMap<String, ConcurrentNavigableMap<Instant, Partition>>>
      namespaces = new ConcurrentHashMap<>();
  private final Counter commits;
  private final Counter crossTenantAttempts;

  @Autowired
  public InMemoryPreAggregationStore(MeterRegistry meterRegistry) {
    this.commits = meterRegistry.counter("rollup.store.commits");
    this.crossTenantAttempts = meterRegistry.counter("rollup.store.crossTenantAttempts");
  }

  @Override
  public Mono<Partition> get(TenantIsolationKey caller, PartitionKey key) {
    return Mono.fromCallable(() -> {
      checkAccess(caller, key);
      final Map<Instant, Partition> table = namespace(caller).get(tableName(key));
      return table != null ? table.get(key.getBucket()) : null;
    });
  }

  @Override
  public Mono<Partition> put(TenantIsolationKey caller, Partition partition) {
    return Mono.fromCallable(() -> {
      final PartitionKey key = partition.getKey();
      checkAccess(caller, key);
      namespace(caller)
          .computeIfAbsent(tableName(key), name -> new ConcurrentSkipListMap<>())
          .put(key.getBucket(), partition);
      commits.increment();
      log.debug("Committed partition {} with {} rows", key, partition.getRowCount());
      return partition;
    });
  }

  @Override
  public Flux<Partition> listByDefinition(TenantIsolationKey caller,
                                          PreAggregationDefinition definition) {
    return Flux.defer(() -> {
      final Map<Instant, Partition> table = namespace(caller)
          .get(tableName(definition.getId(), definition.getStructureVersion()));
      return table != null ? Flux.fromIterable(table.values()) : Flux.empty();
    });
  }

  private ConcurrentMap<String, ConcurrentNavigableMap<Instant, Partition>> namespace(
      TenantIsolationKey tenant) {
    return namespaces.computeIfAbsent(tenant, t -> new ConcurrentHashMap<>());
  }

  private void checkAccess(TenantIsolationKey caller, PartitionKey key) {
    if (!key.getTenant().equals(caller)) {
      crossTenantAttempts.increment();
      log.error("Tenant {} attempted to access partition {}", caller, key.getStorageId());
      throw new CrossTenantAccessException(caller, key);
    }
  }

  private static String tableName(PartitionKey key) {
    return tableName(key.getDefinitionId(), key.getStructureVersion());
  }

  private static String tableName(String definitionId, String structureVersion) {
    return definitionId + "_" + structureVersion;
  }
}
