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

package com.rackspace.rollup.app.web;

import com.rackspace.rollup.app.model.InvalidateRequest;
import com.rackspace.rollup.app.model.InvalidateResponse;
import com.rackspace.rollup.app.model.PartitionInfo;
import com.rackspace.rollup.app.model.PartitionKey;
import com.rackspace.rollup.app.model.PreAggregationDefinition;
import com.rackspace.rollup.app.model.RefreshJob;
import com.rackspace.rollup.app.model.TenantIsolationKey;
import com.rackspace.rollup.app.repos.PreAggregationStore;
import com.rackspace.rollup.app.services.DefinitionRegistry;
import com.rackspace.rollup.app.services.RefreshScheduler;
import com.rackspace.rollup.app.services.TenantContextResolver;
import com.rackspace.rollup.app.services.TimeSlotPartitioner;
import com.rackspace.rollup.app.utils.DateTimeUtils;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import javax.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Operator endpoints for the calling tenant's partitions and refresh jobs.
 */
@RestController
@RequestMapping("/api/pre-aggregations")
@Slf4j
public class PreAggregationController {

  private final DefinitionRegistry definitionRegistry;
  private final PreAggregationStore store;
  private final RefreshScheduler refreshScheduler;
  private final TenantContextResolver tenantContextResolver;
  private final TimeSlotPartitioner partitioner;
  private final Clock clock;

  @Autowired
  public PreAggregationController(DefinitionRegistry definitionRegistry,
                                  PreAggregationStore store,
                                  RefreshScheduler refreshScheduler,
                                  TenantContextResolver tenantContextResolver,
                                  TimeSlotPartitioner partitioner,
                                  Clock clock) {
    this.definitionRegistry = definitionRegistry;
    this.store = store;
    this.refreshScheduler = refreshScheduler;
    this.tenantContextResolver = tenantContextResolver;
    this.partitioner = partitioner;
    this.clock = clock;
  }

  @GetMapping("/{id}/partitions")
  public Flux<PartitionInfo> partitions(@PathVariable String id,
                                        @RequestHeader HttpHeaders headers) {
    return Flux.defer(() -> {
      final TenantIsolationKey tenant = resolve(headers);
      final PreAggregationDefinition definition = definitionRegistry.definition(id);
      return store.listByDefinition(tenant, definition)
          .map(partition -> PartitionInfo.from(partition,
              refreshScheduler.status(partition.getKey())));
    });
  }

  @PostMapping("/invalidate")
  public Mono<ResponseEntity<InvalidateResponse>> invalidate(
      @RequestBody @Valid InvalidateRequest request, @RequestHeader HttpHeaders headers) {
    return Mono.fromCallable(() -> {
      final TenantIsolationKey tenant = resolve(headers);
      final PreAggregationDefinition definition =
          definitionRegistry.definition(request.getDefinitionId());
      final Instant bucket = DateTimeUtils.parseInstant(request.getBucket(), clock.instant());
      final PartitionKey key = partitioner.deriveKey(definition, tenant, bucket);
      log.info("Invalidating partition {}", key);
      return ResponseEntity.status(HttpStatus.ACCEPTED).body(new InvalidateResponse()
          .setStorageId(key.getStorageId())
          .setStatus(refreshScheduler.invalidate(key)));
    });
  }

  @PostMapping("/refresh")
  public Mono<Map<String, Integer>> refresh(@RequestHeader HttpHeaders headers) {
    return Mono.defer(() -> refreshScheduler.runPass(resolve(headers), clock.instant()))
        .map(enqueued -> Map.of("enqueued", enqueued));
  }

  @GetMapping("/jobs")
  public Flux<RefreshJob> jobs(@RequestHeader HttpHeaders headers) {
    return Flux.defer(() -> Flux.fromIterable(refreshScheduler.activeJobs(resolve(headers))));
  }

  @GetMapping("/failed")
  public Flux<RefreshJob> failed(@RequestHeader HttpHeaders headers) {
    return Flux.defer(() -> Flux.fromIterable(refreshScheduler.failedJobs(resolve(headers))));
  }

  private TenantIsolationKey resolve(HttpHeaders headers) {
    return tenantContextResolver.resolve(tenantContextResolver.fromHeaders(headers));
  }
}
