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

import com.rackspace.rollup.app.config.RefreshProperties;
import com.rackspace.rollup.app.config.RetrySpec;
import com.rackspace.rollup.app.exception.RefreshExhaustedException;
import com.rackspace.rollup.app.model.JobState;
import com.rackspace.rollup.app.model.Partition;
import com.rackspace.rollup.app.model.PartitionKey;
import com.rackspace.rollup.app.model.PartitionStatus;
import com.rackspace.rollup.app.model.PreAggregationDefinition;
import com.rackspace.rollup.app.model.RefreshJob;
import com.rackspace.rollup.app.model.TenantIsolationKey;
import com.rackspace.rollup.app.repos.PreAggregationStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Keeps partitions built and fresh. Each pass walks every known tenant and definition,
 * enqueues refreshes of partitions that are missing or due, and dispatches queued jobs
 * round-robin across tenants within the global and per-tenant concurrency bounds.
 */
@Service
@Slf4j
public class RefreshScheduler {
  private final DefinitionRegistry definitionRegistry;
  private final TenantRegistry tenantRegistry;
  private final TenantContextResolver tenantContextResolver;
  private final PreAggregationStore store;
  private final FreshnessEvaluator freshnessEvaluator;
  private final RefreshJobTracker tracker;
  private final PartitionRefresher refresher;
  private final TimeSlotPartitioner partitioner;
  private final RefreshProperties properties;
  private final ScheduledExecutorService executor;
  private final Scheduler workerScheduler;
  private final Clock clock;

  private final Counter enqueuedCounter;
  private final Counter succeededCounter;
  private final Counter retriedCounter;
  private final Counter exhaustedCounter;

  /**
   * Guards the queues and the running counts.
   */
  private final Object lock = new Object();
  private final Map<TenantIsolationKey, Deque<RefreshJob>> queues = new LinkedHashMap<>();
  private final List<TenantIsolationKey> rotation = new ArrayList<>();
  private final Map<TenantIsolationKey, Integer> runningByTenant = new HashMap<>();
  private int rotationCursor;
  private int running;
  private volatile boolean stopped;

  @Autowired
  public RefreshScheduler(DefinitionRegistry definitionRegistry,
                          TenantRegistry tenantRegistry,
                          TenantContextResolver tenantContextResolver,
                          PreAggregationStore store,
                          FreshnessEvaluator freshnessEvaluator,
                          RefreshJobTracker tracker,
                          PartitionRefresher refresher,
                          TimeSlotPartitioner partitioner,
                          RefreshProperties properties,
                          @Qualifier("scheduledExecutorService") ScheduledExecutorService executor,
                          @Qualifier("refreshWorkerScheduler") Scheduler workerScheduler,
                          Clock clock,
                          MeterRegistry meterRegistry) {
    this.definitionRegistry = definitionRegistry;
    this.tenantRegistry = tenantRegistry;
    this.tenantContextResolver = tenantContextResolver;
    this.store = store;
    this.freshnessEvaluator = freshnessEvaluator;
    this.tracker = tracker;
    this.refresher = refresher;
    this.partitioner = partitioner;
    this.properties = properties;
    this.executor = executor;
    this.workerScheduler = workerScheduler;
    this.clock = clock;
    this.enqueuedCounter = meterRegistry.counter("rollup.refresh.jobs", "outcome", "enqueued");
    this.succeededCounter = meterRegistry.counter("rollup.refresh.jobs", "outcome", "succeeded");
    this.retriedCounter = meterRegistry.counter("rollup.refresh.jobs", "outcome", "retried");
    this.exhaustedCounter = meterRegistry.counter("rollup.refresh.jobs", "outcome", "exhausted");
    meterRegistry.gauge("rollup.refresh.queued", this, RefreshScheduler::queuedCount);
    meterRegistry.gauge("rollup.refresh.running", this, RefreshScheduler::runningCount);
  }

  @PostConstruct
  public void setupSchedulers() {
    properties.getScheduledContexts().forEach(tenantContextResolver::resolveScheduled);
    if (properties.isEnabled()) {
      log.info("Starting refresh passes every {} after {}", properties.getInterval(),
          properties.getInitialProcessingDelay());
      scheduleNextPass(properties.getInitialProcessingDelay());
    } else {
      log.info("Periodic refresh passes are disabled");
    }
  }

  @PreDestroy
  public void stop() {
    stopped = true;
    synchronized (lock) {
      queues.values().forEach(queue -> queue.forEach(tracker::release));
      queues.clear();
      rotation.clear();
    }
    tracker.allActiveJobs().forEach(job -> {
      final Disposable execution = job.getExecution();
      if (execution != null) {
        execution.dispose();
      }
    });
    executor.shutdown();
  }

  public Mono<Integer> runPass() {
    return runPass(clock.instant());
  }

  /**
   * Enqueues refreshes of all partitions of the scheduled tenants that are missing or due.
   *
   * @return the number of newly enqueued refreshes
   */
  public Mono<Integer> runPass(Instant now) {
    return Flux.fromIterable(tenantRegistry.scheduledTenants())
        .concatMap(tenant -> planTenant(tenant, now))
        .reduce(0, Integer::sum)
        .doOnSuccess(count -> log.debug("Refresh pass at {} enqueued {} partitions", now, count));
  }

  public Mono<Integer> runPass(TenantIsolationKey tenant, Instant now) {
    return planTenant(tenant, now);
  }

  /**
   * Marks the partition stale and enqueues its refresh. A refresh already running for it is
   * cancelled and started over, since it may have read the source before the change that
   * caused the invalidation.
   */
  public PartitionStatus invalidate(PartitionKey key) {
    final Instant now = clock.instant();
    freshnessEvaluator.invalidate(key, now);
    tracker.resetExhausted(key);
    synchronized (lock) {
      final RefreshJob existing = tracker.get(key).orElse(null);
      if (existing != null && existing.getState() != JobState.PENDING) {
        cancel(existing, "Superseded by invalidation");
      }
    }
    enqueue(key, now);
    return tracker.status(key);
  }

  /**
   * @return true if a new job was enqueued, false if one was already pending or running
   */
  public boolean enqueue(PartitionKey key, Instant now) {
    if (stopped) {
      return false;
    }
    final Optional<RefreshJob> tracked = tracker.track(key, now);
    if (tracked.isEmpty()) {
      return false;
    }
    synchronized (lock) {
      queueOf(key.getTenant()).addLast(tracked.get());
    }
    enqueuedCounter.increment();
    log.trace("Enqueued refresh of {}", key);
    dispatch();
    return true;
  }

  public PartitionStatus status(PartitionKey key) {
    return tracker.status(key);
  }

  public List<RefreshJob> activeJobs(TenantIsolationKey tenant) {
    return tracker.activeJobs(tenant);
  }

  public List<RefreshJob> failedJobs(TenantIsolationKey tenant) {
    return tracker.exhaustedJobs(tenant);
  }

  public int queuedCount() {
    synchronized (lock) {
      return queues.values().stream().mapToInt(Deque::size).sum();
    }
  }

  public int runningCount() {
    synchronized (lock) {
      return running;
    }
  }

  private void scheduleNextPass(Duration delay) {
    if (stopped) {
      return;
    }
    try {
      executor.schedule(this::scheduledPass, delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      log.debug("Not scheduling refresh pass since the executor is shut down");
    }
  }

  private void scheduledPass() {
    runPass()
        .doOnError(e -> log.warn("Refresh pass failed", e))
        .onErrorResume(e -> Mono.empty())
        .doFinally(signal -> scheduleNextPass(properties.getInterval()))
        .subscribe();
  }

  private Mono<Integer> planTenant(TenantIsolationKey tenant, Instant now) {
    return Flux.fromIterable(definitionRegistry.definitions())
        .concatMap(definition -> planDefinition(tenant, definition, now))
        .reduce(0, Integer::sum);
  }

  private Mono<Integer> planDefinition(TenantIsolationKey tenant,
                                       PreAggregationDefinition definition, Instant now) {
    final Instant end = definition.getBuildRangeEnd() != null
        && definition.getBuildRangeEnd().isBefore(now) ? definition.getBuildRangeEnd() : now;
    final List<Instant> buckets =
        partitioner.partitionsOverRange(definition, definition.getBuildRangeStart(), end);

    return store.listByDefinition(tenant, definition)
        .collectMap(partition -> partition.getKey().getBucket())
        .flatMapMany(existing -> Flux.fromIterable(buckets)
            .concatMap(bucket -> {
              final PartitionKey key = partitioner.deriveKey(definition, tenant, bucket);
              if (tracker.isExhausted(key)) {
                // stays failed until invalidated
                return Mono.just(false);
              }
              final Partition partition = existing.get(bucket);
              final Mono<Boolean> due = partition == null ? Mono.just(true) :
                  freshnessEvaluator.needsRefresh(partition, definition, now);
              return due.map(isDue -> isDue && enqueue(key, now));
            }))
        .filter(Boolean::booleanValue)
        .count()
        .map(Long::intValue);
  }

  private void dispatch() {
    final List<RefreshJob> toStart = new ArrayList<>();
    synchronized (lock) {
      while (!stopped && running < properties.getMaxConcurrentJobs()) {
        final RefreshJob next = pollNextFair();
        if (next == null) {
          break;
        }
        running++;
        runningByTenant.merge(next.getKey().getTenant(), 1, Integer::sum);
        next.setState(JobState.RUNNING);
        next.setStartedAt(clock.instant());
        toStart.add(next);
      }
    }
    toStart.forEach(this::execute);
  }

  /**
   * Takes the head of the next tenant queue in rotation whose tenant is below its bound.
   */
  private RefreshJob pollNextFair() {
    final int tenants = rotation.size();
    for (int i = 0; i < tenants; i++) {
      final int index = (rotationCursor + i) % tenants;
      final TenantIsolationKey tenant = rotation.get(index);
      final Deque<RefreshJob> queue = queues.get(tenant);
      if (!queue.isEmpty()
          && runningByTenant.getOrDefault(tenant, 0) < properties.getMaxConcurrentJobsPerTenant()) {
        rotationCursor = (index + 1) % tenants;
        return queue.pollFirst();
      }
    }
    return null;
  }

  private Deque<RefreshJob> queueOf(TenantIsolationKey tenant) {
    return queues.computeIfAbsent(tenant, t -> {
      rotation.add(t);
      return new ArrayDeque<>();
    });
  }

  private void execute(RefreshJob job) {
    final PartitionKey key = job.getKey();
    log.debug("Starting refresh of {}, attempt {}", key, job.getAttempts() + 1);
    try {
      final PreAggregationDefinition definition =
          definitionRegistry.definition(key.getDefinitionId());
      final Disposable execution = refresher.refresh(definition, key, job.getStartedAt())
          .timeout(properties.getRefreshTimeout())
          .switchIfEmpty(Mono.error(() -> new IllegalStateException("Refresh produced no partition")))
          .subscribeOn(workerScheduler)
          .subscribe(partition -> onSuccess(job), e -> onFailure(job, e));
      synchronized (lock) {
        if (job.getState() == JobState.RUNNING && tracker.isCurrent(job)) {
          job.setExecution(execution);
        } else {
          // cancelled before the execution could be recorded
          execution.dispose();
        }
      }
    } catch (RuntimeException e) {
      onFailure(job, e);
    }
  }

  private void onSuccess(RefreshJob job) {
    synchronized (lock) {
      if (job.getState() != JobState.RUNNING || !tracker.isCurrent(job)) {
        return;
      }
      releaseSlot(job);
      job.setState(JobState.SUCCEEDED);
      job.setFinishedAt(clock.instant());
    }
    freshnessEvaluator.acknowledgeRefresh(job.getKey(), job.getStartedAt());
    tracker.complete(job);
    succeededCounter.increment();
    dispatch();
  }

  private void onFailure(RefreshJob job, Throwable error) {
    final int attempts;
    synchronized (lock) {
      if (job.getState() != JobState.RUNNING || !tracker.isCurrent(job)) {
        return;
      }
      releaseSlot(job);
      attempts = job.getAttempts() + 1;
      job.setAttempts(attempts);
      job.setState(JobState.FAILED);
      job.setFinishedAt(clock.instant());
      job.setLastError(error.getMessage());
    }

    final RetrySpec retry = properties.getRetry();
    if (retry.isExhausted(attempts)) {
      tracker.exhaust(job);
      exhaustedCounter.increment();
      log.error("Partition left failed",
          new RefreshExhaustedException(job.getKey(), attempts, error));
    } else {
      final Duration delay = retry.delayFor(attempts);
      retriedCounter.increment();
      log.warn("Refresh of {} failed on attempt {}, retrying in {}: {}", job.getKey(), attempts,
          delay, error.getMessage());
      try {
        executor.schedule(() -> requeue(job), delay.toMillis(), TimeUnit.MILLISECONDS);
      } catch (RejectedExecutionException e) {
        log.debug("Dropping retry of {} since the executor is shut down", job.getKey());
        tracker.release(job);
      }
    }
    dispatch();
  }

  private void requeue(RefreshJob job) {
    synchronized (lock) {
      if (stopped || job.getState() != JobState.FAILED || !tracker.isCurrent(job)) {
        return;
      }
      job.setState(JobState.PENDING);
      queueOf(job.getKey().getTenant()).addLast(job);
    }
    dispatch();
  }

  /**
   * Must be called holding the lock.
   */
  private void cancel(RefreshJob job, String reason) {
    if (job.getState() == JobState.RUNNING) {
      releaseSlot(job);
      if (job.getExecution() != null) {
        job.getExecution().dispose();
      }
    }
    log.debug("Cancelled refresh of {}: {}", job.getKey(), reason);
    job.setState(JobState.FAILED);
    job.setLastError(reason);
    tracker.release(job);
  }

  private void releaseSlot(RefreshJob job) {
    running--;
    runningByTenant.computeIfPresent(job.getKey().getTenant(),
        (tenant, count) -> count > 1 ? count - 1 : null);
  }
}
