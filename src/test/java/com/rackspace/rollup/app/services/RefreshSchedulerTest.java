package com.rackspace.rollup.app.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.rackspace.rollup.app.MutableClock;
import com.rackspace.rollup.app.TestModels;
import com.rackspace.rollup.app.aggregate.AggregateRow;
import com.rackspace.rollup.app.aggregate.PartialAggregate;
import com.rackspace.rollup.app.config.RefreshProperties;
import com.rackspace.rollup.app.config.RetrySpec;
import com.rackspace.rollup.app.model.Granularity;
import com.rackspace.rollup.app.model.Partition;
import com.rackspace.rollup.app.model.PartitionKey;
import com.rackspace.rollup.app.model.PartitionStatus;
import com.rackspace.rollup.app.model.PlanType;
import com.rackspace.rollup.app.model.PreAggregationDefinition;
import com.rackspace.rollup.app.model.QueryPlan;
import com.rackspace.rollup.app.model.RefreshJob;
import com.rackspace.rollup.app.model.RollupQuery;
import com.rackspace.rollup.app.model.TenantConfigSnapshot;
import com.rackspace.rollup.app.model.TenantIsolationKey;
import com.rackspace.rollup.app.model.TimeRange;
import com.rackspace.rollup.app.repos.InMemoryPreAggregationStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

class RefreshSchedulerTest {

  final MeterRegistry meterRegistry = new SimpleMeterRegistry();
  final DefinitionRegistry definitionRegistry = mock(DefinitionRegistry.class);
  final SourceQueryService sourceQueryService = mock(SourceQueryService.class);
  final RefreshCondition refreshCondition = mock(RefreshCondition.class);
  final TenantRegistry tenantRegistry = new TenantRegistry(100);
  final TimeSlotPartitioner partitioner = new TimeSlotPartitioner();
  final InMemoryPreAggregationStore store = new InMemoryPreAggregationStore(meterRegistry);
  final FreshnessEvaluator freshnessEvaluator = new FreshnessEvaluator(refreshCondition);
  final RefreshJobTracker tracker = new RefreshJobTracker();
  final MutableClock clock = new MutableClock(Instant.parse("2024-03-05T12:30:00Z"));

  final RefreshProperties properties = new RefreshProperties()
      .setEnabled(false)
      .setMaxConcurrentJobs(4)
      .setMaxConcurrentJobsPerTenant(2)
      .setRetry(new RetrySpec()
          .setMaxAttempts(3)
          .setMinBackoff(Duration.ofMillis(10))
          .setMaxBackoff(Duration.ofMillis(50)));

  final TenantIsolationKey tenantA = TenantIsolationKey.of("tenant-a");
  final TenantIsolationKey tenantB = TenantIsolationKey.of("tenant-b");

  final PreAggregationDefinition daily = TestModels.daily("daily")
      .buildRangeStart(Instant.parse("2024-03-01T00:00:00Z"))
      .build();

  ScheduledExecutorService executor;
  Scheduler workerScheduler;
  RefreshScheduler scheduler;

  /**
   * Source reads by partition range; replaced per test.
   */
  volatile Function<TimeRange, Mono<List<AggregateRow>>> source = range -> Mono.just(rows(1));

  @BeforeEach
  void setUp() {
    executor = Executors.newScheduledThreadPool(2);
    workerScheduler = Schedulers.newParallel("refresh-test", 4);
    tenantRegistry.schedule(tenantA, "app-a");
    useDefinitions(daily);
    when(sourceQueryService.aggregate(any(), any(), any(), any(), any(), any(), any()))
        .thenAnswer(invocation -> Mono.defer(() -> source.apply(invocation.getArgument(2))));

    final PartitionRefresher refresher = new PartitionRefresher(sourceQueryService, store,
        new HashService(), partitioner, refreshCondition, meterRegistry);
    scheduler = new RefreshScheduler(definitionRegistry, tenantRegistry,
        mock(TenantContextResolver.class), store, freshnessEvaluator, tracker, refresher,
        partitioner, properties, executor, workerScheduler, clock, meterRegistry);
  }

  @AfterEach
  void tearDown() {
    scheduler.stop();
    workerScheduler.dispose();
  }

  @Nested
  public class runPass {
    @Test
    void buildsMissingPartitions() {
      assertThat(scheduler.runPass().block()).isEqualTo(5);

      awaitStored(tenantA, daily, 5);
      assertThat(scheduler.runningCount()).isZero();
      assertThat(scheduler.queuedCount()).isZero();
      assertThat(meterRegistry.get("rollup.refresh.jobs").tag("outcome", "succeeded")
          .counter().count()).isEqualTo(5.0);
    }

    @Test
    void onlyDuePartitionsAreRebuilt() {
      scheduler.runPass().block();
      awaitStored(tenantA, daily, 5);

      clock.advance(Duration.ofMinutes(59));
      assertThat(scheduler.runPass().block()).isZero();

      clock.advance(Duration.ofMinutes(1));
      assertThat(scheduler.runPass().block()).isEqualTo(5);
      await().atMost(Duration.ofSeconds(10)).untilAsserted(() ->
          assertThat(store.listByDefinition(tenantA, daily).collectList().block())
              .allSatisfy(p -> assertThat(p.getLastRefreshed()).isEqualTo(clock.instant())));
    }

    @Test
    void respectsBuildRangeEnd() {
      useDefinitions(TestModels.daily("daily")
          .buildRangeStart(Instant.parse("2024-03-01T00:00:00Z"))
          .buildRangeEnd(Instant.parse("2024-03-03T00:00:00Z"))
          .build());

      assertThat(scheduler.runPass().block()).isEqualTo(2);
    }

    @Test
    void coversEveryKnownTenant() {
      tenantRegistry.schedule(tenantB, "app-b");

      assertThat(scheduler.runPass().block()).isEqualTo(10);

      awaitStored(tenantA, daily, 5);
      awaitStored(tenantB, daily, 5);
    }

    @Test
    void skipsTenantsOnlySeenInRequests() {
      tenantRegistry.register(tenantB, "app-b");

      assertThat(scheduler.runPass().block()).isEqualTo(5);
      awaitStored(tenantA, daily, 5);
      assertThat(store.listByDefinition(tenantB, daily).count().block()).isZero();
    }

    @Test
    void updateWindow() {
      final PreAggregationDefinition hourly = TestModels.daily("hourly")
          .granularity(Granularity.HOUR)
          .partitionGranularity(Granularity.HOUR)
          .updateWindow(Duration.ofHours(2))
          .buildRangeStart(Instant.parse("2024-03-05T07:00:00Z"))
          .build();
      useDefinitions(hourly);

      // 07:00 through 12:00
      assertThat(scheduler.runPass().block()).isEqualTo(6);
      awaitStored(tenantA, hourly, 6);

      // only 11:00 and 12:00 lie within two hours of 12:30
      assertThat(scheduler.runPass().block()).isEqualTo(2);
      awaitIdle();

      final PartitionKey settled = partitioner.deriveKey(hourly, tenantA,
          Instant.parse("2024-03-05T08:00:00Z"));
      freshnessEvaluator.invalidate(settled, clock.instant());
      assertThat(scheduler.runPass().block()).isEqualTo(3);
      awaitIdle();
      assertThat(freshnessEvaluator.isInvalidated(settled)).isFalse();
    }
  }

  @Nested
  public class failures {
    final PartitionKey key = partitioner.deriveKey(daily, tenantA,
        Instant.parse("2024-03-01T00:00:00Z"));

    @Test
    void retriesWithBackoff() {
      final AtomicInteger calls = new AtomicInteger();
      source = range -> calls.incrementAndGet() <= 2 ?
          Mono.error(new IllegalStateException("source unavailable")) : Mono.just(rows(3));

      assertThat(scheduler.enqueue(key, clock.instant())).isTrue();

      await().atMost(Duration.ofSeconds(10)).until(() -> stored(key) != null);
      awaitIdle();
      assertThat(calls).hasValue(3);
      assertThat(stored(key).getRowCount()).isEqualTo(3);
      assertThat(scheduler.status(key)).isEqualTo(PartitionStatus.FRESH);
      assertThat(meterRegistry.get("rollup.refresh.jobs").tag("outcome", "retried")
          .counter().count()).isEqualTo(2.0);
    }

    @Test
    void exhaustedPartitionStaysFailedUntilInvalidated() {
      final AtomicInteger calls = new AtomicInteger();
      source = range -> {
        calls.incrementAndGet();
        return Mono.error(new IllegalStateException("source unavailable"));
      };

      scheduler.enqueue(key, clock.instant());

      await().atMost(Duration.ofSeconds(10))
          .until(() -> scheduler.failedJobs(tenantA).size() == 1);
      final RefreshJob failed = scheduler.failedJobs(tenantA).get(0);
      assertThat(failed.getAttempts()).isEqualTo(3);
      assertThat(failed.getLastError()).contains("source unavailable");
      assertThat(scheduler.status(key)).isEqualTo(PartitionStatus.FAILED);
      assertThat(calls).hasValue(3);

      source = range -> Mono.just(rows(2));

      // the other four partitions are still enqueued by a pass
      assertThat(scheduler.runPass().block()).isEqualTo(4);
      awaitIdle();
      assertThat(scheduler.status(key)).isEqualTo(PartitionStatus.FAILED);
      assertThat(stored(key)).isNull();

      scheduler.invalidate(key);

      await().atMost(Duration.ofSeconds(10))
          .until(() -> scheduler.status(key) == PartitionStatus.FRESH);
      assertThat(scheduler.failedJobs(tenantA)).isEmpty();
      assertThat(stored(key).getRowCount()).isEqualTo(2);
    }

    @Test
    void failedRefreshKeepsPreviousContent() {
      source = range -> Mono.just(rows(4));
      scheduler.enqueue(key, clock.instant());
      await().atMost(Duration.ofSeconds(10)).until(() -> stored(key) != null);
      awaitIdle();
      final Partition previous = stored(key);

      source = range -> Mono.error(new IllegalStateException("source unavailable"));
      scheduler.invalidate(key);

      await().atMost(Duration.ofSeconds(10))
          .until(() -> scheduler.status(key) == PartitionStatus.FAILED
              && tracker.isExhausted(key));
      assertThat(stored(key)).isSameAs(previous);
      assertThat(freshnessEvaluator.isInvalidated(key)).isTrue();
    }
  }

  @Test
  void invalidationRestartsRunningRefresh() {
    final PartitionKey key = partitioner.deriveKey(daily, tenantA,
        Instant.parse("2024-03-01T00:00:00Z"));
    final List<Sinks.One<List<AggregateRow>>> reads = new CopyOnWriteArrayList<>();
    source = range -> {
      final Sinks.One<List<AggregateRow>> sink = Sinks.one();
      reads.add(sink);
      return sink.asMono();
    };

    scheduler.enqueue(key, clock.instant());
    await().atMost(Duration.ofSeconds(10)).until(() -> reads.size() == 1);
    assertThat(scheduler.status(key)).isEqualTo(PartitionStatus.RUNNING);

    clock.advance(Duration.ofSeconds(1));
    scheduler.invalidate(key);

    await().atMost(Duration.ofSeconds(10)).until(() -> reads.size() == 2);
    await().atMost(Duration.ofSeconds(10))
        .until(() -> reads.get(0).currentSubscriberCount() == 0);

    // the superseded read finishing late has no effect
    reads.get(0).tryEmitValue(rows(7));
    assertThat(stored(key)).isNull();

    reads.get(1).tryEmitValue(rows(1));
    await().atMost(Duration.ofSeconds(10))
        .until(() -> scheduler.status(key) == PartitionStatus.FRESH);
    assertThat(stored(key).getRowCount()).isEqualTo(1);
    assertThat(freshnessEvaluator.isInvalidated(key)).isFalse();
  }

  @Test
  void boundsConcurrencyPerTenant() {
    properties.setMaxConcurrentJobs(3).setMaxConcurrentJobsPerTenant(2);
    final ConcurrentMap<Instant, Sinks.One<List<AggregateRow>>> reads = new ConcurrentHashMap<>();
    source = range -> {
      final Sinks.One<List<AggregateRow>> sink = Sinks.one();
      reads.put(range.getStart(), sink);
      return sink.asMono();
    };

    for (int day = 1; day <= 5; day++) {
      scheduler.enqueue(key(tenantA, day), clock.instant());
    }
    scheduler.enqueue(key(tenantB, 9), clock.instant());

    assertThat(scheduler.runningCount()).isEqualTo(3);
    assertThat(scheduler.queuedCount()).isEqualTo(3);
    assertThat(scheduler.status(key(tenantA, 1))).isEqualTo(PartitionStatus.RUNNING);
    assertThat(scheduler.status(key(tenantA, 2))).isEqualTo(PartitionStatus.RUNNING);
    assertThat(scheduler.status(key(tenantA, 3))).isEqualTo(PartitionStatus.PENDING_REFRESH);
    assertThat(scheduler.status(key(tenantB, 9))).isEqualTo(PartitionStatus.RUNNING);
    assertThat(meterRegistry.get("rollup.refresh.queued").gauge().value()).isEqualTo(3.0);

    await().atMost(Duration.ofSeconds(10)).until(() -> reads.size() == 3);
    new ArrayList<>(reads.values()).forEach(sink -> sink.tryEmitValue(rows(1)));

    await().atMost(Duration.ofSeconds(10)).until(() ->
        scheduler.status(key(tenantA, 3)) == PartitionStatus.RUNNING
            && scheduler.status(key(tenantA, 4)) == PartitionStatus.RUNNING);
    assertThat(scheduler.status(key(tenantA, 5))).isEqualTo(PartitionStatus.PENDING_REFRESH);
  }

  @Test
  void dispatchesRoundRobinAcrossTenants() {
    properties.setMaxConcurrentJobs(1).setMaxConcurrentJobsPerTenant(1);
    final List<String> started = new CopyOnWriteArrayList<>();
    final Map<String, Sinks.One<List<AggregateRow>>> reads = new ConcurrentHashMap<>();
    when(sourceQueryService.aggregate(any(), any(), any(), any(), any(), any(), any()))
        .thenAnswer(invocation -> {
          final TenantIsolationKey tenant = invocation.getArgument(0);
          final TimeRange range = invocation.getArgument(2);
          final String label = (tenant.equals(tenantA) ? "A" : "B")
              + range.getStart().atZone(ZoneOffset.UTC).getDayOfMonth();
          final Sinks.One<List<AggregateRow>> sink = Sinks.one();
          started.add(label);
          reads.put(label, sink);
          return sink.asMono();
        });

    for (int day = 1; day <= 3; day++) {
      scheduler.enqueue(key(tenantA, day), clock.instant());
    }
    scheduler.enqueue(key(tenantB, 1), clock.instant());
    scheduler.enqueue(key(tenantB, 2), clock.instant());

    for (int i = 0; i < 5; i++) {
      final int expected = i + 1;
      await().atMost(Duration.ofSeconds(10)).until(() -> started.size() == expected);
      final Sinks.One<List<AggregateRow>> sink = reads.get(started.get(i));
      await().atMost(Duration.ofSeconds(10)).until(() -> sink.currentSubscriberCount() > 0);
      sink.tryEmitValue(rows(1));
    }

    assertThat(started).containsExactly("A1", "B1", "A2", "B2", "A3");
  }

  @Test
  void neverRunsTwoRefreshesOfOnePartition() throws InterruptedException {
    properties.setMaxConcurrentJobs(8).setMaxConcurrentJobsPerTenant(8);
    final ConcurrentMap<Instant, AtomicInteger> inFlight = new ConcurrentHashMap<>();
    final AtomicInteger globalInFlight = new AtomicInteger();
    final AtomicInteger maxGlobal = new AtomicInteger();
    final AtomicBoolean overlapped = new AtomicBoolean();
    final AtomicInteger refreshes = new AtomicInteger();
    source = range -> {
      final AtomicInteger counter =
          inFlight.computeIfAbsent(range.getStart(), bucket -> new AtomicInteger());
      if (counter.incrementAndGet() > 1) {
        overlapped.set(true);
      }
      maxGlobal.accumulateAndGet(globalInFlight.incrementAndGet(), Math::max);
      refreshes.incrementAndGet();
      return Mono.delay(Duration.ofMillis(2))
          .map(tick -> {
            // released before the result is handed back
            globalInFlight.decrementAndGet();
            counter.decrementAndGet();
            return rows(1);
          });
    };

    final List<PartitionKey> keys = new ArrayList<>();
    for (int day = 1; day <= 3; day++) {
      keys.add(key(tenantA, day));
    }
    final ExecutorService callers = Executors.newFixedThreadPool(8);
    for (int t = 0; t < 8; t++) {
      callers.submit(() -> {
        final List<PartitionKey> shuffled = new ArrayList<>(keys);
        for (int i = 0; i < 200; i++) {
          Collections.shuffle(shuffled);
          shuffled.forEach(key -> scheduler.enqueue(key, clock.instant()));
          if (i % 50 == 0) {
            scheduler.runPass().block();
          }
        }
      });
    }
    callers.shutdown();
    assertThat(callers.awaitTermination(60, TimeUnit.SECONDS)).isTrue();
    awaitIdle();

    assertThat(overlapped).isFalse();
    assertThat(maxGlobal.get()).isLessThanOrEqualTo(8);
    assertThat(refreshes.get()).isGreaterThanOrEqualTo(3);
  }

  @Nested
  public class dailyWithTwoDayWindow {
    final PreAggregationDefinition windowed = TestModels.daily("windowed")
        .updateWindow(Duration.ofDays(2))
        .buildRangeStart(Instant.parse("2024-03-01T00:00:00Z"))
        .buildRangeEnd(Instant.parse("2024-03-11T00:00:00Z"))
        .build();

    final TenantConfigResolver tenantConfigResolver = mock(TenantConfigResolver.class);
    final RollupRouter router = new RollupRouter(definitionRegistry, store, freshnessEvaluator,
        tracker, partitioner, tenantConfigResolver, clock);

    @BeforeEach
    void setUp() {
      clock.set(Instant.parse("2024-03-10T12:30:00Z"));
      useDefinitions(windowed);
      when(definitionRegistry.cube(TestModels.EVENTS.getName())).thenReturn(TestModels.EVENTS);
      when(definitionRegistry.definitionsFor(TestModels.EVENTS)).thenReturn(List.of(windowed));
      when(tenantConfigResolver.resolve(any())).thenReturn(
          new TenantConfigSnapshot("events", "jdbc:h2:mem:test", null, null, null, 1, false));
    }

    @Test
    void servesTenDaysAndRequeuesOnlyTheWindow() {
      assertThat(scheduler.runPass().block()).isEqualTo(10);
      awaitStored(tenantA, windowed, 10);

      final QueryPlan plan = router.route(new RollupQuery()
          .setCube(TestModels.EVENTS.getName())
          .setMeasures(List.of("count"))
          .setGranularity(Granularity.DAY)
          .setStart(Instant.parse("2024-03-01T00:00:00Z"))
          .setEnd(Instant.parse("2024-03-11T00:00:00Z")), tenantA).block();
      assertThat(plan.getType()).isEqualTo(PlanType.PARTITIONS);
      assertThat(plan.getPartitions()).hasSize(10);

      final Instant firstBuild = clock.instant();
      clock.advance(Duration.ofHours(1));

      assertThat(scheduler.runPass().block()).isEqualTo(2);
      awaitIdle();

      for (int day = 1; day <= 10; day++) {
        final Partition partition = stored(windowedKey(day));
        final Instant expected = day >= 9 ? clock.instant() : firstBuild;
        assertThat(partition.getLastRefreshed()).as("day %d", day).isEqualTo(expected);
      }
    }

    private PartitionKey windowedKey(int dayOfMarch) {
      return partitioner.deriveKey(windowed, tenantA,
          Instant.parse("2024-03-01T00:00:00Z").plus(Duration.ofDays(dayOfMarch - 1)));
    }
  }

  private void useDefinitions(PreAggregationDefinition... definitions) {
    when(definitionRegistry.definitions()).thenReturn(List.of(definitions));
    for (PreAggregationDefinition definition : definitions) {
      when(definitionRegistry.definition(definition.getId())).thenReturn(definition);
    }
  }

  private PartitionKey key(TenantIsolationKey tenant, int dayOfMarch) {
    return partitioner.deriveKey(daily, tenant,
        Instant.parse("2024-03-01T00:00:00Z").plus(Duration.ofDays(dayOfMarch - 1)));
  }

  private Partition stored(PartitionKey key) {
    return store.get(key.getTenant(), key).block();
  }

  private void awaitStored(TenantIsolationKey tenant, PreAggregationDefinition definition,
                           int count) {
    await().atMost(Duration.ofSeconds(10)).until(() ->
        store.listByDefinition(tenant, definition).count().block() == count);
    awaitIdle();
  }

  private void awaitIdle() {
    await().atMost(Duration.ofSeconds(30)).until(() ->
        scheduler.runningCount() == 0 && scheduler.queuedCount() == 0
            && tracker.allActiveJobs().isEmpty());
  }

  private static List<AggregateRow> rows(int count) {
    final List<AggregateRow> rows = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      rows.add(new AggregateRow()
          .setTimestamp(Instant.parse("2024-03-01T00:00:00Z"))
          .setDimensions(Map.of("region", "r" + i))
          .setMeasures(Map.of("count", new PartialAggregate().setCount(1))));
    }
    return rows;
  }
}
