package com.rackspace.rollup.app.repos;

import static org.assertj.core.api.Assertions.assertThat;

import com.rackspace.rollup.app.TestModels;
import com.rackspace.rollup.app.aggregate.AggregateRow;
import com.rackspace.rollup.app.aggregate.PartialAggregate;
import com.rackspace.rollup.app.exception.CrossTenantAccessException;
import com.rackspace.rollup.app.model.Partition;
import com.rackspace.rollup.app.model.PartitionKey;
import com.rackspace.rollup.app.model.PreAggregationDefinition;
import com.rackspace.rollup.app.model.TenantIsolationKey;
import com.rackspace.rollup.app.model.TimeRange;
import com.rackspace.rollup.app.services.TimeSlotPartitioner;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

class InMemoryPreAggregationStoreTest {

  final MeterRegistry meterRegistry = new SimpleMeterRegistry();
  final InMemoryPreAggregationStore store = new InMemoryPreAggregationStore(meterRegistry);
  final TimeSlotPartitioner partitioner = new TimeSlotPartitioner();
  final PreAggregationDefinition definition = TestModels.daily("daily").build();
  final Instant bucket = Instant.parse("2024-03-01T00:00:00Z");

  final TenantIsolationKey tenantA = TenantIsolationKey.of("tenant-a");
  final TenantIsolationKey tenantB = TenantIsolationKey.of("tenant-b");

  @Test
  void getMissing() {
    StepVerifier.create(store.get(tenantA, partitioner.deriveKey(definition, tenantA, bucket)))
        .verifyComplete();
  }

  @Test
  void putThenGet() {
    final Partition partition = partition(partitioner.deriveKey(definition, tenantA, bucket), 5);

    StepVerifier.create(store.put(tenantA, partition))
        .expectNext(partition)
        .verifyComplete();
    StepVerifier.create(store.get(tenantA, partition.getKey()))
        .expectNext(partition)
        .verifyComplete();
    assertThat(meterRegistry.get("rollup.store.commits").counter().count()).isEqualTo(1.0);
  }

  @Test
  void listsOnlyCallerPartitionsOfCurrentVersion() {
    final PreAggregationDefinition otherVersion = TestModels.daily("daily")
        .structureVersion("99999999").build();
    store.put(tenantA, partition(partitioner.deriveKey(definition, tenantA,
        bucket.plus(1, ChronoUnit.DAYS)), 1)).block();
    store.put(tenantA, partition(partitioner.deriveKey(definition, tenantA, bucket), 1)).block();
    store.put(tenantA, partition(partitioner.deriveKey(otherVersion, tenantA, bucket), 1)).block();
    store.put(tenantB, partition(partitioner.deriveKey(definition, tenantB, bucket), 1)).block();

    StepVerifier.create(store.listByDefinition(tenantA, definition).map(p -> p.getKey().getBucket()))
        .expectNext(bucket, bucket.plus(1, ChronoUnit.DAYS))
        .verifyComplete();
  }

  @Test
  void crossTenantAccessIsRejected() {
    final Random random = new Random(42);
    final List<TenantIsolationKey> tenants = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      tenants.add(TenantIsolationKey.of("tenant-" + i));
    }

    int attempts = 0;
    for (int i = 0; i < 200; i++) {
      final TenantIsolationKey owner = tenants.get(random.nextInt(tenants.size()));
      final TenantIsolationKey caller = tenants.get(random.nextInt(tenants.size()));
      final PartitionKey key = partitioner.deriveKey(definition, owner,
          bucket.plus(random.nextInt(30), ChronoUnit.DAYS));
      store.put(owner, partition(key, 1)).block();

      if (!caller.equals(owner)) {
        attempts += 2;
        StepVerifier.create(store.get(caller, key))
            .expectError(CrossTenantAccessException.class)
            .verify();
        StepVerifier.create(store.put(caller, partition(key, 2)))
            .expectError(CrossTenantAccessException.class)
            .verify();
        // the owner's content is untouched
        assertThat(store.get(owner, key).block().getRowCount()).isEqualTo(1);
      }
    }

    assertThat(attempts).isPositive();
    assertThat(meterRegistry.get("rollup.store.crossTenantAttempts").counter().count())
        .isEqualTo(attempts);
  }

  @Test
  void readersObserveWholeSnapshots() throws InterruptedException {
    final PartitionKey key = partitioner.deriveKey(definition, tenantA, bucket);
    store.put(tenantA, partition(key, 1)).block();

    final ExecutorService executor = Executors.newFixedThreadPool(4);
    final AtomicBoolean torn = new AtomicBoolean();
    final CountDownLatch done = new CountDownLatch(4);
    for (int w = 0; w < 2; w++) {
      executor.submit(() -> {
        for (int i = 1; i <= 500; i++) {
          store.put(tenantA, partition(key, i % 7 + 1)).block();
        }
        done.countDown();
      });
    }
    for (int r = 0; r < 2; r++) {
      executor.submit(() -> {
        for (int i = 0; i < 1000; i++) {
          final Partition read = store.get(tenantA, key).block();
          // every partition is written with one row per count and a matching checksum
          if (!read.getChecksum().equals("rows-" + read.getRowCount())) {
            torn.set(true);
          }
        }
        done.countDown();
      });
    }

    assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
    executor.shutdownNow();
    assertThat(torn).isFalse();
  }

  private Partition partition(PartitionKey key, int rowCount) {
    final List<AggregateRow> rows = new ArrayList<>();
    for (int i = 0; i < rowCount; i++) {
      rows.add(new AggregateRow()
          .setTimestamp(key.getBucket())
          .setDimensions(Map.of("region", "r" + i))
          .setMeasures(Map.of("count", new PartialAggregate().setCount(1))));
    }
    return Partition.builder()
        .key(key)
        .timeRange(TimeRange.of(key.getBucket(), key.getBucket().plus(1, ChronoUnit.DAYS)))
        .rows(List.copyOf(rows))
        .lastRefreshed(Instant.now())
        .checksum("rows-" + rowCount)
        .build();
  }
}
