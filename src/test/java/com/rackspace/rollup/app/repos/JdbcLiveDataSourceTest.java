package com.rackspace.rollup.app.repos;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.rackspace.rollup.app.TestModels;
import com.rackspace.rollup.app.config.AppProperties;
import com.rackspace.rollup.app.model.TenantConfigSnapshot;
import com.rackspace.rollup.app.model.TenantIsolationKey;
import com.rackspace.rollup.app.services.TenantConfigResolver;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import reactor.test.StepVerifier;

class JdbcLiveDataSourceTest {

  static final String URL = "jdbc:h2:mem:live-source;DB_CLOSE_DELAY=-1";

  final TenantIsolationKey tenant = TenantIsolationKey.of("t-1");
  final TenantConfigResolver tenantConfigResolver = mock(TenantConfigResolver.class);
  final Cache<TenantIsolationKey, HikariDataSource> pools = Caffeine.newBuilder()
      .removalListener((TenantIsolationKey key, HikariDataSource pool, RemovalCause cause) -> {
        if (pool != null) {
          pool.close();
        }
      })
      .build();
  final AppProperties appProperties = new AppProperties()
      .setLiveQueryFetchSize(10);
  final JdbcLiveDataSource liveDataSource =
      new JdbcLiveDataSource(tenantConfigResolver, appProperties, pools);

  final JdbcTemplate events = new JdbcTemplate(new DriverManagerDataSource(URL, "sa", ""));

  @BeforeEach
  void setUp() {
    when(tenantConfigResolver.resolve(tenant)).thenReturn(
        new TenantConfigSnapshot("live", URL, "sa", "", "org.h2.Driver", 2, false));
    events.execute(TestModels.EVENTS_SCHEMA);
    events.update("DELETE FROM events");
    final Instant start = Instant.parse("2024-03-01T00:00:00Z");
    for (int i = 0; i < 500; i++) {
      events.update("INSERT INTO events (ts, region, status, amount) VALUES (?, ?, ?, ?)",
          Timestamp.from(start.plusSeconds(60L * i)), i % 2 == 0 ? "east" : "west", "open",
          (double) i);
    }
  }

  @AfterEach
  void tearDown() {
    liveDataSource.closeAll();
  }

  @Test
  void streamsRowsOfTheRange() {
    final List<Map<String, Object>> rows = liveDataSource.query(tenant,
        TestModels.EVENTS.rangeQuery(),
        List.of(Timestamp.from(Instant.parse("2024-03-01T00:00:00Z")),
            Timestamp.from(Instant.parse("2024-03-01T01:00:00Z"))))
        .collectList()
        .block();

    assertThat(rows).hasSize(60);
    assertThat(rows).filteredOn(row -> "east".equals(row.get("region"))).hasSize(30);
  }

  @Test
  void cancellingReleasesTheConnection() {
    StepVerifier.create(liveDataSource.query(tenant, "SELECT * FROM events ORDER BY id",
        List.of()), 3)
        .expectNextCount(3)
        .thenCancel()
        .verify();

    final HikariDataSource pool = pools.getIfPresent(tenant);
    assertThat(pool).isNotNull();
    await().atMost(Duration.ofSeconds(5)).until(() ->
        pool.getHikariPoolMXBean().getActiveConnections() == 0);
  }

  @Test
  void exceedingTheTimeoutFails() {
    appProperties.setLiveQueryTimeout(Duration.ofMillis(200));

    StepVerifier.create(liveDataSource.query(tenant, "SELECT * FROM events ORDER BY id",
        List.of()).delayElements(Duration.ofMillis(50)))
        .thenConsumeWhile(row -> true)
        .verifyError();
  }

  @Test
  void queryForValue() {
    StepVerifier.create(liveDataSource.queryForValue(tenant, "SELECT MAX(amount) FROM events"))
        .assertNext(value -> assertThat(((Number) value).doubleValue()).isEqualTo(499.0))
        .verifyComplete();
    StepVerifier.create(liveDataSource.queryForValue(tenant,
        "SELECT MAX(amount) FROM events WHERE region = 'north'"))
        .verifyComplete();
  }

  @Test
  void rowsAreKeyedCaseInsensitively() {
    final Map<String, Object> row = liveDataSource.query(tenant,
        "SELECT id, region FROM events ORDER BY id", List.of()).blockFirst();

    assertThat(row).containsKeys("REGION", "region");
  }
}
