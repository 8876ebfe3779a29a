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

import com.github.benmanes.caffeine.cache.Cache;
import com.rackspace.rollup.app.config.AppProperties;
import com.rackspace.rollup.app.model.TenantConfigSnapshot;
import com.rackspace.rollup.app.model.TenantIsolationKey;
import com.rackspace.rollup.app.services.TenantConfigResolver;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;
import javax.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs live queries over JDBC with one connection pool per tenant. Blocking calls are moved
 * onto the bounded elastic scheduler.
 */
@Repository
@Slf4j
public class JdbcLiveDataSource implements LiveDataSource {
  private static final ColumnMapRowMapper COLUMN_MAP_ROW_MAPPER = new ColumnMapRowMapper();

  private final TenantConfigResolver tenantConfigResolver;
  private final AppProperties appProperties;
  private final Cache<TenantIsolationKey, HikariDataSource> tenantDataSourceCache;

  @Autowired
  public JdbcLiveDataSource(TenantConfigResolver tenantConfigResolver,
                            AppProperties appProperties,
                            Cache<TenantIsolationKey, HikariDataSource> tenantDataSourceCache) {
    this.tenantConfigResolver = tenantConfigResolver;
    this.appProperties = appProperties;
    this.tenantDataSourceCache = tenantDataSourceCache;
  }

  /**
   * Rows are streamed from an open result set, so callers that fold them into aggregates only
   * hold the aggregates in memory. The result set and its connection are released when the
   * flux terminates or is cancelled.
   */
  @Override
  public Flux<Map<String, Object>> query(TenantIsolationKey tenant, String sql, List<Object> params) {
    final Duration timeout = appProperties.getLiveQueryTimeout();
    return Flux.defer(() -> {
      final long deadline = System.nanoTime() + timeout.toNanos();
      return Flux.using(
          () -> jdbcTemplate(tenant).queryForStream(sql, COLUMN_MAP_ROW_MAPPER, params.toArray()),
          stream -> Flux.fromStream(stream),
          Stream::close
      )
          .<Map<String, Object>>handle((row, sink) -> {
            if (System.nanoTime() - deadline > 0) {
              sink.error(new TimeoutException("Live query exceeded " + timeout));
            } else {
              sink.next(row);
            }
          });
    })
        .subscribeOn(Schedulers.boundedElastic())
        // bounds the wait for the first row and stalls between rows
        .timeout(timeout)
        .name("liveQuery")
        .metrics()
        .doOnError(e -> log.warn("Live query for tenant {} failed: {}", tenant, e.getMessage()));
  }

  @Override
  public Mono<Object> queryForValue(TenantIsolationKey tenant, String sql) {
    final ResultSetExtractor<Object> firstValue = rs -> rs.next() ? rs.getObject(1) : null;
    return Mono.fromCallable(() -> jdbcTemplate(tenant).query(sql, firstValue))
        .subscribeOn(Schedulers.boundedElastic())
        .timeout(appProperties.getLiveQueryTimeout());
  }

  @PreDestroy
  public void closeAll() {
    log.info("Closing {} tenant connection pools", tenantDataSourceCache.estimatedSize());
    tenantDataSourceCache.invalidateAll();
  }

  private JdbcTemplate jdbcTemplate(TenantIsolationKey tenant) {
    final JdbcTemplate jdbcTemplate =
        new JdbcTemplate(tenantDataSourceCache.get(tenant, this::createDataSource));
    jdbcTemplate.setFetchSize(appProperties.getLiveQueryFetchSize());
    jdbcTemplate.setQueryTimeout((int) Math.max(1, appProperties.getLiveQueryTimeout().toSeconds()));
    return jdbcTemplate;
  }

  private HikariDataSource createDataSource(TenantIsolationKey tenant) {
    final TenantConfigSnapshot snapshot = tenantConfigResolver.resolve(tenant);
    log.info("Creating connection pool for tenant {} on data source {}", tenant,
        snapshot.getDataSourceName());

    final HikariConfig hikariConfig = new HikariConfig();
    hikariConfig.setJdbcUrl(snapshot.getJdbcUrl());
    hikariConfig.setUsername(snapshot.getUsername());
    hikariConfig.setPassword(snapshot.getPassword());
    if (snapshot.getDriverClassName() != null) {
      hikariConfig.setDriverClassName(snapshot.getDriverClassName());
    }
    hikariConfig.setMaximumPoolSize(snapshot.getMaximumPoolSize());
    hikariConfig.setMinimumIdle(Math.min(1, snapshot.getMaximumPoolSize()));
    hikariConfig.setReadOnly(true);
    // don't fail tenant resolution when the source is briefly unavailable
    hikariConfig.setInitializationFailTimeout(-1);
    hikariConfig.setPoolName("rollup-" + snapshot.getDataSourceName() + "-" + tenant);
    return new HikariDataSource(hikariConfig);
  }
}
