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

package com.rackspace.rollup.app.config;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.rackspace.rollup.app.model.TenantConfigSnapshot;
import com.rackspace.rollup.app.model.TenantIsolationKey;
import com.rackspace.rollup.app.model.WatermarkCacheKey;
import com.zaxxer.hikari.HikariDataSource;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class CacheConfig {

  private final MeterRegistry meterRegistry;
  private final AppProperties appProperties;

  @Autowired
  public CacheConfig(MeterRegistry meterRegistry,
                     AppProperties appProperties) {
    this.meterRegistry = meterRegistry;
    this.appProperties = appProperties;
  }

  @Bean
  public AsyncCache<WatermarkCacheKey, String> watermarkCache() {
    final AsyncCache<WatermarkCacheKey, String> cache = Caffeine
        .newBuilder()
        .maximumSize(10000)
        // Expiration bounds how long a changed watermark goes unnoticed
        .expireAfterWrite(appProperties.getConditionCacheTtl())
        .recordStats()
        .buildAsync();
    CaffeineCacheMetrics.monitor(meterRegistry, cache, "watermarkCache");
    return cache;
  }

  @Bean
  public Cache<TenantIsolationKey, TenantConfigSnapshot> tenantConfigCache() {
    final Cache<TenantIsolationKey, TenantConfigSnapshot> cache = Caffeine
        .newBuilder()
        .maximumSize(appProperties.getTenantCacheSize())
        .recordStats()
        .build();
    CaffeineCacheMetrics.monitor(meterRegistry, cache, "tenantConfigCache");
    return cache;
  }

  @Bean
  public Cache<TenantIsolationKey, HikariDataSource> tenantDataSourceCache() {
    final Cache<TenantIsolationKey, HikariDataSource> cache = Caffeine
        .newBuilder()
        .maximumSize(appProperties.getTenantCacheSize())
        // close evicted pools on the calling thread so shutdown doesn't leave them open
        .executor(Runnable::run)
        .removalListener((TenantIsolationKey tenant, HikariDataSource dataSource, RemovalCause cause) -> {
          if (dataSource != null) {
            log.debug("Closing connection pool of tenant {} due to {}", tenant, cause);
            dataSource.close();
          }
        })
        .recordStats()
        .build();
    CaffeineCacheMetrics.monitor(meterRegistry, cache, "tenantDataSourceCache");
    return cache;
  }
}
