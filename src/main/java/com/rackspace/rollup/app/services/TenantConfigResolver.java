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

import com.github.benmanes.caffeine.cache.Cache;
import com.rackspace.rollup.app.config.AppProperties;
import com.rackspace.rollup.app.config.TenantProperties;
import com.rackspace.rollup.app.model.TenantConfigSnapshot;
import com.rackspace.rollup.app.model.TenantIsolationKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Resolves the per-tenant configuration once per tenant. Snapshots are immutable so a request
 * never observes configuration changing underneath it.
 */
@Service
@Slf4j
public class TenantConfigResolver {
  private final TenantProperties tenantProperties;
  private final AppProperties appProperties;
  private final TenantRegistry tenantRegistry;
  private final Cache<TenantIsolationKey, TenantConfigSnapshot> tenantConfigCache;

  @Autowired
  public TenantConfigResolver(TenantProperties tenantProperties,
                              AppProperties appProperties,
                              TenantRegistry tenantRegistry,
                              Cache<TenantIsolationKey, TenantConfigSnapshot> tenantConfigCache) {
    this.tenantProperties = tenantProperties;
    this.appProperties = appProperties;
    this.tenantRegistry = tenantRegistry;
    this.tenantConfigCache = tenantConfigCache;
  }

  public TenantConfigSnapshot resolve(TenantIsolationKey tenant) {
    return tenantConfigCache.get(tenant, this::buildSnapshot);
  }

  private TenantConfigSnapshot buildSnapshot(TenantIsolationKey tenant) {
    final String appId = tenantRegistry.appIdOf(tenant)
        .orElseThrow(() -> new IllegalStateException("Tenant was never resolved: " + tenant));
    final String dataSourceName = tenantProperties.getDataSourceByAppId()
        .getOrDefault(appId, tenantProperties.getDefaultDataSource());
    final TenantProperties.DataSource dataSource =
        tenantProperties.getDataSources().get(dataSourceName);
    if (dataSource == null) {
      throw new IllegalStateException("No data source configured with name " + dataSourceName);
    }

    final TenantConfigSnapshot snapshot = new TenantConfigSnapshot(
        dataSourceName,
        dataSource.getUrl(),
        dataSource.getUsername(),
        dataSource.getPassword(),
        dataSource.getDriverClassName(),
        dataSource.getMaximumPoolSize(),
        appProperties.isRollupOnly() || tenantProperties.getRollupOnlyAppIds().contains(appId)
    );
    log.debug("Resolved configuration of tenant {}: {}", tenant, snapshot);
    return snapshot;
  }
}
