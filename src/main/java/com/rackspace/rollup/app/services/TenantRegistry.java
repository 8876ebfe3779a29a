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
import com.github.benmanes.caffeine.cache.Caffeine;
import com.rackspace.rollup.app.config.AppProperties;
import com.rackspace.rollup.app.model.TenantIsolationKey;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Maps tenant keys back to the app id they were resolved for.
 * <p>
 * Tenants resolved from requests are only remembered in a bounded cache. The refresh
 * scheduler maintains partitions for scheduled tenants only, which come from configuration
 * and are never evicted.
 * </p>
 */
@Component
public class TenantRegistry {
  static final Duration SEEN_EXPIRY = Duration.ofHours(1);

  private final Cache<TenantIsolationKey, String> seen;
  private final ConcurrentMap<TenantIsolationKey, String> scheduled = new ConcurrentHashMap<>();

  @Autowired
  public TenantRegistry(AppProperties appProperties) {
    this(appProperties.getTenantCacheSize());
  }

  public TenantRegistry(long maximumSeen) {
    this.seen = Caffeine.newBuilder()
        .maximumSize(maximumSeen)
        .expireAfterAccess(SEEN_EXPIRY)
        // evict on the calling thread so the bound holds once a put returns
        .executor(Runnable::run)
        .build();
  }

  /**
   * Remembers the app id of a tenant resolved from a request.
   */
  public void register(TenantIsolationKey tenant, String appId) {
    seen.put(tenant, appId);
  }

  /**
   * Adds the tenant to the ones the refresh scheduler maintains.
   */
  public void schedule(TenantIsolationKey tenant, String appId) {
    scheduled.putIfAbsent(tenant, appId);
  }

  public Optional<String> appIdOf(TenantIsolationKey tenant) {
    final String appId = scheduled.get(tenant);
    return appId != null ? Optional.of(appId) : Optional.ofNullable(seen.getIfPresent(tenant));
  }

  public boolean isScheduled(TenantIsolationKey tenant) {
    return scheduled.containsKey(tenant);
  }

  public Set<TenantIsolationKey> scheduledTenants() {
    return Set.copyOf(scheduled.keySet());
  }

  long seenCount() {
    seen.cleanUp();
    return seen.estimatedSize();
  }
}
