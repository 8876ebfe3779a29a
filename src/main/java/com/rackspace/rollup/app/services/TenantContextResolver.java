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

import com.rackspace.rollup.app.config.AppProperties;
import com.rackspace.rollup.app.config.TenantProperties;
import com.rackspace.rollup.app.exception.MissingContextException;
import com.rackspace.rollup.app.model.RequestSecurityContext;
import com.rackspace.rollup.app.model.TenantIsolationKey;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class TenantContextResolver {
  static final String APP_ID_FIELD = "appId";
  static final String USER_ID_FIELD = "userId";

  private final TenantProperties tenantProperties;
  private final AppProperties appProperties;
  private final HashService hashService;
  private final TenantRegistry tenantRegistry;

  @Autowired
  public TenantContextResolver(TenantProperties tenantProperties,
                               AppProperties appProperties,
                               HashService hashService,
                               TenantRegistry tenantRegistry) {
    this.tenantProperties = tenantProperties;
    this.appProperties = appProperties;
    this.hashService = hashService;
    this.tenantRegistry = tenantRegistry;
  }

  /**
   * Derives the isolation key of the caller. Equal contexts always produce equal keys and the
   * key fields are hashed so that distinct values can't collide through concatenation.
   *
   * @throws MissingContextException if a key field is absent and the context is required
   */
  public TenantIsolationKey resolve(RequestSecurityContext context) {
    final List<String> missing = new ArrayList<>();
    final List<String> values = new ArrayList<>();
    for (String field : tenantProperties.getKeyFields()) {
      final String value = context != null ? fieldValue(context, field) : null;
      if (StringUtils.isBlank(value)) {
        missing.add(field);
        // only the app id has a default, other absent fields hash as absent
        values.add(APP_ID_FIELD.equals(field) ? tenantProperties.getDefaultAppId() : null);
      } else {
        values.add(value);
      }
    }
    if (!missing.isEmpty() && tenantProperties.isRequireContext()) {
      throw new MissingContextException(missing);
    }

    final TenantIsolationKey tenant = TenantIsolationKey.of(hashService.tenantToken(values));
    final String appId = appIdOf(context);
    tenantRegistry.register(tenant, appId);
    log.trace("Resolved tenant {} for app {}", tenant, appId);
    return tenant;
  }

  /**
   * Resolves a configured context and has the refresh scheduler maintain its tenant.
   */
  public TenantIsolationKey resolveScheduled(RequestSecurityContext context) {
    final TenantIsolationKey tenant = resolve(context);
    final String appId = appIdOf(context);
    tenantRegistry.schedule(tenant, appId);
    log.info("Scheduling refreshes for tenant {} of app {}", tenant, appId);
    return tenant;
  }

  /**
   * Reads the security context of a web request from the configured headers.
   */
  public RequestSecurityContext fromHeaders(HttpHeaders headers) {
    final Map<String, String> attributes = new HashMap<>();
    final String prefix = appProperties.getAttributeHeaderPrefix().toLowerCase(Locale.ROOT);
    headers.forEach((name, headerValues) -> {
      final String lowerName = name.toLowerCase(Locale.ROOT);
      if (lowerName.startsWith(prefix) && lowerName.length() > prefix.length()
          && !headerValues.isEmpty()) {
        attributes.put(lowerName.substring(prefix.length()), headerValues.get(0));
      }
    });
    return new RequestSecurityContext()
        .setAppId(headers.getFirst(appProperties.getAppIdHeader()))
        .setUserId(headers.getFirst(appProperties.getUserIdHeader()))
        .setAttributes(attributes);
  }

  private String appIdOf(RequestSecurityContext context) {
    return context != null && StringUtils.isNotBlank(context.getAppId()) ?
        context.getAppId() : tenantProperties.getDefaultAppId();
  }

  private static String fieldValue(RequestSecurityContext context, String field) {
    if (APP_ID_FIELD.equals(field)) {
      return context.getAppId();
    } else if (USER_ID_FIELD.equals(field)) {
      return context.getUserId();
    } else {
      return context.getAttributes() != null ?
          context.getAttributes().get(field.toLowerCase(Locale.ROOT)) : null;
    }
  }
}
