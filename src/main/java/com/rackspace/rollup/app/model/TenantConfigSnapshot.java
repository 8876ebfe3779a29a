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

package com.rackspace.rollup.app.model;

import lombok.ToString;
import lombok.Value;

/**
 * Immutable per-tenant configuration, resolved once per request.
 */
@Value
public class TenantConfigSnapshot {
  String dataSourceName;
  String jdbcUrl;
  String username;
  @ToString.Exclude
  String password;
  String driverClassName;
  int maximumPoolSize;
  boolean rollupOnly;
}
