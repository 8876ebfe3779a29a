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

import com.rackspace.rollup.app.model.TenantIsolationKey;
import java.util.List;
import java.util.Map;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * The tenant's source of raw rows. Every call is scoped to the connection configured for the
 * given tenant.
 */
public interface LiveDataSource {

  /**
   * @return the rows of the query as column label to value
   */
  Flux<Map<String, Object>> query(TenantIsolationKey tenant, String sql, List<Object> params);

  /**
   * @return the first column of the first row, or empty when there is none or it is null
   */
  Mono<Object> queryForValue(TenantIsolationKey tenant, String sql);
}
