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

import com.rackspace.rollup.app.model.ConditionResult;
import com.rackspace.rollup.app.model.Partition;
import com.rackspace.rollup.app.model.RefreshPolicy;
import com.rackspace.rollup.app.model.TenantIsolationKey;
import reactor.core.publisher.Mono;

/**
 * Evaluates condition refresh policies against the live source.
 */
public interface RefreshCondition {

  /**
   * Never errors; failures to evaluate are reported as {@link ConditionResult#UNKNOWN}.
   */
  Mono<ConditionResult> evaluate(Partition partition, RefreshPolicy policy);

  /**
   * Reads the current watermark bypassing any caching, to be recorded with freshly built
   * partition content.
   */
  Mono<String> currentWatermark(TenantIsolationKey tenant, RefreshPolicy policy);
}
