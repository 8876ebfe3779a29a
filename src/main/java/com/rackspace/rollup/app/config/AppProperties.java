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

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("rollup")
@Component
@Data
@Validated
public class AppProperties {
  /**
   * When enabled, queries that cannot be answered from pre-aggregations are rejected instead
   * of being passed through to the live source.
   */
  boolean rollupOnly = false;

  /**
   * Upper bound on any single call to a live data source.
   */
  @NotNull
  @DurationUnit(ChronoUnit.SECONDS)
  Duration liveQueryTimeout = Duration.ofSeconds(30);

  /**
   * Rows fetched per round trip while streaming live rows into aggregates.
   */
  @Min(1)
  int liveQueryFetchSize = 1000;

  @NotNull
  @Valid
  RetrySpec retryLiveQuery = new RetrySpec()
      .setMaxAttempts(3)
      .setMinBackoff(Duration.ofMillis(100))
      .setMaxBackoff(Duration.ofSeconds(2));

  /**
   * How long a watermark read for a condition refresh policy is reused.
   */
  @NotNull
  @DurationUnit(ChronoUnit.SECONDS)
  Duration conditionCacheTtl = Duration.ofSeconds(10);

  @NotNull
  @DurationUnit(ChronoUnit.SECONDS)
  Duration conditionTimeout = Duration.ofSeconds(5);

  /**
   * Maximum number of tenant configuration snapshots and live connection pools kept.
   */
  @Min(1)
  long tenantCacheSize = 1000;

  @NotBlank
  String appIdHeader = "X-App-Id";

  @NotBlank
  String userIdHeader = "X-User-Id";

  /**
   * Headers starting with this prefix become security context attributes, keyed by the
   * remainder of the header name in lower case.
   */
  @NotBlank
  String attributeHeaderPrefix = "X-Tenant-";
}
