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

import com.rackspace.rollup.app.model.RequestSecurityContext;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("rollup.refresh")
@Component
@Data
@Validated
public class RefreshProperties {
  /**
   * Enables the periodic scheduler passes. Manual passes and invalidations work regardless.
   */
  boolean enabled = true;

  /**
   * The amount of time to wait after startup before the first scheduler pass.
   */
  @NotNull
  @DurationUnit(ChronoUnit.SECONDS)
  Duration initialProcessingDelay = Duration.ofSeconds(5);

  /**
   * Delay between the end of one scheduler pass and the start of the next.
   */
  @NotNull
  @DurationUnit(ChronoUnit.SECONDS)
  Duration interval = Duration.ofSeconds(30);

  /**
   * The number of threads running refresh jobs and scheduler housekeeping.
   * The default uses number of available processors reported by the JVM.
   */
  @Min(1)
  int processingThreads = Runtime.getRuntime().availableProcessors();

  @Min(1)
  int maxConcurrentJobs = 8;

  @Min(1)
  int maxConcurrentJobsPerTenant = 2;

  /**
   * Max time a single refresh job may run before it is failed.
   */
  @NotNull
  @DurationUnit(ChronoUnit.MINUTES)
  Duration refreshTimeout = Duration.ofMinutes(10);

  @NotNull
  @Valid
  RetrySpec retry = new RetrySpec()
      .setMaxAttempts(5)
      .setMinBackoff(Duration.ofSeconds(5))
      .setMaxBackoff(Duration.ofMinutes(5))
      .setMultiplier(2.0);

  /**
   * Security contexts whose tenants are refreshed even before any query arrived for them.
   */
  @Valid
  List<RequestSecurityContext> scheduledContexts = new ArrayList<>();
}
