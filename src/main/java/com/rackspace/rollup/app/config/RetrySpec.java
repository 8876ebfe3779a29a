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
import java.util.function.Predicate;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import lombok.Data;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Exponential backoff settings. <code>maxAttempts</code> counts the first attempt, so a value
 * of one disables retries.
 */
@Data
public class RetrySpec {
  @Min(1)
  int maxAttempts = 3;

  @NotNull
  Duration minBackoff = Duration.ofMillis(100);

  @NotNull
  Duration maxBackoff = Duration.ofMinutes(5);

  @DecimalMin("1.0")
  double multiplier = 2.0;

  /**
   * @param failedAttempts number of attempts that failed so far, at least one
   * @return how long to wait before the next attempt
   */
  public Duration delayFor(int failedAttempts) {
    final double factor = Math.pow(multiplier, Math.max(0, failedAttempts - 1));
    final double millis = Math.min(minBackoff.toMillis() * factor, (double) maxBackoff.toMillis());
    return Duration.ofMillis((long) millis);
  }

  public boolean isExhausted(int failedAttempts) {
    return failedAttempts >= maxAttempts;
  }

  public Retry build() {
    return build(throwable -> true);
  }

  public Retry build(Predicate<Throwable> retryable) {
    return Retry.from(signals -> signals.concatMap(signal -> {
      final int failedAttempts = (int) signal.totalRetries() + 1;
      if (isExhausted(failedAttempts) || !retryable.test(signal.failure())) {
        return Mono.error(signal.failure());
      }
      return Mono.delay(delayFor(failedAttempts));
    }));
  }
}
