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

import com.rackspace.rollup.app.model.JobState;
import com.rackspace.rollup.app.model.PartitionKey;
import com.rackspace.rollup.app.model.PartitionStatus;
import com.rackspace.rollup.app.model.RefreshJob;
import com.rackspace.rollup.app.model.TenantIsolationKey;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Tracks refresh jobs by partition key. At most one job per key is tracked at any time, which
 * is what keeps two refreshes of the same partition from ever running concurrently.
 */
@Component
@Slf4j
public class RefreshJobTracker {
  private final ConcurrentMap<PartitionKey, RefreshJob> active = new ConcurrentHashMap<>();
  private final ConcurrentMap<PartitionKey, RefreshJob> exhausted = new ConcurrentHashMap<>();

  /**
   * Claims the key for a new job.
   *
   * @return the new job, or empty if the key already has a pending or running job
   */
  public Optional<RefreshJob> track(PartitionKey key, Instant now) {
    final RefreshJob job = new RefreshJob(key, now);
    if (active.putIfAbsent(key, job) == null) {
      log.trace("Tracking refresh of {}", key);
      return Optional.of(job);
    }
    return Optional.empty();
  }

  public Optional<RefreshJob> get(PartitionKey key) {
    return Optional.ofNullable(active.get(key));
  }

  public boolean isCurrent(RefreshJob job) {
    return active.get(job.getKey()) == job;
  }

  /**
   * Frees the key after a successful refresh.
   */
  public void complete(RefreshJob job) {
    active.remove(job.getKey(), job);
    exhausted.remove(job.getKey());
  }

  /**
   * Frees the key and records that the partition gave up on retries.
   */
  public void exhaust(RefreshJob job) {
    if (active.remove(job.getKey(), job)) {
      exhausted.put(job.getKey(), job);
    }
  }

  /**
   * Frees the key without recording an outcome, such as when a job is cancelled.
   */
  public void release(RefreshJob job) {
    active.remove(job.getKey(), job);
  }

  public boolean isExhausted(PartitionKey key) {
    return exhausted.containsKey(key);
  }

  public void resetExhausted(PartitionKey key) {
    exhausted.remove(key);
  }

  public PartitionStatus status(PartitionKey key) {
    final RefreshJob job = active.get(key);
    if (job != null) {
      final JobState state = job.getState();
      if (state == JobState.RUNNING) {
        return PartitionStatus.RUNNING;
      } else if (state == JobState.FAILED) {
        // waiting out its backoff
        return PartitionStatus.FAILED;
      }
      return PartitionStatus.PENDING_REFRESH;
    }
    return exhausted.containsKey(key) ? PartitionStatus.FAILED : PartitionStatus.FRESH;
  }

  public List<RefreshJob> activeJobs(TenantIsolationKey tenant) {
    return active.values().stream()
        .filter(job -> job.getKey().getTenant().equals(tenant))
        .collect(Collectors.toList());
  }

  public List<RefreshJob> allActiveJobs() {
    return List.copyOf(active.values());
  }

  public List<RefreshJob> exhaustedJobs(TenantIsolationKey tenant) {
    return exhausted.values().stream()
        .filter(job -> job.getKey().getTenant().equals(tenant))
        .collect(Collectors.toList());
  }
}
