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

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import reactor.core.Disposable;

@Getter
@Setter
@ToString(exclude = "execution")
public class RefreshJob {
  final PartitionKey key;
  volatile JobState state = JobState.PENDING;
  int attempts;
  Instant scheduledAt;
  Instant startedAt;
  Instant finishedAt;
  String lastError;
  @JsonIgnore
  Disposable execution;

  public RefreshJob(PartitionKey key, Instant scheduledAt) {
    this.key = key;
    this.scheduledAt = scheduledAt;
  }
}
