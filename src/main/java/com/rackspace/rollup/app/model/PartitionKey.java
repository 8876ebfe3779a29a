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
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import lombok.Value;

/**
 * Identifies one partition of one pre-aggregation for one tenant. Derived by
 * {@link com.rackspace.rollup.app.services.TimeSlotPartitioner#deriveKey}, which
 * checks that the bucket is aligned.
 */
@Value
public class PartitionKey {

  private static final DateTimeFormatter BUCKET_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMddHHmm").withZone(ZoneOffset.UTC);

  String definitionId;
  String structureVersion;
  @JsonIgnore
  TenantIsolationKey tenant;
  Instant bucket;

  /**
   * Storage identifier of the form <code>tenant/definition_version_bucket</code>. The tenant
   * token never contains a slash and the version and bucket label have fixed widths, so
   * distinct keys always produce distinct identifiers.
   */
  public String getStorageId() {
    return tenant.getToken() + "/" + definitionId + "_" + structureVersion + "_"
        + BUCKET_FORMAT.format(bucket);
  }

  @Override
  public String toString() {
    return getStorageId();
  }
}
