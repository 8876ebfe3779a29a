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

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Opaque scoping token for one tenant's stored partitions and live connections.
 * Only equality and the token itself are exposed; nothing outside of
 * {@link com.rackspace.rollup.app.services.TenantContextResolver} knows how it was derived.
 */
public final class TenantIsolationKey {

  private static final Pattern TOKEN_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");

  private final String token;

  private TenantIsolationKey(String token) {
    this.token = token;
  }

  public static TenantIsolationKey of(String token) {
    if (token == null || !TOKEN_PATTERN.matcher(token).matches()) {
      throw new IllegalArgumentException("Invalid tenant token: " + token);
    }
    return new TenantIsolationKey(token);
  }

  @JsonValue
  public String getToken() {
    return token;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TenantIsolationKey)) {
      return false;
    }
    return token.equals(((TenantIsolationKey) o).token);
  }

  @Override
  public int hashCode() {
    return Objects.hash(token);
  }

  @Override
  public String toString() {
    return token;
  }
}
