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

import java.time.Duration;
import lombok.Value;

@Value
public class RefreshPolicy {

  public enum Type {
    /**
     * Refresh on a fixed interval since the last refresh.
     */
    EVERY,
    /**
     * Refresh when a watermark read from the live source changes.
     */
    CONDITION,
    /**
     * Refresh only on an explicit invalidation.
     */
    EXTERNAL
  }

  Type type;
  Duration every;
  String conditionSql;

  public static RefreshPolicy every(Duration interval) {
    return new RefreshPolicy(Type.EVERY, interval, null);
  }

  public static RefreshPolicy condition(String sql) {
    return new RefreshPolicy(Type.CONDITION, null, sql);
  }

  public static RefreshPolicy external() {
    return new RefreshPolicy(Type.EXTERNAL, null, null);
  }
}
