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

import java.util.List;
import java.util.Map;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;
import lombok.Data;

/**
 * Web form of {@link RollupQuery}. Times may be ISO-8601 instants, epoch seconds or millis,
 * or relative such as <code>2d-ago</code>.
 */
@Data
public class QueryRequest {
  @NotBlank
  String cube;
  @NotEmpty
  List<String> measures;
  List<String> dimensions = List.of();
  Granularity granularity;
  @NotBlank
  String start;
  /**
   * Defaults to now.
   */
  String end;
  Map<String, List<String>> filters = Map.of();
}
