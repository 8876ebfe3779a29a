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

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("rollup.tenant")
@Component
@Data
@Validated
public class TenantProperties {
  /**
   * Security context fields that make up the isolation key: <code>appId</code>,
   * <code>userId</code> or the name of an attribute.
   */
  @NotEmpty
  List<String> keyFields = List.of("appId");

  /**
   * When enabled, a request missing any key field is rejected. Otherwise missing fields fall
   * back to <code>default-app-id</code>.
   */
  boolean requireContext = false;

  @NotBlank
  String defaultAppId = "default";

  @NotBlank
  String defaultDataSource = "default";

  /**
   * Selects the data source of a tenant by its app id.
   */
  Map<String, String> dataSourceByAppId = new HashMap<>();

  /**
   * App ids whose queries are held to rollup-only mode even if it is globally off.
   */
  Set<String> rollupOnlyAppIds = new HashSet<>();

  @Valid
  Map<String, DataSource> dataSources = new HashMap<>();

  @Data
  public static class DataSource {
    @NotBlank
    String url;
    String username;
    String password;
    String driverClassName;
    @Min(1)
    int maximumPoolSize = 5;
  }
}
