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

package com.rackspace.rollup.app.web;

import com.rackspace.rollup.app.config.AppProperties;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

@Component
@Slf4j
public class MDCFilter implements WebFilter {

  private static final String X_B3_TRACE_ID = "X-B3-TraceId";
  private static final String APP_ID = "appId";

  private final AppProperties appProperties;

  @Autowired
  public MDCFilter(AppProperties appProperties) {
    this.appProperties = appProperties;
  }

  @Override
  public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
    MDC.put(X_B3_TRACE_ID, exchange.getRequest().getHeaders().getFirst(X_B3_TRACE_ID));
    MDC.put(APP_ID, exchange.getRequest().getHeaders().getFirst(appProperties.getAppIdHeader()));
    return chain.filter(exchange);
  }
}
