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

import com.rackspace.rollup.app.model.QueryPlan;
import com.rackspace.rollup.app.model.QueryRequest;
import com.rackspace.rollup.app.model.QueryResult;
import com.rackspace.rollup.app.model.RollupQuery;
import com.rackspace.rollup.app.services.QueryService;
import com.rackspace.rollup.app.services.TenantContextResolver;
import com.rackspace.rollup.app.utils.DateTimeUtils;
import java.time.Clock;
import java.time.Instant;
import javax.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Rollup query API. The caller's security context is taken from request headers.
 */
@RestController
@RequestMapping("/api/query")
public class QueryController {

  private final QueryService queryService;
  private final TenantContextResolver tenantContextResolver;
  private final Clock clock;

  @Autowired
  public QueryController(QueryService queryService,
                         TenantContextResolver tenantContextResolver,
                         Clock clock) {
    this.queryService = queryService;
    this.tenantContextResolver = tenantContextResolver;
    this.clock = clock;
  }

  @PostMapping
  public Mono<QueryResult> query(@RequestBody @Valid QueryRequest request,
                                 @RequestHeader HttpHeaders headers) {
    return queryService.query(toQuery(request), tenantContextResolver.fromHeaders(headers));
  }

  @PostMapping("/plan")
  public Mono<QueryPlan> plan(@RequestBody @Valid QueryRequest request,
                              @RequestHeader HttpHeaders headers) {
    return queryService.plan(toQuery(request), tenantContextResolver.fromHeaders(headers));
  }

  private RollupQuery toQuery(QueryRequest request) {
    final Instant now = clock.instant();
    return new RollupQuery()
        .setCube(request.getCube())
        .setMeasures(request.getMeasures())
        .setDimensions(request.getDimensions())
        .setGranularity(request.getGranularity())
        .setStart(DateTimeUtils.parseInstant(request.getStart(), now))
        .setEnd(DateTimeUtils.parseInstant(request.getEnd(), now))
        .setFilters(request.getFilters());
  }
}
