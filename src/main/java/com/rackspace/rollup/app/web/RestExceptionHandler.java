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

import com.rackspace.rollup.app.exception.CrossTenantAccessException;
import com.rackspace.rollup.app.exception.InvalidBucketException;
import com.rackspace.rollup.app.exception.MissingContextException;
import com.rackspace.rollup.app.exception.NoMatchingRollupException;
import com.rackspace.rollup.app.exception.UnknownDefinitionException;
import com.rackspace.rollup.app.model.ApiErrorResponse;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

@ControllerAdvice
@Slf4j
public class RestExceptionHandler {

  static final String NO_MATCHING_PRE_AGGREGATION = "NO_MATCHING_PRE_AGGREGATION";

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgumentException(IllegalArgumentException e) {
    return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
  }

  @ExceptionHandler(WebExchangeBindException.class)
  public ResponseEntity<ApiErrorResponse> handleBindException(WebExchangeBindException e) {
    final String message = e.getFieldErrors().stream()
        .map(fieldError -> fieldError.getField() + " " + fieldError.getDefaultMessage())
        .collect(Collectors.joining(", "));
    return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", message);
  }

  @ExceptionHandler(ServerWebInputException.class)
  public ResponseEntity<ApiErrorResponse> handleServerWebInputException(ServerWebInputException e) {
    return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getReason());
  }

  @ExceptionHandler(MissingContextException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingContext(MissingContextException e) {
    return respond(HttpStatus.BAD_REQUEST, "MISSING_CONTEXT", e.getMessage());
  }

  @ExceptionHandler(InvalidBucketException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidBucket(InvalidBucketException e) {
    return respond(HttpStatus.BAD_REQUEST, "INVALID_BUCKET", e.getMessage());
  }

  @ExceptionHandler(NoMatchingRollupException.class)
  public ResponseEntity<ApiErrorResponse> handleNoMatchingRollup(NoMatchingRollupException e) {
    return respond(HttpStatus.BAD_REQUEST, NO_MATCHING_PRE_AGGREGATION, e.getMessage());
  }

  @ExceptionHandler(CrossTenantAccessException.class)
  public ResponseEntity<ApiErrorResponse> handleCrossTenantAccess(CrossTenantAccessException e) {
    // the message names the partition, which the caller doesn't get to see
    return respond(HttpStatus.FORBIDDEN, "CROSS_TENANT_ACCESS", "Access denied");
  }

  @ExceptionHandler(UnknownDefinitionException.class)
  public ResponseEntity<ApiErrorResponse> handleUnknownDefinition(UnknownDefinitionException e) {
    return respond(HttpStatus.NOT_FOUND, "UNKNOWN_DEFINITION", e.getMessage());
  }

  private ResponseEntity<ApiErrorResponse> respond(HttpStatus status, String error, String message) {
    log.debug("Responding with {} {}: {}", status.value(), error, message);
    return ResponseEntity.status(status)
        .body(new ApiErrorResponse()
            .setStatus(status.value())
            .setError(error)
            .setMessage(message));
  }
}
