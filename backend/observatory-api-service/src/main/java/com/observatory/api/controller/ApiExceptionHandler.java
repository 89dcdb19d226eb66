package com.observatory.api.controller;

import com.observatory.anomaly.error.DiscoveryUnavailableException;
import com.observatory.anomaly.error.PersistenceFailureException;
import com.observatory.api.model.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(IllegalArgumentException.class)
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public ErrorResponse badRequest(IllegalArgumentException e) {
    return new ErrorResponse("bad_request", e.getMessage());
  }

  @ExceptionHandler(PersistenceFailureException.class)
  @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
  public ErrorResponse storeUnavailable(PersistenceFailureException e) {
    log.error("[api] Store unavailable: {}", e.getMessage(), e);
    return new ErrorResponse("store_unavailable", e.getMessage());
  }

  @ExceptionHandler(DiscoveryUnavailableException.class)
  @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
  public ErrorResponse discoveryUnavailable(DiscoveryUnavailableException e) {
    log.warn("[api] Discovery unavailable: {}", e.getMessage());
    return new ErrorResponse("discovery_unavailable", e.getMessage());
  }
}
