package com.apiserver.rest;

import com.apiserver.common.status.Status;
import java.util.Objects;

/**
 * Base class of the errors the dispatch layer raises itself. Each carries the {@link Status} it
 * is rendered with.
 */
public abstract class ApiException extends RuntimeException {

  private final Status status;

  protected ApiException(Status status) {
    super(status.getMessage());
    this.status = Objects.requireNonNull(status);
  }

  /** Returns the status describing this error. */
  public Status getStatus() {
    return status;
  }

  /** Returns the HTTP status code this error is reported with. */
  public int getStatusCode() {
    return status.getHttpCode();
  }
}
