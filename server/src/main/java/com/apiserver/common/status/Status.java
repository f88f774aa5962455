package com.apiserver.common.status;

import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Represents the status of an operation, possibly with additional error details. A non-OK status
 * is what the dispatch layer's exceptions carry and what problem payloads are rendered from.
 */
public class Status {
  private final StatusCode code;
  private final String message;

  private Status(StatusCode code, String message) {
    this.code = Objects.requireNonNull(code);
    this.message = message;
  }

  /** Creates a new status with the given code and message. */
  public static Status of(StatusCode code, String message) {
    return new Status(code, message);
  }

  /** Creates a new OK status. */
  public static Status ok() {
    return new Status(StatusCode.OK, null);
  }

  /** Creates a new NOT_FOUND status with the given message. */
  public static Status notFound(String message) {
    return new Status(StatusCode.NOT_FOUND, message);
  }

  /** Creates a new METHOD_NOT_ALLOWED status with the given message. */
  public static Status methodNotAllowed(String message) {
    return new Status(StatusCode.METHOD_NOT_ALLOWED, message);
  }

  /** Returns the code for this status. */
  @Nonnull
  public StatusCode getCode() {
    return code;
  }

  /** Returns the HTTP status code corresponding to this status. */
  public int getHttpCode() {
    return code.getHttpCode();
  }

  /** Returns the message for this status, or null if there is no message. */
  public String getMessage() {
    return message;
  }

  /** Returns true if this status is OK. */
  public boolean isOk() {
    return code == StatusCode.OK;
  }

  @Override
  public String toString() {
    if (message == null) {
      return code.toString();
    }
    return code + ": " + message;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Status other = (Status) obj;
    return code == other.code && Objects.equals(message, other.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, message);
  }
}
