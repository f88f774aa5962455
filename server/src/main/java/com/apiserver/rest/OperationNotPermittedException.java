package com.apiserver.rest;

import com.apiserver.common.status.Status;
import com.google.common.collect.ImmutableSet;
import java.util.Set;

/**
 * Raised when a request asks for an operation the resource does not support, or uses a method
 * that maps to no operation at all. Always 405.
 */
public class OperationNotPermittedException extends ApiException {

  private final Set<String> allowedMethods;

  /**
   * @param message describes the rejected operation
   * @param allowedMethods the methods the addressed URI does accept, for the Allow header
   */
  public OperationNotPermittedException(String message, Set<String> allowedMethods) {
    super(Status.methodNotAllowed(message));
    this.allowedMethods = ImmutableSet.copyOf(allowedMethods);
  }

  /** Returns the methods the addressed URI accepts. */
  public Set<String> getAllowedMethods() {
    return allowedMethods;
  }
}
