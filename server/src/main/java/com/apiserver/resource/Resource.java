package com.apiserver.resource;

import com.apiserver.validation.InputFilter;
import java.util.Optional;

/**
 * A resource served by a {@link com.apiserver.rest.RestHandler}.
 *
 * <p>A resource declares what it supports by implementing the capability interfaces nested in
 * {@link Capabilities}. Requests for anything else are rejected with 405 before reaching it.
 */
public interface Resource {

  /** The path parameter carrying the identifier, unless a resource overrides it. */
  String DEFAULT_IDENTIFIER_NAME = "id";

  /** Returns the name of this resource, used in routes, log lines and error messages. */
  String resourceName();

  /** Returns the name of the path parameter that carries the resource identifier. */
  default String identifierName() {
    return DEFAULT_IDENTIFIER_NAME;
  }

  /**
   * Returns the filter that validates request bodies for this resource. Without one, bodies are
   * passed to the operations as sent.
   */
  default Optional<InputFilter> inputFilter() {
    return Optional.empty();
  }
}
