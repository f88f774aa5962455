package com.apiserver.rest;

import com.apiserver.common.status.StatusCode;
import com.google.common.base.Joiner;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds problem details responses (RFC 7807) for the errors the dispatch layer manages.
 */
public class ProblemResponseFactory {

  public static final String VALIDATION_MESSAGES = "validation_messages";
  private static final String TYPE_PREFIX = "https://httpstatus.es/";

  /**
   * Creates a problem response.
   *
   * @param status the HTTP status code
   * @param detail the human readable description
   * @param additional extension members appended to the problem
   * @return the response
   */
  public ApiResponse createResponse(int status, String detail, Map<String, ?> additional) {
    StatusCode code = StatusCode.fromHttpStatus(status);
    Map<String, Object> problem = new LinkedHashMap<>();
    problem.put("type", TYPE_PREFIX + status);
    problem.put("title", code.getHttpCode() == status ? code.getReasonPhrase() : "Error");
    problem.put("status", status);
    problem.put("detail", detail);
    problem.putAll(additional);
    return ApiResponse.problem(status, problem);
  }

  /** Converts a validation failure, including its field messages. */
  public ApiResponse fromValidation(ValidationException e) {
    return createResponse(
        e.getStatusCode(),
        e.getMessage(),
        Map.of(VALIDATION_MESSAGES, e.getValidationMessages()));
  }

  /** Converts a rejected operation, advertising the accepted methods in the Allow header. */
  public ApiResponse fromNotPermitted(OperationNotPermittedException e) {
    ApiResponse response = createResponse(e.getStatusCode(), e.getMessage(), Map.of());
    if (e.getAllowedMethods().isEmpty()) {
      return response;
    }
    return response.withHeader("Allow", Joiner.on(", ").join(e.getAllowedMethods()));
  }
}
