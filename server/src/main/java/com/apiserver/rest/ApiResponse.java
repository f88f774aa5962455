package com.apiserver.rest;

import com.google.common.collect.ImmutableMap;
import io.javalin.http.Context;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * An outbound HTTP response produced by the dispatch layer.
 *
 * @param status the HTTP status code
 * @param contentType the content type of the body, or null when there is no body
 * @param headers additional response headers
 * @param body the body, serialized as JSON; null for an empty response
 */
public record ApiResponse(
    int status,
    @Nullable String contentType,
    Map<String, String> headers,
    @Nullable Object body) {

  public static final String HAL_JSON = "application/hal+json";
  public static final String PROBLEM_JSON = "application/problem+json";

  public ApiResponse {
    headers = ImmutableMap.copyOf(headers);
  }

  /** Creates a response with a HAL+JSON body. */
  public static ApiResponse hal(int status, Map<String, Object> resource) {
    return new ApiResponse(status, HAL_JSON, Map.of(), resource);
  }

  /** Creates a response with a problem+json body. */
  public static ApiResponse problem(int status, Map<String, Object> problem) {
    return new ApiResponse(status, PROBLEM_JSON, Map.of(), problem);
  }

  /** Creates a response with no body. */
  public static ApiResponse empty(int status) {
    return new ApiResponse(status, null, Map.of(), null);
  }

  /** Returns a copy of this response with the given header set. */
  public ApiResponse withHeader(String name, String value) {
    Map<String, String> copy = new LinkedHashMap<>(headers);
    copy.put(name, value);
    return new ApiResponse(status, contentType, copy, body);
  }

  /** Returns whether this response carries a body. */
  public boolean hasBody() {
    return body != null;
  }

  /** Writes status, headers and body to the given Javalin context. */
  public void writeTo(Context ctx) {
    ctx.status(status);
    headers.forEach(ctx::header);
    if (body != null) {
      ctx.json(body);
      if (contentType != null) {
        ctx.contentType(contentType);
      }
    }
  }
}
