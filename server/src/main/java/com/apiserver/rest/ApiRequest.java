package com.apiserver.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.javalin.http.Context;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * The parts of an inbound HTTP request the dispatch layer works with.
 *
 * @param method the HTTP method, as sent
 * @param path the request path
 * @param pathParams route-matched path parameters
 * @param queryParams query parameters; a parameter given several times has several values
 * @param body the parsed JSON body, or null when the request had none or it was not JSON
 */
public record ApiRequest(
    String method,
    String path,
    Map<String, String> pathParams,
    Map<String, List<String>> queryParams,
    @Nullable Object body) {

  public ApiRequest {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(path, "path");
    pathParams = ImmutableMap.copyOf(pathParams);
    ImmutableMap.Builder<String, List<String>> query = ImmutableMap.builder();
    queryParams.forEach((key, values) -> query.put(key, ImmutableList.copyOf(values)));
    queryParams = query.build();
  }

  /**
   * Builds a request from a Javalin context.
   *
   * <p>The body is parsed as JSON. An empty body, or one that is not valid JSON, yields a null
   * body; the validator treats both as an empty input.
   *
   * @param ctx the Javalin context
   * @param objectMapper the mapper used to parse the body
   * @return the request
   */
  public static ApiRequest fromContext(Context ctx, ObjectMapper objectMapper) {
    return new ApiRequest(
        ctx.method().name(),
        ctx.path(),
        ctx.pathParamMap(),
        ctx.queryParamMap(),
        parseBody(ctx.body(), objectMapper));
  }

  @Nullable
  static Object parseBody(@Nullable String rawBody, ObjectMapper objectMapper) {
    if (rawBody == null || rawBody.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readValue(rawBody, Object.class);
    } catch (JsonProcessingException e) {
      Logger.warn("Request body is not valid JSON, treating it as empty: {}", e.getOriginalMessage());
      return null;
    }
  }

  /**
   * Returns the value of a path parameter. An empty value counts as absent.
   */
  public Optional<String> pathParam(String name) {
    return Optional.ofNullable(Strings.emptyToNull(pathParams.get(name)));
  }
}
