package com.apiserver.rest;

import com.apiserver.validation.FilterResult;
import com.apiserver.validation.InputFilter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Turns a raw request body into the input map handed to a resource operation.
 *
 * <p>The returned map never contains a key the caller did not send, even when the filter
 * assigns defaults to missing fields.
 */
public class BodyValidator {

  @Nullable private final InputFilter inputFilter;

  /**
   * @param inputFilter the resource's filter, or null to pass bodies through unvalidated
   */
  public BodyValidator(@Nullable InputFilter inputFilter) {
    this.inputFilter = inputFilter;
  }

  /**
   * Validates and filters a request body.
   *
   * @param rawBody the parsed body; anything other than a JSON object counts as empty
   * @param method the HTTP method; for PATCH only the submitted fields are validated
   * @return the filtered input, restricted to the keys of the raw body
   * @throws ValidationException if the filter rejects the input
   */
  public Map<String, Object> validate(@Nullable Object rawBody, String method) {
    Map<String, Object> data = asMap(rawBody);
    if (inputFilter == null) {
      return data;
    }

    Set<String> validationGroup = "PATCH".equalsIgnoreCase(method) ? data.keySet() : null;
    FilterResult result = inputFilter.filter(data, validationGroup);
    if (!result.isValid()) {
      Logger.warn("Request body failed validation on fields {}", result.messages().keySet());
      throw ValidationException.fromMessages(result.messages());
    }

    Map<String, Object> parsed = new LinkedHashMap<>();
    result.values().forEach(
        (key, value) -> {
          if (data.containsKey(key)) {
            parsed.put(key, value);
          }
        });
    return Collections.unmodifiableMap(parsed);
  }

  static Map<String, Object> asMap(@Nullable Object rawBody) {
    if (!(rawBody instanceof Map<?, ?> map)) {
      return Map.of();
    }
    Map<String, Object> data = new LinkedHashMap<>();
    map.forEach((key, value) -> data.put(String.valueOf(key), value));
    return Collections.unmodifiableMap(data);
  }
}
