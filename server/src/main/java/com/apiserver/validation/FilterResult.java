package com.apiserver.validation;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of running an {@link InputFilter}: either the filtered values or a map of field
 * messages.
 *
 * @param values the filtered values; may contain null values and fields absent from the input
 * @param messages field name to validation messages; empty when the input is valid
 */
public record FilterResult(Map<String, Object> values, Map<String, List<String>> messages) {

  public FilterResult {
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    ImmutableMap.Builder<String, List<String>> copy = ImmutableMap.builder();
    messages.forEach((field, list) -> copy.put(field, ImmutableList.copyOf(list)));
    messages = copy.build();
  }

  /** Creates a successful result. */
  public static FilterResult valid(Map<String, Object> values) {
    return new FilterResult(values, Map.of());
  }

  /** Creates a failed result. */
  public static FilterResult invalid(Map<String, List<String>> messages) {
    return new FilterResult(Map.of(), messages);
  }

  /** Returns whether the input passed validation. */
  public boolean isValid() {
    return messages.isEmpty();
  }
}
