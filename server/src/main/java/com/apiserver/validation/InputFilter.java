package com.apiserver.validation;

import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Filters and validates request input against a resource's declared rules.
 *
 * <p>Implementations must be stateless: the validation group is an argument of each call, so a
 * single filter can serve concurrent requests.
 */
public interface InputFilter {

  /**
   * Runs the filter over the given data.
   *
   * @param data the raw input, keyed by field name
   * @param validationGroup when non-null, only these fields are validated; other fields are
   *     neither required nor checked
   * @return the filtered values, or the field messages when validation fails
   */
  FilterResult filter(Map<String, Object> data, @Nullable Set<String> validationGroup);
}
