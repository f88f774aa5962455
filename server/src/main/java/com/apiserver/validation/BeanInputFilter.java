package com.apiserver.validation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.google.common.base.Throwables;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import jakarta.validation.metadata.BeanDescriptor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * {@link InputFilter} backed by a Bean Validation annotated type.
 *
 * <p>The input map is bound onto {@code T} with Jackson, ignoring keys the type does not declare.
 * Binding failures become messages on the offending field. The bound instance is then validated
 * as a whole or, for a validation group, property by property. The filtered values are the
 * properties of the bound instance, so defaults assigned by {@code T} show up in them.
 *
 * @param <T> the annotated input type
 */
public class BeanInputFilter<T> implements InputFilter {

  private static final TypeReference<LinkedHashMap<String, Object>> VALUES_TYPE =
      new TypeReference<LinkedHashMap<String, Object>>() {};
  static final String INPUT_FIELD = "input";

  private final Class<T> inputType;
  private final ObjectMapper objectMapper;
  private final Validator validator;
  private final BeanDescriptor descriptor;

  public BeanInputFilter(Class<T> inputType, ObjectMapper objectMapper, Validator validator) {
    this.inputType = inputType;
    this.objectMapper =
        objectMapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    this.validator = validator;
    this.descriptor = validator.getConstraintsForClass(inputType);
  }

  @Override
  public FilterResult filter(Map<String, Object> data, @Nullable Set<String> validationGroup) {
    T input;
    try {
      input = objectMapper.convertValue(data, inputType);
    } catch (IllegalArgumentException e) {
      Logger.debug(e, "Could not bind input onto {}", inputType.getSimpleName());
      return FilterResult.invalid(bindingMessages(e));
    }

    Set<ConstraintViolation<T>> violations;
    if (validationGroup == null) {
      violations = validator.validate(input);
    } else {
      violations = new LinkedHashSet<>();
      for (String field : validationGroup) {
        if (descriptor.getConstraintsForProperty(field) != null) {
          violations.addAll(validator.validateProperty(input, field));
        }
      }
    }

    if (!violations.isEmpty()) {
      return FilterResult.invalid(violationMessages(violations));
    }
    return FilterResult.valid(objectMapper.convertValue(input, VALUES_TYPE));
  }

  private Map<String, List<String>> violationMessages(Set<ConstraintViolation<T>> violations) {
    Map<String, List<String>> messages = new TreeMap<>();
    for (ConstraintViolation<T> violation : violations) {
      String field = violation.getPropertyPath().toString();
      messages
          .computeIfAbsent(field.isEmpty() ? INPUT_FIELD : field, k -> new ArrayList<>())
          .add(violation.getMessage());
    }
    messages.values().forEach(Collections::sort);
    return messages;
  }

  private static Map<String, List<String>> bindingMessages(IllegalArgumentException e) {
    JsonMappingException mapping =
        Throwables.getCausalChain(e).stream()
            .filter(JsonMappingException.class::isInstance)
            .map(JsonMappingException.class::cast)
            .findFirst()
            .orElse(null);
    if (mapping == null) {
      return Map.of(INPUT_FIELD, List.of("Input could not be read"));
    }
    String field =
        mapping.getPath().stream()
            .map(JsonMappingException.Reference::getFieldName)
            .filter(name -> name != null)
            .collect(Collectors.joining("."));
    String message = "Value is not valid";
    if (mapping instanceof MismatchedInputException mismatch && mismatch.getTargetType() != null) {
      message = "Value must be of type " + mismatch.getTargetType().getSimpleName();
    }
    return Map.of(field.isEmpty() ? INPUT_FIELD : field, List.of(message));
  }
}
