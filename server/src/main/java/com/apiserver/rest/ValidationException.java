package com.apiserver.rest;

import com.apiserver.common.status.Status;
import com.apiserver.common.status.StatusCode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;

/**
 * Raised when a request body fails validation. Carries the messages of every failing field.
 */
public class ValidationException extends ApiException {

  public static final String DEFAULT_MESSAGE = "Failed Validation";

  private final Map<String, List<String>> validationMessages;

  public ValidationException(
      String message, StatusCode statusCode, Map<String, List<String>> validationMessages) {
    super(Status.of(statusCode, message));
    ImmutableMap.Builder<String, List<String>> copy = ImmutableMap.builder();
    validationMessages.forEach((field, messages) -> copy.put(field, ImmutableList.copyOf(messages)));
    this.validationMessages = copy.build();
  }

  /**
   * Creates a 422 validation failure with the default message.
   *
   * @param validationMessages field name to messages
   */
  public static ValidationException fromMessages(Map<String, List<String>> validationMessages) {
    return new ValidationException(
        DEFAULT_MESSAGE, StatusCode.UNPROCESSABLE_ENTITY, validationMessages);
  }

  /** Returns field name to validation messages. */
  public Map<String, List<String>> getValidationMessages() {
    return validationMessages;
  }
}
