package com.fieldservice.jobs.exceptions;

import java.util.List;

/**
 * Base class for rejected job operations. Carries every violated rule, not only the first, so a
 * caller can correct a request in one round trip.
 */
public abstract class JobOperationException extends Exception {

  private final ErrorCode errorCode;
  private final List<String> errors;

  protected JobOperationException(ErrorCode errorCode, String message, List<String> errors) {
    super(message);
    this.errorCode = errorCode;
    this.errors = errors == null ? List.of() : List.copyOf(errors);
  }

  protected JobOperationException(ErrorCode errorCode, String message) {
    this(errorCode, message, List.of(message));
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }

  public List<String> getErrors() {
    return errors;
  }
}
