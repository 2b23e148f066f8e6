package com.fieldservice.jobs.exceptions;

import java.util.List;

/** Thrown when a payload breaks one or more validation rules */
public class JobValidationException extends JobOperationException {
  public JobValidationException(List<String> errors) {
    super(ErrorCode.VALIDATION_FAILED, "Validation failed", errors);
  }

  public JobValidationException(String error) {
    this(List.of(error));
  }
}
