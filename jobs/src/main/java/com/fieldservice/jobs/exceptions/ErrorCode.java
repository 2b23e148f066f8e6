package com.fieldservice.jobs.exceptions;

/** Failure categories surfaced by job operations, with the HTTP status each maps to */
public enum ErrorCode {
  VALIDATION_FAILED(400),
  NOT_FOUND(404),
  INVALID_TRANSITION(409),
  INVALID_STATE(409),
  TECHNICIAN_UNAVAILABLE(422),
  STORE_FAILURE(500);

  private final int httpStatus;

  ErrorCode(int httpStatus) {
    this.httpStatus = httpStatus;
  }

  public int httpStatus() {
    return httpStatus;
  }
}
