package com.fieldservice.jobs.exceptions;

/** Unchecked wrapper for a failed store call or an undecodable stored record */
public class StoreFailureException extends RuntimeException {
  public StoreFailureException(String message) {
    super(message);
  }

  public StoreFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
