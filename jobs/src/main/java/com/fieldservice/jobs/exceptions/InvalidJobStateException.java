package com.fieldservice.jobs.exceptions;

/**
 * Exception thrown when a job is not in the state an operation requires, including when a
 * concurrent writer changed it first
 */
public class InvalidJobStateException extends JobOperationException {
    public InvalidJobStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }
}
