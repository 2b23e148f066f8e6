package com.fieldservice.jobs.exceptions;

import java.util.List;

/**
 * Exception thrown when a status change is not allowed from the job's current status
 */
public class InvalidTransitionException extends JobOperationException {
    public InvalidTransitionException(String message) {
        super(ErrorCode.INVALID_TRANSITION, message);
    }

    public InvalidTransitionException(List<String> errors) {
        super(ErrorCode.INVALID_TRANSITION, "Invalid status transition", errors);
    }
}
