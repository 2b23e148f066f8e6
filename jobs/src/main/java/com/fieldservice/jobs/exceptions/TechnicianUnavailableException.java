package com.fieldservice.jobs.exceptions;

/**
 * Exception thrown when assigning to a user who is inactive or lacks the technician role
 */
public class TechnicianUnavailableException extends JobOperationException {
    public TechnicianUnavailableException(String message) {
        super(ErrorCode.TECHNICIAN_UNAVAILABLE, message);
    }
}
