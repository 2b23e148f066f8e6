package com.fieldservice.jobs.store;

/**
 * Exception thrown when a condition attached to a transactional write fails at commit time
 */
public class TransactionConflictException extends Exception {

    private final int failedOperationIndex;

    public TransactionConflictException(String message, int failedOperationIndex) {
        super(message);
        this.failedOperationIndex = failedOperationIndex;
    }

    /** Position of the failing write in the submitted list, or -1 when the store does not say */
    public int getFailedOperationIndex() {
        return failedOperationIndex;
    }
}
