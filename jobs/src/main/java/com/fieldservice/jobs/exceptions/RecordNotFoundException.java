package com.fieldservice.jobs.exceptions;

/** Thrown when a referenced job or technician does not exist */
public class RecordNotFoundException extends JobOperationException {

  private final String recordType;
  private final String recordId;

  public RecordNotFoundException(String recordType, String recordId) {
    super(ErrorCode.NOT_FOUND, recordType + " not found: " + recordId);
    this.recordType = recordType;
    this.recordId = recordId;
  }

  public static RecordNotFoundException job(String jobId) {
    return new RecordNotFoundException("Job", jobId);
  }

  public static RecordNotFoundException technician(String technicianId) {
    return new RecordNotFoundException("Technician", technicianId);
  }

  public String getRecordType() {
    return recordType;
  }

  public String getRecordId() {
    return recordId;
  }
}
