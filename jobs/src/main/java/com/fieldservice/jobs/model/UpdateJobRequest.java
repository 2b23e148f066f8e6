package com.fieldservice.jobs.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Request record for a job update. Every field is optional; notes are appended to the job's
 * existing notes.
 */
public record UpdateJobRequest(
    @JsonProperty("status") String status,
    @JsonProperty("note") String note,
    @JsonProperty("internalNote") String internalNote,
    @JsonProperty("actualDuration") Integer actualDuration,
    @JsonProperty("completionNotes") String completionNotes,
    @JsonProperty("customerSignature") String customerSignature,
    @JsonProperty("photos") List<String> photos,
    @JsonProperty("workSummary") String workSummary) {

  public static UpdateJobRequest ofStatus(String status) {
    return new UpdateJobRequest(status, null, null, null, null, null, null, null);
  }
}
