package com.fieldservice.jobs.events;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Event record for EventBridge job.deleted events
 */
public record JobDeletedEvent(
    @JsonProperty("eventType") String eventType,
    @JsonProperty("jobId") String jobId,
    @JsonProperty("status") String status,
    @JsonProperty("deletedAt") Instant deletedAt) {

  public JobDeletedEvent(String jobId, String status, Instant deletedAt) {
    this(JobEventPublisher.JOB_DELETED, jobId, status, deletedAt);
  }
}
