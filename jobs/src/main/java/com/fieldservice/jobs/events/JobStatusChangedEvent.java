package com.fieldservice.jobs.events;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Event record for EventBridge job.status_changed events
 */
public record JobStatusChangedEvent(
    @JsonProperty("eventType") String eventType,
    @JsonProperty("jobId") String jobId,
    @JsonProperty("previousStatus") String previousStatus,
    @JsonProperty("newStatus") String newStatus,
    @JsonProperty("technicianId") String technicianId,
    @JsonProperty("changedAt") Instant changedAt) {

  public JobStatusChangedEvent(String jobId, String previousStatus, String newStatus,
                               String technicianId, Instant changedAt) {
    this(JobEventPublisher.JOB_STATUS_CHANGED, jobId, previousStatus, newStatus, technicianId, changedAt);
  }
}
