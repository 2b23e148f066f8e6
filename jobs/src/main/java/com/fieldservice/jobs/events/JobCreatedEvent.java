package com.fieldservice.jobs.events;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Event record for EventBridge job.created events
 */
public record JobCreatedEvent(
    @JsonProperty("eventType") String eventType,
    @JsonProperty("jobId") String jobId,
    @JsonProperty("title") String title,
    @JsonProperty("type") String type,
    @JsonProperty("priority") String priority,
    @JsonProperty("createdBy") String createdBy,
    @JsonProperty("scheduledDate") Instant scheduledDate,
    @JsonProperty("createdAt") Instant createdAt) {

  public JobCreatedEvent(String jobId, String title, String type, String priority,
                         String createdBy, Instant scheduledDate, Instant createdAt) {
    this(JobEventPublisher.JOB_CREATED, jobId, title, type, priority, createdBy, scheduledDate, createdAt);
  }
}
