package com.fieldservice.jobs.events;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Event record for EventBridge job.assigned events
 */
public record JobAssignedEvent(
    @JsonProperty("eventType") String eventType,
    @JsonProperty("jobId") String jobId,
    @JsonProperty("assignmentId") String assignmentId,
    @JsonProperty("technicianId") String technicianId,
    @JsonProperty("assignedBy") String assignedBy,
    @JsonProperty("jobTitle") String jobTitle,
    @JsonProperty("priority") String priority,
    @JsonProperty("assignedAt") Instant assignedAt) {

  public JobAssignedEvent(String jobId, String assignmentId, String technicianId, String assignedBy,
                          String jobTitle, String priority, Instant assignedAt) {
    this(JobEventPublisher.JOB_ASSIGNED, jobId, assignmentId, technicianId, assignedBy, jobTitle, priority, assignedAt);
  }
}
