package com.fieldservice.jobs.entity;

import java.time.Instant;

/** Immutable record of one job-to-technician assignment */
public record AssignmentEntity(
    String assignmentId,
    String jobId,
    String technicianId,
    String assignedBy,
    Instant assignedAt,
    String notes,
    String assignmentReason) {

  public static final String REASON_MANUAL = "manual";
}
