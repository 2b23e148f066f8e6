package com.fieldservice.jobs.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** Request record for assigning a pending job to a technician */
public record AssignJobRequest(
    @JsonProperty("jobId") String jobId,
    @JsonProperty("technicianId") String technicianId,
    @JsonProperty("assignedBy") String assignedBy,
    @JsonProperty("assignedAt") Instant assignedAt,
    @JsonProperty("notes") String notes) {}
