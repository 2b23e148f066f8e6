package com.fieldservice.jobs.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fieldservice.jobs.entity.GeoPoint;

/** Per-technician summary, recomputed on every request */
public record TechnicianWorkload(
    @JsonProperty("technicianId") String technicianId,
    @JsonProperty("technicianName") String technicianName,
    @JsonProperty("activeJobs") int activeJobs,
    @JsonProperty("scheduledJobs") int scheduledJobs,
    @JsonProperty("completedToday") int completedToday,
    @JsonProperty("averageJobDuration") double averageJobDuration,
    @JsonProperty("currentLocation") GeoPoint currentLocation) {}
