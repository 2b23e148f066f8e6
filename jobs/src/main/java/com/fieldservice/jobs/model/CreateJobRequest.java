package com.fieldservice.jobs.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fieldservice.jobs.entity.Customer;
import com.fieldservice.jobs.entity.JobLocation;
import com.fieldservice.jobs.entity.JobRequirements;
import com.fieldservice.jobs.entity.TimeSlot;
import java.util.List;

/**
 * Request record for creating a new job. Enumerations and the scheduled date stay as raw strings
 * so that bad values come back as validation errors rather than parse failures.
 */
public record CreateJobRequest(
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("type") String type,
    @JsonProperty("priority") String priority,
    @JsonProperty("customer") Customer customer,
    @JsonProperty("location") JobLocation location,
    @JsonProperty("scheduledDate") String scheduledDate,
    @JsonProperty("scheduledTimeSlot") TimeSlot scheduledTimeSlot,
    @JsonProperty("estimatedDuration") Integer estimatedDuration,
    @JsonProperty("requirements") JobRequirements requirements,
    @JsonProperty("notes") List<String> notes,
    @JsonProperty("internalNotes") List<String> internalNotes,
    @JsonProperty("createdBy") String createdBy) {

  /** Copy with the creator set from the caller identity */
  public CreateJobRequest withCreatedBy(String createdBy) {
    return new CreateJobRequest(
        title,
        description,
        type,
        priority,
        customer,
        location,
        scheduledDate,
        scheduledTimeSlot,
        estimatedDuration,
        requirements,
        notes,
        internalNotes,
        createdBy);
  }
}
