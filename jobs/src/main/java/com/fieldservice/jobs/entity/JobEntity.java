package com.fieldservice.jobs.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

/** A field-service job as stored in the jobs table */
public record JobEntity(
    @JsonProperty("jobId") String jobId,
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("type") JobType type,
    @JsonProperty("priority") JobPriority priority,
    @JsonProperty("status") JobStatus status,
    @JsonProperty("customer") Customer customer,
    @JsonProperty("location") JobLocation location,
    @JsonProperty("assignedTechnicianId") String assignedTechnicianId,
    @JsonProperty("assignedBy") String assignedBy,
    @JsonProperty("assignedAt") Instant assignedAt,
    @JsonProperty("scheduledDate") Instant scheduledDate,
    @JsonProperty("scheduledTimeSlot") TimeSlot scheduledTimeSlot,
    @JsonProperty("estimatedDuration") Integer estimatedDuration,
    @JsonProperty("requirements") JobRequirements requirements,
    @JsonProperty("startedAt") Instant startedAt,
    @JsonProperty("completedAt") Instant completedAt,
    @JsonProperty("actualDuration") Integer actualDuration,
    @JsonProperty("notes") List<String> notes,
    @JsonProperty("internalNotes") List<String> internalNotes,
    @JsonProperty("createdBy") String createdBy,
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("updatedAt") Instant updatedAt,
    @JsonProperty("completionNotes") String completionNotes,
    @JsonProperty("customerSignature") String customerSignature,
    @JsonProperty("photos") List<String> photos,
    @JsonProperty("workSummary") String workSummary) {

  @JsonIgnore
  public boolean isAssigned() {
    return assignedTechnicianId != null && !assignedTechnicianId.isEmpty();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .jobId(jobId)
        .title(title)
        .description(description)
        .type(type)
        .priority(priority)
        .status(status)
        .customer(customer)
        .location(location)
        .assignedTechnicianId(assignedTechnicianId)
        .assignedBy(assignedBy)
        .assignedAt(assignedAt)
        .scheduledDate(scheduledDate)
        .scheduledTimeSlot(scheduledTimeSlot)
        .estimatedDuration(estimatedDuration)
        .requirements(requirements)
        .startedAt(startedAt)
        .completedAt(completedAt)
        .actualDuration(actualDuration)
        .notes(notes)
        .internalNotes(internalNotes)
        .createdBy(createdBy)
        .createdAt(createdAt)
        .updatedAt(updatedAt)
        .completionNotes(completionNotes)
        .customerSignature(customerSignature)
        .photos(photos)
        .workSummary(workSummary);
  }

  public static class Builder {
    private String jobId;
    private String title;
    private String description;
    private JobType type;
    private JobPriority priority;
    private JobStatus status;
    private Customer customer;
    private JobLocation location;
    private String assignedTechnicianId;
    private String assignedBy;
    private Instant assignedAt;
    private Instant scheduledDate;
    private TimeSlot scheduledTimeSlot;
    private Integer estimatedDuration;
    private JobRequirements requirements;
    private Instant startedAt;
    private Instant completedAt;
    private Integer actualDuration;
    private List<String> notes;
    private List<String> internalNotes;
    private String createdBy;
    private Instant createdAt;
    private Instant updatedAt;
    private String completionNotes;
    private String customerSignature;
    private List<String> photos;
    private String workSummary;

    public Builder jobId(String jobId) {
      this.jobId = jobId;
      return this;
    }

    public Builder title(String title) {
      this.title = title;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder type(JobType type) {
      this.type = type;
      return this;
    }

    public Builder priority(JobPriority priority) {
      this.priority = priority;
      return this;
    }

    public Builder status(JobStatus status) {
      this.status = status;
      return this;
    }

    public Builder customer(Customer customer) {
      this.customer = customer;
      return this;
    }

    public Builder location(JobLocation location) {
      this.location = location;
      return this;
    }

    public Builder assignedTechnicianId(String assignedTechnicianId) {
      this.assignedTechnicianId = assignedTechnicianId;
      return this;
    }

    public Builder assignedBy(String assignedBy) {
      this.assignedBy = assignedBy;
      return this;
    }

    public Builder assignedAt(Instant assignedAt) {
      this.assignedAt = assignedAt;
      return this;
    }

    public Builder scheduledDate(Instant scheduledDate) {
      this.scheduledDate = scheduledDate;
      return this;
    }

    public Builder scheduledTimeSlot(TimeSlot scheduledTimeSlot) {
      this.scheduledTimeSlot = scheduledTimeSlot;
      return this;
    }

    public Builder estimatedDuration(Integer estimatedDuration) {
      this.estimatedDuration = estimatedDuration;
      return this;
    }

    public Builder requirements(JobRequirements requirements) {
      this.requirements = requirements;
      return this;
    }

    public Builder startedAt(Instant startedAt) {
      this.startedAt = startedAt;
      return this;
    }

    public Builder completedAt(Instant completedAt) {
      this.completedAt = completedAt;
      return this;
    }

    public Builder actualDuration(Integer actualDuration) {
      this.actualDuration = actualDuration;
      return this;
    }

    public Builder notes(List<String> notes) {
      this.notes = notes;
      return this;
    }

    public Builder internalNotes(List<String> internalNotes) {
      this.internalNotes = internalNotes;
      return this;
    }

    public Builder createdBy(String createdBy) {
      this.createdBy = createdBy;
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder updatedAt(Instant updatedAt) {
      this.updatedAt = updatedAt;
      return this;
    }

    public Builder completionNotes(String completionNotes) {
      this.completionNotes = completionNotes;
      return this;
    }

    public Builder customerSignature(String customerSignature) {
      this.customerSignature = customerSignature;
      return this;
    }

    public Builder photos(List<String> photos) {
      this.photos = photos;
      return this;
    }

    public Builder workSummary(String workSummary) {
      this.workSummary = workSummary;
      return this;
    }

    public JobEntity build() {
      return new JobEntity(
          jobId,
          title,
          description,
          type,
          priority,
          status,
          customer,
          location,
          assignedTechnicianId,
          assignedBy,
          assignedAt,
          scheduledDate,
          scheduledTimeSlot,
          estimatedDuration,
          requirements,
          startedAt,
          completedAt,
          actualDuration,
          notes,
          internalNotes,
          createdBy,
          createdAt,
          updatedAt,
          completionNotes,
          customerSignature,
          photos,
          workSummary);
    }
  }
}
