package com.fieldservice.jobs;

import static com.fieldservice.jobs.store.AttributeValues.*;

import com.fieldservice.jobs.entity.*;
import com.fieldservice.jobs.mappers.JobEntityMapper;
import com.fieldservice.jobs.model.CreateJobRequest;
import com.fieldservice.jobs.store.JobStore;
import com.fieldservice.jobs.store.StoreCollections;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/** Shared builders for job engine tests */
public final class JobFixtures {

  public static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");
  public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  private JobFixtures() {}

  public static CreateJobRequest createRequest() {
    return new CreateJobRequest(
        "Replace water heater",
        "Remove the old 40 gallon tank and install the new unit",
        "installation",
        "high",
        new Customer("Jane Doe", "555-123-4567", "jane@example.com", null, null, null),
        location(39.7817, -89.6501),
        "2026-03-12T09:00:00Z",
        new TimeSlot("09:00", "11:00"),
        120,
        new JobRequirements(List.of("plumbing"), List.of(), List.of("pipe wrench"), null),
        null,
        null,
        "dispatcher-1");
  }

  public static JobLocation location(Double latitude, Double longitude) {
    return new JobLocation("12 Main St", "Springfield", "IL", "62701", latitude, longitude, null, null);
  }

  /** A stored-shape job with every required attribute set */
  public static JobEntity.Builder job(String jobId, JobStatus status) {
    return JobEntity.builder()
        .jobId(jobId)
        .title("Job " + jobId)
        .description("Description of " + jobId)
        .type(JobType.REPAIR)
        .priority(JobPriority.MEDIUM)
        .status(status)
        .customer(new Customer("Jane Doe", "555-123-4567", null, null, null, null))
        .location(location(39.7817, -89.6501))
        .scheduledDate(NOW.plusSeconds(86_400))
        .scheduledTimeSlot(new TimeSlot("09:00", "11:00"))
        .estimatedDuration(60)
        .requirements(new JobRequirements(List.of("plumbing"), List.of(), List.of(), null))
        .notes(new ArrayList<>())
        .internalNotes(new ArrayList<>())
        .createdBy("dispatcher-1")
        .createdAt(NOW)
        .updatedAt(NOW);
  }

  public static JobEntity store(JobStore store, JobEntity job) {
    store.put(StoreCollections.JOBS, job.jobId(), JobEntityMapper.toItem(job));
    return job;
  }

  public static Map<String, AttributeValue> technician(
      String userId, boolean active, String role, List<String> skills) {
    Map<String, AttributeValue> item = new HashMap<>();
    item.put("userId", s(userId));
    item.put("displayName", s("Tech " + userId));
    item.put("role", s(role));
    item.put("isActive", bool(active));
    item.put("skills", stringList(skills));
    return item;
  }

  public static void storeTechnician(JobStore store, String userId, boolean active, String role) {
    store.put(StoreCollections.USERS, userId, technician(userId, active, role, List.of("plumbing")));
  }
}
