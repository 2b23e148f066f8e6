package com.fieldservice.jobs.validation;

import static org.junit.jupiter.api.Assertions.*;

import com.fieldservice.jobs.JobFixtures;
import com.fieldservice.jobs.entity.Equipment;
import com.fieldservice.jobs.entity.JobRequirements;
import com.fieldservice.jobs.entity.JobStatus;
import com.fieldservice.jobs.entity.TimeSlot;
import com.fieldservice.jobs.model.CreateJobRequest;
import com.fieldservice.jobs.model.UpdateJobRequest;
import com.fieldservice.jobs.model.ValidationResult;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class JobValidatorTest {

  private final JobValidator validator = new JobValidator(JobFixtures.CLOCK);

  @Test
  void acceptsCompleteCreateRequest() {
    ValidationResult result = validator.validateJobCreation(JobFixtures.createRequest());

    assertTrue(result.isValid(), () -> "unexpected errors: " + result.errors());
  }

  @Test
  void reportsEveryViolationAtOnce() {
    CreateJobRequest request =
        new CreateJobRequest(
            " ", null, "plumbing", "critical", null, null, "2020-01-01T00:00:00Z", null, 0, null,
            null, null, null);

    List<String> errors = validator.validateJobCreation(request).errors();

    assertTrue(errors.contains("Job title is required"));
    assertTrue(errors.contains("Job description is required"));
    assertTrue(errors.contains("Valid job type is required"));
    assertTrue(errors.contains("Valid job priority is required"));
    assertTrue(errors.contains("Scheduled date cannot be in the past"));
    assertTrue(errors.contains("Estimated duration must be greater than 0 minutes"));
    assertTrue(errors.contains("Created by field is required"));
    assertTrue(errors.contains("Customer information is required"));
    assertTrue(errors.contains("Job location is required"));
    assertTrue(errors.contains("Job requirements are required"));
    assertTrue(errors.contains("Scheduled time slot is required"));
  }

  @Test
  void rejectsDurationOverOneDay() {
    CreateJobRequest base = JobFixtures.createRequest();
    CreateJobRequest request =
        new CreateJobRequest(
            base.title(), base.description(), base.type(), base.priority(), base.customer(),
            base.location(), base.scheduledDate(), base.scheduledTimeSlot(), 1441,
            base.requirements(), null, null, base.createdBy());

    assertEquals(
        List.of("Estimated duration cannot exceed 24 hours"),
        validator.validateJobCreation(request).errors());
  }

  @Test
  void acceptsOffsetScheduledDate() {
    assertEquals(
        JobFixtures.NOW.plusSeconds(3600),
        JobValidator.parseScheduledDate("2026-03-10T14:00:00+01:00"));
    assertNull(JobValidator.parseScheduledDate("next tuesday"));
  }

  @Test
  void timeSlotEndMustFollowStart() {
    assertEquals(
        List.of("End time must be after start time"),
        validator.validateTimeSlot(new TimeSlot("09:00", "08:00")).errors());
    assertTrue(validator.validateTimeSlot(new TimeSlot("09:00", "10:00")).isValid());
    assertTrue(validator.validateTimeSlot(new TimeSlot("9:30", "17:45")).isValid());
    assertFalse(validator.validateTimeSlot(new TimeSlot("09:00", "09:00")).isValid());
    assertEquals(2, validator.validateTimeSlot(new TimeSlot("24:00", "9am")).errors().size());
  }

  @Test
  void locationRequiresCoordinatesInRangeAndZip() {
    List<String> errors =
        validator.validateLocation(new com.fieldservice.jobs.entity.JobLocation(
            "1 Elm", "Town", "CA", "9021", 91.0, null, null, null)).errors();

    assertEquals(
        List.of(
            "Valid latitude is required (-90 to 90)",
            "Valid longitude is required (-180 to 180)",
            "Valid ZIP code is required"),
        errors);
  }

  @Test
  void requirementsPrefixEquipmentErrorsWithPosition() {
    JobRequirements requirements =
        new JobRequirements(
            List.of(),
            List.of(new Equipment("Ladder", "L-10", null, 1, null), new Equipment("", null, null, 0, null)),
            null,
            null);

    assertEquals(
        List.of(
            "At least one skill is required",
            "Equipment 2: Equipment name is required",
            "Equipment 2: Equipment model is required",
            "Equipment 2: Equipment quantity must be greater than 0",
            "Tools list is required"),
        validator.validateJobRequirements(requirements).errors());
  }

  @Test
  void completionPayloadLimits() {
    UpdateJobRequest completion =
        new UpdateJobRequest(
            "completed", null, null, -5, "x".repeat(1001), null,
            Collections.nCopies(11, "photo.jpg"), "y".repeat(2001));

    assertEquals(4, validator.validateJobCompletion(completion).errors().size());
  }

  @Test
  void assignmentRequiresAllIdentifiers() {
    assertEquals(3, validator.validateJobAssignment(null, " ", "").errors().size());
    assertTrue(validator.validateJobAssignment("job-1", "tech-1", "dispatcher-1").isValid());
  }

  @Test
  void statusTransitionsFollowTable() {
    assertTrue(validator.validateStatusTransition(JobStatus.PENDING, JobStatus.ASSIGNED).isValid());
    assertTrue(validator.validateStatusTransition(JobStatus.ON_HOLD, JobStatus.IN_PROGRESS).isValid());
    assertEquals(
        List.of("Invalid status transition from pending to completed"),
        validator.validateStatusTransition(JobStatus.PENDING, JobStatus.COMPLETED).errors());
  }

  @Test
  void customerContactFormats() {
    List<String> errors =
        validator.validateCustomer(new com.fieldservice.jobs.entity.Customer(
            "N".repeat(101), "12345", "not-an-email", "abc", null, null)).errors();

    assertEquals(4, errors.size());
  }
}
