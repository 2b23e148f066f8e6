package com.fieldservice.jobs.validation;

import com.fieldservice.jobs.entity.*;
import com.fieldservice.jobs.model.CreateJobRequest;
import com.fieldservice.jobs.model.UpdateJobRequest;
import com.fieldservice.jobs.model.ValidationResult;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural and business-rule checks for job payloads. Every method collects all violations
 * instead of stopping at the first one.
 */
public class JobValidator {

  public static final int MAX_TITLE_LENGTH = 100;
  public static final int MAX_DESCRIPTION_LENGTH = 1000;
  public static final int MAX_CUSTOMER_NAME_LENGTH = 100;
  public static final int MAX_ESTIMATED_DURATION_MINUTES = 1440;
  public static final int MAX_COMPLETION_NOTES_LENGTH = 1000;
  public static final int MAX_WORK_SUMMARY_LENGTH = 2000;
  public static final int MAX_PHOTOS = 10;

  private static final Pattern PHONE = Pattern.compile("^\\+?[\\d\\s\\-()]{10,15}$");
  private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
  private static final Pattern ZIP_CODE = Pattern.compile("^\\d{5}(-\\d{4})?$");
  private static final Pattern TIME = Pattern.compile("^([01]?[0-9]|2[0-3]):([0-5][0-9])$");

  private static final Map<JobStatus, Set<JobStatus>> TRANSITIONS = new EnumMap<>(JobStatus.class);

  static {
    TRANSITIONS.put(JobStatus.PENDING, EnumSet.of(JobStatus.ASSIGNED, JobStatus.CANCELLED));
    TRANSITIONS.put(
        JobStatus.ASSIGNED,
        EnumSet.of(JobStatus.IN_PROGRESS, JobStatus.CANCELLED, JobStatus.ON_HOLD));
    TRANSITIONS.put(
        JobStatus.IN_PROGRESS,
        EnumSet.of(JobStatus.COMPLETED, JobStatus.ON_HOLD, JobStatus.CANCELLED));
    TRANSITIONS.put(
        JobStatus.ON_HOLD,
        EnumSet.of(JobStatus.ASSIGNED, JobStatus.IN_PROGRESS, JobStatus.CANCELLED));
    TRANSITIONS.put(JobStatus.COMPLETED, EnumSet.noneOf(JobStatus.class));
    TRANSITIONS.put(JobStatus.CANCELLED, EnumSet.noneOf(JobStatus.class));
  }

  private final Clock clock;

  public JobValidator(Clock clock) {
    this.clock = clock;
  }

  /** Statuses reachable in one step from the given status */
  public static Set<JobStatus> allowedTransitions(JobStatus current) {
    return Collections.unmodifiableSet(TRANSITIONS.get(current));
  }

  /**
   * Parses a scheduled date given as an ISO-8601 instant or offset date-time
   *
   * @return the instant, or null when the value is missing or unparseable
   */
  public static Instant parseScheduledDate(String value) {
    if (value == null || value.trim().isEmpty()) {
      return null;
    }
    try {
      return Instant.parse(value.trim());
    } catch (DateTimeParseException e) {
      try {
        return OffsetDateTime.parse(value.trim()).toInstant();
      } catch (DateTimeParseException ignored) {
        return null;
      }
    }
  }

  /**
   * Checks a proximity search point and radius. NaN and infinite values are rejected.
   *
   * @return every violated rule, empty when the query is usable
   */
  public static List<String> validateGeoQuery(double latitude, double longitude, double radiusKm) {
    List<String> errors = new ArrayList<>();
    if (!(latitude >= -90 && latitude <= 90)) {
      errors.add("Valid latitude is required (-90 to 90)");
    }
    if (!(longitude >= -180 && longitude <= 180)) {
      errors.add("Valid longitude is required (-180 to 180)");
    }
    if (!(radiusKm > 0 && Double.isFinite(radiusKm))) {
      errors.add("Radius must be greater than 0 km");
    }
    return errors;
  }

  public ValidationResult validateJobCreation(CreateJobRequest request) {
    List<String> errors = new ArrayList<>();

    if (isBlank(request.title())) {
      errors.add("Job title is required");
    } else if (request.title().length() > MAX_TITLE_LENGTH) {
      errors.add("Job title must be at most " + MAX_TITLE_LENGTH + " characters");
    }

    if (isBlank(request.description())) {
      errors.add("Job description is required");
    } else if (request.description().length() > MAX_DESCRIPTION_LENGTH) {
      errors.add("Job description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
    }

    if (JobType.fromValue(request.type()) == null) {
      errors.add("Valid job type is required");
    }

    if (JobPriority.fromValue(request.priority()) == null) {
      errors.add("Valid job priority is required");
    }

    if (isBlank(request.scheduledDate())) {
      errors.add("Scheduled date is required");
    } else {
      Instant scheduledDate = parseScheduledDate(request.scheduledDate());
      if (scheduledDate == null) {
        errors.add("Scheduled date must be an ISO-8601 timestamp");
      } else if (scheduledDate.isBefore(clock.instant())) {
        errors.add("Scheduled date cannot be in the past");
      }
    }

    Integer duration = request.estimatedDuration();
    if (duration == null || duration <= 0) {
      errors.add("Estimated duration must be greater than 0 minutes");
    } else if (duration > MAX_ESTIMATED_DURATION_MINUTES) {
      errors.add("Estimated duration cannot exceed 24 hours");
    }

    if (isBlank(request.createdBy())) {
      errors.add("Created by field is required");
    }

    if (request.customer() == null) {
      errors.add("Customer information is required");
    } else {
      errors.addAll(validateCustomer(request.customer()).errors());
    }

    if (request.location() == null) {
      errors.add("Job location is required");
    } else {
      errors.addAll(validateLocation(request.location()).errors());
    }

    if (request.requirements() == null) {
      errors.add("Job requirements are required");
    } else {
      errors.addAll(validateJobRequirements(request.requirements()).errors());
    }

    if (request.scheduledTimeSlot() == null) {
      errors.add("Scheduled time slot is required");
    } else {
      errors.addAll(validateTimeSlot(request.scheduledTimeSlot()).errors());
    }

    return new ValidationResult(errors);
  }

  public ValidationResult validateCustomer(Customer customer) {
    List<String> errors = new ArrayList<>();

    if (isBlank(customer.name())) {
      errors.add("Customer name is required");
    } else if (customer.name().length() > MAX_CUSTOMER_NAME_LENGTH) {
      errors.add("Customer name must be at most " + MAX_CUSTOMER_NAME_LENGTH + " characters");
    }

    if (isBlank(customer.phone())) {
      errors.add("Customer phone is required");
    } else if (!PHONE.matcher(customer.phone()).matches()) {
      errors.add("Customer phone must be a valid phone number");
    }

    if (!isBlank(customer.email()) && !EMAIL.matcher(customer.email()).matches()) {
      errors.add("Customer email must be a valid email address");
    }

    if (!isBlank(customer.alternatePhone()) && !PHONE.matcher(customer.alternatePhone()).matches()) {
      errors.add("Alternate phone must be a valid phone number");
    }

    return new ValidationResult(errors);
  }

  public ValidationResult validateLocation(JobLocation location) {
    List<String> errors = new ArrayList<>();

    if (isBlank(location.address())) {
      errors.add("Location address is required");
    }
    if (location.latitude() == null || location.latitude() < -90 || location.latitude() > 90) {
      errors.add("Valid latitude is required (-90 to 90)");
    }
    if (location.longitude() == null || location.longitude() < -180 || location.longitude() > 180) {
      errors.add("Valid longitude is required (-180 to 180)");
    }
    if (isBlank(location.city())) {
      errors.add("City is required");
    }
    if (isBlank(location.state())) {
      errors.add("State is required");
    }
    if (location.zipCode() == null || !ZIP_CODE.matcher(location.zipCode()).matches()) {
      errors.add("Valid ZIP code is required");
    }

    return new ValidationResult(errors);
  }

  public ValidationResult validateJobRequirements(JobRequirements requirements) {
    List<String> errors = new ArrayList<>();

    if (requirements.skills() == null || requirements.skills().isEmpty()) {
      errors.add("At least one skill is required");
    }

    if (requirements.equipment() != null) {
      for (int i = 0; i < requirements.equipment().size(); i++) {
        for (String error : validateEquipment(requirements.equipment().get(i)).errors()) {
          errors.add("Equipment " + (i + 1) + ": " + error);
        }
      }
    }

    if (requirements.tools() == null) {
      errors.add("Tools list is required");
    }

    return new ValidationResult(errors);
  }

  public ValidationResult validateEquipment(Equipment equipment) {
    List<String> errors = new ArrayList<>();
    if (equipment == null) {
      errors.add("Equipment entry is required");
      return new ValidationResult(errors);
    }
    if (isBlank(equipment.name())) {
      errors.add("Equipment name is required");
    }
    if (isBlank(equipment.model())) {
      errors.add("Equipment model is required");
    }
    if (equipment.quantity() == null || equipment.quantity() <= 0) {
      errors.add("Equipment quantity must be greater than 0");
    }
    return new ValidationResult(errors);
  }

  /** Same-day slots only: an end at or before the start is rejected even across midnight. */
  public ValidationResult validateTimeSlot(TimeSlot timeSlot) {
    List<String> errors = new ArrayList<>();

    Matcher start = timeSlot.start() == null ? null : TIME.matcher(timeSlot.start());
    Matcher end = timeSlot.end() == null ? null : TIME.matcher(timeSlot.end());
    boolean startValid = start != null && start.matches();
    boolean endValid = end != null && end.matches();

    if (!startValid) {
      errors.add("Start time must be in HH:MM format");
    }
    if (!endValid) {
      errors.add("End time must be in HH:MM format");
    }
    if (startValid && endValid && minutes(end) <= minutes(start)) {
      errors.add("End time must be after start time");
    }

    return new ValidationResult(errors);
  }

  public ValidationResult validateJobCompletion(UpdateJobRequest completion) {
    List<String> errors = new ArrayList<>();

    if (completion.completionNotes() != null
        && completion.completionNotes().length() > MAX_COMPLETION_NOTES_LENGTH) {
      errors.add("Completion notes must be at most " + MAX_COMPLETION_NOTES_LENGTH + " characters");
    }
    if (completion.workSummary() != null
        && completion.workSummary().length() > MAX_WORK_SUMMARY_LENGTH) {
      errors.add("Work summary must be at most " + MAX_WORK_SUMMARY_LENGTH + " characters");
    }
    if (completion.actualDuration() != null && completion.actualDuration() <= 0) {
      errors.add("Actual duration must be greater than 0 minutes");
    }
    if (completion.photos() != null && completion.photos().size() > MAX_PHOTOS) {
      errors.add("Maximum " + MAX_PHOTOS + " photos allowed per job");
    }

    return new ValidationResult(errors);
  }

  public ValidationResult validateJobAssignment(String jobId, String technicianId, String assignedBy) {
    List<String> errors = new ArrayList<>();
    if (isBlank(jobId)) {
      errors.add("Job ID is required");
    }
    if (isBlank(technicianId)) {
      errors.add("Technician ID is required");
    }
    if (isBlank(assignedBy)) {
      errors.add("Assigned by field is required");
    }
    return new ValidationResult(errors);
  }

  public ValidationResult validateStatusTransition(JobStatus current, JobStatus next) {
    if (current == null || next == null || !TRANSITIONS.get(current).contains(next)) {
      return new ValidationResult(
          List.of("Invalid status transition from " + label(current) + " to " + label(next)));
    }
    return ValidationResult.valid();
  }

  private static String label(JobStatus status) {
    return status == null ? "unknown" : status.value();
  }

  private static int minutes(Matcher time) {
    return Integer.parseInt(time.group(1)) * 60 + Integer.parseInt(time.group(2));
  }

  private static boolean isBlank(String value) {
    return value == null || value.trim().isEmpty();
  }
}
