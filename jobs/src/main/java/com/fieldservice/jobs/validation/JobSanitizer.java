package com.fieldservice.jobs.validation;

import com.fieldservice.jobs.entity.Customer;
import com.fieldservice.jobs.entity.Equipment;
import com.fieldservice.jobs.entity.JobLocation;
import com.fieldservice.jobs.entity.JobRequirements;
import com.fieldservice.jobs.model.CreateJobRequest;
import com.fieldservice.jobs.model.UpdateJobRequest;
import java.util.ArrayList;
import java.util.List;

/**
 * Cleans free-text fields before they are stored: removes angle brackets and quotes, trims, and
 * caps the length. Applying it twice gives the same result as applying it once.
 */
public class JobSanitizer {

  public static final int MAX_TEXT_LENGTH = 1000;

  public String sanitizeString(String input) {
    if (input == null) {
      return null;
    }
    String stripped = input.replaceAll("[<>'\"]", "").trim();
    if (stripped.length() > MAX_TEXT_LENGTH) {
      stripped = stripped.substring(0, MAX_TEXT_LENGTH);
    }
    return stripped.trim();
  }

  public CreateJobRequest sanitizeJobPayload(CreateJobRequest request) {
    return new CreateJobRequest(
        sanitizeString(request.title()),
        sanitizeString(request.description()),
        request.type(),
        request.priority(),
        sanitizeCustomer(request.customer()),
        sanitizeLocation(request.location()),
        request.scheduledDate(),
        request.scheduledTimeSlot(),
        request.estimatedDuration(),
        sanitizeRequirements(request.requirements()),
        sanitizeAll(request.notes()),
        sanitizeAll(request.internalNotes()),
        request.createdBy());
  }

  public UpdateJobRequest sanitizeUpdate(UpdateJobRequest update) {
    return new UpdateJobRequest(
        update.status(),
        sanitizeString(update.note()),
        sanitizeString(update.internalNote()),
        update.actualDuration(),
        sanitizeString(update.completionNotes()),
        update.customerSignature(),
        update.photos(),
        sanitizeString(update.workSummary()));
  }

  private Customer sanitizeCustomer(Customer customer) {
    if (customer == null) {
      return null;
    }
    return new Customer(
        sanitizeString(customer.name()),
        customer.phone(),
        sanitizeString(customer.email()),
        customer.alternatePhone(),
        sanitizeLocation(customer.address()),
        sanitizeString(customer.notes()));
  }

  private JobLocation sanitizeLocation(JobLocation location) {
    if (location == null) {
      return null;
    }
    return new JobLocation(
        sanitizeString(location.address()),
        sanitizeString(location.city()),
        sanitizeString(location.state()),
        location.zipCode(),
        location.latitude(),
        location.longitude(),
        sanitizeString(location.landmark()),
        sanitizeString(location.accessInstructions()));
  }

  private JobRequirements sanitizeRequirements(JobRequirements requirements) {
    if (requirements == null) {
      return null;
    }
    List<Equipment> equipment = null;
    if (requirements.equipment() != null) {
      equipment = new ArrayList<>();
      for (Equipment item : requirements.equipment()) {
        equipment.add(
            item == null
                ? null
                : new Equipment(
                    sanitizeString(item.name()),
                    sanitizeString(item.model()),
                    item.serialNumber(),
                    item.quantity(),
                    sanitizeString(item.description())));
      }
    }
    return new JobRequirements(
        requirements.skills(),
        equipment,
        requirements.tools(),
        sanitizeString(requirements.specialInstructions()));
  }

  private List<String> sanitizeAll(List<String> values) {
    if (values == null) {
      return null;
    }
    List<String> sanitized = new ArrayList<>();
    for (String value : values) {
      sanitized.add(sanitizeString(value));
    }
    return sanitized;
  }
}
