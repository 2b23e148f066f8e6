package com.fieldservice.jobs.model;

import java.util.ArrayList;
import java.util.List;

/** Every rule a payload broke, in the order checked */
public record ValidationResult(List<String> errors) {

  public ValidationResult {
    errors = List.copyOf(errors);
  }

  public static ValidationResult valid() {
    return new ValidationResult(List.of());
  }

  public boolean isValid() {
    return errors.isEmpty();
  }

  public ValidationResult and(ValidationResult other) {
    List<String> combined = new ArrayList<>(errors);
    combined.addAll(other.errors);
    return new ValidationResult(combined);
  }
}
