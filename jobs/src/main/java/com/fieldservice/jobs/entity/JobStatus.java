package com.fieldservice.jobs.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/** Lifecycle status of a job, stored by its lowercase wire value */
public enum JobStatus {
  PENDING("pending"),
  ASSIGNED("assigned"),
  IN_PROGRESS("in_progress"),
  COMPLETED("completed"),
  ON_HOLD("on_hold"),
  CANCELLED("cancelled");

  private final String value;

  JobStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELLED;
  }

  /**
   * Resolves a stored or requested status value
   *
   * @param value wire value such as "in_progress"
   * @return matching status, or null when the value is unknown
   */
  public static JobStatus fromValue(String value) {
    if (value == null) {
      return null;
    }
    for (JobStatus status : values()) {
      if (status.value.equalsIgnoreCase(value.trim())) {
        return status;
      }
    }
    return null;
  }
}
