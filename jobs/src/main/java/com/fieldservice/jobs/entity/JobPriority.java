package com.fieldservice.jobs.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/** Job priority. The rank is persisted alongside the value so the store can order by it. */
public enum JobPriority {
  LOW("low", 1),
  MEDIUM("medium", 2),
  HIGH("high", 3),
  URGENT("urgent", 4);

  private final String value;
  private final int rank;

  JobPriority(String value, int rank) {
    this.value = value;
    this.rank = rank;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public int rank() {
    return rank;
  }

  public static JobPriority fromValue(String value) {
    if (value == null) {
      return null;
    }
    for (JobPriority priority : values()) {
      if (priority.value.equalsIgnoreCase(value.trim())) {
        return priority;
      }
    }
    return null;
  }
}
