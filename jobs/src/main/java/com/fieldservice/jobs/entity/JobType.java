package com.fieldservice.jobs.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum JobType {
  INSTALLATION("installation"),
  REPAIR("repair"),
  MAINTENANCE("maintenance"),
  INSPECTION("inspection"),
  UPGRADE("upgrade"),
  EMERGENCY("emergency");

  private final String value;

  JobType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public static JobType fromValue(String value) {
    if (value == null) {
      return null;
    }
    for (JobType type : values()) {
      if (type.value.equalsIgnoreCase(value.trim())) {
        return type;
      }
    }
    return null;
  }
}
