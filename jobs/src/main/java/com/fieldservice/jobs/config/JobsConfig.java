package com.fieldservice.jobs.config;

import com.fieldservice.jobs.store.StoreCollections;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Map;

/**
 * Settings read once from the Lambda environment.
 *
 * @param eventBusName EventBridge bus; null disables event publishing
 */
public record JobsConfig(
    String jobsTableName,
    String assignmentsTableName,
    String usersTableName,
    String eventBusName,
    ZoneId timeZone,
    int defaultPageSize,
    int maxPageSize) {

  public static final int DEFAULT_PAGE_SIZE = 20;
  public static final int MAX_PAGE_SIZE = 100;

  public static JobsConfig fromEnvironment() {
    return fromMap(System.getenv());
  }

  public static JobsConfig fromMap(Map<String, String> env) {
    int maxPageSize = parseInt(env.get("MAX_PAGE_SIZE"), MAX_PAGE_SIZE, "MAX_PAGE_SIZE");
    int defaultPageSize =
        Math.min(parseInt(env.get("DEFAULT_PAGE_SIZE"), DEFAULT_PAGE_SIZE, "DEFAULT_PAGE_SIZE"), maxPageSize);
    return new JobsConfig(
        orDefault(env.get("JOBS_TABLE_NAME"), "Jobs"),
        orDefault(env.get("ASSIGNMENTS_TABLE_NAME"), "JobAssignments"),
        orDefault(env.get("USERS_TABLE_NAME"), "Users"),
        blankToNull(env.get("EVENT_BUS_NAME")),
        zone(env.get("JOBS_TIME_ZONE")),
        defaultPageSize,
        maxPageSize);
  }

  /** Table name per store collection */
  public Map<String, String> tableNames() {
    return Map.of(
        StoreCollections.JOBS, jobsTableName,
        StoreCollections.ASSIGNMENTS, assignmentsTableName,
        StoreCollections.USERS, usersTableName);
  }

  public boolean eventsEnabled() {
    return eventBusName != null;
  }

  private static ZoneId zone(String value) {
    if (value == null || value.isBlank()) {
      return ZoneId.of("UTC");
    }
    try {
      return ZoneId.of(value.trim());
    } catch (DateTimeException e) {
      throw new IllegalStateException("Invalid JOBS_TIME_ZONE: " + value, e);
    }
  }

  private static int parseInt(String value, int defaultValue, String name) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      int parsed = Integer.parseInt(value.trim());
      if (parsed <= 0) {
        throw new IllegalStateException(name + " must be positive: " + value);
      }
      return parsed;
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Invalid " + name + ": " + value, e);
    }
  }

  private static String orDefault(String value, String defaultValue) {
    return value == null || value.isBlank() ? defaultValue : value;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
