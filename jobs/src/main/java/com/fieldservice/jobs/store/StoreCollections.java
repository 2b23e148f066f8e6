package com.fieldservice.jobs.store;

/** Collection names and their key attributes */
public final class StoreCollections {

  public static final String JOBS = "jobs";
  public static final String ASSIGNMENTS = "jobAssignments";
  public static final String USERS = "users";

  private StoreCollections() {}

  public static String keyAttribute(String collection) {
    return switch (collection) {
      case JOBS -> "jobId";
      case ASSIGNMENTS -> "assignmentId";
      case USERS -> "userId";
      default -> throw new IllegalArgumentException("Unknown collection: " + collection);
    };
  }
}
