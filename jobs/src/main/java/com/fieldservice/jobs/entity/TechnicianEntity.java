package com.fieldservice.jobs.entity;

import java.util.List;

/** Read-only view of a user record from the users table */
public record TechnicianEntity(
    String userId,
    String displayName,
    String role,
    boolean active,
    List<String> skills,
    GeoPoint currentLocation) {

  public static final String TECHNICIAN_ROLE = "technician";

  public boolean isTechnician() {
    return TECHNICIAN_ROLE.equals(role);
  }
}
