package com.fieldservice.jobs.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Where the work happens. Coordinates are boxed so a missing value can be reported. */
public record JobLocation(
    @JsonProperty("address") String address,
    @JsonProperty("city") String city,
    @JsonProperty("state") String state,
    @JsonProperty("zipCode") String zipCode,
    @JsonProperty("latitude") Double latitude,
    @JsonProperty("longitude") Double longitude,
    @JsonProperty("landmark") String landmark,
    @JsonProperty("accessInstructions") String accessInstructions) {

  public boolean hasCoordinates() {
    return latitude != null && longitude != null;
  }
}
