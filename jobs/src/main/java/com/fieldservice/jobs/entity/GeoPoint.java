package com.fieldservice.jobs.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** Last reported position of a technician */
public record GeoPoint(
    @JsonProperty("latitude") double latitude,
    @JsonProperty("longitude") double longitude,
    @JsonProperty("timestamp") Instant timestamp) {}
