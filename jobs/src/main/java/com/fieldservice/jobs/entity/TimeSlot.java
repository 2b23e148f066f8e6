package com.fieldservice.jobs.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Same-day wall-clock window in 24-hour HH:MM */
public record TimeSlot(@JsonProperty("start") String start, @JsonProperty("end") String end) {}
