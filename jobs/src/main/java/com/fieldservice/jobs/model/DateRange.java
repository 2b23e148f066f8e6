package com.fieldservice.jobs.model;

import java.time.Instant;

/** Inclusive range; either end may be open (null) */
public record DateRange(Instant start, Instant end) {

  public boolean contains(Instant instant) {
    if (instant == null) {
      return false;
    }
    return (start == null || !instant.isBefore(start)) && (end == null || !instant.isAfter(end));
  }
}
