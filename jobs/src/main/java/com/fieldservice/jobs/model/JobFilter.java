package com.fieldservice.jobs.model;

import com.fieldservice.jobs.entity.JobPriority;
import com.fieldservice.jobs.entity.JobStatus;
import com.fieldservice.jobs.entity.JobType;
import java.util.Set;

/**
 * Listing filter. Set-valued fields match any member; empty or null means no restriction.
 */
public record JobFilter(
    Set<JobStatus> statuses,
    Set<JobPriority> priorities,
    Set<JobType> types,
    String technicianId,
    DateRange scheduledDateRange,
    String searchText,
    GeoFilter geo) {

  public JobFilter {
    statuses = statuses == null ? Set.of() : Set.copyOf(statuses);
    priorities = priorities == null ? Set.of() : Set.copyOf(priorities);
    types = types == null ? Set.of() : Set.copyOf(types);
  }

  public static JobFilter none() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean hasSearchText() {
    return searchText != null && !searchText.trim().isEmpty();
  }

  public static class Builder {
    private Set<JobStatus> statuses;
    private Set<JobPriority> priorities;
    private Set<JobType> types;
    private String technicianId;
    private DateRange scheduledDateRange;
    private String searchText;
    private GeoFilter geo;

    public Builder statuses(Set<JobStatus> statuses) {
      this.statuses = statuses;
      return this;
    }

    public Builder priorities(Set<JobPriority> priorities) {
      this.priorities = priorities;
      return this;
    }

    public Builder types(Set<JobType> types) {
      this.types = types;
      return this;
    }

    public Builder technicianId(String technicianId) {
      this.technicianId = technicianId;
      return this;
    }

    public Builder scheduledDateRange(DateRange scheduledDateRange) {
      this.scheduledDateRange = scheduledDateRange;
      return this;
    }

    public Builder searchText(String searchText) {
      this.searchText = searchText;
      return this;
    }

    public Builder geo(GeoFilter geo) {
      this.geo = geo;
      return this;
    }

    public JobFilter build() {
      return new JobFilter(
          statuses, priorities, types, technicianId, scheduledDateRange, searchText, geo);
    }
  }
}
