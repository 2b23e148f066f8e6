package com.fieldservice.jobs.model;

/** Filtered search with an explicit sort key and direction */
public record SearchRequest(
    JobFilter filter, SortField sortBy, boolean descending, int pageSize, String cursor) {

  public enum SortField {
    CREATED_AT("createdAt"),
    SCHEDULED_DATE("scheduledDate"),
    PRIORITY("priority"),
    DISTANCE("distance");

    private final String value;

    SortField(String value) {
      this.value = value;
    }

    public String value() {
      return value;
    }

    /** Resolves a request parameter; null or unknown values fall back to createdAt */
    public static SortField fromValue(String value) {
      if (value != null) {
        for (SortField field : values()) {
          if (field.value.equalsIgnoreCase(value.trim())) {
            return field;
          }
        }
      }
      return CREATED_AT;
    }
  }

  public SearchRequest {
    filter = filter == null ? JobFilter.none() : filter;
    sortBy = sortBy == null ? SortField.CREATED_AT : sortBy;
  }
}
