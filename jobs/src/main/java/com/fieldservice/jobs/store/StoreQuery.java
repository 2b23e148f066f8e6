package com.fieldservice.jobs.store;

import java.util.ArrayList;
import java.util.List;

/**
 * Pushed-down part of a listing: predicates, ordering, limit and cursor. A limit of 0 means no
 * limit.
 */
public record StoreQuery(
    List<StorePredicate> predicates,
    String orderBy,
    boolean descending,
    int limit,
    String afterId) {

  public StoreQuery {
    predicates = predicates == null ? List.of() : List.copyOf(predicates);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private final List<StorePredicate> predicates = new ArrayList<>();
    private String orderBy;
    private boolean descending;
    private int limit;
    private String afterId;

    public Builder where(StorePredicate predicate) {
      this.predicates.add(predicate);
      return this;
    }

    public Builder orderBy(String orderBy, boolean descending) {
      this.orderBy = orderBy;
      this.descending = descending;
      return this;
    }

    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public Builder afterId(String afterId) {
      this.afterId = afterId;
      return this;
    }

    public StoreQuery build() {
      return new StoreQuery(predicates, orderBy, descending, limit, afterId);
    }
  }
}
