package com.fieldservice.jobs.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record JobStats(
    @JsonProperty("total") int total,
    @JsonProperty("pending") int pending,
    @JsonProperty("assigned") int assigned,
    @JsonProperty("inProgress") int inProgress,
    @JsonProperty("completed") int completed,
    @JsonProperty("cancelled") int cancelled,
    @JsonProperty("onHold") int onHold) {}
