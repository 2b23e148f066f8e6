package com.fieldservice.jobs.recommendation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fieldservice.jobs.entity.JobEntity;

/** A candidate job with its score breakdown */
public record ScoredJob(
    @JsonProperty("job") JobEntity job,
    @JsonProperty("score") double score,
    @JsonProperty("skillScore") double skillScore,
    @JsonProperty("priorityScore") double priorityScore,
    @JsonProperty("distanceScore") double distanceScore,
    @JsonProperty("distanceKm") Double distanceKm) {}
