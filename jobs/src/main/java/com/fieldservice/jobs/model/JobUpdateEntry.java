package com.fieldservice.jobs.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One element of a bulk update */
public record JobUpdateEntry(
    @JsonProperty("jobId") String jobId, @JsonProperty("update") UpdateJobRequest update) {}
