package com.fieldservice.jobs.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Equipment(
    @JsonProperty("name") String name,
    @JsonProperty("model") String model,
    @JsonProperty("serialNumber") String serialNumber,
    @JsonProperty("quantity") Integer quantity,
    @JsonProperty("description") String description) {}
