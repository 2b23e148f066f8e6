package com.fieldservice.jobs.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Customer(
    @JsonProperty("name") String name,
    @JsonProperty("phone") String phone,
    @JsonProperty("email") String email,
    @JsonProperty("alternatePhone") String alternatePhone,
    @JsonProperty("address") JobLocation address,
    @JsonProperty("notes") String notes) {}
