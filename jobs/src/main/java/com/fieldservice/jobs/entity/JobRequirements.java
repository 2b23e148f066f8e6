package com.fieldservice.jobs.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Skills, equipment and tools a technician needs for a job */
public record JobRequirements(
    @JsonProperty("skills") List<String> skills,
    @JsonProperty("equipment") List<Equipment> equipment,
    @JsonProperty("tools") List<String> tools,
    @JsonProperty("specialInstructions") String specialInstructions) {}
