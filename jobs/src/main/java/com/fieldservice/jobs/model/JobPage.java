package com.fieldservice.jobs.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fieldservice.jobs.entity.JobEntity;
import java.util.List;

/**
 * One page of a listing. {@code hasMore} means more unfiltered candidates exist, not that more
 * matches do; {@code nextCursor} continues the scan from the last candidate examined.
 */
public record JobPage(
    @JsonProperty("jobs") List<JobEntity> jobs,
    @JsonProperty("hasMore") boolean hasMore,
    @JsonProperty("nextCursor") String nextCursor) {}
