package com.fieldservice.jobs.stats;

import static org.junit.jupiter.api.Assertions.*;

import com.fieldservice.jobs.JobFixtures;
import com.fieldservice.jobs.entity.GeoPoint;
import com.fieldservice.jobs.entity.JobEntity;
import com.fieldservice.jobs.entity.JobStatus;
import com.fieldservice.jobs.entity.TechnicianEntity;
import com.fieldservice.jobs.model.JobStats;
import com.fieldservice.jobs.model.TechnicianWorkload;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class StatsAggregatorTest {

  private final StatsAggregator aggregator = new StatsAggregator(JobFixtures.CLOCK, ZoneOffset.UTC);

  @Test
  void countsByStatus() {
    JobStats stats = aggregator.computeStats(List.of("pending", "pending", "assigned", "completed"));

    assertEquals(new JobStats(4, 2, 1, 0, 1, 0, 0), stats);
  }

  @Test
  void unknownStatusCountsTowardTotalOnly() {
    JobStats stats = aggregator.computeStats(List.of("pending", "archived", "on_hold"));

    assertEquals(3, stats.total());
    assertEquals(1, stats.pending());
    assertEquals(1, stats.onHold());
    assertEquals(2, stats.pending() + stats.assigned() + stats.inProgress() + stats.completed()
        + stats.cancelled() + stats.onHold());
  }

  @Test
  void emptyInputIsAllZero() {
    assertEquals(new JobStats(0, 0, 0, 0, 0, 0, 0), aggregator.computeStats(List.of()));
  }

  @Test
  void workloadSummarisesTechnicianJobs() {
    GeoPoint position = new GeoPoint(39.78, -89.65, JobFixtures.NOW);
    TechnicianEntity technician =
        new TechnicianEntity("tech-1", "Sam Rivera", "technician", true, List.of(), position);
    List<JobEntity> jobs =
        List.of(
            JobFixtures.job("a", JobStatus.IN_PROGRESS).build(),
            JobFixtures.job("b", JobStatus.ASSIGNED).build(),
            JobFixtures.job("c", JobStatus.ASSIGNED).build(),
            JobFixtures.job("d", JobStatus.COMPLETED)
                .completedAt(JobFixtures.NOW.minus(Duration.ofHours(3))).actualDuration(90).build(),
            JobFixtures.job("e", JobStatus.COMPLETED)
                .completedAt(JobFixtures.NOW.minus(Duration.ofDays(2))).actualDuration(30).build());

    TechnicianWorkload workload = aggregator.computeWorkload("tech-1", technician, jobs);

    assertEquals(1, workload.activeJobs());
    assertEquals(2, workload.scheduledJobs());
    assertEquals(1, workload.completedToday());
    assertEquals(60.0, workload.averageJobDuration(), 1e-9);
    assertEquals("Sam Rivera", workload.technicianName());
    assertEquals(position, workload.currentLocation());
  }

  @Test
  void completedTodayFollowsConfiguredZone() {
    // 12:00Z is 01:00 the next day in Auckland (UTC+13 in March)
    StatsAggregator auckland = new StatsAggregator(JobFixtures.CLOCK, ZoneId.of("Pacific/Auckland"));
    JobEntity yesterdayThere =
        JobFixtures.job("a", JobStatus.COMPLETED).completedAt(JobFixtures.NOW.minus(Duration.ofHours(2))).build();

    assertEquals(0, auckland.computeWorkload("tech-1", null, List.of(yesterdayThere)).completedToday());
    assertEquals(1, aggregator.computeWorkload("tech-1", null, List.of(yesterdayThere)).completedToday());
  }

  @Test
  void unknownTechnicianYieldsZeros() {
    TechnicianWorkload workload = aggregator.computeWorkload("ghost", null, List.of());

    assertEquals(0, workload.activeJobs());
    assertEquals(0.0, workload.averageJobDuration(), 1e-9);
    assertNull(workload.technicianName());
  }
}
