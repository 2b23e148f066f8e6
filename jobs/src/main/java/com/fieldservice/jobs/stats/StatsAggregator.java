package com.fieldservice.jobs.stats;

import com.fieldservice.jobs.entity.JobEntity;
import com.fieldservice.jobs.entity.JobStatus;
import com.fieldservice.jobs.entity.TechnicianEntity;
import com.fieldservice.jobs.model.JobStats;
import com.fieldservice.jobs.model.TechnicianWorkload;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/** Per-status counts and per-technician workload, recomputed on every call */
public class StatsAggregator {

  private final Clock clock;
  private final ZoneId zone;

  public StatsAggregator(Clock clock, ZoneId zone) {
    this.clock = clock;
    this.zone = zone;
  }

  /**
   * Counts raw status values in one pass. Values outside the known set count toward the total
   * only.
   */
  public JobStats computeStats(List<String> statuses) {
    int total = 0;
    int pending = 0;
    int assigned = 0;
    int inProgress = 0;
    int completed = 0;
    int cancelled = 0;
    int onHold = 0;

    for (String value : statuses) {
      total++;
      JobStatus status = JobStatus.fromValue(value);
      if (status == null) {
        continue;
      }
      switch (status) {
        case PENDING -> pending++;
        case ASSIGNED -> assigned++;
        case IN_PROGRESS -> inProgress++;
        case COMPLETED -> completed++;
        case CANCELLED -> cancelled++;
        case ON_HOLD -> onHold++;
      }
    }
    return new JobStats(total, pending, assigned, inProgress, completed, cancelled, onHold);
  }

  public TechnicianWorkload computeWorkload(
      String technicianId, TechnicianEntity technician, List<JobEntity> jobs) {
    LocalDate today = LocalDate.now(clock.withZone(zone));
    Instant startOfToday = today.atStartOfDay(zone).toInstant();
    Instant startOfTomorrow = today.plusDays(1).atStartOfDay(zone).toInstant();

    int active = 0;
    int scheduled = 0;
    int completedToday = 0;
    long durationTotal = 0;
    int durationCount = 0;

    for (JobEntity job : jobs) {
      if (job.status() == JobStatus.IN_PROGRESS) {
        active++;
      } else if (job.status() == JobStatus.ASSIGNED) {
        scheduled++;
      }
      Instant completedAt = job.completedAt();
      if (completedAt != null
          && !completedAt.isBefore(startOfToday)
          && completedAt.isBefore(startOfTomorrow)) {
        completedToday++;
      }
      if (job.actualDuration() != null) {
        durationTotal += job.actualDuration();
        durationCount++;
      }
    }

    double average = durationCount == 0 ? 0 : (double) durationTotal / durationCount;
    return new TechnicianWorkload(
        technicianId,
        technician != null ? technician.displayName() : null,
        active,
        scheduled,
        completedToday,
        average,
        technician != null ? technician.currentLocation() : null);
  }
}
