package com.fieldservice.jobs.query;

import static com.fieldservice.jobs.store.AttributeValues.instant;
import static com.fieldservice.jobs.store.AttributeValues.s;

import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.fieldservice.jobs.entity.JobEntity;
import com.fieldservice.jobs.entity.JobPriority;
import com.fieldservice.jobs.entity.JobStatus;
import com.fieldservice.jobs.entity.JobType;
import com.fieldservice.jobs.mappers.JobEntityMapper;
import com.fieldservice.jobs.model.GeoFilter;
import com.fieldservice.jobs.model.JobFilter;
import com.fieldservice.jobs.model.JobPage;
import com.fieldservice.jobs.model.SearchRequest;
import com.fieldservice.jobs.store.JobStore;
import com.fieldservice.jobs.store.StoreCollections;
import com.fieldservice.jobs.store.StorePredicate;
import com.fieldservice.jobs.store.StoreQuery;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Builds job listings. Status, priority, type, technician and date-range filters are pushed to
 * the store; free-text and radius filters run on the fetched page, so a page can hold fewer
 * matches than its size even when more exist further on.
 */
@RequiredArgsConstructor
public class JobQueryEngine {

  static final Duration LONG_RUNNING_THRESHOLD = Duration.ofHours(24);

  private static final Set<JobStatus> OPEN_STATUSES = Set.of(JobStatus.PENDING, JobStatus.ASSIGNED);

  private final JobStore store;
  private final Clock clock;
  private final LambdaLogger logger;

  /**
   * Lists jobs newest first
   *
   * @param filter pushed-down and in-memory filters
   * @param pageSize maximum number of candidates examined for this page
   * @param cursor id of the last candidate of the previous page, or null for the first page
   */
  public JobPage list(JobFilter filter, int pageSize, String cursor) {
    return page(filter, "createdAt", true, pageSize, cursor, false, null);
  }

  public JobPage search(SearchRequest request) {
    JobFilter filter = request.filter();
    return switch (request.sortBy()) {
      case CREATED_AT -> page(filter, "createdAt", request.descending(), request.pageSize(), request.cursor(), true, null);
      case SCHEDULED_DATE -> page(filter, "scheduledDate", request.descending(), request.pageSize(), request.cursor(), true, null);
      case PRIORITY -> page(filter, JobEntityMapper.PRIORITY_RANK, request.descending(), request.pageSize(), request.cursor(), true, null);
      case DISTANCE -> page(filter, "createdAt", true, request.pageSize(), request.cursor(), true, request);
    };
  }

  /** Jobs assigned to a technician, earliest scheduled first */
  public List<JobEntity> getTechnicianJobs(String technicianId, Set<JobStatus> statuses) {
    StoreQuery.Builder query =
        StoreQuery.builder()
            .where(StorePredicate.eq("assignedTechnicianId", s(technicianId)))
            .orderBy("scheduledDate", false);
    if (statuses != null && !statuses.isEmpty()) {
      query.where(StorePredicate.in("status", values(statuses, JobStatus::value)));
    }
    return fetch(query.build());
  }

  /**
   * Open jobs (pending or assigned) within a radius, nearest first. Reads three times as many
   * candidates as requested before filtering.
   */
  public List<JobEntity> getJobsByProximity(double latitude, double longitude, double radiusKm, int max) {
    List<JobEntity> candidates =
        fetch(
            StoreQuery.builder()
                .where(StorePredicate.in("status", values(OPEN_STATUSES, JobStatus::value)))
                .orderBy("createdAt", true)
                .limit(max * 3)
                .build());

    Map<JobEntity, Double> distances = new LinkedHashMap<>();
    for (JobEntity job : candidates) {
      Double distance = GeoDistance.toJobKm(latitude, longitude, job);
      if (distance != null && distance <= radiusKm) {
        distances.put(job, distance);
      }
    }
    logger.log(
        String.format(
            "Proximity search kept %d of %d candidates within %.1f km",
            distances.size(), candidates.size(), radiusKm));

    return distances.entrySet().stream()
        .sorted(Map.Entry.comparingByValue())
        .limit(max)
        .map(Map.Entry::getKey)
        .collect(Collectors.toList());
  }

  /**
   * Overdue open jobs, high and urgent open jobs, and jobs in progress for more than 24 hours,
   * each listed once
   */
  public List<JobEntity> getJobsRequiringAttention() {
    Instant now = clock.instant();
    List<AttributeValue> open = values(OPEN_STATUSES, JobStatus::value);

    List<JobEntity> overdue =
        fetch(
            StoreQuery.builder()
                .where(StorePredicate.in("status", open))
                .where(StorePredicate.lt("scheduledDate", instant(now)))
                .orderBy("scheduledDate", false)
                .build());
    List<JobEntity> highPriority =
        fetch(
            StoreQuery.builder()
                .where(StorePredicate.in("status", open))
                .where(
                    StorePredicate.in(
                        "priority", List.of(s(JobPriority.HIGH.value()), s(JobPriority.URGENT.value()))))
                .orderBy(JobEntityMapper.PRIORITY_RANK, true)
                .build());
    List<JobEntity> longRunning =
        fetch(
            StoreQuery.builder()
                .where(StorePredicate.eq("status", s(JobStatus.IN_PROGRESS.value())))
                .where(StorePredicate.lt("startedAt", instant(now.minus(LONG_RUNNING_THRESHOLD))))
                .orderBy("startedAt", false)
                .build());

    Map<String, JobEntity> unique = new LinkedHashMap<>();
    for (List<JobEntity> group : List.of(overdue, highPriority, longRunning)) {
      for (JobEntity job : group) {
        unique.putIfAbsent(job.jobId(), job);
      }
    }
    logger.log(
        String.format(
            "Jobs requiring attention: %d overdue, %d high priority, %d long running, %d unique",
            overdue.size(), highPriority.size(), longRunning.size(), unique.size()));
    return new ArrayList<>(unique.values());
  }

  /** Pending jobs, highest priority first, used as the recommendation pool */
  public List<JobEntity> getPendingJobsByPriority(int limit) {
    return fetch(
        StoreQuery.builder()
            .where(StorePredicate.eq("status", s(JobStatus.PENDING.value())))
            .orderBy(JobEntityMapper.PRIORITY_RANK, true)
            .limit(limit)
            .build());
  }

  private JobPage page(
      JobFilter filter,
      String orderBy,
      boolean descending,
      int pageSize,
      String cursor,
      boolean extendedSearch,
      SearchRequest distanceSort) {
    StoreQuery query =
        pushDown(filter)
            .orderBy(orderBy, descending)
            .limit(pageSize + 1)
            .afterId(cursor)
            .build();

    List<Map<String, AttributeValue>> records = store.query(StoreCollections.JOBS, query);
    boolean hasMore = records.size() > pageSize;
    List<Map<String, AttributeValue>> candidates = hasMore ? records.subList(0, pageSize) : records;

    List<JobEntity> jobs = new ArrayList<>();
    for (Map<String, AttributeValue> record : candidates) {
      JobEntity job = JobEntityMapper.mapToJobEntity(record);
      if (matchesText(job, filter, extendedSearch) && matchesGeo(job, filter.geo())) {
        jobs.add(job);
      }
    }

    if (distanceSort != null && filter.geo() != null) {
      GeoFilter geo = filter.geo();
      Comparator<JobEntity> byDistance =
          Comparator.comparing(
              job -> GeoDistance.toJobKm(geo.latitude(), geo.longitude(), job),
              Comparator.nullsLast(Comparator.naturalOrder()));
      jobs.sort(distanceSort.descending() ? byDistance.reversed() : byDistance);
    }

    String nextCursor =
        hasMore && !candidates.isEmpty()
            ? JobEntityMapper.mapToJobEntity(candidates.get(candidates.size() - 1)).jobId()
            : null;

    logger.log(
        String.format(
            "Listed %d of %d candidates (hasMore=%s)", jobs.size(), candidates.size(), hasMore));
    return new JobPage(jobs, hasMore, nextCursor);
  }

  private StoreQuery.Builder pushDown(JobFilter filter) {
    StoreQuery.Builder query = StoreQuery.builder();
    if (!filter.statuses().isEmpty()) {
      query.where(StorePredicate.in("status", values(filter.statuses(), JobStatus::value)));
    }
    if (!filter.priorities().isEmpty()) {
      query.where(StorePredicate.in("priority", values(filter.priorities(), JobPriority::value)));
    }
    if (!filter.types().isEmpty()) {
      query.where(StorePredicate.in("type", values(filter.types(), JobType::value)));
    }
    if (filter.technicianId() != null && !filter.technicianId().isEmpty()) {
      query.where(StorePredicate.eq("assignedTechnicianId", s(filter.technicianId())));
    }
    if (filter.scheduledDateRange() != null) {
      if (filter.scheduledDateRange().start() != null) {
        query.where(StorePredicate.gte("scheduledDate", instant(filter.scheduledDateRange().start())));
      }
      if (filter.scheduledDateRange().end() != null) {
        query.where(StorePredicate.lte("scheduledDate", instant(filter.scheduledDateRange().end())));
      }
    }
    return query;
  }

  static boolean matchesText(JobEntity job, JobFilter filter, boolean extended) {
    if (!filter.hasSearchText()) {
      return true;
    }
    String needle = filter.searchText().trim().toLowerCase(Locale.ROOT);
    List<String> haystack = new ArrayList<>();
    haystack.add(job.title());
    haystack.add(job.description());
    haystack.add(job.customer() != null ? job.customer().name() : null);
    haystack.add(job.location() != null ? job.location().address() : null);
    if (extended) {
      haystack.add(job.location() != null ? job.location().city() : null);
      if (job.requirements() != null && job.requirements().skills() != null) {
        haystack.addAll(job.requirements().skills());
      }
      haystack.add(job.type() != null ? job.type().value() : null);
      haystack.add(job.priority() != null ? job.priority().value() : null);
    }
    for (String field : haystack) {
      if (field != null && field.toLowerCase(Locale.ROOT).contains(needle)) {
        return true;
      }
    }
    return false;
  }

  static boolean matchesGeo(JobEntity job, GeoFilter geo) {
    if (geo == null) {
      return true;
    }
    Double distance = GeoDistance.toJobKm(geo.latitude(), geo.longitude(), job);
    return distance != null && distance <= geo.radiusKm();
  }

  private List<JobEntity> fetch(StoreQuery query) {
    List<JobEntity> jobs = new ArrayList<>();
    for (Map<String, AttributeValue> record : store.query(StoreCollections.JOBS, query)) {
      jobs.add(JobEntityMapper.mapToJobEntity(record));
    }
    return jobs;
  }

  private static <T> List<AttributeValue> values(Collection<T> items, Function<T, String> value) {
    return items.stream().map(value).sorted().map(v -> s(v)).collect(Collectors.toList());
  }
}
