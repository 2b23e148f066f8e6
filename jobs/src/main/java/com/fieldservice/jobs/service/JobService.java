package com.fieldservice.jobs.service;

import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.fieldservice.jobs.assignment.AssignmentService;
import com.fieldservice.jobs.config.JobsConfig;
import com.fieldservice.jobs.entity.AssignmentEntity;
import com.fieldservice.jobs.entity.JobEntity;
import com.fieldservice.jobs.entity.JobPriority;
import com.fieldservice.jobs.entity.JobStatus;
import com.fieldservice.jobs.entity.JobType;
import com.fieldservice.jobs.entity.TechnicianEntity;
import com.fieldservice.jobs.events.JobCreatedEvent;
import com.fieldservice.jobs.events.JobDeletedEvent;
import com.fieldservice.jobs.events.JobEventPublisher;
import com.fieldservice.jobs.events.JobStatusChangedEvent;
import com.fieldservice.jobs.exceptions.ErrorCode;
import com.fieldservice.jobs.exceptions.InvalidJobStateException;
import com.fieldservice.jobs.exceptions.InvalidTransitionException;
import com.fieldservice.jobs.exceptions.JobOperationException;
import com.fieldservice.jobs.exceptions.JobValidationException;
import com.fieldservice.jobs.exceptions.RecordNotFoundException;
import com.fieldservice.jobs.mappers.JobEntityMapper;
import com.fieldservice.jobs.mappers.TechnicianMapper;
import com.fieldservice.jobs.model.*;
import com.fieldservice.jobs.query.JobQueryEngine;
import com.fieldservice.jobs.recommendation.RecommendationScorer;
import com.fieldservice.jobs.recommendation.ScoredJob;
import com.fieldservice.jobs.stats.StatsAggregator;
import com.fieldservice.jobs.status.JobStatusMachine;
import com.fieldservice.jobs.store.AttributeValues;
import com.fieldservice.jobs.store.JobStore;
import com.fieldservice.jobs.store.StoreCollections;
import com.fieldservice.jobs.store.StorePredicate;
import com.fieldservice.jobs.store.StoreQuery;
import com.fieldservice.jobs.store.TransactionConflictException;
import com.fieldservice.jobs.store.WriteOperation;
import com.fieldservice.jobs.validation.JobSanitizer;
import com.fieldservice.jobs.validation.JobValidator;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Public operations of the job engine over an explicit {@link JobStore}. Validation and
 * transition errors are raised before any write; store failures propagate unchanged.
 */
public class JobService {

  /** DynamoDB caps a transaction at 100 items. */
  public static final int MAX_BULK_UPDATE_SIZE = 100;

  private final JobStore store;
  private final JobEventPublisher events;
  private final Clock clock;
  private final LambdaLogger logger;
  private final JobsConfig config;

  private final JobValidator validator;
  private final JobSanitizer sanitizer;
  private final JobStatusMachine statusMachine;
  private final AssignmentService assignmentService;
  private final JobQueryEngine queryEngine;
  private final RecommendationScorer scorer;
  private final StatsAggregator statsAggregator;

  public JobService(
      JobStore store, JobEventPublisher events, Clock clock, LambdaLogger logger, JobsConfig config) {
    this.store = store;
    this.events = events;
    this.clock = clock;
    this.logger = logger;
    this.config = config;
    this.validator = new JobValidator(clock);
    this.sanitizer = new JobSanitizer();
    this.statusMachine = new JobStatusMachine(validator, clock);
    this.assignmentService = new AssignmentService(store, validator, events, clock, logger);
    this.queryEngine = new JobQueryEngine(store, clock, logger);
    this.scorer = new RecommendationScorer();
    this.statsAggregator = new StatsAggregator(clock, config.timeZone());
  }

  public JobEntity create(CreateJobRequest request) throws JobOperationException {
    ValidationResult validation = validator.validateJobCreation(request);
    if (!validation.isValid()) {
      logger.log("Rejected job creation: " + validation.errors());
      throw new JobValidationException(validation.errors());
    }

    CreateJobRequest clean = sanitizer.sanitizeJobPayload(request);
    Instant now = clock.instant();

    JobEntity job =
        JobEntity.builder()
            .jobId(UUID.randomUUID().toString())
            .title(clean.title())
            .description(clean.description())
            .type(JobType.fromValue(clean.type()))
            .priority(JobPriority.fromValue(clean.priority()))
            .status(JobStatus.PENDING)
            .customer(clean.customer())
            .location(clean.location())
            .scheduledDate(JobValidator.parseScheduledDate(clean.scheduledDate()))
            .scheduledTimeSlot(clean.scheduledTimeSlot())
            .estimatedDuration(clean.estimatedDuration())
            .requirements(clean.requirements())
            .notes(clean.notes() != null ? clean.notes() : new ArrayList<>())
            .internalNotes(clean.internalNotes() != null ? clean.internalNotes() : new ArrayList<>())
            .createdBy(clean.createdBy().trim())
            .createdAt(now)
            .updatedAt(now)
            .build();

    try {
      store.transaction(
          List.of(
              WriteOperation.putIfAbsent(
                  StoreCollections.JOBS, job.jobId(), JobEntityMapper.toItem(job))));
    } catch (TransactionConflictException e) {
      throw new InvalidJobStateException("Job with this ID already exists: " + job.jobId());
    }
    logger.log("Job saved to database: " + job.jobId());

    events.publish(
        JobEventPublisher.JOB_CREATED,
        new JobCreatedEvent(
            job.jobId(),
            job.title(),
            job.type().value(),
            job.priority().value(),
            job.createdBy(),
            job.scheduledDate(),
            job.createdAt()));
    return job;
  }

  public JobEntity getById(String jobId) throws RecordNotFoundException {
    JobEntity job = JobEntityMapper.mapToJobEntity(store.get(StoreCollections.JOBS, jobId));
    if (job == null) {
      throw RecordNotFoundException.job(jobId);
    }
    return job;
  }

  public JobEntity update(String jobId, UpdateJobRequest update) throws JobOperationException {
    JobEntity current = getById(jobId);
    PreparedUpdate prepared = prepareUpdate(current, update);

    try {
      store.transaction(List.of(prepared.write()));
    } catch (TransactionConflictException e) {
      throw new InvalidJobStateException("Job " + jobId + " was modified concurrently, reload and retry");
    }

    logger.log("Updated job " + jobId + " (status " + prepared.updated().status().value() + ")");
    publishStatusChange(current, prepared.updated());
    return prepared.updated();
  }

  /**
   * Applies several updates in one transaction. Every entry is checked before anything is
   * written, and all violations are reported together.
   */
  public List<JobEntity> bulkUpdate(List<JobUpdateEntry> entries) throws JobOperationException {
    if (entries == null || entries.isEmpty()) {
      throw new JobValidationException("At least one update is required");
    }
    if (entries.size() > MAX_BULK_UPDATE_SIZE) {
      throw new JobValidationException(
          "Bulk update is limited to " + MAX_BULK_UPDATE_SIZE + " jobs, got " + entries.size());
    }

    List<String> errors = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (JobUpdateEntry entry : entries) {
      if (entry == null || entry.jobId() == null || entry.jobId().isBlank() || entry.update() == null) {
        errors.add("Each entry needs a jobId and an update");
      } else if (!seen.add(entry.jobId())) {
        errors.add("Job " + entry.jobId() + " appears more than once");
      }
    }
    if (!errors.isEmpty()) {
      throw new JobValidationException(errors);
    }

    List<JobEntity> currentJobs = new ArrayList<>();
    for (JobUpdateEntry entry : entries) {
      currentJobs.add(getById(entry.jobId()));
    }

    List<PreparedUpdate> prepared = new ArrayList<>();
    boolean onlyTransitionErrors = true;
    for (int i = 0; i < entries.size(); i++) {
      try {
        prepared.add(prepareUpdate(currentJobs.get(i), entries.get(i).update()));
      } catch (JobOperationException e) {
        onlyTransitionErrors &= e.getErrorCode() == ErrorCode.INVALID_TRANSITION;
        for (String error : e.getErrors()) {
          errors.add("Job " + entries.get(i).jobId() + ": " + error);
        }
      }
    }
    if (!errors.isEmpty()) {
      if (onlyTransitionErrors) {
        throw new InvalidTransitionException(errors);
      }
      throw new JobValidationException(errors);
    }

    List<WriteOperation> writes = new ArrayList<>();
    for (PreparedUpdate update : prepared) {
      writes.add(update.write());
    }
    try {
      store.transaction(writes);
    } catch (TransactionConflictException e) {
      int index = e.getFailedOperationIndex();
      String jobId = index >= 0 && index < entries.size() ? entries.get(index).jobId() : "unknown";
      throw new InvalidJobStateException(
          "Bulk update aborted, job " + jobId + " was modified concurrently");
    }
    logger.log("Bulk updated " + prepared.size() + " jobs");

    List<JobEntity> updated = new ArrayList<>();
    for (int i = 0; i < prepared.size(); i++) {
      updated.add(prepared.get(i).updated());
      publishStatusChange(currentJobs.get(i), prepared.get(i).updated());
    }
    return updated;
  }

  public void delete(String jobId) throws RecordNotFoundException {
    JobEntity job = getById(jobId);
    store.delete(StoreCollections.JOBS, jobId);
    logger.log("Deleted job " + jobId);
    events.publish(
        JobEventPublisher.JOB_DELETED,
        new JobDeletedEvent(jobId, job.status().value(), clock.instant()));
  }

  public JobPage list(JobFilter filter, Integer pageSize, String cursor) {
    return queryEngine.list(filter == null ? JobFilter.none() : filter, pageSize(pageSize), cursor);
  }

  public JobPage search(SearchRequest request) {
    return queryEngine.search(
        new SearchRequest(
            request.filter(),
            request.sortBy(),
            request.descending(),
            pageSize(request.pageSize()),
            request.cursor()));
  }

  public AssignmentEntity assign(AssignJobRequest request) throws JobOperationException {
    return assignmentService.assign(request);
  }

  public List<JobEntity> getTechnicianJobs(String technicianId, Set<JobStatus> statuses)
      throws JobValidationException {
    if (technicianId == null || technicianId.isBlank()) {
      throw new JobValidationException("Technician ID is required");
    }
    return queryEngine.getTechnicianJobs(technicianId, statuses);
  }

  public List<JobEntity> getJobsByProximity(
      double latitude, double longitude, double radiusKm, int max) throws JobValidationException {
    List<String> errors = new ArrayList<>(JobValidator.validateGeoQuery(latitude, longitude, radiusKm));
    if (max <= 0) {
      errors.add("Maximum results must be greater than 0");
    }
    if (!errors.isEmpty()) {
      throw new JobValidationException(errors);
    }
    return queryEngine.getJobsByProximity(latitude, longitude, radiusKm, Math.min(max, config.maxPageSize()));
  }

  public List<JobEntity> getJobsRequiringAttention() {
    return queryEngine.getJobsRequiringAttention();
  }

  /**
   * Counts jobs by their stored status. Records with an unknown status count toward the total
   * only, and are not decoded, so one bad record cannot fail the whole report.
   *
   * @param createdRange optional creation-time window; null counts every job
   */
  public JobStats getStats(DateRange createdRange) {
    StoreQuery.Builder query = StoreQuery.builder();
    if (createdRange != null && createdRange.start() != null) {
      query.where(StorePredicate.gte("createdAt", AttributeValues.instant(createdRange.start())));
    }
    if (createdRange != null && createdRange.end() != null) {
      query.where(StorePredicate.lte("createdAt", AttributeValues.instant(createdRange.end())));
    }
    List<String> statuses = new ArrayList<>();
    for (Map<String, AttributeValue> record : store.query(StoreCollections.JOBS, query.build())) {
      statuses.add(AttributeValues.getString(record, "status"));
    }
    return statsAggregator.computeStats(statuses);
  }

  public TechnicianWorkload getWorkload(String technicianId) throws JobValidationException {
    if (technicianId == null || technicianId.isBlank()) {
      throw new JobValidationException("Technician ID is required");
    }
    TechnicianEntity technician =
        TechnicianMapper.mapToTechnician(store.get(StoreCollections.USERS, technicianId));
    List<JobEntity> jobs = queryEngine.getTechnicianJobs(technicianId, null);
    return statsAggregator.computeWorkload(technicianId, technician, jobs);
  }

  /**
   * Ranks up to twice the requested count of pending jobs, highest priority first, for one
   * technician. The count is capped at the maximum page size.
   */
  public List<ScoredJob> recommend(String technicianId, int max) throws JobOperationException {
    if (max <= 0) {
      throw new JobValidationException("Maximum results must be greater than 0");
    }
    TechnicianEntity technician =
        TechnicianMapper.mapToTechnician(store.get(StoreCollections.USERS, technicianId));
    if (technician == null) {
      throw RecordNotFoundException.technician(technicianId);
    }
    int limit = Math.min(max, config.maxPageSize());
    List<JobEntity> candidates = queryEngine.getPendingJobsByPriority(limit * 2);
    return scorer.rank(technician, candidates, limit);
  }

  private PreparedUpdate prepareUpdate(JobEntity current, UpdateJobRequest update)
      throws JobOperationException {
    JobEntity updated = current;

    if (update.status() != null) {
      JobStatus next = JobStatus.fromValue(update.status());
      if (next == null) {
        throw new JobValidationException("Unknown status: " + update.status());
      }
      updated = statusMachine.transition(current, next, update);
      if (next == JobStatus.ASSIGNED && !current.isAssigned()) {
        throw new InvalidJobStateException(
            "Job " + current.jobId() + " has no technician, use the assign operation");
      }
    }
    if (updated.status() != JobStatus.COMPLETED) {
      ValidationResult completion = validator.validateJobCompletion(update);
      if (!completion.isValid()) {
        throw new JobValidationException(completion.errors());
      }
    }
    if (update.actualDuration() != null && updated.status() != JobStatus.COMPLETED) {
      throw new JobValidationException("Actual duration can only be recorded on a completed job");
    }

    UpdateJobRequest clean = sanitizer.sanitizeUpdate(update);
    JobEntity.Builder builder = updated.toBuilder().updatedAt(clock.instant());
    if (clean.note() != null && !clean.note().isEmpty()) {
      builder.notes(append(current.notes(), clean.note()));
    }
    if (clean.internalNote() != null && !clean.internalNote().isEmpty()) {
      builder.internalNotes(append(current.internalNotes(), clean.internalNote()));
    }
    if (clean.actualDuration() != null) {
      builder.actualDuration(clean.actualDuration());
    }
    if (clean.completionNotes() != null) {
      builder.completionNotes(clean.completionNotes());
    }
    if (clean.customerSignature() != null) {
      builder.customerSignature(clean.customerSignature());
    }
    if (clean.photos() != null) {
      builder.photos(clean.photos());
    }
    if (clean.workSummary() != null) {
      builder.workSummary(clean.workSummary());
    }
    JobEntity result = builder.build();

    Map<String, AttributeValue> before = JobEntityMapper.toItem(current);
    Map<String, AttributeValue> changes = new HashMap<>();
    for (Map.Entry<String, AttributeValue> attribute : JobEntityMapper.toItem(result).entrySet()) {
      if (!Objects.equals(before.get(attribute.getKey()), attribute.getValue())) {
        changes.put(attribute.getKey(), attribute.getValue());
      }
    }

    Map<String, AttributeValue> conditions = new HashMap<>();
    conditions.put("status", AttributeValues.s(current.status().value()));
    if (current.updatedAt() != null) {
      conditions.put("updatedAt", AttributeValues.instant(current.updatedAt()));
    }

    return new PreparedUpdate(
        result,
        WriteOperation.updateIf(StoreCollections.JOBS, current.jobId(), changes, conditions));
  }

  private void publishStatusChange(JobEntity before, JobEntity after) {
    if (before.status() == after.status()) {
      return;
    }
    events.publish(
        JobEventPublisher.JOB_STATUS_CHANGED,
        new JobStatusChangedEvent(
            after.jobId(),
            before.status().value(),
            after.status().value(),
            after.assignedTechnicianId(),
            after.updatedAt()));
  }

  private int pageSize(Integer requested) {
    if (requested == null || requested <= 0) {
      return config.defaultPageSize();
    }
    return Math.min(requested, config.maxPageSize());
  }

  private static List<String> append(List<String> existing, String value) {
    List<String> combined = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
    combined.add(value);
    return combined;
  }

  private record PreparedUpdate(JobEntity updated, WriteOperation write) {}
}
