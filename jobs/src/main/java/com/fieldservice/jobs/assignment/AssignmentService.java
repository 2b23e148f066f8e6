package com.fieldservice.jobs.assignment;

import static com.fieldservice.jobs.store.AttributeValues.instant;
import static com.fieldservice.jobs.store.AttributeValues.s;

import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.fieldservice.jobs.entity.AssignmentEntity;
import com.fieldservice.jobs.entity.JobEntity;
import com.fieldservice.jobs.entity.JobStatus;
import com.fieldservice.jobs.entity.TechnicianEntity;
import com.fieldservice.jobs.events.JobAssignedEvent;
import com.fieldservice.jobs.events.JobEventPublisher;
import com.fieldservice.jobs.exceptions.InvalidJobStateException;
import com.fieldservice.jobs.exceptions.JobOperationException;
import com.fieldservice.jobs.exceptions.JobValidationException;
import com.fieldservice.jobs.exceptions.RecordNotFoundException;
import com.fieldservice.jobs.exceptions.TechnicianUnavailableException;
import com.fieldservice.jobs.mappers.AssignmentMapper;
import com.fieldservice.jobs.mappers.JobEntityMapper;
import com.fieldservice.jobs.mappers.TechnicianMapper;
import com.fieldservice.jobs.model.AssignJobRequest;
import com.fieldservice.jobs.model.ValidationResult;
import com.fieldservice.jobs.store.JobStore;
import com.fieldservice.jobs.store.StoreCollections;
import com.fieldservice.jobs.store.TransactionConflictException;
import com.fieldservice.jobs.store.WriteOperation;
import com.fieldservice.jobs.validation.JobValidator;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Assigns a pending job to an eligible technician. Preconditions are checked in order and the
 * first failure wins; the job update and the new assignment record are then committed in one
 * transaction that re-asserts the job is still pending and the technician still assignable.
 */
@RequiredArgsConstructor
public class AssignmentService {

  private static final int JOB_WRITE = 0;
  private static final int TECHNICIAN_CHECK = 1;

  private final JobStore store;
  private final JobValidator validator;
  private final JobEventPublisher events;
  private final Clock clock;
  private final LambdaLogger logger;

  public AssignmentEntity assign(AssignJobRequest request) throws JobOperationException {
    ValidationResult validation =
        validator.validateJobAssignment(request.jobId(), request.technicianId(), request.assignedBy());
    if (!validation.isValid()) {
      throw new JobValidationException(validation.errors());
    }

    JobEntity job =
        JobEntityMapper.mapToJobEntity(store.get(StoreCollections.JOBS, request.jobId()));
    if (job == null) {
      throw RecordNotFoundException.job(request.jobId());
    }
    if (job.status() != JobStatus.PENDING) {
      throw new InvalidJobStateException(
          "Job " + job.jobId() + " cannot be assigned from status " + job.status().value());
    }

    TechnicianEntity technician =
        TechnicianMapper.mapToTechnician(store.get(StoreCollections.USERS, request.technicianId()));
    if (technician == null) {
      throw RecordNotFoundException.technician(request.technicianId());
    }
    if (!technician.active()) {
      throw new TechnicianUnavailableException("Technician " + technician.userId() + " is not active");
    }
    if (!technician.isTechnician()) {
      throw new TechnicianUnavailableException(
          "User " + technician.userId() + " does not have the technician role");
    }

    Instant now = clock.instant();
    Instant assignedAt = request.assignedAt() != null ? request.assignedAt() : now;
    AssignmentEntity assignment =
        new AssignmentEntity(
            UUID.randomUUID().toString(),
            job.jobId(),
            technician.userId(),
            request.assignedBy(),
            assignedAt,
            request.notes(),
            AssignmentEntity.REASON_MANUAL);

    Map<String, AttributeValue> jobChanges = new HashMap<>();
    jobChanges.put("status", s(JobStatus.ASSIGNED.value()));
    jobChanges.put("assignedTechnicianId", s(technician.userId()));
    jobChanges.put("assignedBy", s(request.assignedBy()));
    jobChanges.put("assignedAt", instant(assignedAt));
    jobChanges.put("updatedAt", instant(now));

    List<WriteOperation> operations =
        List.of(
            WriteOperation.updateIf(
                StoreCollections.JOBS,
                job.jobId(),
                jobChanges,
                Map.of("status", s(JobStatus.PENDING.value()))),
            WriteOperation.conditionCheck(
                StoreCollections.USERS, technician.userId(), TechnicianMapper.assignableConditions()),
            WriteOperation.putIfAbsent(
                StoreCollections.ASSIGNMENTS,
                assignment.assignmentId(),
                AssignmentMapper.toItem(assignment)));

    try {
      store.transaction(operations);
    } catch (TransactionConflictException e) {
      logger.log("Assignment of job " + job.jobId() + " rejected at commit: " + e.getMessage());
      if (e.getFailedOperationIndex() == TECHNICIAN_CHECK) {
        throw new TechnicianUnavailableException(
            "Technician " + technician.userId() + " is no longer available");
      }
      if (e.getFailedOperationIndex() == JOB_WRITE) {
        throw new InvalidJobStateException("Job " + job.jobId() + " is no longer pending");
      }
      throw new InvalidJobStateException("Assignment of job " + job.jobId() + " conflicted");
    }

    logger.log("Assigned job " + job.jobId() + " to technician " + technician.userId());

    events.publish(
        JobEventPublisher.JOB_ASSIGNED,
        new JobAssignedEvent(
            job.jobId(),
            assignment.assignmentId(),
            technician.userId(),
            assignment.assignedBy(),
            job.title(),
            job.priority().value(),
            assignedAt));

    return assignment;
  }
}
