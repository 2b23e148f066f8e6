package com.fieldservice.jobs.assignment;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.fieldservice.jobs.JobFixtures;
import com.fieldservice.jobs.entity.AssignmentEntity;
import com.fieldservice.jobs.entity.JobEntity;
import com.fieldservice.jobs.entity.JobStatus;
import com.fieldservice.jobs.events.JobAssignedEvent;
import com.fieldservice.jobs.events.JobEventPublisher;
import com.fieldservice.jobs.exceptions.ErrorCode;
import com.fieldservice.jobs.exceptions.InvalidJobStateException;
import com.fieldservice.jobs.exceptions.JobOperationException;
import com.fieldservice.jobs.exceptions.JobValidationException;
import com.fieldservice.jobs.exceptions.RecordNotFoundException;
import com.fieldservice.jobs.exceptions.TechnicianUnavailableException;
import com.fieldservice.jobs.mappers.AssignmentMapper;
import com.fieldservice.jobs.mappers.JobEntityMapper;
import com.fieldservice.jobs.model.AssignJobRequest;
import com.fieldservice.jobs.store.InMemoryJobStore;
import com.fieldservice.jobs.store.JobStore;
import com.fieldservice.jobs.store.StoreCollections;
import com.fieldservice.jobs.store.StoreQuery;
import com.fieldservice.jobs.store.TransactionConflictException;
import com.fieldservice.jobs.validation.JobValidator;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

class AssignmentServiceTest {

  private JobStore store;
  private JobEventPublisher events;
  private AssignmentService service;

  @BeforeEach
  void setUp() {
    store = new InMemoryJobStore();
    events = mock(JobEventPublisher.class);
    service =
        new AssignmentService(
            store, new JobValidator(JobFixtures.CLOCK), events, JobFixtures.CLOCK, mock(LambdaLogger.class));
  }

  @Test
  void assignsPendingJobAndRecordsAssignment() throws Exception {
    JobFixtures.store(store, JobFixtures.job("job-1", JobStatus.PENDING).build());
    JobFixtures.storeTechnician(store, "tech-1", true, "technician");

    AssignmentEntity assignment = service.assign(request("job-1", "tech-1"));

    JobEntity job = JobEntityMapper.mapToJobEntity(store.get(StoreCollections.JOBS, "job-1"));
    assertEquals(JobStatus.ASSIGNED, job.status());
    assertEquals("tech-1", job.assignedTechnicianId());
    assertEquals("dispatcher-1", job.assignedBy());
    assertEquals(JobFixtures.NOW, job.assignedAt());

    AssignmentEntity stored =
        AssignmentMapper.mapToAssignment(
            store.get(StoreCollections.ASSIGNMENTS, assignment.assignmentId()));
    assertEquals(assignment, stored);
    assertEquals(AssignmentEntity.REASON_MANUAL, stored.assignmentReason());

    verify(events).publish(eq(JobEventPublisher.JOB_ASSIGNED), any(JobAssignedEvent.class));
  }

  @Test
  void missingJobIsNotFound() {
    JobFixtures.storeTechnician(store, "tech-1", true, "technician");

    RecordNotFoundException e =
        assertThrows(RecordNotFoundException.class, () -> service.assign(request("nope", "tech-1")));
    assertEquals("Job", e.getRecordType());
    verifyNoInteractions(events);
  }

  @Test
  void nonPendingJobIsInvalidState() {
    JobFixtures.store(store, JobFixtures.job("job-1", JobStatus.ON_HOLD).build());
    JobFixtures.storeTechnician(store, "tech-1", true, "technician");

    assertThrows(InvalidJobStateException.class, () -> service.assign(request("job-1", "tech-1")));
  }

  @Test
  void missingTechnicianIsNotFound() {
    JobFixtures.store(store, JobFixtures.job("job-1", JobStatus.PENDING).build());

    RecordNotFoundException e =
        assertThrows(RecordNotFoundException.class, () -> service.assign(request("job-1", "ghost")));
    assertEquals("Technician", e.getRecordType());
  }

  @Test
  void inactiveOrWrongRoleTechnicianIsUnavailable() {
    JobFixtures.store(store, JobFixtures.job("job-1", JobStatus.PENDING).build());
    JobFixtures.storeTechnician(store, "tech-off", false, "technician");
    JobFixtures.storeTechnician(store, "dispatcher-2", true, "dispatcher");

    TechnicianUnavailableException inactive =
        assertThrows(TechnicianUnavailableException.class, () -> service.assign(request("job-1", "tech-off")));
    assertEquals(ErrorCode.TECHNICIAN_UNAVAILABLE, inactive.getErrorCode());
    assertThrows(
        TechnicianUnavailableException.class, () -> service.assign(request("job-1", "dispatcher-2")));

    JobEntity job = JobEntityMapper.mapToJobEntity(store.get(StoreCollections.JOBS, "job-1"));
    assertEquals(JobStatus.PENDING, job.status());
  }

  @Test
  void blankIdentifiersFailValidationFirst() {
    JobValidationException e =
        assertThrows(
            JobValidationException.class,
            () -> service.assign(new AssignJobRequest("", "", null, null, null)));
    assertEquals(3, e.getErrors().size());
  }

  @Test
  void technicianDeactivatedAtCommitIsUnavailable() throws Exception {
    JobStore racing = mock(JobStore.class);
    Map<String, AttributeValue> job = JobEntityMapper.toItem(JobFixtures.job("job-1", JobStatus.PENDING).build());
    when(racing.get(StoreCollections.JOBS, "job-1")).thenReturn(job);
    when(racing.get(StoreCollections.USERS, "tech-1"))
        .thenReturn(JobFixtures.technician("tech-1", true, "technician", List.of()));
    doThrow(new TransactionConflictException("condition failed", 1)).when(racing).transaction(any());

    AssignmentService racingService =
        new AssignmentService(
            racing, new JobValidator(JobFixtures.CLOCK), events, JobFixtures.CLOCK, mock(LambdaLogger.class));

    assertThrows(TechnicianUnavailableException.class, () -> racingService.assign(request("job-1", "tech-1")));
    verifyNoInteractions(events);
  }

  @Test
  void concurrentAssignmentsSucceedAtMostOnce() throws Exception {
    JobFixtures.store(store, JobFixtures.job("job-1", JobStatus.PENDING).build());
    for (int i = 0; i < 8; i++) {
      JobFixtures.storeTechnician(store, "tech-" + i, true, "technician");
    }

    ExecutorService executor = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Boolean>> results = new ArrayList<>();
    try {
      for (int i = 0; i < 8; i++) {
        String technicianId = "tech-" + i;
        Callable<Boolean> attempt =
            () -> {
              start.await();
              try {
                service.assign(request("job-1", technicianId));
                return true;
              } catch (JobOperationException e) {
                assertEquals(ErrorCode.INVALID_STATE, e.getErrorCode());
                return false;
              }
            };
        results.add(executor.submit(attempt));
      }
      start.countDown();

      int successes = 0;
      for (Future<Boolean> result : results) {
        if (result.get(10, TimeUnit.SECONDS)) {
          successes++;
        }
      }
      assertEquals(1, successes);
    } finally {
      executor.shutdownNow();
    }

    assertEquals(1, store.query(StoreCollections.ASSIGNMENTS, StoreQuery.builder().build()).size());
  }

  private static AssignJobRequest request(String jobId, String technicianId) {
    return new AssignJobRequest(jobId, technicianId, "dispatcher-1", null, "Bring the long ladder");
  }
}
