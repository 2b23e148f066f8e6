package com.fieldservice.jobs.status;

import static org.junit.jupiter.api.Assertions.*;

import com.fieldservice.jobs.JobFixtures;
import com.fieldservice.jobs.entity.JobEntity;
import com.fieldservice.jobs.entity.JobStatus;
import com.fieldservice.jobs.exceptions.ErrorCode;
import com.fieldservice.jobs.exceptions.InvalidTransitionException;
import com.fieldservice.jobs.exceptions.JobValidationException;
import com.fieldservice.jobs.model.UpdateJobRequest;
import com.fieldservice.jobs.validation.JobValidator;
import java.time.Instant;
import java.util.Set;
import org.junit.jupiter.api.Test;

class JobStatusMachineTest {

  private final JobStatusMachine machine =
      new JobStatusMachine(new JobValidator(JobFixtures.CLOCK), JobFixtures.CLOCK);

  @Test
  void everyPairOutsideTheTableIsRejected() throws Exception {
    for (JobStatus from : JobStatus.values()) {
      Set<JobStatus> allowed = JobValidator.allowedTransitions(from);
      for (JobStatus to : JobStatus.values()) {
        JobEntity job = JobFixtures.job("job-1", from).build();
        if (allowed.contains(to)) {
          assertEquals(to, machine.transition(job, to, null).status());
        } else {
          InvalidTransitionException e =
              assertThrows(InvalidTransitionException.class, () -> machine.transition(job, to, null));
          assertEquals(ErrorCode.INVALID_TRANSITION, e.getErrorCode());
        }
      }
    }
  }

  @Test
  void terminalStatusesHaveNoExits() {
    assertTrue(JobValidator.allowedTransitions(JobStatus.COMPLETED).isEmpty());
    assertTrue(JobValidator.allowedTransitions(JobStatus.CANCELLED).isEmpty());
    assertTrue(JobStatus.COMPLETED.isTerminal());
    assertFalse(JobStatus.ON_HOLD.isTerminal());
  }

  @Test
  void selfTransitionIsRejected() {
    JobEntity job = JobFixtures.job("job-1", JobStatus.ASSIGNED).build();

    assertThrows(InvalidTransitionException.class, () -> machine.transition(job, JobStatus.ASSIGNED, null));
  }

  @Test
  void startStampsStartedAtOnce() throws Exception {
    JobEntity assigned = JobFixtures.job("job-1", JobStatus.ASSIGNED).build();

    JobEntity started = machine.transition(assigned, JobStatus.IN_PROGRESS, null);
    assertEquals(JobFixtures.NOW, started.startedAt());

    Instant earlier = Instant.parse("2026-03-01T08:00:00Z");
    JobEntity resumed =
        machine.transition(
            JobFixtures.job("job-2", JobStatus.ON_HOLD).startedAt(earlier).build(),
            JobStatus.IN_PROGRESS,
            null);
    assertEquals(earlier, resumed.startedAt());
  }

  @Test
  void completionStampsCompletedAtAndValidatesPayload() throws Exception {
    JobEntity inProgress = JobFixtures.job("job-1", JobStatus.IN_PROGRESS).build();

    JobEntity completed =
        machine.transition(
            inProgress,
            JobStatus.COMPLETED,
            new UpdateJobRequest("completed", null, null, 45, "Replaced valve", null, null, null));
    assertEquals(JobFixtures.NOW, completed.completedAt());

    UpdateJobRequest invalid =
        new UpdateJobRequest("completed", null, null, 0, null, null, null, null);
    assertThrows(
        JobValidationException.class,
        () -> machine.transition(inProgress, JobStatus.COMPLETED, invalid));
  }
}
