package com.fieldservice.jobs.status;

import com.fieldservice.jobs.entity.JobEntity;
import com.fieldservice.jobs.entity.JobStatus;
import com.fieldservice.jobs.exceptions.InvalidTransitionException;
import com.fieldservice.jobs.exceptions.JobValidationException;
import com.fieldservice.jobs.model.UpdateJobRequest;
import com.fieldservice.jobs.model.ValidationResult;
import com.fieldservice.jobs.validation.JobValidator;
import java.time.Clock;
import java.time.Instant;

/**
 * Applies guarded status transitions. Entering in_progress stamps startedAt and entering
 * completed stamps completedAt, each only when not already set.
 */
public class JobStatusMachine {

  private final JobValidator validator;
  private final Clock clock;

  public JobStatusMachine(JobValidator validator, Clock clock) {
    this.validator = validator;
    this.clock = clock;
  }

  /**
   * Moves a job to a new status
   *
   * @param job the job as currently stored
   * @param next requested status
   * @param completion payload checked when the job is being completed; may be null otherwise
   * @return the job with the new status and any stamped timestamps
   * @throws InvalidTransitionException when the table does not allow the move, including
   *     self-transitions and any move out of a terminal status
   * @throws JobValidationException when completing with an invalid completion payload
   */
  public JobEntity transition(JobEntity job, JobStatus next, UpdateJobRequest completion)
      throws InvalidTransitionException, JobValidationException {
    ValidationResult transition = validator.validateStatusTransition(job.status(), next);
    if (!transition.isValid()) {
      throw new InvalidTransitionException(transition.errors());
    }

    Instant now = clock.instant();
    JobEntity.Builder updated = job.toBuilder().status(next);

    if (next == JobStatus.IN_PROGRESS && job.startedAt() == null) {
      updated.startedAt(now);
    }
    if (next == JobStatus.COMPLETED) {
      if (completion != null) {
        ValidationResult result = validator.validateJobCompletion(completion);
        if (!result.isValid()) {
          throw new JobValidationException(result.errors());
        }
      }
      if (job.completedAt() == null) {
        updated.completedAt(now);
      }
    }
    return updated.build();
  }
}
