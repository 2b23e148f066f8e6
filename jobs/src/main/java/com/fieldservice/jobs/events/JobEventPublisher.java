package com.fieldservice.jobs.events;

/**
 * Publishes job domain events. Publishing is best effort: implementations log failures and
 * never throw, so a lost event cannot undo a committed write.
 */
@FunctionalInterface
public interface JobEventPublisher {

  String JOB_CREATED = "job.created";
  String JOB_ASSIGNED = "job.assigned";
  String JOB_STATUS_CHANGED = "job.status_changed";
  String JOB_DELETED = "job.deleted";

  void publish(String detailType, Object event);

  static JobEventPublisher disabled() {
    return (detailType, event) -> {};
  }
}
