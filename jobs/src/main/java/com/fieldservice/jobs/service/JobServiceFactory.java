package com.fieldservice.jobs.service;

import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.LambdaRuntime;
import com.fieldservice.jobs.config.JobsConfig;
import com.fieldservice.jobs.events.EventBridgeJobEventPublisher;
import com.fieldservice.jobs.events.JobEventPublisher;
import com.fieldservice.jobs.shared.ObjectMapperFactory;
import com.fieldservice.jobs.store.DynamoDbJobStore;
import java.time.Clock;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.eventbridge.EventBridgeClient;

/** Wires a {@link JobService} against DynamoDB and EventBridge from the Lambda environment */
public final class JobServiceFactory {

  private JobServiceFactory() {}

  public static JobService fromEnvironment() {
    return create(JobsConfig.fromEnvironment(), LambdaRuntime.getLogger());
  }

  public static JobService create(JobsConfig config, LambdaLogger logger) {
    DynamoDbJobStore store = new DynamoDbJobStore(DynamoDbClient.create(), config.tableNames());

    JobEventPublisher events;
    if (config.eventsEnabled()) {
      events =
          new EventBridgeJobEventPublisher(
              EventBridgeClient.create(), ObjectMapperFactory.create(), config.eventBusName(), logger);
    } else {
      logger.log("EVENT_BUS_NAME not set, job events are disabled");
      events = JobEventPublisher.disabled();
    }
    return new JobService(store, events, Clock.systemUTC(), logger, config);
  }
}
