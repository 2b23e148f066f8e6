package com.fieldservice.jobs.events;

import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import software.amazon.awssdk.services.eventbridge.EventBridgeClient;
import software.amazon.awssdk.services.eventbridge.model.PutEventsRequest;
import software.amazon.awssdk.services.eventbridge.model.PutEventsRequestEntry;
import software.amazon.awssdk.services.eventbridge.model.PutEventsResponse;

/** Sends job events to an EventBridge bus with source {@value #SOURCE} */
@RequiredArgsConstructor
public class EventBridgeJobEventPublisher implements JobEventPublisher {

  public static final String SOURCE = "jobs-service";

  private final EventBridgeClient eventBridgeClient;
  private final ObjectMapper objectMapper;
  private final String eventBusName;
  private final LambdaLogger logger;

  @Override
  public void publish(String detailType, Object event) {
    try {
      String eventJson = objectMapper.writeValueAsString(event);

      PutEventsRequestEntry eventEntry =
          PutEventsRequestEntry.builder()
              .source(SOURCE)
              .detailType(detailType)
              .detail(eventJson)
              .eventBusName(eventBusName)
              .build();

      PutEventsResponse response =
          eventBridgeClient.putEvents(PutEventsRequest.builder().entries(eventEntry).build());

      if (response.failedEntryCount() != null && response.failedEntryCount() > 0) {
        logger.log("Failed to publish " + detailType + " event: " + response.entries());
      } else {
        logger.log("Successfully published " + detailType + " event");
      }

    } catch (Exception e) {
      logger.log("Error publishing " + detailType + " event: " + e.getMessage());
    }
  }
}
