package com.fieldservice.admin.handlers;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldservice.jobs.entity.JobEntity;
import com.fieldservice.jobs.entity.JobStatus;
import com.fieldservice.jobs.exceptions.InvalidTransitionException;
import com.fieldservice.jobs.model.JobUpdateEntry;
import com.fieldservice.jobs.service.JobService;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class BulkUpdateJobsHandlerTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  private JobService jobService;
  private Context context;
  private BulkUpdateJobsHandler handler;

  @BeforeEach
  void setUp() {
    jobService = mock(JobService.class);
    context = mock(Context.class);
    when(context.getLogger()).thenReturn(mock(LambdaLogger.class));
    handler = new BulkUpdateJobsHandler(jobService);
  }

  @Test
  @SuppressWarnings("unchecked")
  void acceptsBareArray() throws Exception {
    when(jobService.bulkUpdate(anyList()))
        .thenReturn(List.of(JobEntity.builder().jobId("job-1").status(JobStatus.ON_HOLD).build()));

    APIGatewayProxyResponseEvent response =
        handler.handleRequest(
            body("[{\"jobId\":\"job-1\",\"update\":{\"status\":\"on_hold\",\"note\":\"waiting on parts\"}}]"),
            context);

    assertEquals(200, response.getStatusCode());
    JsonNode json = objectMapper.readTree(response.getBody());
    assertEquals(1, json.get("updated").asInt());
    assertEquals("on_hold", json.get("jobs").get(0).get("status").asText());

    ArgumentCaptor<List<JobUpdateEntry>> entries = ArgumentCaptor.forClass(List.class);
    verify(jobService).bulkUpdate(entries.capture());
    assertEquals("job-1", entries.getValue().get(0).jobId());
    assertEquals("waiting on parts", entries.getValue().get(0).update().note());
  }

  @Test
  @SuppressWarnings("unchecked")
  void acceptsWrappedUpdates() throws Exception {
    when(jobService.bulkUpdate(anyList())).thenReturn(List.of());

    APIGatewayProxyResponseEvent response =
        handler.handleRequest(
            body("{\"updates\":[{\"jobId\":\"job-1\",\"update\":{\"status\":\"cancelled\"}},"
                + "{\"jobId\":\"job-2\",\"update\":{\"status\":\"cancelled\"}}]}"),
            context);

    assertEquals(200, response.getStatusCode());
    ArgumentCaptor<List<JobUpdateEntry>> entries = ArgumentCaptor.forClass(List.class);
    verify(jobService).bulkUpdate(entries.capture());
    assertEquals(2, entries.getValue().size());
  }

  @Test
  void rejectsBodyWithoutUpdates() {
    assertEquals(400, handler.handleRequest(body("{\"jobId\":\"job-1\"}"), context).getStatusCode());
    assertEquals(400, handler.handleRequest(body("not json"), context).getStatusCode());
    assertEquals(400, handler.handleRequest(body("[{\"jobId\":{\"nested\":true}}]"), context).getStatusCode());
    verifyNoInteractions(jobService);
  }

  @Test
  void rejectedBatchReportsEveryError() throws Exception {
    when(jobService.bulkUpdate(anyList()))
        .thenThrow(new InvalidTransitionException(List.of(
            "job-1: Invalid status transition from completed to pending")));

    APIGatewayProxyResponseEvent response =
        handler.handleRequest(body("[{\"jobId\":\"job-1\",\"update\":{\"status\":\"pending\"}}]"), context);

    assertEquals(409, response.getStatusCode());
    assertEquals(1, objectMapper.readTree(response.getBody()).get("details").size());
  }

  private static APIGatewayProxyRequestEvent body(String json) {
    return new APIGatewayProxyRequestEvent()
        .withHttpMethod("POST")
        .withPath("/admin/jobs/bulk-update")
        .withBody(json);
  }
}
