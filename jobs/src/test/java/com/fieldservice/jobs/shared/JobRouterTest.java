package com.fieldservice.jobs.shared;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldservice.jobs.JobFixtures;
import com.fieldservice.jobs.entity.AssignmentEntity;
import com.fieldservice.jobs.entity.JobStatus;
import com.fieldservice.jobs.exceptions.InvalidTransitionException;
import com.fieldservice.jobs.exceptions.RecordNotFoundException;
import com.fieldservice.jobs.exceptions.StoreFailureException;
import com.fieldservice.jobs.model.AssignJobRequest;
import com.fieldservice.jobs.model.CreateJobRequest;
import com.fieldservice.jobs.model.JobPage;
import com.fieldservice.jobs.model.SearchRequest;
import com.fieldservice.jobs.model.UpdateJobRequest;
import com.fieldservice.jobs.service.JobService;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class JobRouterTest {

  private final ObjectMapper objectMapper = ObjectMapperFactory.create();

  private JobService jobService;
  private Context context;
  private JobRouter router;

  @BeforeEach
  void setUp() {
    jobService = mock(JobService.class);
    context = mock(Context.class);
    when(context.getLogger()).thenReturn(mock(LambdaLogger.class));
    router = new JobRouter(jobService);
  }

  @Test
  void preflightNeedsNoIdentity() {
    APIGatewayProxyResponseEvent response =
        router.handleRequest(new APIGatewayProxyRequestEvent().withHttpMethod("OPTIONS").withPath("/jobs"), context);

    assertEquals(200, response.getStatusCode());
    assertEquals("*", response.getHeaders().get("Access-Control-Allow-Origin"));
    verifyNoInteractions(jobService);
  }

  @Test
  void missingIdentityIsUnauthorized() {
    APIGatewayProxyResponseEvent response =
        router.handleRequest(new APIGatewayProxyRequestEvent().withHttpMethod("GET").withPath("/jobs"), context);

    assertEquals(401, response.getStatusCode());
  }

  @Test
  void createUsesCallerAsCreator() throws Exception {
    when(jobService.create(any(CreateJobRequest.class)))
        .thenReturn(JobFixtures.job("job-1", JobStatus.PENDING).build());
    CreateJobRequest body = JobFixtures.createRequest().withCreatedBy(null);

    APIGatewayProxyResponseEvent response =
        router.handleRequest(request("POST", "/jobs").withBody(objectMapper.writeValueAsString(body)), context);

    assertEquals(201, response.getStatusCode());
    assertEquals("job-1", json(response).get("jobId").asText());
    ArgumentCaptor<CreateJobRequest> created = ArgumentCaptor.forClass(CreateJobRequest.class);
    verify(jobService).create(created.capture());
    assertEquals("dispatcher-1", created.getValue().createdBy());
  }

  @Test
  void searchIsNotMistakenForJobId() {
    when(jobService.search(any(SearchRequest.class))).thenReturn(new JobPage(List.of(), false, null));

    APIGatewayProxyResponseEvent response =
        router.handleRequest(
            request("GET", "/jobs/search").withQueryStringParameters(Map.of("sortBy", "priority", "sortOrder", "asc")),
            context);

    assertEquals(200, response.getStatusCode());
    ArgumentCaptor<SearchRequest> search = ArgumentCaptor.forClass(SearchRequest.class);
    verify(jobService).search(search.capture());
    assertEquals(SearchRequest.SortField.PRIORITY, search.getValue().sortBy());
    assertFalse(search.getValue().descending());
  }

  @Test
  void missingJobIsNotFound() throws Exception {
    when(jobService.getById("job-404")).thenThrow(RecordNotFoundException.job("job-404"));

    APIGatewayProxyResponseEvent response = router.handleRequest(request("GET", "/jobs/job-404"), context);

    assertEquals(404, response.getStatusCode());
    assertEquals("Job not found: job-404", json(response).get("error").asText());
  }

  @Test
  void invalidTransitionIsConflictWithDetails() throws Exception {
    when(jobService.update(eq("job-1"), any(UpdateJobRequest.class)))
        .thenThrow(new InvalidTransitionException("Invalid status transition from pending to completed"));

    APIGatewayProxyResponseEvent response =
        router.handleRequest(request("PUT", "/jobs/job-1").withBody("{\"status\":\"completed\"}"), context);

    assertEquals(409, response.getStatusCode());
    assertEquals(
        "Invalid status transition from pending to completed",
        json(response).get("details").get(0).asText());
  }

  @Test
  void malformedBodyIsBadRequest() {
    APIGatewayProxyResponseEvent response =
        router.handleRequest(request("PUT", "/jobs/job-1").withBody("{not json"), context);

    assertEquals(400, response.getStatusCode());
    verifyNoInteractions(jobService);
  }

  @Test
  void assignRecordsCallerAsAssigner() throws Exception {
    when(jobService.assign(any(AssignJobRequest.class)))
        .thenReturn(new AssignmentEntity("as-1", "job-1", "tech-1", "dispatcher-1", JobFixtures.NOW, null, "manual"));

    APIGatewayProxyResponseEvent response =
        router.handleRequest(
            request("POST", "/jobs/job-1/assign").withBody("{\"technicianId\":\"tech-1\",\"assignedBy\":\"someone-else\"}"),
            context);

    assertEquals(200, response.getStatusCode());
    ArgumentCaptor<AssignJobRequest> assigned = ArgumentCaptor.forClass(AssignJobRequest.class);
    verify(jobService).assign(assigned.capture());
    assertEquals("job-1", assigned.getValue().jobId());
    assertEquals("tech-1", assigned.getValue().technicianId());
    assertEquals("dispatcher-1", assigned.getValue().assignedBy());
  }

  @Test
  void storeFailureIsServerError() {
    when(jobService.list(any(), any(), any())).thenThrow(new StoreFailureException("Error querying jobs"));

    APIGatewayProxyResponseEvent response = router.handleRequest(request("GET", "/jobs"), context);

    assertEquals(500, response.getStatusCode());
  }

  @Test
  void technicianRoutes() throws Exception {
    when(jobService.recommend(eq("tech-1"), anyInt())).thenReturn(List.of());
    when(jobService.getTechnicianJobs(eq("tech-1"), any())).thenReturn(List.of());

    assertEquals(200, router.handleRequest(request("GET", "/technicians/tech-1/recommendations"), context).getStatusCode());
    assertEquals(200, router.handleRequest(request("GET", "/technicians/tech-1/jobs"), context).getStatusCode());
    verify(jobService).recommend("tech-1", 10);
  }

  @Test
  void unknownPathIsNotFound() {
    assertEquals(404, router.handleRequest(request("DELETE", "/jobs/job-1"), context).getStatusCode());
    assertEquals(404, router.handleRequest(request("GET", "/invoices"), context).getStatusCode());
  }

  private static APIGatewayProxyRequestEvent request(String method, String path) {
    return new APIGatewayProxyRequestEvent()
        .withHttpMethod(method)
        .withPath(path)
        .withHeaders(Map.of("X-User-ID", "dispatcher-1"));
  }

  private JsonNode json(APIGatewayProxyResponseEvent response) throws Exception {
    return objectMapper.readTree(response.getBody());
  }
}
