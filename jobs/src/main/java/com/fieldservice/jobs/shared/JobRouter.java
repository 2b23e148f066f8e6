package com.fieldservice.jobs.shared;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.fieldservice.jobs.dispatchers.*;
import com.fieldservice.jobs.mappers.RequestMapper;
import com.fieldservice.jobs.service.JobService;
import com.fieldservice.jobs.service.JobServiceFactory;
import com.fieldservice.jobs.technicians.RecommendationsHandler;
import com.fieldservice.jobs.technicians.TechnicianJobsHandler;

/**
 * Main router that handles all job-related API Gateway requests. Routes to the dispatcher
 * handlers under /jobs and the technician handlers under /technicians.
 */
public class JobRouter
    implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

  private final JobService jobService;

  public JobRouter() {
    this(JobServiceFactory.fromEnvironment());
  }

  public JobRouter(JobService jobService) {
    this.jobService = jobService;
  }

  @Override
  public APIGatewayProxyResponseEvent handleRequest(
      APIGatewayProxyRequestEvent input, Context context) {
    try {
      String path = input.getPath();
      String httpMethod = input.getHttpMethod();

      context.getLogger().log("Processing request: " + httpMethod + " " + path);

      // Handle OPTIONS preflight requests for CORS
      if ("OPTIONS".equals(httpMethod)) {
        return ResponseUtil.createPreflightResponse();
      }

      String userId = RequestMapper.extractUserIdFromRequestContext(input);
      if (userId == null) {
        return ResponseUtil.createErrorResponse(401, "Unauthorized: User ID not found");
      }

      if (path == null || httpMethod == null) {
        return ResponseUtil.createErrorResponse(400, "Missing path or method");
      }

      if (path.startsWith("/jobs")) {
        return routeJobRequest(input, context, path, httpMethod);
      } else if (path.startsWith("/technicians/")) {
        return routeTechnicianRequest(input, context, path, httpMethod);
      } else {
        context.getLogger().log("Path not found: " + path);
        return ResponseUtil.createErrorResponse(404, "Path not found: " + path);
      }

    } catch (Exception e) {
      context.getLogger().log("Error processing request: " + e.getMessage());
      e.printStackTrace();
      return ResponseUtil.createErrorResponse(500, "Internal server error");
    }
  }

  private APIGatewayProxyResponseEvent routeJobRequest(
      APIGatewayProxyRequestEvent input, Context context, String path, String method) {
    if (path.equals("/jobs") && method.equals("POST")) {
      return new CreateJobHandler(jobService).handleRequest(input, context);
    } else if (path.equals("/jobs") && method.equals("GET")) {
      return new ListJobsHandler(jobService).handleRequest(input, context);
    } else if (path.equals("/jobs/search") && method.equals("GET")) {
      return new SearchJobsHandler(jobService).handleRequest(input, context);
    } else if (path.equals("/jobs/nearby") && method.equals("GET")) {
      return new NearbyJobsHandler(jobService).handleRequest(input, context);
    } else if (path.matches("/jobs/[^/]+") && method.equals("GET")) {
      return new ViewJobHandler(jobService).handleRequest(input, context);
    } else if (path.matches("/jobs/[^/]+") && method.equals("PUT")) {
      return new UpdateJobHandler(jobService).handleRequest(input, context);
    } else if (path.matches("/jobs/[^/]+/assign") && method.equals("POST")) {
      return new AssignJobHandler(jobService).handleRequest(input, context);
    }
    return ResponseUtil.createErrorResponse(404, "Job endpoint not found: " + method + " " + path);
  }

  private APIGatewayProxyResponseEvent routeTechnicianRequest(
      APIGatewayProxyRequestEvent input, Context context, String path, String method) {
    if (path.matches("/technicians/[^/]+/jobs") && method.equals("GET")) {
      return new TechnicianJobsHandler(jobService).handleRequest(input, context);
    } else if (path.matches("/technicians/[^/]+/recommendations") && method.equals("GET")) {
      return new RecommendationsHandler(jobService).handleRequest(input, context);
    }
    return ResponseUtil.createErrorResponse(
        404, "Technician endpoint not found: " + method + " " + path);
  }
}
