package com.fieldservice.admin.shared;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.fieldservice.admin.handlers.*;
import com.fieldservice.jobs.mappers.RequestMapper;
import com.fieldservice.jobs.service.JobService;
import com.fieldservice.jobs.service.JobServiceFactory;
import com.fieldservice.jobs.shared.ResponseUtil;

/**
 * Router for the /admin API. Every request needs a user id and the ADMIN role, taken from the
 * authorizer claims or the X-User-ID and X-User-Role headers.
 */
public class JobAdminRouter
    implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

  public static final String ADMIN_ROLE = "ADMIN";

  private final JobService jobService;

  public JobAdminRouter() {
    this(JobServiceFactory.fromEnvironment());
  }

  public JobAdminRouter(JobService jobService) {
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
      String userRole = RequestMapper.extractUserRoleFromRequestContext(input);

      if (userId == null) {
        return ResponseUtil.createErrorResponse(401, "Unauthorized: User ID not found");
      }

      if (!ADMIN_ROLE.equalsIgnoreCase(userRole)) {
        context.getLogger().log("Invalid user role for admin operations: " + userRole);
        return ResponseUtil.createErrorResponse(403, "Forbidden: ADMIN role required for admin operations");
      }

      if (path != null && httpMethod != null && path.startsWith("/admin/")) {
        return routeAdminRequest(input, context, path, httpMethod);
      }
      return ResponseUtil.createErrorResponse(404, "Path not found: " + path);

    } catch (Exception e) {
      context.getLogger().log("Error processing request: " + e.getMessage());
      e.printStackTrace();
      return ResponseUtil.createErrorResponse(500, "Internal server error");
    }
  }

  private APIGatewayProxyResponseEvent routeAdminRequest(
      APIGatewayProxyRequestEvent input, Context context, String path, String method) {
    if (path.equals("/admin/jobs/stats") && method.equals("GET")) {
      return new JobStatisticsHandler(jobService).handleRequest(input, context);
    } else if (path.equals("/admin/jobs/attention") && method.equals("GET")) {
      return new JobsRequiringAttentionHandler(jobService).handleRequest(input, context);
    } else if (path.equals("/admin/jobs/bulk-update") && method.equals("POST")) {
      return new BulkUpdateJobsHandler(jobService).handleRequest(input, context);
    } else if (path.matches("/admin/jobs/[^/]+") && method.equals("DELETE")) {
      return new DeleteJobHandler(jobService).handleRequest(input, context);
    } else if (path.matches("/admin/technicians/[^/]+/workload") && method.equals("GET")) {
      return new TechnicianWorkloadHandler(jobService).handleRequest(input, context);
    }
    return ResponseUtil.createErrorResponse(404, "Admin endpoint not found: " + method + " " + path);
  }
}
