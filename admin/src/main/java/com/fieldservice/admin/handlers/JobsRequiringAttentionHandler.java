package com.fieldservice.admin.handlers;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.fieldservice.jobs.entity.JobEntity;
import com.fieldservice.jobs.exceptions.StoreFailureException;
import com.fieldservice.jobs.service.JobService;
import com.fieldservice.jobs.service.JobServiceFactory;
import com.fieldservice.jobs.shared.ResponseUtil;
import java.util.List;
import java.util.Map;

/**
 * Handler for GET /admin/jobs/attention
 * Lists urgent open jobs, overdue scheduled jobs and jobs on hold
 */
public class JobsRequiringAttentionHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

    private final JobService jobService;

    public JobsRequiringAttentionHandler() {
        this(JobServiceFactory.fromEnvironment());
    }

    public JobsRequiringAttentionHandler(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent input, Context context) {
        try {
            List<JobEntity> jobs = jobService.getJobsRequiringAttention();
            context.getLogger().log(jobs.size() + " jobs require attention");
            return ResponseUtil.createSuccessResponse(200, Map.of("jobs", jobs, "count", jobs.size()));

        } catch (StoreFailureException e) {
            context.getLogger().log("Store failure listing attention jobs: " + e.getMessage());
            return ResponseUtil.createErrorResponse(e);
        } catch (Exception e) {
            context.getLogger().log("Error listing attention jobs: " + e.getMessage());
            e.printStackTrace();
            return ResponseUtil.createErrorResponse(500, "Internal server error");
        }
    }
}
