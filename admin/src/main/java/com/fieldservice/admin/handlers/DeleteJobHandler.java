package com.fieldservice.admin.handlers;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.fieldservice.jobs.exceptions.JobOperationException;
import com.fieldservice.jobs.exceptions.StoreFailureException;
import com.fieldservice.jobs.mappers.RequestMapper;
import com.fieldservice.jobs.service.JobService;
import com.fieldservice.jobs.service.JobServiceFactory;
import com.fieldservice.jobs.shared.ResponseUtil;
import java.util.Map;

/**
 * Handler for DELETE /admin/jobs/{jobId}
 * Removes the job record and publishes job.deleted (Admin only)
 */
public class DeleteJobHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

    private final JobService jobService;

    public DeleteJobHandler() {
        this(JobServiceFactory.fromEnvironment());
    }

    public DeleteJobHandler(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent input, Context context) {
        try {
            String jobId = RequestMapper.extractPathParameter(input, "jobId", 3);
            if (jobId == null) {
                return ResponseUtil.createErrorResponse(400, "Job ID not found in path");
            }

            context.getLogger().log("Admin deleting job: " + jobId);
            jobService.delete(jobId);

            return ResponseUtil.createSuccessResponse(200, Map.of(
                    "message", "Job deleted successfully",
                    "jobId", jobId));

        } catch (JobOperationException e) {
            return ResponseUtil.createErrorResponse(e);
        } catch (StoreFailureException e) {
            context.getLogger().log("Store failure deleting job: " + e.getMessage());
            return ResponseUtil.createErrorResponse(e);
        } catch (Exception e) {
            context.getLogger().log("Error deleting job: " + e.getMessage());
            e.printStackTrace();
            return ResponseUtil.createErrorResponse(500, "Internal server error");
        }
    }
}
