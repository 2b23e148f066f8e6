package com.fieldservice.jobs.technicians;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.fieldservice.jobs.entity.JobEntity;
import com.fieldservice.jobs.exceptions.JobOperationException;
import com.fieldservice.jobs.exceptions.StoreFailureException;
import com.fieldservice.jobs.mappers.RequestMapper;
import com.fieldservice.jobs.service.JobService;
import com.fieldservice.jobs.service.JobServiceFactory;
import com.fieldservice.jobs.shared.ResponseUtil;
import java.util.List;
import java.util.Map;

/**
 * Handler for GET /technicians/{technicianId}/jobs
 * Returns the technician's jobs by scheduled date, optionally filtered by status
 */
public class TechnicianJobsHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

    private final JobService jobService;

    public TechnicianJobsHandler() {
        this(JobServiceFactory.fromEnvironment());
    }

    public TechnicianJobsHandler(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent input, Context context) {
        try {
            String technicianId = RequestMapper.extractPathParameter(input, "technicianId", 2);
            if (technicianId == null) {
                return ResponseUtil.createErrorResponse(400, "Technician ID not found in path");
            }

            List<JobEntity> jobs = jobService.getTechnicianJobs(technicianId, RequestMapper.toStatuses(input));

            context.getLogger().log("Found " + jobs.size() + " jobs for technician " + technicianId);
            return ResponseUtil.createSuccessResponse(200, Map.of(
                    "technicianId", technicianId,
                    "jobs", jobs,
                    "count", jobs.size()));

        } catch (JobOperationException e) {
            return ResponseUtil.createErrorResponse(e);
        } catch (StoreFailureException e) {
            context.getLogger().log("Store failure reading technician jobs: " + e.getMessage());
            return ResponseUtil.createErrorResponse(e);
        } catch (Exception e) {
            context.getLogger().log("Error getting technician jobs: " + e.getMessage());
            e.printStackTrace();
            return ResponseUtil.createErrorResponse(500, "Internal server error");
        }
    }
}
