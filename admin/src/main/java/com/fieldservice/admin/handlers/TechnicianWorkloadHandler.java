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

/**
 * Handler for GET /admin/technicians/{technicianId}/workload
 */
public class TechnicianWorkloadHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

    private final JobService jobService;

    public TechnicianWorkloadHandler() {
        this(JobServiceFactory.fromEnvironment());
    }

    public TechnicianWorkloadHandler(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent input, Context context) {
        try {
            String technicianId = RequestMapper.extractPathParameter(input, "technicianId", 3);
            if (technicianId == null) {
                return ResponseUtil.createErrorResponse(400, "Technician ID not found in path");
            }
            return ResponseUtil.createSuccessResponse(200, jobService.getWorkload(technicianId));

        } catch (JobOperationException e) {
            return ResponseUtil.createErrorResponse(e);
        } catch (StoreFailureException e) {
            context.getLogger().log("Store failure computing workload: " + e.getMessage());
            return ResponseUtil.createErrorResponse(e);
        } catch (Exception e) {
            context.getLogger().log("Error computing workload: " + e.getMessage());
            e.printStackTrace();
            return ResponseUtil.createErrorResponse(500, "Internal server error");
        }
    }
}
