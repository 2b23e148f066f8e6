package com.fieldservice.jobs.dispatchers;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldservice.jobs.entity.AssignmentEntity;
import com.fieldservice.jobs.exceptions.JobOperationException;
import com.fieldservice.jobs.exceptions.StoreFailureException;
import com.fieldservice.jobs.mappers.RequestMapper;
import com.fieldservice.jobs.model.AssignJobRequest;
import com.fieldservice.jobs.service.JobService;
import com.fieldservice.jobs.service.JobServiceFactory;
import com.fieldservice.jobs.shared.ObjectMapperFactory;
import com.fieldservice.jobs.shared.ResponseUtil;

/**
 * Handler for POST /jobs/{jobId}/assign
 * Body: {"technicianId": "...", "notes": "..."}; the caller is recorded as assignedBy
 */
public class AssignJobHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

    private final JobService jobService;
    private final ObjectMapper objectMapper;

    public AssignJobHandler() {
        this(JobServiceFactory.fromEnvironment());
    }

    public AssignJobHandler(JobService jobService) {
        this.jobService = jobService;
        this.objectMapper = ObjectMapperFactory.create();
    }

    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent input, Context context) {
        try {
            String jobId = RequestMapper.extractPathParameter(input, "jobId", 2);
            String userId = RequestMapper.extractUserIdFromRequestContext(input);

            if (jobId == null) {
                return ResponseUtil.createErrorResponse(400, "Job ID not found in path");
            }
            if (userId == null) {
                return ResponseUtil.createErrorResponse(401, "Unauthorized: User ID not found");
            }

            AssignJobRequest body = RequestMapper.readBody(input, objectMapper, AssignJobRequest.class);
            AssignJobRequest request = new AssignJobRequest(jobId, body.technicianId(), userId, null, body.notes());

            context.getLogger().log("Assigning job " + jobId + " to technician " + body.technicianId());

            AssignmentEntity assignment = jobService.assign(request);
            return ResponseUtil.createSuccessResponse(200, assignment);

        } catch (JobOperationException e) {
            context.getLogger().log("Assignment rejected: " + e.getErrors());
            return ResponseUtil.createErrorResponse(e);
        } catch (StoreFailureException e) {
            context.getLogger().log("Store failure assigning job: " + e.getMessage());
            return ResponseUtil.createErrorResponse(e);
        } catch (Exception e) {
            context.getLogger().log("Error assigning job: " + e.getMessage());
            e.printStackTrace();
            return ResponseUtil.createErrorResponse(500, "Internal server error");
        }
    }
}
