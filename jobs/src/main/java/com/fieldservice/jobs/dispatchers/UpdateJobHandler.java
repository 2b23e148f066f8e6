package com.fieldservice.jobs.dispatchers;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldservice.jobs.entity.JobEntity;
import com.fieldservice.jobs.exceptions.JobOperationException;
import com.fieldservice.jobs.exceptions.StoreFailureException;
import com.fieldservice.jobs.mappers.RequestMapper;
import com.fieldservice.jobs.model.UpdateJobRequest;
import com.fieldservice.jobs.service.JobService;
import com.fieldservice.jobs.service.JobServiceFactory;
import com.fieldservice.jobs.shared.ObjectMapperFactory;
import com.fieldservice.jobs.shared.ResponseUtil;

/**
 * Handler for PUT /jobs/{jobId}
 * Status changes go through the transition table; notes are appended
 */
public class UpdateJobHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

    private final JobService jobService;
    private final ObjectMapper objectMapper;

    public UpdateJobHandler() {
        this(JobServiceFactory.fromEnvironment());
    }

    public UpdateJobHandler(JobService jobService) {
        this.jobService = jobService;
        this.objectMapper = ObjectMapperFactory.create();
    }

    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent input, Context context) {
        try {
            String jobId = RequestMapper.extractPathParameter(input, "jobId", 2);
            if (jobId == null) {
                return ResponseUtil.createErrorResponse(400, "Job ID not found in path");
            }

            UpdateJobRequest update = RequestMapper.readBody(input, objectMapper, UpdateJobRequest.class);
            context.getLogger().log("Updating job " + jobId + (update.status() != null ? " to status " + update.status() : ""));

            JobEntity job = jobService.update(jobId, update);
            return ResponseUtil.createSuccessResponse(200, job);

        } catch (JobOperationException e) {
            context.getLogger().log("Job update rejected: " + e.getErrors());
            return ResponseUtil.createErrorResponse(e);
        } catch (StoreFailureException e) {
            context.getLogger().log("Store failure updating job: " + e.getMessage());
            return ResponseUtil.createErrorResponse(e);
        } catch (Exception e) {
            context.getLogger().log("Error updating job: " + e.getMessage());
            e.printStackTrace();
            return ResponseUtil.createErrorResponse(500, "Internal server error");
        }
    }
}
