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
import com.fieldservice.jobs.model.CreateJobRequest;
import com.fieldservice.jobs.service.JobService;
import com.fieldservice.jobs.service.JobServiceFactory;
import com.fieldservice.jobs.shared.ObjectMapperFactory;
import com.fieldservice.jobs.shared.ResponseUtil;

/**
 * Handler for POST /jobs
 * Flow: Validate → Sanitize → Store as pending → Publish job.created → Return the job
 */
public class CreateJobHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

    private final JobService jobService;
    private final ObjectMapper objectMapper;

    public CreateJobHandler() {
        this(JobServiceFactory.fromEnvironment());
    }

    public CreateJobHandler(JobService jobService) {
        this.jobService = jobService;
        this.objectMapper = ObjectMapperFactory.create();
    }

    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent input, Context context) {
        try {
            String userId = RequestMapper.extractUserIdFromRequestContext(input);
            if (userId == null) {
                return ResponseUtil.createErrorResponse(401, "Unauthorized: User ID not found");
            }

            CreateJobRequest request = RequestMapper.readBody(input, objectMapper, CreateJobRequest.class)
                    .withCreatedBy(userId);

            context.getLogger().log("Creating job for dispatcher: " + userId + ", type: " + request.type());

            JobEntity job = jobService.create(request);
            return ResponseUtil.createSuccessResponse(201, job);

        } catch (JobOperationException e) {
            context.getLogger().log("Job creation rejected: " + e.getErrors());
            return ResponseUtil.createErrorResponse(e);
        } catch (StoreFailureException e) {
            context.getLogger().log("Store failure creating job: " + e.getMessage());
            return ResponseUtil.createErrorResponse(e);
        } catch (Exception e) {
            context.getLogger().log("Error creating job: " + e.getMessage());
            e.printStackTrace();
            return ResponseUtil.createErrorResponse(500, "Internal server error");
        }
    }
}
