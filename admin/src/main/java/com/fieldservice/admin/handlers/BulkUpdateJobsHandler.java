package com.fieldservice.admin.handlers;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldservice.jobs.entity.JobEntity;
import com.fieldservice.jobs.exceptions.JobOperationException;
import com.fieldservice.jobs.exceptions.JobValidationException;
import com.fieldservice.jobs.exceptions.StoreFailureException;
import com.fieldservice.jobs.mappers.RequestMapper;
import com.fieldservice.jobs.model.JobUpdateEntry;
import com.fieldservice.jobs.service.JobService;
import com.fieldservice.jobs.service.JobServiceFactory;
import com.fieldservice.jobs.shared.ObjectMapperFactory;
import com.fieldservice.jobs.shared.ResponseUtil;
import java.util.List;
import java.util.Map;

/**
 * Handler for POST /admin/jobs/bulk-update
 * Body is either an array of {"jobId", "update"} entries or {"updates": [...]}.
 * Either every update is applied or none is.
 */
public class BulkUpdateJobsHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

    private static final TypeReference<List<JobUpdateEntry>> ENTRY_LIST = new TypeReference<>() {};

    private final JobService jobService;
    private final ObjectMapper objectMapper;

    public BulkUpdateJobsHandler() {
        this(JobServiceFactory.fromEnvironment());
    }

    public BulkUpdateJobsHandler(JobService jobService) {
        this.jobService = jobService;
        this.objectMapper = ObjectMapperFactory.create();
    }

    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent input, Context context) {
        try {
            List<JobUpdateEntry> entries = readEntries(input);

            context.getLogger().log("Admin bulk update of " + entries.size() + " jobs");

            List<JobEntity> updated = jobService.bulkUpdate(entries);
            return ResponseUtil.createSuccessResponse(200, Map.of(
                    "updated", updated.size(),
                    "jobs", updated));

        } catch (JobOperationException e) {
            context.getLogger().log("Bulk update rejected: " + e.getErrors());
            return ResponseUtil.createErrorResponse(e);
        } catch (StoreFailureException e) {
            context.getLogger().log("Store failure in bulk update: " + e.getMessage());
            return ResponseUtil.createErrorResponse(e);
        } catch (Exception e) {
            context.getLogger().log("Error in bulk update: " + e.getMessage());
            e.printStackTrace();
            return ResponseUtil.createErrorResponse(500, "Internal server error");
        }
    }

    private List<JobUpdateEntry> readEntries(APIGatewayProxyRequestEvent input) throws JobValidationException {
        JsonNode body = RequestMapper.readBody(input, objectMapper, JsonNode.class);
        JsonNode updates = body.isArray() ? body : body.get("updates");
        if (updates == null || !updates.isArray()) {
            throw new JobValidationException("Body must be a list of updates");
        }
        try {
            return objectMapper.convertValue(updates, ENTRY_LIST);
        } catch (IllegalArgumentException e) {
            throw new JobValidationException("Malformed update entry: " + e.getMessage());
        }
    }
}
