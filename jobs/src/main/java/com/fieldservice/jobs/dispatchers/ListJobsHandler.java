package com.fieldservice.jobs.dispatchers;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.fieldservice.jobs.exceptions.JobOperationException;
import com.fieldservice.jobs.exceptions.StoreFailureException;
import com.fieldservice.jobs.mappers.RequestMapper;
import com.fieldservice.jobs.model.JobFilter;
import com.fieldservice.jobs.model.JobPage;
import com.fieldservice.jobs.service.JobService;
import com.fieldservice.jobs.service.JobServiceFactory;
import com.fieldservice.jobs.shared.ResponseUtil;

/**
 * Handler for GET /jobs
 * Returns one page of jobs, newest first. A page may hold fewer jobs than pageSize when text
 * or radius filters drop candidates; follow nextCursor while hasMore is true.
 */
public class ListJobsHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

    private final JobService jobService;

    public ListJobsHandler() {
        this(JobServiceFactory.fromEnvironment());
    }

    public ListJobsHandler(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent input, Context context) {
        try {
            JobFilter filter = RequestMapper.toJobFilter(input);
            Integer pageSize = RequestMapper.getIntParameter(input, "pageSize");
            String cursor = RequestMapper.getQueryParameter(input, "cursor");

            JobPage page = jobService.list(filter, pageSize, cursor);

            context.getLogger().log(String.format("Listed %d jobs (hasMore=%s)", page.jobs().size(), page.hasMore()));
            return ResponseUtil.createSuccessResponse(200, page);

        } catch (JobOperationException e) {
            return ResponseUtil.createErrorResponse(e);
        } catch (StoreFailureException e) {
            context.getLogger().log("Store failure listing jobs: " + e.getMessage());
            return ResponseUtil.createErrorResponse(e);
        } catch (Exception e) {
            context.getLogger().log("Error listing jobs: " + e.getMessage());
            e.printStackTrace();
            return ResponseUtil.createErrorResponse(500, "Internal server error");
        }
    }
}
