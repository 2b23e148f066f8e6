package com.fieldservice.jobs.dispatchers;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.fieldservice.jobs.exceptions.JobOperationException;
import com.fieldservice.jobs.exceptions.StoreFailureException;
import com.fieldservice.jobs.mappers.RequestMapper;
import com.fieldservice.jobs.model.JobPage;
import com.fieldservice.jobs.model.SearchRequest;
import com.fieldservice.jobs.service.JobService;
import com.fieldservice.jobs.service.JobServiceFactory;
import com.fieldservice.jobs.shared.ResponseUtil;

/**
 * Handler for GET /jobs/search
 * Accepts the list parameters plus sortBy (createdAt, scheduledDate, priority, distance)
 * and sortOrder (asc, desc)
 */
public class SearchJobsHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

    private final JobService jobService;

    public SearchJobsHandler() {
        this(JobServiceFactory.fromEnvironment());
    }

    public SearchJobsHandler(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent input, Context context) {
        try {
            String sortOrder = RequestMapper.getQueryParameter(input, "sortOrder");
            Integer pageSize = RequestMapper.getIntParameter(input, "pageSize");
            SearchRequest request = new SearchRequest(
                    RequestMapper.toJobFilter(input),
                    SearchRequest.SortField.fromValue(RequestMapper.getQueryParameter(input, "sortBy")),
                    !"asc".equalsIgnoreCase(sortOrder),
                    pageSize != null ? pageSize : 0,
                    RequestMapper.getQueryParameter(input, "cursor"));

            context.getLogger().log("Searching jobs sorted by " + request.sortBy().value());

            JobPage page = jobService.search(request);
            return ResponseUtil.createSuccessResponse(200, page);

        } catch (JobOperationException e) {
            return ResponseUtil.createErrorResponse(e);
        } catch (StoreFailureException e) {
            context.getLogger().log("Store failure searching jobs: " + e.getMessage());
            return ResponseUtil.createErrorResponse(e);
        } catch (Exception e) {
            context.getLogger().log("Error searching jobs: " + e.getMessage());
            e.printStackTrace();
            return ResponseUtil.createErrorResponse(500, "Internal server error");
        }
    }
}
