package com.fieldservice.admin.handlers;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.fieldservice.jobs.exceptions.JobOperationException;
import com.fieldservice.jobs.exceptions.StoreFailureException;
import com.fieldservice.jobs.mappers.RequestMapper;
import com.fieldservice.jobs.model.DateRange;
import com.fieldservice.jobs.model.JobStats;
import com.fieldservice.jobs.service.JobService;
import com.fieldservice.jobs.service.JobServiceFactory;
import com.fieldservice.jobs.shared.ResponseUtil;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Handler for GET /admin/jobs/stats
 * Returns counts per status, optionally limited to jobs created between from and to (Admin only)
 */
public class JobStatisticsHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

    private final JobService jobService;

    public JobStatisticsHandler() {
        this(JobServiceFactory.fromEnvironment());
    }

    public JobStatisticsHandler(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent input, Context context) {
        try {
            DateRange range = RequestMapper.toDateRange(input);

            context.getLogger().log("Generating job statistics" + (range != null ? " for " + range : ""));

            JobStats stats = jobService.getStats(range);

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("statistics", stats);
            if (range != null) {
                response.put("from", range.start());
                response.put("to", range.end());
            }
            return ResponseUtil.createSuccessResponse(200, response);

        } catch (JobOperationException e) {
            return ResponseUtil.createErrorResponse(e);
        } catch (StoreFailureException e) {
            context.getLogger().log("Store failure generating statistics: " + e.getMessage());
            return ResponseUtil.createErrorResponse(e);
        } catch (Exception e) {
            context.getLogger().log("Error generating job statistics: " + e.getMessage());
            e.printStackTrace();
            return ResponseUtil.createErrorResponse(500, "Internal server error");
        }
    }
}
