package com.fieldservice.jobs.technicians;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.fieldservice.jobs.exceptions.JobOperationException;
import com.fieldservice.jobs.exceptions.StoreFailureException;
import com.fieldservice.jobs.mappers.RequestMapper;
import com.fieldservice.jobs.recommendation.ScoredJob;
import com.fieldservice.jobs.service.JobService;
import com.fieldservice.jobs.service.JobServiceFactory;
import com.fieldservice.jobs.shared.ResponseUtil;
import java.util.List;
import java.util.Map;

/**
 * Handler for GET /technicians/{technicianId}/recommendations?max=..
 */
public class RecommendationsHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

    private static final int DEFAULT_MAX = 10;

    private final JobService jobService;

    public RecommendationsHandler() {
        this(JobServiceFactory.fromEnvironment());
    }

    public RecommendationsHandler(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent input, Context context) {
        try {
            String technicianId = RequestMapper.extractPathParameter(input, "technicianId", 2);
            if (technicianId == null) {
                return ResponseUtil.createErrorResponse(400, "Technician ID not found in path");
            }
            Integer max = RequestMapper.getIntParameter(input, "max");

            List<ScoredJob> recommendations = jobService.recommend(technicianId, max != null ? max : DEFAULT_MAX);

            context.getLogger().log("Recommending " + recommendations.size() + " jobs to technician " + technicianId);
            return ResponseUtil.createSuccessResponse(200, Map.of(
                    "technicianId", technicianId,
                    "recommendations", recommendations));

        } catch (JobOperationException e) {
            return ResponseUtil.createErrorResponse(e);
        } catch (StoreFailureException e) {
            context.getLogger().log("Store failure building recommendations: " + e.getMessage());
            return ResponseUtil.createErrorResponse(e);
        } catch (Exception e) {
            context.getLogger().log("Error building recommendations: " + e.getMessage());
            e.printStackTrace();
            return ResponseUtil.createErrorResponse(500, "Internal server error");
        }
    }
}
