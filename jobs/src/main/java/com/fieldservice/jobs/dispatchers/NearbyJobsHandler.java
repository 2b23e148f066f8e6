package com.fieldservice.jobs.dispatchers;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.fieldservice.jobs.entity.JobEntity;
import com.fieldservice.jobs.exceptions.JobOperationException;
import com.fieldservice.jobs.exceptions.JobValidationException;
import com.fieldservice.jobs.exceptions.StoreFailureException;
import com.fieldservice.jobs.mappers.RequestMapper;
import com.fieldservice.jobs.service.JobService;
import com.fieldservice.jobs.service.JobServiceFactory;
import com.fieldservice.jobs.shared.ResponseUtil;
import java.util.List;
import java.util.Map;

/**
 * Handler for GET /jobs/nearby?lat=..&lon=..&radiusKm=..&max=..
 * Returns open jobs inside the radius, nearest first
 */
public class NearbyJobsHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

    private static final double DEFAULT_RADIUS_KM = 25.0;
    private static final int DEFAULT_MAX = 20;

    private final JobService jobService;

    public NearbyJobsHandler() {
        this(JobServiceFactory.fromEnvironment());
    }

    public NearbyJobsHandler(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent input, Context context) {
        try {
            Double lat = RequestMapper.getDoubleParameter(input, "lat");
            Double lon = RequestMapper.getDoubleParameter(input, "lon");
            if (lat == null || lon == null) {
                throw new JobValidationException("lat and lon are required");
            }
            Double radiusKm = RequestMapper.getDoubleParameter(input, "radiusKm");
            Integer max = RequestMapper.getIntParameter(input, "max");

            List<JobEntity> jobs = jobService.getJobsByProximity(
                    lat, lon,
                    radiusKm != null ? radiusKm : DEFAULT_RADIUS_KM,
                    max != null ? max : DEFAULT_MAX);

            return ResponseUtil.createSuccessResponse(200, Map.of("jobs", jobs, "count", jobs.size()));

        } catch (JobOperationException e) {
            return ResponseUtil.createErrorResponse(e);
        } catch (StoreFailureException e) {
            context.getLogger().log("Store failure in proximity search: " + e.getMessage());
            return ResponseUtil.createErrorResponse(e);
        } catch (Exception e) {
            context.getLogger().log("Error in proximity search: " + e.getMessage());
            e.printStackTrace();
            return ResponseUtil.createErrorResponse(500, "Internal server error");
        }
    }
}
