package com.fieldservice.jobs.mappers;

import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldservice.jobs.entity.JobPriority;
import com.fieldservice.jobs.entity.JobStatus;
import com.fieldservice.jobs.entity.JobType;
import com.fieldservice.jobs.exceptions.JobValidationException;
import com.fieldservice.jobs.model.DateRange;
import com.fieldservice.jobs.model.GeoFilter;
import com.fieldservice.jobs.model.JobFilter;
import com.fieldservice.jobs.validation.JobValidator;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Utility class for extracting common parameters from API Gateway request events
 */
public class RequestMapper {

    private RequestMapper() {
        // Utility class - prevent instantiation
    }

    /**
     * Extracts a path parameter, falling back to a segment of the raw path
     * when API Gateway did not populate the path parameters
     *
     * @param input API Gateway request event
     * @param name Path parameter name, e.g. "jobId"
     * @param segmentIndex Position in the path split on "/" (index 0 is the empty leading segment)
     * @return Parameter value or null if not found
     */
    public static String extractPathParameter(APIGatewayProxyRequestEvent input, String name, int segmentIndex) {
        Map<String, String> pathParameters = input.getPathParameters();
        if (pathParameters != null && pathParameters.get(name) != null && !pathParameters.get(name).isEmpty()) {
            return pathParameters.get(name);
        }
        String path = input.getPath();
        if (path == null) {
            return null;
        }
        String[] parts = path.split("/");
        if (parts.length > segmentIndex && !parts[segmentIndex].isEmpty()) {
            return parts[segmentIndex];
        }
        return null;
    }

    /**
     * Extracts user ID from API Gateway request context (Cognito authorizer claims),
     * falling back to the X-User-ID header
     *
     * @param input API Gateway request event
     * @return User ID or null if not found
     */
    public static String extractUserIdFromRequestContext(APIGatewayProxyRequestEvent input) {
        Map<String, Object> claims = claims(input);
        if (claims != null && claims.get("sub") instanceof String) {
            String sub = (String) claims.get("sub");
            if (!sub.isEmpty()) {
                return sub;
            }
        }
        return header(input, "X-User-ID");
    }

    /**
     * Extracts user role from the Cognito groups claim, falling back to the X-User-Role header
     *
     * @param input API Gateway request event
     * @return User role or null if not found
     */
    public static String extractUserRoleFromRequestContext(APIGatewayProxyRequestEvent input) {
        Map<String, Object> claims = claims(input);
        if (claims != null && claims.containsKey("cognito:groups")) {
            Object groups = claims.get("cognito:groups");
            if (groups instanceof List && !((List<?>) groups).isEmpty()) {
                return String.valueOf(((List<?>) groups).get(0)); // Return first group
            } else if (groups instanceof String) {
                return (String) groups;
            }
        }
        return header(input, "X-User-Role");
    }

    /**
     * Extracts query parameter from API Gateway request event
     *
     * @param input API Gateway request event
     * @param paramName Parameter name
     * @return Parameter value or null
     */
    public static String getQueryParameter(APIGatewayProxyRequestEvent input, String paramName) {
        Map<String, String> queryParams = input.getQueryStringParameters();
        if (queryParams != null && queryParams.containsKey(paramName)) {
            String value = queryParams.get(paramName);
            return value == null || value.isBlank() ? null : value.trim();
        }
        return null;
    }

    /**
     * Reads and parses the request body, decoding it first when API Gateway delivered it base64 encoded
     */
    public static <T> T readBody(APIGatewayProxyRequestEvent input, ObjectMapper objectMapper, Class<T> type)
            throws JobValidationException {
        String requestBody = input.getBody();
        if (requestBody == null || requestBody.isBlank()) {
            throw new JobValidationException("Request body is required");
        }
        if (input.getIsBase64Encoded() != null && input.getIsBase64Encoded()) {
            try {
                requestBody = new String(Base64.getDecoder().decode(requestBody), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e) {
                throw new JobValidationException("Malformed request body: invalid base64 encoding");
            }
        }
        try {
            return objectMapper.readValue(requestBody, type);
        } catch (JsonProcessingException e) {
            throw new JobValidationException("Malformed request body: " + e.getOriginalMessage());
        }
    }

    /**
     * Builds a listing filter from the query string: status, priority, type (comma separated),
     * technicianId, from, to, q, lat, lon and radiusKm
     *
     * @throws JobValidationException listing every malformed parameter
     */
    public static JobFilter toJobFilter(APIGatewayProxyRequestEvent input) throws JobValidationException {
        List<String> errors = new ArrayList<>();

        Set<JobStatus> statuses = parseEnumList(getQueryParameter(input, "status"), JobStatus.class, JobStatus::fromValue, "status", errors);
        Set<JobPriority> priorities = parseEnumList(getQueryParameter(input, "priority"), JobPriority.class, JobPriority::fromValue, "priority", errors);
        Set<JobType> types = parseEnumList(getQueryParameter(input, "type"), JobType.class, JobType::fromValue, "type", errors);

        Instant from = parseInstant(getQueryParameter(input, "from"), "from", errors);
        Instant to = parseInstant(getQueryParameter(input, "to"), "to", errors);

        Double lat = parseDouble(getQueryParameter(input, "lat"), "lat", errors);
        Double lon = parseDouble(getQueryParameter(input, "lon"), "lon", errors);
        Double radiusKm = parseDouble(getQueryParameter(input, "radiusKm"), "radiusKm", errors);
        GeoFilter geo = null;
        if (lat != null || lon != null || radiusKm != null) {
            if (lat == null || lon == null || radiusKm == null) {
                errors.add("lat, lon and radiusKm must be given together");
            } else {
                List<String> geoErrors = JobValidator.validateGeoQuery(lat, lon, radiusKm);
                if (geoErrors.isEmpty()) {
                    geo = new GeoFilter(lat, lon, radiusKm);
                } else {
                    errors.addAll(geoErrors);
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new JobValidationException(errors);
        }

        return JobFilter.builder()
                .statuses(statuses)
                .priorities(priorities)
                .types(types)
                .technicianId(getQueryParameter(input, "technicianId"))
                .scheduledDateRange(from == null && to == null ? null : new DateRange(from, to))
                .searchText(getQueryParameter(input, "q"))
                .geo(geo)
                .build();
    }

    /**
     * Parses a created-at window from the from and to query parameters
     *
     * @return the range, or null when neither parameter is present
     */
    public static DateRange toDateRange(APIGatewayProxyRequestEvent input) throws JobValidationException {
        List<String> errors = new ArrayList<>();
        Instant from = parseInstant(getQueryParameter(input, "from"), "from", errors);
        Instant to = parseInstant(getQueryParameter(input, "to"), "to", errors);
        if (!errors.isEmpty()) {
            throw new JobValidationException(errors);
        }
        return from == null && to == null ? null : new DateRange(from, to);
    }

    public static Set<JobStatus> toStatuses(APIGatewayProxyRequestEvent input) throws JobValidationException {
        List<String> errors = new ArrayList<>();
        Set<JobStatus> statuses = parseEnumList(getQueryParameter(input, "status"), JobStatus.class, JobStatus::fromValue, "status", errors);
        if (!errors.isEmpty()) {
            throw new JobValidationException(errors);
        }
        return statuses;
    }

    public static Integer getIntParameter(APIGatewayProxyRequestEvent input, String paramName) throws JobValidationException {
        String value = getQueryParameter(input, paramName);
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new JobValidationException("Invalid " + paramName + ": " + value);
        }
    }

    public static Double getDoubleParameter(APIGatewayProxyRequestEvent input, String paramName) throws JobValidationException {
        List<String> errors = new ArrayList<>();
        Double value = parseDouble(getQueryParameter(input, paramName), paramName, errors);
        if (!errors.isEmpty()) {
            throw new JobValidationException(errors);
        }
        return value;
    }

    private static <E extends Enum<E>> Set<E> parseEnumList(String value, Class<E> type, Function<String, E> parser,
                                                            String name, List<String> errors) {
        Set<E> result = EnumSet.noneOf(type);
        if (value == null) {
            return result;
        }
        for (String part : value.split(",")) {
            if (part.isBlank()) {
                continue;
            }
            E parsed = parser.apply(part);
            if (parsed == null) {
                errors.add("Invalid " + name + ": " + part.trim());
            } else {
                result.add(parsed);
            }
        }
        return result;
    }

    private static Instant parseInstant(String value, String name, List<String> errors) {
        if (value == null) {
            return null;
        }
        Instant parsed = JobValidator.parseScheduledDate(value);
        if (parsed == null) {
            errors.add("Invalid " + name + ": " + value + " (expected ISO-8601 timestamp)");
        }
        return parsed;
    }

    private static Double parseDouble(String value, String name, List<String> errors) {
        if (value == null) {
            return null;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            errors.add("Invalid " + name + ": " + value);
            return null;
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> claims(APIGatewayProxyRequestEvent input) {
        APIGatewayProxyRequestEvent.ProxyRequestContext requestContext = input.getRequestContext();
        if (requestContext == null || requestContext.getAuthorizer() == null) {
            return null;
        }
        Object claims = requestContext.getAuthorizer().get("claims");
        return claims instanceof Map ? (Map<String, Object>) claims : null;
    }

    private static String header(APIGatewayProxyRequestEvent input, String name) {
        Map<String, String> headers = input.getHeaders();
        if (headers == null) {
            return null;
        }
        // Try both case variations as headers can be normalized differently
        String value = headers.get(name);
        if (value == null || value.isEmpty()) {
            value = headers.get(name.toLowerCase());
        }
        return value == null || value.isEmpty() ? null : value;
    }
}
