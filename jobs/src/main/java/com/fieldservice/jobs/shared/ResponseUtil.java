package com.fieldservice.jobs.shared;

import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldservice.jobs.exceptions.ErrorCode;
import com.fieldservice.jobs.exceptions.JobOperationException;
import com.fieldservice.jobs.exceptions.StoreFailureException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Utility class for creating standardized API Gateway responses across all handlers */
public class ResponseUtil {

  private static final ObjectMapper objectMapper = ObjectMapperFactory.create();

  public static final Map<String, String> CORS_HEADERS =
      Map.of(
          "Access-Control-Allow-Origin", "*",
          "Access-Control-Allow-Methods", "GET,POST,PUT,DELETE,OPTIONS",
          "Access-Control-Allow-Headers", "Content-Type,Authorization,X-User-ID,X-User-Role,Accept");

  private static final Map<String, String> DEFAULT_HEADERS = withContentType();

  private ResponseUtil() {}

  /**
   * Creates a success response with the given status code and body
   *
   * @param statusCode HTTP status code
   * @param body Response body object
   * @return APIGatewayProxyResponseEvent
   */
  public static APIGatewayProxyResponseEvent createSuccessResponse(int statusCode, Object body) {
    try {
      return new APIGatewayProxyResponseEvent()
          .withStatusCode(statusCode)
          .withHeaders(DEFAULT_HEADERS)
          .withBody(objectMapper.writeValueAsString(body));
    } catch (Exception e) {
      throw new RuntimeException("Error creating success response", e);
    }
  }

  /**
   * Creates an error response with the given status code and message
   *
   * @param statusCode HTTP status code
   * @param message Error message
   * @return APIGatewayProxyResponseEvent
   */
  public static APIGatewayProxyResponseEvent createErrorResponse(int statusCode, String message) {
    return createErrorResponse(statusCode, message, List.of());
  }

  /**
   * Creates an error response listing every violated rule
   *
   * @param statusCode HTTP status code
   * @param message Error message
   * @param details Individual errors, possibly empty
   * @return APIGatewayProxyResponseEvent
   */
  public static APIGatewayProxyResponseEvent createErrorResponse(
      int statusCode, String message, List<String> details) {
    try {
      Map<String, Object> errorBody = new LinkedHashMap<>();
      errorBody.put("error", message);
      errorBody.put("details", details != null ? details : List.of());
      return new APIGatewayProxyResponseEvent()
          .withStatusCode(statusCode)
          .withHeaders(DEFAULT_HEADERS)
          .withBody(objectMapper.writeValueAsString(errorBody));
    } catch (Exception e) {
      return new APIGatewayProxyResponseEvent()
          .withStatusCode(500)
          .withBody("{\"error\":\"Internal server error\",\"details\":[]}");
    }
  }

  /** Maps a rejected operation to its HTTP status with the full error list */
  public static APIGatewayProxyResponseEvent createErrorResponse(JobOperationException e) {
    return createErrorResponse(e.getErrorCode().httpStatus(), e.getMessage(), e.getErrors());
  }

  /** Store failures are reported as 500 with the underlying message */
  public static APIGatewayProxyResponseEvent createErrorResponse(StoreFailureException e) {
    return createErrorResponse(
        ErrorCode.STORE_FAILURE.httpStatus(), "Store failure", List.of(String.valueOf(e.getMessage())));
  }

  public static APIGatewayProxyResponseEvent createPreflightResponse() {
    Map<String, String> headers = new LinkedHashMap<>(CORS_HEADERS);
    headers.put("Access-Control-Max-Age", "86400");
    return new APIGatewayProxyResponseEvent().withStatusCode(200).withHeaders(headers).withBody("");
  }

  private static Map<String, String> withContentType() {
    Map<String, String> headers = new LinkedHashMap<>(CORS_HEADERS);
    headers.put("Content-Type", "application/json");
    return Map.copyOf(headers);
  }
}
