package com.fieldservice.jobs.mappers;

import static com.fieldservice.jobs.store.AttributeValues.*;

import com.fieldservice.jobs.entity.GeoPoint;
import com.fieldservice.jobs.entity.TechnicianEntity;
import com.fieldservice.jobs.exceptions.StoreFailureException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Utility class for reading technician records from the users table
 */
public class TechnicianMapper {

    private TechnicianMapper() {
        // Utility class - prevent instantiation
    }

    public static TechnicianEntity mapToTechnician(Map<String, AttributeValue> item) {
        if (item == null || item.isEmpty()) {
            return null;
        }
        String userId = getString(item, "userId");
        if (userId == null) {
            throw new StoreFailureException("Stored user is missing attribute: userId");
        }
        Boolean active = getBoolean(item, "isActive");
        List<String> skills = getStringList(item, "skills");
        return new TechnicianEntity(
                userId,
                getString(item, "displayName"),
                getString(item, "role"),
                Boolean.TRUE.equals(active),
                skills == null ? List.of() : skills,
                toGeoPoint(getMap(item, "currentLocation")));
    }

    private static GeoPoint toGeoPoint(Map<String, AttributeValue> m) {
        if (m == null) {
            return null;
        }
        BigDecimal latitude = getNumber(m, "latitude");
        BigDecimal longitude = getNumber(m, "longitude");
        if (latitude == null || longitude == null) {
            return null;
        }
        Instant timestamp = getInstant(m, "timestamp");
        return new GeoPoint(latitude.doubleValue(), longitude.doubleValue(), timestamp);
    }

    /**
     * Condition values a technician record must still hold when an assignment commits
     */
    public static Map<String, AttributeValue> assignableConditions() {
        return Map.of(
                "isActive", bool(true),
                "role", s(TechnicianEntity.TECHNICIAN_ROLE));
    }
}
