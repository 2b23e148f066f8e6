package com.fieldservice.jobs.mappers;

import static com.fieldservice.jobs.store.AttributeValues.*;

import com.fieldservice.jobs.entity.AssignmentEntity;
import java.util.HashMap;
import java.util.Map;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Utility class for mapping assignment records
 */
public class AssignmentMapper {

    private AssignmentMapper() {
        // Utility class - prevent instantiation
    }

    public static Map<String, AttributeValue> toItem(AssignmentEntity assignment) {
        Map<String, AttributeValue> item = new HashMap<>();
        item.put("assignmentId", s(assignment.assignmentId()));
        item.put("jobId", s(assignment.jobId()));
        item.put("technicianId", s(assignment.technicianId()));
        item.put("assignedBy", s(assignment.assignedBy()));
        item.put("assignedAt", instant(assignment.assignedAt()));
        if (assignment.notes() != null) {
            item.put("notes", s(assignment.notes()));
        }
        item.put("assignmentReason", s(assignment.assignmentReason()));
        return item;
    }

    public static AssignmentEntity mapToAssignment(Map<String, AttributeValue> item) {
        if (item == null || item.isEmpty()) {
            return null;
        }
        return new AssignmentEntity(
                getString(item, "assignmentId"),
                getString(item, "jobId"),
                getString(item, "technicianId"),
                getString(item, "assignedBy"),
                getInstant(item, "assignedAt"),
                getString(item, "notes"),
                getString(item, "assignmentReason"));
    }
}
