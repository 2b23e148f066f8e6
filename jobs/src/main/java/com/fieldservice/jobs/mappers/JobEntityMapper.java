package com.fieldservice.jobs.mappers;

import static com.fieldservice.jobs.store.AttributeValues.*;

import com.fieldservice.jobs.entity.*;
import com.fieldservice.jobs.exceptions.StoreFailureException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Utility class for mapping between DynamoDB items and JobEntity objects.
 * Decoding fails closed: a record missing a required attribute or holding an unknown
 * enumeration value raises {@link StoreFailureException} instead of producing a partial job.
 */
public class JobEntityMapper {

    public static final String PRIORITY_RANK = "priorityRank";

    private JobEntityMapper() {
        // Utility class - prevent instantiation
    }

    /**
     * Maps a DynamoDB item to a JobEntity object
     *
     * @param item DynamoDB item map
     * @return JobEntity object, or null for a missing item
     */
    public static JobEntity mapToJobEntity(Map<String, AttributeValue> item) {
        if (item == null || item.isEmpty()) {
            return null;
        }
        String jobId = required(item, "jobId");
        try {
            return JobEntity.builder()
                    .jobId(jobId)
                    .title(required(item, "title"))
                    .description(getString(item, "description"))
                    .type(enumValue(JobType.fromValue(required(item, "type")), "type", item))
                    .priority(enumValue(JobPriority.fromValue(required(item, "priority")), "priority", item))
                    .status(enumValue(JobStatus.fromValue(required(item, "status")), "status", item))
                    .customer(toCustomer(getMap(item, "customer")))
                    .location(toLocation(getMap(item, "location")))
                    .assignedTechnicianId(getString(item, "assignedTechnicianId"))
                    .assignedBy(getString(item, "assignedBy"))
                    .assignedAt(getInstant(item, "assignedAt"))
                    .scheduledDate(getInstant(item, "scheduledDate"))
                    .scheduledTimeSlot(toTimeSlot(getMap(item, "scheduledTimeSlot")))
                    .estimatedDuration(getInteger(item, "estimatedDuration"))
                    .requirements(toRequirements(getMap(item, "requirements")))
                    .startedAt(getInstant(item, "startedAt"))
                    .completedAt(getInstant(item, "completedAt"))
                    .actualDuration(getInteger(item, "actualDuration"))
                    .notes(orEmpty(getStringList(item, "notes")))
                    .internalNotes(orEmpty(getStringList(item, "internalNotes")))
                    .createdBy(required(item, "createdBy"))
                    .createdAt(requiredInstant(item, "createdAt"))
                    .updatedAt(getInstant(item, "updatedAt"))
                    .completionNotes(getString(item, "completionNotes"))
                    .customerSignature(getString(item, "customerSignature"))
                    .photos(getStringList(item, "photos"))
                    .workSummary(getString(item, "workSummary"))
                    .build();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new StoreFailureException("Malformed numeric attribute on job " + jobId, e);
        }
    }

    /**
     * Maps a JobEntity to a full DynamoDB item. Null fields are omitted.
     */
    public static Map<String, AttributeValue> toItem(JobEntity job) {
        Map<String, AttributeValue> item = new HashMap<>();
        putString(item, "jobId", job.jobId());
        putString(item, "title", job.title());
        putString(item, "description", job.description());
        if (job.type() != null) {
            item.put("type", s(job.type().value()));
        }
        if (job.priority() != null) {
            item.put("priority", s(job.priority().value()));
            item.put(PRIORITY_RANK, n(job.priority().rank()));
        }
        if (job.status() != null) {
            item.put("status", s(job.status().value()));
        }
        if (job.customer() != null) {
            item.put("customer", map(fromCustomer(job.customer())));
        }
        if (job.location() != null) {
            item.put("location", map(fromLocation(job.location())));
        }
        putString(item, "assignedTechnicianId", job.assignedTechnicianId());
        putString(item, "assignedBy", job.assignedBy());
        putInstant(item, "assignedAt", job.assignedAt());
        putInstant(item, "scheduledDate", job.scheduledDate());
        if (job.scheduledTimeSlot() != null) {
            Map<String, AttributeValue> slot = new HashMap<>();
            putString(slot, "start", job.scheduledTimeSlot().start());
            putString(slot, "end", job.scheduledTimeSlot().end());
            item.put("scheduledTimeSlot", map(slot));
        }
        putNumber(item, "estimatedDuration", job.estimatedDuration());
        if (job.requirements() != null) {
            item.put("requirements", map(fromRequirements(job.requirements())));
        }
        putInstant(item, "startedAt", job.startedAt());
        putInstant(item, "completedAt", job.completedAt());
        putNumber(item, "actualDuration", job.actualDuration());
        putList(item, "notes", job.notes());
        putList(item, "internalNotes", job.internalNotes());
        putString(item, "createdBy", job.createdBy());
        putInstant(item, "createdAt", job.createdAt());
        putInstant(item, "updatedAt", job.updatedAt());
        putString(item, "completionNotes", job.completionNotes());
        putString(item, "customerSignature", job.customerSignature());
        putList(item, "photos", job.photos());
        putString(item, "workSummary", job.workSummary());
        return item;
    }

    private static Customer toCustomer(Map<String, AttributeValue> m) {
        if (m == null) {
            return null;
        }
        return new Customer(
                getString(m, "name"),
                getString(m, "phone"),
                getString(m, "email"),
                getString(m, "alternatePhone"),
                toLocation(getMap(m, "address")),
                getString(m, "notes"));
    }

    private static Map<String, AttributeValue> fromCustomer(Customer customer) {
        Map<String, AttributeValue> m = new HashMap<>();
        putString(m, "name", customer.name());
        putString(m, "phone", customer.phone());
        putString(m, "email", customer.email());
        putString(m, "alternatePhone", customer.alternatePhone());
        if (customer.address() != null) {
            m.put("address", map(fromLocation(customer.address())));
        }
        putString(m, "notes", customer.notes());
        return m;
    }

    private static JobLocation toLocation(Map<String, AttributeValue> m) {
        if (m == null) {
            return null;
        }
        return new JobLocation(
                getString(m, "address"),
                getString(m, "city"),
                getString(m, "state"),
                getString(m, "zipCode"),
                getDouble(m, "latitude"),
                getDouble(m, "longitude"),
                getString(m, "landmark"),
                getString(m, "accessInstructions"));
    }

    private static Map<String, AttributeValue> fromLocation(JobLocation location) {
        Map<String, AttributeValue> m = new HashMap<>();
        putString(m, "address", location.address());
        putString(m, "city", location.city());
        putString(m, "state", location.state());
        putString(m, "zipCode", location.zipCode());
        putNumber(m, "latitude", location.latitude());
        putNumber(m, "longitude", location.longitude());
        putString(m, "landmark", location.landmark());
        putString(m, "accessInstructions", location.accessInstructions());
        return m;
    }

    private static JobRequirements toRequirements(Map<String, AttributeValue> m) {
        if (m == null) {
            return null;
        }
        List<Equipment> equipment = null;
        AttributeValue equipmentList = m.get("equipment");
        if (equipmentList != null && equipmentList.hasL()) {
            equipment = new ArrayList<>();
            for (AttributeValue entry : equipmentList.l()) {
                Map<String, AttributeValue> e = entry.hasM() ? entry.m() : Map.of();
                equipment.add(new Equipment(
                        getString(e, "name"),
                        getString(e, "model"),
                        getString(e, "serialNumber"),
                        getInteger(e, "quantity"),
                        getString(e, "description")));
            }
        }
        return new JobRequirements(
                getStringList(m, "skills"),
                equipment,
                getStringList(m, "tools"),
                getString(m, "specialInstructions"));
    }

    private static Map<String, AttributeValue> fromRequirements(JobRequirements requirements) {
        Map<String, AttributeValue> m = new HashMap<>();
        putList(m, "skills", requirements.skills());
        if (requirements.equipment() != null) {
            List<AttributeValue> entries = new ArrayList<>();
            for (Equipment equipment : requirements.equipment()) {
                Map<String, AttributeValue> e = new HashMap<>();
                putString(e, "name", equipment.name());
                putString(e, "model", equipment.model());
                putString(e, "serialNumber", equipment.serialNumber());
                putNumber(e, "quantity", equipment.quantity());
                putString(e, "description", equipment.description());
                entries.add(map(e));
            }
            m.put("equipment", AttributeValue.builder().l(entries).build());
        }
        putList(m, "tools", requirements.tools());
        putString(m, "specialInstructions", requirements.specialInstructions());
        return m;
    }

    private static TimeSlot toTimeSlot(Map<String, AttributeValue> m) {
        if (m == null) {
            return null;
        }
        return new TimeSlot(getString(m, "start"), getString(m, "end"));
    }

    private static String required(Map<String, AttributeValue> item, String key) {
        String value = getString(item, key);
        if (value == null) {
            throw new StoreFailureException(
                    "Stored job " + getString(item, "jobId") + " is missing attribute: " + key);
        }
        return value;
    }

    private static Instant requiredInstant(Map<String, AttributeValue> item, String key) {
        Instant value = getInstant(item, key);
        if (value == null) {
            throw new StoreFailureException(
                    "Stored job " + getString(item, "jobId") + " is missing attribute: " + key);
        }
        return value;
    }

    private static <E extends Enum<E>> E enumValue(E value, String key, Map<String, AttributeValue> item) {
        if (value == null) {
            throw new StoreFailureException(
                    "Stored job " + getString(item, "jobId") + " has unknown " + key + ": " + getString(item, key));
        }
        return value;
    }

    private static Integer getInteger(Map<String, AttributeValue> item, String key) {
        BigDecimal value = getNumber(item, key);
        return value == null ? null : value.intValueExact();
    }

    private static Double getDouble(Map<String, AttributeValue> item, String key) {
        BigDecimal value = getNumber(item, key);
        return value == null ? null : value.doubleValue();
    }

    private static List<String> orEmpty(List<String> values) {
        return values == null ? new ArrayList<>() : values;
    }

    private static void putString(Map<String, AttributeValue> item, String key, String value) {
        if (value != null) {
            item.put(key, s(value));
        }
    }

    private static void putNumber(Map<String, AttributeValue> item, String key, Number value) {
        if (value != null) {
            item.put(key, n(value));
        }
    }

    private static void putInstant(Map<String, AttributeValue> item, String key, Instant value) {
        if (value != null) {
            item.put(key, instant(value));
        }
    }

    private static void putList(Map<String, AttributeValue> item, String key, List<String> values) {
        if (values != null) {
            item.put(key, stringList(values));
        }
    }
}
