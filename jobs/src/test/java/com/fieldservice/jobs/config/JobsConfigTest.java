package com.fieldservice.jobs.config;

import static org.junit.jupiter.api.Assertions.*;

import com.fieldservice.jobs.store.StoreCollections;
import java.time.ZoneId;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JobsConfigTest {

  @Test
  void defaultsWhenEnvironmentIsEmpty() {
    JobsConfig config = JobsConfig.fromMap(Map.of());

    assertEquals("Jobs", config.jobsTableName());
    assertEquals("Users", config.tableNames().get(StoreCollections.USERS));
    assertEquals(ZoneId.of("UTC"), config.timeZone());
    assertEquals(JobsConfig.DEFAULT_PAGE_SIZE, config.defaultPageSize());
    assertFalse(config.eventsEnabled());
  }

  @Test
  void readsOverrides() {
    JobsConfig config =
        JobsConfig.fromMap(
            Map.of(
                "JOBS_TABLE_NAME", "prod-jobs",
                "EVENT_BUS_NAME", "field-service-bus",
                "JOBS_TIME_ZONE", "America/Chicago",
                "DEFAULT_PAGE_SIZE", "50",
                "MAX_PAGE_SIZE", "40"));

    assertEquals("prod-jobs", config.tableNames().get(StoreCollections.JOBS));
    assertTrue(config.eventsEnabled());
    assertEquals(ZoneId.of("America/Chicago"), config.timeZone());
    assertEquals(40, config.maxPageSize());
    assertEquals(40, config.defaultPageSize());
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(IllegalStateException.class, () -> JobsConfig.fromMap(Map.of("JOBS_TIME_ZONE", "Mars/Olympus")));
    assertThrows(IllegalStateException.class, () -> JobsConfig.fromMap(Map.of("MAX_PAGE_SIZE", "lots")));
    assertThrows(IllegalStateException.class, () -> JobsConfig.fromMap(Map.of("DEFAULT_PAGE_SIZE", "0")));
  }
}
