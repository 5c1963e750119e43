package com.mapsheet.collection.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forEvent should set eventId, fileName, and operation in MDC")
    void forEventSetsMDC() {
        try (LogContext ctx = LogContext.forEvent("evt-1", "MAHROUS_plan_routes_20250831.kmz")) {
            assertEquals("evt-1", MDC.get("eventId"));
            assertEquals("MAHROUS_plan_routes_20250831.kmz", MDC.get("fileName"));
            assertEquals("event", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forBackfill should set workUnit, category, and operation in MDC")
    void forBackfillSetsMDC() {
        try (LogContext ctx = LogContext.forBackfill("Team_317", "PLANNED_ROUTES")) {
            assertEquals("Team_317", MDC.get("workUnit"));
            assertEquals("PLANNED_ROUTES", MDC.get("category"));
            assertEquals("backfill", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forPeriod should set periodDate and operation in MDC")
    void forPeriodSetsMDC() {
        try (LogContext ctx = LogContext.forPeriod("2025-08-30")) {
            assertEquals("2025-08-30", MDC.get("periodDate"));
            assertEquals("monitor", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forEvent("evt-2", "file.kmz");
        assertNotNull(MDC.get("eventId"));

        ctx.close();

        assertNull(MDC.get("eventId"));
        assertNull(MDC.get("fileName"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("with() should add extra keys that are also cleared on close")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forPeriod("2025-08-30").with("watchRoot", "/data/drop")) {
            assertEquals("/data/drop", MDC.get("watchRoot"));
        }
        assertNull(MDC.get("watchRoot"));
    }

    @Test
    @DisplayName("generateCorrelationId should return unique values")
    void correlationIdsAreUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
    }
}
