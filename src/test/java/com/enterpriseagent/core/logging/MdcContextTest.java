package com.enterpriseagent.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void roleIsScopedWithinRun() {
        MdcContext.setRole("RUN-1", "Planner");
        assertEquals("RUN-1", MDC.get("runId"));
        assertEquals("Planner", MDC.get("role"));

        MdcContext.clearRole();
        assertNull(MDC.get("role"));
        assertEquals("RUN-1", MDC.get("runId"));
    }

    @Test
    void clearRemovesEngineKeysOnly() {
        MDC.put("other", "keep");
        MdcContext.setAdapter("DSP-0001", "enterprise");

        MdcContext.clear();

        assertNull(MDC.get("runId"));
        assertNull(MDC.get("adapter"));
        assertEquals("keep", MDC.get("other"));
    }
}
