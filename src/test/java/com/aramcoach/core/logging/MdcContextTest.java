package com.aramcoach.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setRun puts runId and patch in MDC")
    void setRun() {
        MdcContext.setRun("PEV-2026-0001", "14.99");
        assertEquals("PEV-2026-0001", MDC.get("runId"));
        assertEquals("14.99", MDC.get("patch"));
    }

    @Test
    @DisplayName("setAttempt puts the attempt number in MDC")
    void setAttempt() {
        MdcContext.setAttempt(2);
        assertEquals("2", MDC.get("attempt"));
    }

    @Test
    @DisplayName("clear removes only the coach keys")
    void clear() {
        MDC.put("other", "kept");
        MdcContext.setRun("PEV-2026-0001", "14.99");
        MdcContext.setAttempt(1);

        MdcContext.clear();

        assertNull(MDC.get("runId"));
        assertNull(MDC.get("patch"));
        assertNull(MDC.get("attempt"));
        assertEquals("kept", MDC.get("other"));
        MDC.remove("other");
    }
}
