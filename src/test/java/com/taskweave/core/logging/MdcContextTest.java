package com.taskweave.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setExecution puts executionId in MDC")
    void setExecution() {
        MdcContext.setExecution("run-1");
        assertEquals("run-1", MDC.get("executionId"));
    }

    @Test
    @DisplayName("setAttempt puts executionId, taskId and attempt in MDC")
    void setAttempt() {
        MdcContext.setAttempt("run-1", "fetch", 2);
        assertEquals("run-1", MDC.get("executionId"));
        assertEquals("fetch", MDC.get("taskId"));
        assertEquals("2", MDC.get("attempt"));
    }

    @Test
    @DisplayName("propagate carries the caller's MDC onto another thread")
    void propagateCarriesMdc() throws InterruptedException {
        MdcContext.setTask("run-1", "fetch");
        var seen = new AtomicReference<String>();

        Thread thread = new Thread(MdcContext.propagate(() -> seen.set(MDC.get("taskId"))));
        thread.start();
        thread.join();

        assertEquals("fetch", seen.get());
    }

    @Test
    @DisplayName("clear removes all taskweave MDC keys")
    void clear() {
        MdcContext.setAttempt("run-1", "fetch", 1);
        MdcContext.clear();
        assertNull(MDC.get("executionId"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("attempt"));
    }
}
