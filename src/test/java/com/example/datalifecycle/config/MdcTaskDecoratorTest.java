package com.example.datalifecycle.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class MdcTaskDecoratorTest {

    private final MdcTaskDecorator decorator = new MdcTaskDecorator();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("task sees the MDC captured when it was submitted")
    void copiesSubmittingContext() throws Exception {
        MDC.put("job", "finalize-deletions");
        MDC.put("runId", "run-1");
        AtomicReference<String> job = new AtomicReference<>();
        AtomicReference<String> runId = new AtomicReference<>();
        Runnable decorated = decorator.decorate(() -> {
            job.set(MDC.get("job"));
            runId.set(MDC.get("runId"));
        });
        MDC.clear();

        Thread worker = new Thread(decorated);
        worker.start();
        worker.join();

        assertEquals("finalize-deletions", job.get());
        assertEquals("run-1", runId.get());
    }

    @Test
    @DisplayName("pool thread MDC is cleared after the task")
    void clearsAfterRun() {
        MDC.put("runId", "run-2");
        Runnable decorated = decorator.decorate(() -> { });

        decorated.run();

        assertNull(MDC.get("runId"));
    }
}
