package com.taskweave;

import com.taskweave.core.config.EngineProperties;
import com.taskweave.core.engine.ExecutionEngine;
import com.taskweave.core.model.ExecutionPlan;
import com.taskweave.core.model.ExecutionStatus;
import com.taskweave.core.model.Task;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "taskweave.engine.max-parallel=4")
class TaskweaveApplicationTests {

    @Autowired
    private ExecutionEngine engine;

    @Autowired
    private EngineProperties properties;

    @Test
    void contextLoads() {
        assertEquals(4, properties.getMaxParallel());
        assertEquals(Duration.ofSeconds(30), properties.getDefaultTaskTimeout());
        assertFalse(engine.isShutdown());
    }

    @Test
    void engineRunsPlanFromContext() {
        var plan = ExecutionPlan.builder("smoke")
                .task(Task.builder("hello").execute((input, ctx) -> "hello " + input).build())
                .build();

        var result = engine.execute(plan, "world");

        assertEquals(ExecutionStatus.COMPLETED, result.status());
        assertEquals("hello world", result.result("hello").orElseThrow().output());
    }
}
