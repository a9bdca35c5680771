package com.taskweave;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Hosts the execution engine and its collaborators (event bus, metrics, health)
 * in a Spring context for the agent layers that submit plans to it.
 */
@SpringBootApplication
public class TaskweaveApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskweaveApplication.class, args);
    }
}
