package com.taskweave.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "taskweave.engine")
public class EngineProperties {

    /** Tasks of one run allowed to hold a worker at the same time. */
    private int maxParallel = 8;
    private Duration defaultTaskTimeout = Duration.ofSeconds(30);
    private Duration shutdownTimeout = Duration.ofSeconds(10);
    private String threadNamePrefix = "taskweave-";

    public int getMaxParallel() {
        return maxParallel;
    }

    public void setMaxParallel(int maxParallel) {
        this.maxParallel = maxParallel;
    }

    public Duration getDefaultTaskTimeout() {
        return defaultTaskTimeout;
    }

    public void setDefaultTaskTimeout(Duration defaultTaskTimeout) {
        this.defaultTaskTimeout = defaultTaskTimeout;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }
}
