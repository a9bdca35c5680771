package com.taskweave.core.model;

/**
 * Growth function for the delay between retry attempts.
 */
public enum BackoffKind {
    FIXED,
    LINEAR,
    EXPONENTIAL,
    JITTER
}
