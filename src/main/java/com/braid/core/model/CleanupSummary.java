package com.braid.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One entry of the cleanup history kept in the orchestration state.
 */
public record CleanupSummary(
    int mergedCount,
    int deletedCount,
    int failedCount,
    Instant timestamp
) implements Serializable {
}
