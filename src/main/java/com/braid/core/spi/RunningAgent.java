package com.braid.core.spi;

import java.time.Instant;

/**
 * A worker the runner currently sees as alive.
 */
public record RunningAgent(String sessionId, String runId, Long pid, Instant startedAt) {
}
