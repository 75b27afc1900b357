package com.braid.core.spi;

/**
 * Outcome of launching an agent.
 *
 * @param success   whether the worker was started
 * @param sessionId the worker's session id
 * @param runId     the agent run id
 * @param pid       process id, if known
 * @param error     failure description when {@code success} is false
 */
public record SpawnResult(boolean success, String sessionId, String runId, Long pid, String error) {

    public static SpawnResult started(String sessionId, String runId, Long pid) {
        return new SpawnResult(true, sessionId, runId, pid, null);
    }

    public static SpawnResult failed(String error) {
        return new SpawnResult(false, null, null, null, error);
    }
}
