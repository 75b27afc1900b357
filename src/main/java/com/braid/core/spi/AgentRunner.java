package com.braid.core.spi;

import java.util.Optional;

/**
 * Capability that starts worker processes and reports which are still alive.
 * The engine consumes it; it does not supervise processes itself.
 */
public interface AgentRunner {

    /**
     * Checks spawn-depth limits for a child of the given session.
     */
    SpawnPermission canSpawn(String parentSessionId);

    SpawnResult spawn(AgentLaunch launch);

    /**
     * @return the running worker for the session, or empty if it is not alive
     */
    Optional<RunningAgent> getRunning(String sessionId);
}
