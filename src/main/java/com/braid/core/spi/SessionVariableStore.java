package com.braid.core.spi;

import java.util.Optional;

/**
 * Durable per-session variable document hosted by the workflow engine.
 * Reads and writes are whole-document; there are no partial-field updates.
 */
public interface SessionVariableStore {

    Optional<SessionVariables> get(String sessionId);

    /**
     * Saves the document if its version still matches the stored one.
     *
     * @return the saved document carrying the new version
     * @throws com.braid.core.state.ConcurrentStateModificationException when the stored version moved on
     */
    SessionVariables save(SessionVariables variables);
}
