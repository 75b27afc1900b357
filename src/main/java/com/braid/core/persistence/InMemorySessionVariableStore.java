package com.braid.core.persistence;

import com.braid.core.spi.SessionVariableStore;
import com.braid.core.spi.SessionVariables;
import com.braid.core.state.ConcurrentStateModificationException;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session variable documents kept in memory. Used when no {@code DataSource} is
 * configured; documents are lost on restart.
 */
public class InMemorySessionVariableStore implements SessionVariableStore {

    private final ConcurrentHashMap<String, SessionVariables> documents = new ConcurrentHashMap<>();

    @Override
    public Optional<SessionVariables> get(String sessionId) {
        return Optional.ofNullable(documents.get(sessionId))
                .map(doc -> new SessionVariables(doc.sessionId(), doc.version(), doc.variables()));
    }

    @Override
    public SessionVariables save(SessionVariables variables) {
        return documents.compute(variables.sessionId(), (id, stored) -> {
            long storedVersion = stored == null ? 0L : stored.version();
            if (storedVersion != variables.version()) {
                throw new ConcurrentStateModificationException(id, variables.version());
            }
            return new SessionVariables(id, storedVersion + 1, variables.variables());
        });
    }
}
