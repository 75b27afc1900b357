package com.braid.core.spi;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Whole variable document of one workflow session.
 *
 * @param sessionId owning session
 * @param version   version read from the store; 0 for a document never saved
 * @param variables variable values (JSON-compatible)
 */
public record SessionVariables(String sessionId, long version, Map<String, Object> variables) {

    public SessionVariables {
        variables = variables == null ? new LinkedHashMap<>() : new LinkedHashMap<>(variables);
    }

    public static SessionVariables empty(String sessionId) {
        return new SessionVariables(sessionId, 0L, Map.of());
    }
}
