package com.braid.core.state;

/**
 * Raised when a session document was saved by someone else between read and write.
 */
public class ConcurrentStateModificationException extends StateStoreException {

    private final String sessionId;
    private final long expectedVersion;

    public ConcurrentStateModificationException(String sessionId, long expectedVersion) {
        super("Session state " + sessionId + " was modified concurrently (expected version "
                + expectedVersion + ")");
        this.sessionId = sessionId;
        this.expectedVersion = expectedVersion;
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
