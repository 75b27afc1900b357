package com.braid.core.engine;

/**
 * Raised before any work is done when an orchestration call cannot proceed
 * (no agent runner, missing session, unsupported mode).
 */
public class OrchestrationConfigurationException extends RuntimeException {

    public OrchestrationConfigurationException(String message) {
        super(message);
    }
}
