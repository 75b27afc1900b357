package com.braid.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * How an agent process is presented to the user.
 */
public enum ExecutionMode {
    TERMINAL("terminal"),
    HEADLESS("headless"),
    EMBEDDED("embedded");

    private final String value;

    ExecutionMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ExecutionMode> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(m -> m.value.equalsIgnoreCase(value.trim()))
                .findFirst();
    }

    public static String supportedValues() {
        return String.join(", ", Arrays.stream(values()).map(ExecutionMode::value).sorted().toList());
    }
}
