package com.braid.core.model;

import java.io.Serializable;

/**
 * Directed dependency: {@code taskId} depends on {@code dependsOn}.
 */
public record TaskDependency(
    String taskId,
    String dependsOn,
    DependencyKind kind
) implements Serializable {
}
