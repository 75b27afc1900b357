package com.braid.core.model;

/**
 * Kind of edge between two tasks. Only {@link #BLOCKS} affects readiness.
 */
public enum DependencyKind {
    BLOCKS,
    RELATED
}
