package com.nodeflow.vgc.api;

import java.util.UUID;

/**
 * A structural problem found by graph validation. Reported, never thrown.
 *
 * @param nodeId Offending node, or null for graph-wide problems.
 */
public record ValidationError(Category category, String message, UUID nodeId) {

    public enum Category {
        DUPLICATE_PORT,
        MISSING_PARAMETER,
        DANGLING_CONNECTION,
        CIRCULAR_DEPENDENCY
    }

    public static ValidationError of(Category category, String message, UUID nodeId) {
        return new ValidationError(category, message, nodeId);
    }

    public static ValidationError of(Category category, String message) {
        return new ValidationError(category, message, null);
    }

    @Override
    public String toString() {
        return category + ": " + message;
    }
}
