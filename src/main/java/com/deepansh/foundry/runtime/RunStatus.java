package com.deepansh.foundry.runtime;

import java.util.Locale;

/**
 * Run lifecycle as seen by the orchestrator.
 * QUEUED and IN_PROGRESS are transient; COMPLETED and FAILED are terminal.
 */
public enum RunStatus {
    QUEUED,
    IN_PROGRESS,
    REQUIRES_ACTION,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Maps the agents API wire status onto the five states.
     * "cancelling" is still moving; cancelled / expired / incomplete are failures.
     */
    public static RunStatus fromWire(String wireStatus) {
        if (wireStatus == null) {
            return FAILED;
        }
        return switch (wireStatus.toLowerCase(Locale.ROOT)) {
            case "queued" -> QUEUED;
            case "in_progress", "cancelling" -> IN_PROGRESS;
            case "requires_action" -> REQUIRES_ACTION;
            case "completed" -> COMPLETED;
            default -> FAILED;
        };
    }
}
