package com.github.crucibleplatform.orchestrator.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * @author crucible-platform
 */
public enum EvaluationStatus {
    QUEUED,
    PROVISIONING,
    RUNNING,
    COMPLETED,
    FAILED,
    TIMEOUT,
    CANCELLED;

    public boolean isQueued() {
        return this == QUEUED;
    }

    public boolean isFinal() {
        return this == COMPLETED || this == FAILED || this == TIMEOUT || this == CANCELLED;
    }

    /**
     * Successor states reachable in a single step. Terminal states have none.
     */
    public Set<EvaluationStatus> allowedTransitions() {
        return switch (this) {
            case QUEUED -> EnumSet.of(PROVISIONING, FAILED, CANCELLED);
            case PROVISIONING -> EnumSet.of(RUNNING, COMPLETED, FAILED, TIMEOUT, CANCELLED);
            case RUNNING -> EnumSet.of(COMPLETED, FAILED, TIMEOUT, CANCELLED);
            case COMPLETED, FAILED, TIMEOUT, CANCELLED -> EnumSet.noneOf(EvaluationStatus.class);
        };
    }

    public boolean canTransitionTo(final EvaluationStatus target) {
        return allowedTransitions().contains(target);
    }

}
