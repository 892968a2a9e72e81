package com.github.crucibleplatform.orchestrator.domain;

/**
 * @author crucible-platform
 */
public enum TransitionResult {
    APPLIED,
    DUPLICATE,
    REJECTED_TERMINAL,
    REJECTED_INVALID,
    UNKNOWN_EVALUATION;

    public boolean isApplied() {
        return this == APPLIED;
    }

}
