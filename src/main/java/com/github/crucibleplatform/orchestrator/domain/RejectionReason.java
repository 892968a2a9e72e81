package com.github.crucibleplatform.orchestrator.domain;

/**
 * @author crucible-platform
 */
public enum RejectionReason {
    VALIDATION,
    CAPACITY_EXCEEDED,
    INFRASTRUCTURE,
    ALREADY_TERMINAL,
    DUPLICATE
}
