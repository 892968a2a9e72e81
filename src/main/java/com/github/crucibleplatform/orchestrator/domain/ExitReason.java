package com.github.crucibleplatform.orchestrator.domain;

/**
 * @author crucible-platform
 */
public enum ExitReason {
    SUCCESS,
    FAILURE,
    TIMEOUT,
    CANCELLED,
    INFRASTRUCTURE,
    QUEUE_TIMEOUT,
    REJECTED
}
