package com.github.crucibleplatform.orchestrator.domain;

/**
 * @author crucible-platform
 */
public enum LogsAvailability {
    AVAILABLE,
    NOT_YET_AVAILABLE,
    NOT_FOUND
}
