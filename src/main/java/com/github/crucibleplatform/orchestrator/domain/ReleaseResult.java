package com.github.crucibleplatform.orchestrator.domain;

/**
 * @author crucible-platform
 */
public enum ReleaseResult {
    RELEASED,
    ALREADY_RELEASED
}
