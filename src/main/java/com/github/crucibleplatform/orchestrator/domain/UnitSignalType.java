package com.github.crucibleplatform.orchestrator.domain;

/**
 * @author crucible-platform
 */
public enum UnitSignalType {
    /** Unit reported as running. */
    STARTED,
    /** Native completion channel reported success. */
    SUCCEEDED,
    /** Native completion channel reported failure. */
    FAILED,
    /** The platform killed the unit because its own deadline passed. */
    DEADLINE_EXCEEDED,
    /** Exit code channel reported the main container's exit code. */
    EXIT_CODE,
    /** The unit disappeared (deleted or terminated). */
    GONE,
    /** Observation of the unit was interrupted. */
    WATCH_LOST
}
