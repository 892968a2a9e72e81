package com.github.crucibleplatform.orchestrator.service;

/**
 * The submission can never run, independent of current load. Never retried.
 *
 * @author crucible-platform
 */
public class InvalidEvaluationException extends OrchestrationServiceException {

    public InvalidEvaluationException(String message) {
        super(message);
    }

    public InvalidEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
