package com.github.crucibleplatform.orchestrator.service;

/**
 * @author crucible-platform
 */
public class OrchestrationServiceException extends Exception {

    public OrchestrationServiceException(String message) {
        super(message);
    }

    public OrchestrationServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
