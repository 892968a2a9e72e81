package com.github.crucibleplatform.orchestrator.service;

/**
 * The sandbox backend could not be reached or refused an operation for reasons outside the submitted code.
 *
 * @author crucible-platform
 */
public class SandboxProviderException extends OrchestrationServiceException {

    public SandboxProviderException(String message) {
        super(message);
    }

    public SandboxProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
