package com.github.crucibleplatform.orchestrator.service;

/**
 * The sandbox backend rejected a unit because a resource quota is exhausted. Treated like local capacity
 * exhaustion.
 *
 * @author crucible-platform
 */
public class SandboxQuotaExceededException extends SandboxProviderException {

    public SandboxQuotaExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
