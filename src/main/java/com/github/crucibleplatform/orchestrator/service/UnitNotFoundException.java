package com.github.crucibleplatform.orchestrator.service;

/**
 * @author crucible-platform
 */
public class UnitNotFoundException extends SandboxProviderException {

    public UnitNotFoundException(String message) {
        super(message);
    }

    public UnitNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
