package com.github.crucibleplatform.orchestrator.service;

import com.github.crucibleplatform.orchestrator.domain.UnitHandle;
import com.github.crucibleplatform.orchestrator.domain.UnitSpec;

import java.time.Duration;
import java.util.Optional;

/**
 * Backend that runs evaluation code in isolated execution units.
 * <p>
 * Signals are reported on two independent channels: the platform's native completion status
 * ({@code SUCCEEDED}/{@code FAILED}) and the main container's exit code ({@code EXIT_CODE}). Either may arrive
 * first, and either may be missing.
 *
 * @author crucible-platform
 */
public interface SandboxProvider {

    String getName();

    UnitHandle createUnit(UnitSpec unitSpec) throws SandboxProviderException;

    /**
     * Starts observing the unit. Returns immediately; signals are delivered asynchronously until the watch is
     * closed. A {@code WATCH_LOST} signal ends the watch.
     */
    UnitWatch watch(UnitHandle handle, UnitSignalListener listener) throws SandboxProviderException;

    /**
     * Asks the unit to stop, giving it the grace period to exit on its own.
     */
    void stop(UnitHandle handle, Duration gracePeriod) throws SandboxProviderException;

    /**
     * Removes the unit immediately.
     */
    void terminate(UnitHandle handle) throws SandboxProviderException;

    boolean exists(UnitHandle handle) throws SandboxProviderException;

    /**
     * @return the unit's output, or empty if no output can be read yet
     */
    Optional<String> fetchLogs(UnitHandle handle) throws SandboxProviderException;

}
