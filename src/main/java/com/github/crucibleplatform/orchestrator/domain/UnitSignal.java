package com.github.crucibleplatform.orchestrator.domain;

/**
 * @author crucible-platform
 */
public record UnitSignal(UnitSignalType type, Integer exitCode, String message) {

    public static UnitSignal of(final UnitSignalType type) {
        return new UnitSignal(type, null, null);
    }

    public static UnitSignal of(final UnitSignalType type, final String message) {
        return new UnitSignal(type, null, message);
    }

    public static UnitSignal exitCode(final int exitCode) {
        return new UnitSignal(UnitSignalType.EXIT_CODE, exitCode, null);
    }

}
