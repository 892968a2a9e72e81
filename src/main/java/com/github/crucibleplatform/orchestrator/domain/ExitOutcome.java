package com.github.crucibleplatform.orchestrator.domain;

/**
 * Terminal outcome of an evaluation. {@code exitCodeKnown == false} marks outcomes whose status came from the
 * platform's completion signal without a matching container exit code.
 *
 * @author crucible-platform
 */
public record ExitOutcome(ExitReason reason, Integer exitCode, boolean exitCodeKnown, String message) {

    public static final String REASON_INFRASTRUCTURE = "infrastructure";

    public static final String REASON_QUEUE_TIMEOUT = "queue timeout";

    public static ExitOutcome fromExitCode(final int exitCode) {
        return new ExitOutcome(exitCode == 0 ? ExitReason.SUCCESS : ExitReason.FAILURE, exitCode, true,
                "Process exited with code " + exitCode);
    }

    public static ExitOutcome exitCodeUnknown(final boolean succeeded, final String message) {
        return new ExitOutcome(succeeded ? ExitReason.SUCCESS : ExitReason.FAILURE, null, false, message);
    }

    public static ExitOutcome timeout(final int timeoutSeconds) {
        return new ExitOutcome(ExitReason.TIMEOUT, null, false,
                String.format("Execution exceeded %d seconds", timeoutSeconds));
    }

    public static ExitOutcome cancelled() {
        return new ExitOutcome(ExitReason.CANCELLED, null, false, "Cancelled by request");
    }

    public static ExitOutcome infrastructure(final String message) {
        return new ExitOutcome(ExitReason.INFRASTRUCTURE, null, false, REASON_INFRASTRUCTURE + ": " + message);
    }

    public static ExitOutcome queueTimeout(final long waitedSeconds) {
        return new ExitOutcome(ExitReason.QUEUE_TIMEOUT, null, false,
                String.format("%s after %d seconds", REASON_QUEUE_TIMEOUT, waitedSeconds));
    }

    public static ExitOutcome rejected(final String message) {
        return new ExitOutcome(ExitReason.REJECTED, null, false, message);
    }

    public EvaluationStatus terminalStatus() {
        return switch (reason) {
            case SUCCESS -> EvaluationStatus.COMPLETED;
            case TIMEOUT -> EvaluationStatus.TIMEOUT;
            case CANCELLED -> EvaluationStatus.CANCELLED;
            case FAILURE, INFRASTRUCTURE, QUEUE_TIMEOUT, REJECTED -> EvaluationStatus.FAILED;
        };
    }

}
