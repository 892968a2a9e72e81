package com.github.crucibleplatform.orchestrator.domain;

/**
 * @author crucible-platform
 */
public record SubmissionResult(String evaluationId, boolean accepted, int positionInQueue, String message) {

    public static SubmissionResult queued(final String evaluationId, final int positionInQueue) {
        return new SubmissionResult(evaluationId, true, positionInQueue, null);
    }

    public static SubmissionResult rejected(final String evaluationId, final String message) {
        return new SubmissionResult(evaluationId, false, -1, message);
    }

}
