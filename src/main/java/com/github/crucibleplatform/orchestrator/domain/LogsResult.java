package com.github.crucibleplatform.orchestrator.domain;

/**
 * @author crucible-platform
 */
public record LogsResult(String evaluationId, LogsAvailability availability, String content) {

    public static LogsResult available(final String evaluationId, final String content) {
        return new LogsResult(evaluationId, LogsAvailability.AVAILABLE, content);
    }

    public static LogsResult notYetAvailable(final String evaluationId) {
        return new LogsResult(evaluationId, LogsAvailability.NOT_YET_AVAILABLE, null);
    }

    public static LogsResult notFound(final String evaluationId) {
        return new LogsResult(evaluationId, LogsAvailability.NOT_FOUND, null);
    }

}
