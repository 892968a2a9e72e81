package com.github.crucibleplatform.orchestrator.domain;

import java.time.ZonedDateTime;

/**
 * @author crucible-platform
 */
public record EvaluationState(String evaluationId,
                              EvaluationStatus status,
                              int priority,
                              RiskLevel riskLevel,
                              ResourceRequirements resourceRequirements,
                              ZonedDateTime createdAt,
                              ZonedDateTime startedAt,
                              ZonedDateTime completedAt,
                              ExitOutcome exitOutcome,
                              String unitReference,
                              String outputRef,
                              long version) {
}
