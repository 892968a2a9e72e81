package com.github.crucibleplatform.orchestrator.domain;

import java.time.ZonedDateTime;

/**
 * Immutable submission of a single evaluation, as accepted at the API boundary.
 *
 * @author crucible-platform
 */
public record EvaluationTask(String evaluationId,
                             String code,
                             int priority,
                             ResourceRequirements resourceRequirements,
                             RiskLevel riskLevel,
                             String executorImage,
                             ZonedDateTime submittedAt) {
}
