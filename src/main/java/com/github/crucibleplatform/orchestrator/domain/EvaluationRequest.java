package com.github.crucibleplatform.orchestrator.domain;

/**
 * Raw submission before defaults are applied. Every field but {@code code} is optional.
 *
 * @author crucible-platform
 */
public record EvaluationRequest(String evaluationId,
                                String code,
                                Integer priority,
                                String memoryLimit,
                                String cpuLimit,
                                Integer timeoutSeconds,
                                String riskLevel,
                                String executorImage) {
}
