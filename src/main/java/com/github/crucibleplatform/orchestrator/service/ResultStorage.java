package com.github.crucibleplatform.orchestrator.service;

import com.github.crucibleplatform.orchestrator.domain.EvaluationState;

/**
 * Write-only sink for final evaluation results.
 *
 * @author crucible-platform
 */
public interface ResultStorage {

    void persist(String evaluationId, EvaluationState finalState, String outputRef);

}
