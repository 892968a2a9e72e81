package com.github.crucibleplatform.orchestrator.api;

/**
 * @author crucible-platform
 */
public class EvaluationNotFoundException extends RuntimeException {

    public EvaluationNotFoundException(String evaluationId) {
        super("Evaluation " + evaluationId + " not found");
    }

}
