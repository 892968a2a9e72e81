package com.github.crucibleplatform.orchestrator.domain;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.ZonedDateTime;

/**
 * Mutable lifecycle record of one evaluation. Mutated only by the state machine while holding the record's
 * monitor; everyone else reads {@link #snapshot()}.
 *
 * @author crucible-platform
 */
@Getter
@Setter(AccessLevel.PUBLIC)
public class Evaluation {

    private final EvaluationTask task;

    private final ZonedDateTime createdAt;

    private EvaluationStatus status;

    private ZonedDateTime startedAt;

    private ZonedDateTime completedAt;

    private ExitOutcome exitOutcome;

    private String unitReference;

    private String outputRef;

    private boolean resultPublished;

    private long version;

    public Evaluation(final EvaluationTask task, final ZonedDateTime createdAt) {
        this.task = task;
        this.createdAt = createdAt;
        this.status = EvaluationStatus.QUEUED;
    }

    public String getId() {
        return task.evaluationId();
    }

    public long incrementVersion() {
        return ++version;
    }

    public synchronized EvaluationState snapshot() {
        return new EvaluationState(task.evaluationId(), status, task.priority(), task.riskLevel(),
                task.resourceRequirements(), createdAt, startedAt, completedAt, exitOutcome, unitReference,
                outputRef, version);
    }

}
