package com.github.crucibleplatform.orchestrator.service;

import com.github.crucibleplatform.orchestrator.domain.Evaluation;
import com.github.crucibleplatform.orchestrator.domain.EvaluationState;
import com.github.crucibleplatform.orchestrator.domain.EvaluationStatus;
import com.github.crucibleplatform.orchestrator.domain.EvaluationTask;
import com.github.crucibleplatform.orchestrator.domain.ExitOutcome;
import com.github.crucibleplatform.orchestrator.domain.LifecycleEvent;
import com.github.crucibleplatform.orchestrator.domain.LifecycleEventType;
import com.github.crucibleplatform.orchestrator.domain.TransitionResult;
import com.github.crucibleplatform.orchestrator.event.LifecycleEventBus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sole owner of evaluation status. Transitions of one evaluation are serialized on its record; terminal states
 * are absorbing, so the first terminal transition wins and every later one is discarded.
 *
 * @author crucible-platform
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EvaluationStateMachine {

    private final LifecycleEventBus lifecycleEventBus;

    private final Map<String, Evaluation> evaluations = new ConcurrentHashMap<>();

    private final AtomicLong rejectedTerminalTransitions = new AtomicLong();

    private final AtomicLong rejectedInvalidTransitions = new AtomicLong();

    /**
     * Registers a new evaluation in {@link EvaluationStatus#QUEUED} and announces it.
     *
     * @return false if an evaluation with the same id is already known
     */
    public boolean register(final EvaluationTask task) {
        final Evaluation evaluation = new Evaluation(task, ZonedDateTime.now());
        if (evaluations.putIfAbsent(task.evaluationId(), evaluation) != null) {
            return false;
        }

        synchronized (evaluation) {
            final long sequence = evaluation.incrementVersion();
            lifecycleEventBus.publish(new LifecycleEvent(task.evaluationId(), LifecycleEventType.QUEUED,
                    evaluation.getCreatedAt(), sequence, Map.of()));
        }
        log.info("Evaluation {} registered with priority {}", task.evaluationId(), task.priority());
        return true;
    }

    public TransitionResult transition(final String evaluationId, final EvaluationStatus target) {
        return transition(evaluationId, target, null, null);
    }

    public TransitionResult transition(final String evaluationId, final EvaluationStatus target,
                                       final ExitOutcome exitOutcome) {
        return transition(evaluationId, target, exitOutcome, null);
    }

    public TransitionResult transition(final String evaluationId, final EvaluationStatus target,
                                       final ExitOutcome exitOutcome, final String unitReference) {
        final Evaluation evaluation = evaluations.get(evaluationId);
        if (evaluation == null) {
            log.warn("Transition to {} requested for unknown evaluation {}", target, evaluationId);
            return TransitionResult.UNKNOWN_EVALUATION;
        }

        synchronized (evaluation) {
            final EvaluationStatus current = evaluation.getStatus();
            if (current == target) {
                log.debug("Evaluation {} already in {}, ignoring duplicate transition", evaluationId, target);
                return TransitionResult.DUPLICATE;
            }
            if (current.isFinal()) {
                rejectedTerminalTransitions.incrementAndGet();
                log.warn("Discarding transition {} -> {} for evaluation {}: status is terminal", current, target,
                        evaluationId);
                return TransitionResult.REJECTED_TERMINAL;
            }
            if (!current.canTransitionTo(target)) {
                rejectedInvalidTransitions.incrementAndGet();
                log.warn("Invalid transition {} -> {} for evaluation {}", current, target, evaluationId);
                return TransitionResult.REJECTED_INVALID;
            }

            final ZonedDateTime now = ZonedDateTime.now();
            evaluation.setStatus(target);
            if (unitReference != null) {
                evaluation.setUnitReference(unitReference);
            }
            if (target == EvaluationStatus.RUNNING) {
                evaluation.setStartedAt(now);
            }
            if (target.isFinal()) {
                evaluation.setCompletedAt(now);
                evaluation.setExitOutcome(exitOutcome);
            }
            final long sequence = evaluation.incrementVersion();

            log.info("Evaluation {} transitioned {} -> {}", evaluationId, current, target);
            lifecycleEventBus.publish(new LifecycleEvent(evaluationId, LifecycleEventType.fromStatus(target), now,
                    sequence, buildPayload(evaluation, exitOutcome)));
            return TransitionResult.APPLIED;
        }
    }

    /**
     * Records where the persisted output of a finished evaluation lives.
     */
    public void recordOutputReference(final String evaluationId, final String outputRef) {
        final Evaluation evaluation = evaluations.get(evaluationId);
        if (evaluation == null) {
            return;
        }
        synchronized (evaluation) {
            evaluation.setOutputRef(outputRef);
        }
    }

    /**
     * Claims the publication of a terminal evaluation's result. Only the first caller gets {@code true} until the
     * claim is released again.
     */
    public boolean claimResultPublication(final String evaluationId) {
        final Evaluation evaluation = evaluations.get(evaluationId);
        if (evaluation == null) {
            return false;
        }
        synchronized (evaluation) {
            if (!evaluation.getStatus().isFinal() || evaluation.isResultPublished()) {
                return false;
            }
            evaluation.setResultPublished(true);
            return true;
        }
    }

    public void releaseResultPublication(final String evaluationId) {
        final Evaluation evaluation = evaluations.get(evaluationId);
        if (evaluation == null) {
            return;
        }
        synchronized (evaluation) {
            evaluation.setResultPublished(false);
        }
    }

    public Optional<EvaluationState> get(final String evaluationId) {
        return Optional.ofNullable(evaluations.get(evaluationId)).map(Evaluation::snapshot);
    }

    public Optional<EvaluationTask> getTask(final String evaluationId) {
        return Optional.ofNullable(evaluations.get(evaluationId)).map(Evaluation::getTask);
    }

    public Optional<EvaluationStatus> getStatus(final String evaluationId) {
        return get(evaluationId).map(EvaluationState::status);
    }

    public boolean isTerminal(final String evaluationId) {
        return getStatus(evaluationId).map(EvaluationStatus::isFinal).orElse(false);
    }

    public List<EvaluationState> findActive() {
        return evaluations.values().stream()
                .map(Evaluation::snapshot)
                .filter(state -> !state.status().isFinal())
                .toList();
    }

    public long getRejectedTerminalTransitions() {
        return rejectedTerminalTransitions.get();
    }

    public long getRejectedInvalidTransitions() {
        return rejectedInvalidTransitions.get();
    }

    private Map<String, String> buildPayload(final Evaluation evaluation, final ExitOutcome exitOutcome) {
        final Map<String, String> payload = new HashMap<>();
        if (evaluation.getUnitReference() != null) {
            payload.put(LifecycleEvent.PAYLOAD_UNIT_REFERENCE, evaluation.getUnitReference());
        }
        if (exitOutcome != null) {
            payload.put(LifecycleEvent.PAYLOAD_REASON, exitOutcome.reason().name());
            payload.put(LifecycleEvent.PAYLOAD_EXIT_CODE_KNOWN, String.valueOf(exitOutcome.exitCodeKnown()));
            if (exitOutcome.exitCode() != null) {
                payload.put(LifecycleEvent.PAYLOAD_EXIT_CODE, String.valueOf(exitOutcome.exitCode()));
            }
            if (exitOutcome.message() != null) {
                payload.put(LifecycleEvent.PAYLOAD_MESSAGE, exitOutcome.message());
            }
        }
        return payload;
    }

}
