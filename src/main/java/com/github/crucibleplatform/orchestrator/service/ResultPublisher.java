package com.github.crucibleplatform.orchestrator.service;

import com.github.crucibleplatform.orchestrator.domain.EvaluationState;
import com.github.crucibleplatform.orchestrator.domain.LifecycleEvent;
import com.github.crucibleplatform.orchestrator.event.LifecycleEventBus;
import com.github.crucibleplatform.orchestrator.event.Subscription;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Persists the final state of every evaluation once, reading it from the state machine rather than from the
 * event that announced it.
 *
 * @author crucible-platform
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResultPublisher {

    private final LifecycleEventBus lifecycleEventBus;

    private final EvaluationStateMachine stateMachine;

    private final ResultStorage resultStorage;

    private Subscription subscription;

    @PostConstruct
    public void subscribe() {
        subscription = lifecycleEventBus.subscribeToAll(this::onEvent);
    }

    @PreDestroy
    public void unsubscribe() {
        if (subscription != null) {
            subscription.cancel();
        }
    }

    void onEvent(final LifecycleEvent event) {
        if (!event.eventType().isTerminal()) {
            return;
        }
        final String evaluationId = event.evaluationId();
        if (!stateMachine.claimResultPublication(evaluationId)) {
            log.debug("Result of evaluation {} already published, ignoring {}", evaluationId, event.topic());
            return;
        }

        try {
            final EvaluationState finalState = stateMachine.get(evaluationId)
                    .filter(state -> state.status().isFinal())
                    .orElseThrow(() -> new IllegalStateException("No final state for evaluation " + evaluationId));
            final String outputRef = outputReference(event);
            stateMachine.recordOutputReference(evaluationId, outputRef);
            resultStorage.persist(evaluationId, finalState, outputRef);
            log.info("Published result of evaluation {} with status {}", evaluationId, finalState.status());
        } catch (RuntimeException e) {
            // allow redelivery to try again
            stateMachine.releaseResultPublication(evaluationId);
            throw e;
        }
    }

    private String outputReference(final LifecycleEvent event) {
        final String unitReference = event.payload().get(LifecycleEvent.PAYLOAD_UNIT_REFERENCE);
        return unitReference == null ? null : unitReference + "/logs";
    }

}
