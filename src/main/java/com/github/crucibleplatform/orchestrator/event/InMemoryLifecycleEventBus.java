package com.github.crucibleplatform.orchestrator.event;

import com.github.crucibleplatform.orchestrator.domain.LifecycleEvent;
import com.github.crucibleplatform.orchestrator.domain.LifecycleEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * @author crucible-platform
 */
@Component
@Slf4j
public class InMemoryLifecycleEventBus implements LifecycleEventBus {

    private final Executor deliveryExecutor;

    private final int maxDeliveryAttempts;

    private final Map<String, List<LifecycleEventListener>> evaluationListeners = new ConcurrentHashMap<>();

    private final Map<LifecycleEventType, List<LifecycleEventListener>> typeListeners =
            new EnumMap<>(LifecycleEventType.class);

    private final List<LifecycleEventListener> globalListeners = new CopyOnWriteArrayList<>();

    public InMemoryLifecycleEventBus(@Qualifier("eventDeliveryExecutor") final Executor deliveryExecutor,
                                     @Value("${CRUCIBLE_EVENT_MAX_DELIVERY_ATTEMPTS:3}") final int maxDeliveryAttempts) {
        this.deliveryExecutor = deliveryExecutor;
        this.maxDeliveryAttempts = Math.max(1, maxDeliveryAttempts);
        for (final LifecycleEventType eventType : LifecycleEventType.values()) {
            typeListeners.put(eventType, new CopyOnWriteArrayList<>());
        }
    }

    @Override
    public void publish(final LifecycleEvent event) {
        log.debug("Publishing {} for evaluation {} (sequence {})", event.topic(), event.evaluationId(),
                event.sequenceHint());

        final List<LifecycleEventListener> recipients = new ArrayList<>(globalListeners);
        recipients.addAll(typeListeners.get(event.eventType()));
        recipients.addAll(evaluationListeners.getOrDefault(event.evaluationId(), List.of()));

        for (final LifecycleEventListener listener : recipients) {
            dispatch(listener, event);
        }

        if (event.eventType().isTerminal()) {
            // no further events will follow for this evaluation
            evaluationListeners.remove(event.evaluationId());
        }
    }

    @Override
    public Subscription subscribeToEvaluation(final String evaluationId, final LifecycleEventListener listener) {
        evaluationListeners.compute(evaluationId, (id, listeners) -> {
            final List<LifecycleEventListener> current = listeners != null ? listeners : new CopyOnWriteArrayList<>();
            current.add(listener);
            return current;
        });
        return () -> evaluationListeners.computeIfPresent(evaluationId, (id, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    @Override
    public Subscription subscribeToType(final LifecycleEventType eventType, final LifecycleEventListener listener) {
        final List<LifecycleEventListener> listeners = typeListeners.get(eventType);
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @Override
    public Subscription subscribeToAll(final LifecycleEventListener listener) {
        globalListeners.add(listener);
        return () -> globalListeners.remove(listener);
    }

    public int getSubscribedEvaluationCount() {
        return evaluationListeners.size();
    }

    private void dispatch(final LifecycleEventListener listener, final LifecycleEvent event) {
        try {
            deliveryExecutor.execute(() -> deliver(listener, event));
        } catch (RejectedExecutionException e) {
            log.error("Could not schedule delivery of {} for evaluation {}", event.topic(), event.evaluationId(), e);
        }
    }

    private void deliver(final LifecycleEventListener listener, final LifecycleEvent event) {
        for (int attempt = 1; attempt <= maxDeliveryAttempts; attempt++) {
            try {
                listener.onEvent(event);
                return;
            } catch (RuntimeException e) {
                if (attempt == maxDeliveryAttempts) {
                    log.error("Giving up delivery of {} for evaluation {} after {} attempts", event.topic(),
                            event.evaluationId(), attempt, e);
                } else {
                    log.warn("Delivery of {} for evaluation {} failed on attempt {}, redelivering: {}",
                            event.topic(), event.evaluationId(), attempt, e.getMessage());
                }
            }
        }
    }

}
