package com.github.crucibleplatform.orchestrator.event;

import com.github.crucibleplatform.orchestrator.domain.LifecycleEvent;
import com.github.crucibleplatform.orchestrator.domain.LifecycleEventType;

/**
 * @author crucible-platform
 */
public interface LifecycleEventBus {

    void publish(LifecycleEvent event);

    /**
     * Events of a single evaluation.
     */
    Subscription subscribeToEvaluation(String evaluationId, LifecycleEventListener listener);

    /**
     * Events of one type across all evaluations, i.e. the {@code evaluation:<type>} topic.
     */
    Subscription subscribeToType(LifecycleEventType eventType, LifecycleEventListener listener);

    /**
     * The global feed.
     */
    Subscription subscribeToAll(LifecycleEventListener listener);

}
