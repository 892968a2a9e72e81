package com.github.crucibleplatform.orchestrator.event;

import com.github.crucibleplatform.orchestrator.domain.LifecycleEvent;

/**
 * Consumer of lifecycle events. Delivery is at-least-once: an event may be handed over again if a previous
 * delivery threw, so implementations must tolerate duplicates.
 *
 * @author crucible-platform
 */
@FunctionalInterface
public interface LifecycleEventListener {

    void onEvent(LifecycleEvent event);

}
