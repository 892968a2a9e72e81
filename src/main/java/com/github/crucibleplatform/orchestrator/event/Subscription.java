package com.github.crucibleplatform.orchestrator.event;

/**
 * @author crucible-platform
 */
@FunctionalInterface
public interface Subscription {

    void cancel();

}
