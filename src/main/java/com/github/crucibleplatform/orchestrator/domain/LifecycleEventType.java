package com.github.crucibleplatform.orchestrator.domain;

import java.util.Locale;

/**
 * @author crucible-platform
 */
public enum LifecycleEventType {
    QUEUED,
    PROVISIONING,
    RUNNING,
    COMPLETED,
    FAILED,
    TIMEOUT,
    CANCELLED;

    public static final String TOPIC_PREFIX = "evaluation:";

    public String topic() {
        return TOPIC_PREFIX + name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return toStatus().isFinal();
    }

    public EvaluationStatus toStatus() {
        return EvaluationStatus.valueOf(name());
    }

    public static LifecycleEventType fromStatus(final EvaluationStatus status) {
        return LifecycleEventType.valueOf(status.name());
    }

}
