package com.github.crucibleplatform.orchestrator.domain;

import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Claim on one unit of execution capacity. Moves from claimed to released exactly once.
 *
 * @author crucible-platform
 */
@Getter
public class ExecutionSlot {

    private final String evaluationId;

    private final ResourceRequirements resourceRequirements;

    private final Instant claimedAt;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean released = new AtomicBoolean(false);

    public ExecutionSlot(final String evaluationId, final ResourceRequirements resourceRequirements,
                         final Instant claimedAt) {
        this.evaluationId = evaluationId;
        this.resourceRequirements = resourceRequirements;
        this.claimedAt = claimedAt;
    }

    /**
     * @return true for the one caller that moved the slot to released
     */
    public boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public String toString() {
        return "ExecutionSlot[" + evaluationId + ", released=" + released.get() + "]";
    }

}
