package com.github.crucibleplatform.orchestrator.domain;

/**
 * @author crucible-platform
 */
public record ClaimResult(ExecutionSlot slot) {

    private static final ClaimResult CAPACITY_EXCEEDED = new ClaimResult(null);

    public static ClaimResult claimed(final ExecutionSlot slot) {
        return new ClaimResult(slot);
    }

    public static ClaimResult capacityExceeded() {
        return CAPACITY_EXCEEDED;
    }

    public boolean isClaimed() {
        return slot != null;
    }

}
