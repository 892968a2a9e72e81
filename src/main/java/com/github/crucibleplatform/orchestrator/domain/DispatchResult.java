package com.github.crucibleplatform.orchestrator.domain;

/**
 * @author crucible-platform
 */
public record DispatchResult(boolean accepted,
                             String unitReference,
                             RejectionReason reason,
                             boolean retryable,
                             String message) {

    public static DispatchResult accepted(final String unitReference) {
        return new DispatchResult(true, unitReference, null, false, null);
    }

    public static DispatchResult rejected(final RejectionReason reason, final String message) {
        return new DispatchResult(false, null, reason, isRetryable(reason), message);
    }

    private static boolean isRetryable(final RejectionReason reason) {
        return reason == RejectionReason.CAPACITY_EXCEEDED || reason == RejectionReason.INFRASTRUCTURE;
    }

}
