package com.agentrunner.dto;

/**
 * Counts from one reconciliation pass. {@code storeAvailable} is false when the schedules could not
 * be read and the live jobs were left as they were.
 */
public record ReconcileResult(int added, int removed, int reloaded, int invalid, int live, boolean storeAvailable) {

    public static ReconcileResult storeUnavailable(int live) {
        return new ReconcileResult(0, 0, 0, 0, live, false);
    }

    public boolean hasChanges() {
        return added > 0 || removed > 0 || reloaded > 0;
    }
}
