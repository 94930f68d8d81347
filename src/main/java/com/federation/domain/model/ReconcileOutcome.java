package com.federation.domain.model;

/**
 * Counts produced by one reconciliation pass.
 */
public record ReconcileOutcome(int imported, int evicted, int skipped, int failed) {

    public static final ReconcileOutcome NONE = new ReconcileOutcome(0, 0, 0, 0);

    public ReconcileOutcome plus(ReconcileOutcome other) {
        return new ReconcileOutcome(
            imported + other.imported,
            evicted + other.evicted,
            skipped + other.skipped,
            failed + other.failed);
    }

    public boolean changedAnything() {
        return imported > 0 || evicted > 0;
    }
}
