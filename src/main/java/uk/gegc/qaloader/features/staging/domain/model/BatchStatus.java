package uk.gegc.qaloader.features.staging.domain.model;

public enum BatchStatus {
    PENDING,
    REVIEWING,
    COMPLETED,
    CANCELLED;

    /**
     * Open batches still accept reviews, duplicate checks, imports and cancellation.
     */
    public boolean isOpen() {
        return this == PENDING || this == REVIEWING;
    }
}
