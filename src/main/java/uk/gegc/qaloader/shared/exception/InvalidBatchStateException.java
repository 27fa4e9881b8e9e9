package uk.gegc.qaloader.shared.exception;

import uk.gegc.qaloader.features.staging.domain.model.BatchStatus;

import java.util.UUID;

/**
 * Thrown when a staging batch is asked to do something its status no longer allows.
 */
public class InvalidBatchStateException extends RuntimeException {

    private final UUID batchId;
    private final BatchStatus currentStatus;

    public InvalidBatchStateException(UUID batchId, BatchStatus currentStatus, String action) {
        super(String.format("Cannot %s batch %s in status %s", action, batchId, currentStatus));
        this.batchId = batchId;
        this.currentStatus = currentStatus;
    }

    public UUID getBatchId() {
        return batchId;
    }

    public BatchStatus getCurrentStatus() {
        return currentStatus;
    }
}
