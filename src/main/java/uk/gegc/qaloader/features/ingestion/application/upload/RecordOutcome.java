package uk.gegc.qaloader.features.ingestion.application.upload;

import uk.gegc.qaloader.features.ingestion.api.dto.FailedUploadDto;
import uk.gegc.qaloader.features.ingestion.domain.model.ValidatedBlock;

/**
 * Result of inserting one block: the assigned id, or the classified failure.
 */
public record RecordOutcome(ValidatedBlock block, String questionId, FailedUploadDto failure) {

    public static RecordOutcome stored(ValidatedBlock block, String questionId) {
        return new RecordOutcome(block, questionId, null);
    }

    public static RecordOutcome failed(ValidatedBlock block, FailedUploadDto failure) {
        return new RecordOutcome(block, failure.questionId(), failure);
    }

    public boolean stored() {
        return failure == null;
    }
}
