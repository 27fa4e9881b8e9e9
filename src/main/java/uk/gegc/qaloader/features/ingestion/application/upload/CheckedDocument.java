package uk.gegc.qaloader.features.ingestion.application.upload;

import uk.gegc.qaloader.features.ingestion.api.dto.ValidationResult;
import uk.gegc.qaloader.features.ingestion.domain.model.ValidatedBlock;

import java.util.List;

/**
 * A scanned and validated document waiting to be committed.
 */
public record CheckedDocument(ValidationResult validation, List<ValidatedBlock> validBlocks, long startedAtMillis) {

    public CheckedDocument {
        validBlocks = validBlocks == null ? List.of() : List.copyOf(validBlocks);
    }
}
