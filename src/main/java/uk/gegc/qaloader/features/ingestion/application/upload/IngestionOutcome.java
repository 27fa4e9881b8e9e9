package uk.gegc.qaloader.features.ingestion.application.upload;

import uk.gegc.qaloader.features.ingestion.api.dto.BatchUploadResult;
import uk.gegc.qaloader.features.ingestion.api.dto.ValidationResult;

/**
 * Validation report plus, for committed uploads, the per-record result.
 */
public record IngestionOutcome(ValidationResult validation, BatchUploadResult upload) {

    public static IngestionOutcome validated(ValidationResult validation) {
        return new IngestionOutcome(validation, null);
    }
}
